package com.vireo.plugin;

import com.vireo.core.Vireo;
import com.vireo.util.LogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for plugins. A plugin instance belongs to one application and
 * tracks whether its server is running. Subclasses implement
 * {@link #configure(Vireo)}.
 */
public abstract class AbstractPlugin implements Plugin {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final String name;
    private final String version;
    private volatile Vireo app;
    private volatile boolean started;

    protected AbstractPlugin(String name, String version) {
        this.name = name;
        this.version = version;
    }

    @Override
    public final void register(Vireo app) {
        if (this.app != null && this.app != app) {
            throw new IllegalStateException("Plugin " + name + " is already registered with another application");
        }
        this.app = app;
        configure(app);
    }

    /**
     * Adds the plugin's middleware, bindings and routes to the application.
     *
     * @param app the application
     */
    protected abstract void configure(Vireo app);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public void onStart(Vireo app) {
        started = true;
        logger.debug(LogUtil.debug("Plugin " + name + " v" + version + " started"));
    }

    @Override
    public void onStop(Vireo app) {
        started = false;
        logger.debug(LogUtil.debug("Plugin " + name + " v" + version + " stopped"));
    }

    public boolean isStarted() {
        return started;
    }
}
