package com.vireo.plugin;

import com.vireo.core.Vireo;

/**
 * Interface for plugins that can be registered with a Vireo application.
 * A plugin typically contributes named middleware, container bindings or
 * routes.
 */
public interface Plugin {

    /**
     * Registers the plugin with the application. Called from
     * {@link Vireo#register(Plugin)}.
     *
     * @param app the application
     */
    void register(Vireo app);

    String getName();

    String getVersion();

    /**
     * Called right before the server starts listening.
     *
     * @param app the application
     */
    default void onStart(Vireo app) {
    }

    /**
     * Called while the server is stopping.
     *
     * @param app the application
     */
    default void onStop(Vireo app) {
    }
}
