package com.vireo.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Application settings with fluent setters.
 *
 * <p>{@link #load()} reads {@code vireo.properties} from the class path and
 * then applies {@code vireo.*} system properties on top, so
 * {@code -Dvireo.port=9000} overrides the file. Keys in the file carry no
 * prefix ({@code port=9000}).
 */
public class VireoConfig {
    private static final Logger logger = LoggerFactory.getLogger(VireoConfig.class);

    public static final String RESOURCE = "vireo.properties";
    public static final String SYSTEM_PREFIX = "vireo.";

    private String host = "0.0.0.0";
    private int port = 8080;
    private boolean debug = false;
    private String appUrl = "";
    private List<String> controllerPackages = new ArrayList<>();
    private String jwtSecret;
    private long jwtExpirationMs = 3600000; // 1 hour
    private boolean discoverRoutes = true;
    private boolean discoverMiddleware = true;
    private int workerThreads = 0;
    private boolean showBanner = true;

    /**
     * Loads {@code vireo.properties} from the class path, if present, and applies
     * {@code vireo.*} system properties.
     *
     * @return the configuration
     */
    public static VireoConfig load() {
        Properties merged = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader != null ? loader.getResourceAsStream(RESOURCE) : null) {
            if (in != null) {
                merged.load(in);
                logger.debug("Loaded {} from the class path", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }

        Properties system = System.getProperties();
        for (String key : system.stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PREFIX)) {
                merged.setProperty(key.substring(SYSTEM_PREFIX.length()), system.getProperty(key));
            }
        }
        return fromProperties(merged);
    }

    /**
     * Builds a configuration from unprefixed keys.
     *
     * @param properties the settings
     * @return the configuration
     * @throws IllegalArgumentException if a numeric setting is not a number
     */
    public static VireoConfig fromProperties(Properties properties) {
        VireoConfig config = new VireoConfig();
        config.setHost(properties.getProperty("host", config.host));
        config.setPort(intValue(properties, "port", config.port));
        config.setDebug(Boolean.parseBoolean(properties.getProperty("debug", String.valueOf(config.debug))));
        config.setAppUrl(properties.getProperty("app.url", config.appUrl));
        config.setControllerPackages(splitList(properties.getProperty("controllers.packages", "")));
        config.setJwtSecret(properties.getProperty("jwt.secret"));
        config.setJwtExpirationMs(longValue(properties, "jwt.expiration-ms", config.jwtExpirationMs));
        config.setDiscoverRoutes(Boolean.parseBoolean(
                properties.getProperty("routes.discover", String.valueOf(config.discoverRoutes))));
        config.setDiscoverMiddleware(Boolean.parseBoolean(
                properties.getProperty("middleware.discover", String.valueOf(config.discoverMiddleware))));
        config.setWorkerThreads(intValue(properties, "worker-threads", config.workerThreads));
        config.setShowBanner(Boolean.parseBoolean(
                properties.getProperty("banner", String.valueOf(config.showBanner))));
        return config;
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be an integer: " + value, e);
        }
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be an integer: " + value, e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    public String getHost() {
        return host;
    }

    public VireoConfig setHost(String host) {
        this.host = host;
        return this;
    }

    public int getPort() {
        return port;
    }

    public VireoConfig setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        this.port = port;
        return this;
    }

    public boolean isDebug() {
        return debug;
    }

    public VireoConfig setDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    public String getAppUrl() {
        return appUrl;
    }

    public VireoConfig setAppUrl(String appUrl) {
        this.appUrl = appUrl == null ? "" : appUrl;
        return this;
    }

    public List<String> getControllerPackages() {
        return Collections.unmodifiableList(controllerPackages);
    }

    public VireoConfig setControllerPackages(List<String> controllerPackages) {
        this.controllerPackages = new ArrayList<>(controllerPackages);
        return this;
    }

    public VireoConfig addControllerPackage(String controllerPackage) {
        this.controllerPackages.add(controllerPackage);
        return this;
    }

    public String getJwtSecret() {
        return jwtSecret;
    }

    public VireoConfig setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
        return this;
    }

    public long getJwtExpirationMs() {
        return jwtExpirationMs;
    }

    public VireoConfig setJwtExpirationMs(long jwtExpirationMs) {
        this.jwtExpirationMs = jwtExpirationMs;
        return this;
    }

    public boolean isDiscoverRoutes() {
        return discoverRoutes;
    }

    public VireoConfig setDiscoverRoutes(boolean discoverRoutes) {
        this.discoverRoutes = discoverRoutes;
        return this;
    }

    public boolean isDiscoverMiddleware() {
        return discoverMiddleware;
    }

    public VireoConfig setDiscoverMiddleware(boolean discoverMiddleware) {
        this.discoverMiddleware = discoverMiddleware;
        return this;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * @param workerThreads Undertow worker threads; 0 keeps Undertow's default
     * @return this configuration for method chaining
     */
    public VireoConfig setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
        return this;
    }

    public boolean isShowBanner() {
        return showBanner;
    }

    public VireoConfig setShowBanner(boolean showBanner) {
        this.showBanner = showBanner;
        return this;
    }
}
