package com.vireo.core;

import com.vireo.container.Container;
import com.vireo.container.Factory;
import com.vireo.controller.ControllerInvoker;
import com.vireo.http.Context;
import com.vireo.http.Request;
import com.vireo.http.Response;
import com.vireo.middleware.CommonMiddleware;
import com.vireo.middleware.Middleware;
import com.vireo.middleware.MiddlewareRegistry;
import com.vireo.plugin.Plugin;
import com.vireo.plugin.jwt.JwtPlugin;
import com.vireo.routing.Route;
import com.vireo.routing.RouteProvider;
import com.vireo.routing.Router;
import com.vireo.util.Banner;
import com.vireo.util.ConsoleColors;
import com.vireo.util.LogUtil;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main application class for the Vireo framework. Provides a fluent API for registering
 * routes, middleware, container bindings and plugins, and serves them on an embedded Undertow
 * server.
 *
 * <p>Every request is moved off the IO thread onto an Undertow worker and handled in blocking
 * mode with its own {@link Request}, {@link Response} and {@link Context}. Registration is meant
 * to happen before {@link #listen()}.
 */
public class Vireo {
  private static final Logger logger = LoggerFactory.getLogger(Vireo.class);

  private final VireoConfig config;
  private final Router router;
  private final Container container;
  private final MiddlewareRegistry middlewareRegistry;
  private final List<Middleware> globalMiddleware = new CopyOnWriteArrayList<>();
  private final List<Plugin> plugins = new ArrayList<>();
  private volatile RequestDispatcher dispatcher;
  private Undertow server;

  /** Creates an application configured from {@code vireo.properties} and system properties. */
  public Vireo() {
    this(VireoConfig.load());
  }

  /**
   * Creates an application with the given configuration.
   *
   * @param config the configuration
   */
  public Vireo(VireoConfig config) {
    this.config = config;
    this.router = new Router();
    this.router.setBaseUrl(config.getAppUrl());
    this.container = new Container();
    this.container.instance(VireoConfig.class, config);
    this.container.instance(Router.class, router);
    this.middlewareRegistry = new MiddlewareRegistry(container);

    middlewareRegistry.register("cors", CommonMiddleware.cors());
    middlewareRegistry.register("security-headers", CommonMiddleware.securityHeaders());
    middlewareRegistry.register("request-logger", CommonMiddleware.requestLogger());
    middlewareRegistry.register("json-only", CommonMiddleware.jsonOnly());
    if (config.isDiscoverMiddleware()) {
      middlewareRegistry.discover();
    }

    if (config.getJwtSecret() != null && !config.getJwtSecret().isEmpty()) {
      register(
          new JwtPlugin(
              config.getJwtSecret(),
              new JwtPlugin.JwtConfig().setExpirationMs(config.getJwtExpirationMs())));
    }
  }

  /**
   * Sets the host for the server.
   *
   * @param host the host to bind to
   * @return this instance for method chaining
   */
  public Vireo host(String host) {
    config.setHost(host);
    return this;
  }

  /**
   * Sets the port for the server. Port 0 picks a free port, see {@link #getPort()}.
   *
   * @param port the port to listen on
   * @return this instance for method chaining
   */
  public Vireo port(int port) {
    config.setPort(port);
    return this;
  }

  /**
   * Turns on exception details in error responses.
   *
   * @param debug whether to expose exception details
   * @return this instance for method chaining
   */
  public Vireo debug(boolean debug) {
    config.setDebug(debug);
    return this;
  }

  /**
   * Adds a global middleware. Global middleware runs before route lookup, in registration order,
   * and is called without parameters.
   *
   * @param middleware the middleware to add
   * @return this instance for method chaining
   */
  public Vireo use(Middleware middleware) {
    this.globalMiddleware.add(middleware);
    return this;
  }

  /**
   * Registers a named route middleware.
   *
   * @param name the name routes refer to
   * @param middleware the middleware
   * @return this instance for method chaining
   */
  public Vireo middleware(String name, Middleware middleware) {
    middlewareRegistry.register(name, middleware);
    return this;
  }

  /**
   * Registers a middleware class under the name derived from its class name; it is instantiated
   * through the container on every use.
   *
   * @param type the middleware class
   * @return this instance for method chaining
   */
  public Vireo middleware(Class<? extends Middleware> type) {
    middlewareRegistry.register(type);
    return this;
  }

  public <T> Vireo bind(Class<T> type, Class<? extends T> concrete) {
    container.bind(type, concrete);
    return this;
  }

  public <T> Vireo factory(Class<T> type, Factory<? extends T> factory) {
    container.factory(type, factory);
    return this;
  }

  public <T> Vireo singleton(Class<T> type, Class<? extends T> concrete) {
    container.singleton(type, concrete);
    return this;
  }

  public <T> Vireo instance(Class<T> type, T instance) {
    container.instance(type, instance);
    return this;
  }

  /**
   * Registers a custom route parameter type, usable as {@code {name:type}}.
   *
   * @param name the type name
   * @param regex the regex fragment
   * @return this instance for method chaining
   */
  public Vireo pattern(String name, String regex) {
    router.addPattern(name, regex);
    return this;
  }

  public Route get(String path, Handler handler) {
    return router.get(path, handler);
  }

  public Route get(String path, String action) {
    return router.get(path, action);
  }

  public Route post(String path, Handler handler) {
    return router.post(path, handler);
  }

  public Route post(String path, String action) {
    return router.post(path, action);
  }

  public Route put(String path, Handler handler) {
    return router.put(path, handler);
  }

  public Route put(String path, String action) {
    return router.put(path, action);
  }

  public Route patch(String path, Handler handler) {
    return router.patch(path, handler);
  }

  public Route patch(String path, String action) {
    return router.patch(path, action);
  }

  public Route delete(String path, Handler handler) {
    return router.delete(path, handler);
  }

  public Route delete(String path, String action) {
    return router.delete(path, action);
  }

  public Route options(String path, Handler handler) {
    return router.options(path, handler);
  }

  public List<Route> match(List<String> methods, String path, Handler handler) {
    return router.match(methods, path, handler);
  }

  public List<Route> match(List<String> methods, String path, String action) {
    return router.match(methods, path, action);
  }

  /**
   * Lets a route module register its routes right away.
   *
   * @param provider the route module
   * @return this instance for method chaining
   */
  public Vireo routes(RouteProvider provider) {
    provider.registerRoutes(router);
    return this;
  }

  /**
   * Registers a plugin with the application.
   *
   * @param plugin the plugin to register
   * @return this instance for method chaining
   */
  public Vireo register(Plugin plugin) {
    logger.info(
        LogUtil.info(
            "Registering plugin: "
                + ConsoleColors.CYAN_BOLD
                + plugin.getName()
                + ConsoleColors.RESET
                + " v"
                + plugin.getVersion()));
    plugin.register(this);
    plugins.add(plugin);
    return this;
  }

  /**
   * Gets the dispatcher, creating it on first use from the current configuration.
   *
   * @return the request dispatcher
   */
  public RequestDispatcher dispatcher() {
    RequestDispatcher current = dispatcher;
    if (current == null) {
      synchronized (this) {
        current = dispatcher;
        if (current == null) {
          ControllerInvoker controllers =
              new ControllerInvoker(container, config.getControllerPackages());
          current =
              new RequestDispatcher(router, middlewareRegistry, globalMiddleware, controllers, config);
          dispatcher = current;
        }
      }
    }
    return current;
  }

  /** Starts the server and begins listening for requests. */
  public void listen() {
    listen(
        () -> {
          if (config.isShowBanner()) {
            Banner.display(config.getHost(), getPort(), router.getRoutes().size());
          }
        });
  }

  /**
   * Starts the server with a callback function.
   *
   * @param callback the function to call when the server has started
   */
  public synchronized void listen(Runnable callback) {
    if (server != null) {
      throw new IllegalStateException("Server is already running");
    }

    for (Plugin plugin : plugins) {
      logger.info(
          LogUtil.info(
              "Starting plugin: "
                  + ConsoleColors.CYAN_BOLD
                  + plugin.getName()
                  + ConsoleColors.RESET));
      plugin.onStart(this);
    }

    RequestDispatcher requestDispatcher = dispatcher();
    requestDispatcher.discoverRoutes();

    Undertow.Builder builder =
        Undertow.builder()
            .addHttpListener(config.getPort(), config.getHost())
            .setHandler(new VireoHttpHandler(requestDispatcher));
    if (config.getWorkerThreads() > 0) {
      builder.setWorkerThreads(config.getWorkerThreads());
    }
    server = builder.build();
    server.start();

    logger.info(
        LogUtil.info(
            ConsoleColors.GREEN_BOLD
                + "Vireo server started on "
                + config.getHost()
                + ":"
                + getPort()
                + ConsoleColors.RESET
                + (config.isDebug() ? ConsoleColors.YELLOW_BOLD + " [debug]" + ConsoleColors.RESET : "")));

    if (callback != null) {
      callback.run();
    }
  }

  /** Stops the server. */
  public synchronized void stop() {
    if (server != null) {
      for (Plugin plugin : plugins) {
        logger.info(
            LogUtil.info(
                "Stopping plugin: "
                    + ConsoleColors.CYAN_BOLD
                    + plugin.getName()
                    + ConsoleColors.RESET));
        plugin.onStop(this);
      }

      server.stop();
      server = null;

      logger.info(
          LogUtil.info(ConsoleColors.YELLOW_BOLD + "Vireo server stopped" + ConsoleColors.RESET));
    }
  }

  /**
   * Gets the port the server listens on; once started with port 0 this is the port actually
   * bound.
   *
   * @return the port
   */
  public int getPort() {
    if (server != null && !server.getListenerInfo().isEmpty()) {
      Object address = server.getListenerInfo().get(0).getAddress();
      if (address instanceof InetSocketAddress) {
        return ((InetSocketAddress) address).getPort();
      }
    }
    return config.getPort();
  }

  public Router router() {
    return router;
  }

  public Container container() {
    return container;
  }

  public MiddlewareRegistry middlewareRegistry() {
    return middlewareRegistry;
  }

  public VireoConfig config() {
    return config;
  }

  public List<Plugin> getPlugins() {
    return new ArrayList<>(plugins);
  }

  /** Undertow entry point: moves the exchange to a worker and hands it to the dispatcher. */
  private final class VireoHttpHandler implements HttpHandler {
    private final RequestDispatcher requestDispatcher;

    VireoHttpHandler(RequestDispatcher requestDispatcher) {
      this.requestDispatcher = requestDispatcher;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
      if (exchange.isInIoThread()) {
        exchange.dispatch(this);
        return;
      }

      if (!exchange.isBlocking()) {
        exchange.startBlocking();
      }
      Context context = new Context(new Request(exchange), new Response(exchange), router);
      requestDispatcher.dispatch(context);

      if (!exchange.isComplete()) {
        exchange.endExchange();
      }
    }
  }

  /** A route handler. The return value is rendered by the dispatcher. */
  @FunctionalInterface
  public interface Handler {
    /**
     * Handles a request.
     *
     * @param ctx the request context
     * @return a {@code String} to send as HTML, any other object to send as JSON, or {@code null}
     *     (or the context itself) when the handler wrote the response
     * @throws Exception if the request cannot be handled
     */
    Object handle(Context ctx) throws Exception;
  }
}
