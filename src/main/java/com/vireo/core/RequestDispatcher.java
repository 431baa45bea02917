package com.vireo.core;

import com.vireo.controller.ControllerInvoker;
import com.vireo.http.Context;
import com.vireo.http.Request;
import com.vireo.http.Response;
import com.vireo.middleware.Middleware;
import com.vireo.middleware.MiddlewareRegistry;
import com.vireo.routing.Route;
import com.vireo.routing.RouteMatch;
import com.vireo.routing.RouteProvider;
import com.vireo.routing.Router;
import com.vireo.util.LogUtil;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one request through the application: global middleware, route lookup, route middleware,
 * the handler or controller action, and rendering of the handler's result.
 *
 * <p>Any exception on the way becomes a 500 response. Requests that expect JSON ({@code /api/}
 * paths, JSON bodies, {@code Accept: application/json} and XHR calls, see {@link
 * Request#expectsJson()}) get the JSON envelope, other requests an HTML page; debug mode adds the
 * exception details to both. Misses are answered the same way with a 404.
 */
public class RequestDispatcher {
  private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

  private static final int HTTP_NOT_FOUND = 404;
  private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

  private final Router router;
  private final MiddlewareRegistry middleware;
  private final List<Middleware> globalMiddleware;
  private final ControllerInvoker controllers;
  private final VireoConfig config;
  private final Map<String, Optional<String>> errorPages = new ConcurrentHashMap<>();
  private volatile boolean routesDiscovered;

  public RequestDispatcher(
      Router router,
      MiddlewareRegistry middleware,
      List<Middleware> globalMiddleware,
      ControllerInvoker controllers,
      VireoConfig config) {
    this.router = router;
    this.middleware = middleware;
    this.globalMiddleware = globalMiddleware;
    this.controllers = controllers;
    this.config = config;
    this.routesDiscovered = !config.isDiscoverRoutes();
  }

  /**
   * Dispatches a request. Never throws: failures are logged and answered with an error response.
   *
   * @param ctx the request context
   */
  public void dispatch(Context ctx) {
    Request request = ctx.request();
    Response response = ctx.response();
    try {
      discoverRoutes();

      for (Middleware mw : globalMiddleware) {
        if (!mw.handle(ctx) || response.isSent()) {
          return;
        }
      }

      RouteMatch match = router.find(request.getMethod(), request.getPath());
      if (match == null) {
        notFound(ctx);
        return;
      }
      ctx.setRoute(match);

      Route route = match.getRoute();
      for (String definition : route.getMiddleware()) {
        if (!middleware.execute(definition, ctx) || response.isSent()) {
          logger.debug("Middleware '{}' halted {} {}", definition, request.getMethod(), request.getPath());
          return;
        }
      }

      Object result =
          route.isControllerAction()
              ? controllers.invoke(route.getAction(), ctx)
              : route.getHandler().handle(ctx);
      render(ctx, result);
    } catch (Exception e) {
      serverError(ctx, e);
    }
  }

  /**
   * Loads every {@link RouteProvider} on the class path once, ordered by class name. Discovery is
   * attempted a single time: when a provider fails, the routes registered so far are kept and the
   * failure is reported to the caller of this first attempt only.
   *
   * @throws VireoException if a provider cannot be loaded
   */
  public void discoverRoutes() {
    if (routesDiscovered) {
      return;
    }
    synchronized (this) {
      if (routesDiscovered) {
        return;
      }
      try {
        for (RouteProvider provider : loadRouteProviders()) {
          provider.registerRoutes(router);
          logger.debug("Loaded routes from {}", provider.getClass().getName());
        }
      } finally {
        routesDiscovered = true;
      }
    }
  }

  private static List<RouteProvider> loadRouteProviders() {
    try {
      return ServiceLoader.load(RouteProvider.class, Thread.currentThread().getContextClassLoader())
          .stream()
          .map(ServiceLoader.Provider::get)
          .sorted(Comparator.comparing(provider -> provider.getClass().getName()))
          .collect(Collectors.toList());
    } catch (ServiceConfigurationError e) {
      logger.error(LogUtil.error("Cannot load route providers: " + e.getMessage()), e);
      throw new VireoException("Cannot load route providers: " + e.getMessage(), e);
    }
  }

  private void render(Context ctx, Object result) {
    Response response = ctx.response();
    if (result == null || result == ctx || result instanceof Response || response.isSent()) {
      return;
    }
    if (result instanceof CharSequence) {
      response.html(result.toString());
      return;
    }
    response.json(result);
  }

  private void notFound(Context ctx) {
    Request request = ctx.request();
    logger.debug(
        "No route for {} {} (methods on this path: {})",
        request.getMethod(),
        request.getPath(),
        router.allowedMethods(request.getPath()));

    if (request.expectsJson()) {
      ctx.response().error("Endpoint not found", HTTP_NOT_FOUND);
      return;
    }
    String page =
        errorPage("404")
            .orElseGet(
                () ->
                    builtinPage(
                        "404 Not Found",
                        "The page " + escapeHtml(request.getPath()) + " could not be found."));
    ctx.response().status(HTTP_NOT_FOUND).html(page);
  }

  private void serverError(Context ctx, Exception e) {
    Request request = ctx.request();
    Response response = ctx.response();
    logger.error(
        LogUtil.error(
            "Error processing " + request.getMethod() + " " + request.getPath() + ": " + e.getMessage()),
        e);

    if (response.isSent()) {
      logger.warn(LogUtil.warn("Cannot send error response, response already sent"));
      return;
    }

    if (request.expectsJson()) {
      if (config.isDebug()) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", e.getMessage() != null ? e.getMessage() : "Internal server error");
        body.put("data", debugDetails(e));
        response.envelope(body, HTTP_INTERNAL_SERVER_ERROR);
      } else {
        response.serverError("Internal server error");
      }
      return;
    }

    String page;
    if (config.isDebug()) {
      page =
          builtinPage(
              "500 " + escapeHtml(e.getClass().getName()),
              escapeHtml(String.valueOf(e.getMessage()))
                  + "</p><pre>"
                  + escapeHtml(stackTrace(e))
                  + "</pre><p>");
    } else {
      page =
          errorPage("500")
              .orElseGet(
                  () ->
                      builtinPage(
                          "500 Internal Server Error",
                          "Something went wrong while processing your request."));
    }
    response.status(HTTP_INTERNAL_SERVER_ERROR).html(page);
  }

  private static Map<String, Object> debugDetails(Exception e) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("exception", e.getClass().getName());
    details.put("message", e.getMessage());
    List<String> trace = new ArrayList<>();
    Arrays.stream(e.getStackTrace()).limit(20).forEach(frame -> trace.add(frame.toString()));
    details.put("trace", trace);
    return details;
  }

  private Optional<String> errorPage(String code) {
    return errorPages.computeIfAbsent(code, RequestDispatcher::loadErrorPage);
  }

  private static Optional<String> loadErrorPage(String code) {
    String resource = "error/" + code + ".html";
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream in = loader != null ? loader.getResourceAsStream(resource) : null) {
      if (in == null) {
        return Optional.empty();
      }
      return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read error page " + resource, e);
    }
  }

  private static String builtinPage(String title, String message) {
    return "<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>"
        + title
        + "</title></head><body><h1>"
        + title
        + "</h1><p>"
        + message
        + "</p></body></html>";
  }

  private static String stackTrace(Throwable t) {
    StringWriter out = new StringWriter();
    t.printStackTrace(new PrintWriter(out));
    return out.toString();
  }

  static String escapeHtml(String text) {
    StringBuilder escaped = new StringBuilder(text.length());
    for (char c : text.toCharArray()) {
      switch (c) {
        case '<':
          escaped.append("&lt;");
          break;
        case '>':
          escaped.append("&gt;");
          break;
        case '&':
          escaped.append("&amp;");
          break;
        case '"':
          escaped.append("&quot;");
          break;
        case '\'':
          escaped.append("&#39;");
          break;
        default:
          escaped.append(c);
      }
    }
    return escaped.toString();
  }
}
