package com.vireo.middleware;

import com.vireo.util.LogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Collection of common middleware implementations. The application registers
 * them as {@code cors}, {@code security-headers}, {@code request-logger} and
 * {@code json-only}.
 */
public class CommonMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(CommonMiddleware.class);

    public static final String DEFAULT_METHODS = "GET, POST, PUT, PATCH, DELETE, OPTIONS";
    public static final String DEFAULT_HEADERS = "Content-Type, Authorization, X-Requested-With";

    private CommonMiddleware() {
    }

    /**
     * Creates a CORS middleware. The allowed origin is the first parameter
     * ({@code "cors:https://example.com"}), {@code *} when none is given.
     * Preflight {@code OPTIONS} requests are answered with 204 and halt.
     *
     * @return the middleware
     */
    public static Middleware cors() {
        return (ctx, params) -> {
            String origin = params.length > 0 && !params[0].isEmpty() ? params[0] : "*";
            ctx.header("Access-Control-Allow-Origin", origin);
            ctx.header("Access-Control-Allow-Methods", DEFAULT_METHODS);
            ctx.header("Access-Control-Allow-Headers", DEFAULT_HEADERS);

            if (ctx.request().isMethod("OPTIONS")) {
                ctx.response().noContent();
                return false;
            }
            return true;
        };
    }

    /**
     * Creates a middleware that adds standard security headers.
     *
     * @return the middleware
     */
    public static Middleware securityHeaders() {
        return (ctx, params) -> {
            ctx.header("X-Content-Type-Options", "nosniff");
            ctx.header("X-Frame-Options", "DENY");
            ctx.header("X-XSS-Protection", "1; mode=block");
            ctx.header("Referrer-Policy", "no-referrer-when-downgrade");
            return true;
        };
    }

    /**
     * Creates a logging middleware that tags the request with a short id and
     * logs its completion time once the exchange ends.
     *
     * @return the middleware
     */
    public static Middleware requestLogger() {
        return (ctx, params) -> {
            long startTime = System.currentTimeMillis();
            String requestId = UUID.randomUUID().toString().substring(0, 8);
            ctx.request().setAttribute("requestId", requestId);
            ctx.request().setAttribute("startTime", startTime);

            logger.info(LogUtil.info("[" + requestId + "] " + LogUtil.requestLine(
                    ctx.request().getMethod(), ctx.request().getPath()) + " started"));

            ctx.exchange().addExchangeCompleteListener((exchange, nextListener) -> {
                try {
                    long duration = System.currentTimeMillis() - startTime;
                    logger.info("[{}] {} {} completed with status {} in {}ms",
                            requestId, ctx.request().getMethod(), ctx.request().getPath(),
                            exchange.getStatusCode(), duration);
                } finally {
                    nextListener.proceed();
                }
            });
            return true;
        };
    }

    /**
     * Rejects requests with a body that is not JSON with 415.
     *
     * @return the middleware
     */
    public static Middleware jsonOnly() {
        return (ctx, params) -> {
            String method = ctx.request().getMethod();
            boolean hasBody = "POST".equalsIgnoreCase(method) || "PUT".equalsIgnoreCase(method)
                    || "PATCH".equalsIgnoreCase(method);
            if (hasBody && !ctx.request().isJson()) {
                ctx.response().error("Content-Type must be application/json", 415);
                return false;
            }
            return true;
        };
    }
}
