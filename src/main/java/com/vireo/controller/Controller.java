package com.vireo.controller;

import com.vireo.http.Context;
import com.vireo.http.Request;
import com.vireo.http.Response;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Optional base class for controllers with shortcuts over the current
 * request and response. A controller instance serves a single request.
 */
public abstract class Controller {
    private Context ctx;

    void bind(Context ctx) {
        this.ctx = ctx;
    }

    protected Context context() {
        if (ctx == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " is not bound to a request");
        }
        return ctx;
    }

    protected Request request() {
        return context().request();
    }

    protected Response response() {
        return context().response();
    }

    protected Object input(String key) {
        return context().input(key);
    }

    protected Object input(String key, Object defaultValue) {
        return context().input(key, defaultValue);
    }

    protected boolean has(String key) {
        Object value = context().input(key);
        return value != null && !"".equals(value);
    }

    protected Map<String, Object> all() {
        return context().params();
    }

    protected Map<String, Object> only(String... keys) {
        return request().only(Arrays.asList(keys));
    }

    protected Map<String, Object> except(String... keys) {
        return request().except(Arrays.asList(keys));
    }

    /**
     * Lists the fields that are absent or empty.
     *
     * @param fields the required fields
     * @return the missing field names, in argument order
     */
    protected List<String> missing(String... fields) {
        List<String> missing = new ArrayList<>();
        for (String field : fields) {
            if (!has(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    protected Response json(Object data) {
        return response().json(data);
    }

    protected Response json(Object data, int status) {
        return response().status(status).json(data);
    }

    protected Response success(String message, Object data) {
        return response().success(message, data, 200);
    }

    protected Response error(String message, int status) {
        return response().error(message, status);
    }

    protected Response validationError(Object errors) {
        return response().validationError(errors);
    }

    protected Response created(Object data) {
        return response().created(data, "Resource created successfully");
    }

    protected Response notFound(String message) {
        return response().notFound(message);
    }

    protected Response unauthorized(String message) {
        return response().unauthorized(message);
    }

    protected Response forbidden(String message) {
        return response().forbidden(message);
    }

    protected Response redirect(String url) {
        return response().redirect(url);
    }

    protected Response redirectToRoute(String name, Map<String, ?> params) {
        return response().redirect(context().url(name, params));
    }

    /**
     * Redirects to the page named by the {@code Referer} header, or to
     * {@code /} when there is none.
     *
     * @return the response
     */
    protected Response redirectBack() {
        String referer = request().getHeader("Referer");
        return response().redirect(referer != null && !referer.isEmpty() ? referer : "/");
    }
}
