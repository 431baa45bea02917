package com.vireo.http;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the request wrapper on a detached exchange. Body parsing needs a
 * live connection; JSON, form, multipart and untyped bodies are covered in
 * {@code VireoTest}.
 */
@DisplayName("Request Tests")
public class RequestTest {

    private HttpServerExchange exchange;
    private Request request;

    @BeforeEach
    void setUp() {
        exchange = new HttpServerExchange(null);
        exchange.setRequestMethod(Methods.GET);
        exchange.setRequestPath("/api/users");
        request = new Request(exchange);
    }

    @Test
    @DisplayName("GET data comes from the query string")
    void testGetDataFromQuery() {
        // Given: query parameters
        exchange.addQueryParam("page", "2");
        exchange.addQueryParam("sort", "name");
        exchange.addQueryParam("empty", "");

        // Then: they are the request data
        assertEquals("2", request.input("page"));
        assertEquals("fallback", request.input("missing", "fallback"));
        assertTrue(request.has("sort"));
        assertFalse(request.has("empty"));
        assertTrue(request.hasAll(List.of("page", "sort")));
        assertTrue(request.hasAny(List.of("nope", "page")));
        assertEquals(Map.of("page", "2"), request.only(List.of("page", "nope")));
        assertFalse(request.except(List.of("page")).containsKey("page"));
        assertThrows(UnsupportedOperationException.class, () -> request.all().put("x", "y"));
    }

    @Test
    @DisplayName("Methods without a body have no data")
    void testHeadHasNoData() {
        exchange.setRequestMethod(Methods.HEAD);
        exchange.addQueryParam("page", "2");

        assertTrue(request.all().isEmpty());
        assertFalse(request.hasFiles());
    }

    @Test
    @DisplayName("Headers are case-insensitive")
    void testHeaders() {
        exchange.getRequestHeaders().put(new HttpString("X-Custom"), "value");

        assertEquals("value", request.getHeader("x-custom"));
        assertNull(request.getHeader("X-Missing"));
    }

    @Test
    @DisplayName("Content type is lower-cased without parameters")
    void testContentType() {
        assertEquals("", request.getContentType());

        exchange.getRequestHeaders().put(Headers.CONTENT_TYPE, "Application/JSON; charset=UTF-8");

        assertEquals("application/json", request.getContentType());
        assertTrue(request.isJson());
    }

    @Test
    @DisplayName("API, AJAX and Accept headers make a request expect JSON")
    void testExpectsJson() {
        // /api/ prefix
        assertTrue(request.isApi());
        assertTrue(request.expectsJson());

        // a page request
        exchange.setRequestPath("/users");
        assertFalse(request.isApi());
        assertFalse(request.expectsJson());

        exchange.getRequestHeaders().put(Headers.ACCEPT, "application/json, text/plain");
        assertTrue(request.expectsJson());

        exchange.getRequestHeaders().remove(Headers.ACCEPT);
        exchange.getRequestHeaders().put(new HttpString("X-Requested-With"), "XMLHttpRequest");
        assertTrue(request.isAjax());
        assertTrue(request.expectsJson());
    }

    @Test
    @DisplayName("Bearer tokens are extracted from the Authorization header")
    void testBearerToken() {
        assertNull(request.bearerToken());

        exchange.getRequestHeaders().put(Headers.AUTHORIZATION, "Basic abc");
        assertNull(request.bearerToken());

        exchange.getRequestHeaders().put(Headers.AUTHORIZATION, "Bearer abc.def.ghi");
        assertEquals("abc.def.ghi", request.bearerToken());
    }

    @Test
    @DisplayName("Method checks ignore case")
    void testMethod() {
        exchange.setRequestMethod(Methods.POST);

        assertEquals("POST", request.getMethod());
        assertTrue(request.isMethod("post"));
        assertFalse(request.isSecure());
    }

    @Test
    @DisplayName("Attributes are stored per request")
    void testAttributes() {
        request.setAttribute("requestId", "abc");

        assertEquals("abc", request.getAttribute("requestId"));
        assertNull(new Request(exchange).getAttribute("requestId"));
    }
}
