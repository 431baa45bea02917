package com.vireo.http;

import com.vireo.util.JsonUtil;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.form.FormData;
import io.undertow.server.handlers.form.FormDataParser;
import io.undertow.server.handlers.form.FormParserFactory;
import io.undertow.util.HeaderMap;
import io.undertow.util.HeaderValues;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Wrapper for HTTP request data that provides a convenient API.
 *
 * <p>Request data is parsed lazily on first access: query parameters for
 * {@code GET}, the body for {@code POST}, {@code PUT}, {@code PATCH} and
 * {@code DELETE}, chosen by content type. JSON objects become maps, form
 * encodings go through Undertow's form parser and uploaded files are kept
 * apart from the plain fields.
 */
public class Request {
    private static final Logger logger = LoggerFactory.getLogger(Request.class);

    private static final FormParserFactory FORM_PARSER_FACTORY = FormParserFactory.builder()
            .withDefaultCharset(StandardCharsets.UTF_8.name())
            .build();
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final HttpServerExchange exchange;
    private final Map<String, Object> attributes = new HashMap<>();
    private String body;
    private Map<String, Object> data;
    private Map<String, UploadedFile> files = Collections.emptyMap();

    /**
     * Creates a new Request instance wrapped around an HttpServerExchange.
     *
     * @param exchange the underlying exchange
     */
    public Request(HttpServerExchange exchange) {
        this.exchange = exchange;
    }

    /**
     * Gets the HTTP method of the request.
     *
     * @return the HTTP method (e.g., GET, POST)
     */
    public String getMethod() {
        return exchange.getRequestMethod().toString();
    }

    public boolean isMethod(String method) {
        return getMethod().equalsIgnoreCase(method);
    }

    /**
     * Gets the path of the request, without the query string.
     *
     * @return the request path
     */
    public String getPath() {
        return exchange.getRequestPath();
    }

    public String getQueryString() {
        return exchange.getQueryString();
    }

    /**
     * Rebuilds the full URL the client asked for.
     *
     * @return scheme, host, path and query string
     */
    public String getUrl() {
        String query = exchange.getQueryString();
        return exchange.getRequestScheme() + "://" + exchange.getHostAndPort() + exchange.getRequestURI()
                + (query == null || query.isEmpty() ? "" : "?" + query);
    }

    /**
     * Gets a query parameter by name.
     *
     * @param name the parameter name
     * @return the parameter value or null if not present
     */
    public String getQueryParam(String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values != null && !values.isEmpty() ? values.getFirst() : null;
    }

    /**
     * Gets all query parameters, first value of each.
     *
     * @return a map of parameter names to values
     */
    public Map<String, String> getQueryParams() {
        Map<String, String> result = new LinkedHashMap<>();
        exchange.getQueryParameters().forEach((key, values) -> {
            if (!values.isEmpty()) {
                result.put(key, values.getFirst());
            }
        });
        return result;
    }

    /**
     * Gets a header by name, case-insensitively.
     *
     * @param name the header name
     * @return the header value or null if not present
     */
    public String getHeader(String name) {
        HeaderValues values = exchange.getRequestHeaders().get(name);
        return values != null ? values.getFirst() : null;
    }

    public HeaderMap getHeaders() {
        return exchange.getRequestHeaders();
    }

    /**
     * Gets the media type of the body, lower-cased and without parameters.
     *
     * @return the content type, or an empty string
     */
    public String getContentType() {
        String header = getHeader(Headers.CONTENT_TYPE_STRING);
        if (header == null) {
            return "";
        }
        int semicolon = header.indexOf(';');
        return (semicolon >= 0 ? header.substring(0, semicolon) : header).trim().toLowerCase(Locale.ROOT);
    }

    public boolean isJson() {
        return "application/json".equals(getContentType());
    }

    /**
     * @return true if the path is under {@code /api/}
     */
    public boolean isApi() {
        return getPath().startsWith("/api/");
    }

    public boolean isAjax() {
        return "xmlhttprequest".equalsIgnoreCase(getHeader("X-Requested-With"));
    }

    /**
     * Decides whether errors and results should be rendered as JSON.
     *
     * @return true for JSON bodies, API paths, JSON accept headers and XHR calls
     */
    public boolean expectsJson() {
        if (isJson() || isApi() || isAjax()) {
            return true;
        }
        String accept = getHeader(Headers.ACCEPT_STRING);
        return accept != null && accept.contains("application/json");
    }

    public boolean isSecure() {
        return "https".equalsIgnoreCase(exchange.getRequestScheme());
    }

    public String getIp() {
        InetSocketAddress address = exchange.getSourceAddress();
        if (address == null || address.getAddress() == null) {
            return "127.0.0.1";
        }
        return address.getAddress().getHostAddress();
    }

    public String getUserAgent() {
        String agent = getHeader(Headers.USER_AGENT_STRING);
        return agent != null ? agent : "";
    }

    /**
     * Extracts the token of an {@code Authorization: Bearer ...} header.
     *
     * @return the token or null
     */
    public String bearerToken() {
        String header = getHeader(Headers.AUTHORIZATION_STRING);
        if (header != null && header.startsWith("Bearer ")) {
            return header.substring(7);
        }
        return null;
    }

    /**
     * Gets the raw request body. Not available once a form body has been
     * consumed by the form parser.
     *
     * @return the body, empty if there is none
     * @throws IOException if an I/O error occurs
     */
    public String getBody() throws IOException {
        if (body == null) {
            if (!exchange.isBlocking()) {
                exchange.startBlocking();
            }
            try (InputStream in = exchange.getInputStream()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return body;
    }

    /**
     * Gets all request data.
     *
     * @return an unmodifiable view of the parsed data
     */
    public Map<String, Object> all() {
        return Collections.unmodifiableMap(data());
    }

    public Object input(String key) {
        return data().get(key);
    }

    public Object input(String key, Object defaultValue) {
        Object value = data().get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @param key the field name
     * @return true if the field is present and not an empty string
     */
    public boolean has(String key) {
        Object value = data().get(key);
        return value != null && !"".equals(value);
    }

    public boolean hasAll(Collection<String> keys) {
        return keys.stream().allMatch(this::has);
    }

    public boolean hasAny(Collection<String> keys) {
        return keys.stream().anyMatch(this::has);
    }

    public Map<String, Object> only(List<String> keys) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            if (data().containsKey(key)) {
                result.put(key, data().get(key));
            }
        }
        return result;
    }

    public Map<String, Object> except(List<String> keys) {
        Map<String, Object> result = new LinkedHashMap<>(data());
        keys.forEach(result::remove);
        return result;
    }

    public UploadedFile file(String name) {
        data();
        return files.get(name);
    }

    public Map<String, UploadedFile> files() {
        data();
        return Collections.unmodifiableMap(files);
    }

    public boolean hasFiles() {
        data();
        return !files.isEmpty();
    }

    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    public HttpServerExchange getExchange() {
        return exchange;
    }

    private Map<String, Object> data() {
        if (data == null) {
            data = new LinkedHashMap<>();
            try {
                parseData();
            } catch (IOException e) {
                logger.warn("Failed to read request body for {} {}: {}", getMethod(), getPath(), e.getMessage());
            }
        }
        return data;
    }

    private void parseData() throws IOException {
        String method = getMethod().toUpperCase(Locale.ROOT);
        if ("GET".equals(method)) {
            data.putAll(getQueryParams());
            return;
        }
        if (!BODY_METHODS.contains(method)) {
            return;
        }

        switch (getContentType()) {
            case "application/json":
                parseJson(getBody());
                break;
            case "application/x-www-form-urlencoded":
            case "multipart/form-data":
                parseForm();
                break;
            default:
                String raw = getBody();
                if (JsonUtil.looksLikeJson(raw)) {
                    parseJson(raw);
                } else {
                    parseUrlEncoded(raw);
                }
                break;
        }
    }

    private void parseJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            Object decoded = JsonUtil.getMapper().readValue(raw, Object.class);
            if (decoded instanceof Map) {
                ((Map<?, ?>) decoded).forEach((key, value) -> data.put(String.valueOf(key), value));
            } else if (decoded instanceof List) {
                List<?> list = (List<?>) decoded;
                for (int i = 0; i < list.size(); i++) {
                    data.put(String.valueOf(i), list.get(i));
                }
            } else {
                logger.warn("Ignoring JSON body that is neither an object nor an array");
            }
        } catch (IOException e) {
            logger.warn("JSON parsing error: {}", e.getMessage());
        }
    }

    private void parseUrlEncoded(String raw) {
        if (raw == null || raw.isBlank()) {
            return;
        }
        for (String pair : raw.trim().split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            try {
                data.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping malformed form field '{}': {}", key, e.getMessage());
            }
        }
    }

    private void parseForm() throws IOException {
        if (!exchange.isBlocking()) {
            exchange.startBlocking();
        }
        // Not closed here: Undertow closes the parser, and deletes the upload
        // temp files, once the exchange completes.
        FormDataParser parser = FORM_PARSER_FACTORY.createParser(exchange);
        if (parser == null) {
            return;
        }
        FormData formData = parser.parseBlocking();
        Map<String, UploadedFile> uploaded = new LinkedHashMap<>();
        for (String name : formData) {
            FormData.FormValue value = formData.getFirst(name);
            if (value == null) {
                continue;
            }
            if (value.isFileItem()) {
                uploaded.put(name, new UploadedFile(name, value.getFileName(),
                        value.getHeaders() != null ? value.getHeaders().getFirst(Headers.CONTENT_TYPE) : null,
                        value.getFileItem()));
            } else {
                data.put(name, value.getValue());
            }
        }
        files = uploaded;
    }

    /**
     * A file received in a {@code multipart/form-data} body.
     */
    public static class UploadedFile {
        private final String fieldName;
        private final String filename;
        private final String contentType;
        private final FormData.FileItem item;

        public UploadedFile(String fieldName, String filename, String contentType, FormData.FileItem item) {
            this.fieldName = fieldName;
            this.filename = filename;
            this.contentType = contentType;
            this.item = item;
        }

        public String getFieldName() {
            return fieldName;
        }

        public String getFilename() {
            return filename;
        }

        public String getContentType() {
            return contentType;
        }

        public long getSize() throws IOException {
            return item.getFileSize();
        }

        public InputStream getInputStream() throws IOException {
            return item.getInputStream();
        }

        public byte[] getBytes() throws IOException {
            try (InputStream in = item.getInputStream()) {
                return in.readAllBytes();
            }
        }
    }
}
