package com.vireo.core;

import com.vireo.controller.fixtures.InMemoryUserRepository;
import com.vireo.controller.fixtures.UserRepository;
import com.vireo.http.Request;
import com.vireo.plugin.jwt.JwtPlugin;
import com.vireo.util.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests against a running server on a free port.
 */
@DisplayName("Vireo Core Framework Tests")
public class VireoTest {
    private static final int REQUEST_TIMEOUT_SECONDS = 10;
    private static final String SECRET = "integration-secret-key-of-32-bytes!!";

    private Vireo app;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        VireoConfig config = new VireoConfig()
                .setHost("127.0.0.1")
                .setPort(0)
                .setShowBanner(false)
                .addControllerPackage("com.vireo.controller.fixtures");
        app = new Vireo(config);
        app.bind(UserRepository.class, InMemoryUserRepository.class);

        httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        app.stop();
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + app.getPort() + path))
                .timeout(Duration.ofSeconds(REQUEST_TIMEOUT_SECONDS));
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return send(request(path).GET().build());
    }

    private HttpResponse<String> postJson(String path, String json) throws IOException, InterruptedException {
        return send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build());
    }

    private HttpResponse<String> post(String path, String contentType, String body)
            throws IOException, InterruptedException {
        return send(request(path)
                .header("Content-Type", contentType)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build());
    }

    private static Map<String, Object> json(HttpResponse<String> response) throws IOException {
        return JsonUtil.fromJsonMap(response.body());
    }

    @Test
    @DisplayName("Should bind a free port and call the start callback")
    void testListenOnFreePort() throws Exception {
        // Given: a route and a callback
        CountDownLatch started = new CountDownLatch(1);
        app.get("/ping", ctx -> "pong");

        // When: the server starts on port 0
        app.listen(started::countDown);

        // Then: a real port is bound and the route answers
        assertTrue(started.await(1, TimeUnit.SECONDS));
        assertTrue(app.getPort() > 0);
        HttpResponse<String> response = get("/ping");
        assertEquals(200, response.statusCode());
        assertEquals("pong", response.body());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/html"));
    }

    @Test
    @DisplayName("Should refuse to start twice")
    void testListenTwice() {
        app.listen();

        assertThrows(IllegalStateException.class, () -> app.listen());
    }

    @Test
    @DisplayName("Should pass typed route parameters and query values")
    void testRouteParameters() throws Exception {
        // Given: a numeric id route
        app.get("/users/{id:number}/posts", ctx -> Map.of("user", ctx.param("id"), "page", ctx.input("page", "1")));
        app.listen();

        // When/Then: digits match, letters do not
        Map<String, Object> body = json(get("/users/12/posts?page=3"));
        assertEquals("12", body.get("user"));
        assertEquals("3", body.get("page"));
        assertEquals(404, get("/users/abc/posts").statusCode());
    }

    @Test
    @DisplayName("Should merge JSON bodies with route parameters")
    void testJsonBody() throws Exception {
        app.post("/api/items/{id}", ctx -> ctx.params());
        app.listen();

        HttpResponse<String> response = postJson("/api/items/5", "{\"name\":\"lamp\",\"tags\":[\"a\",\"b\"]}");

        assertEquals(200, response.statusCode());
        Map<String, Object> body = json(response);
        assertEquals("5", body.get("id"));
        assertEquals("lamp", body.get("name"));
        assertEquals(List.of("a", "b"), body.get("tags"));
    }

    @Test
    @DisplayName("Should parse URL-encoded form bodies")
    void testFormBody() throws Exception {
        app.post("/greet", ctx -> "Hello " + ctx.input("name"));
        app.listen();

        HttpResponse<String> response = send(request("/greet")
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("name=Ann+Lee&x=1"))
                .build());

        assertEquals("Hello Ann Lee", response.body());
    }

    @Test
    @DisplayName("Should answer unknown API paths with a JSON envelope")
    void testApiNotFound() throws Exception {
        app.listen();

        HttpResponse<String> response = get("/api/nothing");

        assertEquals(404, response.statusCode());
        Map<String, Object> body = json(response);
        assertEquals("Client Error", body.get("status"));
        assertEquals("Endpoint not found", body.get("message"));
        assertNotNull(body.get("timestamp"));
        assertNotNull(body.get("server_time"));
        assertEquals("nosniff", response.headers().firstValue("X-Content-Type-Options").orElse(null));
        assertEquals("DENY", response.headers().firstValue("X-Frame-Options").orElse(null));
    }

    @Test
    @DisplayName("Should answer unknown pages with the 404 page")
    void testPageNotFound() throws Exception {
        app.listen();

        HttpResponse<String> response = get("/nothing");

        assertEquals(404, response.statusCode());
        assertTrue(response.body().contains("Custom 404"));
    }

    @Test
    @DisplayName("Should run controller actions with injected dependencies")
    void testControllerActions() throws Exception {
        // Given: controller routes
        app.get("/api/users", "UserController@index");
        app.get("/api/users/{id}", "UserController@show");
        app.post("/api/users", "UserController@store");
        app.match(List.of("GET", "POST"), "/hello/{name}", "UserController@greet");
        app.listen();

        // Then: each action is resolved and rendered
        assertEquals("[ \"alice\", \"bob\" ]", get("/api/users").body());
        assertEquals("User 3", json(get("/api/users/3")).get("name"));
        assertEquals(404, get("/api/users/missing").statusCode());
        assertEquals("<p>Hello ann via GET</p>", get("/hello/ann").body());

        HttpResponse<String> invalid = postJson("/api/users", "{\"name\":\"Ann\"}");
        assertEquals(422, invalid.statusCode());
        assertEquals("Validation failed", json(invalid).get("message"));

        HttpResponse<String> created = postJson("/api/users", "{\"name\":\"Ann\",\"email\":\"ann@example.com\"}");
        assertEquals(201, created.statusCode());
        assertEquals(Map.of("name", "Ann"), json(created).get("data"));
    }

    @Test
    @DisplayName("Should turn controller failures into a 500")
    void testControllerFailure() throws Exception {
        app.get("/api/fail", "UserController@fail");
        app.listen();

        HttpResponse<String> response = get("/api/fail");

        assertEquals(500, response.statusCode());
        assertEquals("Internal server error", json(response).get("message"));
    }

    @Test
    @DisplayName("Should run global and named middleware")
    void testMiddleware() throws Exception {
        // Given: a global header and a discovered tenant middleware
        app.use((ctx, params) -> {
            ctx.response().header("X-Served-By", "vireo");
            return true;
        });
        app.get("/tenant", ctx -> "tenant " + ctx.get("tenant")).middleware("require-tenant:acme");
        app.listen();

        // When/Then: the wrong tenant is halted, the right one passes
        HttpResponse<String> rejected = send(request("/tenant").header("X-Tenant", "other").GET().build());
        assertEquals(400, rejected.statusCode());
        assertEquals("vireo", rejected.headers().firstValue("X-Served-By").orElse(null));

        HttpResponse<String> accepted = send(request("/tenant").header("X-Tenant", "acme").GET().build());
        assertEquals(200, accepted.statusCode());
        assertEquals("tenant acme", accepted.body());
    }

    @Test
    @DisplayName("Should protect routes with JWT roles")
    void testJwtProtection() throws Exception {
        // Given: an admin-only route
        JwtPlugin jwt = new JwtPlugin(SECRET);
        app.register(jwt);
        app.get("/api/admin", ctx -> Map.of("ok", true)).middleware("jwt:admin");
        app.listen();
        assertTrue(jwt.isStarted());

        // Then: missing, wrong-role and admin tokens get 401, 403 and 200
        assertEquals(401, get("/api/admin").statusCode());

        String editor = jwt.generateToken("1", Map.of("role", "editor"));
        HttpResponse<String> forbidden = send(request("/api/admin")
                .header("Authorization", "Bearer " + editor).GET().build());
        assertEquals(403, forbidden.statusCode());
        assertEquals("Insufficient permissions", json(forbidden).get("message"));

        String admin = jwt.generateToken("2", Map.of("role", "admin"));
        HttpResponse<String> allowed = send(request("/api/admin")
                .header("Authorization", "Bearer " + admin).GET().build());
        assertEquals(200, allowed.statusCode());
        assertEquals(Boolean.TRUE, json(allowed).get("ok"));
    }

    @Test
    @DisplayName("Should load discovered route providers and generate named URLs")
    void testDiscoveryAndNamedRoutes() throws Exception {
        app.get("/posts/{slug}", ctx -> ctx.url("posts.show", Map.of("slug", "next")))
                .name("posts.show");
        app.get("/old", ctx -> ctx.redirectToRoute("posts.show", Map.of("slug", "moved")));
        app.listen();

        assertEquals("ok", json(get("/discovered/health")).get("status"));
        assertEquals("/posts/next", get("/posts/first").body());

        HttpResponse<String> redirect = get("/old");
        assertEquals(302, redirect.statusCode());
        assertEquals("/posts/moved", redirect.headers().firstValue("Location").orElse(null));
    }

    @Test
    @DisplayName("Should answer CORS preflight requests")
    void testCors() throws Exception {
        app.options("/api/things", ctx -> null).middleware("cors");
        app.listen();

        HttpResponse<String> response = send(request("/api/things")
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build());

        assertEquals(204, response.statusCode());
        assertEquals("*",
                response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }

    @Test
    @DisplayName("Should decode form fields as UTF-8")
    void testFormBodyUtf8() throws Exception {
        app.post("/api/echo", ctx -> ctx.params());
        app.listen();

        // When: the same non-ASCII field is sent as a form and as an untyped body
        Map<String, Object> form = json(post("/api/echo", "application/x-www-form-urlencoded", "name=J%C3%BCrgen"));
        Map<String, Object> untyped = json(post("/api/echo", "text/plain", "name=J%C3%BCrgen"));

        // Then: both decode to the same text
        assertEquals("J\u00fcrgen", form.get("name"));
        assertEquals("J\u00fcrgen", untyped.get("name"));
    }

    @Test
    @DisplayName("Should expose multipart fields and uploaded files for the whole request")
    void testMultipartUpload() throws Exception {
        // Given: a handler that does some work before reading the upload
        app.post("/api/upload", ctx -> {
            Thread.sleep(200);
            Request.UploadedFile doc = ctx.request().file("doc");
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("title", ctx.input("title"));
            out.put("filename", doc.getFilename());
            out.put("type", doc.getContentType());
            out.put("size", doc.getSize());
            out.put("content", new String(doc.getBytes(), StandardCharsets.UTF_8));
            out.put("hasFiles", ctx.request().hasFiles());
            out.put("files", List.copyOf(ctx.request().files().keySet()));
            out.put("fields", List.copyOf(ctx.request().all().keySet()));
            return out;
        });
        app.listen();

        String boundary = "----vireo-boundary";
        String body = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"title\"\r\n\r\n"
                + "Report\r\n"
                + "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"doc\"; filename=\"a.txt\"\r\n"
                + "Content-Type: text/plain\r\n\r\n"
                + "FILE-CONTENT\r\n"
                + "--" + boundary + "--\r\n";

        // When: the multipart body is posted
        HttpResponse<String> response = post("/api/upload", "multipart/form-data; boundary=" + boundary, body);

        // Then: the field is data, the file is still readable
        assertEquals(200, response.statusCode());
        Map<String, Object> result = json(response);
        assertEquals("Report", result.get("title"));
        assertEquals("a.txt", result.get("filename"));
        assertEquals("text/plain", result.get("type"));
        assertEquals(12, result.get("size"));
        assertEquals("FILE-CONTENT", result.get("content"));
        assertEquals(Boolean.TRUE, result.get("hasFiles"));
        assertEquals(List.of("doc"), result.get("files"));
        assertEquals(List.of("title"), result.get("fields"));
    }

    @Test
    @DisplayName("Should treat invalid JSON bodies as empty data")
    void testInvalidJsonBody() throws Exception {
        app.post("/api/echo", ctx -> Map.of("count", ctx.params().size()));
        app.listen();

        HttpResponse<String> response = postJson("/api/echo", "{\"name\": ");

        assertEquals(200, response.statusCode());
        assertEquals(0, json(response).get("count"));
    }

    @Test
    @DisplayName("Should index top-level JSON arrays by position")
    void testJsonArrayBody() throws Exception {
        app.post("/api/echo", ctx -> ctx.params());
        app.listen();

        Map<String, Object> body = json(postJson("/api/echo", "[\"x\", {\"y\": 1}]"));

        assertEquals("x", body.get("0"));
        assertEquals(Map.of("y", 1), body.get("1"));
    }

    @Test
    @DisplayName("Should sniff bodies with an unknown content type")
    void testUnknownContentType() throws Exception {
        app.post("/api/echo", ctx -> ctx.params());
        app.listen();

        // JSON-looking text is read as JSON, anything else as form data
        Map<String, Object> asJson = json(post("/api/echo", "text/plain", "{\"a\": 1, \"b\": [true]}"));
        assertEquals(1, asJson.get("a"));
        assertEquals(List.of(true), asJson.get("b"));

        Map<String, Object> asForm = json(post("/api/echo", "text/plain", "a=1&b=two+words"));
        assertEquals("1", asForm.get("a"));
        assertEquals("two words", asForm.get("b"));
    }

    @Test
    @DisplayName("Should answer JSON clients with JSON errors outside /api")
    void testJsonClientNotFound() throws Exception {
        app.listen();

        HttpResponse<String> response = send(request("/nothing").header("Accept", "application/json").GET().build());

        assertEquals(404, response.statusCode());
        assertEquals("Endpoint not found", json(response).get("message"));
    }
}
