package com.vireo.plugin.jwt;

import com.vireo.core.Vireo;
import com.vireo.core.VireoConfig;
import com.vireo.http.Context;
import com.vireo.http.Request;
import com.vireo.http.Response;
import com.vireo.middleware.Middleware;
import com.vireo.routing.Router;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for token handling and the jwt route middleware.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JwtPlugin Tests")
public class JwtPluginTest {
    private static final String SECRET = "test-secret-key-with-at-least-32-bytes!";

    @Mock
    private Request request;

    @Mock
    private Response response;

    private JwtPlugin plugin;
    private Middleware middleware;
    private Context ctx;

    @BeforeEach
    void setUp() {
        plugin = new JwtPlugin(SECRET);
        middleware = plugin.protect();
        ctx = new Context(request, response, new Router());
    }

    private void bearer(String token) {
        when(request.getHeader("Authorization")).thenReturn("Bearer " + token);
    }

    @Test
    @DisplayName("Short secrets are rejected")
    void testShortSecret() {
        assertThrows(IllegalArgumentException.class, () -> new JwtPlugin("too-short"));
        assertThrows(IllegalArgumentException.class, () -> new JwtPlugin(null));
    }

    @Test
    @DisplayName("Generated tokens validate and carry their claims")
    void testGenerateAndValidate() {
        // When: a token is generated with a role claim
        String token = plugin.generateToken("42", Map.of("role", "admin"));

        // Then: validation returns the subject and claims
        Claims claims = plugin.validateToken(token);
        assertEquals("42", claims.getSubject());
        assertEquals("admin", claims.get("role"));
        assertNotNull(claims.getExpiration());
        assertEquals("42", plugin.extractSubject(token));
    }

    @Test
    @DisplayName("Tokens signed with another key are rejected")
    void testForeignToken() {
        String foreign = new JwtPlugin("another-secret-key-that-is-long-enough!!").generateToken("1");

        assertThrows(JwtException.class, () -> plugin.validateToken(foreign));
    }

    @Test
    @DisplayName("Missing token is answered with 401")
    void testMissingToken() throws Exception {
        // Given: no Authorization header
        when(request.getHeader("Authorization")).thenReturn(null);

        // When: the middleware runs
        boolean proceed = middleware.handle(ctx);

        // Then: the request is halted
        assertFalse(proceed);
        verify(response).unauthorized("Missing authentication token");
    }

    @Test
    @DisplayName("Other auth schemes count as a missing token")
    void testWrongScheme() throws Exception {
        when(request.getHeader("Authorization")).thenReturn("Basic dXNlcjpwYXNz");

        assertFalse(middleware.handle(ctx));
        verify(response).unauthorized("Missing authentication token");
    }

    @Test
    @DisplayName("Malformed token is answered with 401")
    void testMalformedToken() throws Exception {
        bearer("not-a-jwt");

        assertFalse(middleware.handle(ctx));
        verify(response).unauthorized("Malformed token");
    }

    @Test
    @DisplayName("Bad signature is answered with 401")
    void testBadSignature() throws Exception {
        bearer(new JwtPlugin("another-secret-key-that-is-long-enough!!").generateToken("1"));

        assertFalse(middleware.handle(ctx));
        verify(response).unauthorized("Invalid token signature");
    }

    @Test
    @DisplayName("Expired token is answered with 401")
    void testExpiredToken() throws Exception {
        // Given: a token that has already expired
        JwtPlugin shortLived = new JwtPlugin(SECRET, new JwtPlugin.JwtConfig().setExpirationMs(1));
        String token = shortLived.generateToken("1");
        Thread.sleep(1100);
        bearer(token);

        // When: the middleware runs
        boolean proceed = middleware.handle(ctx);

        // Then: the expiry is reported
        assertFalse(proceed);
        verify(response).unauthorized("Token expired");
    }

    @Test
    @DisplayName("Valid token stores its claims on the context")
    void testValidToken() throws Exception {
        bearer(plugin.generateToken("7"));

        assertTrue(middleware.handle(ctx));
        Claims claims = ctx.get("user");
        assertEquals("7", claims.getSubject());
        verify(response, never()).unauthorized(anyString());
    }

    @Test
    @DisplayName("Role parameters require a matching role claim")
    void testRoles() throws Exception {
        // Given: an editor token
        bearer(plugin.generateToken("7", Map.of("role", "editor")));

        // Then: admin-only is forbidden, admin or editor passes
        assertFalse(middleware.handle(ctx, "admin"));
        verify(response).forbidden("Insufficient permissions");
        assertTrue(middleware.handle(ctx, "admin", "editor"));
    }

    @Test
    @DisplayName("A roles list is accepted as well")
    void testRolesList() throws Exception {
        bearer(plugin.generateToken("7", Map.of("roles", List.of("viewer", "admin"))));

        assertTrue(middleware.handle(ctx, "admin"));
    }

    @Test
    @DisplayName("Tokens without role claims fail role checks")
    void testNoRoleClaim() throws Exception {
        bearer(plugin.generateToken("7"));

        assertFalse(middleware.handle(ctx, "admin"));
        verify(response).forbidden("No role specified in token");
    }

    @Test
    @DisplayName("Tokens can be read from the query string")
    void testQueryLookup() throws Exception {
        // Given: a plugin reading ?token=
        JwtPlugin queryPlugin = new JwtPlugin(SECRET,
                new JwtPlugin.JwtConfig().setTokenLookup("query:token").setContextKey("auth"));
        when(request.getQueryParam("token")).thenReturn(queryPlugin.generateToken("9"));

        // When: the middleware runs
        boolean proceed = queryPlugin.protect().handle(ctx);

        // Then: the claims are stored under the configured key
        assertTrue(proceed);
        assertEquals("9", ctx.<Claims>get("auth").getSubject());
    }

    @Test
    @DisplayName("Registering adds the jwt middleware and the plugin instance")
    void testRegister() {
        // Given: an application without a configured secret
        Vireo app = new Vireo(new VireoConfig().setShowBanner(false).setDiscoverMiddleware(false));

        // When: the plugin is registered
        app.register(plugin);

        // Then: routes can use "jwt" and the plugin is injectable
        assertTrue(app.middlewareRegistry().has(JwtPlugin.MIDDLEWARE_NAME));
        assertSame(plugin, app.container().resolve(JwtPlugin.class));
        assertEquals(List.of(plugin), app.getPlugins());
        assertFalse(plugin.isStarted());
    }

    @Test
    @DisplayName("A plugin instance belongs to a single application")
    void testRegisterTwice() {
        VireoConfig config = new VireoConfig().setShowBanner(false).setDiscoverMiddleware(false);
        new Vireo(config).register(plugin);

        Vireo other = new Vireo(config);
        assertThrows(IllegalStateException.class, () -> other.register(plugin));
    }

    @Test
    @DisplayName("A configured secret registers the plugin automatically")
    void testAutoRegister() {
        Vireo app = new Vireo(new VireoConfig().setShowBanner(false).setJwtSecret(SECRET).setJwtExpirationMs(5000));

        assertTrue(app.middlewareRegistry().has("jwt"));
        assertEquals(5000, app.container().resolve(JwtPlugin.class).getConfig().getExpirationMs());
    }
}
