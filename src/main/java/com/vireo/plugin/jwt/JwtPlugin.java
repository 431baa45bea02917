package com.vireo.plugin.jwt;

import com.vireo.core.Vireo;
import com.vireo.http.Context;
import com.vireo.middleware.Middleware;
import com.vireo.plugin.AbstractPlugin;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import javax.crypto.SecretKey;

/**
 * Plugin for JWT authentication.
 *
 * <p>Registers the {@code jwt} route middleware. Its parameters are the
 * accepted roles: {@code "jwt"} only requires a valid token, {@code
 * "jwt:admin:editor"} also requires the token's {@code role} claim (or one of
 * its {@code roles}) to be {@code admin} or {@code editor}. A missing or invalid
 * token is answered with 401, a role mismatch with 403.
 */
public class JwtPlugin extends AbstractPlugin {
  public static final String MIDDLEWARE_NAME = "jwt";
  private static final String DEFAULT_AUTH_SCHEME = "Bearer";
  private static final String DEFAULT_TOKEN_LOOKUP = "header:Authorization";
  private static final String DEFAULT_CONTEXT_KEY = "user";
  private static final int MIN_SECRET_BYTES = 32;

  private final SecretKey secretKey;
  private final JwtConfig config;

  /**
   * Creates a new JWT plugin with the specified secret key.
   *
   * @param secretKey the HMAC secret, at least 32 bytes
   */
  public JwtPlugin(String secretKey) {
    this(secretKey, new JwtConfig());
  }

  /**
   * Creates a new JWT plugin with the specified secret key and configuration.
   *
   * @param secretKey the HMAC secret, at least 32 bytes
   * @param config the JWT configuration
   */
  public JwtPlugin(String secretKey, JwtConfig config) {
    super("jwt", "1.0.0");
    if (secretKey == null || secretKey.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "JWT secret must be at least " + MIN_SECRET_BYTES + " bytes long");
    }
    this.secretKey = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    this.config = config;
  }

  @Override
  protected void configure(Vireo app) {
    logger.info("Registering JWT plugin");
    app.middleware(MIDDLEWARE_NAME, protect());
    app.instance(JwtPlugin.class, this);
  }

  /**
   * Creates the middleware that protects routes with JWT authentication and optional role
   * checks.
   *
   * @return the middleware
   */
  public Middleware protect() {
    return (ctx, roles) -> {
      String token = extractToken(ctx);
      if (token == null) {
        return handleAuthError(ctx, "Missing authentication token");
      }

      Claims claims;
      try {
        claims = validateToken(token);
      } catch (ExpiredJwtException e) {
        return handleAuthError(ctx, "Token expired");
      } catch (SignatureException e) {
        return handleAuthError(ctx, "Invalid token signature");
      } catch (MalformedJwtException e) {
        return handleAuthError(ctx, "Malformed token");
      } catch (JwtException | IllegalArgumentException e) {
        return handleAuthError(ctx, "Invalid token: " + e.getMessage());
      }
      ctx.set(config.getContextKey(), claims);

      if (roles.length == 0) {
        return true;
      }
      Set<String> granted = rolesOf(claims);
      if (granted.isEmpty()) {
        ctx.response().forbidden("No role specified in token");
        return false;
      }
      if (Collections.disjoint(granted, Arrays.asList(roles))) {
        ctx.response().forbidden("Insufficient permissions");
        return false;
      }
      return true;
    };
  }

  /**
   * Generates a JWT token for the specified subject.
   *
   * @param subject the subject (usually a user ID)
   * @return the generated token
   */
  public String generateToken(String subject) {
    return generateToken(subject, Collections.emptyMap());
  }

  /**
   * Generates a JWT token for the specified subject with custom claims.
   *
   * @param subject the subject (usually a user ID)
   * @param claims the custom claims to include
   * @return the generated token
   */
  public String generateToken(String subject, Map<String, Object> claims) {
    long now = System.currentTimeMillis();

    JwtBuilder builder = Jwts.builder().subject(subject).issuedAt(new Date(now));
    for (Map.Entry<String, Object> entry : claims.entrySet()) {
      builder.claim(entry.getKey(), entry.getValue());
    }
    if (config.getExpirationMs() > 0) {
      builder.expiration(new Date(now + config.getExpirationMs()));
    }

    return builder.signWith(secretKey).compact();
  }

  /**
   * Validates a JWT token and returns the claims.
   *
   * @param token the token to validate
   * @return the claims
   * @throws JwtException if the token is invalid
   */
  public Claims validateToken(String token) throws JwtException {
    return Jwts.parser().verifyWith(secretKey).build().parseSignedClaims(token).getPayload();
  }

  public String extractSubject(String token) {
    return validateToken(token).getSubject();
  }

  private static Set<String> rolesOf(Claims claims) {
    Set<String> roles = new HashSet<>();
    Object role = claims.get("role");
    if (role != null) {
      roles.add(String.valueOf(role));
    }
    Object many = claims.get("roles");
    if (many instanceof Collection) {
      for (Object item : (Collection<?>) many) {
        roles.add(String.valueOf(item));
      }
    }
    return roles;
  }

  private String extractToken(Context ctx) {
    String[] parts = config.getTokenLookup().split(":", 2);
    if (parts.length != 2) {
      return null;
    }

    String key = parts[1];
    switch (parts[0].toLowerCase()) {
      case "header":
        String authHeader = ctx.header(key);
        if (authHeader != null && authHeader.startsWith(config.getAuthScheme() + " ")) {
          return authHeader.substring(config.getAuthScheme().length() + 1);
        }
        return null;
      case "query":
        return ctx.query(key);
      default:
        return null;
    }
  }

  private boolean handleAuthError(Context ctx, String message) {
    ctx.response().unauthorized(message);
    return false;
  }

  public JwtConfig getConfig() {
    return config;
  }

  /** Configuration for the JWT plugin. */
  public static class JwtConfig {
    private String authScheme = DEFAULT_AUTH_SCHEME;
    private String tokenLookup = DEFAULT_TOKEN_LOOKUP;
    private String contextKey = DEFAULT_CONTEXT_KEY;
    private long expirationMs = 3600000; // 1 hour by default

    public String getAuthScheme() {
      return authScheme;
    }

    public JwtConfig setAuthScheme(String authScheme) {
      this.authScheme = authScheme;
      return this;
    }

    public String getTokenLookup() {
      return tokenLookup;
    }

    /**
     * @param tokenLookup where to read the token: {@code header:<name>} or {@code query:<name>}
     * @return this configuration for method chaining
     */
    public JwtConfig setTokenLookup(String tokenLookup) {
      this.tokenLookup = tokenLookup;
      return this;
    }

    public String getContextKey() {
      return contextKey;
    }

    public JwtConfig setContextKey(String contextKey) {
      this.contextKey = contextKey;
      return this;
    }

    public long getExpirationMs() {
      return expirationMs;
    }

    public JwtConfig setExpirationMs(long expirationMs) {
      this.expirationMs = expirationMs;
      return this;
    }
  }
}
