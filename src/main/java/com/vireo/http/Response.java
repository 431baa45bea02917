package com.vireo.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.vireo.util.JsonUtil;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wrapper for HTTP response operations with a fluent API.
 *
 * <p>A response is sent at most once. Any later attempt to send is ignored and logged as a
 * warning, so a handler that already answered cannot be overwritten by the dispatcher.
 */
public class Response {
  private static final Logger logger = LoggerFactory.getLogger(Response.class);

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final HttpServerExchange exchange;
  private boolean sent = false;

  /**
   * Creates a new Response instance wrapped around an HttpServerExchange.
   *
   * @param exchange the underlying exchange
   */
  public Response(HttpServerExchange exchange) {
    this.exchange = exchange;
  }

  /**
   * Sets the response status code.
   *
   * @param status the status code
   * @return this response for method chaining
   */
  public Response status(int status) {
    exchange.setStatusCode(status);
    return this;
  }

  public int getStatus() {
    return exchange.getStatusCode();
  }

  /**
   * Sets a response header, replacing any previous value.
   *
   * @param name the header name
   * @param value the header value
   * @return this response for method chaining
   */
  public Response header(String name, String value) {
    exchange.getResponseHeaders().put(new HttpString(name), value);
    return this;
  }

  public String getHeader(String name) {
    return exchange.getResponseHeaders().getFirst(name);
  }

  /**
   * Sets the Content-Type header.
   *
   * @param contentType the content type
   * @return this response for method chaining
   */
  public Response type(String contentType) {
    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
    return this;
  }

  /**
   * Sends a text body. Defaults the Content-Type to 'text/plain' when none is set.
   *
   * @param text the text to send
   * @return this response for method chaining
   */
  public Response send(String text) {
    if (sent) {
      logger.warn("Response already sent, ignoring subsequent send() call");
      return this;
    }

    if (!exchange.getResponseHeaders().contains(Headers.CONTENT_TYPE)) {
      type("text/plain; charset=UTF-8");
    }
    exchange.getResponseSender().send(text == null ? "" : text, StandardCharsets.UTF_8);
    sent = true;
    return this;
  }

  /**
   * Sends binary data as a response.
   *
   * @param data the binary data to send
   * @return this response for method chaining
   */
  public Response send(byte[] data) {
    if (sent) {
      logger.warn("Response already sent, ignoring subsequent send() call");
      return this;
    }

    exchange.getResponseSender().send(ByteBuffer.wrap(data));
    sent = true;
    return this;
  }

  public Response html(String html) {
    return type("text/html; charset=UTF-8").send(html);
  }

  public Response text(String text) {
    return type("text/plain; charset=UTF-8").send(text);
  }

  public Response xml(String xml) {
    return type("application/xml; charset=UTF-8").send(xml);
  }

  /**
   * Sends an already serialized JSON document.
   *
   * @param json the JSON string to send
   * @return this response for method chaining
   */
  public Response json(String json) {
    if (sent) {
      logger.warn("Response already sent, ignoring json() call");
      return this;
    }
    return type("application/json").send(json);
  }

  /**
   * Serializes an object with the shared Jackson mapper and sends it as JSON.
   *
   * @param obj the object to serialize
   * @return this response for method chaining
   */
  public Response json(Object obj) {
    if (sent) {
      logger.warn("Response already sent, ignoring json() call");
      return this;
    }

    try {
      return json(JsonUtil.toJson(obj));
    } catch (JsonProcessingException e) {
      logger.error("Error serializing object to JSON", e);
      return status(500).text("Error processing JSON");
    }
  }

  /**
   * Sends the standard JSON envelope with the security headers.
   *
   * @param data the payload; a map's {@code message} key becomes the envelope message
   * @param status the status code
   * @return this response for method chaining
   * @see #buildEnvelope(Object, int)
   */
  public Response envelope(Object data, int status) {
    header("X-Content-Type-Options", "nosniff");
    header("X-Frame-Options", "DENY");
    header("X-XSS-Protection", "1; mode=block");
    return status(status).json(buildEnvelope(data, status));
  }

  public Response success(String message) {
    return success(message, null, 200);
  }

  /**
   * Sends a success envelope.
   *
   * @param message the message
   * @param data optional payload
   * @param status the status code
   * @return this response for method chaining
   */
  public Response success(String message, Object data, int status) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", message);
    if (data != null) {
      body.put("data", data);
    }
    return envelope(body, status);
  }

  public Response error(String message, int status) {
    return error(message, status, null);
  }

  /**
   * Sends an error envelope. Field errors end up under {@code data.errors}.
   *
   * @param message the error message
   * @param status the status code
   * @param errors optional field errors
   * @return this response for method chaining
   */
  public Response error(String message, int status, Object errors) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", message);
    if (errors != null) {
      body.put("errors", errors);
    }
    return envelope(body, status);
  }

  public Response validationError(Object errors) {
    return validationError(errors, "Validation failed");
  }

  public Response validationError(Object errors, String message) {
    return error(message, 422, errors);
  }

  public Response notFound(String message) {
    return error(message, 404);
  }

  public Response unauthorized(String message) {
    return error(message, 401);
  }

  public Response forbidden(String message) {
    return error(message, 403);
  }

  public Response serverError(String message) {
    return error(message, 500);
  }

  public Response created(Object data, String message) {
    return success(message, data, 201);
  }

  public Response accepted(String message) {
    return success(message, null, 202);
  }

  /**
   * Sends a 204 No Content response.
   *
   * @return this response for method chaining
   */
  public Response noContent() {
    if (sent) {
      logger.warn("Response already sent, ignoring noContent() call");
      return this;
    }
    status(204);
    exchange.endExchange();
    sent = true;
    return this;
  }

  /**
   * Performs a temporary (302) redirect to the specified URL.
   *
   * @param url the URL to redirect to
   * @return this response for method chaining
   */
  public Response redirect(String url) {
    return redirect(url, 302);
  }

  public Response redirect(String url, int status) {
    status(status);
    header("Location", url);
    return send("");
  }

  /**
   * Gets the underlying exchange object.
   *
   * @return the exchange
   */
  public HttpServerExchange getExchange() {
    return exchange;
  }

  /**
   * Checks if the response has been sent.
   *
   * @return true if the response has been sent
   */
  public boolean isSent() {
    return sent;
  }

  /**
   * Builds the JSON envelope: {@code status} is the status class name, {@code message} is lifted
   * out of a map payload, {@code data} is the map's {@code data} entry or whatever is left of the
   * map. Non-map payloads are used as {@code data} directly.
   *
   * @param data the payload
   * @param status the status code
   * @return the envelope, in output order
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> buildEnvelope(Object data, int status) {
    String message = "";
    Object payload = data;
    if (data instanceof Map) {
      Map<String, Object> rest = new LinkedHashMap<>((Map<String, Object>) data);
      Object lifted = rest.remove("message");
      if (lifted != null) {
        message = String.valueOf(lifted);
      }
      if (rest.get("data") != null) {
        payload = rest.get("data");
      } else {
        rest.remove("data");
        payload = rest.isEmpty() ? null : rest;
      }
    }

    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("status", statusName(status));
    envelope.put("message", message);
    envelope.put("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMAT));
    envelope.put("server_time", Instant.now().getEpochSecond());
    if (payload != null) {
      envelope.put("data", payload);
    }
    return envelope;
  }

  /**
   * Names the class of a status code.
   *
   * @param status the status code
   * @return Informational, Success, Redirect, Client Error, Server Error or Unknown
   */
  public static String statusName(int status) {
    if (status >= 100 && status < 200) {
      return "Informational";
    } else if (status >= 200 && status < 300) {
      return "Success";
    } else if (status >= 300 && status < 400) {
      return "Redirect";
    } else if (status >= 400 && status < 500) {
      return "Client Error";
    } else if (status >= 500 && status < 600) {
      return "Server Error";
    }
    return "Unknown";
  }
}
