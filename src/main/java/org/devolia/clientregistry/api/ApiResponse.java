package org.devolia.clientregistry.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-facing outcome of a registry operation: an HTTP-equivalent status and a JSON-ready
 * body.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class ApiResponse {

  private final int status;
  private final Object body;

  public ApiResponse(int status, Object body) {
    this.status = status;
    this.body = body;
  }

  /**
   * Builds an error response with body {@code {"error": message}}.
   *
   * @param status the status code
   * @param message the caller-safe message
   * @return the response
   */
  public static ApiResponse error(int status, String message) {
    return new ApiResponse(status, Collections.singletonMap("error", message));
  }

  /**
   * Builds a success response with body {@code {"success": true, name: value}}.
   *
   * @param status the status code
   * @param name the result field name
   * @param value the result field value
   * @return the response
   */
  public static ApiResponse success(int status, String name, Object value) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put(name, value);
    return new ApiResponse(status, Collections.unmodifiableMap(body));
  }

  public int getStatus() {
    return status;
  }

  public Object getBody() {
    return body;
  }

  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }

  @Override
  public String toString() {
    return "ApiResponse{status=" + status + "}";
  }
}
