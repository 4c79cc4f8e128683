package com.example.sessionguard.web.rest.errors;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Builds the JSON error body shared by controllers and servlet filters:
 * {@code {timestamp, status, error, message, path}}.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public Map<String, Object> body(HttpStatus status, String error, String message, String path) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", clock.instant().toString());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", path);
    return body;
  }

  /**
   * Write an error directly to the servlet response, for code running outside MVC.
   */
  public void write(HttpServletRequest request, HttpServletResponse response,
                    HttpStatus status, String error, String message) throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body(status, error, message, request.getRequestURI()));
  }
}
