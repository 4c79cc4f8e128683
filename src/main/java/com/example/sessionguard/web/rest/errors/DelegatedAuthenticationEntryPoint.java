package com.example.sessionguard.web.rest.errors;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Returns a 401 JSON error instead of a login redirect when a protected endpoint is hit without a
 * valid session.
 *
 * This is triggered when:
 * - No session cookie or session header is provided
 * - The session is unknown, logged out, evicted or expired
 */
@Component
@RequiredArgsConstructor
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ErrorResponseWriter errorResponseWriter;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    errorResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED,
                              "not_authenticated", "Authentication required");
  }
}
