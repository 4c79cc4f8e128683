package com.example.sessionguard.util;

import com.example.sessionguard.properties.ApplicationProperties.SessionProperties.CookieProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cookie utility for the session cookie.
 * Uses Spring's ResponseCookie builder for proper cookie handling
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String COOKIE_PATH = "/";
  private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{8,128}$");

  /**
   * Extract cookie by name using Spring's WebUtils
   *
   * @param request HTTP request
   * @param name cookie name
   * @return Optional containing the cookie if found
   */
  public static Optional<Cookie> getCookie(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name));
  }

  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    return getCookie(request, name)
        .map(Cookie::getValue)
        .filter(value -> !value.isEmpty());
  }

  /**
   * Set the session cookie: HttpOnly, with the configured Secure/SameSite/Domain attributes.
   *
   * @param maxAge lifetime of the cookie, normally the absolute session timeout
   */
  public static void setSessionCookie(HttpServletResponse response,
                                      String sessionId,
                                      CookieProperties cookie,
                                      Duration maxAge) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Session ID cannot be null or empty");
    }
    response.addHeader(HttpHeaders.SET_COOKIE, buildCookie(cookie, sessionId, maxAge).toString());
    log.debug("Set session cookie: name={}, secure={}, sameSite={}", cookie.name(), cookie.secure(), cookie.sameSite());
  }

  /**
   * Expire the session cookie on the client
   */
  public static void clearSessionCookie(HttpServletResponse response, CookieProperties cookie) {
    response.addHeader(HttpHeaders.SET_COOKIE, buildCookie(cookie, "", Duration.ZERO).toString());
    log.debug("Cleared session cookie: name={}", cookie.name());
  }

  /**
   * Basic shape check so malformed ids never reach the session store.
   */
  public static boolean isValidSessionId(String sessionId) {
    return sessionId != null && SESSION_ID_PATTERN.matcher(sessionId).matches();
  }

  private static ResponseCookie buildCookie(CookieProperties cookie, String value, Duration maxAge) {
    ResponseCookie.ResponseCookieBuilder builder = ResponseCookie
        .from(cookie.name(), value)
        .httpOnly(true)
        .secure(cookie.secure())
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .sameSite(cookie.sameSite());

    if (cookie.domain() != null && !cookie.domain().isBlank()) {
      builder.domain(cookie.domain());
    }
    return builder.build();
  }
}
