package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.DeviceType;
import com.example.sessionguard.domain.entity.SessionMetadata;
import com.example.sessionguard.properties.ApplicationProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Client fingerprinting and request metadata extraction for session binding
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FingerprintService {

  static final int FINGERPRINT_LENGTH = 16;
  private static final String DELIMITER = "|";
  private static final String UNKNOWN = "unknown";

  private final ApplicationProperties properties;

  /**
   * Generate client fingerprint for session binding
   */
  public String generateFingerprint(HttpServletRequest request) {
    String fingerprintData = String.join(DELIMITER,
        headerOrEmpty(request, "User-Agent"),
        headerOrEmpty(request, "Accept-Language"),
        headerOrEmpty(request, "Accept-Encoding"),
        nullToEmpty(getClientIpAddress(request)));

    String fingerprint = sha256Hex(fingerprintData).substring(0, FINGERPRINT_LENGTH);
    log.debug("Generated client fingerprint: {}", fingerprint);
    return fingerprint;
  }

  /**
   * Build the metadata stored with a new session
   */
  public SessionMetadata extractMetadata(HttpServletRequest request) {
    String userAgent = headerOrEmpty(request, "User-Agent");
    return new SessionMetadata(
        getClientIpAddress(request),
        userAgent,
        detectDeviceType(userAgent),
        detectBrowser(userAgent),
        detectOs(userAgent),
        generateFingerprint(request));
  }

  /**
   * Extract client IP address.
   *
   * <p>Forwarded headers are only read when the service is configured to sit behind
   * {@code trusted-proxy-count} proxies. Each proxy appends the address it received the request
   * from to {@code X-Forwarded-For}, so the client is the entry that many hops from the right;
   * anything further left was supplied by the caller and is ignored.
   */
  public String getClientIpAddress(HttpServletRequest request) {
    ApplicationProperties.SecurityProperties security = properties.security();
    if (security.trustForwardedHeaders()) {
      List<String> hops = forwardedHops(request.getHeader("X-Forwarded-For"));
      if (!hops.isEmpty()) {
        return hops.get(Math.max(0, hops.size() - security.trustedProxyCount()));
      }

      String xRealIp = request.getHeader("X-Real-IP");
      if (xRealIp != null && !xRealIp.isBlank()) {
        return xRealIp.trim();
      }
    }

    return request.getRemoteAddr();
  }

  private static List<String> forwardedHops(String xForwardedFor) {
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return List.of();
    }
    return Arrays.stream(xForwardedFor.split(","))
        .map(String::trim)
        .filter(hop -> !hop.isEmpty())
        .toList();
  }

  static DeviceType detectDeviceType(String userAgent) {
    String ua = userAgent.toLowerCase(Locale.ROOT);
    if (ua.contains("mobile") || ua.contains("iphone")) {
      return DeviceType.MOBILE;
    }
    if (ua.contains("tablet") || ua.contains("ipad")) {
      return DeviceType.TABLET;
    }
    return DeviceType.DESKTOP;
  }

  static String detectBrowser(String userAgent) {
    // Chrome and Edge user agents also contain "Safari"
    if (userAgent.contains("Chrome")) {
      return "Chrome";
    }
    if (userAgent.contains("Firefox")) {
      return "Firefox";
    }
    if (userAgent.contains("Safari")) {
      return "Safari";
    }
    if (userAgent.contains("Edge")) {
      return "Edge";
    }
    return UNKNOWN;
  }

  static String detectOs(String userAgent) {
    if (userAgent.contains("Windows")) {
      return "Windows";
    }
    if (userAgent.contains("Android")) {
      return "Android";
    }
    // iOS user agents contain "Mac OS X", so they must be matched first
    if (userAgent.contains("iOS") || userAgent.contains("iPhone") || userAgent.contains("iPad")) {
      return "iOS";
    }
    if (userAgent.contains("Mac")) {
      return "MacOS";
    }
    if (userAgent.contains("Linux")) {
      return "Linux";
    }
    return UNKNOWN;
  }

  private static String headerOrEmpty(HttpServletRequest request, String name) {
    return nullToEmpty(request.getHeader(name));
  }

  private static String nullToEmpty(String value) {
    return value != null ? value : "";
  }

  private String sha256Hex(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      log.error("SHA-256 algorithm not available", e);
      throw new IllegalStateException("Failed to generate fingerprint", e);
    }
  }
}
