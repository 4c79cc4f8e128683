package com.example.sessionguard.adapter.session;

import com.example.sessionguard.domain.entity.DeviceType;
import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionMetadata;
import com.example.sessionguard.domain.entity.SessionState;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Converts sessions to and from the string fields of a Redis hash.
 * Timestamps are stored as epoch milliseconds; null values are left out of the hash.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class SessionHashMapper {

  static final String FIELD_SESSION_ID = "sessionId";
  static final String FIELD_CSRF_TOKEN = "csrfToken";
  static final String FIELD_USER_ID = "userId";
  static final String FIELD_EXTERNAL_SESSION_ID = "externalSessionId";
  static final String FIELD_IP = "ip";
  static final String FIELD_USER_AGENT = "userAgent";
  static final String FIELD_DEVICE_TYPE = "deviceType";
  static final String FIELD_BROWSER = "browser";
  static final String FIELD_OS = "os";
  static final String FIELD_FINGERPRINT = "fingerprint";
  static final String FIELD_CREATED_AT = "createdAt";
  static final String FIELD_LAST_ACTIVITY = "lastActivity";
  static final String FIELD_EXPIRES_AT = "expiresAt";
  static final String FIELD_STATE = "state";
  static final String FIELD_SUSPICIOUS = "suspicious";
  static final String FIELD_SUSPICIOUS_REASON = "suspiciousReason";
  static final String FIELD_REQUEST_COUNT = "requestCount";
  static final String FIELD_LAST_ENDPOINT = "lastEndpoint";

  static Map<String, String> toHash(Session session) {
    Map<String, String> hash = new HashMap<>();
    put(hash, FIELD_SESSION_ID, session.sessionId());
    put(hash, FIELD_CSRF_TOKEN, session.csrfToken());
    put(hash, FIELD_USER_ID, session.userId());
    put(hash, FIELD_EXTERNAL_SESSION_ID, session.externalSessionId());

    SessionMetadata metadata = session.metadata();
    if (metadata != null) {
      put(hash, FIELD_IP, metadata.ipAddress());
      put(hash, FIELD_USER_AGENT, metadata.userAgent());
      put(hash, FIELD_DEVICE_TYPE, metadata.deviceType() != null ? metadata.deviceType().name() : null);
      put(hash, FIELD_BROWSER, metadata.browser());
      put(hash, FIELD_OS, metadata.os());
      put(hash, FIELD_FINGERPRINT, metadata.fingerprint());
    }

    put(hash, FIELD_CREATED_AT, millis(session.createdAt()));
    put(hash, FIELD_LAST_ACTIVITY, millis(session.lastActivity()));
    put(hash, FIELD_EXPIRES_AT, millis(session.expiresAt()));
    put(hash, FIELD_STATE, session.state().name());
    put(hash, FIELD_SUSPICIOUS, String.valueOf(session.suspicious()));
    put(hash, FIELD_SUSPICIOUS_REASON, session.suspiciousReason());
    put(hash, FIELD_REQUEST_COUNT, String.valueOf(session.requestCount()));
    put(hash, FIELD_LAST_ENDPOINT, session.lastEndpoint());
    return hash;
  }

  static Session fromHash(Map<String, String> hash) {
    String deviceType = hash.get(FIELD_DEVICE_TYPE);
    SessionMetadata metadata = new SessionMetadata(
        hash.get(FIELD_IP),
        hash.get(FIELD_USER_AGENT),
        deviceType != null ? DeviceType.valueOf(deviceType) : null,
        hash.get(FIELD_BROWSER),
        hash.get(FIELD_OS),
        hash.get(FIELD_FINGERPRINT));

    return new Session(
        required(hash, FIELD_SESSION_ID),
        hash.get(FIELD_CSRF_TOKEN),
        required(hash, FIELD_USER_ID),
        hash.get(FIELD_EXTERNAL_SESSION_ID),
        metadata,
        instant(required(hash, FIELD_CREATED_AT)),
        instant(required(hash, FIELD_LAST_ACTIVITY)),
        instant(required(hash, FIELD_EXPIRES_AT)),
        SessionState.valueOf(required(hash, FIELD_STATE)),
        Boolean.parseBoolean(hash.get(FIELD_SUSPICIOUS)),
        hash.get(FIELD_SUSPICIOUS_REASON),
        Long.parseLong(hash.getOrDefault(FIELD_REQUEST_COUNT, "0")),
        hash.get(FIELD_LAST_ENDPOINT));
  }

  /**
   * Rebuilds a hash from the flat field/value reply of HGETALL inside a script.
   */
  static Map<String, String> fromFlatReply(List<?> reply) {
    Map<String, String> hash = new HashMap<>();
    for (int i = 0; i + 1 < reply.size(); i += 2) {
      hash.put(String.valueOf(reply.get(i)), String.valueOf(reply.get(i + 1)));
    }
    return hash;
  }

  static String millis(Instant instant) {
    return instant != null ? String.valueOf(instant.toEpochMilli()) : null;
  }

  private static Instant instant(String millis) {
    return Instant.ofEpochMilli(Long.parseLong(millis));
  }

  private static String required(Map<String, String> hash, String field) {
    String value = hash.get(field);
    if (value == null) {
      throw new IllegalStateException("Session hash is missing field '" + field + "'");
    }
    return value;
  }

  private static void put(Map<String, String> hash, String field, String value) {
    if (value != null) {
      hash.put(field, value);
    }
  }
}
