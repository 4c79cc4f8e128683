package com.example.sessionguard.adapter.session;

import com.example.sessionguard.domain.entity.DeviceType;
import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionMetadata;
import com.example.sessionguard.domain.entity.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionHashMapperTest {

  private static final Instant CREATED = Instant.parse("2024-03-01T09:00:00.123Z");

  @Test
  void toHash_storesTimestampsAsEpochMillisAndSkipsNulls() {
    Session session = new Session("sess_a", "csrf_a", "user-1", null,
        new SessionMetadata("10.0.0.1", "ua", DeviceType.MOBILE, "Safari", "iOS", "0123456789abcdef"),
        CREATED, CREATED, CREATED.plusSeconds(3600), SessionState.ACTIVE, false, null, 3, null);

    Map<String, String> hash = SessionHashMapper.toHash(session);

    assertEquals(String.valueOf(CREATED.toEpochMilli()), hash.get(SessionHashMapper.FIELD_CREATED_AT));
    assertEquals("MOBILE", hash.get(SessionHashMapper.FIELD_DEVICE_TYPE));
    assertEquals("ACTIVE", hash.get(SessionHashMapper.FIELD_STATE));
    assertEquals("3", hash.get(SessionHashMapper.FIELD_REQUEST_COUNT));
    assertFalse(hash.containsKey(SessionHashMapper.FIELD_EXTERNAL_SESSION_ID));
    assertFalse(hash.containsKey(SessionHashMapper.FIELD_SUSPICIOUS_REASON));
    assertFalse(hash.containsKey(SessionHashMapper.FIELD_LAST_ENDPOINT));
  }

  @Test
  void fromHash_readsFieldsWrittenByScripts() {
    Map<String, String> hash = new HashMap<>();
    hash.put(SessionHashMapper.FIELD_SESSION_ID, "sess_b");
    hash.put(SessionHashMapper.FIELD_USER_ID, "user-2");
    hash.put(SessionHashMapper.FIELD_CREATED_AT, "1709283600000");
    hash.put(SessionHashMapper.FIELD_LAST_ACTIVITY, "1709283660000");
    hash.put(SessionHashMapper.FIELD_EXPIRES_AT, "1709326800000");
    hash.put(SessionHashMapper.FIELD_STATE, "EVICTED");
    hash.put(SessionHashMapper.FIELD_SUSPICIOUS, "true");
    hash.put(SessionHashMapper.FIELD_SUSPICIOUS_REASON, "Abnormal request rate");
    hash.put("suspiciousAt", "1709283660000");

    Session session = SessionHashMapper.fromHash(hash);

    assertEquals("sess_b", session.sessionId());
    assertEquals(SessionState.EVICTED, session.state());
    assertEquals(Instant.ofEpochMilli(1709283660000L), session.lastActivity());
    assertTrue(session.suspicious());
    assertEquals(0, session.requestCount());
    assertNull(session.metadata().deviceType());
  }

  @Test
  void fromHash_missingRequiredFieldFails() {
    Map<String, String> hash = Map.of(SessionHashMapper.FIELD_SESSION_ID, "sess_c");

    assertThrows(IllegalStateException.class, () -> SessionHashMapper.fromHash(hash));
  }

  @Test
  void fromFlatReply_pairsFieldsAndValues() {
    Map<String, String> hash = SessionHashMapper.fromFlatReply(List.of("state", "ACTIVE", "requestCount", "7"));

    assertEquals(Map.of("state", "ACTIVE", "requestCount", "7"), hash);
  }
}
