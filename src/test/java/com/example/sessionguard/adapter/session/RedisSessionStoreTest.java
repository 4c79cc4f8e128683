package com.example.sessionguard.adapter.session;

import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionState;
import com.example.sessionguard.exception.SessionStoreException;
import com.example.sessionguard.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisSessionStoreTest {

  private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

  @Mock
  private StringRedisTemplate redisTemplate;
  @Mock
  private HashOperations<String, Object, Object> hashOperations;
  @Mock
  private ZSetOperations<String, String> zSetOperations;

  private RedisSessionStore store;

  @BeforeEach
  void setUp() {
    store = new RedisSessionStore(redisTemplate, TestProperties.defaults());
  }

  @Test
  void get_mapsHashToSession() {
    when(redisTemplate.opsForHash()).thenReturn(hashOperations);
    when(hashOperations.entries("session:sess_a")).thenReturn(Map.of(
        "sessionId", "sess_a",
        "userId", "user-1",
        "createdAt", String.valueOf(NOW.toEpochMilli()),
        "lastActivity", String.valueOf(NOW.toEpochMilli()),
        "expiresAt", String.valueOf(NOW.plusSeconds(60).toEpochMilli()),
        "state", "ACTIVE"));

    Session session = store.get("sess_a").orElseThrow();

    assertEquals("user-1", session.userId());
    assertTrue(session.isActiveAt(NOW));
  }

  @Test
  void get_missingHashIsEmpty() {
    when(redisTemplate.opsForHash()).thenReturn(hashOperations);
    when(hashOperations.entries("session:sess_missing")).thenReturn(Map.of());

    assertEquals(Optional.empty(), store.get("sess_missing"));
  }

  @Test
  void get_connectionFailureIsWrapped() {
    when(redisTemplate.opsForHash()).thenThrow(new RedisConnectionFailureException("down"));

    assertThrows(SessionStoreException.class, () -> store.get("sess_a"));
  }

  @Test
  void deactivate_runsSingleKeyScriptThenUpdatesIndex() {
    when(redisTemplate.execute(eq(RedisSessionStore.DEACTIVATE_SCRIPT), eq(List.of("session:sess_a")),
                               eq("LOGGED_OUT"), eq("ACTIVE")))
        .thenReturn("user-1");
    when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);

    assertTrue(store.deactivate("sess_a", SessionState.LOGGED_OUT));
    verify(zSetOperations).remove("user_active_sessions:user-1", "sess_a");
  }

  @Test
  void deactivate_inactiveOrMissingSessionLeavesIndexAlone() {
    when(redisTemplate.execute(eq(RedisSessionStore.DEACTIVATE_SCRIPT), eq(List.of("session:sess_missing")),
                               eq("LOGGED_OUT"), eq("ACTIVE")))
        .thenReturn(null);

    assertFalse(store.deactivate("sess_missing", SessionState.LOGGED_OUT));
    verify(redisTemplate, never()).opsForZSet();
  }

  @Test
  @SuppressWarnings("unchecked")
  void extend_expiredSessionIsEmptyAndNotReindexed() {
    when(redisTemplate.execute(eq(RedisSessionStore.EXTEND_SCRIPT), eq(List.of("session:sess_old")),
                               any(Object[].class)))
        .thenReturn(List.of());

    assertTrue(store.extend("sess_old", NOW.plusSeconds(3600), NOW).isEmpty());
    verify(redisTemplate, never()).opsForZSet();
  }

  @Test
  void scriptsOnlyTouchTheSessionHash() {
    for (RedisScript<?> script : List.of(RedisSessionStore.DEACTIVATE_SCRIPT, RedisSessionStore.EXTEND_SCRIPT,
                                         RedisSessionStore.UPDATE_ACTIVITY_SCRIPT,
                                         RedisSessionStore.FLAG_SUSPICIOUS_SCRIPT)) {
      String source = script.getScriptAsString();
      assertTrue(source.contains("KEYS[1]"));
      assertFalse(source.contains("KEYS[2]"), source);
    }
  }

  @Test
  void deactivate_rejectsActiveAsTargetState() {
    assertThrows(IllegalArgumentException.class, () -> store.deactivate("sess_a", SessionState.ACTIVE));
  }

  @Test
  void updateActivity_emptyReplyMeansSessionGone() {
    when(redisTemplate.execute(eq(RedisSessionStore.UPDATE_ACTIVITY_SCRIPT),
                               eq(List.of("session:sess_gone")),
                               eq(String.valueOf(NOW.toEpochMilli())), eq("/api/x")))
        .thenReturn(List.of());

    assertTrue(store.updateActivity("sess_gone", "/api/x", NOW).isEmpty());
  }

  @Test
  void flagSuspicious_passesReason() {
    when(redisTemplate.execute(eq(RedisSessionStore.FLAG_SUSPICIOUS_SCRIPT),
                               eq(List.of("session:sess_a")),
                               eq("Abnormal request rate"), eq(String.valueOf(NOW.toEpochMilli()))))
        .thenReturn(1L);

    assertTrue(store.flagSuspicious("sess_a", "Abnormal request rate", NOW));
  }
}
