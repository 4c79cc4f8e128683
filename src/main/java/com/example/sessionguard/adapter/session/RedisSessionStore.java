package com.example.sessionguard.adapter.session;

import static com.example.sessionguard.adapter.session.SessionHashMapper.FIELD_USER_ID;

import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionState;
import com.example.sessionguard.exception.SessionStoreException;
import com.example.sessionguard.properties.ApplicationProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Session store using Redis hashes as the source of truth for session records.
 *
 * <p>Layout: {@code session:{id}} hash per session; {@code user_sessions:{userId}} and
 * {@code user_active_sessions:{userId}} sorted sets scored by creation time;
 * {@code sessions_by_expiry} sorted set scored by absolute expiry for the cleanup sweep.
 *
 * <p>State changes run as Lua scripts that touch only the session hash, so every script has one
 * key and works unchanged against Redis Cluster. The sorted sets are indexes: they are updated
 * after the hash and may briefly list an id whose hash says otherwise. Readers always filter on
 * the hash and prune ids whose hash is gone.
 */
@Slf4j
@Component
public class RedisSessionStore implements SessionStore {

  public static final String SESSION_KEY_PREFIX = "session:";
  public static final String USER_SESSIONS_PREFIX = "user_sessions:";
  public static final String USER_ACTIVE_SESSIONS_PREFIX = "user_active_sessions:";
  public static final String SESSIONS_BY_EXPIRY_KEY = "sessions_by_expiry";

  private static final String ACTIVE = SessionState.ACTIVE.name();

  /**
   * Moves an active session to a terminal state. Returns the owning user id, or nil when the
   * session is missing or no longer active.
   */
  static final RedisScript<String> DEACTIVATE_SCRIPT = new DefaultRedisScript<>("""
      if redis.call('HGET', KEYS[1], 'state') ~= ARGV[2] then
        return false
      end
      redis.call('HSET', KEYS[1], 'state', ARGV[1])
      return redis.call('HGET', KEYS[1], 'userId')
      """, String.class);

  @SuppressWarnings("rawtypes")
  static final RedisScript<List> UPDATE_ACTIVITY_SCRIPT = new DefaultRedisScript<>("""
      if redis.call('EXISTS', KEYS[1]) == 0 then
        return {}
      end
      redis.call('HSET', KEYS[1], 'lastActivity', ARGV[1])
      if ARGV[2] ~= '' then
        redis.call('HSET', KEYS[1], 'lastEndpoint', ARGV[2])
      end
      redis.call('HINCRBY', KEYS[1], 'requestCount', 1)
      return redis.call('HGETALL', KEYS[1])
      """, List.class);

  @SuppressWarnings("rawtypes")
  static final RedisScript<List> EXTEND_SCRIPT = new DefaultRedisScript<>("""
      if redis.call('HGET', KEYS[1], 'state') ~= ARGV[4] then
        return {}
      end
      if tonumber(redis.call('HGET', KEYS[1], 'expiresAt')) <= tonumber(ARGV[2]) then
        return {}
      end
      redis.call('HSET', KEYS[1], 'expiresAt', ARGV[1], 'lastActivity', ARGV[2])
      redis.call('PEXPIREAT', KEYS[1], ARGV[3])
      return redis.call('HGETALL', KEYS[1])
      """, List.class);

  static final RedisScript<Long> FLAG_SUSPICIOUS_SCRIPT = new DefaultRedisScript<>("""
      if redis.call('EXISTS', KEYS[1]) == 0 then
        return 0
      end
      redis.call('HSET', KEYS[1], 'suspicious', 'true', 'suspiciousReason', ARGV[1], 'suspiciousAt', ARGV[2])
      return 1
      """, Long.class);

  private final StringRedisTemplate redisTemplate;
  private final Duration retentionGrace;
  private final Duration indexTtl;

  public RedisSessionStore(StringRedisTemplate redisTemplate, ApplicationProperties properties) {
    this.redisTemplate = redisTemplate;
    ApplicationProperties.SessionProperties sessionProps = properties.session();
    this.retentionGrace = sessionProps.retentionGrace();
    this.indexTtl = sessionProps.absoluteTimeout().plus(sessionProps.retentionGrace());
  }

  @Override
  public void insert(Session session) {
    String sessionKey = sessionKey(session.sessionId());
    String userKey = USER_SESSIONS_PREFIX + session.userId();
    String activeKey = USER_ACTIVE_SESSIONS_PREFIX + session.userId();
    Map<String, String> hash = SessionHashMapper.toHash(session);
    double createdScore = session.createdAt().toEpochMilli();
    long retainUntil = session.expiresAt().plus(retentionGrace).toEpochMilli();

    execute("insert", () -> redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        redisOps.opsForHash().putAll(sessionKey, hash);
        redisOps.expireAt(sessionKey, Instant.ofEpochMilli(retainUntil));
        redisOps.opsForZSet().add(userKey, session.sessionId(), createdScore);
        redisOps.opsForZSet().add(activeKey, session.sessionId(), createdScore);
        redisOps.opsForZSet().add(SESSIONS_BY_EXPIRY_KEY, session.sessionId(), session.expiresAt().toEpochMilli());
        redisOps.expire(userKey, indexTtl.toMillis(), TimeUnit.MILLISECONDS);
        redisOps.expire(activeKey, indexTtl.toMillis(), TimeUnit.MILLISECONDS);
        return null;
      }
    }));
  }

  @Override
  public Optional<Session> get(String sessionId) {
    return execute("get", () -> {
      Map<String, String> hash = redisTemplate.<String, String>opsForHash().entries(sessionKey(sessionId));
      return hash.isEmpty() ? Optional.empty() : Optional.of(SessionHashMapper.fromHash(hash));
    });
  }

  @Override
  public List<Session> listActive(String userId, int limit, Instant now) {
    return execute("listActive", () -> {
      String activeKey = USER_ACTIVE_SESSIONS_PREFIX + userId;
      Set<String> ids = redisTemplate.opsForZSet().reverseRange(activeKey, 0, -1);
      List<Session> sessions = loadSessions(ids, activeKey);
      return sessions.stream()
          .filter(session -> session.isActiveAt(now))
          .sorted(NEWEST_FIRST)
          .limit(limit)
          .toList();
    });
  }

  @Override
  public List<Session> listSessions(String userId, boolean activeOnly, int limit, Instant now) {
    if (activeOnly) {
      return listActive(userId, limit, now);
    }
    return execute("listSessions", () -> {
      String userKey = USER_SESSIONS_PREFIX + userId;
      Set<String> ids = redisTemplate.opsForZSet().reverseRange(userKey, 0, limit - 1L);
      return loadSessions(ids, userKey).stream()
          .sorted(NEWEST_FIRST)
          .toList();
    });
  }

  @Override
  public int countActive(String userId, Instant now) {
    return listActive(userId, Integer.MAX_VALUE, now).size();
  }

  @Override
  @SuppressWarnings("unchecked")
  public Optional<Session> updateActivity(String sessionId, String path, Instant now) {
    return execute("updateActivity", () -> {
      List<Object> reply = redisTemplate.execute(UPDATE_ACTIVITY_SCRIPT,
          List.of(sessionKey(sessionId)),
          SessionHashMapper.millis(now),
          path != null ? path : "");
      return toSession(reply);
    });
  }

  @Override
  public boolean deactivate(String sessionId, SessionState state) {
    if (state == SessionState.ACTIVE) {
      throw new IllegalArgumentException("Deactivation requires a terminal state");
    }
    return execute("deactivate", () -> {
      String userId = redisTemplate.execute(DEACTIVATE_SCRIPT, List.of(sessionKey(sessionId)), state.name(), ACTIVE);
      if (userId == null) {
        return false;
      }
      redisTemplate.opsForZSet().remove(USER_ACTIVE_SESSIONS_PREFIX + userId, sessionId);
      return true;
    });
  }

  @Override
  public int deactivateAll(String userId, String exceptSessionId, SessionState state) {
    Set<String> ids = execute("deactivateAll",
        () -> redisTemplate.opsForZSet().range(USER_ACTIVE_SESSIONS_PREFIX + userId, 0, -1));
    if (ids == null) {
      return 0;
    }
    int count = 0;
    for (String id : ids) {
      if (!id.equals(exceptSessionId) && deactivate(id, state)) {
        count++;
      }
    }
    return count;
  }

  @Override
  public Optional<Session> extend(String sessionId, Instant expiresAt, Instant now) {
    return execute("extend", () -> {
      Instant retainUntil = expiresAt.plus(retentionGrace);
      Optional<Session> extended = toSession(redisTemplate.execute(EXTEND_SCRIPT,
          List.of(sessionKey(sessionId)),
          SessionHashMapper.millis(expiresAt),
          SessionHashMapper.millis(now),
          SessionHashMapper.millis(retainUntil),
          ACTIVE));
      extended.ifPresent(session -> reindexExtended(session, Duration.between(now, retainUntil)));
      return extended;
    });
  }

  /**
   * Moves an extended session in the expiry index and keeps the user's indexes alive at least as
   * long as the session hash.
   */
  private void reindexExtended(Session session, Duration retainFor) {
    redisTemplate.opsForZSet().add(SESSIONS_BY_EXPIRY_KEY, session.sessionId(), session.expiresAt().toEpochMilli());
    for (String indexKey : List.of(USER_SESSIONS_PREFIX + session.userId(),
                                   USER_ACTIVE_SESSIONS_PREFIX + session.userId())) {
      Long ttl = redisTemplate.getExpire(indexKey, TimeUnit.MILLISECONDS);
      if (ttl != null && ttl >= 0 && ttl < retainFor.toMillis()) {
        redisTemplate.expire(indexKey, retainFor.toMillis(), TimeUnit.MILLISECONDS);
      }
    }
  }

  @Override
  public int deleteExpired(Instant cutoff) {
    return execute("deleteExpired", () -> {
      Set<String> ids = redisTemplate.opsForZSet()
          .rangeByScore(SESSIONS_BY_EXPIRY_KEY, Double.NEGATIVE_INFINITY, cutoff.toEpochMilli() - 1);
      if (ids == null || ids.isEmpty()) {
        return 0;
      }
      for (String id : ids) {
        String sessionKey = sessionKey(id);
        String userId = redisTemplate.<String, String>opsForHash().get(sessionKey, FIELD_USER_ID);
        redisTemplate.executePipelined(new SessionCallback<Object>() {
          @Override
          public Object execute(@NonNull RedisOperations operations) {
            @SuppressWarnings("unchecked")
            RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
            redisOps.delete(sessionKey);
            if (userId != null) {
              redisOps.opsForZSet().remove(USER_SESSIONS_PREFIX + userId, id);
              redisOps.opsForZSet().remove(USER_ACTIVE_SESSIONS_PREFIX + userId, id);
            }
            redisOps.opsForZSet().remove(SESSIONS_BY_EXPIRY_KEY, id);
            return null;
          }
        });
      }
      return ids.size();
    });
  }

  @Override
  public boolean flagSuspicious(String sessionId, String reason, Instant now) {
    return execute("flagSuspicious", () -> {
      Long flagged = redisTemplate.execute(FLAG_SUSPICIOUS_SCRIPT,
          List.of(sessionKey(sessionId)),
          reason != null ? reason : "",
          SessionHashMapper.millis(now));
      return flagged != null && flagged == 1L;
    });
  }

  /**
   * Loads session hashes in one pipeline. Ids whose hash has disappeared are pruned from the index.
   */
  private List<Session> loadSessions(Set<String> ids, String indexKey) {
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    List<String> orderedIds = new ArrayList<>(ids);
    List<Object> hashes = redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations operations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
        for (String id : orderedIds) {
          redisOps.opsForHash().entries(sessionKey(id));
        }
        return null;
      }
    });

    List<Session> sessions = new ArrayList<>(orderedIds.size());
    List<String> stale = new ArrayList<>();
    for (int i = 0; i < orderedIds.size(); i++) {
      @SuppressWarnings("unchecked")
      Map<String, String> hash = (Map<String, String>) hashes.get(i);
      if (hash == null || hash.isEmpty()) {
        stale.add(orderedIds.get(i));
      } else {
        sessions.add(SessionHashMapper.fromHash(hash));
      }
    }
    if (!stale.isEmpty()) {
      redisTemplate.opsForZSet().remove(indexKey, stale.toArray());
      log.debug("Pruned {} stale entries from {}", stale.size(), indexKey);
    }
    return sessions;
  }

  private Optional<Session> toSession(List<?> reply) {
    if (reply == null || reply.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(SessionHashMapper.fromHash(SessionHashMapper.fromFlatReply(reply)));
  }

  private <T> T execute(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (SessionStoreException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SessionStoreException("Session store operation '" + operation + "' failed", e);
    }
  }

  private static String sessionKey(String sessionId) {
    return SESSION_KEY_PREFIX + sessionId;
  }
}
