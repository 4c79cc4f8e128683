package com.example.sessionguard.support;

import com.example.sessionguard.adapter.session.SessionStore;
import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionState;
import com.example.sessionguard.exception.SessionStoreException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed session store with a switch to simulate the backend being unreachable.
 */
public class InMemorySessionStore implements SessionStore {

  private final Map<String, Session> sessions = new ConcurrentHashMap<>();
  private volatile boolean unavailable;

  public void setUnavailable(boolean unavailable) {
    this.unavailable = unavailable;
  }

  public int size() {
    return sessions.size();
  }

  /**
   * Replace a stored record directly, bypassing the store contract.
   */
  public void put(Session session) {
    sessions.put(session.sessionId(), session);
  }

  @Override
  public void insert(Session session) {
    checkAvailable();
    sessions.put(session.sessionId(), session);
  }

  @Override
  public Optional<Session> get(String sessionId) {
    checkAvailable();
    return Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public List<Session> listActive(String userId, int limit, Instant now) {
    checkAvailable();
    return sessions.values().stream()
        .filter(s -> s.userId().equals(userId) && s.isActiveAt(now))
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .toList();
  }

  @Override
  public List<Session> listSessions(String userId, boolean activeOnly, int limit, Instant now) {
    checkAvailable();
    return sessions.values().stream()
        .filter(s -> s.userId().equals(userId) && (!activeOnly || s.isActiveAt(now)))
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .toList();
  }

  @Override
  public int countActive(String userId, Instant now) {
    checkAvailable();
    return (int) sessions.values().stream()
        .filter(s -> s.userId().equals(userId) && s.isActiveAt(now))
        .count();
  }

  @Override
  public Optional<Session> updateActivity(String sessionId, String path, Instant now) {
    checkAvailable();
    Session updated = sessions.computeIfPresent(sessionId, (id, s) -> new Session(
        s.sessionId(), s.csrfToken(), s.userId(), s.externalSessionId(), s.metadata(), s.createdAt(),
        now, s.expiresAt(), s.state(), s.suspicious(), s.suspiciousReason(), s.requestCount() + 1, path));
    return Optional.ofNullable(updated);
  }

  @Override
  public boolean deactivate(String sessionId, SessionState state) {
    checkAvailable();
    boolean[] changed = {false};
    sessions.computeIfPresent(sessionId, (id, s) -> {
      if (s.state() != SessionState.ACTIVE) {
        return s;
      }
      changed[0] = true;
      return withState(s, state);
    });
    return changed[0];
  }

  @Override
  public int deactivateAll(String userId, String exceptSessionId, SessionState state) {
    checkAvailable();
    int count = 0;
    for (Session s : List.copyOf(sessions.values())) {
      if (s.userId().equals(userId) && !s.sessionId().equals(exceptSessionId) && deactivate(s.sessionId(), state)) {
        count++;
      }
    }
    return count;
  }

  @Override
  public Optional<Session> extend(String sessionId, Instant expiresAt, Instant now) {
    checkAvailable();
    Session current = sessions.get(sessionId);
    if (current == null || !current.isActiveAt(now)) {
      return Optional.empty();
    }
    Session extended = new Session(
        current.sessionId(), current.csrfToken(), current.userId(), current.externalSessionId(),
        current.metadata(), current.createdAt(), now, expiresAt, current.state(), current.suspicious(),
        current.suspiciousReason(), current.requestCount(), current.lastEndpoint());
    sessions.put(sessionId, extended);
    return Optional.of(extended);
  }

  @Override
  public int deleteExpired(Instant cutoff) {
    checkAvailable();
    List<String> expired = sessions.values().stream()
        .filter(s -> s.expiresAt().isBefore(cutoff))
        .map(Session::sessionId)
        .toList();
    expired.forEach(sessions::remove);
    return expired.size();
  }

  @Override
  public boolean flagSuspicious(String sessionId, String reason, Instant now) {
    checkAvailable();
    return sessions.computeIfPresent(sessionId, (id, s) -> s.markSuspicious(reason)) != null;
  }

  private static Session withState(Session s, SessionState state) {
    return new Session(
        s.sessionId(), s.csrfToken(), s.userId(), s.externalSessionId(), s.metadata(), s.createdAt(),
        s.lastActivity(), s.expiresAt(), state, s.suspicious(), s.suspiciousReason(), s.requestCount(),
        s.lastEndpoint());
  }

  private void checkAvailable() {
    if (unavailable) {
      throw new SessionStoreException("Session store unavailable");
    }
  }
}
