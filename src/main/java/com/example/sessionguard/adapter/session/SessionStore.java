package com.example.sessionguard.adapter.session;

import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionState;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage for session records.
 *
 * <p>Every operation touches a single session atomically; there are no multi-session transactions.
 * Implementations report connectivity problems as
 * {@link com.example.sessionguard.exception.SessionStoreException}.
 */
public interface SessionStore {

  /**
   * Creation time descending, then session id descending, so eviction order is deterministic.
   */
  Comparator<Session> NEWEST_FIRST =
      Comparator.comparing(Session::createdAt).thenComparing(Session::sessionId).reversed();

  void insert(Session session);

  Optional<Session> get(String sessionId);

  /**
   * Sessions that are ACTIVE and not yet past {@code expiresAt}, newest first by creation time
   * (ties broken by session id).
   */
  List<Session> listActive(String userId, int limit, Instant now);

  /**
   * All sessions of a user, newest first by creation time.
   */
  List<Session> listSessions(String userId, boolean activeOnly, int limit, Instant now);

  int countActive(String userId, Instant now);

  /**
   * Records a request against the session: bumps {@code lastActivity} and {@code requestCount}.
   *
   * @return the updated record, or empty if the session no longer exists
   */
  Optional<Session> updateActivity(String sessionId, String path, Instant now);

  /**
   * Moves an ACTIVE session to {@code state}. Compare-and-swap: returns false if the session was
   * missing or already inactive.
   */
  boolean deactivate(String sessionId, SessionState state);

  int deactivateAll(String userId, String exceptSessionId, SessionState state);

  /**
   * Pushes out the absolute expiry of an ACTIVE session.
   *
   * @return the updated record, or empty if the session is missing or not ACTIVE
   */
  Optional<Session> extend(String sessionId, Instant expiresAt, Instant now);

  /**
   * Hard-deletes sessions whose {@code expiresAt} is before {@code cutoff}.
   */
  int deleteExpired(Instant cutoff);

  boolean flagSuspicious(String sessionId, String reason, Instant now);
}
