package com.example.sessionguard.service;

import com.example.sessionguard.adapter.session.SessionStore;
import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionMetadata;
import com.example.sessionguard.domain.entity.SessionState;
import com.example.sessionguard.domain.entity.SessionStatus;
import com.example.sessionguard.domain.entity.SuspicionReason;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.exception.SessionStoreException;
import com.example.sessionguard.properties.ApplicationProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;

/**
 * Session lifecycle management: creation under a per-user concurrency budget, per-request
 * validation with lazy expiry and hijack/abuse detection, refresh, and termination.
 *
 * <p>Detection never blocks a request. A fingerprint mismatch or an abnormal request rate only
 * flags the session as suspicious; enforcement is left to callers.
 */
@Slf4j
@Service
public class SessionLifecycleService {

  private static final String SESSION_ID_PREFIX = "sess_";
  private static final String CSRF_TOKEN_PREFIX = "csrf_";
  private static final int TOKEN_ENTROPY_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final SessionStore sessionStore;
  private final FingerprintService fingerprintService;
  private final Clock clock;
  private final int maxConcurrentSessions;
  private final Duration idleTimeout;
  private final Duration absoluteTimeout;
  private final double idleWarningRatio;
  private final int suspiciousRequestThreshold;
  private final Duration retentionGrace;

  public SessionLifecycleService(
      SessionStore sessionStore,
      FingerprintService fingerprintService,
      ApplicationProperties properties,
      Clock clock) {
    this.sessionStore = sessionStore;
    this.fingerprintService = fingerprintService;
    this.clock = clock;

    ApplicationProperties.SessionProperties sessionProps = properties.session();
    this.maxConcurrentSessions = sessionProps.maxConcurrentSessions();
    this.idleTimeout = sessionProps.idleTimeout();
    this.absoluteTimeout = sessionProps.absoluteTimeout();
    this.idleWarningRatio = sessionProps.idleWarningRatio();
    this.suspiciousRequestThreshold = sessionProps.suspiciousRequestThreshold();
    this.retentionGrace = sessionProps.retentionGrace();
  }

  /**
   * Create a session for an already authenticated user. When the user is at the concurrency
   * budget the oldest active sessions are evicted first; creation itself never fails on the limit.
   *
   * @throws SessionStoreException if the store cannot record the session
   */
  public Session create(String userId, String externalSessionId, HttpServletRequest request) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("User id is required to create a session");
    }
    Instant now = clock.instant();

    evictOverBudget(userId, now);

    SessionMetadata metadata = fingerprintService.extractMetadata(request);
    Session session = new Session(
        generateToken(SESSION_ID_PREFIX),
        generateToken(CSRF_TOKEN_PREFIX),
        userId,
        externalSessionId,
        metadata,
        now,
        now,
        now.plus(absoluteTimeout),
        SessionState.ACTIVE,
        false,
        null,
        0,
        null);

    sessionStore.insert(session);
    log.info("Created session {} for user {} ({}, {}, {})", maskSessionId(session.sessionId()), userId,
             metadata.deviceType(), metadata.browser(), metadata.os());
    return session;
  }

  /**
   * Session for a caller whose identity was just verified but who presented no valid session.
   * The user's newest active session from the same client is resumed when there is one, so a
   * client that does not keep cookies does not churn through the concurrency budget; otherwise a
   * new session is created.
   *
   * @throws SessionStoreException if the store cannot be read or written
   */
  public Session establish(String userId, String externalSessionId, HttpServletRequest request) {
    Instant now = clock.instant();
    String fingerprint = fingerprintService.generateFingerprint(request);

    Optional<Session> sameClient = sessionStore.listActive(userId, maxConcurrentSessions, now).stream()
        .filter(session -> session.metadata() != null && fingerprint.equals(session.metadata().fingerprint()))
        .findFirst();
    if (sameClient.isPresent()) {
      Optional<Session> resumed = validate(sameClient.get().sessionId(), request);
      if (resumed.isPresent()) {
        log.debug("Resumed session {} for user {}", maskSessionId(resumed.get().sessionId()), userId);
        return resumed.get();
      }
    }
    return create(userId, externalSessionId, request);
  }

  /**
   * Validate a session for the current request and record the request against it.
   *
   * @return the session with any suspicion raised by this call, or empty if the caller must be
   *     treated as not authenticated
   */
  public Optional<Session> validate(String sessionId, HttpServletRequest request) {
    if (!isValidSessionId(sessionId)) {
      return Optional.empty();
    }
    Instant now = clock.instant();

    Session session;
    try {
      Optional<Session> stored = sessionStore.get(sessionId);
      if (stored.isEmpty() || stored.get().state() != SessionState.ACTIVE) {
        return Optional.empty();
      }
      session = stored.get();

      if (session.isExpiredAt(now)) {
        sessionStore.deactivate(sessionId, SessionState.EXPIRED);
        log.debug("Session {} reached absolute expiry", maskSessionId(sessionId));
        return Optional.empty();
      }
    } catch (RuntimeException e) {
      log.error("Session validation failed for session: {}", maskSessionId(sessionId), e);
      return Optional.empty();
    }

    Duration idle = Duration.between(session.lastActivity(), now);
    if (idle.compareTo(idleTimeout) > 0) {
      log.debug("Session {} idle for {}s, still within absolute lifetime",
                maskSessionId(sessionId), idle.toSeconds());
    }

    String currentFingerprint = fingerprintService.generateFingerprint(request);
    String storedFingerprint = session.metadata() != null ? session.metadata().fingerprint() : null;
    if (storedFingerprint != null && !storedFingerprint.equals(currentFingerprint)) {
      session = flag(session, SuspicionReason.FINGERPRINT_MISMATCH.description(), now);
    }

    if (session.requestCount() > 0) {
      double minutesSinceCreated = Duration.between(session.createdAt(), now).toMillis() / 60_000.0;
      if (minutesSinceCreated > 0) {
        double requestsPerMinute = session.requestCount() / minutesSinceCreated;
        if (requestsPerMinute > suspiciousRequestThreshold) {
          session = flag(session, "%s: %.1f req/min".formatted(
              SuspicionReason.ABNORMAL_REQUEST_RATE.description(), requestsPerMinute), now);
        }
      }
    }

    Optional<Session> updated;
    try {
      updated = sessionStore.updateActivity(sessionId, request.getRequestURI(), now);
    } catch (RuntimeException e) {
      log.error("Could not record activity for session: {}", maskSessionId(sessionId), e);
      updated = Optional.empty();
    }

    if (updated.isPresent()) {
      Session result = updated.get();
      if (session.suspicious() && !result.suspicious()) {
        result = result.markSuspicious(session.suspiciousReason());
      }
      return Optional.of(result);
    }
    return Optional.of(session);
  }

  /**
   * Push the absolute expiry out to a full lifetime from now.
   *
   * @return the refreshed session, or empty if it is missing or no longer active
   */
  public Optional<Session> refresh(String sessionId) {
    if (!isValidSessionId(sessionId)) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    try {
      Optional<Session> stored = sessionStore.get(sessionId);
      if (stored.isEmpty() || !stored.get().isActiveAt(now)) {
        return Optional.empty();
      }
      Optional<Session> refreshed = sessionStore.extend(sessionId, now.plus(absoluteTimeout), now);
      refreshed.ifPresent(s -> log.debug("Refreshed session {} until {}", maskSessionId(sessionId), s.expiresAt()));
      return refreshed;
    } catch (RuntimeException e) {
      log.error("Session refresh failed for session: {}", maskSessionId(sessionId), e);
      return Optional.empty();
    }
  }

  /**
   * Log out a single session.
   *
   * @return true if an active session was ended by this call
   */
  public boolean end(String sessionId) {
    if (!isValidSessionId(sessionId)) {
      return false;
    }
    try {
      boolean ended = sessionStore.deactivate(sessionId, SessionState.LOGGED_OUT);
      if (ended) {
        log.info("Ended session {}", maskSessionId(sessionId));
      }
      return ended;
    } catch (RuntimeException e) {
      log.error("Could not end session: {}", maskSessionId(sessionId), e);
      return false;
    }
  }

  /**
   * Log out every session of a user, optionally keeping one.
   *
   * @return number of sessions ended
   * @throws SessionStoreException if the store is unreachable, so callers do not assume success
   */
  public int endAll(String userId, String exceptSessionId) {
    int count = sessionStore.deactivateAll(userId, exceptSessionId, SessionState.LOGGED_OUT);
    log.info("Ended {} session(s) for user {}{}", count, userId,
             exceptSessionId != null ? " keeping " + maskSessionId(exceptSessionId) : "");
    return count;
  }

  /**
   * End a session on behalf of its owner.
   *
   * @throws SessionException if the session does not exist
   * @throws AccessDeniedException if the session belongs to another user
   */
  public boolean endOwnedSession(String userId, String sessionId) {
    Session session = sessionStore.get(sessionId)
        .orElseThrow(() -> new SessionException("Session not found"));
    if (!session.userId().equals(userId)) {
      log.warn("User {} attempted to end session {} owned by another user", userId, maskSessionId(sessionId));
      throw new AccessDeniedException("Cannot end a session belonging to another user");
    }
    return end(sessionId);
  }

  public List<Session> listSessions(String userId, boolean activeOnly, int limit) {
    return sessionStore.listSessions(userId, activeOnly, limit, clock.instant());
  }

  /**
   * Read-only timing view of a session; never changes stored state.
   */
  public Optional<SessionStatus> getSessionStatus(String sessionId) {
    if (!isValidSessionId(sessionId)) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    return sessionStore.get(sessionId).map(session -> {
      long idleSeconds = Duration.between(session.lastActivity(), now).toSeconds();
      boolean idleWarning = idleSeconds > idleTimeout.toSeconds() * idleWarningRatio;
      long timeUntilExpiry = Duration.between(now, session.expiresAt()).toSeconds();
      return new SessionStatus(
          session.sessionId(),
          session.state(),
          session.isActiveAt(now),
          session.suspicious(),
          session.createdAt(),
          session.lastActivity(),
          session.expiresAt(),
          idleSeconds,
          idleWarning,
          timeUntilExpiry,
          session.requestCount(),
          session.metadata() != null ? session.metadata().deviceType() : null,
          session.metadata() != null ? session.metadata().browser() : null);
    });
  }

  /**
   * Hard-delete sessions whose expiry passed more than the retention grace ago.
   *
   * @return number of sessions deleted
   */
  public int cleanupExpiredSessions() {
    Instant cutoff = clock.instant().minus(retentionGrace);
    int deleted = sessionStore.deleteExpired(cutoff);
    if (deleted > 0) {
      log.info("Deleted {} session(s) expired before {}", deleted, cutoff);
    }
    return deleted;
  }

  private void evictOverBudget(String userId, Instant now) {
    int activeCount = sessionStore.countActive(userId, now);
    if (activeCount < maxConcurrentSessions) {
      return;
    }
    // Concurrent logins can push the count past the budget; evict enough to get back under it.
    int toEvict = activeCount - maxConcurrentSessions + 1;
    List<Session> active = sessionStore.listActive(userId, activeCount, now);
    List<Session> oldestFirst = active.subList(Math.max(0, active.size() - toEvict), active.size());
    for (int i = oldestFirst.size() - 1; i >= 0; i--) {
      Session oldest = oldestFirst.get(i);
      if (sessionStore.deactivate(oldest.sessionId(), SessionState.EVICTED)) {
        log.info("Evicted session {} for user {} (concurrent session limit {})",
                 maskSessionId(oldest.sessionId()), userId, maxConcurrentSessions);
      }
    }
  }

  private Session flag(Session session, String reason, Instant now) {
    log.warn("Suspicious activity on session {} for user {}: {}",
             maskSessionId(session.sessionId()), session.userId(), reason);
    try {
      sessionStore.flagSuspicious(session.sessionId(), reason, now);
    } catch (RuntimeException e) {
      log.error("Could not persist suspicious flag for session: {}", maskSessionId(session.sessionId()), e);
    }
    return session.markSuspicious(reason);
  }

  private String generateToken(String prefix) {
    byte[] randomBytes = new byte[TOKEN_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return prefix + Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
  }

  private boolean isValidSessionId(String sessionId) {
    return sessionId != null && !sessionId.isBlank() && sessionId.length() <= 128;
  }

  static String maskSessionId(String sessionId) {
    if (sessionId == null || sessionId.length() < 8) return "INVALID";
    return sessionId.substring(0, 8) + "...";
  }
}
