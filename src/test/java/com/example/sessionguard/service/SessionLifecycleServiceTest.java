package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.DeviceType;
import com.example.sessionguard.domain.entity.Session;
import com.example.sessionguard.domain.entity.SessionMetadata;
import com.example.sessionguard.domain.entity.SessionState;
import com.example.sessionguard.domain.entity.SessionStatus;
import com.example.sessionguard.domain.entity.SuspicionReason;
import com.example.sessionguard.exception.SessionException;
import com.example.sessionguard.exception.SessionStoreException;
import com.example.sessionguard.properties.ApplicationProperties;
import com.example.sessionguard.support.InMemorySessionStore;
import com.example.sessionguard.support.MutableClock;
import com.example.sessionguard.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.access.AccessDeniedException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionLifecycleServiceTest {

  private static final String USER = "user-42";
  private static final String CHROME_UA =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 Chrome/120.0 Safari/537.36";
  private static final String FIREFOX_UA =
      "Mozilla/5.0 (X11; Linux x86_64; rv:121.0) Gecko/20100101 Firefox/121.0";

  private InMemorySessionStore store;
  private MutableClock clock;
  private FingerprintService fingerprintService;
  private SessionLifecycleService service;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionStore();
    clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
    ApplicationProperties properties = TestProperties.defaults();
    fingerprintService = new FingerprintService(properties);
    service = new SessionLifecycleService(store, fingerprintService, properties, clock);
  }

  @Test
  void create_returnsActiveSessionWithAbsoluteExpiry() {
    Session session = service.create(USER, "ext-1", request(CHROME_UA));

    assertTrue(session.sessionId().startsWith("sess_"));
    assertTrue(session.csrfToken().startsWith("csrf_"));
    assertEquals(USER, session.userId());
    assertEquals("ext-1", session.externalSessionId());
    assertEquals(SessionState.ACTIVE, session.state());
    assertEquals(clock.instant(), session.createdAt());
    assertEquals(clock.instant().plus(Duration.ofHours(12)), session.expiresAt());
    assertEquals(0, session.requestCount());
    assertFalse(session.suspicious());
    assertEquals(DeviceType.DESKTOP, session.metadata().deviceType());
    assertEquals("Chrome", session.metadata().browser());
    assertEquals("Windows", session.metadata().os());
    assertEquals(16, session.metadata().fingerprint().length());
    assertTrue(store.get(session.sessionId()).isPresent());
  }

  @Test
  void create_generatesDistinctIds() {
    Session first = service.create(USER, null, request(CHROME_UA));
    Session second = service.create(USER, null, request(CHROME_UA));

    assertNotEquals(first.sessionId(), second.sessionId());
    assertNotEquals(first.csrfToken(), second.csrfToken());
  }

  @Test
  void create_rejectsBlankUserId() {
    assertThrows(IllegalArgumentException.class, () -> service.create(" ", null, request(CHROME_UA)));
  }

  @Test
  void establish_resumesSameClientSessionInsteadOfCreatingNew() {
    Session first = service.establish(USER, "ext-1", request(CHROME_UA));
    Session latest = first;
    for (int i = 0; i < 20; i++) {
      clock.advance(Duration.ofSeconds(5));
      latest = service.establish(USER, "ext-1", request(CHROME_UA));
    }

    assertEquals(first.sessionId(), latest.sessionId());
    assertEquals(1, store.size());
    assertEquals(1, store.countActive(USER, clock.instant()));
    assertEquals(20, store.get(first.sessionId()).orElseThrow().requestCount());
  }

  @Test
  void establish_createsSessionForDifferentClient() {
    Session desktop = service.establish(USER, null, request(CHROME_UA));
    Session laptop = service.establish(USER, null, request(FIREFOX_UA));

    assertNotEquals(desktop.sessionId(), laptop.sessionId());
    assertEquals(2, store.countActive(USER, clock.instant()));
  }

  @Test
  void establish_doesNotResumeSessionPastAbsoluteExpiry() {
    Session first = service.establish(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofHours(13));

    Session next = service.establish(USER, null, request(CHROME_UA));

    assertNotEquals(first.sessionId(), next.sessionId());
  }

  @Test
  void create_evictsOldestSessionWhenAtLimit() {
    List<Session> created = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      created.add(service.create(USER, null, request(CHROME_UA)));
      clock.advance(Duration.ofSeconds(1));
    }

    Session sixth = service.create(USER, null, request(CHROME_UA));

    assertEquals(SessionState.EVICTED, store.get(created.get(0).sessionId()).orElseThrow().state());
    for (int i = 1; i < 5; i++) {
      assertEquals(SessionState.ACTIVE, store.get(created.get(i).sessionId()).orElseThrow().state());
    }
    assertEquals(SessionState.ACTIVE, sixth.state());
    assertEquals(5, store.countActive(USER, clock.instant()));
  }

  @Test
  void create_evictsDownToBudgetWhenAlreadyOverLimit() {
    Instant base = clock.instant().minus(Duration.ofMinutes(10));
    for (int i = 0; i < 7; i++) {
      store.put(session("sess_over_" + i, base.plusSeconds(i), 0, null));
    }

    service.create(USER, null, request(CHROME_UA));

    assertEquals(5, store.countActive(USER, clock.instant()));
    for (int i = 0; i < 3; i++) {
      assertEquals(SessionState.EVICTED, store.get("sess_over_" + i).orElseThrow().state());
    }
    assertEquals(SessionState.ACTIVE, store.get("sess_over_3").orElseThrow().state());
  }

  @Test
  void create_doesNotCountOtherUsersSessions() {
    for (int i = 0; i < 5; i++) {
      service.create("someone-else", null, request(CHROME_UA));
    }

    service.create(USER, null, request(CHROME_UA));

    assertEquals(5, store.countActive("someone-else", clock.instant()));
    assertEquals(1, store.countActive(USER, clock.instant()));
  }

  @Test
  void create_propagatesStoreFailure() {
    store.setUnavailable(true);

    assertThrows(SessionStoreException.class, () -> service.create(USER, null, request(CHROME_UA)));
  }

  @Test
  void validate_recordsActivity() {
    Session session = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofSeconds(30));

    Optional<Session> validated = service.validate(session.sessionId(), request(CHROME_UA));

    assertTrue(validated.isPresent());
    assertEquals(1, validated.get().requestCount());
    assertEquals("/api/v1/books", validated.get().lastEndpoint());
    assertEquals(clock.instant(), validated.get().lastActivity());
    assertFalse(validated.get().suspicious());
  }

  @Test
  void validate_unknownOrMalformedSession_returnsEmpty() {
    assertTrue(service.validate("sess_missing", request(CHROME_UA)).isEmpty());
    assertTrue(service.validate("", request(CHROME_UA)).isEmpty());
    assertTrue(service.validate(null, request(CHROME_UA)).isEmpty());
  }

  @Test
  void validate_afterAbsoluteExpiry_marksSessionExpired() {
    Session session = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofHours(12));

    assertTrue(service.validate(session.sessionId(), request(CHROME_UA)).isEmpty());
    assertEquals(SessionState.EXPIRED, store.get(session.sessionId()).orElseThrow().state());
  }

  @Test
  void validate_idleBeyondTimeout_isStillAccepted() {
    Session session = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofMinutes(31));

    assertTrue(service.validate(session.sessionId(), request(CHROME_UA)).isPresent());
  }

  @Test
  void validate_endedSession_returnsEmpty() {
    Session session = service.create(USER, null, request(CHROME_UA));
    service.end(session.sessionId());

    assertTrue(service.validate(session.sessionId(), request(CHROME_UA)).isEmpty());
  }

  @Test
  void validate_fingerprintMismatch_flagsButAllows() {
    Session session = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofSeconds(5));

    Optional<Session> validated = service.validate(session.sessionId(), request(FIREFOX_UA));

    assertTrue(validated.isPresent());
    assertTrue(validated.get().suspicious());
    assertEquals(SuspicionReason.FINGERPRINT_MISMATCH.description(), validated.get().suspiciousReason());
    assertTrue(store.get(session.sessionId()).orElseThrow().suspicious());
  }

  @Test
  void validate_sameSignals_keepsFingerprintStable() {
    Session session = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofSeconds(5));

    assertFalse(service.validate(session.sessionId(), request(CHROME_UA)).orElseThrow().suspicious());
    clock.advance(Duration.ofSeconds(5));
    assertFalse(service.validate(session.sessionId(), request(CHROME_UA)).orElseThrow().suspicious());
  }

  @Test
  void validate_abnormalRequestRate_flagsButAllows() {
    String fingerprint = fingerprintService.generateFingerprint(request(CHROME_UA));
    store.put(session("sess_busy_session", clock.instant().minus(Duration.ofMinutes(1)), 500, fingerprint));

    Optional<Session> validated = service.validate("sess_busy_session", request(CHROME_UA));

    assertTrue(validated.isPresent());
    assertTrue(validated.get().suspicious());
    assertTrue(validated.get().suspiciousReason().startsWith(SuspicionReason.ABNORMAL_REQUEST_RATE.description()));
    assertEquals(501, validated.get().requestCount());
  }

  @Test
  void validate_normalRequestRate_isNotFlagged() {
    String fingerprint = fingerprintService.generateFingerprint(request(CHROME_UA));
    store.put(session("sess_calm_session", clock.instant().minus(Duration.ofMinutes(10)), 500, fingerprint));

    assertFalse(service.validate("sess_calm_session", request(CHROME_UA)).orElseThrow().suspicious());
  }

  @Test
  void validate_storeUnavailable_returnsEmpty() {
    Session session = service.create(USER, null, request(CHROME_UA));
    store.setUnavailable(true);

    assertTrue(service.validate(session.sessionId(), request(CHROME_UA)).isEmpty());
  }

  @Test
  void refresh_extendsExpiryFromNow() {
    Session session = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofHours(3));

    Session refreshed = service.refresh(session.sessionId()).orElseThrow();

    assertEquals(clock.instant().plus(Duration.ofHours(12)), refreshed.expiresAt());
    assertEquals(clock.instant(), refreshed.lastActivity());
  }

  @Test
  void refresh_endedOrExpiredSession_returnsEmpty() {
    Session ended = service.create(USER, null, request(CHROME_UA));
    service.end(ended.sessionId());
    Session expired = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofHours(13));

    assertTrue(service.refresh(ended.sessionId()).isEmpty());
    assertTrue(service.refresh(expired.sessionId()).isEmpty());
    assertTrue(service.refresh("sess_missing").isEmpty());
  }

  @Test
  void end_isIdempotent() {
    Session session = service.create(USER, null, request(CHROME_UA));

    assertTrue(service.end(session.sessionId()));
    assertFalse(service.end(session.sessionId()));
    assertEquals(SessionState.LOGGED_OUT, store.get(session.sessionId()).orElseThrow().state());
  }

  @Test
  void end_storeUnavailable_returnsFalse() {
    Session session = service.create(USER, null, request(CHROME_UA));
    store.setUnavailable(true);

    assertFalse(service.end(session.sessionId()));
  }

  @Test
  void endAll_keepsExceptedSession() {
    Session first = service.create(USER, null, request(CHROME_UA));
    Session second = service.create(USER, null, request(CHROME_UA));
    Session third = service.create(USER, null, request(CHROME_UA));

    int ended = service.endAll(USER, second.sessionId());

    assertEquals(2, ended);
    assertEquals(SessionState.LOGGED_OUT, store.get(first.sessionId()).orElseThrow().state());
    assertEquals(SessionState.ACTIVE, store.get(second.sessionId()).orElseThrow().state());
    assertEquals(SessionState.LOGGED_OUT, store.get(third.sessionId()).orElseThrow().state());
  }

  @Test
  void endAll_withoutException_endsEverySession() {
    service.create(USER, null, request(CHROME_UA));
    service.create(USER, null, request(CHROME_UA));

    assertEquals(2, service.endAll(USER, null));
    assertEquals(0, store.countActive(USER, clock.instant()));
  }

  @Test
  void endOwnedSession_rejectsForeignAndUnknownSessions() {
    Session foreign = service.create("intruder-target", null, request(CHROME_UA));

    assertThrows(AccessDeniedException.class, () -> service.endOwnedSession(USER, foreign.sessionId()));
    assertThrows(SessionException.class, () -> service.endOwnedSession(USER, "sess_missing"));
    assertEquals(SessionState.ACTIVE, store.get(foreign.sessionId()).orElseThrow().state());
  }

  @Test
  void endOwnedSession_endsCallersSession() {
    Session session = service.create(USER, null, request(CHROME_UA));

    assertTrue(service.endOwnedSession(USER, session.sessionId()));
  }

  @Test
  void listSessions_newestFirstAndFiltered() {
    Session older = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofMinutes(1));
    Session newer = service.create(USER, null, request(CHROME_UA));
    service.end(older.sessionId());

    List<Session> all = service.listSessions(USER, false, 10);
    List<Session> active = service.listSessions(USER, true, 10);

    assertEquals(List.of(newer.sessionId(), older.sessionId()), all.stream().map(Session::sessionId).toList());
    assertEquals(List.of(newer.sessionId()), active.stream().map(Session::sessionId).toList());
  }

  @Test
  void getSessionStatus_reportsIdleWarningAfterThreshold() {
    Session session = service.create(USER, null, request(CHROME_UA));

    clock.advance(Duration.ofMinutes(10));
    SessionStatus early = service.getSessionStatus(session.sessionId()).orElseThrow();
    assertFalse(early.idleWarning());
    assertEquals(600, early.idleSeconds());

    clock.advance(Duration.ofMinutes(15));
    SessionStatus late = service.getSessionStatus(session.sessionId()).orElseThrow();
    assertTrue(late.idleWarning());
    assertTrue(late.active());
    assertEquals(Duration.ofHours(12).minus(Duration.ofMinutes(25)).toSeconds(), late.timeUntilExpirySeconds());
  }

  @Test
  void getSessionStatus_doesNotChangeStoredState() {
    Session session = service.create(USER, null, request(CHROME_UA));
    clock.advance(Duration.ofHours(13));

    SessionStatus status = service.getSessionStatus(session.sessionId()).orElseThrow();

    assertFalse(status.active());
    assertTrue(status.timeUntilExpirySeconds() < 0);
    assertEquals(SessionState.ACTIVE, store.get(session.sessionId()).orElseThrow().state());
    assertTrue(service.getSessionStatus("sess_missing").isEmpty());
  }

  @Test
  void cleanupExpiredSessions_deletesOnlyPastRetentionGrace() {
    Instant now = clock.instant();
    store.put(new Session("sess_long_gone", "csrf_a", USER, null, null,
                          now.minus(Duration.ofHours(40)), now.minus(Duration.ofHours(30)),
                          now.minus(Duration.ofHours(25)), SessionState.EXPIRED, false, null, 0, null));
    store.put(new Session("sess_recently_gone", "csrf_b", USER, null, null,
                          now.minus(Duration.ofHours(13)), now.minus(Duration.ofHours(2)),
                          now.minus(Duration.ofHours(1)), SessionState.ACTIVE, false, null, 0, null));

    assertEquals(1, service.cleanupExpiredSessions());
    assertTrue(store.get("sess_long_gone").isEmpty());
    assertTrue(store.get("sess_recently_gone").isPresent());
  }

  private MockHttpServletRequest request(String userAgent) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/books");
    request.addHeader("User-Agent", userAgent);
    request.addHeader("Accept-Language", "en-US,en;q=0.9");
    request.addHeader("Accept-Encoding", "gzip, deflate");
    request.setRemoteAddr("10.1.2.4");
    return request;
  }

  private Session session(String sessionId, Instant createdAt, long requestCount, String fingerprint) {
    SessionMetadata metadata = new SessionMetadata("10.1.2.4", CHROME_UA, DeviceType.DESKTOP,
                                                   "Chrome", "Windows", fingerprint);
    return new Session(sessionId, "csrf_" + sessionId, USER, null, metadata, createdAt, createdAt,
                       createdAt.plus(Duration.ofHours(12)), SessionState.ACTIVE, false, null,
                       requestCount, null);
  }
}
