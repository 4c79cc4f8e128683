package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ApiPath.*;

import com.example.sessionguard.domain.entity.SessionPrincipal;
import com.example.sessionguard.domain.entity.SessionStatus;
import com.example.sessionguard.web.rest.dto.SessionSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Session management API for the authenticated caller's own sessions.
 */
@Tag(
    name = "Session Management",
    description = "Inspect, refresh and end the caller's sessions"
)
@RequestMapping(
    value = API_BASE + SESSIONS,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Current session status",
      description = "Timing view of the current session including the idle warning flag"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session status returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = CURRENT)
  ResponseEntity<SessionStatus> getCurrentSession(@Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);

  @Operation(
      summary = "Refresh session",
      description = "Extends the current session to a full absolute lifetime from now"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session refreshed"),
      @ApiResponse(responseCode = "401", description = "Session no longer active")
  })
  @PostMapping(value = REFRESH)
  ResponseEntity<Map<String, Object>> refresh(@Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);

  @Operation(summary = "Log out", description = "Ends the current session and clears the session cookie")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Logged out")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<Map<String, Object>> logout(@Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal);

  @Operation(summary = "Log out everywhere", description = "Ends all of the caller's sessions, optionally keeping the current one")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions ended"),
      @ApiResponse(responseCode = "503", description = "Session store unavailable")
  })
  @PostMapping(value = LOGOUT_ALL)
  ResponseEntity<Map<String, Object>> logoutAll(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal,
      @RequestParam(defaultValue = "true") boolean keepCurrent);

  @Operation(summary = "List sessions", description = "Caller's sessions, newest first")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions returned"),
      @ApiResponse(responseCode = "400", description = "Invalid limit")
  })
  @GetMapping(value = LIST)
  ResponseEntity<List<SessionSummary>> listSessions(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal,
      @RequestParam(defaultValue = "true") boolean activeOnly,
      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit);

  @Operation(summary = "End a session", description = "Ends one of the caller's other sessions")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session ended"),
      @ApiResponse(responseCode = "401", description = "Session not found"),
      @ApiResponse(responseCode = "403", description = "Session belongs to another user")
  })
  @DeleteMapping(value = SESSION_ID)
  ResponseEntity<Map<String, Object>> endSession(
      @Parameter(hidden = true) @AuthenticationPrincipal SessionPrincipal principal,
      @PathVariable String sessionId);
}
