package com.example.sessionguard.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Session paths
    public static final String SESSIONS = "/sessions";
    public static final String CURRENT = "/current";
    public static final String REFRESH = "/refresh";
    public static final String LOGOUT = "/logout";
    public static final String LOGOUT_ALL = "/logout-all";
    public static final String LIST = "/list";
    public static final String SESSION_ID = "/{sessionId}";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
