package com.example.sessionguard;

import com.example.sessionguard.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Session Guard Application
 *
 * Session lifecycle and rate limiting service for horizontal scaling with:
 * - Redis for shared session state and rate limit counters
 * - In-memory counter fallback while Redis is unreachable
 * - Device fingerprinting for hijack detection
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class SessionGuardApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(SessionGuardApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
