package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

/**
 * Decoder for the bearer tokens issued by the identity provider. A session is only ever created
 * for the subject of a token this decoder accepts.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class JwtDecoderConfig {

  static final String HMAC_SHA_256 = "HmacSHA256";

  private final ApplicationProperties properties;

  @Bean
  public JwtDecoder jwtDecoder() {
    return buildDecoder(properties.auth());
  }

  static JwtDecoder buildDecoder(ApplicationProperties.AuthProperties auth) {
    NimbusJwtDecoder decoder;
    if (hasText(auth.jwksUri())) {
      log.info("Verifying bearer tokens against JWK set {}", auth.jwksUri());
      decoder = NimbusJwtDecoder
          .withJwkSetUri(auth.jwksUri())
          .jwsAlgorithm(SignatureAlgorithm.RS256)
          .build();
    } else if (hasText(auth.secret())) {
      log.info("Verifying bearer tokens with the shared HS256 secret");
      SecretKeySpec key = new SecretKeySpec(auth.secret().getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
      decoder = NimbusJwtDecoder
          .withSecretKey(key)
          .macAlgorithm(MacAlgorithm.HS256)
          .build();
    } else {
      throw new IllegalStateException("Either 'app.auth.jwks-uri' or 'app.auth.secret' must be configured");
    }

    List<OAuth2TokenValidator<Jwt>> validators = new ArrayList<>();
    validators.add(new JwtTimestampValidator(auth.clockSkew()));
    if (hasText(auth.issuerUri())) {
      validators.add(new JwtIssuerValidator(auth.issuerUri()));
    }
    if (hasText(auth.audience())) {
      validators.add(jwt -> {
        List<String> aud = jwt.getAudience();
        return (aud != null && aud.contains(auth.audience()))
            ? OAuth2TokenValidatorResult.success()
            : OAuth2TokenValidatorResult.failure(new OAuth2Error("invalid_token", "Invalid audience", null));
      });
    }
    validators.add(jwt -> hasText(jwt.getClaimAsString(auth.userIdClaim()))
        ? OAuth2TokenValidatorResult.success()
        : OAuth2TokenValidatorResult.failure(
            new OAuth2Error("invalid_token", "Missing claim " + auth.userIdClaim(), null)));

    decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(validators));
    return decoder;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
