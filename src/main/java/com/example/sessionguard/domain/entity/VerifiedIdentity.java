package com.example.sessionguard.domain.entity;

/**
 * User identity taken from a verified bearer token.
 *
 * @param externalSessionId the identity provider's own session id, if the token carries one
 */
public record VerifiedIdentity(
    String userId,
    String externalSessionId
) {}
