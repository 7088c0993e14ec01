package com.chatbridge.auth.service;

import com.chatbridge.auth.dto.VerifiedIdentity;

/**
 * Turns a client-supplied token into an identity.
 * Token issuance lives outside this service.
 */
public interface IdentityVerifier {

    /**
     * @throws com.chatbridge.exception.UnauthenticatedException if the token is not acceptable
     */
    VerifiedIdentity verify(String token);
}
