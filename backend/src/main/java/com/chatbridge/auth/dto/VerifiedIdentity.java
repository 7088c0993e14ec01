package com.chatbridge.auth.dto;

/**
 * Identity established from a verified token.
 */
public record VerifiedIdentity(String userId, String displayName) {
}
