package com.collection.mint.audit;

/**
 * Types of notifications emitted by successful contract calls.
 */
public enum AuditAction {
    TOKENS_MINTED,
    PARAMETER_UPDATED,
    ROLE_GRANTED,
    ROLE_REVOKED,
    WITHDRAWAL_SUBMITTED,
    WITHDRAWAL_CONFIRMED,
    WITHDRAWAL_REVOKED,
    WITHDRAWAL_EXECUTED,
    RELAY_MINTED
}
