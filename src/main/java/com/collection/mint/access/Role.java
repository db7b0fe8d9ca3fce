package com.collection.mint.access;

/**
 * Privileged roles of a collection contract.
 * Roles are hierarchical: ADMIN > OPERATOR.
 */
public enum Role {

    /** Operator mints, withdrawal proposals and confirmations. */
    OPERATOR,

    /** Everything an operator may do, plus setters, role grants and withdrawal execution. */
    ADMIN;

    /**
     * Returns true if this role has sufficient privilege for the required role.
     */
    public boolean hasPermission(Role required) {
        return this.ordinal() >= required.ordinal();
    }
}
