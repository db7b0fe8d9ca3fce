package com.collection.mint.access;

import com.collection.mint.core.model.Address;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Role grants keyed by address. A check for a role passes when the caller
 * holds that role or any role above it.
 *
 * <p>Grants are read from view calls on any thread, so access is synchronized.</p>
 */
public class AccessControl {

    private final Map<Address, EnumSet<Role>> grants = new HashMap<>();

    public AccessControl(Address admin) {
        Objects.requireNonNull(admin, "admin is required");
        grant(Role.ADMIN, admin);
    }

    /**
     * @return true if the role was newly granted
     */
    public synchronized boolean grant(Role role, Address account) {
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(account, "account is required");
        return grants.computeIfAbsent(account, a -> EnumSet.noneOf(Role.class)).add(role);
    }

    /**
     * @return true if the role was held and is now removed
     */
    public synchronized boolean revoke(Role role, Address account) {
        EnumSet<Role> held = grants.get(account);
        if (held == null || !held.remove(role)) {
            return false;
        }
        if (held.isEmpty()) {
            grants.remove(account);
        }
        return true;
    }

    public synchronized boolean hasRole(Role required, Address account) {
        EnumSet<Role> held = grants.get(account);
        if (held == null) {
            return false;
        }
        for (Role role : held) {
            if (role.hasPermission(required)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Roles granted directly to the account, without the hierarchy applied.
     */
    public synchronized Set<Role> rolesOf(Address account) {
        EnumSet<Role> held = grants.get(account);
        return held == null ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(held));
    }

    /**
     * @throws CollectionException with {@link ErrorCode#UNAUTHORIZED} if the account lacks the role
     */
    public void requireRole(Role required, Address account) {
        if (!hasRole(required, account)) {
            throw new CollectionException(ErrorCode.UNAUTHORIZED,
                    "Account " + account + " is missing role " + required);
        }
    }
}
