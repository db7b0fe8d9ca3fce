package com.collection.mint.access;

import com.collection.mint.core.model.Address;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AccessControl Tests")
class AccessControlTest {

    private static final Address ADMIN = Address.of("0x00000000000000000000000000000000000000ad");
    private static final Address OPERATOR = Address.of("0x0000000000000000000000000000000000000001");
    private static final Address STRANGER = Address.of("0x00000000000000000000000000000000000000ff");

    @Nested
    @DisplayName("Role hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("ADMIN should satisfy OPERATOR checks but not the reverse")
        void adminSatisfiesOperator() {
            assertTrue(Role.ADMIN.hasPermission(Role.OPERATOR));
            assertTrue(Role.OPERATOR.hasPermission(Role.OPERATOR));
            assertFalse(Role.OPERATOR.hasPermission(Role.ADMIN));
        }
    }

    @Nested
    @DisplayName("Grants")
    class Grants {

        @Test
        @DisplayName("Admin given at construction should hold ADMIN and pass OPERATOR checks")
        void constructorAdmin() {
            AccessControl access = new AccessControl(ADMIN);

            assertTrue(access.hasRole(Role.ADMIN, ADMIN));
            assertTrue(access.hasRole(Role.OPERATOR, ADMIN));
            assertEquals(Set.of(Role.ADMIN), access.rolesOf(ADMIN));
        }

        @Test
        @DisplayName("Grant and revoke should report whether anything changed")
        void grantRevoke() {
            AccessControl access = new AccessControl(ADMIN);

            assertTrue(access.grant(Role.OPERATOR, OPERATOR));
            assertFalse(access.grant(Role.OPERATOR, OPERATOR));
            assertTrue(access.hasRole(Role.OPERATOR, OPERATOR));
            assertFalse(access.hasRole(Role.ADMIN, OPERATOR));

            assertTrue(access.revoke(Role.OPERATOR, OPERATOR));
            assertFalse(access.revoke(Role.OPERATOR, OPERATOR));
            assertFalse(access.hasRole(Role.OPERATOR, OPERATOR));
            assertTrue(access.rolesOf(OPERATOR).isEmpty());
        }

        @Test
        @DisplayName("requireRole should fail with UNAUTHORIZED")
        void requireRole() {
            AccessControl access = new AccessControl(ADMIN);

            CollectionException ex = assertThrows(CollectionException.class,
                    () -> access.requireRole(Role.OPERATOR, STRANGER));
            assertEquals(ErrorCode.UNAUTHORIZED, ex.getErrorCode());
            assertDoesNotThrow(() -> access.requireRole(Role.ADMIN, ADMIN));
        }
    }
}
