package com.polyhunter.bounty.access;

import com.polyhunter.bounty.entity.AdminRole;
import com.polyhunter.bounty.exception.AccessDeniedException;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdminAccessGuardTest {

    private final AdminAccessGuard guard = new AdminAccessGuard(new RoleHierarchyAccessPolicy());
    private final UUID adminId = UUID.randomUUID();

    @Test
    void higherRolesSatisfyLowerRequirements() {
        assertThat(guard.require(adminId, "super_admin", AdminRole.REVIEWER).getRole()).isEqualTo(AdminRole.SUPER_ADMIN);
        assertThat(guard.require(adminId, "admin", AdminRole.ADMIN).getId()).isEqualTo(adminId);
    }

    @Test
    void lowerRoleIsDenied() {
        assertThatThrownBy(() -> guard.require(adminId, "reviewer", AdminRole.ADMIN))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessage("Requires admin role");
    }

    @Test
    void unknownOrMissingRoleIsDenied() {
        assertThatThrownBy(() -> guard.require(adminId, "owner", AdminRole.REVIEWER))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> guard.require(adminId, null, AdminRole.REVIEWER))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> guard.require(null, "super_admin", AdminRole.REVIEWER))
                .isInstanceOf(AccessDeniedException.class);
    }
}
