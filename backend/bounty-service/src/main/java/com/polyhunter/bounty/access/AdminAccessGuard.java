package com.polyhunter.bounty.access;

import com.polyhunter.bounty.entity.AdminRole;
import com.polyhunter.bounty.exception.AccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Turns the identity headers set by the gateway into a principal and enforces a minimum role
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAccessGuard {

    public static final String ADMIN_ID_HEADER = "X-Admin-Id";
    public static final String ADMIN_ROLE_HEADER = "X-Admin-Role";

    private final AccessPolicy accessPolicy;

    public AdminPrincipal require(UUID adminId, String roleHeader, AdminRole minRole) {
        AdminPrincipal principal = new AdminPrincipal(adminId, AdminRole.fromValue(roleHeader));
        if (adminId == null || !accessPolicy.hasRole(principal, minRole)) {
            log.warn("Admin {} with role {} denied; {} required", adminId, roleHeader, minRole.getValue());
            throw new AccessDeniedException("Requires " + minRole.getValue() + " role");
        }
        return principal;
    }
}
