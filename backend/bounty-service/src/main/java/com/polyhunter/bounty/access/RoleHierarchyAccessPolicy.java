package com.polyhunter.bounty.access;

import com.polyhunter.bounty.entity.AdminRole;
import org.springframework.stereotype.Component;

/**
 * reviewer < admin < super_admin
 */
@Component
public class RoleHierarchyAccessPolicy implements AccessPolicy {

    @Override
    public boolean hasRole(AdminPrincipal actor, AdminRole minRole) {
        if (actor == null || actor.getRole() == null) {
            return false;
        }
        return actor.getRole().getLevel() >= minRole.getLevel();
    }
}
