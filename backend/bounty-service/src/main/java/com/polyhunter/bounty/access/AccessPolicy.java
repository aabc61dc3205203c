package com.polyhunter.bounty.access;

import com.polyhunter.bounty.entity.AdminRole;

/**
 * Decides whether an admin holds at least a given role
 */
public interface AccessPolicy {

    boolean hasRole(AdminPrincipal actor, AdminRole minRole);
}
