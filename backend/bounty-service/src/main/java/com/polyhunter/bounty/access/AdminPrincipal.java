package com.polyhunter.bounty.access;

import com.polyhunter.bounty.entity.AdminRole;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

/**
 * Already-authenticated admin making a call
 */
@Data
@AllArgsConstructor
public class AdminPrincipal {

    private UUID id;
    private AdminRole role;
}
