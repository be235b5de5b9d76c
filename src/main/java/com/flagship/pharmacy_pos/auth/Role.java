package com.flagship.pharmacy_pos.auth;

import java.util.EnumSet;
import java.util.Set;

public enum Role {
    CASHIER,
    QF,
    WAREHOUSE,
    MANAGER,
    ADMIN,
    GERENTE_GENERAL,
    /** Any role string this service does not know; never eligible for approvals. */
    OTHER;

    /** May approve an authorized open or a large price change. */
    public static final Set<Role> SUPERVISOR_ROLES = EnumSet.of(MANAGER, ADMIN, GERENTE_GENERAL);

    /** May unlock accounts. */
    public static final Set<Role> ADMIN_ROLES = EnumSet.of(ADMIN, GERENTE_GENERAL);

    public static Role parse(String code) {
        if (code == null) {
            return OTHER;
        }
        try {
            return Role.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
