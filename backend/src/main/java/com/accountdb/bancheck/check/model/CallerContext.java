package com.accountdb.bancheck.check.model;

import java.util.Locale;

public record CallerContext(long ownerId, boolean admin) {
    public static final String ADMIN_ROLE = "admin";

    public static CallerContext of(long ownerId, String role) {
        boolean admin = role != null && ADMIN_ROLE.equals(role.trim().toLowerCase(Locale.ROOT));
        return new CallerContext(ownerId, admin);
    }

    public boolean canRead(long taskOwnerId) {
        return admin || ownerId == taskOwnerId;
    }
}
