package com.scanops.scope;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * The authenticated principal behind a request. Authentication happens upstream; this core only sees
 * the resolved user id and role.
 */
public record Caller(String userId, String role) {

    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_ENGINEER = "ENGINEER";

    public Caller {
        role = StringUtils.hasText(role) ? role.trim().toUpperCase(Locale.ROOT) : ROLE_ENGINEER;
    }

    public static Caller admin(String userId) {
        return new Caller(userId, ROLE_ADMIN);
    }

    public static Caller engineer(String userId) {
        return new Caller(userId, ROLE_ENGINEER);
    }

    public boolean elevated() {
        return ROLE_ADMIN.equals(role);
    }

    public boolean owns(String ownerId) {
        return userId != null && userId.equals(ownerId);
    }

    /**
     * Owners see their own resources; ADMIN sees everything.
     */
    public boolean canAccess(String ownerId) {
        return elevated() || owns(ownerId);
    }
}
