package com.scriptohio.orchestrator.model;

public enum PermissionLevel {
    READ_ONLY,
    READ_EXECUTE,
    READ_EXECUTE_WRITE,
    ADMIN;

    public boolean permits(PermissionLevel required) {
        return permits(this, required);
    }

    // null on either side denies
    public static boolean permits(PermissionLevel held, PermissionLevel required) {
        if (held == null || required == null) {
            return false;
        }
        return held.ordinal() >= required.ordinal();
    }

    public static PermissionLevel parse(Object value) {
        if (value instanceof PermissionLevel level) {
            return level;
        }
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.toString().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
