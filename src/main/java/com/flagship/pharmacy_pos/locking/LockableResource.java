package com.flagship.pharmacy_pos.locking;

/**
 * Rows that may be locked by the coordinator. The table name is fixed here,
 * never taken from callers.
 */
public enum LockableResource {
    TERMINAL("terminals", "Terminal"),
    SESSION("cash_register_sessions", "Session"),
    USER("users", "User"),
    PRODUCT("products", "Product");

    private final String table;
    private final String displayName;

    LockableResource(String table, String displayName) {
        this.table = table;
        this.displayName = displayName;
    }

    public String getTable() {
        return table;
    }

    public String getDisplayName() {
        return displayName;
    }
}
