package com.healthmonitor.core.repository;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromValue(String value) {
        return SortOrder.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
