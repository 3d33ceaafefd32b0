package com.lumis.invoiceingest.infrastructure.adapters;

final class ColumnLimits {

    static final int ERROR_MESSAGE = 4000;

    private ColumnLimits() {}

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max - 3) + "...";
    }
}
