package com.company.watchdog.domain.enums;

public enum CheckStatus {
    GOOD("Event count within the configured bounds"),
    BAD("Event count outside the configured bounds");

    private final String description;

    CheckStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static CheckStatus forCount(long count, long minNum, long maxNum) {
        return count < minNum || count > maxNum ? BAD : GOOD;
    }
}
