package com.company.watchdog.exception;

public class CheckerNotFoundException extends RuntimeException {
    public CheckerNotFoundException(String checkerName) {
        super("Checker not found: " + checkerName);
    }
}
