package com.company.watchdog.plugin;

import com.company.watchdog.domain.CheckResult;

import java.util.Map;

/**
 * Reacts to a single check outcome, e.g. by alerting on BAD results.
 * Exceptions thrown here abort the rest of the checker's pass.
 */
public interface CheckHandler {

    void handle(CheckResult result, Map<String, Object> extraConfig);
}
