package com.company.watchdog.plugin;

import com.company.watchdog.domain.PurgeDecision;

import java.util.Map;

/**
 * Decides whether stored events of a checker should be trimmed after a check.
 */
public interface RowPurger {

    PurgeDecision identifyOld(String checkerName, Map<String, Object> extraConfig);
}
