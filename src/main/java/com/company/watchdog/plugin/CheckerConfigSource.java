package com.company.watchdog.plugin;

import com.company.watchdog.domain.Checker;

import java.util.List;

/**
 * Where checkers come from: discovery of their names and loading of a parsed config.
 */
public interface CheckerConfigSource {

    List<String> listCheckerNames();

    /**
     * @throws com.company.watchdog.exception.ConfigParseException if the config is malformed
     */
    Checker load(String checkerName);
}
