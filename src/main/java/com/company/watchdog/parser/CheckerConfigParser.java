package com.company.watchdog.parser;

import com.company.watchdog.domain.Checker;
import com.company.watchdog.domain.QueryDetails;
import com.company.watchdog.domain.Requirement;
import com.company.watchdog.exception.ConfigParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the text of a {@code .dwmon} checker config.
 *
 * <pre>
 * __QUERY__
 * SELECT id AS dwmon_unique_key, created_at AS dwmon_timestamp FROM applications
 * __REQUIREMENTS__
 * CHECKHOURS9-17 CHECKMINUTES0-59 WEEKDAYS MINNUM1 MAXNUM100 LOOKBACKSECONDS3600
 * __SOURCE__
 * warehouse
 * __EXTRA__
 * {"owner": "growth"}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class CheckerConfigParser {

    static final String QUERY_SENTINEL = "__QUERY__";
    static final String REQUIREMENTS_SENTINEL = "__REQUIREMENTS__";
    static final String SOURCE_SENTINEL = "__SOURCE__";
    static final String EXTRA_SENTINEL = "__EXTRA__";
    static final String UNIQUE_KEY_SENTINEL = "dwmon_unique_key";
    static final String TIMESTAMP_SENTINEL = "dwmon_timestamp";

    static final int MAX_CHECKER_NAME_LENGTH = 100;

    private static final List<String> REQUIRED_SENTINELS = List.of(
            QUERY_SENTINEL, REQUIREMENTS_SENTINEL, UNIQUE_KEY_SENTINEL,
            TIMESTAMP_SENTINEL, SOURCE_SENTINEL, EXTRA_SENTINEL);

    private static final TypeReference<Map<String, Object>> EXTRA_TYPE = new TypeReference<>() {
    };

    private final RequirementParser requirementParser;
    private final ObjectMapper objectMapper;

    public Checker parse(String checkerName, String configText) {
        if (checkerName == null || checkerName.isEmpty() || checkerName.length() >= MAX_CHECKER_NAME_LENGTH) {
            throw new ConfigParseException("Checker name must be 1 to "
                    + (MAX_CHECKER_NAME_LENGTH - 1) + " characters: " + checkerName);
        }

        for (String sentinel : REQUIRED_SENTINELS) {
            if (!configText.contains(sentinel)) {
                throw new ConfigParseException("Expected " + sentinel);
            }
        }

        int queryAt = configText.indexOf(QUERY_SENTINEL);
        int requirementsAt = configText.indexOf(REQUIREMENTS_SENTINEL, queryAt);
        int sourceAt = requirementsAt < 0 ? -1 : configText.indexOf(SOURCE_SENTINEL, requirementsAt);
        int extraAt = sourceAt < 0 ? -1 : configText.indexOf(EXTRA_SENTINEL, sourceAt);
        if (requirementsAt < 0 || sourceAt < 0 || extraAt < 0) {
            throw new ConfigParseException("Config parse failed for checker " + checkerName
                    + ": sections must appear in the order "
                    + String.join(", ", QUERY_SENTINEL, REQUIREMENTS_SENTINEL, SOURCE_SENTINEL, EXTRA_SENTINEL));
        }

        String query = configText.substring(queryAt + QUERY_SENTINEL.length(), requirementsAt).trim();
        String requirementsText = configText.substring(requirementsAt + REQUIREMENTS_SENTINEL.length(), sourceAt);
        String source = configText.substring(sourceAt + SOURCE_SENTINEL.length(), extraAt).trim();
        String extraText = configText.substring(extraAt + EXTRA_SENTINEL.length()).trim();

        if (!query.toLowerCase(Locale.ROOT).contains("select")) {
            throw new ConfigParseException("Query for checker " + checkerName + " must be a SELECT");
        }

        List<Requirement> requirements = parseRequirements(checkerName, requirementsText);

        return Checker.builder()
                .name(checkerName)
                .queryDetails(QueryDetails.builder().query(query).source(source).build())
                .requirements(requirements)
                .extraConfig(parseExtra(checkerName, extraText))
                .build();
    }

    private List<Requirement> parseRequirements(String checkerName, String requirementsText) {
        List<Requirement> requirements = new ArrayList<>();
        for (String line : requirementsText.split("\\R")) {
            String trimmed = line.trim();
            // Blank lines may separate groups of related requirements
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            requirements.add(requirementParser.parse(trimmed));
        }

        if (requirements.isEmpty()) {
            throw new ConfigParseException("No requirements found for checker " + checkerName);
        }
        return Collections.unmodifiableList(requirements);
    }

    private Map<String, Object> parseExtra(String checkerName, String extraText) {
        if (extraText.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, Object> extra = objectMapper.readValue(extraText, EXTRA_TYPE);
            return extra != null ? extra : Map.of();
        } catch (JsonProcessingException e) {
            throw new ConfigParseException("Extra section of checker " + checkerName + " is not a JSON object", e);
        }
    }
}
