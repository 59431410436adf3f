package com.company.watchdog.service;

import com.company.watchdog.config.WatchdogProperties;
import com.company.watchdog.domain.Checker;
import com.company.watchdog.exception.CheckerNotFoundException;
import com.company.watchdog.exception.ConfigParseException;
import com.company.watchdog.parser.CheckerConfigParser;
import com.company.watchdog.parser.RequirementParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryCheckerConfigSourceTest {

    private static final String CONFIG = "__QUERY__\n"
            + "SELECT id AS dwmon_unique_key, created_at AS dwmon_timestamp FROM applications\n"
            + "__REQUIREMENTS__\n"
            + "CHECKHOURS9-17 CHECKMINUTES0-59 WEEKDAYS MINNUM1 MAXNUM100 LOOKBACKSECONDS3600\n"
            + "__SOURCE__\nwarehouse\n"
            + "__EXTRA__\n{}\n";

    @TempDir
    Path configsDir;

    private WatchdogProperties properties;
    private DirectoryCheckerConfigSource source;

    @BeforeEach
    void setUp() {
        properties = new WatchdogProperties();
        properties.setConfigsDir(configsDir.toString());
        source = new DirectoryCheckerConfigSource(properties,
                new CheckerConfigParser(new RequirementParser(), new ObjectMapper()));
    }

    @Test
    void shouldListDwmonFilesSortedWithoutSuffix() throws IOException {
        Files.writeString(configsDir.resolve("signups.dwmon"), CONFIG);
        Files.writeString(configsDir.resolve("applications.dwmon"), CONFIG);
        Files.writeString(configsDir.resolve("notes.txt"), "ignored");
        Files.writeString(configsDir.resolve("old.dwmon.example"), CONFIG);
        Files.createDirectory(configsDir.resolve("nested.dwmon"));

        assertThat(source.listCheckerNames()).containsExactly("applications", "signups");
    }

    @Test
    void shouldReturnNoNamesForMissingDirectory() {
        properties.setConfigsDir(configsDir.resolve("absent").toString());

        assertThat(source.listCheckerNames()).isEmpty();
    }

    @Test
    void shouldLoadAndParseConfig() throws IOException {
        Files.writeString(configsDir.resolve("applications.dwmon"), CONFIG);

        Checker checker = source.load("applications");

        assertThat(checker.getName()).isEqualTo("applications");
        assertThat(checker.getQueryDetails().getSource()).isEqualTo("warehouse");
        assertThat(checker.getRequirements()).hasSize(1);
    }

    @Test
    void shouldFailForUnknownChecker() {
        assertThatThrownBy(() -> source.load("missing"))
                .isInstanceOf(CheckerNotFoundException.class)
                .hasMessage("Checker not found: missing");
    }

    @Test
    void shouldPropagateParseFailure() throws IOException {
        Files.writeString(configsDir.resolve("broken.dwmon"), "__QUERY__\nSELECT 1\n");

        assertThatThrownBy(() -> source.load("broken"))
                .isInstanceOf(ConfigParseException.class)
                .hasMessage("Expected __REQUIREMENTS__");
    }
}
