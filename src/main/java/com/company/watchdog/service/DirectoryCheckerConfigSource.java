package com.company.watchdog.service;

import com.company.watchdog.config.WatchdogProperties;
import com.company.watchdog.domain.Checker;
import com.company.watchdog.exception.CheckerNotFoundException;
import com.company.watchdog.exception.ConfigParseException;
import com.company.watchdog.parser.CheckerConfigParser;
import com.company.watchdog.plugin.CheckerConfigSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checkers defined as {@code <name>.dwmon} files in {@code dwmon.configs-dir}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DirectoryCheckerConfigSource implements CheckerConfigSource {

    static final String CONFIG_SUFFIX = ".dwmon";

    private final WatchdogProperties properties;
    private final CheckerConfigParser configParser;

    @Override
    public List<String> listCheckerNames() {
        Path dir = configsDir();
        if (!Files.isDirectory(dir)) {
            log.warn("Checker config directory {} does not exist", dir.toAbsolutePath());
            return List.of();
        }

        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(CONFIG_SUFFIX))
                    .map(name -> name.substring(0, name.length() - CONFIG_SUFFIX.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checker configs in " + dir, e);
        }
    }

    @Override
    public Checker load(String checkerName) {
        Path file = configsDir().resolve(checkerName + CONFIG_SUFFIX);
        if (!Files.isRegularFile(file)) {
            throw new CheckerNotFoundException(checkerName);
        }

        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigParseException("Couldn't read config for checker " + checkerName, e);
        }
        return configParser.parse(checkerName, text);
    }

    private Path configsDir() {
        return Paths.get(properties.getConfigsDir());
    }
}
