package com.warden.proxy.core.policy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.warden.proxy.config.WardenProperties;
import com.warden.proxy.core.exceptions.ConfigException;

/**
 * Collects block patterns from the inline {@code blocklist} and the optional
 * {@code blocklistFile}. The file holds one pattern per line; blank lines and
 * lines starting with {@code #} are skipped.
 */
public final class BlocklistLoader {

    private BlocklistLoader() {
        // Utility class
    }

    /**
     * Gathers all configured patterns, inline ones first, duplicates removed.
     *
     * @param props The application properties.
     * @return Raw pattern strings in declaration order.
     * @throws ConfigException If the blocklist file cannot be read.
     */
    public static List<String> load(WardenProperties props) {
        Set<String> patterns = new LinkedHashSet<>();
        if (props.getBlocklist() != null) {
            patterns.addAll(props.getBlocklist());
        }
        if (props.getBlocklistFile() != null && !props.getBlocklistFile().isBlank()) {
            patterns.addAll(readFile(Paths.get(props.getBlocklistFile())));
        }
        return new ArrayList<>(patterns);
    }

    /**
     * Reads patterns from a file.
     *
     * @param file Path to the pattern file.
     * @return The patterns in file order.
     * @throws ConfigException If the file cannot be read.
     */
    public static List<String> readFile(Path file) {
        List<String> patterns = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    patterns.add(trimmed);
                }
            }
        } catch (IOException e) {
            throw new ConfigException("Cannot read blocklist file: " + file, e);
        }
        return patterns;
    }
}
