package com.spotladder.infrastructure.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reader for the profile's {@code .env} file.
 *
 * <p>Accepts {@code KEY=value} and {@code export KEY=value}. Values may be wrapped in single or double
 * quotes; an unquoted value ends at a {@code " #"} comment. Lines without a key are skipped. Later
 * assignments of the same key win.
 */
final class DotEnv {

    private static final String EXPORT = "export ";

    private DotEnv() {}

    static Map<String, String> loadIfExists(Path envFile) throws IOException {
        if (envFile == null || !Files.isRegularFile(envFile)) return Map.of();
        return parse(Files.readAllLines(envFile, StandardCharsets.UTF_8));
    }

    static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : lines) {
            assignment(line).ifPresent(a -> values.put(a.getKey(), a.getValue()));
        }
        return values;
    }

    private static Optional<Map.Entry<String, String>> assignment(String line) {
        String t = line.strip();
        if (t.isEmpty() || t.charAt(0) == '#') return Optional.empty();
        if (t.startsWith(EXPORT)) t = t.substring(EXPORT.length()).stripLeading();

        int eq = t.indexOf('=');
        if (eq <= 0) return Optional.empty();
        String key = t.substring(0, eq).strip();
        if (key.isEmpty() || key.chars().anyMatch(Character::isWhitespace)) return Optional.empty();
        return Optional.of(Map.entry(key, value(t.substring(eq + 1).strip())));
    }

    private static String value(String raw) {
        if (raw.length() >= 2) {
            char q = raw.charAt(0);
            if ((q == '"' || q == '\'') && raw.indexOf(q, 1) > 0) {
                return raw.substring(1, raw.indexOf(q, 1));
            }
        }
        int comment = raw.indexOf(" #");
        return comment >= 0 ? raw.substring(0, comment).stripTrailing() : raw;
    }
}
