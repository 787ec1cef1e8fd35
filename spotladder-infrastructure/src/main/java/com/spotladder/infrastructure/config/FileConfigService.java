package com.spotladder.infrastructure.config;

import com.spotladder.application.config.ConfigKey;
import com.spotladder.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * File + env configuration.
 *
 * Load order (low -> high priority):
 *  1) config.properties (profile dir)
 *  2) .env (profile dir, optional)
 *  3) secrets.properties (profile dir, optional)
 *  4) environment variables: SPOTLADDER_* mapping of any known key, or the key itself (ATAIX_API_KEY)
 *
 * Nothing is created on disk; a missing profile directory just means defaults and environment.
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    private final Properties props = new Properties();
    private final Path profileDir;
    private final Map<String, String> env;

    private FileConfigService(Path profileDir, Map<String, String> env) throws IOException {
        this.profileDir = profileDir;
        this.env = env;
        loadAll();
        applyEnvOverrides();
    }

    public static FileConfigService defaultFromWorkingDir(String profile) throws IOException {
        Path base = Path.of(System.getProperty("user.dir")).resolve("config");
        if (profile != null && !profile.isBlank()) {
            base = base.resolve(profile.trim());
        }
        return new FileConfigService(base, System.getenv());
    }

    public static FileConfigService fromDirectory(Path profileDir, Map<String, String> env) throws IOException {
        return new FileConfigService(profileDir, Map.copyOf(env));
    }

    private void loadAll() throws IOException {
        if (profileDir == null || !Files.isDirectory(profileDir)) return;

        loadPropsIfExists(profileDir.resolve("config.properties"));

        Map<String, String> dotEnv = DotEnv.loadIfExists(profileDir.resolve(".env"));
        for (Map.Entry<String, String> e : dotEnv.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }

        loadPropsIfExists(profileDir.resolve("secrets.properties"));
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (file == null || !Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
    }

    private void applyEnvOverrides() {
        Set<String> keys = new LinkedHashSet<>(props.stringPropertyNames());
        for (ConfigKey k : ConfigKey.values()) keys.add(k.key());

        for (String key : keys) {
            String val = env.get(toEnvKey(key));
            if (val == null) val = env.get(key);
            if (val != null) props.setProperty(key, val);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - trade.maxPrice  -> SPOTLADDER_TRADE_MAX_PRICE
     * - ataix.baseUrl   -> SPOTLADDER_ATAIX_BASE_URL
     * - ATAIX_API_KEY   -> SPOTLADDER_ATAIX_API_KEY
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return "SPOTLADDER_" + s.toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not an integer, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not a decimal, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        return v == null ? defaultValue : Boolean.parseBoolean(v);
    }

    @Override
    public String getSecret(String key) {
        return get(key, null);
    }
}
