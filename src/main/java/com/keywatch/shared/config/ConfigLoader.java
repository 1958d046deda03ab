package com.keywatch.shared.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.keywatch.filter.KeywordMatcher;
import com.keywatch.filter.PatternException;
import com.keywatch.shared.model.GroupRule;
import com.keywatch.shared.model.Keyword;
import com.keywatch.shared.model.NotificationTarget;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes the config document. YAML is the default format; a path ending in
 * {@code .json} is handled as JSON. Only the monitor sections are rewritten on save.
 */
public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".keywatch", "config.yaml"
    );
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static Path defaultPath() {
        var override = System.getenv("KEYWATCH_CONFIG");
        return override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH;
    }

    public static KeyWatchConfig load(Path path) {
        return load(path, System.getenv());
    }

    public static KeyWatchConfig load(Path path, Map<String, String> env) {
        var raw = read(path);

        var telegram = section(raw, "telegram");
        var pipeline = section(raw, "pipeline");

        var token = env.getOrDefault("KEYWATCH_TELEGRAM_TOKEN",
                telegram.get("bot-token") == null ? "" : String.valueOf(telegram.get("bot-token")));
        if (token.isBlank()) {
            throw new ConfigException("Missing required field in config: telegram.bot-token");
        }
        var ownerRaw = env.getOrDefault("KEYWATCH_OWNER_ID",
                telegram.get("owner-id") == null ? "" : String.valueOf(telegram.get("owner-id")));
        long ownerId;
        try {
            ownerId = Long.parseLong(ownerRaw.strip());
        } catch (NumberFormatException e) {
            throw new ConfigException("telegram.owner-id must be a numeric user id, got '" + ownerRaw + "'", e);
        }

        var defaults = PipelineConfig.defaults();
        var pipelineConfig = new PipelineConfig(
            positive(pipeline, "workers", defaults.workers()),
            positive(pipeline, "shutdown-grace-seconds", (int) defaults.shutdownGraceSeconds()),
            positive(pipeline, "dedup-sweep-minutes", (int) defaults.dedupSweepMinutes())
        );
        return new KeyWatchConfig(path, token, ownerId, pipelineConfig, parseMonitor(raw));
    }

    public static MonitorConfig loadMonitor(Path path) {
        return parseMonitor(read(path));
    }

    public static MonitorConfig parseMonitor(Map<String, Object> raw) {
        if (!raw.containsKey("keywords")) {
            throw new ConfigException("Missing required field in config: keywords");
        }
        var keywords = new ArrayList<Keyword>();
        for (var pattern : stringList(raw, "keywords")) {
            var keyword = new Keyword(pattern);
            try {
                KeywordMatcher.validate(keyword);
            } catch (PatternException e) {
                throw new ConfigException("Invalid keyword pattern in config: " + pattern, e);
            }
            if (keywords.stream().anyMatch(keyword::sameAs)) {
                throw new ConfigException("Duplicate keyword in config: " + pattern);
            }
            keywords.add(keyword);
        }

        var settings = section(raw, "settings");
        var groups = section(raw, "groups");
        var dup = section(raw, "duplicates");

        var settingsDef = MonitorConfig.Settings.defaults();
        var dupDef = MonitorConfig.DedupSettings.defaults();

        var expiryHours = integer(dup, "expiry_hours", dupDef.expiryHours());
        if (expiryHours < MonitorConfig.DedupSettings.MIN_EXPIRY_HOURS
                || expiryHours > MonitorConfig.DedupSettings.MAX_EXPIRY_HOURS) {
            throw new ConfigException("duplicates.expiry_hours must be between "
                    + MonitorConfig.DedupSettings.MIN_EXPIRY_HOURS + " and "
                    + MonitorConfig.DedupSettings.MAX_EXPIRY_HOURS + ", got " + expiryHours);
        }

        NotificationTarget target;
        try {
            var value = raw.get("notification_target");
            target = NotificationTarget.parse(value == null ? "me" : String.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid notification_target: " + e.getMessage(), e);
        }

        return new MonitorConfig(
            keywords,
            new GroupRule(stringList(groups, "whitelist"), stringList(groups, "blacklist")),
            new MonitorConfig.Settings(
                bool(settings, "case_sensitive", settingsDef.caseSensitive()),
                bool(settings, "send_full_message", settingsDef.sendFullMessage()),
                positive(settings, "max_message_length", settingsDef.maxMessageLength())
            ),
            new MonitorConfig.DedupSettings(
                bool(dup, "enabled", dupDef.enabled()),
                expiryHours,
                bool(dup, "include_sender", dupDef.includeSender())
            ),
            target
        );
    }

    /** Writes the monitor sections into the document at {@code path}, keeping every other section. */
    public static void save(Path path, MonitorConfig config) {
        var raw = Files.exists(path) ? new LinkedHashMap<>(read(path)) : new LinkedHashMap<String, Object>();
        raw.putAll(toDocument(config));
        var tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            Files.writeString(tmp, isJson(path) ? JSON.writeValueAsString(raw) : yaml().dump(raw));
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ConfigException("Failed to save config: " + path, e);
        }
    }

    public static Map<String, Object> toDocument(MonitorConfig config) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("keywords", config.keywords().stream().map(Keyword::pattern).toList());

        var settings = new LinkedHashMap<String, Object>();
        settings.put("case_sensitive", config.settings().caseSensitive());
        settings.put("send_full_message", config.settings().sendFullMessage());
        settings.put("max_message_length", config.settings().maxMessageLength());
        doc.put("settings", settings);

        var groups = new LinkedHashMap<String, Object>();
        groups.put("whitelist", config.groups().whitelist());
        groups.put("blacklist", config.groups().blacklist());
        doc.put("groups", groups);

        var dup = new LinkedHashMap<String, Object>();
        dup.put("enabled", config.duplicates().enabled());
        dup.put("expiry_hours", config.duplicates().expiryHours());
        dup.put("include_sender", config.duplicates().includeSender());
        doc.put("duplicates", dup);

        doc.put("notification_target", config.target().configValue());
        return doc;
    }

    private static Map<String, Object> read(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            Map<String, Object> raw;
            if (isJson(path)) {
                raw = JSON.readValue(in, new TypeReference<Map<String, Object>>() {});
            } else {
                raw = yaml().load(in);
            }
            return raw == null ? Map.of() : raw;
        } catch (IOException | RuntimeException e) {
            throw new ConfigException("Failed to load config: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String key) {
        var value = raw.get(key);
        if (value == null) return Map.of();
        if (!(value instanceof Map)) {
            throw new ConfigException("Config section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static List<String> stringList(Map<String, Object> raw, String key) {
        var value = raw.get(key);
        if (value == null) return List.of();
        if (!(value instanceof List<?> items)) {
            throw new ConfigException("Config field '" + key + "' must be a list");
        }
        return items.stream().map(String::valueOf).toList();
    }

    private static boolean bool(Map<String, Object> raw, String key, boolean fallback) {
        var value = raw.getOrDefault(key, fallback);
        if (value instanceof Boolean b) return b;
        var text = String.valueOf(value).toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("false")) return Boolean.parseBoolean(text);
        throw new ConfigException("Config field '" + key + "' must be true or false, got '" + value + "'");
    }

    private static int integer(Map<String, Object> raw, String key, int fallback) {
        var value = raw.getOrDefault(key, fallback);
        try {
            return Integer.parseInt(String.valueOf(value).strip());
        } catch (NumberFormatException e) {
            throw new ConfigException("Config field '" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static int positive(Map<String, Object> raw, String key, int fallback) {
        var value = integer(raw, key, fallback);
        if (value < 1) {
            throw new ConfigException("Config field '" + key + "' must be positive, got " + value);
        }
        return value;
    }

    private static boolean isJson(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static Yaml yaml() {
        var options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options);
    }
}
