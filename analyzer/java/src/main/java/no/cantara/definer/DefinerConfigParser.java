package no.cantara.definer;

import no.cantara.definer.FreeVariableAnalyzer.Mode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses a definer.yaml file into a {@link DefinerConfig}.
 */
public class DefinerConfigParser {

    private static final Logger log = LoggerFactory.getLogger(DefinerConfigParser.class);

    // SafeConstructor: configuration files never instantiate Java types through YAML tags.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    private static final Set<String> KNOWN_KEYS = Set.of("mode", "max_depth", "standard_globals", "globals");

    public static DefinerConfig parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static DefinerConfig parse(InputStream is) {
        Object data = YAML.load(is);
        if (data == null) {
            return fromMap(Map.of());
        }
        if (!(data instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("configuration must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            map.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return fromMap(map);
    }

    public static DefinerConfig fromMap(Map<String, Object> data) {
        for (String key : data.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Ignoring unknown configuration key '{}'", key);
            }
        }
        DefinerConfig defaults = DefinerConfig.defaults();
        return new DefinerConfig(
                parseMode(data.get("mode")),
                parseMaxDepth(data.getOrDefault("max_depth", defaults.maxDepth())),
                parseFlag("standard_globals", data.getOrDefault("standard_globals", defaults.standardGlobals())),
                parseGlobals(data.get("globals"))
        );
    }

    static Mode parseMode(Object value) {
        if (value == null) return Mode.STRICT;
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "strict" -> Mode.STRICT;
            case "lenient" -> Mode.LENIENT;
            default -> throw new IllegalArgumentException("'mode' must be one of [lenient, strict], got '" + value + "'");
        };
    }

    private static int parseMaxDepth(Object value) {
        if (!(value instanceof Integer depth)) {
            throw new IllegalArgumentException("'max_depth' must be an integer, got '" + value + "'");
        }
        if (depth < 1) {
            throw new IllegalArgumentException("'max_depth' must be positive, got " + depth);
        }
        return depth;
    }

    private static boolean parseFlag(String key, Object value) {
        if (value instanceof Boolean b) return b;
        throw new IllegalArgumentException("'" + key + "' must be true or false, got '" + value + "'");
    }

    private static List<String> parseGlobals(Object value) {
        if (value == null) return List.of();
        if (!(value instanceof List<?> raw)) {
            throw new IllegalArgumentException("'globals' must be a list of names");
        }
        List<String> names = new ArrayList<>();
        for (Object entry : raw) {
            if (!(entry instanceof String name) || name.isBlank()) {
                throw new IllegalArgumentException("'globals' entries must be non-blank strings, got '" + entry + "'");
            }
            names.add(name);
        }
        return names;
    }
}
