package io.github.cyfko.dnfql.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.dnfql.core.exception.OperatorConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@link OperatorConfig} instances from JSON documents.
 * <p>
 * The expected document is a JSON object whose keys are role names and whose values are
 * lists of token strings:
 * </p>
 * <pre>{@code
 * {
 *   "AND": ["&", "AND"],
 *   "OR": ["|", "OR"],
 *   "NOT": ["!", "NOT"],
 *   "NEQ": ["<>", "!="],
 *   "EQ": ["="],
 *   "LPAREN": ["("],
 *   "RPAREN": [")"]
 * }
 * }</pre>
 *
 * <p><strong>Caching:</strong> loaded configurations are kept in a process-wide read-through
 * cache keyed by the normalized absolute path (or the classpath resource name). Each key is
 * populated at most once and never invalidated. A failed load is not cached.</p>
 *
 * <p><strong>Concurrency:</strong> the cache is a {@link ConcurrentHashMap} populated through
 * {@code computeIfAbsent}, so concurrent callers asking for the same source share one load.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorConfigLoader {

    private static final Logger log = Logger.getLogger(OperatorConfigLoader.class.getName());

    /**
     * Classpath resource holding the built-in operator table.
     */
    public static final String DEFAULT_RESOURCE = "operators.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, OperatorConfig> CACHE = new ConcurrentHashMap<>();

    private OperatorConfigLoader() {}

    /**
     * Loads (once) the configuration stored at the given path.
     *
     * @param path path of a UTF-8 JSON document
     * @return the cached or freshly validated configuration
     * @throws OperatorConfigException if the document cannot be read or is invalid
     */
    public static OperatorConfig load(Path path) {
        Objects.requireNonNull(path, "path is required");
        Path resolved = path.toAbsolutePath().normalize();
        return CACHE.computeIfAbsent(resolved.toString(), key -> readFile(resolved));
    }

    /**
     * Loads (once) the built-in configuration from the classpath resource {@value #DEFAULT_RESOURCE}.
     *
     * @return the default configuration
     * @throws OperatorConfigException if the resource is missing or invalid
     */
    public static OperatorConfig loadDefault() {
        return CACHE.computeIfAbsent("classpath:" + DEFAULT_RESOURCE, OperatorConfigLoader::readResource);
    }

    /**
     * Parses and validates a JSON document without touching the cache.
     *
     * @param json   the document text
     * @param source label used in log and error messages
     * @return the validated configuration
     * @throws OperatorConfigException if the document is invalid
     */
    public static OperatorConfig fromJson(String json, String source) {
        Objects.requireNonNull(json, "json is required");
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw failure("Could not parse operator configuration", source, e);
        }
        return fromTree(root, source);
    }

    private static OperatorConfig readFile(Path path) {
        String source = path.toString();
        log.fine(() -> "Loading operator configuration from " + source);
        try {
            return logLoaded(fromJson(Files.readString(path, StandardCharsets.UTF_8), source));
        } catch (IOException e) {
            throw failure("Could not load operator configuration", source, e);
        }
    }

    private static OperatorConfig readResource(String key) {
        log.fine(() -> "Loading operator configuration from " + key);
        try (InputStream in = OperatorConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw failure("Operator configuration resource not found", key, null);
            }
            return logLoaded(fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8), key));
        } catch (IOException e) {
            throw failure("Could not load operator configuration", key, e);
        }
    }

    private static OperatorConfig fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw failure("Operator configuration must be a JSON object", source, null);
        }

        Map<OperatorRole, List<String>> raw = new EnumMap<>(OperatorRole.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<OperatorRole> role = OperatorRole.fromKey(field.getKey());
            if (role.isEmpty()) {
                log.warning(() -> String.format("Ignoring unknown operator role '%s' (source: %s)", field.getKey(), source));
                continue;
            }
            raw.put(role.get(), readTokens(role.get(), field.getValue(), source));
        }

        try {
            return OperatorConfig.of(raw, source);
        } catch (OperatorConfigException e) {
            log.log(Level.WARNING, "Operator configuration rejected: " + e.getMessage());
            throw e;
        }
    }

    private static List<String> readTokens(OperatorRole role, JsonNode value, String source) {
        if (value == null || !value.isArray()) {
            throw failure("Operator values must be lists of strings (role " + role + ")", source, null);
        }
        List<String> tokens = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw failure("Operator values must be strings (role " + role + ")", source, null);
            }
            tokens.add(item.asText());
        }
        return tokens;
    }

    private static OperatorConfig logLoaded(OperatorConfig config) {
        log.info(() -> String.format("Operator configuration loaded: source=%s summary=%s", config.source(), config.summary()));
        return config;
    }

    private static OperatorConfigException failure(String message, String source, Throwable cause) {
        String full = message + " (source: " + source + ")";
        if (cause != null) {
            log.log(Level.WARNING, full, cause);
            return new OperatorConfigException(full, cause);
        }
        log.warning(full);
        return new OperatorConfigException(full);
    }
}
