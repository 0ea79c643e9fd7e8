package io.waypost.javalin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Invocation patterns:
 * <ul>
 * <li>Default: loads {@code waypost.yaml} from the current directory if it
 * exists, otherwise starts from the built-in defaults</li>
 * <li>{@code --config /path/to/waypost.yaml}: loads from the given path, which
 * must exist</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as
 * set only if it is defined and its trimmed value is non-empty.
 *
 * <table>
 * <caption>Keys</caption>
 * <tr><th>YAML</th><th>Environment</th><th>Default</th></tr>
 * <tr><td>server.host</td><td>SERVER_HOST</td><td>0.0.0.0</td></tr>
 * <tr><td>server.port</td><td>SERVER_PORT</td><td>8080</td></tr>
 * <tr><td>logging.format</td><td>LOG_FORMAT</td><td>text</td></tr>
 * <tr><td>logging.level</td><td>LOG_LEVEL</td><td>INFO</td></tr>
 * <tr><td>request-log.enabled</td><td>REQUEST_LOG_ENABLED</td><td>true</td></tr>
 * <tr><td>request-log.method</td><td>REQUEST_LOG_METHOD</td><td>true</td></tr>
 * <tr><td>request-log.path</td><td>REQUEST_LOG_PATH</td><td>true</td></tr>
 * <tr><td>request-log.duration</td><td>REQUEST_LOG_DURATION</td><td>true</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "waypost.yaml";

    private static final Set<String> LOGGING_FORMATS = Set.of("text", "json");
    private static final Set<String> LOGGING_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves configuration from CLI arguments and {@link System#getenv}.
     *
     * @throws ConfigLoadException if an explicit file is missing or any value is invalid
     */
    public static ServerConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Resolves configuration from CLI arguments and the supplied environment
     * lookup. Without {@code --config}, a missing default file is not an error.
     */
    public static ServerConfig load(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Loads from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML, or holds invalid values
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads from {@code configPath}, applying overrides from {@code envLookup}.
     * The lookup returns {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML, or holds invalid values
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null) {
            root = MissingNode.getInstance();
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * The path after {@code --config}, or null when the flag is absent.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(yamlInt(server.get("port"), "server.port"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode requestLog = root.path("request-log");
        if (requestLog.has("enabled"))
            builder.requestLogEnabled(requestLog.get("enabled").asBoolean());
        if (requestLog.has("method"))
            builder.requestLogMethod(requestLog.get("method").asBoolean());
        if (requestLog.has("path")) builder.requestLogPath(requestLog.get("path").asBoolean());
        if (requestLog.has("duration"))
            builder.requestLogDuration(requestLog.get("duration").asBoolean());

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::host);
        envInt(envLookup, "SERVER_PORT", builder::port);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envBool(envLookup, "REQUEST_LOG_ENABLED", builder::requestLogEnabled);
        envBool(envLookup, "REQUEST_LOG_METHOD", builder::requestLogMethod);
        envBool(envLookup, "REQUEST_LOG_PATH", builder::requestLogPath);
        envBool(envLookup, "REQUEST_LOG_DURATION", builder::requestLogDuration);

        return validate(builder.build());
    }

    private static ServerConfig validate(ServerConfig config) {
        if (config.host() == null || config.host().isBlank()) {
            throw new ConfigLoadException("server.host must not be blank");
        }
        if (config.port() < 0 || config.port() > 65535) {
            throw new ConfigLoadException("server.port must be between 0 and 65535, got " + config.port());
        }
        if (!LOGGING_FORMATS.contains(config.loggingFormat().toLowerCase(Locale.ROOT))) {
            throw new ConfigLoadException(
                    "logging.format must be 'text' or 'json', got '" + config.loggingFormat() + "'");
        }
        if (!LOGGING_LEVELS.contains(config.loggingLevel().toUpperCase(Locale.ROOT))) {
            throw new ConfigLoadException("logging.level must be one of " + LOGGING_LEVELS + ", got '"
                    + config.loggingLevel() + "'");
        }
        return config;
    }

    // --- Env var helpers ---

    /** True if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int yamlInt(JsonNode node, String key) {
        if (!node.canConvertToInt()) {
            throw new ConfigLoadException(key + " must be an integer, got '" + node.asText() + "'");
        }
        return node.asInt();
    }
}
