package io.clientmock.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.clientmock.core.error.SettingsLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link MockSettings} from YAML with an environment variable overlay.
 *
 * <p>Recognized YAML keys and their environment variables:
 * <pre>
 * template:
 *   base-url-marker: "{+baseurl}"     # CLIENT_MOCK_BASE_URL_MARKER
 *   ignore-case: true                 # CLIENT_MOCK_IGNORE_CASE
 *   query-matching: lenient           # CLIENT_MOCK_QUERY_MATCHING (lenient | strict)
 * builder:
 *   ignored-parameters: [baseurl]     # CLIENT_MOCK_IGNORED_PARAMETERS (comma-separated)
 * dispatch:
 *   unmatched: return-default         # CLIENT_MOCK_UNMATCHED (return-default | fail)
 * </pre>
 *
 * <p>Missing keys keep the {@link MockSettings.Builder} defaults. An environment variable counts
 * as set only when it is defined and non-blank after trimming; it then wins over the YAML value.
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath resource consulted by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "client-mock.yaml";

    private SettingsLoader() {
        // utility class
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath if present, defaults otherwise, then
     * applies {@link System#getenv} overrides.
     */
    public static MockSettings loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE, System::getenv, true);
    }

    /**
     * Loads settings from a YAML file, applying {@link System#getenv} overrides.
     *
     * @throws SettingsLoadException if the file is missing or invalid
     */
    public static MockSettings load(Path path) {
        return load(path, System::getenv);
    }

    /**
     * Loads settings from a YAML file, applying overrides from {@code envLookup}.
     *
     * @param path      the YAML file
     * @param envLookup maps a variable name to its value, or null when undefined
     * @throws SettingsLoadException if the file is missing or invalid
     */
    public static MockSettings load(Path path, Function<String, String> envLookup) {
        if (!Files.exists(path)) {
            throw new SettingsLoadException("Settings file not found: " + path, path.toString());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, envLookup, path.toString());
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to read settings file: " + path, e, path.toString());
        }
    }

    /**
     * Loads settings from a classpath resource, applying overrides from {@code envLookup}.
     *
     * @throws SettingsLoadException if the resource is missing or invalid
     */
    public static MockSettings loadFromClasspath(String resource, Function<String, String> envLookup) {
        return loadFromClasspath(resource, envLookup, false);
    }

    private static MockSettings loadFromClasspath(
            String resource, Function<String, String> envLookup, boolean optional) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SettingsLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                if (!optional) {
                    throw new SettingsLoadException("Settings resource not found on classpath: " + resource, resource);
                }
                LOG.debug("No {} on classpath, using default settings", resource);
                return applyEnvOverrides(MockSettings.builder(), envLookup, resource).build();
            }
            return parse(in, envLookup, resource);
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to read settings resource: " + resource, e, resource);
        }
    }

    private static MockSettings parse(InputStream in, Function<String, String> envLookup, String source)
            throws IOException {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new SettingsLoadException("Invalid YAML in settings: " + source, e, source);
        }
        MockSettings.Builder builder = MockSettings.builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new SettingsLoadException("Settings root must be a mapping: " + source, source);
            }
            mapYaml(root, builder, source);
        }
        MockSettings settings = applyEnvOverrides(builder, envLookup, source).build();
        LOG.debug("Loaded client-mock settings from {}: {}", source, settings);
        return settings;
    }

    private static void mapYaml(JsonNode root, MockSettings.Builder builder, String source) {
        JsonNode template = root.path("template");
        if (template.has("base-url-marker")) builder.baseUrlMarker(template.get("base-url-marker").asText());
        if (template.has("ignore-case")) builder.ignoreCase(template.get("ignore-case").asBoolean());
        if (template.has("query-matching")) {
            String value = template.get("query-matching").asText();
            builder.queryMatching(parseEnum(value, MockSettings.QueryMatching::parse, "template.query-matching", source));
        }

        JsonNode builderNode = root.path("builder");
        if (builderNode.has("ignored-parameters")) {
            JsonNode ignored = builderNode.get("ignored-parameters");
            List<String> names = new ArrayList<>();
            if (ignored.isArray()) {
                ignored.forEach(node -> names.add(node.asText()));
            } else {
                names.addAll(splitList(ignored.asText()));
            }
            builder.ignoredParameters(names);
        }

        JsonNode dispatch = root.path("dispatch");
        if (dispatch.has("unmatched")) {
            String value = dispatch.get("unmatched").asText();
            builder.unmatched(parseEnum(value, MockSettings.UnmatchedPolicy::parse, "dispatch.unmatched", source));
        }
    }

    private static MockSettings.Builder applyEnvOverrides(
            MockSettings.Builder builder, Function<String, String> envLookup, String source) {
        envString(envLookup, "CLIENT_MOCK_BASE_URL_MARKER", builder::baseUrlMarker);
        envString(envLookup, "CLIENT_MOCK_IGNORE_CASE", value -> builder.ignoreCase(Boolean.parseBoolean(value)));
        envString(
                envLookup,
                "CLIENT_MOCK_QUERY_MATCHING",
                value -> builder.queryMatching(
                        parseEnum(value, MockSettings.QueryMatching::parse, "CLIENT_MOCK_QUERY_MATCHING", source)));
        envString(
                envLookup,
                "CLIENT_MOCK_IGNORED_PARAMETERS",
                value -> builder.ignoredParameters(splitList(value)));
        envString(
                envLookup,
                "CLIENT_MOCK_UNMATCHED",
                value -> builder.unmatched(
                        parseEnum(value, MockSettings.UnmatchedPolicy::parse, "CLIENT_MOCK_UNMATCHED", source)));
        return builder;
    }

    /** Applies an env var if it is defined and non-blank. */
    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        String value = envLookup.apply(name);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }

    private static <E extends Enum<E>> E parseEnum(
            String value, Function<String, E> parser, String key, String source) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new SettingsLoadException("Invalid value for " + key + ": '" + value + "'", e, source);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
