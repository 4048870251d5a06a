package work.lcod.bridge.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link BridgeConfiguration} from {@code lcod-bridge.toml}. Missing or malformed files
 * yield the defaults; absent keys keep their default values.
 */
public final class BridgeConfigurationLoader {
    public static final String RESOURCE_NAME = "lcod-bridge.toml";

    private static final Logger LOG = LoggerFactory.getLogger(BridgeConfigurationLoader.class);

    private BridgeConfigurationLoader() {}

    public static BridgeConfiguration loadDefault() {
        return fromClasspath(RESOURCE_NAME).orElseGet(BridgeConfiguration::defaults);
    }

    public static BridgeConfiguration load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return BridgeConfiguration.defaults();
        }
        try {
            return parse(Files.readString(path)).orElseGet(BridgeConfiguration::defaults);
        } catch (IOException ex) {
            LOG.warn("Unable to read bridge configuration {}", path, ex);
            return BridgeConfiguration.defaults();
        }
    }

    public static Optional<BridgeConfiguration> fromClasspath(String resource) {
        var loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = BridgeConfigurationLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            LOG.warn("Unable to read bridge configuration resource {}", resource, ex);
            return Optional.empty();
        }
    }

    public static Optional<BridgeConfiguration> parse(String toml) {
        if (toml == null) {
            return Optional.empty();
        }
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            LOG.warn("Ignoring malformed bridge configuration: {}", result.errors().get(0).toString());
            return Optional.empty();
        }
        return Optional.of(fromToml(result));
    }

    public static BridgeConfiguration fromToml(TomlTable root) {
        var builder = BridgeConfiguration.builder();
        TomlTable bridge = root.getTable("bridge");
        if (bridge != null) {
            if (bridge.isString("name")) {
                builder.bridgeName(bridge.getString("name"));
            }
            if (bridge.isString("version")) {
                builder.bridgeVersion(bridge.getString("version"));
            }
        }
        TomlTable pipeline = root.getTable("pipeline");
        if (pipeline != null) {
            if (pipeline.isArray("read_only_operations")) {
                builder.readOnlyOperations(readStrings(pipeline.getArray("read_only_operations")));
            }
            if (pipeline.isString("side_effect_key") && !pipeline.getString("side_effect_key").isBlank()) {
                builder.sideEffectKey(pipeline.getString("side_effect_key"));
            }
        }
        TomlTable batch = root.getTable("batch");
        if (batch != null && batch.isLong("default_max_results")) {
            long max = batch.getLong("default_max_results");
            if (max > 0 && max <= Integer.MAX_VALUE) {
                builder.defaultMaxResults((int) max);
            }
        }
        return builder.build();
    }

    private static List<String> readStrings(TomlArray array) {
        var values = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            Object item = array.get(i);
            if (item instanceof String str && !str.isBlank()) {
                values.add(str.trim());
            }
        }
        return values;
    }
}
