package im.arun.htmldom.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import im.arun.htmldom.model.ChildrenStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link LoadSettings} from YAML and merges user options on top.
 *
 * <p>Defaults come from the given file if it exists, else from {@code htmldom.yaml} on the
 * classpath, else from the built-in values.
 */
public class SettingsLoader {
    private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);
    static final String DEFAULT_RESOURCE = "htmldom.yaml";

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
    private final LoadSettings defaultSettings;

    public SettingsLoader() {
        this(null);
    }

    public SettingsLoader(String configPath) {
        this.defaultSettings = loadDefaultSettings(configPath);
    }

    private LoadSettings loadDefaultSettings(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), LoadSettings.class);
                }
                logger.warn("Settings file {} not found", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, LoadSettings.class);
                }
            }

            logger.warn("No {} found, using default settings", DEFAULT_RESOURCE);
            return new LoadSettings();
        } catch (IOException e) {
            logger.warn("Failed to load settings, using defaults: {}", e.getMessage());
            return new LoadSettings();
        }
    }

    public LoadSettings getDefaultSettings() {
        return copySettings(defaultSettings);
    }

    /**
     * Defaults with {@code userOptions} applied. Unknown keys and unusable values are logged
     * and ignored.
     */
    public LoadSettings load(Map<String, Object> userOptions) {
        LoadSettings settings = copySettings(defaultSettings);

        if (userOptions == null || userOptions.isEmpty()) {
            return settings;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "all_text_separately":
                case "allTextSeparately":
                    settings.setAllTextSeparately(parseBoolean(value));
                    break;
                case "children_storage":
                case "childrenStorage":
                    ChildrenStorage storage = parseStorage(value);
                    if (storage != null) {
                        settings.setChildrenStorage(storage);
                    } else {
                        logger.warn("Invalid value for {}: {}", key, value);
                    }
                    break;
                default:
                    logger.warn("Unknown settings key: {}", key);
            }
        });

        return settings;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    static ChildrenStorage parseStorage(Object value) {
        if (value instanceof ChildrenStorage) {
            return (ChildrenStorage) value;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if ("exclusive".equalsIgnoreCase(s) || "owned".equalsIgnoreCase(s)) {
                return ChildrenStorage.EXCLUSIVE;
            }
            if ("shared".equalsIgnoreCase(s) || "sharable".equalsIgnoreCase(s)) {
                return ChildrenStorage.SHARED;
            }
        }
        return null;
    }

    private LoadSettings copySettings(LoadSettings source) {
        LoadSettings copy = new LoadSettings();
        copy.setAllTextSeparately(source.isAllTextSeparately());
        copy.setChildrenStorage(source.getChildrenStorage());
        return copy;
    }
}
