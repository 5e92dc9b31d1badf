package com.conveyal.proximity;

import com.conveyal.proximity.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these
 * options via the Config interfaces of the analysis components.
 *
 * Some validation may be performed here, but any interpretation or conditional logic should be provided in the
 * components themselves. Unlike a long-running server, one analysis run has many options with obvious defaults
 * (band breakpoints, thresholds) so those keys are optional. Input locations and the classification policy are
 * always required.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "proximity-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system
     * properties. In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or
     * dots as separators, and must be prefixed with "proximity", e.g. PROXIMITY_THREADS=5 or
     * java -Dproximity.threads=5. Precedence is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new ConfigurationException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = optionalStrProp(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    /** @return the trimmed value of the key, or null if it is absent or blank. */
    protected String optionalStrProp (String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    protected String strProp (String key, String defaultValue) {
        String value = optionalStrProp(key);
        return value == null ? defaultValue : value;
    }

    protected boolean hasProp (String key) {
        return optionalStrProp(key) != null;
    }

    protected int intProp (String key, int defaultValue) {
        String val = optionalStrProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return defaultValue;
    }

    /** @return the parsed value, or null if the key is absent. */
    protected Double optionalDoubleProp (String key) {
        String val = optionalStrProp(key);
        if (val != null) {
            try {
                return Double.parseDouble(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return null;
    }

    protected boolean boolProp (String key, boolean defaultValue) {
        String val = optionalStrProp(key);
        if (val != null) {
            // Boolean.parseBoolean will return false for any string other than "true".
            // We want to be more strict.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return defaultValue;
    }

    /** Parse a comma separated list of numbers, returning the supplied default if the key is absent. */
    protected double[] doubleListProp (String key, double[] defaultValue) {
        String val = optionalStrProp(key);
        if (val == null) {
            return defaultValue;
        }
        List<String> items = stringListProp(key);
        double[] result = new double[items.size()];
        for (int i = 0; i < result.length; i++) {
            try {
                result[i] = Double.parseDouble(items.get(i));
            } catch (NumberFormatException nfe) {
                LOG.error("Item '{}' of configuration option '{}' could not be parsed as a number.", items.get(i), key);
                keysWithErrors.add(key);
                return defaultValue;
            }
        }
        return result;
    }

    /** Parse a comma separated list of strings. An absent key yields an empty list. */
    protected List<String> stringListProp (String key) {
        List<String> items = new ArrayList<>();
        String val = optionalStrProp(key);
        if (val != null) {
            for (String item : val.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
        }
        return items;
    }

    /** Call this after reading all properties to report every missing or malformed option at once. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new ConfigurationException(
                "Missing or invalid configuration properties: " + String.join(", ", keysWithErrors)
            );
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String)entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String)entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
