package forklift;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static java.util.Objects.requireNonNull;

/**
 * The settings of one driver: the {@value #CLASS} entry naming the driver, plus whatever options that
 * driver reads.
 */
public final class DriverConfig {

    public static final String CLASS = "class";
    public static final String DEFAULT_DRIVER = "sync";

    private final Map<String, String> settings;

    private DriverConfig(Map<String, String> settings) {
        this.settings = ImmutableMap.copyOf(settings);
    }

    public static DriverConfig of(Map<String, String> settings) {
        return new DriverConfig(requireNonNull(settings, "settings"));
    }

    /**
     * Collects every property starting with {@code prefix}, with the prefix removed from its key.
     */
    public static DriverConfig fromProperties(Properties properties, String prefix) {
        requireNonNull(properties, "properties");
        requireNonNull(prefix, "prefix");
        final ImmutableMap.Builder<String, String> settings = ImmutableMap.builder();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                settings.put(key.substring(prefix.length()), properties.getProperty(key).trim());
            }
        }
        return new DriverConfig(settings.build());
    }

    /**
     * Returns the driver name, {@value #DEFAULT_DRIVER} if none is configured.
     */
    public String driverName() {
        final String name = settings.get(CLASS);
        return name == null || name.isEmpty() ? DEFAULT_DRIVER : name;
    }

    @Nullable
    public String getString(String key) {
        return settings.get(requireNonNull(key, "key"));
    }

    public int getInt(String key, int defaultValue) {
        final String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ForkliftException(key + ": " + value + " (expected: an integer)", e);
        }
    }

    /**
     * Reads a non-negative number of seconds, fractions allowed ({@code 0.5}).
     */
    public Duration getSeconds(String key, Duration defaultValue) {
        final String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        final BigDecimal seconds;
        try {
            seconds = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ForkliftException(key + ": " + value + " (expected: a number of seconds)", e);
        }
        if (seconds.signum() < 0) {
            throw new ForkliftException(key + ": " + value + " (expected: >= 0)");
        }
        try {
            return Duration.ofNanos(seconds.movePointRight(9).setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new ForkliftException(key + ": " + value + " (expected: a number of seconds)", e);
        }
    }

    public Map<String, String> asMap() {
        return settings;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("settings", settings)
                .toString();
    }
}
