package forklift;

import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.ServiceLoader;

import static java.util.Objects.requireNonNull;

/**
 * Resolves the {@link Driver} named by a {@link DriverConfig}.
 *
 * <p>The name is either one registered by a {@link DriverFactory} service ({@code sync}, {@code worker-pool})
 * or the fully qualified class name of a {@link DriverFactory}. A leading {@code ::} is ignored.
 */
public final class Drivers {

    private static final Logger LOGGER = LoggerFactory.getLogger(Drivers.class);
    private static final String SHORT_NAME_PREFIX = "::";

    private Drivers() {
    }

    public static Driver create(DriverConfig config) {
        requireNonNull(config, "config");
        final DriverFactory factory = factory(config.driverName());
        LOGGER.debug("Creating driver {} from {}", factory.name(), config);
        return factory.create(config);
    }

    /**
     * Returns the registered factories by name.
     */
    public static Map<String, DriverFactory> factories() {
        final ImmutableSortedMap.Builder<String, DriverFactory> factories = ImmutableSortedMap.naturalOrder();
        for (DriverFactory factory : ServiceLoader.load(DriverFactory.class, Drivers.class.getClassLoader())) {
            factories.put(factory.name(), factory);
        }
        return factories.build();
    }

    static DriverFactory factory(String driverName) {
        final String name = driverName.startsWith(SHORT_NAME_PREFIX) ?
                driverName.substring(SHORT_NAME_PREFIX.length()) : driverName;

        final Map<String, DriverFactory> factories = factories();
        final DriverFactory registered = factories.get(name);
        if (registered != null) {
            return registered;
        }
        if (name.indexOf('.') < 0) {
            throw new ForkliftException("unknown driver: " + driverName + " (expected one of " +
                    factories.keySet() + " or a DriverFactory class name)");
        }
        return instantiate(name);
    }

    private static DriverFactory instantiate(String className) {
        final Class<?> type;
        try {
            type = Class.forName(className, true, Drivers.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new ForkliftException("unknown driver class: " + className, e);
        }
        if (!DriverFactory.class.isAssignableFrom(type)) {
            throw new ForkliftException(className + " is not a " + DriverFactory.class.getName());
        }
        try {
            return (DriverFactory) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ForkliftException("cannot instantiate driver factory " + className, e);
        }
    }
}
