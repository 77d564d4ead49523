package forklift;

/**
 * Creates a {@link Driver} from configuration. Implementations are discovered with
 * {@link java.util.ServiceLoader} and selected by {@link #name()}.
 */
public interface DriverFactory {

    String name();

    Driver create(DriverConfig config);
}
