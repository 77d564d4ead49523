package forklift.driver;

import forklift.Driver;
import forklift.DriverConfig;
import forklift.DriverFactory;

public final class SyncDriverFactory implements DriverFactory {

    public static final String NAME = "sync";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Driver create(DriverConfig config) {
        return new SyncDriver();
    }
}
