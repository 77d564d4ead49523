package forklift;

import forklift.driver.SyncDriver;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class ForkliftBuilder {

    private static final int DEFAULT_BATCH_SIZE = 1;

    @Nullable
    private Driver driver;
    private int batchSize = DEFAULT_BATCH_SIZE;

    ForkliftBuilder() {
    }

    /**
     * Sets the driver. Defaults to a {@link SyncDriver}.
     */
    public ForkliftBuilder driver(Driver driver) {
        this.driver = requireNonNull(driver, "driver");
        return this;
    }

    public ForkliftBuilder driver(DriverConfig config) {
        return driver(Drivers.create(config));
    }

    public ForkliftBuilder batchSize(int batchSize) {
        checkArgument(batchSize > 0, "batchSize: %s (expected: > 0)", batchSize);
        this.batchSize = batchSize;
        return this;
    }

    public Forklift build() {
        return new Forklift(driver != null ? driver : new SyncDriver(), batchSize);
    }
}
