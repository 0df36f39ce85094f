package com.batrun.driver;

import com.batrun.core.error.UnknownTestDriverException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Test drivers available to suites, looked up by the {@code driver} entry of
 * their config.
 */
@Component
public class TestDriverRegistry {

    private final Map<String, TestDriver> testDrivers = new TreeMap<>();

    public TestDriverRegistry(List<TestDriver> drivers) {
        for (var driver : drivers) {
            var previous = testDrivers.put(driver.name(), driver);
            if (previous != null) {
                throw new IllegalStateException("Two test drivers named " + driver.name() + ": "
                        + previous.getClass().getName() + " and " + driver.getClass().getName());
            }
        }
    }

    /**
     * @throws UnknownTestDriverException if no driver is registered under {@code driverName}
     */
    public TestDriver get(String driverName) {
        var driver = testDrivers.get(driverName);
        if (driver == null) {
            throw new UnknownTestDriverException(driverName);
        }
        return driver;
    }

    public Set<String> names() {
        return testDrivers.keySet();
    }
}
