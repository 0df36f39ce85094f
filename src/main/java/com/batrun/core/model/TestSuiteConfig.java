package com.batrun.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Contents of a suite's {@code test-suite.json} file.
 *
 * @param name             suite name
 * @param description      free text description
 * @param version          suite version
 * @param driver           name of the test driver able to discover and run the suite
 * @param testFilePatterns glob patterns selecting test files; empty means driver default
 * @param globalFixture    file holding the suite-level setup/teardown, relative to the suite (nullable)
 * @param targets          names of the targets the suite supports
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestSuiteConfig(
    @JsonProperty(value = "name", required = true) String name,
    @JsonProperty("description") String description,
    @JsonProperty("version") String version,
    @JsonProperty(value = "driver", required = true) String driver,
    @JsonProperty("test-file-patterns") List<String> testFilePatterns,
    @JsonProperty("global-fixture") String globalFixture,
    @JsonProperty("targets") List<String> targets
) {

    public TestSuiteConfig {
        testFilePatterns = testFilePatterns == null ? List.of() : List.copyOf(testFilePatterns);
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public Optional<String> globalFixtureFile() {
        return Optional.ofNullable(globalFixture).filter(f -> !f.isBlank());
    }
}
