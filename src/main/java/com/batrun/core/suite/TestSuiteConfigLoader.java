package com.batrun.core.suite;

import com.batrun.core.error.SuiteConfigException;
import com.batrun.core.model.TestSuiteConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the {@code test-suite.json} file at the root of a test suite directory.
 */
@Component
public class TestSuiteConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(TestSuiteConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "test-suite.json";

    private final ObjectMapper objectMapper;

    public TestSuiteConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @throws SuiteConfigException if the file cannot be read, is not valid JSON,
     *                              or lacks the suite name or driver
     */
    public TestSuiteConfig load(Path testSuiteDir) {
        Path configPath = testSuiteDir.resolve(CONFIG_FILE_NAME);
        String contents;
        try {
            contents = Files.readString(configPath);
        } catch (IOException e) {
            throw SuiteConfigException.unreadable(configPath, e);
        }

        TestSuiteConfig config;
        try {
            config = objectMapper.readValue(contents, TestSuiteConfig.class);
        } catch (JsonProcessingException e) {
            throw SuiteConfigException.invalid(configPath, e);
        }
        if (config == null || isBlank(config.name()) || isBlank(config.driver())) {
            throw SuiteConfigException.invalid(configPath,
                    new IllegalArgumentException("`name` and `driver` are required"));
        }
        log.debug("Loaded suite config {} (driver {}, {} targets)",
                config.name(), config.driver(), config.targets().size());
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
