package com.batrun.core.config;

import com.batrun.core.model.ExecutionStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatrunPropertiesTest {

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var props = new BatrunProperties();
        assertEquals(ExecutionStrategy.ROUND_ROBIN, props.getStrategy());
        assertEquals("out", props.getOutDir());
        assertEquals(0, props.getMaxParallel());
        assertFalse(props.isRunTeardownWhenSkipped());
        assertFalse(props.isMatrixSummary());
        assertEquals("bash", props.getBashExecutable());
    }

    @Test
    @DisplayName("binds kebab-case keys under batrun.*")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.of(
                "batrun.execution.strategy", "parallel",
                "batrun.execution.out-dir", "/tmp/results",
                "batrun.execution.max-parallel", "4",
                "batrun.execution.run-teardown-when-skipped", "true",
                "batrun.report.matrix-summary", "true",
                "batrun.bash.executable", "/usr/local/bin/bash"));

        var props = new Binder(source).bind("batrun", BatrunProperties.class).get();

        assertEquals(ExecutionStrategy.PARALLEL, props.getStrategy());
        assertEquals("/tmp/results", props.getOutDir());
        assertEquals(4, props.getMaxParallel());
        assertTrue(props.isRunTeardownWhenSkipped());
        assertTrue(props.isMatrixSummary());
        assertEquals("/usr/local/bin/bash", props.getBashExecutable());
    }
}
