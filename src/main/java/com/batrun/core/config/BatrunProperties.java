package com.batrun.core.config;

import com.batrun.core.model.ExecutionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "batrun")
public class BatrunProperties {

    private Execution execution = new Execution();
    private Report report = new Report();
    private Bash bash = new Bash();

    // -- Execution accessors (delegate to nested) --
    public ExecutionStrategy getStrategy() { return execution.strategy; }
    public String getOutDir() { return execution.outDir; }
    public int getMaxParallel() { return execution.maxParallel; }
    public boolean isRunTeardownWhenSkipped() { return execution.runTeardownWhenSkipped; }

    // -- Report accessors --
    public boolean isMatrixSummary() { return report.matrixSummary; }

    // -- Bash driver accessors --
    public String getBashExecutable() { return bash.executable; }

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Report getReport() { return report; }
    public void setReport(Report report) { this.report = report; }
    public Bash getBash() { return bash; }
    public void setBash(Bash bash) { this.bash = bash; }

    public static class Execution {
        private ExecutionStrategy strategy = ExecutionStrategy.ROUND_ROBIN;
        private String outDir = "out";
        private int maxParallel = 0;
        private boolean runTeardownWhenSkipped = false;

        public ExecutionStrategy getStrategy() { return strategy; }
        public void setStrategy(ExecutionStrategy strategy) { this.strategy = strategy; }
        public String getOutDir() { return outDir; }
        public void setOutDir(String outDir) { this.outDir = outDir; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public boolean isRunTeardownWhenSkipped() { return runTeardownWhenSkipped; }
        public void setRunTeardownWhenSkipped(boolean runTeardownWhenSkipped) { this.runTeardownWhenSkipped = runTeardownWhenSkipped; }
    }

    public static class Report {
        private boolean matrixSummary = false;

        public boolean isMatrixSummary() { return matrixSummary; }
        public void setMatrixSummary(boolean matrixSummary) { this.matrixSummary = matrixSummary; }
    }

    public static class Bash {
        private String executable = "bash";

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
    }
}
