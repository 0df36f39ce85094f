package com.batrun.driver;

import com.batrun.core.config.BatrunProperties;
import com.batrun.core.error.DuplicateTestCaseException;
import com.batrun.core.error.NoTestFoundException;
import com.batrun.core.error.TestDriverException;
import com.batrun.core.error.TestFileExecException;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestFile;
import com.batrun.core.model.TestSuite;
import com.batrun.core.model.TestSuiteConfig;
import com.batrun.core.model.TestSuiteFixture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Test driver for bash scripts.
 * <p>
 * In a test file, the functions named {@code setup} and {@code teardown} form the
 * file's local fixture and every function prefixed with {@code test_} is a test
 * case. The suite's global fixture file, when configured, provides the suite-level
 * {@code setup} and {@code teardown} and is sourced before every test file.
 * <p>
 * A function is called with the target name and its output directory as
 * arguments; its output goes to {@code <outDir>/<function>.log}. Exit status 0
 * means passed, 255 means the case skipped itself, anything else failed.
 *
 * <p>This class shells out to {@code bash} via {@link ProcessBuilder}; scripts
 * and values are passed as positional parameters, never spliced into the
 * command string.
 */
@Component
public class BashTestDriver implements TestDriver {

    private static final Logger log = LoggerFactory.getLogger(BashTestDriver.class);

    static final String SETUP_FN_NAME = "setup";
    static final String TEARDOWN_FN_NAME = "teardown";
    static final String TEST_FN_PREFIX = "test_";
    static final int SKIP_EXIT_STATUS = 255;

    private static final long DESTROY_GRACE_MILLIS = 2000;

    // name() {, name () {, function name {, function name() {
    private static final Pattern FUNCTION_DEFINITION = Pattern.compile(
            "^\\s*(?:function\\s+([A-Za-z_][\\w:.-]*)\\s*(?:\\(\\s*\\))?|([A-Za-z_][\\w:.-]*)\\s*\\(\\s*\\))");

    private static final String LIST_FUNCTIONS_SCRIPT =
            "source \"$1\"; compgen -A function | grep \"$2\"";
    private static final String RUN_FUNCTION_SCRIPT =
            "if [ -n \"$1\" ]; then source \"$1\"; fi; source \"$2\"; \"$3\" \"$4\" \"$5\" &> \"$6\"";

    private final String bashExecutable;

    @Autowired
    public BashTestDriver(BatrunProperties properties) {
        this(properties.getBashExecutable());
    }

    public BashTestDriver(String bashExecutable) {
        this.bashExecutable = bashExecutable;
    }

    @Override
    public String name() {
        return "bash";
    }

    @Override
    public List<String> testFilePatternsDefault() {
        return List.of("*.sh", "*.bash");
    }

    @Override
    public TestSuite discoverTests(Path testSuiteDir, TestSuiteConfig config) {
        var fixture = discoverSuiteFixture(testSuiteDir, config);
        var testFiles = new ArrayList<TestFile>();

        for (Path localPath : discoverTestFiles(testSuiteDir, config)) {
            Path filePath = testSuiteDir.resolve(localPath);
            var setup = namedFunction(filePath, SETUP_FN_NAME);
            var teardown = namedFunction(filePath, TEARDOWN_FN_NAME);
            var testCases = functions(filePath, "^" + TEST_FN_PREFIX).stream()
                    .map(fn -> new TestCase(localPath, fn))
                    .toList();
            if (testCases.isEmpty() && setup == null && teardown == null) {
                log.debug("Ignoring {}: no test function", localPath);
                continue;
            }
            checkSingleDefinitions(filePath, testCases, setup, teardown);
            testFiles.add(new TestFile(
                    localPath,
                    setup != null ? new TestCase(localPath, setup) : null,
                    teardown != null ? new TestCase(localPath, teardown) : null,
                    testCases));
        }

        if (testFiles.isEmpty() && fixture.setup() == null && fixture.teardown() == null) {
            throw new NoTestFoundException(testSuiteDir);
        }
        log.info("Discovered {} test files in {}", testFiles.size(), testSuiteDir);
        return new TestSuite(testSuiteDir, config, testFiles, fixture);
    }

    @Override
    public RunTestOutput runTest(Path testSuiteDir, TestSuiteConfig config, String target,
                                 TestCase testCase, Path outDir) {
        String globalFixture = config.globalFixtureFile()
                .map(f -> testSuiteDir.resolve(f).toString())
                .orElse("");
        Path logFile = outDir.resolve(testCase.name() + ".log");

        var command = List.of(bashExecutable, "-x", "-c", RUN_FUNCTION_SCRIPT, "batrun",
                globalFixture,
                testSuiteDir.resolve(testCase.path()).toString(),
                testCase.name(),
                target,
                outDir.toString(),
                logFile.toString());
        log.debug("Running {} for target {}", testCase.id(), target);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(testSuiteDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new TestDriverException("cannot execute test driver command `" + bashExecutable + "`", e);
        }

        // The bash trace is drained off-thread so that only waitFor() blocks
        var drain = new Thread(() -> logTrace(process.getInputStream()), "bash-trace-" + testCase.name());
        drain.setDaemon(true);
        drain.start();
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            destroy(process);
            Thread.currentThread().interrupt();
            throw new TestDriverException("interrupted while running " + testCase.id(), e);
        }

        String driverOutput = logFile.toString();
        if (exitCode == 0) {
            return RunTestOutput.passed(driverOutput);
        }
        if (exitCode == SKIP_EXIT_STATUS) {
            return RunTestOutput.skipped("test case requested skip (exit status " + SKIP_EXIT_STATUS + ")",
                    driverOutput);
        }
        log.debug("{} exited with status {} for target {}", testCase.id(), exitCode, target);
        return RunTestOutput.failed(driverOutput);
    }

    private TestSuiteFixture discoverSuiteFixture(Path testSuiteDir, TestSuiteConfig config) {
        return config.globalFixtureFile()
                .map(Path::of)
                .map(localPath -> {
                    Path fixturePath = testSuiteDir.resolve(localPath);
                    var setup = namedFunction(fixturePath, SETUP_FN_NAME);
                    var teardown = namedFunction(fixturePath, TEARDOWN_FN_NAME);
                    return new TestSuiteFixture(
                            setup != null ? new TestCase(localPath, setup) : null,
                            teardown != null ? new TestCase(localPath, teardown) : null);
                })
                .orElse(TestSuiteFixture.none());
    }

    /**
     * Returns the function named exactly {@code fnName}, or {@code null} when the
     * file does not define it.
     */
    String namedFunction(Path filePath, String fnName) {
        var found = functions(filePath, "^" + fnName + "$");
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Bash silently keeps the last of several definitions of one function, so
     * repeated definitions are looked up in the file text.
     *
     * @throws DuplicateTestCaseException if a discovered function is defined more than once
     */
    void checkSingleDefinitions(Path filePath, List<TestCase> testCases, String setup, String teardown) {
        var counts = definitionCounts(filePath);
        var names = new ArrayList<String>();
        testCases.forEach(tc -> names.add(tc.name()));
        if (setup != null) {
            names.add(setup);
        }
        if (teardown != null) {
            names.add(teardown);
        }
        for (String name : names) {
            if (counts.getOrDefault(name, 0) > 1) {
                throw new DuplicateTestCaseException(name);
            }
        }
    }

    static Map<String, Integer> definitionCounts(Path filePath) {
        List<String> lines;
        try {
            lines = Files.readAllLines(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TestDriverException("cannot read test file `" + filePath + "`", e);
        }
        var counts = new HashMap<String, Integer>();
        for (String line : lines) {
            Matcher m = FUNCTION_DEFINITION.matcher(line);
            if (m.find()) {
                String name = m.group(1) != null ? m.group(1) : m.group(2);
                counts.merge(name, 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Lists the functions defined by {@code filePath} whose name matches
     * {@code fnRegex}, as sorted by {@code compgen}.
     */
    List<String> functions(Path filePath, String fnRegex) {
        var command = List.of(bashExecutable, "-c", LIST_FUNCTIONS_SCRIPT, "batrun",
                filePath.toString(), fnRegex);
        try {
            var process = new ProcessBuilder(command)
                    .directory(filePath.toAbsolutePath().getParent().toFile())
                    .redirectErrorStream(false)
                    .start();

            var stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
            String stdout = readAll(process.getInputStream());
            int exitCode = process.waitFor();
            String errors = stderr.join();

            if (exitCode == 0) {
                return stdout.lines()
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toList());
            }
            if (stdout.isBlank() && errors.isBlank()) {
                // grep found nothing
                return List.of();
            }
            throw new TestFileExecException(filePath, errors.strip());
        } catch (IOException | UncheckedIOException e) {
            throw new TestDriverException("cannot execute test driver command `" + bashExecutable + "`", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestDriverException("interrupted while reading " + filePath, e);
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void logTrace(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.trace("bash: {}", line);
            }
        } catch (IOException e) {
            log.debug("bash trace closed: {}", e.getMessage());
        }
    }

    /**
     * Terminates bash and the processes it started, forcibly if they outlive
     * the grace period.
     */
    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }
}
