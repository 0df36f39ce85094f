package com.batrun.driver;

import com.batrun.core.model.SkipReason;
import com.batrun.core.model.TestCaseStatus;

/**
 * Result of a test driver running one test case.
 *
 * @param status       PASSED, FAILED or SKIPPED
 * @param skipReason   why the case skipped itself; set only when {@code status} is SKIPPED
 * @param driverOutput driver-specific information (e.g. the log file), nullable
 */
public record RunTestOutput(
    TestCaseStatus status,
    SkipReason skipReason,
    String driverOutput
) {

    public RunTestOutput {
        if (status != TestCaseStatus.PASSED && status != TestCaseStatus.FAILED
                && status != TestCaseStatus.SKIPPED) {
            throw new IllegalArgumentException("A driver can only report PASSED, FAILED or SKIPPED, got " + status);
        }
        if (status == TestCaseStatus.SKIPPED && skipReason == null) {
            skipReason = SkipReason.testCaseSpecific(null);
        }
    }

    public static RunTestOutput passed(String driverOutput) {
        return new RunTestOutput(TestCaseStatus.PASSED, null, driverOutput);
    }

    public static RunTestOutput failed(String driverOutput) {
        return new RunTestOutput(TestCaseStatus.FAILED, null, driverOutput);
    }

    public static RunTestOutput skipped(String message, String driverOutput) {
        return new RunTestOutput(TestCaseStatus.SKIPPED, SkipReason.testCaseSpecific(message), driverOutput);
    }
}
