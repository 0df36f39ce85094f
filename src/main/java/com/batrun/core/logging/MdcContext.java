package com.batrun.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing batrun-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTarget(String suite, String target) {
        MDC.put("suite", suite);
        MDC.put("target", target);
    }

    public static void setTestCase(String suite, String target, String testCaseId) {
        MDC.put("suite", suite);
        MDC.put("target", target);
        MDC.put("testCase", testCaseId);
    }

    public static void clearTestCase() {
        MDC.remove("testCase");
    }

    public static void clear() {
        MDC.remove("suite");
        MDC.remove("target");
        MDC.remove("testCase");
    }
}
