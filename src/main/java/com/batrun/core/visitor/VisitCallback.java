package com.batrun.core.visitor;

import com.batrun.core.model.ShouldSkip;
import com.batrun.core.model.TestCase;
import com.batrun.core.model.TestCaseRole;

/**
 * Invoked by {@link TestSuiteVisitor} for each visited test case.
 */
@FunctionalInterface
public interface VisitCallback {

    /**
     * @param testCase   the visited test case
     * @param role       position of the case in the suite hierarchy
     * @param shouldSkip skip advice computed from the setup outcomes seen so far
     * @return {@code true} if the visit succeeded; a {@code false} returned for a
     *         setup case raises the skip flag of its scope
     */
    boolean visit(TestCase testCase, TestCaseRole role, ShouldSkip shouldSkip);
}
