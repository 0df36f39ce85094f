package com.batrun.core.error;

/**
 * Thrown at discovery when a test case name is ambiguous within its scope.
 */
public class DuplicateTestCaseException extends BatrunException {
    public DuplicateTestCaseException(String name) {
        super("multiple test functions found with name `" + name + "`");
    }
}
