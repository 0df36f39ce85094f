package com.batrun.core.error;

public class UnknownTestDriverException extends BatrunException {
    public UnknownTestDriverException(String driverName) {
        super("unknown test driver `" + driverName + "`");
    }
}
