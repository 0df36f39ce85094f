package com.batrun.core.error;

import java.nio.file.Path;

public class OutputDirectoryException extends BatrunException {
    public OutputDirectoryException(Path directory, Throwable cause) {
        super("cannot create output directory `" + directory + "`", cause);
    }
}
