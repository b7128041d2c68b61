package io.surfworks.einforge.benchmark.instance;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when an instance file is readable but does not describe a valid instance.
 */
public class InstanceFormatException extends IOException {

    private final Path file;

    public InstanceFormatException(Path file, String message) {
        super(file.getFileName() + ": " + message);
        this.file = file;
    }

    public InstanceFormatException(Path file, String message, Throwable cause) {
        super(file.getFileName() + ": " + message, cause);
        this.file = file;
    }

    /**
     * The offending instance file.
     */
    public Path file() {
        return file;
    }
}
