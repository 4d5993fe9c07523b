package com.phillippitts.actiontracker.exception;

import java.nio.file.Path;

/**
 * Thrown when merging a summary into the accumulation file fails.
 * This may occur due to I/O errors, lock acquisition failure or an unwritable path.
 */
public class AccumulationException extends ActionTrackerException {

    private final Path file;

    public AccumulationException(String message, Path file, Throwable cause) {
        super(message + " (file: " + file + ")", cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
