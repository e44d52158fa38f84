package com.purchasingpower.entityrevert.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class StorageException extends RuntimeException {

    private final Path file;

    public StorageException(String message, Path file, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public StorageException(String message) {
        super(message);
        this.file = null;
    }
}
