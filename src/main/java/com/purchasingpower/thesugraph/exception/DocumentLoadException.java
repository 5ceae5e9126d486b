package com.purchasingpower.thesugraph.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The primary TheSu document could not be read or parsed. Fatal for a render.
 */
@Getter
public class DocumentLoadException extends RuntimeException {

    private final Path path;

    public DocumentLoadException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
