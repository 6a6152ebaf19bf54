package com.elime.service;

import java.nio.file.Path;

/**
 * A file the run cannot do without is gone: a cascade definition, or a photo
 * the store still refers to at render time.
 */
public class ResourceMissingException extends RuntimeException {

    private final Path path;

    public ResourceMissingException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
