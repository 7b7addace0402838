package com.streamfirst.media.tiering.domain;

import java.util.Optional;

/**
 * Outcome of a provider write. On success {@code sha256} is recomputed from the buffer that was
 * handed to the backend, not assumed from the caller.
 *
 * @param success whether the bytes were stored
 * @param relativePath the path that was written
 * @param location backend-specific absolute location (filesystem path, s3 URI), empty on failure
 * @param size number of bytes written
 * @param sha256 hex digest of the written bytes, empty on failure
 * @param error reason for an expected failure, null on success
 */
public record WriteResult(boolean success, String relativePath, String location, long size,
                          String sha256, String error) {

    public static WriteResult written(String relativePath, String location, long size, String sha256) {
        return new WriteResult(true, relativePath, location, size, sha256, null);
    }

    public static WriteResult failed(String relativePath, String error) {
        return new WriteResult(false, relativePath, "", 0L, "", error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
