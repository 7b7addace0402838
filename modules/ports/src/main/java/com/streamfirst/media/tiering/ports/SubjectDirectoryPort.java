package com.streamfirst.media.tiering.ports;

import java.util.Optional;

/**
 * Looks up the human readable username of a subject. Used for symlink names and legacy layouts.
 */
public interface SubjectDirectoryPort {

    Optional<String> usernameFor(String personId);
}
