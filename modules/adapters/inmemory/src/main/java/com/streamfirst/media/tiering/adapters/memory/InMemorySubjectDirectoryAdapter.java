package com.streamfirst.media.tiering.adapters.memory;

import com.streamfirst.media.tiering.ports.SubjectDirectoryPort;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory username lookup for testing and development.
 */
public class InMemorySubjectDirectoryAdapter implements SubjectDirectoryPort {

    private final Map<String, String> usernames = new ConcurrentHashMap<>();

    public InMemorySubjectDirectoryAdapter register(String personId, String username) {
        usernames.put(personId, username);
        return this;
    }

    @Override
    public Optional<String> usernameFor(String personId) {
        return Optional.ofNullable(usernames.get(personId)).filter(u -> !u.isBlank());
    }
}
