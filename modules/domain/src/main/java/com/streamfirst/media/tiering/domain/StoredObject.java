package com.streamfirst.media.tiering.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Bytes read back from a provider, buffered whole.
 *
 * @param data the exact bytes previously written
 * @param mimeType content type reported by the backend or derived from the extension
 */
public record StoredObject(byte[] data, String mimeType) {

    public StoredObject {
        Objects.requireNonNull(data, "data cannot be null");
    }

    public long size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoredObject other)) {
            return false;
        }
        return Arrays.equals(data, other.data) && Objects.equals(mimeType, other.mimeType);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + Objects.hashCode(mimeType);
    }

    @Override
    public String toString() {
        return "StoredObject{size=" + data.length + ", mimeType=" + mimeType + '}';
    }
}
