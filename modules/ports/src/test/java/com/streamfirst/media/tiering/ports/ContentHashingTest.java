package com.streamfirst.media.tiering.ports;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashingTest {

    @Test
    void sha256_is_lowercase_hex() {
        assertThat(ContentHashing.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(ContentHashing.sha256Hex(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void mime_type_follows_extension() {
        assertThat(ContentHashing.mimeTypeFor("profiles/p1/2024/01/a.JPG")).isEqualTo("image/jpeg");
        assertThat(ContentHashing.mimeTypeFor("clip.mp4")).isEqualTo("video/mp4");
        assertThat(ContentHashing.mimeTypeFor("profiles/p1/noext")).isEqualTo(ContentHashing.DEFAULT_MIME_TYPE);
        assertThat(ContentHashing.mimeTypeFor("archive.tar.zst")).isEqualTo(ContentHashing.DEFAULT_MIME_TYPE);
    }

    @Test
    void file_name_is_last_segment() {
        assertThat(ContentHashing.fileName("profiles/p1/2024/01/a.jpg")).isEqualTo("a.jpg");
        assertThat(ContentHashing.fileName("a.jpg")).isEqualTo("a.jpg");
    }
}
