package com.streamfirst.media.tiering.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Operator entry point. Wires the tiering services and runs the command given on the command
 * line; see {@link VerificationRunner}.
 */
@SpringBootApplication
public class MediaTieringApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaTieringApplication.class, args);
    }
}
