package com.fabric.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Execution Core Runtime: Entry Point
 *
 * Intent intake, sessions, boundary contracts and the saga coordinator over the WAL and the
 * state surface.
 *
 * Port: 8080 (see application.yml)
 */
@SpringBootApplication
public class RuntimeApplication {
    public static void main(String[] args) {
        SpringApplication.run(RuntimeApplication.class, args);
    }
}
