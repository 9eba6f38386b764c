package com.whereq.forge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Forge.
 * Runs a pool of queue workers that drive multi-stage generation jobs
 * (script, voice, video, compositing and the like) through external generation services.
 * <p>
 * Usage: {@code java -jar whereq-forge.jar [worker-id]}
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class ForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgeApplication.class, args);
    }
}
