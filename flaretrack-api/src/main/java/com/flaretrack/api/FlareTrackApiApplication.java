package com.flaretrack.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * FlareTrack API Application
 *
 * Flare event store and derived analytics for personal symptom tracking.
 */
@SpringBootApplication(scanBasePackages = "com.flaretrack")
@EntityScan(basePackages = "com.flaretrack.core.domain")
@EnableJpaRepositories(basePackages = "com.flaretrack.core.repository")
public class FlareTrackApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlareTrackApiApplication.class, args);
    }
}
