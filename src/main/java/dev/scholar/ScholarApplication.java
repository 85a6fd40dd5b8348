package dev.scholar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Scholar research retrieval service.
 *
 * <p>Exposes hybrid document + web search over REST ({@code /api/**}) and as MCP tools.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScholarApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScholarApplication.class, args);
    }
}
