package edu.brandeis.cosi103a.bracket.viewer;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.bracket.config.ObjectMapperFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the bracket host.
 * Serves the REST API for entering results and pushes bracket updates over WebSocket.
 */
@SpringBootApplication
@EnableScheduling
public class BracketViewerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BracketViewerApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }
}
