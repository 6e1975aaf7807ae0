package com.puzzletracker.ingestion;

import com.puzzletracker.ingestion.config.GameCatalogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GameCatalogProperties.class)
public class PuzzleTrackerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PuzzleTrackerServiceApplication.class, args);
    }
}
