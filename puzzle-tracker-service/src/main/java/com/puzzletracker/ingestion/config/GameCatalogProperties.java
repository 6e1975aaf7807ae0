package com.puzzletracker.ingestion.config;

import com.puzzletracker.ingestion.model.Game;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "puzzle-tracker")
public class GameCatalogProperties {
    private List<Game> games = new ArrayList<>();
}
