package com.puzzletracker.ingestion.config;

import com.puzzletracker.parser.ShareTextParser;
import com.puzzletracker.parser.grammar.GrammarRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ParserConfig {

    @Bean
    public GrammarRegistry grammarRegistry() {
        return GrammarRegistry.defaults();
    }

    @Bean
    public ShareTextParser shareTextParser(GrammarRegistry grammarRegistry, Clock clock) {
        return new ShareTextParser(grammarRegistry, clock);
    }
}
