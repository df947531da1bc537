package com.spreadsheet.formula.config;

import com.spreadsheet.formula.engine.FormulaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the engine from {@link FormulaProperties}. The engine itself has no Spring dependency.
 */
@Configuration
public class FormulaEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngineConfig.class);

    @Bean
    public Clock formulaClock(FormulaProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }

    @Bean
    public FormulaEngine formulaEngine(FormulaProperties properties, Clock formulaClock) {
        log.info("Formula engine: max cell depth {}, max expression depth {}, max range cells {}, time zone {}",
                properties.getMaxCellDepth(), properties.getMaxExpressionDepth(),
                properties.getMaxRangeCells(), formulaClock.getZone());
        return new FormulaEngine(properties.getMaxCellDepth(), properties.getMaxExpressionDepth(),
                properties.getMaxRangeCells(), formulaClock);
    }
}
