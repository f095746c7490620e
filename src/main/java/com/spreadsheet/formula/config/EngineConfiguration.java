package com.spreadsheet.formula.config;

import com.spreadsheet.formula.functions.BuiltInFunctions;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.GridBounds;
import com.spreadsheet.formula.parser.ReferenceAdjuster;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine collaborators shared by every session.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public GridBounds gridBounds(EngineProperties properties) {
        return new GridBounds(properties.getGrid().getMaxColumns(), properties.getGrid().getMaxRows());
    }

    /**
     * Built-in functions are stateless apart from the clock, so one registry serves all sessions.
     */
    @Bean
    public FunctionRegistry functionRegistry(Clock clock) {
        return BuiltInFunctions.createRegistry(clock);
    }

    @Bean
    public ReferenceAdjuster referenceAdjuster(GridBounds gridBounds) {
        return new ReferenceAdjuster(gridBounds);
    }
}
