package com.slipway.core.engine;

import com.slipway.core.model.PipelineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    /** Fails startup with PipelineDefinitionException when the stage list is invalid. */
    @Bean
    public PipelineDefinition pipelineDefinition(PipelineProperties properties) {
        var definition = PipelineDefinitionFactory.create(properties);
        log.info("Pipeline for {} loaded: {} stage(s), image reference mode {}",
                definition.repository(),
                definition.stages().size(),
                definition.imageReferenceMode());
        return definition;
    }
}
