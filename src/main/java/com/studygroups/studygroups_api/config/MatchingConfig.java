package com.studygroups.studygroups_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.studygroups.studygroups_api.matching.CompatibilityScorer;
import com.studygroups.studygroups_api.matching.GroupFormationEngine;
import com.studygroups.studygroups_api.matching.TargetSizeResolver;

/**
 * Wires the group formation engine from the {@code matching.*} properties.
 */
@Configuration
public class MatchingConfig {

    private static final Logger logger = LoggerFactory.getLogger(MatchingConfig.class);

    @Value("${matching.base-score:5}")
    private int baseScore;

    @Value("${matching.min-group-size:2}")
    private int minGroupSize;

    @Value("${matching.max-group-size:5}")
    private int maxGroupSize;

    @Value("${matching.default-group-size:3}")
    private int defaultGroupSize;

    @Bean
    public CompatibilityScorer compatibilityScorer() {
        return new CompatibilityScorer(baseScore);
    }

    @Bean
    public TargetSizeResolver targetSizeResolver() {
        return new TargetSizeResolver(minGroupSize, maxGroupSize, defaultGroupSize);
    }

    @Bean
    public GroupFormationEngine groupFormationEngine(CompatibilityScorer compatibilityScorer,
                                                     TargetSizeResolver targetSizeResolver) {
        logger.info("Group formation: base score {}, group size range [{}, {}], default {}",
                baseScore, targetSizeResolver.getMinSize(), targetSizeResolver.getMaxSize(), targetSizeResolver.getDefaultSize());
        return new GroupFormationEngine(compatibilityScorer, targetSizeResolver);
    }
}
