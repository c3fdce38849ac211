package com.refactorguard.config;

import com.refactorguard.classifier.RiskModelStore;
import com.refactorguard.classifier.RiskModelTrainer;
import com.refactorguard.features.FeatureExtractor;
import com.refactorguard.features.FeatureVector;
import com.refactorguard.parser.SourceParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RefactoringProperties.class)
public class RefactoringConfiguration {

    @Bean
    public SourceParser sourceParser() {
        return new SourceParser();
    }

    @Bean
    public FeatureExtractor featureExtractor() {
        return new FeatureExtractor();
    }

    @Bean
    public RiskModelStore riskModelStore() {
        return new RiskModelStore(FeatureVector.SCHEMA);
    }

    @Bean
    public RiskModelTrainer riskModelTrainer(FeatureExtractor featureExtractor, RefactoringProperties properties) {
        return new RiskModelTrainer(featureExtractor, RiskModelTrainer.DEFAULT_SEED, properties.toConfig().getThreads());
    }
}
