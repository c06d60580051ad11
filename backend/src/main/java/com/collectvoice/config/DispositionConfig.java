package com.collectvoice.config;

import com.collectvoice.disposition.rules.DispositionRuleTable;
import com.collectvoice.disposition.service.DispositionClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Configuration
public class DispositionConfig {

    private static final Logger log = LoggerFactory.getLogger(DispositionConfig.class);

    @Bean
    DispositionRuleTable dispositionRuleTable(AppProperties properties,
                                              ResourceLoader resourceLoader,
                                              ObjectMapper objectMapper) {
        String location = properties.classifier().rulesLocation();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream inputStream = resource.getInputStream()) {
            DispositionRuleTable table = DispositionRuleTable.load(inputStream, objectMapper);
            log.info("Loaded {} disposition rules from {}", table.rules().size(), location);
            return table;
        } catch (IOException exception) {
            throw new IllegalStateException("Unable to open disposition rules at " + location, exception);
        }
    }

    @Bean
    DispositionClassifier dispositionClassifier(DispositionRuleTable dispositionRuleTable) {
        return new DispositionClassifier(dispositionRuleTable);
    }
}
