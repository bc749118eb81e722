package com.purchasingpower.flowinsight.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link ModelConfig} - provider, model and temperature resolution</li>
 *   <li>{@link AnalysisConfig} - thresholds and limits of the analysis pipeline</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    ModelConfig.class,
    AnalysisConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
