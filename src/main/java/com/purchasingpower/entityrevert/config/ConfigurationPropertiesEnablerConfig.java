package com.purchasingpower.entityrevert.config;

import com.purchasingpower.entityrevert.configuration.AppProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code app.*} properties, bound from application.yml.
 *
 * <p>Kept out of the application class so that web slice tests do not have to
 * supply a repository directory.
 */
@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class ConfigurationPropertiesEnablerConfig {
}
