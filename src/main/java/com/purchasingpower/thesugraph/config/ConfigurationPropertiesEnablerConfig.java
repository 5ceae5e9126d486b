package com.purchasingpower.thesugraph.config;

import com.purchasingpower.thesugraph.configuration.ThesuProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes with Spring's binder.
 *
 * <ul>
 *   <li>{@link ThesuProperties} - input/output paths, document filters and layout engine settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    ThesuProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
    // Binding is handled by @EnableConfigurationProperties.
}
