package com.purchasingpower.thesugraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "thesu")
public class ThesuProperties {

    /**
     * Render once when the application context is ready.
     */
    private boolean runOnStartup = false;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PathProperties paths = new PathProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private FilterProperties filters = new FilterProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LayoutProperties layout = new LayoutProperties();
}
