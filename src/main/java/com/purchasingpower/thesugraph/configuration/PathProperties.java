package com.purchasingpower.thesugraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.nio.file.Path;

@Data
public class PathProperties {

    @NotBlank
    private String baseDir = "_thesu_inputs";

    @NotBlank
    private String outputDir = "_thesu_outputs";

    @NotBlank(message = "Name of the TheSu XML file (without extension) is required")
    private String xmlName = "example";

    @NotBlank
    private String outputBasename = "example";

    public Path xmlFile() {
        return Path.of(baseDir, xmlName + ".xml");
    }

    public Path dotFile() {
        return Path.of(outputDir, outputBasename + ".dot");
    }
}
