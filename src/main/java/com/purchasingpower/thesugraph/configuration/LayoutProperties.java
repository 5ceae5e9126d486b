package com.purchasingpower.thesugraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class LayoutProperties {

    @NotBlank
    @Pattern(regexp = "dot|fdp|neato", message = "Layout engine must be one of dot, fdp, neato")
    private String engine = "dot";

    /** Directory containing the Graphviz binaries; blank means resolve from PATH. */
    private String graphvizPath = "";

    @Min(1)
    private int timeoutSeconds = 30;

    private boolean directionCorrection = true;
}
