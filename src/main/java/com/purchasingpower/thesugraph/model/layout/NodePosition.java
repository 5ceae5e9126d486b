package com.purchasingpower.thesugraph.model.layout;

import lombok.Value;

/**
 * Node centre as reported by the layout engine, in inches, y growing upwards.
 */
@Value
public class NodePosition {
    double x;
    double y;
}
