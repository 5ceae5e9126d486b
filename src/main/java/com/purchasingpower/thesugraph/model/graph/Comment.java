package com.purchasingpower.thesugraph.model.graph;

import lombok.Value;

@Value
public class Comment implements GraphStatement {
    String text;
}
