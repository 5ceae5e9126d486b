package com.purchasingpower.thesugraph.service.lowering;

import lombok.Builder;
import lombok.Value;
import org.w3c.dom.Element;

/**
 * One phase node emitted for a thesis or proposition sequence.
 */
@Value
@Builder
public class PhaseRecord {

    String phaseId;
    String sequenceId;
    String clusterId;
    int phaseNumber;
    /** 1-based phases group, or {@code null} when the phase sits outside any group. */
    Integer groupNumber;
    int numberInGroup;
    /** Paraphrasis wrapped for an HTML label. */
    String paraphrasis;
    String originalXmlId;
    Element element;
}
