package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.style.Manifestation;
import com.purchasingpower.thesugraph.model.style.Palette;

/**
 * Colours and line style of a THESIS, shared with its mediators and sequence.
 */
public record ThesisStyle(Manifestation manifestation, Palette palette, String style) {

    public static ThesisStyle of(Manifestation manifestation) {
        if (manifestation.isUnstated()) {
            return new ThesisStyle(manifestation, Palette.THESIS_UNSTATED, "rounded,filled,dashed");
        }
        return new ThesisStyle(manifestation, Palette.THESIS, "rounded,filled");
    }
}
