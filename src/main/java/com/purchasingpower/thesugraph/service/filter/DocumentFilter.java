package com.purchasingpower.thesugraph.service.filter;

/**
 * One stage of document filtering, applied to the DOM before lowering.
 * Implementations are Spring beans sorted by {@code @Order}; each must tolerate elements
 * that an earlier stage already detached.
 */
public interface DocumentFilter {

    void apply(FilterContext context);

    /**
     * When true, a failure is logged and the remaining filters still run.
     */
    default boolean isFailSoft() {
        return false;
    }
}
