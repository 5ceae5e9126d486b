package com.purchasingpower.thesugraph.model.ids;

/**
 * Read-only view of every node id and edge endpoint emitted so far.
 */
public interface EmittedIds {

    boolean contains(String id);

    /**
     * Whether any emitted id contains {@code fragment}.
     */
    boolean anyContains(String fragment);
}
