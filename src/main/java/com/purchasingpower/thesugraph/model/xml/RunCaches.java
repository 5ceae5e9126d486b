package com.purchasingpower.thesugraph.model.xml;

import lombok.Getter;

/**
 * Memoizing caches scoped to a single render. Created at run start and dropped with the run.
 */
@Getter
public class RunCaches {

    private final DocumentCache documents = new DocumentCache();
    private final TextSegmentCache segments = new TextSegmentCache();
}
