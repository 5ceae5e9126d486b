package com.purchasingpower.thesugraph.service;

import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.render.RenderResult;

import java.nio.file.Path;

/**
 * Turns a TheSu document into a DOT file: load, filter, lower, rewrite, correct, write.
 */
public interface GraphRenderService {

    /**
     * Renders the document configured under {@code thesu.paths} with the configured filters.
     */
    RenderResult render();

    /**
     * @throws com.purchasingpower.thesugraph.exception.DocumentLoadException if the primary document is unreadable;
     *         nothing is written in that case
     */
    RenderResult render(Path xmlFile, Path baseDir, Path dotFile, FilterSettings settings);

    /**
     * Same pipeline, returning the DOT text without writing it.
     */
    String renderToText(Path xmlFile, Path baseDir, FilterSettings settings);
}
