package com.purchasingpower.thesugraph.service.impl;

import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.service.DocumentFilterService;
import com.purchasingpower.thesugraph.service.filter.DocumentFilter;
import com.purchasingpower.thesugraph.service.filter.FilterContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentFilterServiceImpl implements DocumentFilterService {

    /**
     * All {@link DocumentFilter} beans, sorted by their @Order.
     */
    private final List<DocumentFilter> filters;

    @Override
    public Map<String, Integer> applyFilters(LoadedDocument document, FilterSettings settings) {
        checkNotNull(document, "document");
        checkNotNull(settings, "settings");

        FilterContext context = new FilterContext(document, settings);
        for (DocumentFilter filter : filters) {
            String name = filter.getClass().getSimpleName();
            log.debug(">> Applying Filter: {}", name);
            try {
                filter.apply(context);
            } catch (RuntimeException e) {
                if (!filter.isFailSoft()) {
                    throw e;
                }
                log.warn("⚠️ Filter {} failed, continuing without it: {}", name, e.getMessage(), e);
            }
        }
        log.info("✅ Document filters applied: {}", context.getRemovals());
        return context.getRemovals();
    }
}
