package com.purchasingpower.thesugraph.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.thesugraph.model.render.RenderResult;
import com.purchasingpower.thesugraph.service.GraphRenderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Renders the configured document once at startup when {@code thesu.run-on-startup=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "thesu", name = "run-on-startup", havingValue = "true")
public class GraphRenderRunner implements ApplicationRunner {

    private final GraphRenderService renderService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) {
        RenderResult result = renderService.render();
        try {
            log.info("Render summary: {}", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize render summary: {}", e.getMessage());
        }
    }
}
