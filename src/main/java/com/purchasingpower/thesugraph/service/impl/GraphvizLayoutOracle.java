package com.purchasingpower.thesugraph.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.thesugraph.configuration.LayoutProperties;
import com.purchasingpower.thesugraph.configuration.ThesuProperties;
import com.purchasingpower.thesugraph.exception.LayoutOracleException;
import com.purchasingpower.thesugraph.model.layout.NodePosition;
import com.purchasingpower.thesugraph.service.LayoutOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a Graphviz engine with {@code -Tplain} and reads the node coordinates back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphvizLayoutOracle implements LayoutOracle {

    private final ThesuProperties properties;

    @Override
    public Map<String, NodePosition> layout(String dotText, String rankDir) {
        Preconditions.checkNotNull(dotText, "DOT text cannot be null");
        LayoutProperties layout = properties.getLayout();
        List<String> command = List.of(executable(layout), "-Tplain", "-Grankdir=" + rankDir);
        log.debug("Running layout engine: {}", command);

        Path output = null;
        try {
            output = Files.createTempFile("thesu-layout", ".plain");
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true); // Merge stderr into the captured output
            builder.redirectOutput(output.toFile());
            Process process = builder.start();

            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(dotText.getBytes(StandardCharsets.UTF_8));
            }

            if (!process.waitFor(layout.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new LayoutOracleException("Layout engine timed out after " + layout.getTimeoutSeconds() + "s", "");
            }
            String plain = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new LayoutOracleException("Layout engine exited with code " + process.exitValue(), plain);
            }
            Map<String, NodePosition> positions = parsePlain(plain);
            log.debug("Layout engine placed {} node(s)", positions.size());
            return positions;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LayoutOracleException("Layout interrupted", e);
        } catch (IOException e) {
            throw new LayoutOracleException("Failed to run layout engine " + command.get(0), e);
        } finally {
            deleteQuietly(output);
        }
    }

    /**
     * Reads {@code node <name> <x> <y> ...} lines of Graphviz plain output.
     */
    static Map<String, NodePosition> parsePlain(String plain) {
        Map<String, NodePosition> positions = new LinkedHashMap<>();
        for (String line : plain.split("\\R")) {
            if (!line.startsWith("node ")) {
                continue;
            }
            List<String> tokens = tokenize(line, 4);
            if (tokens.size() < 4) {
                continue;
            }
            try {
                positions.put(tokens.get(1), new NodePosition(Double.parseDouble(tokens.get(2)), Double.parseDouble(tokens.get(3))));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparsable layout line: {}", line);
            }
        }
        return positions;
    }

    /**
     * Splits on spaces, honouring double-quoted tokens with backslash escapes.
     */
    static List<String> tokenize(String line, int limit) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < line.length() && tokens.size() < limit) {
            char c = line.charAt(i);
            if (c == ' ') {
                i++;
                continue;
            }
            StringBuilder token = new StringBuilder();
            if (c == '"') {
                i++;
                while (i < line.length() && line.charAt(i) != '"') {
                    if (line.charAt(i) == '\\' && i + 1 < line.length()) {
                        i++;
                    }
                    token.append(line.charAt(i++));
                }
                i++;
            } else {
                while (i < line.length() && line.charAt(i) != ' ') {
                    token.append(line.charAt(i++));
                }
            }
            tokens.add(token.toString());
        }
        return tokens;
    }

    private static String executable(LayoutProperties layout) {
        if (Strings.isNullOrEmpty(layout.getGraphvizPath()) || layout.getGraphvizPath().isBlank()) {
            return layout.getEngine();
        }
        return Path.of(layout.getGraphvizPath(), layout.getEngine()).toString();
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary layout file {}", file, e);
        }
    }
}
