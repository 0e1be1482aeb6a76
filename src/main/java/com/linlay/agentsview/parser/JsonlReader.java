package com.linlay.agentsview.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Line-by-line JSONL reading shared by both record grammars. Blank lines and lines that are
 * not a JSON object are dropped silently; a missing trailing newline is fine.
 */
final class JsonlReader {

    private final ObjectMapper objectMapper;

    JsonlReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the number of records handed to {@code consumer}
     * @throws IOException when the file cannot be opened or read
     */
    int forEachRecord(Path file, Consumer<JsonNode> consumer) throws IOException {
        int records = 0;
        // InputStreamReader replaces malformed UTF-8 instead of failing the whole file
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                JsonNode node = parseLine(line);
                if (node == null) {
                    continue;
                }
                consumer.accept(node);
                records++;
            }
        }
        return records;
    }

    JsonNode parseLine(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(line);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
