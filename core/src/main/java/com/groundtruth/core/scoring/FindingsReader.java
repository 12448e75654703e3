package com.groundtruth.core.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads agent findings: either a JSON array of objects, or an object holding a
 * {@code findings} array. Each object contributes its {@code value}, {@code table}
 * and {@code rowid} fields.
 */
public class FindingsReader {
    private final ObjectMapper mapper = new ObjectMapper();

    public List<ProvenanceTriple> read(Path file) throws IOException {
        return parse(mapper.readTree(file.toFile()));
    }

    public List<ProvenanceTriple> parse(String json) throws IOException {
        return parse(mapper.readTree(json));
    }

    private List<ProvenanceTriple> parse(JsonNode root) {
        JsonNode items = root.isObject() ? root.path("findings") : root;
        List<ProvenanceTriple> findings = new ArrayList<>();
        if (!items.isArray()) {
            return findings;
        }
        for (JsonNode item : items) {
            findings.add(ProvenanceTriple.of(
                    text(item, "value"),
                    text(item, "table"),
                    text(item, "rowid")));
        }
        return findings;
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
