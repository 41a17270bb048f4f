package com.example.compliance.service;

import com.example.compliance.exception.IngestionException;
import com.example.compliance.model.RegulationClause;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the external regulation file.
 * <p>
 * Accepted shapes: {@code {"name": ..., "clauses": [...]}} or a bare clause array. Each clause is
 * {@code {"id", "title"?, "text", "subclauses"?}}; sub-clauses are flattened depth-first after
 * their parent and keep a {@code parentId}. Entries without id or text are skipped.
 */
@Service
public class RegulationLoader {

    private static final Logger log = LoggerFactory.getLogger(RegulationLoader.class);

    private final ObjectMapper objectMapper;

    public RegulationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IngestionException if the file cannot be read or is not a regulation document
     */
    public List<RegulationClause> load(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(path));
        } catch (IOException e) {
            throw new IngestionException(path.toString(), "Unable to read regulation file: " + e.getMessage(), e);
        }
        JsonNode clauses = root != null && root.isArray() ? root : (root != null ? root.get("clauses") : null);
        if (clauses == null || !clauses.isArray()) {
            throw new IngestionException(path.toString(), "Regulation file has no 'clauses' array");
        }

        List<RegulationClause> result = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        flatten(clauses, null, result, seen);
        log.info("Loaded {} clause(s) from '{}'", result.size(), path);
        return result;
    }

    private void flatten(JsonNode array, String parentId, List<RegulationClause> out, Set<String> seen) {
        for (JsonNode node : array) {
            String id = text(node, "id");
            String body = text(node, "text");
            if (id == null || body == null) {
                log.warn("Skipping regulation entry without id or text: {}", abbreviate(node.toString()));
            } else if (!seen.add(id)) {
                log.warn("Skipping duplicate clause id '{}'", id);
            } else {
                out.add(RegulationClause.pending(id, text(node, "title"), body, parentId, Hashes.sha256(body)));
            }
            JsonNode children = node.get("subclauses");
            if (children != null && children.isArray()) {
                flatten(children, id != null ? id : parentId, out, seen);
            }
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String s = value.asText().strip();
        return s.isEmpty() ? null : s;
    }

    private static String abbreviate(String s) {
        return s.length() > 120 ? s.substring(0, 117) + "..." : s;
    }
}
