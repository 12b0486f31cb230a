package io.github.yok.dataporter.jsonimport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Walks a JSON document and reports where the importable rows are.
 *
 * <p>
 * Every object field is visited recursively. An array whose first element is an object is
 * reported as a potential row structure; its elements are not descended into.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class JsonStructureAnalyzer {

    /**
     * Analyzes a document.
     *
     * @param root parsed document
     * @return potential row structures in document order
     */
    public List<StructureSuggestion> analyze(JsonNode root) {
        log.info("Analyzing JSON structure...");
        List<StructureSuggestion> found = new ArrayList<>();
        walk(root, "", found);
        log.info("Analysis complete. Review the suggestions to determine the optimal way to"
                + " convert the data into rows.");
        return found;
    }

    private void walk(JsonNode node, String path, List<StructureSuggestion> found) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String childPath = path + "/" + field.getKey();
                log.info("Analyzing: {}", childPath);
                walk(field.getValue(), childPath, found);
            }
        } else if (node.isArray() && node.size() > 0 && node.get(0).isObject()) {
            List<String> keys = new ArrayList<>();
            node.get(0).fieldNames().forEachRemaining(keys::add);
            String display = path.isEmpty() ? "/" : path;
            log.info("Found a potential row structure at path: {} with keys: {}", display, keys);
            found.add(new StructureSuggestion(display, List.copyOf(keys)));
        }
    }
}
