package io.github.yok.dataporter.gharchive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns one archive line into the JSON text stored in {@code jsonb_data}.
 *
 * <p>
 * The line is parsed and re-serialized. Optionally 1 to 3 randomly chosen top-level keys are
 * removed first, which produces documents of varying shape for GIN index experiments. The result
 * has every {@code \u0000} escape removed (PostgreSQL {@code jsonb} rejects it) and backticks
 * replaced by single quotes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class EventTransformer {

    // JSON escape of the NUL character as written by the serializer
    private static final String NUL_ESCAPE = "\\u0000";

    private static final int MAX_DROPPED_KEYS = 3;

    private final ObjectMapper mapper;
    private final Random random;
    private final boolean randomDrop;

    /**
     * Creates a transformer.
     *
     * @param mapper JSON mapper
     * @param random source of randomness for key dropping
     * @param randomDrop whether 1 to 3 top-level keys are removed from each event
     */
    public EventTransformer(ObjectMapper mapper, Random random, boolean randomDrop) {
        this.mapper = mapper;
        this.random = random;
        this.randomDrop = randomDrop;
    }

    /**
     * Transforms one line.
     *
     * @param line one JSON document
     * @return sanitized JSON text
     * @throws JsonProcessingException if the line is not valid JSON
     */
    public String transform(String line) throws JsonProcessingException {
        JsonNode event = mapper.readTree(line);
        if (randomDrop && event instanceof ObjectNode) {
            dropRandomKeys((ObjectNode) event);
        }
        return sanitize(mapper.writeValueAsString(event));
    }

    /**
     * Removes 1 to 3 distinct, randomly chosen top-level keys (never more than the object has).
     *
     * @param event JSON object, modified in place
     * @return removed keys
     */
    List<String> dropRandomKeys(ObjectNode event) {
        List<String> keys = new ArrayList<>();
        event.fieldNames().forEachRemaining(keys::add);
        Collections.shuffle(keys, random);
        int count = Math.min(keys.size(), 1 + random.nextInt(MAX_DROPPED_KEYS));
        List<String> dropped = keys.subList(0, count);
        event.remove(dropped);
        return List.copyOf(dropped);
    }

    static String sanitize(String json) {
        return StringUtils.replace(StringUtils.remove(json, NUL_ESCAPE), "`", "'");
    }
}
