package org.accesstwin.consult.gateway.privacy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flattens UDL and POUR mappings into tag sets.
 *
 * <p>A mapping may arrive as a map of principle to checkpoints, a flat list, a JSON
 * string of either, or a comma-separated string. Malformed JSON folds to nothing.
 */
public final class TagFolder {

    private static final Logger logger = LoggerFactory.getLogger(TagFolder.class);

    private final ObjectMapper objectMapper;

    public TagFolder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Normalizes a raw mapping to a JSON tree. Returns a missing node for null,
     * blank or unparsable input.
     */
    public JsonNode parse(Object raw) {
        if (raw == null) {
            return MissingNode.getInstance();
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            if (text.isEmpty()) {
                return MissingNode.getInstance();
            }
            if (text.startsWith("{") || text.startsWith("[")) {
                try {
                    return objectMapper.readTree(text);
                } catch (JsonProcessingException e) {
                    logger.debug("Ignoring malformed tag mapping: {}", e.getOriginalMessage());
                    return MissingNode.getInstance();
                }
            }
            return TextNode.valueOf(text);
        }
        try {
            return objectMapper.valueToTree(raw);
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring unconvertible tag mapping of type {}", raw.getClass().getName());
            return MissingNode.getInstance();
        }
    }

    /**
     * UDL tags: the checkpoint values of a map, or the items of a list or string.
     */
    public Set<String> foldUdl(Object raw) {
        return fold(parse(raw), false);
    }

    /**
     * POUR tags: the principle keys and detail values of a map, or the items of a
     * list or string.
     */
    public Set<String> foldPour(Object raw) {
        return fold(parse(raw), true);
    }

    private static Set<String> fold(JsonNode node, boolean includeKeys) {
        Set<String> tags = new TreeSet<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (includeKeys) {
                    addTag(tags, field.getKey());
                }
                addValues(tags, field.getValue());
            }
        } else if (node.isArray()) {
            addValues(tags, node);
        } else if (node.isTextual()) {
            for (String item : node.asText().split(",")) {
                addTag(tags, item);
            }
        }
        return tags;
    }

    private static void addValues(Set<String> tags, JsonNode value) {
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isValueNode() && !item.isNull()) {
                    addTag(tags, item.asText());
                }
            }
        } else if (value.isValueNode() && !value.isNull()) {
            addTag(tags, value.asText());
        }
    }

    private static void addTag(Set<String> tags, String tag) {
        String trimmed = tag.trim();
        if (!trimmed.isEmpty()) {
            tags.add(trimmed);
        }
    }
}
