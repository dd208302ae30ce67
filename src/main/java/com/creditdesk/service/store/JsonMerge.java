package com.creditdesk.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Merge rules of the snapshot JSON tree.
 */
final class JsonMerge {

    static final String TYPE_FIELD = "type";

    private JsonMerge() {
    }

    /**
     * Deep merge {@code patch} into {@code target}: objects merge field by field,
     * arrays and scalars replace. An object whose {@code type} discriminator
     * changes is a different variant and replaces the old one wholesale.
     */
    static ObjectNode deepMerge(ObjectNode target, ObjectNode patch) {
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode incoming = field.getValue();
            if (incoming == null || incoming.isNull()) {
                continue;
            }
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode currentObject
                    && incoming instanceof ObjectNode incomingObject
                    && sameVariant(currentObject, incomingObject)) {
                deepMerge(currentObject, incomingObject);
            } else {
                target.set(field.getKey(), incoming.deepCopy());
            }
        }
        return target;
    }

    /**
     * First-level merge: every field present in the patch replaces the target's.
     */
    static ObjectNode shallowMerge(ObjectNode target, ObjectNode patch) {
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue() != null && !field.getValue().isNull()) {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return target;
    }

    private static boolean sameVariant(ObjectNode current, ObjectNode incoming) {
        JsonNode incomingType = incoming.get(TYPE_FIELD);
        if (incomingType == null || !incomingType.isTextual()) {
            return true;
        }
        JsonNode currentType = current.get(TYPE_FIELD);
        return currentType != null && incomingType.asText().equals(currentType.asText());
    }
}
