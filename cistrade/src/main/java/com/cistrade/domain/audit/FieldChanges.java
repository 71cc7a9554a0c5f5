package com.cistrade.domain.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Set;
import java.util.TreeSet;

/**
 * Field-level diff between a before and after snapshot.
 *
 * Output shape: {@code {"field": {"old": ..., "new": ...}}}, one key per field whose
 * value differs. Fields missing on one side are reported with a JSON null.
 */
public final class FieldChanges {

    /**
     * Diff two snapshots.
     *
     * @return the changed fields, or null unless both sides are JSON objects
     */
    public static ObjectNode diff(JsonNode oldValue, JsonNode newValue) {
        if (oldValue == null || newValue == null || !oldValue.isObject() || !newValue.isObject()) {
            return null;
        }

        // sorted so that the stored diff is stable across runs
        Set<String> fields = new TreeSet<>();
        collect(oldValue.fieldNames(), fields);
        collect(newValue.fieldNames(), fields);

        ObjectNode changes = JsonNodeFactory.instance.objectNode();
        for (String field : fields) {
            JsonNode before = valueOrNull(oldValue.get(field));
            JsonNode after = valueOrNull(newValue.get(field));
            if (!before.equals(after)) {
                ObjectNode change = changes.putObject(field);
                change.set("old", before.deepCopy());
                change.set("new", after.deepCopy());
            }
        }
        return changes;
    }

    private static void collect(Iterator<String> names, Set<String> into) {
        while (names.hasNext()) {
            into.add(names.next());
        }
    }

    private static JsonNode valueOrNull(JsonNode node) {
        return node == null ? NullNode.getInstance() : node;
    }

    private FieldChanges() {}
}
