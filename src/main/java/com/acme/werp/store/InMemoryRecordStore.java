package com.acme.werp.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;

/**
 * Records held in sorted maps per collection path. A commit is applied to a copy which replaces
 * the live state only once {@link #persist} has succeeded.
 */
public class InMemoryRecordStore implements RecordStore {
    private final Map<String, TreeMap<String, ObjectNode>> collections = new HashMap<>();

    public synchronized void put(String path, String id, ObjectNode data) {
        collections.computeIfAbsent(path, p -> new TreeMap<>()).put(id, data.deepCopy());
    }

    public synchronized int size(String path) {
        TreeMap<String, ObjectNode> c = collections.get(path);
        return c == null ? 0 : c.size();
    }

    @Override
    public synchronized List<StoredRecord> list(String path, String orderBy, String startAfter, int limit) {
        TreeMap<String, ObjectNode> c = collections.getOrDefault(path, new TreeMap<>());
        List<Map.Entry<String, ObjectNode>> ordered = new ArrayList<>(c.entrySet());
        if (orderBy != null && !ORDER_BY_ID.equals(orderBy)) {
            ordered.sort(Comparator.comparing((Map.Entry<String, ObjectNode> e) -> fieldText(e.getValue(), orderBy))
                    .thenComparing(Map.Entry::getKey));
        }
        int start = 0;
        if (startAfter != null) {
            start = ordered.size();
            if (ORDER_BY_ID.equals(orderBy) || orderBy == null) {
                for (int i = 0; i < ordered.size(); i++) {
                    if (ordered.get(i).getKey().compareTo(startAfter) > 0) { start = i; break; }
                }
            } else {
                // anchor document; an unknown anchor restarts from the beginning
                start = 0;
                for (int i = 0; i < ordered.size(); i++) {
                    if (ordered.get(i).getKey().equals(startAfter)) { start = i + 1; break; }
                }
            }
        }
        List<StoredRecord> out = new ArrayList<>();
        for (int i = start; i < ordered.size() && out.size() < limit; i++) {
            out.add(new StoredRecord(ordered.get(i).getKey(), ordered.get(i).getValue().deepCopy()));
        }
        return out;
    }

    @Override
    public synchronized Optional<StoredRecord> get(String path, String id) {
        ObjectNode n = collections.getOrDefault(path, new TreeMap<>()).get(id);
        return n == null ? Optional.empty() : Optional.of(new StoredRecord(id, n.deepCopy()));
    }

    @Override
    public synchronized void commit(String path, WriteBatch batch) throws StoreWriteException {
        if (batch.size() > WriteBatch.MAX_OPS) throw new StoreWriteException("Batch exceeds " + WriteBatch.MAX_OPS + " ops");
        TreeMap<String, ObjectNode> next = new TreeMap<>();
        collections.getOrDefault(path, new TreeMap<>()).forEach((k, v) -> next.put(k, v.deepCopy()));
        for (WriteOp op : batch.ops()) {
            ObjectNode target = next.computeIfAbsent(op.id(), k -> op.update().objectNode());
            op.update().fields().forEachRemaining(e -> target.set(e.getKey(), e.getValue().deepCopy()));
        }
        persist(path, next);
        collections.put(path, next);
    }

    /** Hook for durable subclasses; throwing here leaves the live state untouched. */
    protected void persist(String path, SortedMap<String, ObjectNode> next) throws StoreWriteException {}

    private static String fieldText(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? "" : v.asText();
    }
}
