package com.acme.werp.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/** Updates committed together or not at all. */
public final class WriteBatch {
    public static final int MAX_OPS = 450;

    private final int limit;
    private final List<WriteOp> ops = new ArrayList<>();

    public WriteBatch() { this(MAX_OPS); }

    public WriteBatch(int limit) {
        if (limit < 1 || limit > MAX_OPS) throw new IllegalArgumentException("Batch limit must be in [1, " + MAX_OPS + "]: " + limit);
        this.limit = limit;
    }

    public void merge(String id, ObjectNode update) {
        if (isFull()) throw new IllegalStateException("Write batch is full (" + limit + " ops)");
        ops.add(new WriteOp(id, update));
    }

    public boolean isFull() { return ops.size() >= limit; }
    public boolean isEmpty() { return ops.isEmpty(); }
    public int size() { return ops.size(); }
    public int limit() { return limit; }
    public List<WriteOp> ops() { return List.copyOf(ops); }

    public List<String> ids() { return ops.stream().map(WriteOp::id).toList(); }
}
