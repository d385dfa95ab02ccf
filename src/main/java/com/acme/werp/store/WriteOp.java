package com.acme.werp.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Merge update: each top-level field of update replaces the stored one. */
public record WriteOp(String id, ObjectNode update) {}
