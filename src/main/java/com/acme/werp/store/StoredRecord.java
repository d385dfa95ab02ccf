package com.acme.werp.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record StoredRecord(String id, ObjectNode data) {}
