package com.acme.werp.store;

import java.util.List;
import java.util.Optional;

/** A collection of JSON records keyed by id, addressed by a collection path. */
public interface RecordStore {
    String ORDER_BY_ID = "id";

    /** Records after startAfter (exclusive, null for the beginning) in orderBy order. */
    List<StoredRecord> list(String path, String orderBy, String startAfter, int limit);

    Optional<StoredRecord> get(String path, String id);

    void commit(String path, WriteBatch batch) throws StoreWriteException;
}
