package com.acme.werp.batch;

import com.acme.werp.model.Enums.BatchMode;

import java.time.Duration;

/** Per-invocation options; unset values fall back to the engine configuration. */
public record BatchOptions(
        BatchMode mode,
        Boolean dryRun,
        Integer pageSize,
        Integer maxDocs,
        String startAfter,
        Duration timeBudget,
        String docId,
        String orderBy
) {
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private BatchMode mode = BatchMode.REPAIR;
        private Boolean dryRun;
        private Integer pageSize;
        private Integer maxDocs;
        private String startAfter;
        private Duration timeBudget;
        private String docId;
        private String orderBy;

        public Builder mode(BatchMode v) { this.mode = v; return this; }
        public Builder dryRun(Boolean v) { this.dryRun = v; return this; }
        public Builder pageSize(Integer v) { this.pageSize = v; return this; }
        public Builder maxDocs(Integer v) { this.maxDocs = v; return this; }
        public Builder startAfter(String v) { this.startAfter = v; return this; }
        public Builder timeBudget(Duration v) { this.timeBudget = v; return this; }
        public Builder docId(String v) { this.docId = v; return this; }
        public Builder orderBy(String v) { this.orderBy = v; return this; }

        public BatchOptions build() {
            return new BatchOptions(mode, dryRun, pageSize, maxDocs, startAfter, timeBudget, docId, orderBy);
        }
    }
}
