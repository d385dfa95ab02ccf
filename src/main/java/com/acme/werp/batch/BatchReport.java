package com.acme.werp.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"dryRun", "mode", "pages", "scanned", "updated", "wrote", "wcsRescored", "phsFixed", "esiFixed",
        "rpmFixed", "lastProcessedId", "nextCursor", "tookMs", "changes", "errors"})
public record BatchReport(
        boolean dryRun,
        String mode,
        int pages,
        int scanned,
        int updated,
        int wrote,
        int wcsRescored,
        int phsFixed,
        int esiFixed,
        int rpmFixed,
        String lastProcessedId,
        @JsonInclude(JsonInclude.Include.NON_NULL) String nextCursor,
        long tookMs,
        List<Change> changes,
        List<RecordError> errors
) {
    public record Change(String id, List<String> sections) {}

    public record RecordError(String id, String message) {}

    public boolean hasErrors() { return !errors.isEmpty(); }
}
