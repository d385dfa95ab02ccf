package com.acme.werp.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.acme.werp.TestRecords;
import com.acme.werp.config.EngineConfig;
import com.acme.werp.inspect.CompletenessInspector;
import com.acme.werp.model.Enums.BatchMode;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.normalize.RecordNormalizer;
import com.acme.werp.plan.MigrationPlanner;
import com.acme.werp.record.RawRecordReader;
import com.acme.werp.regen.RegenerationException;
import com.acme.werp.regen.SectionRegenerator;
import com.acme.werp.severity.SeverityCalculator;
import com.acme.werp.store.InMemoryRecordStore;
import com.acme.werp.store.RecordStore;
import com.acme.werp.store.StoreWriteException;
import com.acme.werp.store.StoredRecord;
import com.acme.werp.store.WriteBatch;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchDriverTest {

    private static final String PATH = "werp_assessments";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private static final String GOOD_ESI = """
            {"parameters": [
              {"name": "Proximity to Sensitive Ecosystems", "rationale": "Seagrass beds within 2 km.", "score": 6},
              {"name": "Biodiversity Value", "rationale": "Turtle nesting area.", "score": 7},
              {"name": "Protected Areas", "rationale": "Adjacent marine reserve.", "score": 8},
              {"name": "Socioeconomic Sensitivity", "rationale": "Artisanal fisheries.", "score": 5}
            ]}
            """;

    @Mock
    private RecordStore store;

    @Mock
    private SectionRegenerator regenerator;

    private static BatchDriver driver(RecordStore store, EngineConfig config, Clock clock, SectionRegenerator regen) {
        RawRecordReader reader = new RawRecordReader();
        RecordNormalizer normalizer = new RecordNormalizer(new SeverityCalculator(config.thresholds()));
        CompletenessInspector inspector = new CompletenessInspector(config.placeholderSet());
        MigrationPlanner planner = new MigrationPlanner(reader, normalizer, inspector, TestRecords.MAPPER, clock);
        return new BatchDriver(store, PATH, reader, normalizer, planner, regen, config, clock, TestRecords.MAPPER);
    }

    private static List<StoredRecord> records(int n, ObjectNode template) {
        List<StoredRecord> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ObjectNode doc = template.deepCopy();
            doc.put("id", "r" + i);
            out.add(new StoredRecord("r" + i, doc));
        }
        return out;
    }

    private static InMemoryRecordStore memoryStore(int n, ObjectNode template) {
        InMemoryRecordStore memory = new InMemoryRecordStore();
        for (int i = 0; i < n; i++) memory.put(PATH, String.format("w-%03d", i), template);
        return memory;
    }

    private static ObjectNode withoutSensitivity() {
        ObjectNode doc = TestRecords.complete();
        doc.remove("esi");
        return doc;
    }

    @Test
    void cursorWalksTheWholeCollectionOnce() {
        InMemoryRecordStore memory = memoryStore(250, TestRecords.messy());
        BatchDriver driver = driver(memory, EngineConfig.defaults(), CLOCK, null);
        Set<String> seen = new HashSet<>();
        List<String> cursors = new ArrayList<>();

        String cursor = null;
        for (int run = 0; run < 3; run++) {
            BatchReport report = driver.run(BatchOptions.builder().mode(BatchMode.NORMALIZE).dryRun(false)
                    .pageSize(100).startAfter(cursor).build());
            report.changes().forEach(c -> assertThat(seen.add(c.id())).isTrue());
            cursor = report.nextCursor();
            cursors.add(cursor);
        }

        assertThat(seen).hasSize(250);
        assertThat(cursors).containsExactly("w-099", "w-199", null);
        assertThat(memory.get(PATH, "w-249").orElseThrow().data().has("severity")).isTrue();
    }

    @Test
    void dryRunNeverWritesOrRegenerates() {
        when(store.list(eq(PATH), eq(RecordStore.ORDER_BY_ID), any(), anyInt())).thenReturn(records(3, withoutSensitivity()));

        BatchReport report = driver(store, EngineConfig.defaults(), CLOCK, regenerator)
                .run(BatchOptions.builder().dryRun(true).build());

        verify(store, never()).commit(any(), any());
        verifyNoInteractions(regenerator);
        assertThat(report.dryRun()).isTrue();
        assertThat(report.scanned()).isEqualTo(3);
        assertThat(report.updated()).isEqualTo(3);
        assertThat(report.esiFixed()).isEqualTo(3);
        assertThat(report.wrote()).isZero();
        assertThat(report.nextCursor()).isNull();
    }

    @Test
    void dryRunFallsBackToTheConfiguredDefault() {
        when(store.list(any(), any(), any(), anyInt())).thenReturn(records(2, TestRecords.messy()));

        BatchReport report = driver(store, EngineConfig.defaults(), CLOCK, null)
                .run(BatchOptions.builder().mode(BatchMode.NORMALIZE).build());

        assertThat(report.dryRun()).isTrue();
        verify(store, never()).commit(any(), any());
    }

    @Test
    void writesAreSplitAtTheOpCeiling() {
        when(store.list(any(), any(), any(), anyInt())).thenReturn(records(5, TestRecords.messy()));
        EngineConfig config = EngineConfig.from(Map.of(EngineConfig.MAX_OPS, "2"));

        BatchReport report = driver(store, config, CLOCK, null)
                .run(BatchOptions.builder().mode(BatchMode.NORMALIZE).dryRun(false).build());

        ArgumentCaptor<WriteBatch> batches = ArgumentCaptor.forClass(WriteBatch.class);
        verify(store, times(3)).commit(eq(PATH), batches.capture());
        assertThat(batches.getAllValues()).extracting(WriteBatch::size).containsExactly(2, 2, 1);
        assertThat(report.wrote()).isEqualTo(5);
        assertThat(report.errors()).isEmpty();
    }

    @Test
    void failedCommitRewindsTheCursor() {
        when(store.list(any(), any(), any(), anyInt())).thenReturn(records(4, TestRecords.messy()));
        doNothing().doThrow(new StoreWriteException("quota exceeded")).when(store).commit(any(), any());
        EngineConfig config = EngineConfig.from(Map.of(EngineConfig.MAX_OPS, "2"));

        BatchReport report = driver(store, config, CLOCK, null)
                .run(BatchOptions.builder().mode(BatchMode.NORMALIZE).dryRun(false).build());

        assertThat(report.wrote()).isEqualTo(2);
        assertThat(report.errors()).extracting(BatchReport.RecordError::id).containsExactly("r2", "r3");
        assertThat(report.errors().get(0).message()).contains("quota exceeded");
        assertThat(report.lastProcessedId()).isEqualTo("r3");
        assertThat(report.nextCursor()).isEqualTo("r1");
    }

    @Test
    void failedFirstCommitLeavesNoCursor() {
        when(store.list(any(), any(), any(), anyInt())).thenReturn(records(2, TestRecords.messy()));
        doThrow(new StoreWriteException("unavailable")).when(store).commit(any(), any());

        BatchReport report = driver(store, EngineConfig.defaults(), CLOCK, null)
                .run(BatchOptions.builder().mode(BatchMode.NORMALIZE).dryRun(false).build());

        assertThat(report.hasErrors()).isTrue();
        assertThat(report.wrote()).isZero();
        assertThat(report.nextCursor()).isNull();
    }

    @Test
    void timeBudgetStopsThePageEarly() {
        InMemoryRecordStore memory = memoryStore(5, TestRecords.messy());
        Clock ticking = new TickingClock(Instant.parse("2024-06-01T00:00:00Z"), Duration.ofSeconds(10));

        BatchReport report = driver(memory, EngineConfig.defaults(), ticking, null)
                .run(BatchOptions.builder().mode(BatchMode.NORMALIZE).dryRun(false).pageSize(5)
                        .timeBudget(Duration.ofSeconds(45)).build());

        assertThat(report.scanned()).isBetween(1, 4);
        assertThat(report.nextCursor()).isNotNull().isEqualTo(report.lastProcessedId());
    }

    @Test
    void timeBudgetStopsSlowRegenerationAfterTheCurrentWindow() {
        InMemoryRecordStore memory = memoryStore(8, withoutSensitivity());
        EngineConfig config = EngineConfig.from(Map.of(EngineConfig.FANOUT, "2"));
        SectionRegenerator slow = request -> {
            try {
                Thread.sleep(400);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegenerationException("Interrupted", e);
            }
            return Map.of(SectionKind.SENSITIVITY, TestRecords.json(GOOD_ESI));
        };

        BatchReport report = driver(memory, config, Clock.systemUTC(), slow)
                .run(BatchOptions.builder().dryRun(false).pageSize(20).timeBudget(Duration.ofMillis(250)).build());

        assertThat(report.scanned()).isBetween(1, 2);
        assertThat(report.wrote()).isEqualTo(report.scanned());
        assertThat(report.errors()).isEmpty();
        assertThat(report.nextCursor()).isNotNull().isEqualTo(report.lastProcessedId());
        assertThat(memory.get(PATH, "w-007").orElseThrow().data().has("esi")).isFalse();
    }

    @Test
    void maxDocsLimitsTheRunAndTheCursorResumes() {
        InMemoryRecordStore memory = memoryStore(5, TestRecords.messy());
        BatchDriver driver = driver(memory, EngineConfig.defaults(), CLOCK, null);

        BatchReport first = driver.run(BatchOptions.builder().mode(BatchMode.NORMALIZE).dryRun(false)
                .pageSize(5).maxDocs(3).build());
        BatchReport second = driver.run(BatchOptions.builder().mode(BatchMode.NORMALIZE).dryRun(false)
                .pageSize(5).startAfter(first.nextCursor()).build());

        assertThat(first.scanned()).isEqualTo(3);
        assertThat(first.nextCursor()).isEqualTo("w-002");
        assertThat(second.scanned()).isEqualTo(2);
        assertThat(second.nextCursor()).isNull();
    }

    @Test
    void unknownDocIdIsReported() {
        when(store.get(PATH, "nope")).thenReturn(java.util.Optional.empty());

        BatchReport report = driver(store, EngineConfig.defaults(), CLOCK, null)
                .run(BatchOptions.builder().docId("nope").build());

        assertThat(report.scanned()).isZero();
        assertThat(report.errors()).containsExactly(new BatchReport.RecordError("nope", "Record not found"));
        assertThat(report.nextCursor()).isNull();
    }

    @Test
    void singleDocumentRepair() throws Exception {
        InMemoryRecordStore memory = new InMemoryRecordStore();
        memory.put(PATH, "ss-example", withoutSensitivity());
        when(regenerator.regenerate(any())).thenReturn(Map.of(SectionKind.SENSITIVITY, TestRecords.json(GOOD_ESI)));

        BatchReport report = driver(memory, EngineConfig.defaults(), CLOCK, regenerator)
                .run(BatchOptions.builder().docId("ss-example").dryRun(false).build());

        ObjectNode stored = memory.get(PATH, "ss-example").orElseThrow().data();
        assertThat(report.esiFixed()).isEqualTo(1);
        assertThat(report.wrote()).isEqualTo(1);
        assertThat(report.changes()).containsExactly(new BatchReport.Change("ss-example", List.of("esi")));
        assertThat(report.nextCursor()).isNull();
        assertThat(stored.path("esi").path("totalScore").asDouble()).isEqualTo(26.0);
        assertThat(stored.path("severity").path("band").asText()).isEqualTo("high");
    }

    @Test
    void regenerationCallsAreCappedPerRun() throws Exception {
        InMemoryRecordStore memory = memoryStore(2, withoutSensitivity());
        when(regenerator.regenerate(any())).thenReturn(Map.of(SectionKind.SENSITIVITY, TestRecords.json(GOOD_ESI)));
        EngineConfig config = EngineConfig.from(Map.of(EngineConfig.MAX_CALLS, "1"));

        BatchReport report = driver(memory, config, CLOCK, regenerator)
                .run(BatchOptions.builder().dryRun(false).build());

        verify(regenerator, times(1)).regenerate(any());
        assertThat(report.esiFixed()).isEqualTo(2);
        assertThat(memory.get(PATH, "w-000").orElseThrow().data().has("esi")).isTrue();
        assertThat(memory.get(PATH, "w-001").orElseThrow().data().has("esi")).isFalse();
    }

    @Test
    void failedRegenerationIsReportedPerRecord() throws Exception {
        InMemoryRecordStore memory = memoryStore(1, withoutSensitivity());
        when(regenerator.regenerate(any())).thenReturn(Map.of());

        BatchReport report = driver(memory, EngineConfig.defaults(), CLOCK, regenerator)
                .run(BatchOptions.builder().dryRun(false).build());

        assertThat(report.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).isEqualTo("Regeneration failed for [esi]"));
    }

    /** Advances by a fixed step every time it is read. */
    private static final class TickingClock extends Clock {
        private Instant now;
        private final Duration step;

        TickingClock(Instant start, Duration step) {
            this.now = start;
            this.step = step;
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }

        @Override
        public synchronized Instant instant() {
            Instant current = now;
            now = now.plus(step);
            return current;
        }
    }
}
