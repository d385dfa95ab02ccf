package com.acme.werp.batch;

import com.acme.werp.config.EngineConfig;
import com.acme.werp.model.Assessment;
import com.acme.werp.model.Enums.BatchMode;
import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.normalize.NormalizationResult;
import com.acme.werp.normalize.RecordNormalizer;
import com.acme.werp.plan.MigrationPlan;
import com.acme.werp.plan.MigrationPlanner;
import com.acme.werp.plan.RecordPatch;
import com.acme.werp.record.RawRecord;
import com.acme.werp.record.RawRecordReader;
import com.acme.werp.regen.SectionRegenerator;
import com.acme.werp.store.RecordStore;
import com.acme.werp.store.StoreWriteException;
import com.acme.werp.store.StoredRecord;
import com.acme.werp.store.WriteBatch;
import com.acme.werp.util.JsonSupport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

/**
 * Applies normalization or repair to one page of a collection per invocation. Writes go out in
 * bounded atomic batches; the returned cursor lets the next invocation continue where this one
 * stopped, including retrying a batch whose commit failed. The time budget is checked between
 * records, and regeneration runs in windows of the configured fanout so at most one window overruns it.
 */
public final class BatchDriver {
    private static final Logger logger = LoggerFactory.getLogger(BatchDriver.class);

    private final RecordStore store;
    private final String path;
    private final RawRecordReader reader;
    private final RecordNormalizer normalizer;
    private final MigrationPlanner planner;
    private final SectionRegenerator regenerator;
    private final EngineConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;

    public BatchDriver(RecordStore store, String path, RawRecordReader reader, RecordNormalizer normalizer,
                       MigrationPlanner planner, SectionRegenerator regenerator, EngineConfig config,
                       Clock clock, ObjectMapper mapper) {
        this.store = store;
        this.path = path;
        this.reader = reader;
        this.normalizer = normalizer;
        this.planner = planner;
        this.regenerator = regenerator;
        this.config = config;
        this.clock = clock;
        this.mapper = mapper;
    }

    public BatchReport run(BatchOptions options) {
        Instant started = clock.instant();
        boolean dryRun = options.dryRun() == null ? config.dryRunDefault() : options.dryRun();
        BatchMode mode = options.mode() == null ? BatchMode.REPAIR : options.mode();
        int pageSize = clamp(options.pageSize() == null ? config.pageSize() : options.pageSize(), 1, EngineConfig.MAX_PAGE_SIZE);
        int maxDocs = clamp(options.maxDocs() == null ? pageSize : options.maxDocs(), 1, pageSize);
        Duration budget = options.timeBudget() == null ? config.timeBudget() : options.timeBudget();
        Instant deadline = started.plus(budget);
        String orderBy = options.orderBy() == null ? RecordStore.ORDER_BY_ID : options.orderBy();

        Tally tally = new Tally(dryRun, mode);
        List<StoredRecord> page;
        boolean single = options.docId() != null && !options.docId().isBlank();
        if (single) {
            Optional<StoredRecord> one = store.get(path, options.docId());
            if (one.isEmpty()) {
                tally.error(options.docId(), "Record not found");
                return tally.report(null, null, elapsed(started));
            }
            page = List.of(one.get());
        } else {
            page = store.list(path, orderBy, options.startAfter(), pageSize);
        }
        tally.pages = 1;
        logger.info("Batch {} over {}: {} records (dryRun={}, startAfter={})", mode, path, page.size(), dryRun, options.startAfter());

        // plan sequentially, regenerate one window of `fanout` records at a time, write in page order
        List<Pending> work = new ArrayList<>();
        List<CompletableFuture<RecordPatch>> window = new ArrayList<>();
        boolean stoppedEarly = false;
        int callsLeft = config.maxRegenerationCallsPerRun();
        int fanout = config.regenerationFanout();
        ExecutorService pool = Executors.newFixedThreadPool(fanout);
        try {
            for (StoredRecord rec : page) {
                if (work.size() >= maxDocs || !clock.instant().isBefore(deadline)) {
                    stoppedEarly = true;
                    break;
                }
                RawRecord raw = reader.read(rec.id(), rec.data());
                if (mode == BatchMode.NORMALIZE) {
                    work.add(new Pending(raw, CompletableFuture.completedFuture(normalizationPatch(raw))));
                    continue;
                }
                MigrationPlan plan = planner.plan(raw);
                SectionRegenerator regen = null;
                if (!dryRun && !plan.regenerate().isEmpty()) {
                    if (callsLeft > 0 && regenerator != null) {
                        regen = regenerator;
                        callsLeft--;
                    } else {
                        logger.warn("Regeneration call limit reached; {} left pending", raw.id());
                    }
                }
                if (regen == null) {
                    work.add(new Pending(raw, CompletableFuture.completedFuture(planner.apply(raw, plan, null))));
                    continue;
                }
                SectionRegenerator chosen = regen;
                CompletableFuture<RecordPatch> f = CompletableFuture.supplyAsync(() -> planner.apply(raw, plan, chosen), pool);
                work.add(new Pending(raw, f));
                window.add(f);
                if (window.size() >= fanout) {
                    settle(window);
                    window.clear();
                }
            }

            boolean pageFull = !single && page.size() == pageSize;
            return write(work, pageFull, stoppedEarly, options.startAfter(), tally, started);
        } finally {
            pool.shutdownNow();
        }
    }

    private BatchReport write(List<Pending> work, boolean pageFull, boolean stoppedEarly,
                              String startAfter, Tally tally, Instant started) {
        WriteBatch batch = new WriteBatch(config.maxOpsPerBatch());
        String lastId = null;

        for (Pending p : work) {
            RecordPatch patch = await(p, tally);
            lastId = p.raw().id();
            tally.scanned++;
            if (patch == null) continue;

            tally.count(patch);
            if (tally.dryRun || patch.isEmpty()) continue;

            if (batch.isFull()) {
                if (!commit(batch, tally)) return tally.report(lastId, lastBefore(batch, work, startAfter), elapsed(started));
                batch = new WriteBatch(config.maxOpsPerBatch());
            }
            batch.merge(patch.id(), patch.toUpdate(mapper));
        }
        if (!tally.dryRun && !batch.isEmpty() && !commit(batch, tally)) {
            return tally.report(lastId, lastBefore(batch, work, startAfter), elapsed(started));
        }

        String cursor;
        if (stoppedEarly) cursor = lastId != null ? lastId : startAfter;
        else if (pageFull && lastId != null) cursor = lastId;
        else cursor = null;
        return tally.report(lastId, cursor, elapsed(started));
    }

    private boolean commit(WriteBatch batch, Tally tally) {
        try {
            store.commit(path, batch);
            tally.wrote += batch.size();
            logger.info("Committed {} updates to {}", batch.size(), path);
            return true;
        } catch (StoreWriteException e) {
            logger.error("Commit of {} updates failed: {}", batch.size(), e.getMessage());
            for (String id : batch.ids()) tally.error(id, "Commit failed: " + e.getMessage());
            return false;
        }
    }

    private RecordPatch await(Pending p, Tally tally) {
        try {
            return p.patch().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalStateException ise) throw ise;
            logger.warn("Record {} failed: {}", p.raw().id(), String.valueOf(cause));
            tally.error(p.raw().id(), String.valueOf(cause.getMessage()));
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing " + p.raw().id(), e);
        }
    }

    /** Blocks until every task of the window has finished; failures are reported when the patch is awaited. */
    private static void settle(List<CompletableFuture<RecordPatch>> window) {
        CompletableFuture.allOf(window.toArray(new CompletableFuture<?>[0])).handle((v, e) -> null).join();
    }

    private RecordPatch normalizationPatch(RawRecord raw) {
        NormalizationResult result = normalizer.normalize(raw);
        Assessment a = result.assessment();
        Map<SectionKind, Object> changed = new EnumMap<>(SectionKind.class);
        for (SectionKind k : SectionKind.values()) {
            Object section = a.section(k);
            if (section != null && !JsonSupport.sameTree(raw.section(k).source(), mapper.valueToTree(section))) {
                changed.put(k, section);
            }
        }
        boolean severityChanged = !JsonSupport.sameTree(raw.severity(), mapper.valueToTree(a.severity()));
        return new RecordPatch(raw.id(), Collections.unmodifiableMap(changed),
                (severityChanged || !changed.isEmpty()) ? a.severity() : null, clock.instant(),
                Set.of(), Set.copyOf(changed.keySet()), Set.of(), Set.of(), false, result.diagnostics());
    }

    /** The last id processed before the batch that could not be committed. */
    private static String lastBefore(WriteBatch failed, List<Pending> work, String startAfter) {
        String first = failed.ids().get(0);
        String prev = startAfter;
        for (Pending p : work) {
            if (p.raw().id().equals(first)) return prev;
            prev = p.raw().id();
        }
        return prev;
    }

    private long elapsed(Instant started) { return Duration.between(started, clock.instant()).toMillis(); }

    private static int clamp(int v, int min, int max) { return Math.min(max, Math.max(min, v)); }

    private record Pending(RawRecord raw, Future<RecordPatch> patch) {}

    private static final class Tally {
        final boolean dryRun;
        final BatchMode mode;
        int pages, scanned, updated, wrote, wcsRescored, phsFixed, esiFixed, rpmFixed;
        final List<BatchReport.Change> changes = new ArrayList<>();
        final List<BatchReport.RecordError> errors = new ArrayList<>();

        Tally(boolean dryRun, BatchMode mode) {
            this.dryRun = dryRun;
            this.mode = mode;
        }

        void count(RecordPatch patch) {
            Set<SectionKind> touched = EnumSet.noneOf(SectionKind.class);
            touched.addAll(patch.sections().keySet());
            touched.addAll(patch.pending());
            if (patch.wouldChange() || !patch.pending().isEmpty()) {
                updated++;
                List<String> keys = touched.stream().map(SectionKind::key).toList();
                changes.add(new BatchReport.Change(patch.id(), keys));
            }
            if (patch.ageRescored()) wcsRescored++;
            if (touched.contains(SectionKind.POLLUTION)) phsFixed++;
            if (touched.contains(SectionKind.SENSITIVITY)) esiFixed++;
            if (touched.contains(SectionKind.PRESSURE)) rpmFixed++;
            if (patch.hasFailures()) {
                List<String> keys = patch.failed().stream().map(SectionKind::key).toList();
                error(patch.id(), "Regeneration failed for " + keys);
            }
        }

        void error(String id, String message) { errors.add(new BatchReport.RecordError(id, message)); }

        BatchReport report(String lastProcessedId, String nextCursor, long tookMs) {
            return new BatchReport(dryRun, mode.name().toLowerCase(Locale.ROOT), pages, scanned, updated, wrote,
                    wcsRescored, phsFixed, esiFixed, rpmFixed, lastProcessedId, nextCursor, tookMs,
                    List.copyOf(changes), List.copyOf(errors));
        }
    }
}
