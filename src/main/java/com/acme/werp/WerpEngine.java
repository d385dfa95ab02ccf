package com.acme.werp;

import com.acme.werp.batch.BatchDriver;
import com.acme.werp.batch.BatchOptions;
import com.acme.werp.batch.BatchReport;
import com.acme.werp.config.EngineConfig;
import com.acme.werp.inspect.CompletenessInspector;
import com.acme.werp.inspect.InspectionResult;
import com.acme.werp.normalize.NormalizationResult;
import com.acme.werp.normalize.RecordNormalizer;
import com.acme.werp.plan.MigrationPlan;
import com.acme.werp.plan.MigrationPlanner;
import com.acme.werp.plan.RecordPatch;
import com.acme.werp.record.RawRecordReader;
import com.acme.werp.regen.SectionRegenerator;
import com.acme.werp.severity.SeverityCalculator;
import com.acme.werp.store.RecordStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;

/** Entry point for embedding the engine: one instance per configuration snapshot. */
public final class WerpEngine {
    private final EngineConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final RawRecordReader reader = new RawRecordReader();
    private final RecordNormalizer normalizer;
    private final CompletenessInspector inspector;
    private final MigrationPlanner planner;

    public WerpEngine(EngineConfig config, Clock clock, ObjectMapper mapper) {
        this.config = config;
        this.clock = clock;
        this.mapper = mapper;
        this.normalizer = new RecordNormalizer(new SeverityCalculator(config.thresholds()));
        this.inspector = new CompletenessInspector(config.placeholderSet());
        this.planner = new MigrationPlanner(reader, normalizer, inspector, mapper, clock);
    }

    public EngineConfig config() { return config; }
    public ObjectMapper mapper() { return mapper; }

    public NormalizationResult normalize(JsonNode record) { return normalizer.normalize(reader.read(record)); }

    public InspectionResult inspect(JsonNode record) { return inspector.inspect(reader.read(record)); }

    public MigrationPlan plan(JsonNode record) { return planner.plan(reader.read(record)); }

    /** A null regenerator plans without calling out; regenerations are then reported as pending. */
    public RecordPatch planAndApply(JsonNode record, SectionRegenerator regenerator) {
        return planner.planAndApply(reader.read(record), regenerator);
    }

    public BatchReport runBatch(RecordStore store, String path, SectionRegenerator regenerator, BatchOptions options) {
        return new BatchDriver(store, path, reader, normalizer, planner, regenerator, config, clock, mapper).run(options);
    }
}
