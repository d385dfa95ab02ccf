/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: WERP Risk Scoring Engine
 */

package com.acme.werp;

import com.acme.werp.batch.BatchOptions;
import com.acme.werp.batch.BatchReport;
import com.acme.werp.config.CachingConfigSource;
import com.acme.werp.config.ConfigSource;
import com.acme.werp.config.PropertiesConfigSource;
import com.acme.werp.inspect.InspectionResult;
import com.acme.werp.model.Enums.BatchMode;
import com.acme.werp.model.Enums.Severity;
import com.acme.werp.model.Finding;
import com.acme.werp.normalize.NormalizationResult;
import com.acme.werp.plan.RecordPatch;
import com.acme.werp.regen.*;
import com.acme.werp.store.JsonFileRecordStore;
import com.acme.werp.util.JsonSupport;
import com.acme.werp.util.ScoreUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "werp-engine",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Normalizes, scores and repairs WERP shipwreck risk assessments.",
        subcommands = {
                WerpEngineApp.NormalizeCommand.class,
                WerpEngineApp.InspectCommand.class,
                WerpEngineApp.RepairCommand.class,
                WerpEngineApp.BatchCommand.class
        },
        sortOptions = false
)
public class WerpEngineApp implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(WerpEngineApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RECORD_ERRORS = 1;
    static final int EXIT_FAILURE = 2;

    static final ObjectMapper MAPPER = JsonSupport.newMapper();

    @CommandLine.Option(names = "--config", scope = CommandLine.ScopeType.INHERIT,
            description = "Properties file overriding werp-engine.properties.")
    Path configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new WerpEngineApp())
                .setExecutionExceptionHandler((ex, cmd, parsed) -> {
                    logger.error("Command failed", ex);
                    cmd.getErr().println("Error: " + ex.getMessage());
                    return EXIT_FAILURE;
                });
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    WerpEngine engine() {
        return new WerpEngine(new PropertiesConfigSource(configFile).load(), Clock.systemUTC(), MAPPER);
    }

    /** For long-running loops: the file is re-read once the configured TTL has passed. */
    ConfigSource configSource(Clock clock) {
        PropertiesConfigSource source = new PropertiesConfigSource(configFile);
        return new CachingConfigSource(source, source.load().configTtl(), clock);
    }

    static JsonNode readRecord(Path in) throws IOException {
        JsonNode n = MAPPER.readTree(in.toFile());
        if (n == null || !n.isObject()) throw new IOException(in + " does not hold a JSON object");
        return n;
    }

    static void emit(Object value, Path out) throws IOException {
        if (out != null) {
            MAPPER.writeValue(out.toFile(), value);
            System.out.println("Report: " + out);
        } else {
            System.out.println(MAPPER.writeValueAsString(value));
        }
    }

    @CommandLine.Command(name = "normalize", mixinStandardHelpOptions = true,
            description = "Normalize one record and print it with its diagnostics.")
    static class NormalizeCommand implements Callable<Integer> {
        @CommandLine.ParentCommand WerpEngineApp app;
        @CommandLine.Parameters(index = "0", description = "Record JSON file.") Path input;
        @CommandLine.Option(names = "--out", description = "Write the result here instead of stdout.") Path out;

        @Override
        public Integer call() throws Exception {
            NormalizationResult r = app.engine().normalize(readRecord(input));
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("record", r.assessment());
            o.put("corrected", r.corrected());
            o.put("diagnostics", r.diagnostics());
            emit(o, out);
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "inspect", mixinStandardHelpOptions = true,
            description = "Report which sections of a record are incomplete and why.")
    static class InspectCommand implements Callable<Integer> {
        @CommandLine.ParentCommand WerpEngineApp app;
        @CommandLine.Parameters(index = "0", description = "Record JSON file.") Path input;

        @Override
        public Integer call() throws Exception {
            InspectionResult r = app.engine().inspect(readRecord(input));
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("incompleteSections", r.incompleteSections());
            o.put("reasons", r.reasons());
            if (!r.findings().isEmpty()) o.put("findings", r.findings());
            emit(o, null);
            return r.complete() ? EXIT_OK : EXIT_RECORD_ERRORS;
        }
    }

    @CommandLine.Command(name = "repair", mixinStandardHelpOptions = true,
            description = "Plan and apply a repair to one record file and print the patch.")
    static class RepairCommand implements Callable<Integer> {
        @CommandLine.ParentCommand WerpEngineApp app;
        @CommandLine.Parameters(index = "0", description = "Record JSON file.") Path input;
        @CommandLine.Mixin RegeneratorOptions regen;

        @Override
        public Integer call() throws Exception {
            WerpEngine engine = app.engine();
            RecordPatch patch = engine.planAndApply(readRecord(input), regen.build());
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("id", patch.id());
            o.put("status", ScoreUtil.worst(patch.findings()));
            o.put("update", patch.toUpdate(MAPPER));
            o.put("regenerated", patch.regenerated());
            o.put("recomputed", patch.recomputed());
            o.put("pending", patch.pending());
            o.put("failed", patch.failed());
            o.put("findings", patch.findings().stream().filter(f -> f.severity() != Severity.OK).map(Finding::message).toList());
            emit(o, null);
            return patch.hasFailures() ? EXIT_RECORD_ERRORS : EXIT_OK;
        }
    }

    @CommandLine.Command(name = "batch", mixinStandardHelpOptions = true,
            description = "Normalize or repair one page of a JSON-file record store.")
    static class BatchCommand implements Callable<Integer> {
        @CommandLine.ParentCommand WerpEngineApp app;

        @CommandLine.Option(names = "--store", required = true, description = "JSON file holding the records.")
        Path storeFile;

        @CommandLine.Option(names = "--collection", defaultValue = "werp_assessments",
                description = "Collection path. Default: ${DEFAULT-VALUE}")
        String collection;

        @CommandLine.Option(names = "--mode", defaultValue = "REPAIR", description = "${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
        BatchMode mode;

        @CommandLine.Option(names = "--dry-run", negatable = true, description = "Plan only: no writes, no model calls.")
        Boolean dryRun;

        @CommandLine.Option(names = "--page-size", description = "Records per invocation (1-450).") Integer pageSize;
        @CommandLine.Option(names = "--max-docs", description = "Stop after this many records.") Integer maxDocs;
        @CommandLine.Option(names = "--start-after", description = "Continuation cursor from a previous run.") String startAfter;
        @CommandLine.Option(names = "--doc-id", description = "Process only this record.") String docId;
        @CommandLine.Option(names = "--order-by", description = "Cursor field (id or vesselName).") String orderBy;
        @CommandLine.Option(names = "--time-budget-seconds", description = "Stop taking new records after this long.") Integer timeBudgetSeconds;
        @CommandLine.Option(names = "--all", description = "Keep invoking until the cursor is exhausted.") boolean all;
        @CommandLine.Option(names = "--report", description = "Write the last batch report here.") Path report;
        @CommandLine.Mixin RegeneratorOptions regen;

        @Override
        public Integer call() throws Exception {
            Clock clock = Clock.systemUTC();
            ConfigSource configs = app.configSource(clock);
            JsonFileRecordStore store = new JsonFileRecordStore(storeFile, collection, MAPPER);
            SectionRegenerator regenerator = regen.build();

            String cursor = startAfter;
            boolean errors = false;
            BatchReport r;
            int runs = 0;
            do {
                BatchOptions options = BatchOptions.builder()
                        .mode(mode).dryRun(dryRun).pageSize(pageSize).maxDocs(maxDocs)
                        .startAfter(cursor).docId(docId).orderBy(orderBy)
                        .timeBudget(timeBudgetSeconds == null ? null : Duration.ofSeconds(timeBudgetSeconds))
                        .build();
                r = new WerpEngine(configs.load(), clock, MAPPER).runBatch(store, collection, regenerator, options);
                runs++;
                errors |= r.hasErrors();
                System.out.printf("run %d: scanned=%d updated=%d wrote=%d errors=%d next=%s%n",
                        runs, r.scanned(), r.updated(), r.wrote(), r.errors().size(), r.nextCursor());
                // a failed commit leaves the cursor where it was; looping would retry forever
                if (r.scanned() == 0 || (r.hasErrors() && r.wrote() == 0 && Objects.equals(r.nextCursor(), cursor))) break;
                cursor = r.nextCursor();
            } while (all && docId == null && cursor != null);

            emit(r, report);
            return errors ? EXIT_RECORD_ERRORS : EXIT_OK;
        }
    }

    /** Where regenerated sections come from: recorded fixtures or a model endpoint. */
    static class RegeneratorOptions {
        @CommandLine.Option(names = "--fixtures-dir", description = "Directory of recorded model replies (<id>.json).")
        Path fixturesDir;

        @CommandLine.Option(names = "--model-endpoint", description = "HTTP endpoint accepting {\"prompt\": ...}.")
        URI modelEndpoint;

        @CommandLine.Option(names = "--model-timeout-seconds", defaultValue = "60",
                description = "Per-request timeout. Default: ${DEFAULT-VALUE}")
        int modelTimeoutSeconds;

        SectionRegenerator build() {
            RegenerationParser parser = new RegenerationParser(MAPPER);
            if (fixturesDir != null) return new FixtureSectionRegenerator(fixturesDir, parser);
            if (modelEndpoint != null) {
                return new TextModelSectionRegenerator(
                        new HttpTextGenerationClient(modelEndpoint, Duration.ofSeconds(modelTimeoutSeconds), MAPPER), parser);
            }
            return null;
        }
    }
}
