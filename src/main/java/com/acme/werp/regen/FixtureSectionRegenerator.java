package com.acme.werp.regen;

import com.acme.werp.model.Enums.SectionKind;
import com.acme.werp.util.FsUtil;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/** Replays recorded model replies from {@code <dir>/<recordId>.json}. */
public final class FixtureSectionRegenerator implements SectionRegenerator {
    private static final int MAX_BYTES = 1 << 20;

    private final Path dir;
    private final RegenerationParser parser;

    public FixtureSectionRegenerator(Path dir, RegenerationParser parser) {
        this.dir = dir;
        this.parser = parser;
    }

    @Override
    public Map<SectionKind, JsonNode> regenerate(RegenerationRequest request) throws RegenerationException {
        Path file = dir.resolve(request.recordId() + ".json");
        if (!Files.isRegularFile(file)) throw new RegenerationException("No fixture for " + request.recordId());
        String text;
        try { text = FsUtil.read(file, MAX_BYTES); }
        catch (IOException e) { throw new RegenerationException("Cannot read fixture " + file + ": " + e.getMessage(), e); }
        return RegenerationParser.sectionsFrom(parser.parse(text), request.sections());
    }
}
