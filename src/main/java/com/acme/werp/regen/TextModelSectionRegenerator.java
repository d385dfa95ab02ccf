package com.acme.werp.regen;

import com.acme.werp.model.Enums.SectionKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class TextModelSectionRegenerator implements SectionRegenerator {
    private static final Logger logger = LoggerFactory.getLogger(TextModelSectionRegenerator.class);

    private final TextGenerationClient client;
    private final RegenerationParser parser;

    public TextModelSectionRegenerator(TextGenerationClient client, RegenerationParser parser) {
        this.client = client;
        this.parser = parser;
    }

    @Override
    public Map<SectionKind, JsonNode> regenerate(RegenerationRequest request) throws RegenerationException {
        logger.info("Regenerating {} for {}", request.sections(), request.recordId());
        String text = client.generate(request.prompt());
        JsonNode root = parser.parse(text);
        return RegenerationParser.sectionsFrom(root, request.sections());
    }
}
