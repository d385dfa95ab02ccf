package com.acme.werp.regen;

import com.acme.werp.model.Enums.SectionKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/** Produces fresh content for the requested sections. Its output is untrusted. */
@FunctionalInterface
public interface SectionRegenerator {
    Map<SectionKind, JsonNode> regenerate(RegenerationRequest request) throws RegenerationException;
}
