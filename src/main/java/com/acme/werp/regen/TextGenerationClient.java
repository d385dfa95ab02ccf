package com.acme.werp.regen;

public interface TextGenerationClient {
    String generate(String prompt) throws RegenerationException;
}
