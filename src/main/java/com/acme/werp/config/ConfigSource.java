package com.acme.werp.config;

public interface ConfigSource {
    EngineConfig load();
}
