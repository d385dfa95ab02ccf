package com.acme.werp.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.werp.inspect.Placeholders;
import com.acme.werp.severity.SeverityThresholds;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EngineConfigTest {

    @Mock
    private ConfigSource delegate;

    @Test
    void classpathDefaultsMatchBuiltInDefaults() {
        EngineConfig config = new PropertiesConfigSource().load();

        assertThat(config).isEqualTo(EngineConfig.defaults());
        assertThat(config.placeholders()).containsExactlyInAnyOrderElementsOf(Placeholders.DEFAULTS);
    }

    @Test
    void unreadableValuesKeepTheirDefaults() {
        EngineConfig config = EngineConfig.from(Map.of(
                EngineConfig.SEVERITY_HIGH, "lots",
                EngineConfig.PAGE_SIZE, "12x",
                EngineConfig.DRY_RUN_DEFAULT, "maybe",
                EngineConfig.FANOUT, "8"));

        assertThat(config.thresholds()).isEqualTo(SeverityThresholds.DEFAULTS);
        assertThat(config.pageSize()).isEqualTo(150);
        assertThat(config.dryRunDefault()).isTrue();
        assertThat(config.regenerationFanout()).isEqualTo(8);
    }

    @Test
    void invertedThresholdsFallBack() {
        EngineConfig config = EngineConfig.from(Map.of(EngineConfig.SEVERITY_HIGH, "3", EngineConfig.SEVERITY_MEDIUM, "5"));

        assertThat(config.thresholds()).isEqualTo(SeverityThresholds.DEFAULTS);
    }

    @Test
    void batchLimitsAreClamped() {
        EngineConfig config = EngineConfig.from(Map.of(EngineConfig.PAGE_SIZE, "5000", EngineConfig.MAX_OPS, "0"));

        assertThat(config.pageSize()).isEqualTo(EngineConfig.MAX_PAGE_SIZE);
        assertThat(config.maxOpsPerBatch()).isEqualTo(1);
    }

    @Test
    void placeholdersArePipeSeparated() {
        EngineConfig config = EngineConfig.from(Map.of(EngineConfig.PLACEHOLDERS, "|N/A|  TBD "));

        assertThat(config.placeholders()).containsExactlyInAnyOrder("", "n/a", "tbd");
        assertThat(config.placeholderSet().isPlaceholder("Tbd")).isTrue();
        assertThat(config.placeholderSet().isPlaceholder("Unknown.")).isFalse();
    }

    @Test
    void overrideFileWins(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("engine.properties");
        Files.writeString(file, "severity.high=9\nbatch.dryRunDefault=false\n", StandardCharsets.UTF_8);

        EngineConfig config = new PropertiesConfigSource(file).load();

        assertThat(config.thresholds().high()).isEqualTo(9.0);
        assertThat(config.thresholds().medium()).isEqualTo(4.0);
        assertThat(config.dryRunDefault()).isFalse();
    }

    @Test
    void missingOverrideFileUsesDefaults(@TempDir Path dir) {
        assertThat(new PropertiesConfigSource(dir.resolve("absent.properties")).load()).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void cachedConfigIsReloadedAfterItsTtl() {
        EngineConfig first = EngineConfig.defaults();
        EngineConfig second = EngineConfig.from(Map.of(EngineConfig.PAGE_SIZE, "20"));
        when(delegate.load()).thenReturn(first, second);
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        CachingConfigSource source = new CachingConfigSource(delegate, Duration.ofSeconds(60), clock);

        assertThat(source.load()).isSameAs(first);
        clock.advance(Duration.ofSeconds(59));
        assertThat(source.load()).isSameAs(first);
        clock.advance(Duration.ofSeconds(1));
        assertThat(source.load()).isSameAs(second);
        verify(delegate, times(2)).load();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) { this.now = now; }

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }
}
