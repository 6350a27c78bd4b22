package org.carball.probe.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class ProbeSettingsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ProbeSettings.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldClampCountThresholdToMaximum() {
        // Given
        ProbeSettings settings = ProbeSettings.builder().countThreshold(75).build();

        // When
        settings.validate();

        // Then
        assertThat(settings.getCountThreshold()).isEqualTo(30);
        assertThat(logAppender.list)
                .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains("clamping to 30"));
    }

    @Test
    void shouldReplaceNegativeThresholdsWithDefaults() {
        ProbeSettings settings = ProbeSettings.builder()
                .countThreshold(-1)
                .responseTimeThresholdMs(-20)
                .build();

        settings.validate();

        assertThat(settings.getCountThreshold()).isEqualTo(20);
        assertThat(settings.getResponseTimeThresholdMs()).isEqualTo(500);
    }

    @Test
    void shouldKeepZeroCountThresholdAsUnlimited() {
        ProbeSettings settings = ProbeSettings.builder().countThreshold(0).build();

        settings.validate();

        assertThat(settings.getCountThreshold()).isZero();
        assertThat(settings.getPlanCountLimit()).isEqualTo(10);
        assertThat(settings.getQueryRowLimit()).isEqualTo(ProbeSettings.MAX_COUNT_THRESHOLD);
    }

    @Test
    void shouldLimitPlansPerQuery() {
        assertThat(ProbeSettings.builder().countThreshold(4).build().getPlanCountLimit()).isEqualTo(4);
        assertThat(ProbeSettings.builder().countThreshold(25).build().getPlanCountLimit()).isEqualTo(10);
    }

    @Test
    void shouldRestoreDefaultsForNonPositiveSizes() {
        ProbeSettings settings = ProbeSettings.builder()
                .batchSize(0)
                .fetchIntervalSeconds(-5)
                .retryAttempts(0)
                .textTruncateLimit(0)
                .build();

        settings.validate();

        assertThat(settings.getBatchSize()).isEqualTo(600);
        assertThat(settings.getFetchIntervalSeconds()).isEqualTo(15);
        assertThat(settings.getRetryAttempts()).isEqualTo(3);
        assertThat(settings.getTextTruncateLimit()).isEqualTo(4094);
    }

    @Test
    void shouldSummarizeConfiguration() {
        assertThat(ProbeSettings.defaults().getConfigurationSummary())
                .contains("Count: 20")
                .contains("Response time: 500ms")
                .contains("Algorithm: bounded-heap");
    }
}
