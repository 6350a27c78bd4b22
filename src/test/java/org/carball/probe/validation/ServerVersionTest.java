package org.carball.probe.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServerVersionTest {

    @Test
    void shouldExtractVersionFromBanner() {
        // Given
        String banner = "Microsoft SQL Server 2022 (RTM-CU12) (KB5033663) - 16.0.4115.5 (X64)\n"
                + "\tMar  4 2024 08:56:10\n\tCopyright (C) 2022 Microsoft Corporation";

        // When/Then
        assertThat(ServerVersion.parse(banner)).contains(new ServerVersion(16, 0, 4115));
    }

    @Test
    void shouldSupportSqlServer2017Through2022() {
        assertThat(new ServerVersion(14, 0, 3465).isSupported()).isTrue();
        assertThat(new ServerVersion(15, 0, 4322).isSupported()).isTrue();
        assertThat(new ServerVersion(16, 0, 1000).isSupported()).isTrue();
    }

    @Test
    void shouldRejectOlderAndNewerVersions() {
        assertThat(new ServerVersion(13, 0, 6300).isSupported()).isFalse();
        assertThat(new ServerVersion(17, 0, 100).isSupported()).isFalse();
    }

    @Test
    void shouldReturnEmptyForUnparseableBanners() {
        assertThat(ServerVersion.parse(null)).isEmpty();
        assertThat(ServerVersion.parse("")).isEmpty();
        assertThat(ServerVersion.parse("Microsoft SQL Server vNext")).isEmpty();
    }

    @Test
    void shouldFormatAsDottedTriple() {
        assertThat(new ServerVersion(15, 0, 4322)).hasToString("15.0.4322");
    }
}
