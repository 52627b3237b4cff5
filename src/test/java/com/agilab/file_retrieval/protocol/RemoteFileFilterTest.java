package com.agilab.file_retrieval.protocol;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteFileFilterTest {

    @Test
    void matchesPattern_shouldUseCaseInsensitiveWildcards() {
        assertThat(RemoteFileFilter.matchesPattern("Report_2026.CSV", "report_*.csv")).isTrue();
        assertThat(RemoteFileFilter.matchesPattern("report_1.csv", "report_?.csv")).isTrue();
        assertThat(RemoteFileFilter.matchesPattern("report_10.csv", "report_?.csv")).isFalse();
        assertThat(RemoteFileFilter.matchesPattern("anything", "*")).isTrue();
        assertThat(RemoteFileFilter.matchesPattern("anything", "")).isTrue();
    }

    @Test
    void matchesExtension_shouldIgnoreLeadingDotAndCase() {
        assertThat(RemoteFileFilter.matchesExtension("a.CSV", ".csv")).isTrue();
        assertThat(RemoteFileFilter.matchesExtension("a.csv", "csv")).isTrue();
        assertThat(RemoteFileFilter.matchesExtension("a.txt", "csv")).isFalse();
        assertThat(RemoteFileFilter.matchesExtension("a.txt", null)).isTrue();
    }

    @Test
    void matches_shouldRequirePatternAndExtension() {
        var request = new ListingRequest("/in", "policy_*", "xml");

        assertThat(RemoteFileFilter.matches("policy_1.xml", request)).isTrue();
        assertThat(RemoteFileFilter.matches("policy_1.csv", request)).isFalse();
        assertThat(RemoteFileFilter.matches("claims_1.xml", request)).isFalse();
    }

    @Test
    void join_shouldUseSingleSlash() {
        assertThat(RemoteFileFilter.join("https://host/api/", "/in/files")).isEqualTo("https://host/api/in/files");
        assertThat(RemoteFileFilter.join("https://host/api", "in")).isEqualTo("https://host/api/in");
        assertThat(RemoteFileFilter.join("https://host/api", "")).isEqualTo("https://host/api");
    }
}
