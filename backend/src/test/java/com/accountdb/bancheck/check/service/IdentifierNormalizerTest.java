package com.accountdb.bancheck.check.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierNormalizerTest {

    @Test
    void duplicatesCollapseInFirstSeenOrder() {
        List<String> normalized = IdentifierNormalizer.normalize(Arrays.asList(" B ", "A", null, "", "B", "C", "A"));

        assertThat(normalized).containsExactly("B", "A", "C");
    }

    @Test
    void recognisesSteamId64() {
        assertThat(IdentifierNormalizer.isSteamId64("76561198000000001")).isTrue();
        assertThat(IdentifierNormalizer.isSteamId64("7656119800000000")).isFalse();
        assertThat(IdentifierNormalizer.isSteamId64("STEAM_0:1:12345")).isFalse();
        assertThat(IdentifierNormalizer.isSteamId64(null)).isFalse();
    }
}
