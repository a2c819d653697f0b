package com.docverify.service.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashTest {

    @Test
    void of_shouldProducePrefixedSha256Hex() {
        // sha256("abc")
        assertThat(ContentHash.of("abc"))
                .isEqualTo("sha256:ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void of_shouldBeStableAndSensitiveToAnyChange() {
        String page = "# Agents\n\nAgents enroll with a key.\n";

        assertThat(ContentHash.of(page)).isEqualTo(ContentHash.of(page));
        assertThat(ContentHash.of(page)).isNotEqualTo(ContentHash.of(page + " "));
    }
}
