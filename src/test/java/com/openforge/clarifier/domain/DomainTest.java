package com.openforge.clarifier.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainTest {

    @Test
    void shouldParseWireValuesLeniently() {
        assertThat(Domain.fromValue("business")).isEqualTo(Domain.BUSINESS);
        assertThat(Domain.fromValue(" Coding ")).isEqualTo(Domain.CODING);
        assertThat(Intensity.fromValue("BASIC")).isEqualTo(Intensity.BASIC);
    }

    @Test
    void shouldRejectUnknownValues() {
        assertThatThrownBy(() -> Domain.fromValue("finance"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("business, product, creative, research, coding");
        assertThatThrownBy(() -> Intensity.fromValue("extreme"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldNameArtifactPerDomain() {
        assertThat(Domain.BUSINESS.artifact()).isEqualTo("business ideas");
        assertThat(Domain.CODING.artifact()).isEqualTo("technical specification");
    }
}
