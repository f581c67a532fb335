package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class CorrelationIdsTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void explicitIdWinsOverMdc() {
    MDC.put(CorrelationIds.MDC_KEY, "from-mdc");

    assertThat(CorrelationIds.resolve("  corr-1 ")).isEqualTo("corr-1");
  }

  @Test
  void fallsBackToMdcWhenExplicitIsBlank() {
    MDC.put(CorrelationIds.MDC_KEY, "from-mdc");

    assertThat(CorrelationIds.resolve(" ")).isEqualTo("from-mdc");
  }

  @Test
  void generatesUuidWhenNothingIsBound() {
    final String resolved = CorrelationIds.resolve(null);

    assertThat(UUID.fromString(resolved)).isNotNull();
  }
}
