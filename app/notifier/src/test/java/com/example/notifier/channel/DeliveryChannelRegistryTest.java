package com.example.notifier.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class DeliveryChannelRegistryTest {

  @Test
  void findsChannelsByName() {
    final DeliveryChannelRegistry registry =
        new DeliveryChannelRegistry(List.of(new ConsoleDeliveryChannel()));

    assertThat(registry.find("console")).isPresent();
    assertThat(registry.find("sms")).isEmpty();
    assertThat(registry.names()).containsExactly("console");
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThatThrownBy(
            () ->
                new DeliveryChannelRegistry(
                    List.of(new ConsoleDeliveryChannel(), new ConsoleDeliveryChannel())))
        .isInstanceOf(IllegalStateException.class);
  }
}
