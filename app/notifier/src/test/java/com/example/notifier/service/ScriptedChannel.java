package com.example.notifier.service;

import com.example.notifier.channel.DeliveryChannel;
import com.example.notifier.channel.DeliveryPayload;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/** Channel whose n-th call (1-based) fails with whatever the script returns, or succeeds on null. */
final class ScriptedChannel implements DeliveryChannel {

  private final String name;
  private final boolean requiresRecipients;
  private final IntFunction<RuntimeException> script;
  private final AtomicInteger calls = new AtomicInteger();
  private final List<DeliveryPayload> delivered = new CopyOnWriteArrayList<>();

  ScriptedChannel(String name, boolean requiresRecipients, IntFunction<RuntimeException> script) {
    this.name = name;
    this.requiresRecipients = requiresRecipients;
    this.script = script;
  }

  static ScriptedChannel succeeding(String name) {
    return new ScriptedChannel(name, false, call -> null);
  }

  static ScriptedChannel failing(String name, RuntimeException error) {
    return new ScriptedChannel(name, false, call -> error);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean requiresRecipients() {
    return requiresRecipients;
  }

  @Override
  public void deliver(DeliveryPayload payload) {
    final RuntimeException failure = script.apply(calls.incrementAndGet());
    if (failure != null) {
      throw failure;
    }
    delivered.add(payload);
  }

  int calls() {
    return calls.get();
  }

  List<DeliveryPayload> delivered() {
    return delivered;
  }
}
