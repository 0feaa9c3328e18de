package com.chessmatch.arena.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class ArenaMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> invitationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> moveCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> workersErrorCounters = new ConcurrentHashMap<>();

  public ArenaMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLogin(boolean success) {
    final String result = success ? "success" : "rejected";
    loginCounters
        .computeIfAbsent(
            result,
            key ->
                Counter.builder("arena.login.total")
                    .tags(Tags.of("result", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordInvitationTransition(String event, String result) {
    invitationCounters
        .computeIfAbsent(
            event + ":" + result,
            key ->
                Counter.builder("arena.invitation.transition.total")
                    .tags(Tags.of("event", event, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordMove(String result) {
    moveCounters
        .computeIfAbsent(
            result,
            key ->
                Counter.builder("arena.move.total")
                    .tags(Tags.of("result", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordWorkersError(String reason) {
    workersErrorCounters
        .computeIfAbsent(
            reason,
            key ->
                Counter.builder("arena.workers.error.total")
                    .tags(Tags.of("reason", key))
                    .register(meterRegistry))
        .increment();
  }
}
