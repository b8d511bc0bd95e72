package ca.gc.cra.relay.testutil;

import ca.gc.cra.relay.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Metrics port keeping every increment and observation in memory. */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Long> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  public long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public List<Long> observations(String key) {
    return List.copyOf(observations.getOrDefault(key, List.of()));
  }
}
