package com.gentoro.claimgraph.derivative;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Requests several derivative sets in parallel, each at a different sampling temperature, and keeps
 * the ones that pass {@link DerivativeValidator}. A failing set is logged and skipped; the call
 * fails only when fewer than {@link #MIN_SUCCESSFUL_SETS} sets survive.
 */
public class SelfConsistentDerivativeGenerator implements DerivativeGenerator {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(
          SelfConsistentDerivativeGenerator.class);

  public static final int MIN_SETS = 3;
  public static final int MAX_SETS = 5;
  public static final int MIN_SUCCESSFUL_SETS = 2;
  private static final double MIN_TEMPERATURE = 0.3;
  private static final double MAX_TEMPERATURE = 0.9;

  private final DerivativeSource source;
  private final BoundedFanOut fanOut;

  public SelfConsistentDerivativeGenerator(DerivativeSource source, BoundedFanOut fanOut) {
    this.source = Objects.requireNonNull(source, "source");
    this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
  }

  @Override
  public List<List<String>> generateSets(String worldview, int numSets) {
    if (numSets < MIN_SETS || numSets > MAX_SETS) {
      throw new ValidationException(
          "numDerivativeSets must be within [%d,%d]: %d".formatted(MIN_SETS, MAX_SETS, numSets));
    }
    List<Double> temperatures =
        IntStream.range(0, numSets).mapToObj(i -> temperature(i, numSets)).toList();

    List<Optional<List<String>>> results =
        fanOut.map("derivatives", temperatures, numSets, t -> generateOne(worldview, t));

    List<List<String>> sets = new ArrayList<>();
    results.forEach(r -> r.ifPresent(sets::add));
    if (sets.size() < MIN_SUCCESSFUL_SETS) {
      throw new ValidationException(
          "Only %d of %d derivative sets succeeded".formatted(sets.size(), numSets),
          Map.of("requested", numSets, "succeeded", sets.size()));
    }
    log.info("Generated {} of {} derivative sets", sets.size(), numSets);
    return List.copyOf(sets);
  }

  private Optional<List<String>> generateOne(String worldview, double temperature) {
    try {
      return Optional.of(DerivativeValidator.validate(source.generate(worldview, temperature)));
    } catch (RuntimeException e) {
      log.warn("Derivative set at temperature {} rejected: {}", temperature, e.getMessage());
      return Optional.empty();
    }
  }

  static double temperature(int index, int count) {
    if (count <= 1) return MIN_TEMPERATURE;
    return MIN_TEMPERATURE + (MAX_TEMPERATURE - MIN_TEMPERATURE) * index / (count - 1);
  }
}
