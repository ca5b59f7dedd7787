package construction.core;

import com.google.common.primitives.Ints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker pool sizes of the engine.
 *
 * @param parallelism workers filling the evaluation matrix of a simplification
 * @param symmetrizationParallelism workers symmetrizing the summands of a sum and the members of
 *     an orbit
 * @param exchangeParallelism workers exchange-symmetrizing the summands of a sum
 */
public record EngineOptions(
    int parallelism, int symmetrizationParallelism, int exchangeParallelism) {
  private static final Logger LOG = LoggerFactory.getLogger(EngineOptions.class);

  static final String PARALLELISM_PROPERTY = "construction.parallelism";
  static final String SYMMETRIZATION_PROPERTY = "construction.symmetrizationParallelism";
  static final String EXCHANGE_PROPERTY = "construction.exchangeParallelism";

  private static final int DEFAULT_SYMMETRIZATION_PARALLELISM = 8;
  private static final int DEFAULT_EXCHANGE_PARALLELISM = 1;

  public static EngineOptions defaults() {
    return new EngineOptions(
        Runtime.getRuntime().availableProcessors(),
        DEFAULT_SYMMETRIZATION_PARALLELISM,
        DEFAULT_EXCHANGE_PARALLELISM);
  }

  /** Replaces missing or non-positive sizes by their defaults. */
  public static EngineOptions normalize(EngineOptions options) {
    if (options == null) {
      return defaults();
    }
    EngineOptions defaults = defaults();
    int parallelism = options.parallelism() > 0 ? options.parallelism() : defaults.parallelism();
    int symmetrization =
        options.symmetrizationParallelism() > 0
            ? options.symmetrizationParallelism()
            : defaults.symmetrizationParallelism();
    int exchange =
        options.exchangeParallelism() > 0
            ? options.exchangeParallelism()
            : defaults.exchangeParallelism();
    return new EngineOptions(parallelism, symmetrization, exchange);
  }

  /**
   * Defaults overridden by the system properties {@code construction.parallelism}, {@code
   * construction.symmetrizationParallelism} and {@code construction.exchangeParallelism}, or the
   * environment variables {@code CONSTRUCTION_PARALLELISM}, {@code
   * CONSTRUCTION_SYMMETRIZATION_PARALLELISM} and {@code CONSTRUCTION_EXCHANGE_PARALLELISM}.
   */
  public static EngineOptions fromSystemProperties() {
    EngineOptions defaults = defaults();
    return normalize(
        new EngineOptions(
            read(PARALLELISM_PROPERTY, defaults.parallelism()),
            read(SYMMETRIZATION_PROPERTY, defaults.symmetrizationParallelism()),
            read(EXCHANGE_PROPERTY, defaults.exchangeParallelism())));
  }

  static String environmentName(String property) {
    StringBuilder sb = new StringBuilder();
    for (char c : property.toCharArray()) {
      if (c == '.') {
        sb.append('_');
      } else if (Character.isUpperCase(c)) {
        sb.append('_').append(c);
      } else {
        sb.append(Character.toUpperCase(c));
      }
    }
    return sb.toString();
  }

  private static int read(String property, int fallback) {
    String value = System.getProperty(property);
    if (value == null) {
      value = System.getenv(environmentName(property));
    }
    if (value == null) {
      return fallback;
    }
    Integer parsed = Ints.tryParse(value.trim());
    if (parsed == null) {
      LOG.warn("Ignoring unparsable value '{}' for {}", value, property);
      return fallback;
    }
    return parsed;
  }
}
