package construction.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class EngineOptionsTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty(EngineOptions.PARALLELISM_PROPERTY);
    System.clearProperty(EngineOptions.SYMMETRIZATION_PROPERTY);
    System.clearProperty(EngineOptions.EXCHANGE_PROPERTY);
  }

  @Test
  void defaultsArePositive() {
    EngineOptions defaults = EngineOptions.defaults();
    assertTrue(defaults.parallelism() > 0);
    assertEquals(8, defaults.symmetrizationParallelism());
    assertEquals(1, defaults.exchangeParallelism());
  }

  @Test
  void normalizeReplacesNonPositiveSizes() {
    EngineOptions normalized = EngineOptions.normalize(new EngineOptions(3, 0, -2));
    assertEquals(3, normalized.parallelism());
    assertEquals(8, normalized.symmetrizationParallelism());
    assertEquals(1, normalized.exchangeParallelism());
  }

  @Test
  void normalizeOfNullIsDefaults() {
    assertEquals(EngineOptions.defaults(), EngineOptions.normalize(null));
  }

  @Test
  void environmentNamesAreUpperSnakeCase() {
    assertEquals(
        "CONSTRUCTION_PARALLELISM", EngineOptions.environmentName("construction.parallelism"));
    assertEquals(
        "CONSTRUCTION_SYMMETRIZATION_PARALLELISM",
        EngineOptions.environmentName("construction.symmetrizationParallelism"));
  }

  @Test
  void systemPropertiesOverrideDefaults() {
    System.setProperty(EngineOptions.PARALLELISM_PROPERTY, "3");
    System.setProperty(EngineOptions.SYMMETRIZATION_PROPERTY, " 5 ");
    System.setProperty(EngineOptions.EXCHANGE_PROPERTY, "2");

    EngineOptions options = EngineOptions.fromSystemProperties();

    assertEquals(new EngineOptions(3, 5, 2), options);
  }

  @Test
  void unparsableValuesFallBack() {
    System.setProperty(EngineOptions.SYMMETRIZATION_PROPERTY, "many");
    System.setProperty(EngineOptions.EXCHANGE_PROPERTY, "0");

    EngineOptions options = EngineOptions.fromSystemProperties();

    assertEquals(8, options.symmetrizationParallelism());
    assertEquals(1, options.exchangeParallelism());
  }
}
