package dev.ragbench.gate;

import java.util.Map;
import java.util.TreeMap;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Phase definitions, bound from {@code ragbench.gate.*}.
 *
 * @param phases definitions keyed by phase number
 * @param stabilityTolerancePp largest accuracy drop between two iterations still counted as stable
 */
@ConfigurationProperties(prefix = "ragbench.gate")
public record GateProperties(
    Map<Integer, PhaseDefinition> phases, @DefaultValue("2.0") double stabilityTolerancePp) {

  public GateProperties {
    phases = phases == null ? Map.of() : Map.copyOf(new TreeMap<>(phases));
    if (stabilityTolerancePp < 0.0) {
      throw new IllegalStateException(
          "ragbench.gate.stability-tolerance-pp must be >= 0, got: " + stabilityTolerancePp);
    }
  }
}
