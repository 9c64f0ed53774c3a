package dev.ragbench.improvement;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Backlog location and applier settings, bound from {@code ragbench.backlog.*}.
 *
 * @param path JSON file holding the improvements
 * @param applierCommand command run to apply an item; the item id is appended as last argument
 * @param applierTimeoutSeconds how long the command may run
 * @param regressionTolerancePp accuracy drop tolerated at verification before an item fails
 */
@ConfigurationProperties(prefix = "ragbench.backlog")
public record BacklogProperties(
    @DefaultValue("data/backlog.json") String path,
    List<String> applierCommand,
    @DefaultValue("120") long applierTimeoutSeconds,
    @DefaultValue("1.0") double regressionTolerancePp) {

  public BacklogProperties {
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("ragbench.backlog.path must not be blank");
    }
    applierCommand = applierCommand == null ? List.of() : List.copyOf(applierCommand);
    if (applierTimeoutSeconds < 1) {
      throw new IllegalStateException(
          "ragbench.backlog.applier-timeout-seconds must be positive, got: "
              + applierTimeoutSeconds);
    }
    if (regressionTolerancePp < 0.0) {
      throw new IllegalStateException(
          "ragbench.backlog.regression-tolerance-pp must be >= 0, got: " + regressionTolerancePp);
    }
  }
}
