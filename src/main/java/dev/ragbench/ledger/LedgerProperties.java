package dev.ragbench.ledger;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location of the ledger document, bound from {@code ragbench.ledger.*}.
 *
 * @param path JSON file holding iterations, registry and run state
 */
@ConfigurationProperties(prefix = "ragbench.ledger")
public record LedgerProperties(@DefaultValue("data/ledger.json") String path) {

  public LedgerProperties {
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("ragbench.ledger.path must not be blank");
    }
  }
}
