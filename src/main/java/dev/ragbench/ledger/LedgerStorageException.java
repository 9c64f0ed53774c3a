package dev.ragbench.ledger;

/**
 * Raised when the ledger or the backlog cannot be read or written durably.
 *
 * <p>Fatal to a run: continuing could lose or duplicate attempts.
 */
public class LedgerStorageException extends RuntimeException {

  public LedgerStorageException(String message) {
    super(message);
  }

  public LedgerStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
