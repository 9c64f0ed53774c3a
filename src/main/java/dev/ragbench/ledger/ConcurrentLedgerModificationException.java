package dev.ragbench.ledger;

import java.nio.file.Path;

/** The document on disk was saved by someone else since it was loaded. */
public class ConcurrentLedgerModificationException extends LedgerStorageException {

  private final long expectedRevision;
  private final long actualRevision;

  public ConcurrentLedgerModificationException(
      Path path, long expectedRevision, long actualRevision) {
    super(
        "Document "
            + path
            + " is at revision "
            + actualRevision
            + " but revision "
            + expectedRevision
            + " was expected");
    this.expectedRevision = expectedRevision;
    this.actualRevision = actualRevision;
  }

  public long expectedRevision() {
    return expectedRevision;
  }

  public long actualRevision() {
    return actualRevision;
  }
}
