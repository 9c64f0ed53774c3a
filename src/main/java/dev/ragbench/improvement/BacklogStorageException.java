package dev.ragbench.improvement;

/** The backlog document could not be read or written. */
public class BacklogStorageException extends RuntimeException {

  public BacklogStorageException(String message) {
    super(message);
  }

  public BacklogStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
