package dev.ragbench.pipeline;

/** Category of a failed attempt, used to group errors across an iteration. */
public enum ErrorType {
  TIMEOUT,
  NETWORK,
  SERVER_ERROR,
  RATE_LIMIT,
  FORBIDDEN,
  CLIENT_ERROR,
  EMPTY_RESPONSE,
  MALFORMED_RESPONSE,
  MATCHER_FAULT,
  UNKNOWN
}
