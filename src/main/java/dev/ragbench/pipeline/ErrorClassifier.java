package dev.ragbench.pipeline;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import org.springframework.web.client.ResourceAccessException;

/** Maps HTTP statuses and client exceptions to an {@link ErrorType}. */
public final class ErrorClassifier {

  private ErrorClassifier() {}

  public static ErrorType forStatus(int status) {
    if (status == 429) {
      return ErrorType.RATE_LIMIT;
    }
    if (status == 403) {
      return ErrorType.FORBIDDEN;
    }
    if (status >= 500) {
      return ErrorType.SERVER_ERROR;
    }
    if (status >= 400) {
      return ErrorType.CLIENT_ERROR;
    }
    return ErrorType.UNKNOWN;
  }

  /** 5xx and 403 are retried; 403 is the pipelines' rate-limit signal, not an auth failure. */
  public static boolean isRetryableStatus(int status) {
    return status == 403 || status >= 500;
  }

  /**
   * Classifies an I/O failure by walking the cause chain.
   *
   * @param failure exception raised while sending the request or reading the response
   * @return {@link ErrorType#TIMEOUT} or {@link ErrorType#NETWORK}, or {@link ErrorType#UNKNOWN}
   */
  public static ErrorType forException(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
        return ErrorType.TIMEOUT;
      }
      if (t instanceof ConnectException || t instanceof UnknownHostException) {
        return ErrorType.NETWORK;
      }
      String message = t.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains("timed out")) {
        return ErrorType.TIMEOUT;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    if (failure instanceof IOException || failure instanceof ResourceAccessException) {
      return ErrorType.NETWORK;
    }
    return ErrorType.UNKNOWN;
  }
}
