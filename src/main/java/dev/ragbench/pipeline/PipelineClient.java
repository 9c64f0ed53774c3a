package dev.ragbench.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Sends one question to one pipeline endpoint and returns the extracted answer.
 *
 * <p>Connection failures, timeouts, 5xx and 403 responses are retried through the shared {@link
 * RetryTemplate}; other 4xx, empty and malformed bodies are not. Every failure is returned as a
 * {@link PipelineCallResult} carrying an error, never thrown.
 */
@Service
public class PipelineClient {

  private static final Logger log = LoggerFactory.getLogger(PipelineClient.class);

  private static final int ERROR_BODY_PREVIEW = 200;

  private final RestClient.@Nullable Builder restClientBuilder;
  private final @Nullable RestClient fixedRestClient;
  private final RetryTemplate retryTemplate;
  private final ObjectMapper objectMapper;
  private final PipelineProperties properties;
  private final Map<Duration, RestClient> clientsByTimeout = new ConcurrentHashMap<>();

  @Autowired
  public PipelineClient(
      RestClient.Builder restClientBuilder,
      @Qualifier("pipelineRetryTemplate") RetryTemplate retryTemplate,
      ObjectMapper objectMapper,
      PipelineProperties properties) {
    this.restClientBuilder = restClientBuilder;
    this.fixedRestClient = null;
    this.retryTemplate = retryTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /** Uses one pre-built client for every timeout. */
  PipelineClient(
      RestClient restClient,
      RetryTemplate retryTemplate,
      ObjectMapper objectMapper,
      PipelineProperties properties) {
    this.restClientBuilder = null;
    this.fixedRestClient = restClient;
    this.retryTemplate = retryTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Calls a configured pipeline with its configured URL and read timeout.
   *
   * @throws IllegalArgumentException if the pipeline has no configured endpoint
   */
  public PipelineCallResult call(String pipeline, String questionText) {
    PipelineProperties.Endpoint endpoint = properties.endpoint(pipeline);
    if (endpoint == null) {
      throw new IllegalArgumentException("No endpoint configured for pipeline: " + pipeline);
    }
    return call(pipeline, endpoint.url(), questionText, Duration.ofMillis(endpoint.timeoutMs()));
  }

  /**
   * Posts {@code {query, tenant_id, session_id}} to {@code url}.
   *
   * @param pipeline pipeline name, used for logging
   * @param url endpoint URL
   * @param questionText question sent as {@code query}
   * @param timeout read timeout for each attempt
   * @return answer or error; latency covers all attempts and backoff
   */
  public PipelineCallResult call(
      String pipeline, String url, String questionText, Duration timeout) {
    RestClient client = clientFor(timeout);
    Map<String, String> body =
        Map.of(
            "query", questionText,
            "tenant_id", properties.tenantId(),
            "session_id", "eval-" + UUID.randomUUID());
    AtomicInteger attempts = new AtomicInteger();
    long start = System.nanoTime();

    PipelineCallResult result =
        retryTemplate.execute(
            context -> attemptOnce(pipeline, client, url, body, attempts),
            context -> recover(pipeline, context.getLastThrowable(), attempts.get()));

    long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
    log.debug(
        "Pipeline {} answered in {} ms after {} attempt(s), error={}",
        pipeline,
        latencyMs,
        result.attempts(),
        result.errorType());
    return result.withLatency(latencyMs);
  }

  private PipelineCallResult attemptOnce(
      String pipeline,
      RestClient client,
      String url,
      Map<String, String> body,
      AtomicInteger attempts) {
    int attempt = attempts.incrementAndGet();
    ResponseEntity<String> response;
    try {
      response =
          client
              .post()
              .uri(url)
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .toEntity(String.class);
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      ErrorType errorType = ErrorClassifier.forStatus(status);
      String error = "HTTP " + status + ": " + preview(e.getResponseBodyAsString());
      if (ErrorClassifier.isRetryableStatus(status)) {
        log.debug("Pipeline {} attempt {} failed with HTTP {}", pipeline, attempt, status);
        throw new TransientPipelineException(error, errorType, status, e);
      }
      return PipelineCallResult.failure("", 0, error, errorType, status, attempt);
    } catch (ResourceAccessException e) {
      log.debug("Pipeline {} attempt {} failed: {}", pipeline, attempt, e.getMessage());
      throw new TransientPipelineException(
          String.valueOf(e.getMessage()), ErrorClassifier.forException(e), null, e);
    } catch (RestClientException e) {
      return PipelineCallResult.failure(
          "", 0, String.valueOf(e.getMessage()), ErrorClassifier.forException(e), null, attempt);
    }
    return interpret(response.getStatusCode().value(), response.getBody(), attempt);
  }

  private PipelineCallResult interpret(int status, @Nullable String body, int attempts) {
    if (body == null || body.isBlank()) {
      return PipelineCallResult.failure(
          "", 0, "Empty response body", ErrorType.EMPTY_RESPONSE, status, attempts);
    }
    String trimmed = body.strip();
    if (!looksLikeJson(trimmed)) {
      return PipelineCallResult.success(bound(trimmed), 0, status, attempts);
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(trimmed);
    } catch (JsonProcessingException e) {
      return PipelineCallResult.failure(
          bound(trimmed),
          0,
          "Malformed JSON response: " + e.getOriginalMessage(),
          ErrorType.MALFORMED_RESPONSE,
          status,
          attempts);
    }
    String answer = ResponseShape.extractAnswer(root);
    if (answer.isEmpty()) {
      return PipelineCallResult.failure(
          "", 0, "Response carried no answer", ErrorType.EMPTY_RESPONSE, status, attempts);
    }
    return PipelineCallResult.success(bound(answer), 0, status, attempts);
  }

  private PipelineCallResult recover(String pipeline, @Nullable Throwable failure, int attempts) {
    if (failure instanceof TransientPipelineException transientFailure) {
      log.warn(
          "Pipeline {} failed after {} attempt(s): {}",
          pipeline,
          attempts,
          transientFailure.getMessage());
      return PipelineCallResult.failure(
          "",
          0,
          String.valueOf(transientFailure.getMessage()),
          transientFailure.errorType(),
          transientFailure.httpStatus(),
          attempts);
    }
    String message = failure == null ? "Unknown failure" : String.valueOf(failure.getMessage());
    log.warn("Pipeline {} call failed: {}", pipeline, message);
    ErrorType errorType =
        failure == null ? ErrorType.UNKNOWN : ErrorClassifier.forException(failure);
    return PipelineCallResult.failure("", 0, message, errorType, null, attempts);
  }

  private RestClient clientFor(Duration readTimeout) {
    if (fixedRestClient != null) {
      return fixedRestClient;
    }
    RestClient.Builder builder = restClientBuilder;
    return clientsByTimeout.computeIfAbsent(
        readTimeout,
        timeout -> {
          var requestFactory = new SimpleClientHttpRequestFactory();
          requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
          requestFactory.setReadTimeout(timeout);
          return builder.clone().requestFactory(requestFactory).build();
        });
  }

  private String bound(String text) {
    int max = properties.maxAnswerLength();
    return text.length() > max ? text.substring(0, max) : text;
  }

  private static boolean looksLikeJson(String text) {
    char first = text.charAt(0);
    return first == '{' || first == '[' || first == '"';
  }

  private static String preview(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > ERROR_BODY_PREVIEW ? body.substring(0, ERROR_BODY_PREVIEW) : body;
  }
}
