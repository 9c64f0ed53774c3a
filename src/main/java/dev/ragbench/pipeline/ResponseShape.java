package dev.ragbench.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of response bodies the pipelines are known to produce, in the order they are tried.
 *
 * <p>Each shape inspects the parsed body and either yields an answer or declines. {@link
 * #REMAINDER} never declines, so {@link #extractAnswer(JsonNode)} always produces text.
 */
public enum ResponseShape {

  /** Plain JSON string body. */
  TEXT {
    @Override
    Optional<String> extract(JsonNode root) {
      return root.isTextual() ? nonBlank(root.asText()) : Optional.empty();
    }
  },

  /** Array wrapping a single response object, as returned by some webhook runners. */
  ARRAY_WRAPPED {
    @Override
    Optional<String> extract(JsonNode root) {
      if (!root.isArray() || root.isEmpty()) {
        return Optional.empty();
      }
      JsonNode first = root.get(0);
      return first.isArray() ? Optional.empty() : nonBlank(extractAnswer(first));
    }
  },

  /** {@code {"response": "..."}} and the other top-level text fields. */
  DIRECT_FIELD {
    @Override
    Optional<String> extract(JsonNode root) {
      return firstText(root, DIRECT_FIELDS);
    }
  },

  /** {@code {"response": {"answer": "..."}}}, {@code {"output": {"text": "..."}}} and similar. */
  NESTED_FIELD {
    @Override
    Optional<String> extract(JsonNode root) {
      for (String outer : NESTED_CONTAINERS) {
        JsonNode container = root.path(outer);
        if (container.isObject()) {
          Optional<String> found = firstText(container, NESTED_FIELDS);
          if (found.isPresent()) {
            return found;
          }
        }
      }
      return Optional.empty();
    }
  },

  /** Orchestrator body: the first task result carrying an answer. */
  TASK_RESULTS {
    @Override
    Optional<String> extract(JsonNode root) {
      JsonNode results = root.path("task_results");
      if (!results.isArray()) {
        return Optional.empty();
      }
      for (JsonNode taskResult : results) {
        for (String field : TASK_RESULT_FIELDS) {
          JsonNode value = taskResult.path(field);
          if (value.isValueNode() && !value.isNull()) {
            Optional<String> text = nonBlank(value.asText());
            if (text.isPresent()) {
              return text;
            }
          }
        }
      }
      return Optional.empty();
    }
  },

  /** Chat-completion passthrough: {@code choices[0].message.content}. */
  CHAT_COMPLETION {
    @Override
    Optional<String> extract(JsonNode root) {
      JsonNode content = root.path("choices").path(0).path("message").path("content");
      return content.isTextual() ? nonBlank(content.asText()) : Optional.empty();
    }
  },

  /** Any sufficiently long text field that is not request echo or metadata. */
  LONG_TEXT_FIELD {
    @Override
    Optional<String> extract(JsonNode root) {
      if (!root.isObject()) {
        return Optional.empty();
      }
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (METADATA_FIELDS.contains(field.getKey()) || !field.getValue().isTextual()) {
          continue;
        }
        String text = field.getValue().asText().strip();
        if (text.length() > LONG_TEXT_MIN_LENGTH) {
          return Optional.of(text);
        }
      }
      return Optional.empty();
    }
  },

  /** Fallback: the serialized body itself, bounded. */
  REMAINDER {
    @Override
    Optional<String> extract(JsonNode root) {
      String text = root.isNull() || root.isMissingNode() ? "" : root.toString();
      if (text.length() > REMAINDER_MAX_LENGTH) {
        text = text.substring(0, REMAINDER_MAX_LENGTH);
      }
      return Optional.of(text);
    }
  };

  private static final List<String> DIRECT_FIELDS =
      List.of("response", "answer", "interpretation", "result", "output", "final_response");

  private static final List<String> NESTED_CONTAINERS =
      List.of("response", "output", "result", "data");

  private static final List<String> NESTED_FIELDS =
      List.of("answer", "response", "text", "content", "interpretation", "final_response");

  private static final List<String> TASK_RESULT_FIELDS = List.of("response", "answer", "result");

  private static final Set<String> METADATA_FIELDS =
      Set.of(
          "query",
          "tenant_id",
          "session_id",
          "benchmark_mode",
          "top_k",
          "include_sources",
          "trace_id",
          "confidence",
          "sources",
          "metadata",
          "perf");

  private static final int LONG_TEXT_MIN_LENGTH = 20;
  private static final int REMAINDER_MAX_LENGTH = 500;

  abstract Optional<String> extract(JsonNode root);

  /**
   * Returns the first shape that recognises {@code root}.
   *
   * @param root parsed response body
   * @return the matching shape, {@link #REMAINDER} when nothing more specific applies
   */
  public static ResponseShape detect(JsonNode root) {
    for (ResponseShape shape : values()) {
      if (shape.extract(root).isPresent()) {
        return shape;
      }
    }
    return REMAINDER;
  }

  /**
   * Extracts the most specific answer text from a parsed response body.
   *
   * @param root parsed response body
   * @return trimmed answer text, possibly empty
   */
  public static String extractAnswer(JsonNode root) {
    for (ResponseShape shape : values()) {
      Optional<String> answer = shape.extract(root);
      if (answer.isPresent()) {
        return answer.get().strip();
      }
    }
    return "";
  }

  private static Optional<String> firstText(JsonNode node, List<String> fields) {
    for (String field : fields) {
      JsonNode value = node.path(field);
      if (value.isTextual()) {
        Optional<String> text = nonBlank(value.asText());
        if (text.isPresent()) {
          return text;
        }
      }
    }
    return Optional.empty();
  }

  private static Optional<String> nonBlank(String text) {
    return text == null || text.isBlank() ? Optional.empty() : Optional.of(text);
  }
}
