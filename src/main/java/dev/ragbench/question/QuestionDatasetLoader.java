package dev.ragbench.question;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ragbench.config.EvaluationConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Loads question datasets and groups them by target pipeline.
 *
 * <p>A dataset is a JSON array of questions or an object with a {@code questions} array. Locations
 * prefixed with {@code classpath:} are read from the classpath, anything else from the file
 * system. Order within a pipeline follows file order, then position in the file.
 */
@Component
public class QuestionDatasetLoader {

  private static final Logger log = LoggerFactory.getLogger(QuestionDatasetLoader.class);

  private static final String CLASSPATH_PREFIX = "classpath:";

  private final ObjectMapper objectMapper;

  public QuestionDatasetLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Reads every dataset and returns its questions grouped by pipeline.
   *
   * @param locations dataset locations, read in order
   * @return questions per pipeline in first-seen pipeline order
   * @throws EvaluationConfigurationException if a dataset is unreadable, a question lacks an id,
   *     text or pipeline, or an id appears twice
   */
  public Map<String, List<Question>> load(List<String> locations) {
    Map<String, List<Question>> byPipeline = new LinkedHashMap<>();
    Set<String> seenIds = new HashSet<>();
    for (String location : locations) {
      List<Question> questions = readDataset(location);
      for (Question question : questions) {
        if (!seenIds.add(question.id())) {
          throw new EvaluationConfigurationException(
              "Duplicate question id '" + question.id() + "' in " + location);
        }
        byPipeline.computeIfAbsent(question.targetPipeline(), k -> new ArrayList<>()).add(question);
      }
      log.info("Loaded {} questions from {}", questions.size(), location);
    }
    Map<String, List<Question>> result = new LinkedHashMap<>();
    byPipeline.forEach((pipeline, questions) -> result.put(pipeline, List.copyOf(questions)));
    return result;
  }

  private List<Question> readDataset(String location) {
    JsonNode root;
    try (InputStream in = resolve(location).getInputStream()) {
      root = objectMapper.readTree(in);
    } catch (IOException e) {
      throw new EvaluationConfigurationException("Cannot read dataset " + location, e);
    }
    JsonNode entries = root != null && root.isObject() ? root.path("questions") : root;
    if (entries == null || !entries.isArray()) {
      throw new EvaluationConfigurationException(
          "Dataset " + location + " must be an array or an object with a 'questions' array");
    }

    List<Question> questions = new ArrayList<>(entries.size());
    for (JsonNode entry : entries) {
      if (!entry.isObject()) {
        log.debug("Skipping non-object entry in {}", location);
        continue;
      }
      Question question = toQuestion(entry, location);
      if (question.expectedAnswer() == null || question.expectedAnswer().isBlank()) {
        log.warn("Skipping question {} in {}: no expected answer", question.id(), location);
        continue;
      }
      questions.add(question);
    }
    return questions;
  }

  private Question toQuestion(JsonNode entry, String location) {
    Question question;
    try {
      question = objectMapper.treeToValue(entry, Question.class);
    } catch (JsonProcessingException e) {
      throw new EvaluationConfigurationException(
          "Invalid question in " + location + ": " + e.getOriginalMessage(), e);
    }
    requireText(question.id(), "id", location, entry);
    requireText(question.text(), "text", location, entry);
    requireText(question.targetPipeline(), "targetPipeline", location, entry);
    return question;
  }

  private static void requireText(String value, String field, String location, JsonNode entry) {
    if (value == null || value.isBlank()) {
      throw new EvaluationConfigurationException(
          "Question in " + location + " has no " + field + ": " + entry);
    }
  }

  private static Resource resolve(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()));
    }
    return new FileSystemResource(location);
  }
}
