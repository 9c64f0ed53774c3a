package dev.ragbench.question;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One benchmark question with its reference answer.
 *
 * <p>Dataset files written by earlier tooling use {@code question}, {@code expected_answer} and
 * {@code rag_target}; those names are accepted as aliases.
 *
 * @param id unique question id across all datasets
 * @param text question sent to the pipeline
 * @param expectedAnswer reference answer
 * @param targetPipeline name of the pipeline that must answer it
 * @param category optional free-form category
 * @param tags optional labels, never null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Question(
    String id,
    @JsonAlias("question") String text,
    @JsonAlias({"expected", "expected_answer"}) String expectedAnswer,
    @JsonAlias({"rag_target", "rag_type", "target_pipeline", "pipeline"}) String targetPipeline,
    @Nullable String category,
    List<String> tags) {

  public Question {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static Question of(String id, String text, String expectedAnswer, String targetPipeline) {
    return new Question(id, text, expectedAnswer, targetPipeline, null, List.of());
  }
}
