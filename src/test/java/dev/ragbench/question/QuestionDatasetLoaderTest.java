package dev.ragbench.question;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.ragbench.config.EvaluationConfigurationException;
import dev.ragbench.fixture.TestJson;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QuestionDatasetLoaderTest {

  @TempDir Path tempDir;

  private final QuestionDatasetLoader loader = new QuestionDatasetLoader(TestJson.objectMapper());

  @Test
  void readsClasspathDatasetWithLegacyFieldNames() {
    Map<String, List<Question>> byPipeline = loader.load(List.of("classpath:datasets/sample.json"));

    assertThat(byPipeline).containsOnlyKeys("standard", "graph");
    Question standard = byPipeline.get("standard").get(0);
    assertThat(standard.text()).isEqualTo("What is the capital of France?");
    assertThat(standard.expectedAnswer()).isEqualTo("Paris");
    assertThat(standard.category()).isEqualTo("geography");
    assertThat(standard.tags()).isEmpty();
    assertThat(byPipeline.get("graph").get(0).tags()).containsExactly("multi-hop");
  }

  @Test
  void plainArrayKeepsFileOrderAcrossDatasets() throws IOException {
    Path first =
        write(
            "a.json",
            """
            [{"id": "s1", "question": "One?", "expected": "1", "rag_type": "standard"},
             {"id": "s2", "question": "Two?", "expected": "2", "rag_type": "standard"}]
            """);
    Path second =
        write(
            "b.json",
            """
            [{"id": "s3", "question": "Three?", "expected": "3", "pipeline": "standard"}]
            """);

    Map<String, List<Question>> byPipeline =
        loader.load(List.of(first.toString(), second.toString()));

    assertThat(byPipeline.get("standard"))
        .extracting(Question::id)
        .containsExactly("s1", "s2", "s3");
  }

  @Test
  void questionsWithoutExpectedAnswerAreSkipped() throws IOException {
    Path dataset =
        write(
            "blank.json",
            """
            [{"id": "s1", "question": "One?", "expected": "  ", "rag_type": "standard"},
             {"id": "s2", "question": "Two?", "expected": "2", "rag_type": "standard"}]
            """);

    assertThat(loader.load(List.of(dataset.toString())).get("standard"))
        .extracting(Question::id)
        .containsExactly("s2");
  }

  @Test
  void duplicateIdAcrossDatasetsIsAConfigurationError() throws IOException {
    Path first =
        write(
            "a.json",
            """
            [{"id": "x", "question": "?", "expected": "1", "rag_type": "standard"}]
            """);
    Path second =
        write(
            "b.json",
            """
            [{"id": "x", "question": "?", "expected": "2", "rag_type": "graph"}]
            """);

    assertThatThrownBy(() -> loader.load(List.of(first.toString(), second.toString())))
        .isInstanceOf(EvaluationConfigurationException.class)
        .hasMessageContaining("Duplicate question id 'x'");
  }

  @Test
  void questionWithoutPipelineIsAConfigurationError() throws IOException {
    Path dataset =
        write("nopipe.json", "[{\"id\": \"x\", \"question\": \"?\", \"expected\": \"1\"}]");

    assertThatThrownBy(() -> loader.load(List.of(dataset.toString())))
        .isInstanceOf(EvaluationConfigurationException.class)
        .hasMessageContaining("targetPipeline");
  }

  @Test
  void missingOrMalformedDatasetIsAConfigurationError() throws IOException {
    Path scalar = write("scalar.json", "42");

    assertThatThrownBy(() -> loader.load(List.of(tempDir.resolve("absent.json").toString())))
        .isInstanceOf(EvaluationConfigurationException.class);
    assertThatThrownBy(() -> loader.load(List.of(scalar.toString())))
        .isInstanceOf(EvaluationConfigurationException.class)
        .hasMessageContaining("must be an array");
  }

  private Path write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }
}
