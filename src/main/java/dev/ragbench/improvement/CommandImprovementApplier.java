package dev.ragbench.improvement;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies an item by running the configured command with the item id as last argument.
 *
 * <p>Exit code 0 is success. Output (stdout and stderr merged) is captured to a temporary file and
 * its tail becomes the result message.
 */
@Component
public class CommandImprovementApplier implements ImprovementApplier {

  private static final Logger log = LoggerFactory.getLogger(CommandImprovementApplier.class);

  private static final int MESSAGE_TAIL = 500;

  private final BacklogProperties properties;

  public CommandImprovementApplier(BacklogProperties properties) {
    this.properties = properties;
  }

  @Override
  public ApplyResult apply(Improvement improvement) {
    if (properties.applierCommand().isEmpty()) {
      return ApplyResult.failure(
          "No applier command configured (ragbench.backlog.applier-command)");
    }
    List<String> command = new ArrayList<>(properties.applierCommand());
    command.add(improvement.id());
    log.info("Running applier for {}: {}", improvement.id(), command);
    @Nullable Path output = null;
    try {
      output = Files.createTempFile("ragbench-applier", ".log");
      Process process =
          new ProcessBuilder(command)
              .redirectErrorStream(true)
              .redirectOutput(output.toFile())
              .start();
      if (!process.waitFor(properties.applierTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        return ApplyResult.failure(
            "Applier timed out after " + properties.applierTimeoutSeconds() + "s");
      }
      String text = tail(Files.readString(output, StandardCharsets.UTF_8));
      int exitCode = process.exitValue();
      if (exitCode == 0) {
        return ApplyResult.success(text);
      }
      return ApplyResult.failure("Exit code " + exitCode + ": " + text);
    } catch (IOException e) {
      log.warn("Applier for {} could not run", improvement.id(), e);
      return ApplyResult.failure("Applier could not run: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ApplyResult.failure("Interrupted while waiting for the applier");
    } finally {
      deleteQuietly(output);
    }
  }

  private static String tail(String text) {
    String trimmed = text.strip();
    return trimmed.length() > MESSAGE_TAIL
        ? trimmed.substring(trimmed.length() - MESSAGE_TAIL)
        : trimmed;
  }

  private static void deleteQuietly(@Nullable Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("Could not delete applier output {}", file, e);
    }
  }
}
