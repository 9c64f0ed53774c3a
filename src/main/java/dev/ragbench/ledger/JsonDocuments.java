package dev.ragbench.ledger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/** Shared plumbing for the JSON documents kept on disk (ledger and backlog). */
public final class JsonDocuments {

  private JsonDocuments() {}

  /**
   * Copies {@code objectMapper} with the settings persisted documents need: ISO-8601 instants,
   * unknown properties ignored, and enum values matched case-insensitively, unknown ones read as
   * null.
   */
  public static ObjectMapper lenientCopy(ObjectMapper objectMapper) {
    ObjectMapper copy =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
    copy.setConfig(
        copy.getDeserializationConfig().with(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS));
    return copy;
  }

  /**
   * Writes {@code document} so that readers see either the old or the new content, never a
   * partial file: the bytes go to a sibling {@code .tmp} file, are forced to disk, then moved over
   * the target.
   */
  public static void writeAtomically(ObjectMapper objectMapper, Path target, Object document)
      throws IOException {
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
    Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
    try (FileChannel channel =
        FileChannel.open(
            tmp,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
    try {
      Files.move(
          tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
