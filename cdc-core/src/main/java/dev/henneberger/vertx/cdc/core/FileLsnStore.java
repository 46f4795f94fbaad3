package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists slot checkpoints in a JSON file ({@code {"slot": "0/16B4F50"}}).
 * Writes go to a sibling temp file that is moved over the target, so a crash mid-write leaves
 * the previous checkpoint intact.
 */
public final class FileLsnStore implements LsnStore {

  private final Path file;
  private final Object monitor = new Object();

  public FileLsnStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Optional<String> load(String slotName) throws IOException {
    Objects.requireNonNull(slotName, "slotName");
    synchronized (monitor) {
      return Optional.ofNullable(readAll().get(slotName));
    }
  }

  @Override
  public void save(String slotName, String lsn) throws IOException {
    Objects.requireNonNull(slotName, "slotName");
    Objects.requireNonNull(lsn, "lsn");

    synchronized (monitor) {
      Map<String, String> checkpoints = readAll();
      if (lsn.equals(checkpoints.get(slotName))) {
        return;
      }
      checkpoints.put(slotName, lsn);
      writeAll(checkpoints);
    }
  }

  private Map<String, String> readAll() throws IOException {
    Map<String, String> checkpoints = new LinkedHashMap<>();
    if (Files.notExists(file)) {
      return checkpoints;
    }

    String raw = Files.readString(file, StandardCharsets.UTF_8);
    if (raw.isBlank()) {
      return checkpoints;
    }

    JsonObject json = new JsonObject(raw);
    for (String key : json.fieldNames()) {
      Object value = json.getValue(key);
      if (value != null) {
        checkpoints.put(key, String.valueOf(value));
      }
    }
    return checkpoints;
  }

  private void writeAll(Map<String, String> checkpoints) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    JsonObject json = new JsonObject();
    checkpoints.forEach(json::put);
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    Files.writeString(tmp, json.encodePrettily(), StandardCharsets.UTF_8);
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
