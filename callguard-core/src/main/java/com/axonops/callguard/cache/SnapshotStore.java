/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.callguard.cache;

import com.axonops.callguard.api.PersistenceException;
import com.axonops.callguard.util.JsonMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes snapshot files.
 *
 * <p>Writes go to {@code <path>.tmp} and are then moved over {@code <path>}, so a crash mid-write
 * leaves the previous snapshot intact.
 */
final class SnapshotStore {
  private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

  private final Path path;
  private final Path tempPath;
  private final ObjectMapper mapper = JsonMappers.standard();

  SnapshotStore(Path path) {
    this.path = path.toAbsolutePath();
    this.tempPath = this.path.resolveSibling(this.path.getFileName() + ".tmp");
  }

  Path path() {
    return path;
  }

  /**
   * Atomically replaces the snapshot file.
   *
   * @throws PersistenceException if the snapshot cannot be written
   */
  void write(CacheSnapshot snapshot) {
    try {
      Path dir = path.getParent();
      if (dir != null) {
        Files.createDirectories(dir);
      }
      writeDurably(mapper.writeValueAsBytes(snapshot));
      moveIntoPlace();
    } catch (IOException e) {
      deleteTempQuietly();
      throw new PersistenceException("Failed to write snapshot to " + path, e);
    }
  }

  // Contents must be on disk before the rename makes them visible
  private void writeDurably(byte[] bytes) throws IOException {
    try (FileChannel channel =
        FileChannel.open(
            tempPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
  }

  private void deleteTempQuietly() {
    try {
      Files.deleteIfExists(tempPath);
    } catch (IOException e) {
      logger.warn("CallGuard: Failed to delete partial snapshot {}", tempPath, e);
    }
  }

  /**
   * Reads the snapshot file.
   *
   * @return the snapshot, or empty if no file exists
   * @throws PersistenceException if the file exists but is unreadable, malformed or of another
   *     format
   */
  Optional<CacheSnapshot> read() {
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    CacheSnapshot snapshot;
    try (InputStream in = Files.newInputStream(path)) {
      snapshot = mapper.readValue(in, CacheSnapshot.class);
    } catch (NoSuchFileException e) {
      // Removed between the existence check and the read
      return Optional.empty();
    } catch (IOException e) {
      throw new PersistenceException("Failed to read snapshot from " + path, e);
    }

    if (snapshot == null || !snapshot.hasSupportedFormat()) {
      throw new PersistenceException(
          "Unrecognized snapshot format in "
              + path
              + (snapshot == null ? "" : " (" + snapshot.format() + " v" + snapshot.version() + ")"));
    }
    return Optional.of(snapshot);
  }

  private void moveIntoPlace() throws IOException {
    try {
      Files.move(
          tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      logger.debug("CallGuard: Atomic move not supported for {}, falling back to replace", path);
      Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
