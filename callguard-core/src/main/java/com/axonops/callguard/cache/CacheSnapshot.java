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

import java.time.Instant;
import java.util.List;

/**
 * On-disk form of a cache: every live entry plus aggregate statistics.
 *
 * <p>{@code format} and {@code version} identify the document. A file with any other values is
 * discarded on load rather than misread.
 */
record CacheSnapshot(
    String format,
    int version,
    String cacheName,
    Instant snapshotAt,
    long hits,
    long misses,
    long totalSizeBytes,
    List<Entry> entries) {

  static final String FORMAT = "callguard-cache-snapshot";
  static final int VERSION = 1;

  boolean hasSupportedFormat() {
    return FORMAT.equals(format) && version == VERSION && entries != null;
  }

  /** Stored entry. {@code data} is serialized as base64. */
  record Entry(
      String key,
      byte[] data,
      Instant createdAt,
      Instant expiresAt,
      boolean compressed,
      long sizeBytes,
      long accessCount,
      Instant lastAccessedAt) {

    static Entry from(CacheEntry entry) {
      return new Entry(
          entry.key(),
          entry.data(),
          Instant.ofEpochMilli(entry.createdAtMillis()),
          Instant.ofEpochMilli(entry.expiresAtMillis()),
          entry.compressed(),
          entry.sizeBytes(),
          entry.accessCount(),
          Instant.ofEpochMilli(entry.lastAccessedAtMillis()));
    }

    boolean hasRequiredFields() {
      return key != null
          && data != null
          && createdAt != null
          && expiresAt != null
          && lastAccessedAt != null;
    }

    CacheEntry toCacheEntry() {
      return new CacheEntry(
          key,
          data,
          createdAt.toEpochMilli(),
          expiresAt.toEpochMilli(),
          compressed,
          accessCount,
          lastAccessedAt.toEpochMilli());
    }
  }
}
