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

/**
 * One stored value with its expiry and access metadata.
 *
 * <p>{@code data} is never mutated after construction. Access fields are guarded by the owning
 * cache's monitor.
 */
final class CacheEntry {
  private final String key;
  private final byte[] data;
  private final long createdAtMillis;
  private final long expiresAtMillis;
  private final boolean compressed;

  private long accessCount;
  private long lastAccessedAtMillis;

  CacheEntry(
      String key,
      byte[] data,
      long createdAtMillis,
      long expiresAtMillis,
      boolean compressed,
      long accessCount,
      long lastAccessedAtMillis) {
    this.key = key;
    this.data = data;
    this.createdAtMillis = createdAtMillis;
    this.expiresAtMillis = expiresAtMillis;
    this.compressed = compressed;
    this.accessCount = accessCount;
    this.lastAccessedAtMillis = lastAccessedAtMillis;
  }

  static CacheEntry create(String key, byte[] data, boolean compressed, long now, long ttlMillis) {
    long expiresAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
    return new CacheEntry(key, data, now, expiresAt, compressed, 0, now);
  }

  String key() {
    return key;
  }

  byte[] data() {
    return data;
  }

  /** Size of the stored (possibly compressed) representation. */
  long sizeBytes() {
    return data.length;
  }

  long createdAtMillis() {
    return createdAtMillis;
  }

  long expiresAtMillis() {
    return expiresAtMillis;
  }

  boolean compressed() {
    return compressed;
  }

  long accessCount() {
    return accessCount;
  }

  long lastAccessedAtMillis() {
    return lastAccessedAtMillis;
  }

  boolean isExpiredAt(long nowMillis) {
    return nowMillis > expiresAtMillis;
  }

  void recordAccess(long nowMillis) {
    accessCount++;
    lastAccessedAtMillis = nowMillis;
  }
}
