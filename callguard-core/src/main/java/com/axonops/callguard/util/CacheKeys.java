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

package com.axonops.callguard.util;

import com.axonops.callguard.api.CacheSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derives content-addressed cache keys from structured call inputs.
 *
 * <p>The input is serialized to canonical JSON (map entries and bean properties sorted by name)
 * and hashed with SHA-256. Two inputs that serialize to the same JSON get the same key no matter
 * in which order their map entries were inserted.
 *
 * <p>Collections keep their iteration order, so a {@link java.util.HashSet} input is only stable if
 * its element order is. Prefer lists or sorted sets in key inputs.
 *
 * <pre>{@code
 * String key = CacheKeys.of(Map.of("model", "gpt-4", "prompt", prompt));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CacheKeys {

  private CacheKeys() {
    // Utility class
  }

  /**
   * Computes the key for a structured input.
   *
   * @param input any Jackson-serializable value
   * @return 64-character lowercase hex SHA-256 digest
   * @throws CacheSerializationException if the input cannot be serialized
   */
  public static String of(Object input) {
    Objects.requireNonNull(input, "input cannot be null");

    byte[] canonical;
    try {
      canonical = JsonMappers.canonical().writeValueAsBytes(input);
    } catch (JsonProcessingException e) {
      throw new CacheSerializationException(
          "Cannot derive cache key from " + input.getClass().getName(), e);
    }
    return HexFormat.of().formatHex(sha256().digest(canonical));
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // Every JDK is required to ship SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
