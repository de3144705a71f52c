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

/**
 * Utility for shortening cache keys in log output.
 *
 * <p>Cache keys may embed prompts or other caller data. Logging a short hash keeps that data out of
 * the logs while still letting the same key be traced across log lines.
 *
 * @since 1.0.0
 */
public final class KeyHasher {

  private KeyHasher() {
    // Utility class
  }

  /**
   * Creates a compact hex hash of a key for logging.
   *
   * @param key the cache key
   * @return up to 8-character hex string, or "null"
   */
  public static String hash(String key) {
    if (key == null) {
      return "null";
    }
    return Integer.toHexString(key.hashCode());
  }
}
