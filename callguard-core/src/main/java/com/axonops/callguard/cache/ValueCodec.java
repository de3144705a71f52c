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
 * Converts cached values to and from bytes.
 *
 * <p>The encoded size is what the cache accounts against {@code maxSizeBytes} and compares with
 * {@code compressionThreshold}, and the bytes are what snapshot files store.
 *
 * @param <T> cached value type
 * @since 1.0.0
 */
public interface ValueCodec<T> {

  /**
   * @throws com.axonops.callguard.api.CacheSerializationException if the value cannot be encoded
   */
  byte[] encode(T value);

  /**
   * @throws com.axonops.callguard.api.CacheSerializationException if the bytes cannot be decoded
   */
  T decode(byte[] bytes);
}
