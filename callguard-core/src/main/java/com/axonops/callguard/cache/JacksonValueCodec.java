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

import com.axonops.callguard.api.CacheSerializationException;
import com.axonops.callguard.util.JsonMappers;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

/**
 * JSON value codec backed by Jackson.
 *
 * <pre>{@code
 * ValueCodec<String> strings = JacksonValueCodec.of(String.class);
 * ValueCodec<List<Message>> messages = JacksonValueCodec.of(new TypeReference<>() {});
 * }</pre>
 *
 * @param <T> cached value type
 * @since 1.0.0
 */
public final class JacksonValueCodec<T> implements ValueCodec<T> {

  private final ObjectMapper mapper;
  private final JavaType type;

  private JacksonValueCodec(ObjectMapper mapper, JavaType type) {
    this.mapper = mapper;
    this.type = type;
  }

  public static <T> JacksonValueCodec<T> of(Class<T> type) {
    Objects.requireNonNull(type, "type cannot be null");
    ObjectMapper mapper = JsonMappers.standard();
    return new JacksonValueCodec<>(mapper, mapper.constructType(type));
  }

  public static <T> JacksonValueCodec<T> of(TypeReference<T> type) {
    Objects.requireNonNull(type, "type cannot be null");
    ObjectMapper mapper = JsonMappers.standard();
    return new JacksonValueCodec<>(mapper, mapper.getTypeFactory().constructType(type));
  }

  @Override
  public byte[] encode(T value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new CacheSerializationException(
          "Failed to encode value of type " + value.getClass().getName(), e);
    }
  }

  @Override
  public T decode(byte[] bytes) {
    try {
      return mapper.readValue(bytes, type);
    } catch (IOException e) {
      throw new CacheSerializationException("Failed to decode value as " + type, e);
    }
  }
}
