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

package com.axonops.callguard.ratelimit;

/**
 * Receives admission events from a {@link RateLimiter}, e.g. to feed a telemetry collector.
 *
 * <p>Called on the thread that caused the event, outside the limiter's lock. Implementations must
 * be fast; exceptions are logged and ignored.
 *
 * @since 1.0.0
 */
public interface RateLimiterListener {

  /**
   * A request found no token and was queued.
   *
   * @param endpoint endpoint name
   * @param queueDepth queue depth for the endpoint after insertion
   */
  default void onRequestQueued(String endpoint, int queueDepth) {}

  /**
   * A queued request was admitted.
   *
   * @param endpoint endpoint name
   * @param waitTimeMillis time the request spent queued
   */
  default void onRequestProcessed(String endpoint, long waitTimeMillis) {}
}
