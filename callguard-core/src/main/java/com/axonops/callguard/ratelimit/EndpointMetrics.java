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
 * Snapshot of one endpoint's admission statistics.
 *
 * <p>{@code totalRequests}, {@code successfulRequests}, {@code rateLimitedRequests}, {@code
 * timedOutRequests} and {@code cancelledRequests} only grow until {@link
 * RateLimiter#resetMetrics(String)}. {@code rateLimitedRequests} counts immediate rejections
 * because the queue was full.
 *
 * @since 1.0.0
 */
public record EndpointMetrics(
    String endpoint,
    long totalRequests,
    long successfulRequests,
    long rateLimitedRequests,
    long timedOutRequests,
    long cancelledRequests,
    int queuedRequests,
    double averageWaitTimeMs,
    double currentTokens,
    int maxTokens) {

  /**
   * Share of requests that were admitted.
   *
   * @return ratio between 0.0 and 1.0, or 0.0 if no requests
   */
  public double admissionRate() {
    return totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests;
  }
}
