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

package com.axonops.callguard.api;

/**
 * Thrown when an endpoint has no token available and its wait queue is already at capacity.
 *
 * <p>This is the load-shedding signal. Callers should back off or trip a circuit breaker rather
 * than retry immediately.
 *
 * @since 1.0.0
 */
public final class QueueFullException extends CallGuardException {

  private final String endpoint;
  private final int queueSize;

  public QueueFullException(String endpoint, int queueSize) {
    super(
        "CallGuard: Request queue full for endpoint: "
            + endpoint
            + " (queueSize: "
            + queueSize
            + ")");
    this.endpoint = endpoint;
    this.queueSize = queueSize;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public int getQueueSize() {
    return queueSize;
  }
}
