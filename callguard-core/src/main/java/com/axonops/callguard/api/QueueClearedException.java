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
 * Thrown to queued requests that were cancelled by {@code clearQueue} or {@code destroy}.
 *
 * @since 1.0.0
 */
public final class QueueClearedException extends CallGuardException {

  private final String endpoint;

  public QueueClearedException(String endpoint) {
    super("CallGuard: Queue cleared for endpoint: " + endpoint);
    this.endpoint = endpoint;
  }

  public String getEndpoint() {
    return endpoint;
  }
}
