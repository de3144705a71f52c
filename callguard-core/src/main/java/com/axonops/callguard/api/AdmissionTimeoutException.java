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
 * Thrown when a queued request is not admitted before its deadline.
 *
 * <p>Signals sustained overload on the endpoint. Retryable.
 *
 * @since 1.0.0
 */
public final class AdmissionTimeoutException extends CallGuardException {

  private final String endpoint;
  private final long timeoutMillis;

  public AdmissionTimeoutException(String endpoint, long timeoutMillis) {
    super(
        "CallGuard: Request timeout for endpoint: "
            + endpoint
            + " after "
            + timeoutMillis
            + " ms in queue");
    this.endpoint = endpoint;
    this.timeoutMillis = timeoutMillis;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
