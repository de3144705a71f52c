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
 * Base exception for all CallGuard errors.
 *
 * <p>Sealed class ensuring exhaustive handling of all error types. Admission errors are delivered
 * as the failure of the future returned by {@code RateLimiter.acquire}; cache errors are thrown
 * directly.
 *
 * @since 1.0.0
 */
public abstract sealed class CallGuardException extends RuntimeException
    permits EndpointNotConfiguredException,
        QueueFullException,
        AdmissionTimeoutException,
        QueueClearedException,
        PersistenceException,
        CacheSerializationException {

  protected CallGuardException(String message) {
    super(message);
  }

  protected CallGuardException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether a caller's retry policy may repeat the same call after this error.
   *
   * @return true only for transient conditions such as an admission timeout
   */
  public boolean isRetryable() {
    return false;
  }
}
