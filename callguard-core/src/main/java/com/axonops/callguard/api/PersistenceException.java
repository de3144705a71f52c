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
 * Thrown when writing or reading a cache snapshot fails.
 *
 * <p>Never fatal: background snapshot failures are logged and the in-memory cache stays
 * authoritative.
 *
 * @since 1.0.0
 */
public final class PersistenceException extends CallGuardException {

  public PersistenceException(String message) {
    super("CallGuard: Persistence error: " + message);
  }

  public PersistenceException(String message, Throwable cause) {
    super("CallGuard: Persistence error: " + message, cause);
  }
}
