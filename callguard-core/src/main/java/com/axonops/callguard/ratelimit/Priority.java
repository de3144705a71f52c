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
 * Admission priority of a queued request.
 *
 * <p>Strict total order: {@code HIGH > MEDIUM > LOW}. Within a band requests are admitted in
 * arrival order.
 *
 * @since 1.0.0
 */
public enum Priority {
  LOW(1),
  MEDIUM(2),
  HIGH(3);

  private final int rank;

  Priority(int rank) {
    this.rank = rank;
  }

  /** Higher rank is admitted first. */
  public int rank() {
    return rank;
  }
}
