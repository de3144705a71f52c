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

import java.util.Comparator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/** A caller waiting for a token. Guarded by the owning limiter's monitor. */
final class QueuedRequest {

  /** Priority-major (highest first), then arrival order. */
  static final Comparator<QueuedRequest> ADMISSION_ORDER =
      Comparator.comparingInt((QueuedRequest r) -> r.priority.rank())
          .reversed()
          .thenComparingLong(r -> r.sequence);

  private final long sequence;
  private final String endpoint;
  private final Priority priority;
  private final long enqueuedNanos;
  private final long timeoutMillis;
  private final CompletableFuture<Void> future = new CompletableFuture<>();
  private ScheduledFuture<?> deadline;

  QueuedRequest(
      long sequence, String endpoint, Priority priority, long enqueuedNanos, long timeoutMillis) {
    this.sequence = sequence;
    this.endpoint = endpoint;
    this.priority = priority;
    this.enqueuedNanos = enqueuedNanos;
    this.timeoutMillis = timeoutMillis;
  }

  long sequence() {
    return sequence;
  }

  String endpoint() {
    return endpoint;
  }

  Priority priority() {
    return priority;
  }

  long enqueuedNanos() {
    return enqueuedNanos;
  }

  long timeoutMillis() {
    return timeoutMillis;
  }

  CompletableFuture<Void> future() {
    return future;
  }

  void deadline(ScheduledFuture<?> deadline) {
    this.deadline = deadline;
  }

  void cancelDeadline() {
    if (deadline != null) {
      deadline.cancel(false);
      deadline = null;
    }
  }

  @Override
  public String toString() {
    return "req-" + sequence + " (" + endpoint + ", " + priority + ")";
  }
}
