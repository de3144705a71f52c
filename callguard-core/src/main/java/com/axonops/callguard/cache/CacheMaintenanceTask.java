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

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background thread that sweeps expired entries and writes periodic snapshots.
 *
 * <p>Wakes every {@code cleanupInterval} to remove expired entries. Writes a snapshot on the wake-up
 * where {@code persistInterval} has elapsed since the previous one.
 *
 * @since 1.0.0
 */
final class CacheMaintenanceTask {
  private static final Logger logger = LoggerFactory.getLogger(CacheMaintenanceTask.class);

  private final ResponseCache<?> cache;
  private final CacheConfig config;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile Thread thread;

  CacheMaintenanceTask(ResponseCache<?> cache, CacheConfig config) {
    this.cache = cache;
    this.config = config;
  }

  void start() {
    if (running.compareAndSet(false, true)) {
      thread = new Thread(this::run, "CallGuard-CacheMaintenance-" + config.name());
      thread.setDaemon(true);
      thread.setPriority(Thread.MIN_PRIORITY);
      thread.start();

      logger.debug(
          "CallGuard: Cache maintenance thread started - cache: {}, cleanup: {}ms, persist: {}",
          config.name(),
          config.cleanupInterval().toMillis(),
          config.persistenceEnabled() ? config.persistInterval().toMillis() + "ms" : "disabled");
    }
  }

  /** Stops the thread and waits up to 5 seconds for it to exit. */
  void stop() {
    if (running.compareAndSet(true, false)) {
      Thread t = thread;
      if (t != null) {
        t.interrupt();
        try {
          t.join(5000);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      logger.debug("CallGuard: Cache maintenance thread stopped - cache: {}", config.name());
    }
  }

  boolean isRunning() {
    return running.get() && thread != null && thread.isAlive();
  }

  private void run() {
    long lastPersist = System.currentTimeMillis();
    long cleanupIntervalMs = config.cleanupInterval().toMillis();
    long persistIntervalMs = config.persistInterval().toMillis();

    while (running.get()) {
      try {
        Thread.sleep(cleanupIntervalMs);

        int expired = cache.cleanup();
        if (expired > 0) {
          logger.debug(
              "CallGuard: Expired entries swept - cache: {}, removed: {}", config.name(), expired);
        }

        long now = System.currentTimeMillis();
        if (config.persistenceEnabled() && now - lastPersist >= persistIntervalMs) {
          cache.persistQuietly();
          lastPersist = now;
        }
      } catch (InterruptedException e) {
        logger.trace("CallGuard: Cache maintenance thread interrupted");
        break;
      } catch (Exception e) {
        logger.error("CallGuard: Error in cache maintenance thread - cache: {}", config.name(), e);
        // Keep running: the next sweep may succeed
      }
    }
  }
}
