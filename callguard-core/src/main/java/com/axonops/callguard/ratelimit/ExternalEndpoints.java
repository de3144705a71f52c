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

import java.util.Map;

/**
 * Limits for the generation services this library is deployed in front of.
 *
 * <p>Values are conservative relative to the providers' published quotas.
 *
 * @since 1.0.0
 */
public final class ExternalEndpoints {

  public static final String CHAT_COMPLETION = "chat-completion";
  public static final String SPEECH_SYNTHESIS = "speech-synthesis";
  public static final String TRANSCRIPTION = "transcription";

  /** Endpoint name to limits. */
  public static final Map<String, EndpointConfig> DEFAULTS =
      Map.of(
          CHAT_COMPLETION, EndpointConfig.of(60, 10, 50),
          SPEECH_SYNTHESIS, EndpointConfig.of(50, 8, 30),
          TRANSCRIPTION, EndpointConfig.of(50, 8, 30));

  private ExternalEndpoints() {
    // Utility class
  }

  /**
   * Configures every default endpoint on the given limiter.
   *
   * @param limiter limiter built at the composition root
   * @return the same limiter
   */
  public static RateLimiter configureDefaults(RateLimiter limiter) {
    DEFAULTS.forEach(limiter::configure);
    return limiter;
  }
}
