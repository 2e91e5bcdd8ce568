// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.brokerworks.consumer;

import java.time.Duration;

/**
 * Contract to determine a delay between attempts of some task.
 *
 * <p>The task is the creation of a consumer by the supervising loop.
 */
public interface BackOffDelayPolicy {

  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Returns the delay to use for a given attempt.
   *
   * <p>The policy can return the TIMEOUT constant to indicate that the task has reached a timeout.
   *
   * @param recoveryAttempt number of the recovery attempt, starting at 0
   * @return the delay, TIMEOUT if the task should stop being retried
   */
  Duration delay(int recoveryAttempt);

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(delay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @return fixed-delay policy with initial delay
   */
  static BackOffDelayPolicy fixedWithInitialDelay(Duration initialDelay, Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(initialDelay, delay);
  }

  /**
   * Policy with a fixed delay and a maximum number of attempts.
   *
   * @param delay the fixed delay
   * @param maxAttempts number of attempts before the policy times out
   * @return fixed-delay policy with attempt limit
   */
  static BackOffDelayPolicy fixedWithMaxAttempts(Duration delay, int maxAttempts) {
    return new FixedWithMaxAttemptsBackOffPolicy(fixed(delay), maxAttempts);
  }

  final class FixedWithInitialDelayBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration delay;

    private FixedWithInitialDelayBackOffPolicy(Duration initialDelay, Duration delay) {
      this.initialDelay = initialDelay;
      this.delay = delay;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      return recoveryAttempt == 0 ? initialDelay : delay;
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", delay="
          + delay
          + '}';
    }
  }

  final class FixedWithMaxAttemptsBackOffPolicy implements BackOffDelayPolicy {

    private final BackOffDelayPolicy delegate;
    private final int maxAttempts;

    private FixedWithMaxAttemptsBackOffPolicy(BackOffDelayPolicy delegate, int maxAttempts) {
      if (maxAttempts <= 0) {
        throw new IllegalArgumentException("Max attempts must be positive");
      }
      this.delegate = delegate;
      this.maxAttempts = maxAttempts;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      if (recoveryAttempt >= maxAttempts) {
        return TIMEOUT;
      } else {
        return delegate.delay(recoveryAttempt);
      }
    }

    @Override
    public String toString() {
      return "FixedWithMaxAttemptsBackOffPolicy{"
          + "maxAttempts="
          + maxAttempts
          + ", delegate="
          + delegate
          + '}';
    }
  }
}
