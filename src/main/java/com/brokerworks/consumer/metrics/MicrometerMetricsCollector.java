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
package com.brokerworks.consumer.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong consumers;
  private final Counter consume, consumeAccepted, consumeRejected, consumeReleased, consumeRetried;
  private final Counter handlerFailures;
  private final Counter recoveries;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "amqp.consumer");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.consumers = registry.gauge(prefix + ".consumers", tags, new AtomicLong(0));
    this.consume = registry.counter(prefix + ".consumed", tags);
    this.consumeAccepted = registry.counter(prefix + ".consumed_accepted", tags);
    this.consumeRejected = registry.counter(prefix + ".consumed_rejected", tags);
    this.consumeReleased = registry.counter(prefix + ".consumed_released", tags);
    this.consumeRetried = registry.counter(prefix + ".consumed_retried", tags);
    this.handlerFailures = registry.counter(prefix + ".handler_failures", tags);
    this.recoveries = registry.counter(prefix + ".recoveries", tags);
  }

  @Override
  public void openConsumer() {
    this.consumers.incrementAndGet();
  }

  @Override
  public void closeConsumer() {
    this.consumers.decrementAndGet();
  }

  @Override
  public void consume() {
    this.consume.increment();
  }

  @Override
  public void consumeDisposition(ConsumeDisposition disposition) {
    switch (disposition) {
      case ACCEPTED:
        this.consumeAccepted.increment();
        break;
      case REJECTED:
        this.consumeRejected.increment();
        break;
      case RELEASED:
        this.consumeReleased.increment();
        break;
      case RETRIED:
        this.consumeRetried.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void handlerFailure() {
    this.handlerFailures.increment();
  }

  @Override
  public void recover() {
    this.recoveries.increment();
  }
}
