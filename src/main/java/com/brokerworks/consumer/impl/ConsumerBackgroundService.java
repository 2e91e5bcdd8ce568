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
package com.brokerworks.consumer.impl;

import static com.brokerworks.consumer.Resource.State.CLOSED;
import static com.brokerworks.consumer.Resource.State.CLOSING;
import static com.brokerworks.consumer.Resource.State.OPEN;
import static com.brokerworks.consumer.Resource.State.RECOVERING;

import com.brokerworks.consumer.BackOffDelayPolicy;
import com.brokerworks.consumer.ConsumerConfiguration;
import com.brokerworks.consumer.ConsumerLogger;
import com.brokerworks.consumer.CorrelationContext;
import com.brokerworks.consumer.CorrelationIdProvider;
import com.brokerworks.consumer.InvalidDeliveryOutcomeException;
import com.brokerworks.consumer.SupervisedConsumer;
import com.brokerworks.consumer.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervising loop of a consumer.
 *
 * <p>Creates a {@link ConsumerSession}, receives messages until the session stops running or
 * fails, disposes of the session and starts over with a new session. A failure, including an
 * {@link Error} other than a {@link VirtualMachineError}, is logged and followed by the back-off
 * delay, a clean stop is not. Only {@link #close()} or a {@link BackOffDelayPolicy#TIMEOUT} delay
 * stop the loop.
 */
final class ConsumerBackgroundService extends ResourceBase implements SupervisedConsumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerBackgroundService.class);

  private final ConsumerConfiguration configuration;
  private final Supplier<ConsumerSession> sessionFactory;
  private final ConsumerLogger logger;
  private final CorrelationIdProvider correlationIdProvider;
  private final BackOffDelayPolicy backOffDelayPolicy;
  private final MetricsCollector metricsCollector;
  private final ExecutorService executorService;
  private final boolean privateExecutorService;
  private final Duration shutdownTimeout;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final CountDownLatch cancellation = new CountDownLatch(1);
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final Object stateLock = new Object();
  private volatile ConsumerSession currentSession;
  private volatile Future<?> loop;

  ConsumerBackgroundService(
      ConsumerConfiguration configuration,
      Supplier<ConsumerSession> sessionFactory,
      ConsumerLogger logger,
      CorrelationIdProvider correlationIdProvider,
      BackOffDelayPolicy backOffDelayPolicy,
      MetricsCollector metricsCollector,
      ExecutorService executorService,
      Duration shutdownTimeout,
      List<StateListener> listeners) {
    super(configuration.idEndpoint(), listeners);
    this.configuration = configuration;
    this.sessionFactory = sessionFactory;
    this.logger = logger;
    this.correlationIdProvider = correlationIdProvider;
    this.backOffDelayPolicy =
        backOffDelayPolicy == null
            ? BackOffDelayPolicy.fixed(Duration.ofMillis(configuration.retryTime()))
            : backOffDelayPolicy;
    this.metricsCollector = metricsCollector;
    if (executorService == null) {
      this.executorService =
          Utils.singleThreadExecutor("amqp-consumer-%s-", configuration.idEndpoint());
      this.privateExecutorService = true;
    } else {
      this.executorService = executorService;
      this.privateExecutorService = false;
    }
    this.shutdownTimeout = shutdownTimeout;
  }

  @Override
  public String idEndpoint() {
    return this.configuration.idEndpoint();
  }

  @Override
  public void start() {
    checkNotClosed();
    if (this.started.compareAndSet(false, true)) {
      LOGGER.debug("Starting consumer '{}'", this.idEndpoint());
      this.loop = this.executorService.submit(this::run);
    }
  }

  void run() {
    CorrelationContext correlation =
        CorrelationContext.create(this.idEndpoint(), this.correlationIdProvider);
    Throwable lastFailure = null;
    Throwable escaped = null;
    boolean active = this.configuration.active();
    try {
      if (!active) {
        this.logger.info(correlation, "ConsumerBackgroundService is not active");
        return;
      }
      int attempt = 0;
      while (!this.cancellationRequested()) {
        ConsumerSession session = this.sessionFactory.get();
        this.currentSession = session;
        Throwable failure = null;
        try {
          session.createConsumer();
          this.logger.info(correlation, "Consumer created");
          attempt = 0;
          this.transition(OPEN, null);
          try (session) {
            while (!this.cancellationRequested() && session.isRunning()) {
              session.receiveMessage(correlation);
              correlation = correlation.next();
            }
            if (!this.cancellationRequested()) {
              this.logger.info(correlation, "Consumer has stopped running");
            }
          } catch (Throwable e) {
            failure = passFailure(e);
          }
        } catch (Throwable e) {
          session.close();
          failure = passFailure(e);
        } finally {
          this.currentSession = null;
        }

        if (this.cancellationRequested()) {
          if (failure != null) {
            LOGGER.debug(
                "Consumer '{}' failure during cancellation: {}",
                this.idEndpoint(),
                Utils.exceptionMessage(failure));
          }
          break;
        }

        if (failure == null) {
          // clean stop, the consumer is created again right away
          correlation = correlation.next();
          LOGGER.debug("Consumer '{}' stopped running, restarting", this.idEndpoint());
          continue;
        }

        lastFailure = failure;
        this.logFailure(correlation, failure);
        Duration delay = this.backOffDelayPolicy.delay(attempt++);
        if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
          this.logger.info(correlation, "Giving up after {} attempt(s)", attempt);
          break;
        }
        this.logger.trace(correlation, "Retry on {}", delay.toMillis());
        this.metricsCollector.recover();
        this.transition(RECOVERING, failure);
        if (this.awaitCancellation(delay)) {
          break;
        }
        correlation = correlation.next();
        LOGGER.debug("Consumer '{}' retry delay elapsed, restarting", this.idEndpoint());
      }
    } catch (Throwable e) {
      escaped = e;
      lastFailure = e;
      throw e;
    } finally {
      if (escaped instanceof VirtualMachineError) {
        LOGGER.error("Consumer '{}' loop failed", this.idEndpoint(), escaped);
      } else if (escaped != null) {
        this.logFailure(correlation, escaped);
      }
      if (active) {
        this.logger.info(correlation, "ConsumerBackgroundService is terminated");
      }
      synchronized (this.stateLock) {
        this.state(CLOSED, this.cancellationRequested() ? null : lastFailure);
      }
      this.terminated.countDown();
    }
  }

  @Override
  public void close() {
    if (!this.closed.compareAndSet(false, true)) {
      return;
    }
    synchronized (this.stateLock) {
      this.cancellation.countDown();
      if (this.state() != CLOSED) {
        this.state(CLOSING);
      }
    }
    Future<?> l = this.loop;
    if (l == null) {
      synchronized (this.stateLock) {
        this.state(CLOSED);
      }
    } else {
      ConsumerSession session = this.currentSession;
      if (session != null && !session.isHandling()) {
        // unblocks a receive waiting for a message
        session.close();
      }
      try {
        if (!this.terminated.await(this.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
          LOGGER.warn(
              "Consumer '{}' did not stop in {} ms, interrupting it",
              this.idEndpoint(),
              this.shutdownTimeout.toMillis());
          session = this.currentSession;
          if (session != null) {
            session.close();
          }
          l.cancel(true);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        l.cancel(true);
      }
    }
    if (this.privateExecutorService) {
      this.executorService.shutdownNow();
    }
  }

  boolean awaitTermination(Duration timeout) throws InterruptedException {
    return this.terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  ConsumerConfiguration configuration() {
    return this.configuration;
  }

  private static Throwable passFailure(Throwable failure) {
    if (failure instanceof VirtualMachineError) {
      throw (VirtualMachineError) failure;
    }
    return failure;
  }

  private void logFailure(CorrelationContext correlation, Throwable failure) {
    if (failure instanceof InvalidDeliveryOutcomeException) {
      this.logger.error(
          correlation, "Invalid delivery outcome, the message handler is defective", failure);
    } else {
      this.logger.error(correlation, failure);
    }
  }

  private void transition(State state, Throwable failureCause) {
    synchronized (this.stateLock) {
      if (!this.cancellationRequested()) {
        this.state(state, failureCause);
      }
    }
  }

  private boolean cancellationRequested() {
    return this.cancellation.getCount() == 0 || Thread.currentThread().isInterrupted();
  }

  private boolean awaitCancellation(Duration delay) {
    try {
      return this.cancellation.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  @Override
  public String toString() {
    return "ConsumerBackgroundService{" + "idEndpoint='" + this.idEndpoint() + '\'' + '}';
  }
}
