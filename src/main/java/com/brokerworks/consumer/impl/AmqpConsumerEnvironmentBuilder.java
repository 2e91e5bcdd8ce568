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

import com.brokerworks.consumer.BackOffDelayPolicy;
import com.brokerworks.consumer.ConnectionProvider;
import com.brokerworks.consumer.ConsumerConfiguration;
import com.brokerworks.consumer.ConsumerEnvironment;
import com.brokerworks.consumer.ConsumerLogger;
import com.brokerworks.consumer.CorrelationIdProvider;
import com.brokerworks.consumer.MessageHandler;
import com.brokerworks.consumer.Resource;
import com.brokerworks.consumer.config.ConfigurationSource;
import com.brokerworks.consumer.metrics.MetricsCollector;
import com.brokerworks.consumer.metrics.NoOpMetricsCollector;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/** Builder to create a {@link ConsumerEnvironment} and register its consumers. */
public class AmqpConsumerEnvironmentBuilder {

  static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  private final Map<String, DefaultConsumerSettings> consumers = new LinkedHashMap<>();
  private ConfigurationSource configurationSource;
  private ConsumerLogger logger = new Slf4jConsumerLogger();
  private CorrelationIdProvider correlationIdProvider = CorrelationIdProvider.uuid();
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private Function<ConsumerConfiguration, ConnectionProvider> connectionProviderFactory =
      configuration -> ProtonConnectionProvider.builder(configuration.idEndpoint()).build();
  private ExecutorService executorService;
  private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

  public AmqpConsumerEnvironmentBuilder() {}

  /**
   * Set the source of consumer configurations.
   *
   * <p>Required to register consumers with {@link #consumer(String, MessageHandler)}.
   *
   * @param configurationSource the configuration source
   * @return this builder instance
   * @see com.brokerworks.consumer.config.GsonConfigurationSource
   */
  public AmqpConsumerEnvironmentBuilder configurationSource(
      ConfigurationSource configurationSource) {
    this.configurationSource = configurationSource;
    return this;
  }

  /**
   * Register a consumer from the configuration section of its endpoint identifier.
   *
   * <p>The section is looked up right away, a missing section fails here, not when the environment
   * starts.
   *
   * @param idEndpoint the endpoint identifier
   * @param handler the message handler
   * @return settings of the consumer
   * @throws com.brokerworks.consumer.ConsumerException.ConfigurationNotFoundException if there is
   *     no section for the endpoint identifier
   */
  public ConsumerSettings consumer(String idEndpoint, MessageHandler handler) {
    if (this.configurationSource == null) {
      throw new IllegalStateException("A configuration source is required to look up consumers");
    }
    return this.consumer(this.configurationSource.consumerConfiguration(idEndpoint), handler);
  }

  /**
   * Register a consumer.
   *
   * @param configuration the consumer configuration
   * @param handler the message handler
   * @return settings of the consumer
   */
  public ConsumerSettings consumer(ConsumerConfiguration configuration, MessageHandler handler) {
    Objects.requireNonNull(configuration, "Consumer configuration cannot be null");
    Objects.requireNonNull(handler, "Message handler cannot be null");
    if (this.consumers.containsKey(configuration.idEndpoint())) {
      throw new IllegalArgumentException(
          "A consumer is already registered for endpoint " + configuration.idEndpoint());
    }
    DefaultConsumerSettings settings = new DefaultConsumerSettings(this, configuration, handler);
    this.consumers.put(configuration.idEndpoint(), settings);
    return settings;
  }

  /**
   * Set the default {@link ConsumerLogger}.
   *
   * <p>Default writes to SLF4J.
   *
   * @param logger the logger
   * @return this builder instance
   */
  public AmqpConsumerEnvironmentBuilder logger(ConsumerLogger logger) {
    this.logger = logger;
    return this;
  }

  public AmqpConsumerEnvironmentBuilder correlationIdProvider(
      CorrelationIdProvider correlationIdProvider) {
    this.correlationIdProvider = correlationIdProvider;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.brokerworks.consumer.metrics.MicrometerMetricsCollector
   */
  public AmqpConsumerEnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Factory of the default connection provider of consumers.
   *
   * <p>Default creates a {@link ProtonConnectionProvider} for each consumer.
   *
   * @param connectionProviderFactory the factory
   * @return this builder instance
   */
  public AmqpConsumerEnvironmentBuilder connectionProviderFactory(
      Function<ConsumerConfiguration, ConnectionProvider> connectionProviderFactory) {
    this.connectionProviderFactory = connectionProviderFactory;
    return this;
  }

  /**
   * Set executor service used for the consumer loops.
   *
   * <p>Each consumer blocks a thread while it waits for messages, so the executor must be able to
   * run all the consumers at the same time. Each consumer uses its own thread by default.
   *
   * <p>It is the developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  public AmqpConsumerEnvironmentBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  /**
   * Time to wait for a consumer loop to stop on close before interrupting it.
   *
   * <p>Default is 10 seconds.
   *
   * @param shutdownTimeout the shutdown timeout
   * @return this builder instance
   */
  public AmqpConsumerEnvironmentBuilder shutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
    return this;
  }

  /**
   * Create the environment.
   *
   * <p>Consumers do not start until {@link ConsumerEnvironment#start()} is called.
   *
   * @return the environment
   */
  public ConsumerEnvironment build() {
    if (this.shutdownTimeout == null || this.shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("Shutdown timeout must be positive");
    }
    List<ConsumerBackgroundService> services = new ArrayList<>(this.consumers.size());
    List<ConnectionProvider> providers = new ArrayList<>(this.consumers.size());
    for (DefaultConsumerSettings settings : this.consumers.values()) {
      ConnectionProvider provider = settings.connectionProvider;
      if (provider == null) {
        provider = this.connectionProviderFactory.apply(settings.configuration);
        providers.add(provider);
      }
      services.add(this.service(settings, provider));
    }
    return new AmqpConsumerEnvironment(services, providers);
  }

  private ConsumerBackgroundService service(
      DefaultConsumerSettings settings, ConnectionProvider provider) {
    ConsumerConfiguration configuration = settings.configuration;
    MessageHandler handler = settings.handler;
    MetricsCollector metrics = this.metricsCollector;
    return new ConsumerBackgroundService(
        configuration,
        () -> new ConsumerSession(configuration, provider, handler, metrics),
        settings.logger == null ? this.logger : settings.logger,
        this.correlationIdProvider,
        settings.backOffDelayPolicy,
        metrics,
        this.executorService,
        this.shutdownTimeout,
        settings.listeners);
  }

  /** Settings of a registered consumer. */
  public interface ConsumerSettings {

    /**
     * Logger for this consumer only.
     *
     * @param logger the logger
     * @return these settings
     */
    ConsumerSettings logger(ConsumerLogger logger);

    /**
     * Connection provider for this consumer.
     *
     * <p>The application owns this provider, the environment does not close it.
     *
     * @param connectionProvider the connection provider
     * @return these settings
     */
    ConsumerSettings connectionProvider(ConnectionProvider connectionProvider);

    /**
     * Delay policy between two attempts of the consumer loop.
     *
     * <p>Default is a fixed delay of the configured retry time. A policy returning {@link
     * BackOffDelayPolicy#TIMEOUT} stops the loop.
     *
     * @param backOffDelayPolicy the policy
     * @return these settings
     */
    ConsumerSettings backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy);

    /**
     * Add {@link com.brokerworks.consumer.Resource.StateListener}s to the consumer.
     *
     * @param listeners listeners
     * @return these settings
     */
    ConsumerSettings listeners(Resource.StateListener... listeners);

    /**
     * The environment builder.
     *
     * @return environment builder
     */
    AmqpConsumerEnvironmentBuilder environmentBuilder();
  }

  static final class DefaultConsumerSettings implements ConsumerSettings {

    private final AmqpConsumerEnvironmentBuilder builder;
    private final ConsumerConfiguration configuration;
    private final MessageHandler handler;
    private final List<Resource.StateListener> listeners = new ArrayList<>();
    private ConsumerLogger logger;
    private ConnectionProvider connectionProvider;
    private BackOffDelayPolicy backOffDelayPolicy;

    private DefaultConsumerSettings(
        AmqpConsumerEnvironmentBuilder builder,
        ConsumerConfiguration configuration,
        MessageHandler handler) {
      this.builder = builder;
      this.configuration = configuration;
      this.handler = handler;
    }

    @Override
    public ConsumerSettings logger(ConsumerLogger logger) {
      this.logger = logger;
      return this;
    }

    @Override
    public ConsumerSettings connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    @Override
    public ConsumerSettings backOffDelayPolicy(BackOffDelayPolicy backOffDelayPolicy) {
      this.backOffDelayPolicy = backOffDelayPolicy;
      return this;
    }

    @Override
    public ConsumerSettings listeners(Resource.StateListener... listeners) {
      if (listeners == null || listeners.length == 0) {
        this.listeners.clear();
      } else {
        this.listeners.addAll(Arrays.asList(listeners));
      }
      return this;
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AmqpConsumerEnvironmentBuilder environmentBuilder() {
      return this.builder;
    }
  }
}
