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

import com.brokerworks.consumer.ConsumerLogger;
import com.brokerworks.consumer.CorrelationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * {@link ConsumerLogger} writing to SLF4J.
 *
 * <p>Lines are prefixed with the correlation ID and the endpoint identifier. Both values are also
 * in the {@link MDC} during the call, under the {@link #MDC_CORRELATION_ID} and {@link
 * #MDC_ID_ENDPOINT} keys.
 */
public class Slf4jConsumerLogger implements ConsumerLogger {

  public static final String MDC_CORRELATION_ID = "correlationId";
  public static final String MDC_ID_ENDPOINT = "idEndpoint";

  private final Logger logger;

  public Slf4jConsumerLogger() {
    this(LoggerFactory.getLogger(Slf4jConsumerLogger.class));
  }

  public Slf4jConsumerLogger(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void trace(CorrelationContext context, String message, Object... args) {
    if (this.logger.isTraceEnabled()) {
      try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_CORRELATION_ID, id(context));
          MDC.MDCCloseable ignored2 = MDC.putCloseable(MDC_ID_ENDPOINT, endpoint(context))) {
        this.logger.trace(prefix(context) + message, args);
      }
    }
  }

  @Override
  public void info(CorrelationContext context, String message, Object... args) {
    if (this.logger.isInfoEnabled()) {
      try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_CORRELATION_ID, id(context));
          MDC.MDCCloseable ignored2 = MDC.putCloseable(MDC_ID_ENDPOINT, endpoint(context))) {
        this.logger.info(prefix(context) + message, args);
      }
    }
  }

  @Override
  public void error(CorrelationContext context, Throwable error) {
    this.error(context, String.valueOf(error), error);
  }

  @Override
  public void error(CorrelationContext context, String message, Throwable error) {
    if (this.logger.isErrorEnabled()) {
      try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_CORRELATION_ID, id(context));
          MDC.MDCCloseable ignored2 = MDC.putCloseable(MDC_ID_ENDPOINT, endpoint(context))) {
        this.logger.error(prefix(context) + message, error);
      }
    }
  }

  static String prefix(CorrelationContext context) {
    return "CorrelationId: " + id(context) + " | Endpoint: " + endpoint(context) + " | Message: ";
  }

  private static String id(CorrelationContext context) {
    return context == null ? "" : context.correlationId();
  }

  private static String endpoint(CorrelationContext context) {
    return context == null ? "" : context.idEndpoint();
  }
}
