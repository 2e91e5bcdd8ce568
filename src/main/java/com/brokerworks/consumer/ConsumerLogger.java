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

/**
 * Logger of the consumer lifecycle events, tagged with the correlation and endpoint identifiers.
 *
 * <p>Messages use the SLF4J <code>{}</code> placeholder syntax.
 *
 * @see com.brokerworks.consumer.impl.Slf4jConsumerLogger
 */
public interface ConsumerLogger {

  void trace(CorrelationContext context, String message, Object... args);

  void info(CorrelationContext context, String message, Object... args);

  void error(CorrelationContext context, Throwable error);

  /**
   * Log an error with a message.
   *
   * @param context correlation context
   * @param message the message
   * @param error the error
   */
  default void error(CorrelationContext context, String message, Throwable error) {
    this.error(context, error);
  }
}
