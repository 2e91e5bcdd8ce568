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
 * Base exception of the library.
 *
 * <p>Nested types describe the failures the supervising loop recovers from (connection,
 * subscription) and the setup failures it does not (configuration not found).
 */
public class ConsumerException extends RuntimeException {

  public ConsumerException(Throwable cause) {
    super(cause);
  }

  public ConsumerException(String format, Object... args) {
    super(String.format(format, args));
  }

  public ConsumerException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The broker is unreachable or refused the connection. */
  public static class ConnectionException extends ConsumerException {

    public ConnectionException(String message, Throwable cause) {
      super(message, cause);
    }

    public ConnectionException(String format, Object... args) {
      super(format, args);
    }
  }

  /** The broker refused the subscription (address, queue, routing type, filter). */
  public static class SubscriptionException extends ConsumerException {

    public SubscriptionException(String message, Throwable cause) {
      super(message, cause);
    }

    public SubscriptionException(String format, Object... args) {
      super(format, args);
    }
  }

  /** Authentication or authorization failure, or TLS problem. */
  public static class SecurityException extends ConsumerException {

    public SecurityException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class ResourceInvalidStateException extends ConsumerException {

    public ResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public ResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class ResourceClosedException extends ResourceInvalidStateException {

    public ResourceClosedException(String message) {
      super(message);
    }

    public ResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * No configuration section exists for a requested endpoint identifier.
   *
   * <p>Raised at registration time, it is never retried.
   */
  public static class ConfigurationNotFoundException extends ConsumerException {

    private final String idEndpoint;

    public ConfigurationNotFoundException(String idEndpoint) {
      super("Consumer configuration for endpoint %s not found.", idEndpoint);
      this.idEndpoint = idEndpoint;
    }

    public String idEndpoint() {
      return this.idEndpoint;
    }
  }
}
