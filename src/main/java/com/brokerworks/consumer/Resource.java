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
 * Marker interface for classes with a lifecycle.
 *
 * <p>A {@link SupervisedConsumer} goes through different states: opening, open, recovering after a
 * failure, closed. Applications can react to these states, e.g. to raise an alert when a consumer
 * keeps recovering.
 *
 * @see SupervisedConsumer
 */
public interface Resource {

  /**
   * Application listener for a {@link Resource}.
   *
   * <p>They are registered at creation time.
   *
   * @see com.brokerworks.consumer.impl.AmqpConsumerEnvironmentBuilder.ConsumerSettings#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Handle state change.
     *
     * @param context state change context
     */
    void handle(Context context);
  }

  /** Context of a resource state change. */
  interface Context {

    /**
     * The resource instance.
     *
     * @return resource instance
     */
    Resource resource();

    /**
     * The endpoint identifier of the consumer.
     *
     * @return endpoint identifier
     */
    String idEndpoint();

    /**
     * The failure cause, can be null.
     *
     * @return failure cause, null if no cause for failure
     */
    Throwable failureCause();

    /**
     * The previous state of the resource.
     *
     * @return previous state
     */
    State previousState();

    /**
     * The current (new) state of the resource.
     *
     * @return current state
     */
    State currentState();
  }

  /** Resource state. */
  enum State {
    /** The resource is created but not subscribed yet. */
    OPENING,
    /** The resource is subscribed and consuming. */
    OPEN,
    /** The resource failed and waits before retrying. */
    RECOVERING,
    /** The resource is closing. */
    CLOSING,
    /** The resource is closed. */
    CLOSED
  }
}
