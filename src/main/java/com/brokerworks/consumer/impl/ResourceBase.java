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
import static com.brokerworks.consumer.Resource.State.OPENING;

import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a consumer, with notification of the registered listeners.
 *
 * <p>Listeners are called on the thread that changes the state, in state-change order. A failing
 * listener is logged and does not prevent the other listeners from being called.
 */
abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final String idEndpoint;
  private final AtomicReference<State> state = new AtomicReference<>();
  private final List<StateListener> listeners;

  ResourceBase(String idEndpoint, List<StateListener> listeners) {
    this.idEndpoint = idEndpoint;
    this.listeners = List.copyOf(listeners);
    this.state(OPENING);
  }

  protected void checkNotClosed() {
    State s = this.state.get();
    if (s == CLOSING || s == CLOSED) {
      throw new ConsumerException.ResourceClosedException(
          "Consumer '" + this.idEndpoint + "' is closed");
    }
  }

  protected State state() {
    return this.state.get();
  }

  protected void state(State state) {
    this.state(state, null);
  }

  protected void state(State state, Throwable failureCause) {
    State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      LOGGER.debug("Consumer '{}' went from {} to {}", this.idEndpoint, previousState, state);
      if (!this.listeners.isEmpty()) {
        StateChange change = new StateChange(this, failureCause, previousState, state);
        for (StateListener listener : this.listeners) {
          try {
            listener.handle(change);
          } catch (Exception e) {
            LOGGER.warn("Error in state listener of consumer '{}'", this.idEndpoint, e);
          }
        }
      }
    }
  }

  private static final class StateChange implements Context {

    private final ResourceBase resource;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;

    private StateChange(
        ResourceBase resource, Throwable failureCause, State previousState, State currentState) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public String idEndpoint() {
      return this.resource.idEndpoint;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }

    @Override
    public String toString() {
      return "StateChange{"
          + "idEndpoint='"
          + this.resource.idEndpoint
          + '\''
          + ", "
          + this.previousState
          + " -> "
          + this.currentState
          + (this.failureCause == null ? "" : ", failureCause=" + this.failureCause)
          + '}';
    }
  }
}
