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

import static com.brokerworks.consumer.impl.ExceptionUtils.convert;

import com.brokerworks.consumer.Message;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.qpid.protonj2.client.Delivery;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.apache.qpid.protonj2.types.Binary;

final class ProtonMessage implements Message {

  private static final byte[] EMPTY_BODY = new byte[0];

  private final Delivery delivery;
  private final org.apache.qpid.protonj2.client.Message<?> delegate;

  ProtonMessage(Delivery delivery, org.apache.qpid.protonj2.client.Message<?> delegate) {
    this.delivery = delivery;
    this.delegate = delegate;
  }

  Delivery delivery() {
    return this.delivery;
  }

  @Override
  public Object messageId() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::messageId);
  }

  @Override
  public Object correlationId() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::correlationId);
  }

  @Override
  public String subject() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::subject);
  }

  @Override
  public String contentType() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::contentType);
  }

  @Override
  public Object body() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::body);
  }

  @Override
  public byte[] bodyAsBinary() {
    Object body = this.body();
    if (body == null) {
      return EMPTY_BODY;
    } else if (body instanceof byte[]) {
      return (byte[]) body;
    } else if (body instanceof Binary) {
      return ((Binary) body).asByteArray();
    } else if (body instanceof String) {
      return ((String) body).getBytes(StandardCharsets.UTF_8);
    } else {
      throw new IllegalStateException(
          "Message body is not binary: " + body.getClass().getSimpleName());
    }
  }

  @Override
  public String bodyAsString() {
    Object body = this.body();
    if (body == null) {
      return null;
    } else if (body instanceof String) {
      return (String) body;
    } else if (body instanceof byte[]) {
      return new String((byte[]) body, StandardCharsets.UTF_8);
    } else if (body instanceof Binary) {
      return new String(((Binary) body).asByteArray(), StandardCharsets.UTF_8);
    } else {
      return String.valueOf(body);
    }
  }

  @Override
  public Object property(String key) {
    return returnFromDelegate(m -> m.property(key));
  }

  @Override
  public Map<String, Object> properties() {
    Map<String, Object> properties = new LinkedHashMap<>();
    returnFromDelegate(m -> m.forEachProperty(properties::put));
    return Collections.unmodifiableMap(properties);
  }

  @Override
  public boolean durable() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::durable);
  }

  @Override
  public byte priority() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::priority);
  }

  @Override
  public long deliveryCount() {
    return returnFromDelegate(org.apache.qpid.protonj2.client.Message::deliveryCount);
  }

  private <E> E returnFromDelegate(MessageFunctionCallable<E> call) {
    try {
      return call.call(this.delegate);
    } catch (ClientException e) {
      throw convert(e);
    }
  }

  @FunctionalInterface
  private interface MessageFunctionCallable<E> {

    E call(org.apache.qpid.protonj2.client.Message<?> message) throws ClientException;
  }

  @Override
  public String toString() {
    return "ProtonMessage{" + "messageId=" + this.messageId() + '}';
  }
}
