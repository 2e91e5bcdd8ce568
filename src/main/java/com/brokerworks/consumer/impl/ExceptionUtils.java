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

import com.brokerworks.consumer.ConsumerException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import javax.net.ssl.SSLException;
import org.apache.qpid.protonj2.client.ErrorCondition;
import org.apache.qpid.protonj2.client.exceptions.ClientConnectionRemotelyClosedException;
import org.apache.qpid.protonj2.client.exceptions.ClientConnectionSecurityException;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.apache.qpid.protonj2.client.exceptions.ClientIOException;
import org.apache.qpid.protonj2.client.exceptions.ClientIllegalStateException;
import org.apache.qpid.protonj2.client.exceptions.ClientLinkRemotelyClosedException;
import org.apache.qpid.protonj2.client.exceptions.ClientResourceRemotelyClosedException;
import org.apache.qpid.protonj2.client.exceptions.ClientSessionRemotelyClosedException;

abstract class ExceptionUtils {

  static final String ERROR_UNAUTHORIZED_ACCESS = "amqp:unauthorized-access";
  static final String ERROR_NOT_FOUND = "amqp:not-found";
  static final String ERROR_RESOURCE_DELETED = "amqp:resource-deleted";
  static final String ERROR_INVALID_FIELD = "amqp:invalid-field";

  private ExceptionUtils() {}

  static <T> T wrapGet(Future<T> future) throws ClientException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      if (e.getCause() instanceof ClientException) {
        throw (ClientException) e.getCause();
      } else {
        throw convert(e);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConsumerException(e);
    }
  }

  static ConsumerException convert(Exception e) {
    if (e instanceof ConsumerException) {
      return (ConsumerException) e;
    } else if (e instanceof ClientException) {
      return convert((ClientException) e);
    } else if (e instanceof ExecutionException && e.getCause() instanceof ClientException) {
      return convert((ClientException) e.getCause());
    } else if (e instanceof ExecutionException && e.getCause() != null) {
      return new ConsumerException(e.getCause());
    } else {
      return new ConsumerException(e);
    }
  }

  static ConsumerException convert(ClientException e) {
    return convert(e, null);
  }

  static ConsumerException convert(ClientException e, String format, Object... args) {
    return convert(e, true, format, args);
  }

  /**
   * Convert a failure that happened while connecting.
   *
   * <p>Anything but a security failure is a connection failure.
   */
  static ConsumerException convertConnectionFailure(
      ClientException e, String format, Object... args) {
    ConsumerException result = convert(e, format, args);
    if (result instanceof ConsumerException.SecurityException
        || result instanceof ConsumerException.ConnectionException) {
      return result;
    } else {
      return new ConsumerException.ConnectionException(messageOf(result, e), e);
    }
  }

  /**
   * Convert a failure that happened while subscribing.
   *
   * <p>Security and connection failures keep their type, anything else is a subscription failure.
   */
  static ConsumerException convertSubscriptionFailure(
      ClientException e, String format, Object... args) {
    ConsumerException result = convert(e, format, args);
    if (result instanceof ConsumerException.SecurityException
        || result instanceof ConsumerException.ConnectionException
        || result instanceof ConsumerException.SubscriptionException) {
      return result;
    } else {
      return new ConsumerException.SubscriptionException(messageOf(result, e), e);
    }
  }

  private static ConsumerException convert(
      ClientException e, boolean checkCause, String format, Object... args) {
    String message = format != null ? String.format(format, args) : e.getMessage();
    ConsumerException result;
    if (e.getCause() instanceof SSLException) {
      result = new ConsumerException.SecurityException(message, e.getCause());
    } else if (e instanceof ClientConnectionSecurityException) {
      result = new ConsumerException.SecurityException(message, e);
    } else if (e instanceof ClientConnectionRemotelyClosedException) {
      ErrorCondition errorCondition =
          ((ClientConnectionRemotelyClosedException) e).getErrorCondition();
      if (isUnauthorizedAccess(errorCondition)) {
        result = new ConsumerException.SecurityException(message, e);
      } else {
        result = new ConsumerException.ConnectionException(message, e);
      }
    } else if (e instanceof ClientSessionRemotelyClosedException
        || e instanceof ClientLinkRemotelyClosedException) {
      ErrorCondition errorCondition =
          ((ClientResourceRemotelyClosedException) e).getErrorCondition();
      if (isUnauthorizedAccess(errorCondition)) {
        result = new ConsumerException.SecurityException(message, e);
      } else if (isNotFound(errorCondition)
          || isResourceDeleted(errorCondition)
          || isInvalidField(errorCondition)) {
        result = new ConsumerException.SubscriptionException(message, e);
      } else {
        result = new ConsumerException.ResourceClosedException(message, e);
      }
    } else if (e instanceof ClientIOException) {
      result = new ConsumerException.ConnectionException(message, e);
    } else if (e instanceof ClientIllegalStateException) {
      result = new ConsumerException.ResourceInvalidStateException(message, e);
    } else {
      result = new ConsumerException(message, e);
    }
    if (checkCause
        && (ConsumerException.class.equals(result.getClass())
            || ConsumerException.ResourceInvalidStateException.class.equals(result.getClass()))
        && e.getCause() instanceof ClientException) {
      // we end up with a generic exception, we try to narrow down with the cause
      result = convert((ClientException) e.getCause(), false, format, args);
    }
    return result;
  }

  private static String messageOf(ConsumerException result, ClientException e) {
    return result.getMessage() == null ? e.getMessage() : result.getMessage();
  }

  private static boolean isUnauthorizedAccess(ErrorCondition errorCondition) {
    return errorConditionEquals(errorCondition, ERROR_UNAUTHORIZED_ACCESS);
  }

  private static boolean isNotFound(ErrorCondition errorCondition) {
    return errorConditionEquals(errorCondition, ERROR_NOT_FOUND);
  }

  private static boolean isResourceDeleted(ErrorCondition errorCondition) {
    return errorConditionEquals(errorCondition, ERROR_RESOURCE_DELETED);
  }

  private static boolean isInvalidField(ErrorCondition errorCondition) {
    return errorConditionEquals(errorCondition, ERROR_INVALID_FIELD);
  }

  private static boolean errorConditionEquals(ErrorCondition errorCondition, String expected) {
    return errorCondition != null && expected.equals(errorCondition.condition());
  }
}
