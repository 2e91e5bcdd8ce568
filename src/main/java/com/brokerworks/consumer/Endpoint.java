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

import java.util.Objects;

/**
 * Broker connection target: host, port and credentials.
 *
 * <p>Instances are immutable.
 */
public final class Endpoint {

  private final String host;
  private final int port;
  private final String user;
  private final String password;

  private Endpoint(String host, int port, String user, String password) {
    this.host = host;
    this.port = port;
    this.user = user;
    this.password = password;
  }

  /**
   * Create an endpoint.
   *
   * @param host host name or IP address
   * @param port port
   * @param user user name, can be null
   * @param password password, can be null
   * @return the endpoint
   */
  public static Endpoint create(String host, int port, String user, String password) {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Endpoint host cannot be blank");
    }
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("Endpoint port must be between 1 and 65535: " + port);
    }
    return new Endpoint(host, port, user, password);
  }

  public static Endpoint create(String host, int port) {
    return create(host, port, null, null);
  }

  public String host() {
    return this.host;
  }

  public int port() {
    return this.port;
  }

  public String user() {
    return this.user;
  }

  public String password() {
    return this.password;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Endpoint endpoint = (Endpoint) o;
    return port == endpoint.port
        && host.equals(endpoint.host)
        && Objects.equals(user, endpoint.user)
        && Objects.equals(password, endpoint.password);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, user, password);
  }

  @Override
  public String toString() {
    return "Endpoint{"
        + "host='"
        + host
        + '\''
        + ", port="
        + port
        + ", user='"
        + user
        + '\''
        + ", password="
        + (password == null ? "null" : "********")
        + '}';
  }
}
