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

/** Routing semantics of the address a consumer subscribes to. */
public enum RoutingType {
  /** Point-to-point, each message goes to one consumer. */
  ANYCAST(0, "Anycast"),
  /** Publish-subscribe, each subscription gets a copy. */
  MULTICAST(1, "Multicast");

  private final int code;
  private final String label;

  RoutingType(int code, String label) {
    this.code = code;
    this.label = label;
  }

  public int code() {
    return this.code;
  }

  public String label() {
    return this.label;
  }

  /**
   * Resolve a routing type from its label (case-insensitive) or its numeric code.
   *
   * @param value label or code
   * @return the routing type
   * @throws IllegalArgumentException if the value matches no routing type
   */
  public static RoutingType from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Routing type cannot be null");
    }
    String trimmed = value.trim();
    for (RoutingType type : values()) {
      if (type.label.equalsIgnoreCase(trimmed)
          || type.name().equalsIgnoreCase(trimmed)
          || String.valueOf(type.code).equals(trimmed)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown routing type: " + value);
  }

  public static RoutingType from(int code) {
    for (RoutingType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown routing type code: " + code);
  }
}
