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
package com.brokerworks.consumer.config;

import com.brokerworks.consumer.ConsumerConfiguration;
import com.brokerworks.consumer.ConsumerException;
import com.brokerworks.consumer.RoutingType;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * {@link ConfigurationSource} reading a JSON document.
 *
 * <p>Consumer sections are under the root <code>Amqp</code> section, keyed by endpoint identifier:
 *
 * <pre>
 * {
 *   "Amqp": {
 *     "orders": {
 *       "Address": "orders", "Queue": "orders.q", "RetryTime": 2000,
 *       "Endpoints": [ { "Host": "localhost", "Port": 5672 } ]
 *     }
 *   }
 * }
 * </pre>
 *
 * Endpoint identifiers are matched case-insensitively. Missing keys take the defaults of {@link
 * ConsumerConfiguration}. <code>RoutingType</code> accepts <code>Anycast</code>, <code>Multicast
 * </code> or their numeric codes.
 */
public final class GsonConfigurationSource implements ConfigurationSource {

  public static final String ROOT_SECTION = "Amqp";

  private static final Gson GSON =
      new GsonBuilder()
          .setFieldNamingPolicy(FieldNamingPolicy.UPPER_CAMEL_CASE)
          .registerTypeAdapter(RoutingType.class, new RoutingTypeAdapter().nullSafe())
          .create();

  private final Map<String, JsonElement> sections;

  private GsonConfigurationSource(JsonObject document) {
    Map<String, JsonElement> s = new LinkedHashMap<>();
    JsonObject root = rootSection(document);
    if (root != null) {
      root.entrySet().forEach(e -> s.put(e.getKey(), e.getValue()));
    }
    this.sections = Collections.unmodifiableMap(s);
  }

  public static GsonConfigurationSource fromJson(String json) {
    return fromJson(new StringReader(json));
  }

  public static GsonConfigurationSource fromJson(Reader reader) {
    try {
      JsonElement document = JsonParser.parseReader(reader);
      if (!document.isJsonObject()) {
        throw new IllegalArgumentException(
            "Consumer configuration document must be a JSON object");
      }
      return new GsonConfigurationSource(document.getAsJsonObject());
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid consumer configuration document", e);
    }
  }

  public static GsonConfigurationSource fromPath(Path path) {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("Error while reading consumer configuration " + path, e);
    }
  }

  public static GsonConfigurationSource fromClasspath(String resource) {
    InputStream in = GsonConfigurationSource.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new IllegalArgumentException("Classpath resource not found: " + resource);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    } catch (IOException e) {
      throw new UncheckedIOException("Error while reading consumer configuration " + resource, e);
    }
  }

  /**
   * Section form of a configuration.
   *
   * @param configuration the configuration
   * @return JSON object of the section
   */
  public static String toSection(ConsumerConfiguration configuration) {
    return GSON.toJson(ConsumerSection.from(configuration));
  }

  /**
   * Document with a section for each configuration, keyed by endpoint identifier.
   *
   * @param configurations the configurations
   * @return the JSON document
   */
  public static String toJson(ConsumerConfiguration... configurations) {
    JsonObject consumers = new JsonObject();
    for (ConsumerConfiguration configuration : configurations) {
      consumers.add(
          configuration.idEndpoint(), GSON.toJsonTree(ConsumerSection.from(configuration)));
    }
    JsonObject document = new JsonObject();
    document.add(ROOT_SECTION, consumers);
    return GSON.toJson(document);
  }

  @Override
  public ConsumerConfiguration consumerConfiguration(String idEndpoint) {
    JsonElement section = this.section(idEndpoint);
    if (section == null || !section.isJsonObject()) {
      throw new ConsumerException.ConfigurationNotFoundException(idEndpoint);
    }
    try {
      ConsumerSection consumerSection = GSON.fromJson(section, ConsumerSection.class);
      return consumerSection.toConfiguration(idEndpoint);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(
          "Invalid configuration for consumer endpoint " + idEndpoint, e);
    }
  }

  @Override
  public Set<String> idEndpoints() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(this.sections.keySet()));
  }

  private JsonElement section(String idEndpoint) {
    if (idEndpoint == null) {
      return null;
    }
    JsonElement section = this.sections.get(idEndpoint);
    if (section == null) {
      for (Map.Entry<String, JsonElement> entry : this.sections.entrySet()) {
        if (entry.getKey().equalsIgnoreCase(idEndpoint)) {
          return entry.getValue();
        }
      }
    }
    return section;
  }

  private static JsonObject rootSection(JsonObject document) {
    for (Map.Entry<String, JsonElement> entry : document.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(ROOT_SECTION) && entry.getValue().isJsonObject()) {
        return entry.getValue().getAsJsonObject();
      }
    }
    return null;
  }

  private static final class RoutingTypeAdapter extends TypeAdapter<RoutingType> {

    @Override
    public void write(JsonWriter out, RoutingType value) throws IOException {
      out.value(value.label());
    }

    @Override
    public RoutingType read(JsonReader in) throws IOException {
      try {
        if (in.peek() == JsonToken.NUMBER) {
          return RoutingType.from(in.nextInt());
        } else {
          return RoutingType.from(in.nextString());
        }
      } catch (IllegalArgumentException e) {
        throw new JsonParseException(e.getMessage(), e);
      }
    }
  }
}
