// This file is part of SatFusion.
// Copyright (C) 2026  The SatFusion Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.satfusion.utils;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Static, shared Jackson mapper for YAML documents such as the product type
 * parameters. The mapper is thread safe once configured.
 * <p>
 * Parsing and mapping errors are thrown as {@link IllegalArgumentException}s
 * while I/O errors are wrapped in a {@link YAMLException}.
 * 
 * @since 1.0
 */
public final class YAML {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper MAPPER = 
      new ObjectMapper(new YAMLFactory());
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }

  private YAML() {
    // statics
  }
  
  /**
   * Deserializes a YAML formatted string to a specific class type.
   * @param yaml The non-null and non-empty string to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or 
   * parsing failed.
   * @param <T> The type of object to parse to.
   */
  public static final <T> T parseToObject(final String yaml,
                                          final Class<T> pojo) {
    if (yaml == null || yaml.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(yaml, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }
  
  /**
   * Deserializes a YAML formatted stream to a complex type.
   * @param stream The non-null stream to deserialize.
   * @param type A type definition for a complex object.
   * @return An object of the given type.
   * @throws IllegalArgumentException if the data or type was null or 
   * parsing failed.
   * @throws YAMLException if the stream could not be read.
   * @param <T> The type of object to parse to.
   */
  public static final <T> T parseToObject(final InputStream stream,
                                          final TypeReference<T> type) {
    if (stream == null) {
      throw new IllegalArgumentException("Incoming data was null");
    }
    if (type == null) {
      throw new IllegalArgumentException("Missing type reference");
    }
    try {
      return MAPPER.readValue(stream, type);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }
  
  /** @return The shared mapper. */
  public static final ObjectMapper getMapper() {
    return MAPPER;
  }
}
