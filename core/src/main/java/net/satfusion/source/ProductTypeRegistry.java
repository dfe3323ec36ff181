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
package net.satfusion.source;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import net.satfusion.configuration.Configuration;
import net.satfusion.utils.YAML;
import net.satfusion.utils.YAMLException;

/**
 * Holds the {@link ProductTypeParameters} per product type as read from a
 * YAML document mapping the product type identifier to its parameters. 
 * Types missing from the document use {@link ProductTypeParameters#DEFAULT}.
 * 
 * @since 1.0
 */
public class ProductTypeRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(
      ProductTypeRegistry.class);
  
  /** The configuration key of an optional external YAML file. */
  public static final String FILE_KEY = "satfusion.product.types.file";
  
  /** The class path resource loaded when no file is configured. */
  public static final String DEFAULT_RESOURCE = "product-types.yaml";
  
  private static final TypeReference<Map<String, ProductTypeParameters>> 
      TYPE_REF = new TypeReference<Map<String, ProductTypeParameters>>() { };
  
  /** The parameters keyed by product type. */
  private final Map<String, ProductTypeParameters> parameters;
  
  /**
   * Default ctor.
   * @param parameters A non-null map of product type to parameters.
   */
  public ProductTypeRegistry(
      final Map<String, ProductTypeParameters> parameters) {
    if (parameters == null) {
      throw new IllegalArgumentException("Parameters cannot be null.");
    }
    this.parameters = ImmutableMap.copyOf(parameters);
  }
  
  /**
   * @param product_type A product type identifier.
   * @return The parameters of the type or the defaults if not registered.
   */
  public ProductTypeParameters get(final String product_type) {
    final ProductTypeParameters params = parameters.get(product_type);
    return params == null ? ProductTypeParameters.DEFAULT : params;
  }
  
  /**
   * @param product_type A product type identifier.
   * @return True if the type has explicit parameters.
   */
  public boolean contains(final String product_type) {
    return parameters.containsKey(product_type);
  }
  
  /** @return An unmodifiable view of the registered parameters. */
  public Map<String, ProductTypeParameters> parameters() {
    return parameters;
  }
  
  /**
   * Parses the registry from a YAML stream. The stream is not closed.
   * @param stream A non-null stream.
   * @return The registry.
   * @throws IllegalArgumentException if the document could not be parsed.
   */
  public static ProductTypeRegistry parse(final InputStream stream) {
    final Map<String, ProductTypeParameters> parsed = 
        YAML.parseToObject(stream, TYPE_REF);
    return new ProductTypeRegistry(parsed == null 
        ? Collections.<String, ProductTypeParameters>emptyMap() : parsed);
  }
  
  /**
   * Registers the file key if needed and loads the configured file or, when
   * not set, the bundled {@link #DEFAULT_RESOURCE}.
   * @param config A non-null configuration.
   * @return The registry.
   * @throws YAMLException if the file could not be read.
   */
  public static ProductTypeRegistry fromConfiguration(
      final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Configuration cannot be null.");
    }
    if (!config.hasProperty(FILE_KEY)) {
      config.register(FILE_KEY, (String) null, 
          "The path to a YAML file with the product type parameters. When "
          + "null the bundled " + DEFAULT_RESOURCE + " is used.");
    }
    final String file = config.getString(FILE_KEY);
    if (Strings.isNullOrEmpty(file)) {
      return fromResource(DEFAULT_RESOURCE);
    }
    LOG.info("Loading product type parameters from file: {}", file);
    try (final InputStream stream = new FileInputStream(file)) {
      return parse(stream);
    } catch (IOException e) {
      throw new YAMLException("Unable to read the product type file: " 
          + file, e);
    }
  }
  
  /**
   * Loads the registry from a class path resource.
   * @param resource The non-null resource name.
   * @return The registry.
   * @throws YAMLException if the resource was missing or unreadable.
   */
  public static ProductTypeRegistry fromResource(final String resource) {
    final InputStream stream = ProductTypeRegistry.class.getClassLoader()
        .getResourceAsStream(resource);
    if (stream == null) {
      throw new YAMLException("No such resource: " + resource);
    }
    try {
      final ProductTypeRegistry registry = parse(stream);
      LOG.debug("Loaded {} product types from resource {}", 
          registry.parameters.size(), resource);
      return registry;
    } finally {
      try {
        stream.close();
      } catch (IOException e) {
        LOG.warn("Failed to close resource " + resource, e);
      }
    }
  }
  
}
