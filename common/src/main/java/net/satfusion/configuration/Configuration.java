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
package net.satfusion.configuration;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.satfusion.configuration.provider.EnvironmentProvider;
import net.satfusion.configuration.provider.MapProvider;
import net.satfusion.configuration.provider.PropertiesFileProvider;
import net.satfusion.configuration.provider.Provider;
import net.satfusion.configuration.provider.SystemPropertiesProvider;

/**
 * A key to value configuration flattened from an ordered list of 
 * {@link Provider}s. Providers later in the list override earlier ones and
 * runtime overrides added through {@link #addOverride(String, Object)} win
 * over every provider.
 * <p>
 * A key must be registered with a {@link ConfigurationEntrySchema} before
 * it can be read or overridden so that it has a type, a default and a 
 * description. Reading an unregistered key throws a 
 * {@link ConfigurationException}.
 * <p>
 * Values are converted to the schema type with Jackson so that strings from
 * properties files or the environment become numbers or booleans.
 * 
 * @since 1.0
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);
  
  /** Shared mapper used only for type conversion. */
  protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  
  /** The system property or environment key pointing to a properties file. */
  public static final String CONFIG_FILE_KEY = "satfusion.config.file";
  
  /** Registered schemas. */
  protected final Map<String, ConfigurationEntrySchema> schemas;
  
  /** Resolved values, absent when the default applies. May map to null. */
  protected final Map<String, Object> values;
  
  /** The ordered providers, least significant first. */
  protected final List<Provider> providers;
  
  /** Runtime overrides, the most significant provider. */
  protected final MapProvider overrides;
  
  /**
   * Default ctor loading an optional properties file named by 
   * {@link #CONFIG_FILE_KEY}, then the environment and the system 
   * properties.
   * @throws ConfigurationException if the properties file could not be
   * loaded.
   */
  public Configuration() {
    this(defaultProviders());
  }
  
  /**
   * Ctor with an explicit list of providers.
   * @param providers A non-null list of providers, least significant first.
   */
  public Configuration(final List<Provider> providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    schemas = Maps.newConcurrentMap();
    values = Collections.synchronizedMap(Maps.<String, Object>newHashMap());
    overrides = new MapProvider(MapProvider.RUNTIME_SOURCE);
    this.providers = Lists.newArrayList(providers);
    this.providers.add(overrides);
  }
  
  /**
   * Helper to register a schema builder. 
   * @param builder A non-null builder.
   */
  public void register(final ConfigurationEntrySchema.Builder builder) {
    if (builder == null) {
      throw new IllegalArgumentException("Builder cannot be null.");
    }
    register(builder.build());
  }
  
  /**
   * Registers the schema and pulls the current value from the providers, 
   * most significant first.
   * @param schema A non-null schema.
   * @throws ConfigurationException if the key was already registered.
   */
  public void register(final ConfigurationEntrySchema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    final ConfigurationEntrySchema extant = 
        schemas.putIfAbsent(schema.getKey(), schema);
    if (extant != null) {
      throw new ConfigurationException("Schema already exists for "
          + "key: " + schema.getKey());
    }
    for (int i = providers.size() - 1; i >= 0; i--) {
      final Object setting = providers.get(i).getSetting(schema.getKey());
      if (setting != null) {
        values.put(schema.getKey(), convert(schema, setting));
        if (LOG.isDebugEnabled()) {
          LOG.debug("Loaded key [{}] from {}", schema.getKey(), 
              providers.get(i).source());
        }
        break;
      }
    }
  }
  
  /**
   * Registers an integer schema.
   * @param key A non-null and non-empty key.
   * @param default_value The default value.
   * @param description A non-null and non-empty description.
   */
  public void register(final String key, 
                       final int default_value, 
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(int.class)
        .setDefaultValue(default_value)
        .notNullable()
        .setDescription(description));
  }
  
  /**
   * Registers a long schema.
   * @param key A non-null and non-empty key.
   * @param default_value The default value.
   * @param description A non-null and non-empty description.
   */
  public void register(final String key, 
                       final long default_value, 
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(long.class)
        .setDefaultValue(default_value)
        .notNullable()
        .setDescription(description));
  }
  
  /**
   * Registers a nullable string schema.
   * @param key A non-null and non-empty key.
   * @param default_value The default value, may be null.
   * @param description A non-null and non-empty description.
   */
  public void register(final String key, 
                       final String default_value, 
                       final String description) {
    register(ConfigurationEntrySchema.newBuilder()
        .setKey(key)
        .setType(String.class)
        .setDefaultValue(default_value)
        .isNullable()
        .setDescription(description));
  }
  
  /**
   * Overrides the value of a registered key at runtime.
   * @param key A non-null and non-empty registered key.
   * @param value The new value, converted to the schema type.
   * @throws ConfigurationException if the key was not registered or the 
   * value could not be converted.
   */
  public void addOverride(final String key, final Object value) {
    final ConfigurationEntrySchema schema = schema(key);
    if (value == null) {
      if (!schema.isNullable()) {
        throw new ConfigurationException("Key " + key 
            + " cannot be set to null.");
      }
      overrides.put(key, null);
      values.put(key, null);
      return;
    }
    final Object converted = convert(schema, value);
    overrides.put(key, value);
    values.put(key, converted);
  }
  
  /**
   * Returns the value converted to the given type.
   * @param key The non-null and non-empty registered key.
   * @param type A non-null class to convert to.
   * @return The value, may be null for nullable entries.
   * @throws ConfigurationException if the key was not registered or a
   * null was read as a primitive.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final Class<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    final ConfigurationEntrySchema schema = schema(key);
    final Object value = values.containsKey(key) 
        ? values.get(key) : schema.getDefaultValue();
    if (value == null) {
      if (type.isPrimitive()) {
        throw new ConfigurationException("Cannot cast null to a "
            + "primitive type: " + type);
      }
      return null;
    }
    if (value.getClass().equals(type)) {
      return (T) value;
    }
    try {
      return (T) OBJECT_MAPPER.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert the value of key " 
          + key + " to " + type, e);
    }
  }
  
  /**
   * @param key A non-null and non-empty registered key.
   * @return The value as a string, may be null.
   */
  public String getString(final String key) {
    return getTyped(key, String.class);
  }
  
  /**
   * @param key A non-null and non-empty registered key.
   * @return The value as an integer.
   */
  public int getInt(final String key) {
    return (int) getTyped(key, int.class);
  }
  
  /**
   * @param key A non-null and non-empty registered key.
   * @return The value as a long.
   */
  public long getLong(final String key) {
    return (long) getTyped(key, long.class);
  }
  
  /**
   * Only the values in the set [true, 1, yes] count as true, case 
   * insensitive. Nulls count as false.
   * @param key A non-null and non-empty registered key.
   * @return The value as a boolean.
   */
  public boolean getBoolean(final String key) {
    String bool = getTyped(key, String.class);
    if (Strings.isNullOrEmpty(bool)) {
      return false;
    }
    bool = bool.toLowerCase().trim();
    return bool.equals("true") || bool.equals("1") || bool.equals("yes");
  }
  
  /**
   * @param key A non-null and non-empty key.
   * @return True if the key was registered.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return schemas.containsKey(key);
  }
  
  /** @return The providers, least significant first. */
  public List<Provider> providers() {
    return ImmutableList.copyOf(providers);
  }
  
  @Override
  public void close() throws IOException {
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.warn("Failed to close provider " + provider.source(), e);
      }
    }
  }
  
  private ConfigurationEntrySchema schema(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntrySchema schema = schemas.get(key);
    if (schema == null) {
      throw new ConfigurationException("No registration found for key: " 
          + key);
    }
    return schema;
  }
  
  private static Object convert(final ConfigurationEntrySchema schema, 
                                final Object value) {
    try {
      return OBJECT_MAPPER.convertValue(value, 
          OBJECT_MAPPER.constructType(schema.getType()));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert value for key " 
          + schema.getKey() + " to " + schema.getType(), e);
    }
  }
  
  private static List<Provider> defaultProviders() {
    final List<Provider> providers = Lists.newArrayList();
    String file = System.getProperty(CONFIG_FILE_KEY);
    if (Strings.isNullOrEmpty(file)) {
      file = System.getenv(EnvironmentProvider.toEnvironmentKey(
          CONFIG_FILE_KEY));
    }
    if (!Strings.isNullOrEmpty(file)) {
      providers.add(new PropertiesFileProvider(file));
    }
    providers.add(new EnvironmentProvider());
    providers.add(new SystemPropertiesProvider());
    return providers;
  }
}
