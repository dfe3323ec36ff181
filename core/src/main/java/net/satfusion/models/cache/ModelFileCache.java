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
package net.satfusion.models.cache;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.satfusion.configuration.Configuration;

/**
 * An explicitly constructed cache of loaded models keyed by model id. 
 * Loading a model is slow so the loaded instances are kept and only 
 * reloaded when the modification time of one of their source files 
 * changes. 
 * <p>
 * The change detection happens on every {@link #get(String)} and for all
 * entries at once on {@link #invalidateIfChanged()}.
 * <p>
 * The cache is thread safe. Concurrent loads of the same model may both 
 * hit the loader, the last one wins.
 * 
 * @param <M> The type of the cached models.
 * 
 * @since 1.0
 */
public class ModelFileCache<M> {
  private static final Logger LOG = LoggerFactory.getLogger(
      ModelFileCache.class);
  
  /** The configuration key of the maximum number of cached models. */
  public static final String MAX_OBJECTS_KEY = 
      "satfusion.models.cache.max_objects";
  
  /** Default number of cached models. */
  public static final int DEFAULT_MAX_OBJECTS = 64;
  
  /** The loader. */
  private final ModelLoader<M> loader;
  
  /** Model id aliases. */
  private final Map<String, String> aliases;
  
  /** The Guava cache implementation. */
  private final Cache<String, CachedModel<M>> cache;
  
  /**
   * Ctor with the default size.
   * @param loader A non-null loader.
   */
  public ModelFileCache(final ModelLoader<M> loader) {
    this(loader, null, DEFAULT_MAX_OBJECTS);
  }
  
  /**
   * Default ctor.
   * @param loader A non-null loader.
   * @param aliases Optional map of alias to model id.
   * @param max_objects The maximum number of cached models, at least 1.
   */
  public ModelFileCache(final ModelLoader<M> loader, 
                        final Map<String, String> aliases, 
                        final int max_objects) {
    if (loader == null) {
      throw new IllegalArgumentException("Loader cannot be null.");
    }
    if (max_objects < 1) {
      throw new IllegalArgumentException("Max objects must be at least 1.");
    }
    this.loader = loader;
    this.aliases = aliases == null ? ImmutableMap.<String, String>of() 
        : ImmutableMap.copyOf(aliases);
    cache = CacheBuilder.newBuilder()
        .maximumSize(max_objects)
        .recordStats()
        .build();
  }
  
  /**
   * Builds a cache sized from the configuration, registering the key if 
   * needed.
   * @param loader A non-null loader.
   * @param aliases Optional aliases.
   * @param config A non-null configuration.
   * @return The cache.
   */
  public static <M> ModelFileCache<M> fromConfiguration(
      final ModelLoader<M> loader, 
      final Map<String, String> aliases, 
      final Configuration config) {
    if (!config.hasProperty(MAX_OBJECTS_KEY)) {
      config.register(MAX_OBJECTS_KEY, DEFAULT_MAX_OBJECTS, 
          "The maximum number of loaded models kept in memory.");
    }
    return new ModelFileCache<M>(loader, aliases, 
        config.getInt(MAX_OBJECTS_KEY));
  }
  
  /**
   * Returns the cached model, loading it if absent or if a source file 
   * changed.
   * @param model_id A model id or alias.
   * @return The model or null if the id is not known to the loader.
   * @throws ModelLoadException if the model failed to load.
   */
  public M get(final String model_id) {
    if (model_id == null || model_id.isEmpty()) {
      throw new IllegalArgumentException("Model ID cannot be null or "
          + "empty.");
    }
    final String resolved = aliases.containsKey(model_id) 
        ? aliases.get(model_id) : model_id;
    if (!loader.canLoad(resolved)) {
      return null;
    }
    final CachedModel<M> cached = cache.getIfPresent(resolved);
    if (cached != null && !cached.changed()) {
      return cached.model;
    }
    
    final Map<File, Long> modified = modificationTimes(resolved);
    final M model;
    try {
      model = loader.load(resolved);
    } catch (IOException | RuntimeException e) {
      LOG.error("Error occurred while loading model " + (resolved.equals(
          model_id) ? resolved : model_id + "(" + resolved + ")"), e);
      throw new ModelLoadException("Failed to load model " + model_id, e);
    }
    if (model == null) {
      throw new ModelLoadException("Loader returned a null model for " 
          + resolved, null);
    }
    cache.put(resolved, new CachedModel<M>(model, modified));
    LOG.info("{} model loaded", resolved);
    return model;
  }
  
  /**
   * Evicts every model whose source files changed since it was loaded.
   * @return The number of evicted models.
   */
  public int invalidateIfChanged() {
    int evicted = 0;
    for (final Entry<String, CachedModel<M>> entry : 
        cache.asMap().entrySet()) {
      if (entry.getValue().changed()) {
        cache.invalidate(entry.getKey());
        LOG.info("{} model sources changed, evicted", entry.getKey());
        evicted++;
      }
    }
    return evicted;
  }
  
  /** Evicts all models. */
  public void flush() {
    cache.invalidateAll();
  }
  
  /** @return The number of cached models. */
  public long size() {
    return cache.size();
  }
  
  /** @return The Guava cache statistics. */
  public CacheStats stats() {
    return cache.stats();
  }
  
  private Map<File, Long> modificationTimes(final String model_id) {
    final Map<File, Long> modified = Maps.newHashMap();
    for (final File file : loader.sourceFiles(model_id)) {
      modified.put(file, file.lastModified());
    }
    return modified;
  }
  
  /** A model and the modification times of its sources at load time. */
  @VisibleForTesting
  static class CachedModel<M> {
    final M model;
    final Map<File, Long> modified;
    
    CachedModel(final M model, final Map<File, Long> modified) {
      this.model = model;
      this.modified = modified;
    }
    
    /** @return True if a source file was modified or removed. */
    boolean changed() {
      for (final Entry<File, Long> entry : modified.entrySet()) {
        if (entry.getKey().lastModified() != entry.getValue()) {
          return true;
        }
      }
      return false;
    }
  }
}
