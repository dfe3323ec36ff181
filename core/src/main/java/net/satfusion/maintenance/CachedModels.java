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
package net.satfusion.maintenance;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.satfusion.query.CacheableModel;
import net.satfusion.query.ModelSource;
import net.satfusion.source.BaseProductSource;
import net.satfusion.storage.Product;

/**
 * Shared helpers comparing the cached provenance of a product with the 
 * sources the current models would use.
 * 
 * @since 1.0
 */
public final class CachedModels {

  private CachedModels() {
    // static helpers only
  }
  
  /**
   * @param product The non-null product.
   * @return The exclusive end of the span covered by the product.
   */
  public static long spanEnd(final Product product) {
    return product.getEnd() + BaseProductSource.TIME_PRECISION;
  }
  
  /**
   * @param model The non-null model.
   * @param product The non-null product.
   * @return The sources the model uses over the span of the product.
   */
  public static List<ModelSource> expectedSources(final CacheableModel model,
                                                  final Product product) {
    return model.sources(product.getBegin(), spanEnd(product));
  }
  
  /**
   * @param sources The sources, may be null.
   * @return The set of the source names.
   */
  public static Set<String> names(final Collection<ModelSource> sources) {
    final Set<String> names = Sets.newHashSet();
    if (sources != null) {
      for (final ModelSource source : sources) {
        names.add(source.getName());
      }
    }
    return names;
  }
  
  /**
   * Compares the cached sources overlapping the product span with the 
   * sources the model would use now.
   * @param model The non-null model.
   * @param product The non-null product.
   * @param cached The cached sources of the model, may be null.
   * @return True if the cached values are out of date.
   */
  public static boolean isObsolete(final CacheableModel model,
                                   final Product product, 
                                   final List<ModelSource> cached) {
    final Set<String> cached_names = Sets.newHashSet();
    if (cached != null) {
      for (final ModelSource source : cached) {
        if (source.intersects(product.getBegin(), spanEnd(product))) {
          cached_names.add(source.getName());
        }
      }
    }
    return !cached_names.equals(names(expectedSources(model, product)));
  }
  
  /**
   * @param models The non-null models.
   * @return The models keyed by name.
   * @throws IllegalArgumentException if two models share a name.
   */
  public static Map<String, CacheableModel> byName(
      final Collection<? extends CacheableModel> models) {
    final Map<String, CacheableModel> by_name = Maps.newLinkedHashMap();
    for (final CacheableModel model : models) {
      if (by_name.put(model.name(), model) != null) {
        throw new IllegalArgumentException("Duplicate cached model name: " 
            + model.name());
      }
    }
    return by_name;
  }
}
