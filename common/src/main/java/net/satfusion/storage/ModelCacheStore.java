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
package net.satfusion.storage;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.satfusion.data.Column;
import net.satfusion.query.ModelSource;

/**
 * Per product storage of precomputed model values. Each entry holds one 
 * column per model, row aligned with the product, and the sources each
 * model was evaluated from.
 * 
 * @since 1.0
 */
public interface ModelCacheStore {

  /**
   * @param collection The non-null collection identifier.
   * @param product The non-null product identifier.
   * @return The sources per cached model or null if the product has no 
   * cache entry.
   * @throws IOException if the entry could not be read.
   */
  public Map<String, List<ModelSource>> readProvenance(
      final String collection, final String product) throws IOException;
  
  /**
   * @param collection The non-null collection identifier.
   * @param product The non-null product identifier.
   * @param model The model name.
   * @return The cached column or null if not present.
   * @throws IOException if the entry could not be read.
   */
  public Column readColumn(final String collection, 
                           final String product, 
                           final String model) throws IOException;
  
  /**
   * Writes or replaces the column and sources of a model. The entry is 
   * replaced atomically.
   * @param collection The non-null collection identifier.
   * @param product The non-null product identifier.
   * @param model The model name.
   * @param column The non-null column.
   * @param sources The non-null sources.
   * @throws IOException if the entry could not be written.
   */
  public void write(final String collection, 
                    final String product, 
                    final String model, 
                    final Column column, 
                    final List<ModelSource> sources) throws IOException;
  
  /**
   * Removes the column and sources of a model.
   * @param collection The non-null collection identifier.
   * @param product The non-null product identifier.
   * @param model The model name.
   * @return True if the model was cached.
   * @throws IOException if the entry could not be written.
   */
  public boolean remove(final String collection, 
                        final String product, 
                        final String model) throws IOException;
  
  /**
   * Removes the whole entry of a product.
   * @param collection The non-null collection identifier.
   * @param product The non-null product identifier.
   * @return True if the entry existed.
   * @throws IOException if the entry could not be removed.
   */
  public boolean removeEntry(final String collection, 
                             final String product) throws IOException;
  
  /**
   * @param collection The non-null collection identifier.
   * @return The identifiers of the products with a cache entry.
   * @throws IOException if the entries could not be listed.
   */
  public Set<String> listEntries(final String collection) throws IOException;
  
}
