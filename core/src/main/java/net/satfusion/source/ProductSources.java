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

import java.util.List;

import net.satfusion.storage.RecordRepository;

/**
 * Factory choosing the product source implementation for the number of 
 * collections.
 * 
 * @since 1.0
 */
public final class ProductSources {
  private ProductSources() {
    // statics
  }
  
  /**
   * @param repository A non-null repository.
   * @param collections A non-null and non-empty list of collections, the 
   * highest priority first.
   * @param parameters Optional product type parameters.
   * @return A single collection source for one collection, a multi 
   * collection source otherwise.
   * @throws IllegalArgumentException if the collections were invalid.
   */
  public static ProductSource newSource(
      final RecordRepository repository, 
      final List<String> collections, 
      final ProductTypeParameters parameters) {
    if (collections == null || collections.isEmpty()) {
      throw new IllegalArgumentException("Collections cannot be null or "
          + "empty.");
    }
    if (collections.size() == 1) {
      return new SingleCollectionProductSource(repository, 
          collections.get(0), parameters);
    }
    return new MultiCollectionProductSource(repository, collections, 
        parameters);
  }
}
