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

import java.util.List;

/**
 * Lists the products of the collections. Implementations are expected to be
 * thread safe.
 * 
 * @since 1.0
 */
public interface RecordRepository {

  /**
   * Lists the products of the collection whose span overlaps the window
   * extended by the tolerance, i.e. {@code begin < end + tolerance} and
   * {@code product end >= start - tolerance}, ordered by begin time.
   * @param collection The non-null collection identifier.
   * @param start The window start in milliseconds.
   * @param end The window end in milliseconds.
   * @param tolerance The non-negative tolerance in milliseconds.
   * @return A non-null, possibly empty list of products.
   */
  public List<Product> list(final String collection, 
                            final long start, 
                            final long end, 
                            final long tolerance);
  
  /**
   * Lists all products of the collection ordered by begin time.
   * @param collection The non-null collection identifier.
   * @return A non-null, possibly empty list of products.
   */
  public List<Product> listAll(final String collection);
  
  /**
   * @param collection The non-null collection identifier.
   * @return Any product of the collection or null if the collection is 
   * empty.
   */
  public Product sampleOne(final String collection);
  
}
