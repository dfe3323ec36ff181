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

import java.util.Iterator;
import java.util.List;

import net.satfusion.data.Record;
import net.satfusion.storage.Product;

/**
 * Enumerates the products to read for a time window as ordered, clipped and
 * non-overlapping half-open {@link Record}s.
 * 
 * @since 1.0
 */
public interface ProductSource {

  /** @return The identifier, the collection identifiers joined with '+'. */
  public String identifier();
  
  /** @return The collections in priority order. */
  public List<String> collections();
  
  /** @return The parameters of the product type. */
  public ProductTypeParameters parameters();
  
  /**
   * Lazily resolves the records overlapping the window extended by the 
   * tolerance.
   * @param start The window start in milliseconds.
   * @param end The window end in milliseconds.
   * @param tolerance The non-negative tolerance in milliseconds.
   * @return A non-null iterator over the records sorted by start time.
   */
  public Iterator<Record<Product>> iterRecords(final long start, 
                                               final long end, 
                                               final long tolerance);
  
  /**
   * @param start The window start in milliseconds.
   * @param end The window end in milliseconds.
   * @param tolerance The non-negative tolerance in milliseconds.
   * @return The number of records {@link #iterRecords(long, long, long)} 
   * would yield.
   */
  public int countRecords(final long start, 
                          final long end, 
                          final long tolerance);
  
  /**
   * @return The earliest product of the first non-empty collection or null
   * if all collections are empty. Used to type empty outputs.
   */
  public Product sampleRecord();
  
}
