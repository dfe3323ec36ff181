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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;

import net.satfusion.data.Record;
import net.satfusion.storage.Product;
import net.satfusion.storage.RecordRepository;

/**
 * Product source of a single collection. Within a collection a later 
 * product supersedes an earlier one so when two consecutive products 
 * overlap, the earlier one is clipped to end where the later one starts.
 * 
 * @since 1.0
 */
public class SingleCollectionProductSource extends BaseProductSource {

  /**
   * Default ctor.
   * @param repository A non-null repository.
   * @param collection A non-null and non-empty collection.
   * @param parameters Optional parameters, the defaults when null.
   */
  public SingleCollectionProductSource(final RecordRepository repository, 
                                       final String collection,
                                       final ProductTypeParameters parameters) {
    super(repository, ImmutableList.of(collection), parameters);
  }

  @Override
  public Iterator<Record<Product>> iterRecords(final long start, 
                                               final long end, 
                                               final long tolerance) {
    final List<Product> products = repository.list(collections.get(0), 
        start, end, tolerance);
    final Iterator<Product> iterator = products.iterator();
    return new AbstractIterator<Record<Product>>() {
      private Record<Product> last = iterator.hasNext() 
          ? toRecord(0, iterator.next()) : null;

      @Override
      protected Record<Product> computeNext() {
        while (last != null) {
          Record<Product> result = last;
          if (iterator.hasNext()) {
            final Record<Product> record = toRecord(0, iterator.next());
            if (result.end() > record.start()) {
              result = result.withEnd(Math.max(result.start(), 
                  record.start()));
            }
            last = record;
          } else {
            last = null;
          }
          if (!result.isEmpty()) {
            return result;
          }
        }
        return endOfData();
      }
    };
  }
  
}
