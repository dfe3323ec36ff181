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
package net.satfusion.data;

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;

/**
 * Helpers for building {@link DatasetIterator}s.
 * 
 * @since 1.0
 */
public final class DatasetIterators {
  private DatasetIterators() {
    // statics
  }
  
  /**
   * @return An iterator without any chunk.
   */
  public static DatasetIterator empty() {
    return of(ImmutableList.<Dataset>of().iterator());
  }
  
  /**
   * @param datasets The datasets to yield.
   * @return An iterator yielding the given datasets in order.
   */
  public static DatasetIterator of(final Dataset... datasets) {
    return of(ImmutableList.copyOf(datasets).iterator());
  }
  
  /**
   * Wraps a plain iterator. Closing is a no-op.
   * @param iterator The non-null iterator to wrap.
   * @return The dataset iterator.
   */
  public static DatasetIterator of(final Iterator<Dataset> iterator) {
    if (iterator == null) {
      throw new IllegalArgumentException("Iterator cannot be null.");
    }
    return new DatasetIterator() {
      @Override
      public boolean hasNext() {
        return iterator.hasNext();
      }

      @Override
      public Dataset next() {
        if (!iterator.hasNext()) {
          throw new NoSuchElementException();
        }
        return iterator.next();
      }

      @Override
      public void close() {
        // no-op
      }
    };
  }
  
  /**
   * Drains the iterator appending every chunk to a single dataset and closes
   * it.
   * @param iterator The non-null iterator.
   * @return The concatenated dataset, empty if no chunk was yielded.
   */
  public static Dataset concat(final DatasetIterator iterator) {
    try {
      final Dataset dataset = new Dataset();
      while (iterator.hasNext()) {
        dataset.append(iterator.next());
      }
      return dataset;
    } finally {
      iterator.close();
    }
  }
}
