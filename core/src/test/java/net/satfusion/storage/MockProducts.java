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

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;

/**
 * Helpers populating the in-memory storage for tests. Products are sampled
 * every {@code step} milliseconds over {@code [begin, end]} with 
 * {@code F = t / 1000}.
 */
public final class MockProducts {
  
  public static final String TIME = "Timestamp";
  
  /** 2016-01-01T10:00:00Z */
  public static final long T0 = 1451642400000L;
  
  public static final long MINUTE = 60000L;

  private MockProducts() { }
  
  /**
   * Registers a product sampled every step.
   * @return The product.
   */
  public static Product add(final MemoryRecordRepository repository, 
                            final MemoryColumnReader reader, 
                            final String collection, 
                            final String identifier, 
                            final long begin, 
                            final long end, 
                            final long step) {
    final Product product = Product.newBuilder()
        .setIdentifier(identifier)
        .setCollection(collection)
        .setBegin(begin)
        .setEnd(end)
        .build();
    repository.add(product);
    reader.put(identifier, data(begin, end, step));
    return product;
  }
  
  /** @return The dataset sampled every step over [begin, end]. */
  public static Dataset data(final long begin, 
                             final long end, 
                             final long step) {
    final int count = (int) ((end - begin) / step) + 1;
    final long[] times = new long[count];
    final double[] values = new double[count];
    for (int i = 0; i < count; i++) {
      times[i] = begin + i * step;
      values[i] = times[i] / 1000.0;
    }
    return new Dataset()
        .set(TIME, Column.ofTimestamps(times))
        .set("F", Column.ofDoubles(values));
  }
}
