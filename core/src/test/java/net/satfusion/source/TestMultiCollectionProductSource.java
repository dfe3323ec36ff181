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

import static net.satfusion.source.TestSingleCollectionProductSource.assertNoOverlap;
import static net.satfusion.source.TestSingleCollectionProductSource.collect;
import static net.satfusion.storage.MockProducts.MINUTE;
import static net.satfusion.storage.MockProducts.T0;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.satfusion.data.Record;
import net.satfusion.storage.MemoryRecordRepository;
import net.satfusion.storage.Product;

public class TestMultiCollectionProductSource {

  private MemoryRecordRepository repository;
  
  @Before
  public void before() throws Exception {
    repository = new MemoryRecordRepository();
  }
  
  @Test
  public void ctor() throws Exception {
    final MultiCollectionProductSource source = 
        new MultiCollectionProductSource(repository, 
            ImmutableList.of("A", "B"), null);
    assertEquals("A+B", source.identifier());
    assertEquals(ImmutableList.of("A", "B"), source.collections());
    
    try {
      new MultiCollectionProductSource(repository, 
          ImmutableList.of("A"), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new MultiCollectionProductSource(repository, 
          ImmutableList.of("A", "B", "A"), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new MultiCollectionProductSource(repository, 
          ImmutableList.<String>of(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    final List<String> too_many = Lists.newArrayList();
    for (int i = 0; i <= MultiCollectionProductSource.MAX_COLLECTIONS; i++) {
      too_many.add("C" + i);
    }
    try {
      new MultiCollectionProductSource(repository, too_many, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    // exactly the maximum is fine
    new MultiCollectionProductSource(repository, 
        too_many.subList(0, MultiCollectionProductSource.MAX_COLLECTIONS), 
        null);
  }
  
  @Test
  public void higherPriorityWinsOverlap() throws Exception {
    final Product a = product("A", "a1", T0, T0 + 10 * MINUTE);
    final Product b = product("B", "b1", T0 + 5 * MINUTE, T0 + 15 * MINUTE);
    final MultiCollectionProductSource source = source("A", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 15 * MINUTE, 0));
    assertEquals(2, records.size());
    assertEquals(new Record<Product>(0, T0, T0 + 10 * MINUTE, a), 
        records.get(0));
    assertEquals(new Record<Product>(1, T0 + 10 * MINUTE, T0 + 15 * MINUTE, 
        b), records.get(1));
  }
  
  @Test
  public void higherPriorityStartingLater() throws Exception {
    final Product b = product("B", "b1", T0, T0 + 30 * MINUTE);
    final Product a = product("A", "a1", T0 + 10 * MINUTE, T0 + 20 * MINUTE);
    final MultiCollectionProductSource source = source("A", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 30 * MINUTE, 0));
    assertEquals(3, records.size());
    assertEquals(new Record<Product>(1, T0, T0 + 10 * MINUTE, b), 
        records.get(0));
    assertEquals(new Record<Product>(0, T0 + 10 * MINUTE, T0 + 20 * MINUTE, 
        a), records.get(1));
    assertEquals(new Record<Product>(1, T0 + 20 * MINUTE, T0 + 30 * MINUTE, 
        b), records.get(2));
  }
  
  @Test
  public void equalStartGoesToHigherPriority() throws Exception {
    final Product a = product("A", "a1", T0, T0 + 5 * MINUTE);
    final Product b = product("B", "b1", T0, T0 + 10 * MINUTE);
    final MultiCollectionProductSource source = source("A", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 10 * MINUTE, 0));
    assertEquals(2, records.size());
    assertSame(a, records.get(0).payload());
    assertEquals(T0 + 5 * MINUTE, records.get(0).end());
    assertSame(b, records.get(1).payload());
    assertEquals(T0 + 5 * MINUTE, records.get(1).start());
  }
  
  @Test
  public void fullyCoveredLowerPriorityIsDiscarded() throws Exception {
    final Product a = product("A", "a1", T0, T0 + 10 * MINUTE);
    product("B", "b1", T0 + 2 * MINUTE, T0 + 4 * MINUTE);
    final MultiCollectionProductSource source = source("A", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 10 * MINUTE, 0));
    assertEquals(1, records.size());
    assertEquals(new Record<Product>(0, T0, T0 + 10 * MINUTE, a), 
        records.get(0));
  }
  
  @Test
  public void gapsFilledInPriorityOrder() throws Exception {
    final Product a = product("A", "a1", T0, T0 + 5 * MINUTE);
    final Product b = product("B", "b1", T0 + 10 * MINUTE, T0 + 15 * MINUTE);
    final Product c = product("C", "c1", T0, T0 + 20 * MINUTE);
    final MultiCollectionProductSource source = source("A", "B", "C");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 20 * MINUTE, 0));
    assertEquals(ImmutableList.of(
        new Record<Product>(0, T0, T0 + 5 * MINUTE, a),
        new Record<Product>(2, T0 + 5 * MINUTE, T0 + 10 * MINUTE, c),
        new Record<Product>(1, T0 + 10 * MINUTE, T0 + 15 * MINUTE, b),
        new Record<Product>(2, T0 + 15 * MINUTE, T0 + 20 * MINUTE, c)), 
        records);
    assertCovers(records, T0, T0 + 20 * MINUTE);
  }
  
  @Test
  public void gapsBetweenAllCollectionsRemain() throws Exception {
    product("A", "a1", T0, T0 + 5 * MINUTE);
    product("B", "b1", T0 + 10 * MINUTE, T0 + 15 * MINUTE);
    final MultiCollectionProductSource source = source("A", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 20 * MINUTE, 0));
    assertEquals(2, records.size());
    assertEquals(T0 + 5 * MINUTE, records.get(0).end());
    assertEquals(T0 + 10 * MINUTE, records.get(1).start());
  }
  
  @Test
  public void manyProductsPerCollection() throws Exception {
    // A is split in 10 minute products with a hole, B in 7 minute ones
    for (int i = 0; i < 6; i++) {
      if (i == 3) {
        continue;
      }
      product("A", "a" + i, T0 + i * 10 * MINUTE, T0 + (i + 1) * 10 * MINUTE);
    }
    for (int i = 0; i < 8; i++) {
      product("B", "b" + i, T0 + i * 7 * MINUTE, T0 + (i + 1) * 7 * MINUTE);
    }
    final MultiCollectionProductSource source = source("A", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 60 * MINUTE, 0));
    assertNoOverlap(records);
    assertCovers(records, T0, T0 + 60 * MINUTE);
    for (final Record<Product> record : records) {
      final boolean in_hole = record.start() >= T0 + 30 * MINUTE 
          && record.end() <= T0 + 40 * MINUTE;
      assertEquals(record.toString(), in_hole ? 1 : 0, record.index());
      assertTrue(record.start() >= record.payload().getBegin());
      assertTrue(record.end() <= record.payload().getEnd() 
          + BaseProductSource.TIME_PRECISION);
    }
  }
  
  @Test
  public void midPriorityStartingInsideClippedRecord() throws Exception {
    final Product a = product("A", "a1", T0, T0 + 10 * MINUTE);
    final Product b = product("B", "b1", T0 + 2 * MINUTE, T0 + 20 * MINUTE);
    final Product c = product("C", "c1", T0 + 5 * MINUTE, T0 + 15 * MINUTE);
    final MultiCollectionProductSource source = source("A", "C", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 20 * MINUTE, 0));
    assertEquals(ImmutableList.of(
        new Record<Product>(0, T0, T0 + 10 * MINUTE, a),
        new Record<Product>(1, T0 + 10 * MINUTE, T0 + 15 * MINUTE, c),
        new Record<Product>(2, T0 + 15 * MINUTE, T0 + 20 * MINUTE, b)), 
        records);
  }
  
  @Test
  public void laterRecordSupersedesOwnCollection() throws Exception {
    final Product a1 = product("A", "a1", T0, T0 + 10 * MINUTE);
    final Product a2 = product("A", "a2", T0 + 5 * MINUTE, T0 + 20 * MINUTE);
    final Product b = product("B", "b1", T0, T0 + 30 * MINUTE);
    final MultiCollectionProductSource source = source("A", "B");
    
    final List<Record<Product>> records = 
        collect(source.iterRecords(T0, T0 + 30 * MINUTE, 0));
    assertEquals(ImmutableList.of(
        new Record<Product>(0, T0, T0 + 5 * MINUTE, a1),
        new Record<Product>(0, T0 + 5 * MINUTE, T0 + 20 * MINUTE, a2),
        new Record<Product>(1, T0 + 20 * MINUTE, T0 + 30 * MINUTE, b)), 
        records);
  }
  
  @Test
  public void randomLayouts() throws Exception {
    final int horizon = 120;
    for (int seed = 0; seed < 200; seed++) {
      final Random random = new Random(seed);
      repository = new MemoryRecordRepository();
      final List<String> names = Lists.newArrayList("A", "B", "C", "D", "E");
      Collections.shuffle(names, random);
      final int count = 3 + random.nextInt(3);
      final List<String> collections = names.subList(0, count);
      
      // owner[m] is the highest priority collection covering minute m
      final int[] owner = new int[horizon];
      Arrays.fill(owner, -1);
      for (int c = 0; c < count; c++) {
        int minute = 0;
        int serial = 0;
        while (true) {
          final int begin = minute + random.nextInt(15);
          if (begin >= horizon) {
            break;
          }
          final int end = Math.min(begin + 1 + random.nextInt(30), horizon);
          product(collections.get(c), collections.get(c) + serial++, 
              T0 + begin * MINUTE, T0 + end * MINUTE);
          for (int m = begin; m < end; m++) {
            if (owner[m] < 0) {
              owner[m] = c;
            }
          }
          minute = end;
        }
      }
      
      final List<Record<Product>> records = collect(source(
          collections.toArray(new String[count]))
            .iterRecords(T0, T0 + horizon * MINUTE, 0));
      final String message = "Seed " + seed + ": " + records;
      for (final Record<Product> record : records) {
        assertTrue(message, record.start() < record.end());
      }
      assertNoOverlap(records);
      
      for (int m = 0; m < horizon; m++) {
        final long instant = T0 + m * MINUTE + MINUTE / 2;
        Record<Product> covering = null;
        for (final Record<Product> record : records) {
          if (record.start() <= instant && instant < record.end()) {
            covering = record;
            break;
          }
        }
        if (owner[m] < 0) {
          assertNull(message + " minute " + m, covering);
          continue;
        }
        assertNotNull(message + " minute " + m, covering);
        assertEquals(message + " minute " + m, owner[m], covering.index());
        assertEquals(collections.get(owner[m]), 
            covering.payload().getCollection());
        assertTrue(covering.payload().getBegin() <= instant);
        assertTrue(covering.payload().getEnd() >= instant);
      }
    }
  }
  
  @Test
  public void sampleRecord() throws Exception {
    final MultiCollectionProductSource source = source("A", "B");
    assertEquals(null, source.sampleRecord());
    final Product b = product("B", "b1", T0, T0 + MINUTE);
    assertSame(b, source.sampleRecord());
    final Product a = product("A", "a1", T0 + MINUTE, T0 + 2 * MINUTE);
    assertSame(a, source.sampleRecord());
  }
  
  private MultiCollectionProductSource source(final String... collections) {
    return new MultiCollectionProductSource(repository, 
        ImmutableList.copyOf(collections), null);
  }
  
  private Product product(final String collection, 
                          final String identifier, 
                          final long begin, 
                          final long end) {
    final Product product = Product.newBuilder()
        .setCollection(collection)
        .setIdentifier(identifier)
        .setBegin(begin)
        .setEnd(end - BaseProductSource.TIME_PRECISION)
        .build();
    repository.add(product);
    return product;
  }
  
  /** The records must tile the window without holes. */
  private static void assertCovers(final List<Record<Product>> records, 
                                   final long start, 
                                   final long end) {
    assertEquals(start, records.get(0).start());
    for (int i = 1; i < records.size(); i++) {
      assertEquals(records.get(i - 1).end(), records.get(i).start());
    }
    assertEquals(end, records.get(records.size() - 1).end());
  }
}
