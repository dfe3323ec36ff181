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
package net.satfusion.timeseries;

import static net.satfusion.storage.MockProducts.MINUTE;
import static net.satfusion.storage.MockProducts.T0;
import static net.satfusion.storage.MockProducts.TIME;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterators;
import net.satfusion.exceptions.IllegalDataException;
import net.satfusion.models.MockCacheableModel;
import net.satfusion.query.ModelSource;
import net.satfusion.source.SingleCollectionProductSource;
import net.satfusion.storage.MemoryColumnReader;
import net.satfusion.storage.MemoryModelCacheStore;
import net.satfusion.storage.MemoryRecordRepository;
import net.satfusion.storage.MockProducts;

public class TestCachedModelExtraction {
  private static final long SECOND = 1000;
  private static final long DAY = 24 * 60 * MINUTE;
  private static final ModelSource V0 = 
      new ModelSource("CHAOS_v0", T0 - 2 * DAY, T0 - DAY);
  private static final ModelSource V1 = 
      new ModelSource("CHAOS_v1", T0 - DAY, T0 + DAY);
  private static final ModelSource V2 = 
      new ModelSource("CHAOS_v2", T0 - DAY, T0 + DAY);
  
  private MemoryRecordRepository repository;
  private MemoryColumnReader reader;
  private MemoryModelCacheStore store;
  private MockCacheableModel model;
  private CachedModelExtraction extraction;
  private String variable;
  private ListAppender<ILoggingEvent> appender;
  
  @Before
  public void before() throws Exception {
    repository = new MemoryRecordRepository();
    reader = new MemoryColumnReader();
    store = new MemoryModelCacheStore();
    MockProducts.add(repository, reader, "MAG", "p1", 
        T0, T0 + 10 * MINUTE - SECOND, SECOND);
    MockProducts.add(repository, reader, "MAG", "p2", 
        T0 + 10 * MINUTE, T0 + 20 * MINUTE - SECOND, SECOND);
    model = new MockCacheableModel("CHAOS", TIME, V1);
    // p1 is cached, p2 is not
    store.write("MAG", "p1", "CHAOS", 
        cachedColumn(T0, 600), ImmutableList.of(V0, V1));
    extraction = new CachedModelExtraction(
        new SingleCollectionProductSource(repository, "MAG", null), 
        reader, store, ImmutableList.of(model), null);
    variable = CachedModelExtraction.cacheVariable(model);
    
    appender = new ListAppender<ILoggingEvent>();
    appender.start();
    ((Logger) LoggerFactory.getLogger(CachedModelExtraction.class))
        .addAppender(appender);
  }
  
  @After
  public void after() throws Exception {
    ((Logger) LoggerFactory.getLogger(CachedModelExtraction.class))
        .detachAppender(appender);
  }
  
  @Test
  public void ctor() throws Exception {
    assertEquals("__cached__B_CHAOS", variable);
    assertEquals(ImmutableList.of(variable), extraction.variables());
    assertEquals(ImmutableList.of(TIME), extraction.requiredVariables());
    assertEquals("MAG:cached", extraction.id());
    
    try {
      new CachedModelExtraction(new SingleCollectionProductSource(
          repository, "MAG", null), reader, store, 
          ImmutableList.<MockCacheableModel>of(), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new CachedModelExtraction(new SingleCollectionProductSource(
          repository, "MAG", null), reader, null, 
          ImmutableList.of(model), null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void subsetTrustedAndMissing() throws Exception {
    final List<Dataset> chunks = Lists.newArrayList(extraction.subset(
        T0 + 5 * MINUTE, T0 + 15 * MINUTE, ImmutableList.of(TIME, variable)));
    assertEquals(2, chunks.size());
    
    final Dataset cached = chunks.get(0);
    assertEquals(ImmutableList.of(TIME, variable), cached.variables());
    assertEquals(300, cached.length());
    final long[] times = cached.get(TIME).longs();
    final double[] values = cached.get(variable).doubles();
    for (int i = 0; i < times.length; i++) {
      assertArrayEquals(MockCacheableModel.expected(times[i]), 
          new double[] { values[3 * i], values[3 * i + 1], values[3 * i + 2] },
          0.0);
    }
    
    final Dataset missing = chunks.get(1);
    assertEquals(300, missing.length());
    assertEquals(3, missing.get(variable).width());
    for (final double value : missing.get(variable).doubles()) {
      assertTrue(Double.isNaN(value));
    }
    
    assertTrue(extraction.products().contains("p1"));
    assertTrue(extraction.products().contains("p2"));
    assertTrue(extraction.products().contains("CHAOS_v1"));
    assertFalse(extraction.products().contains("CHAOS_v0"));
    assertTrue(appender.list.isEmpty());
  }
  
  @Test
  public void subsetObsoleteIsDiscarded() throws Exception {
    model.setSources(V2);
    final Dataset dataset = DatasetIterators.concat(extraction.subset(
        T0, T0 + MINUTE, ImmutableList.of(TIME, variable)));
    assertEquals(60, dataset.length());
    for (final double value : dataset.get(variable).doubles()) {
      assertTrue(Double.isNaN(value));
    }
    
    assertEquals(1, appender.list.size());
    assertEquals(Level.WARN, appender.list.get(0).getLevel());
    assertTrue(appender.list.get(0).getFormattedMessage().contains("CHAOS"));
  }
  
  @Test
  public void subsetCachedVariableOnly() throws Exception {
    final Dataset dataset = DatasetIterators.concat(extraction.subset(
        T0 + 10 * MINUTE, T0 + 11 * MINUTE, ImmutableList.of(variable)));
    assertEquals(ImmutableList.of(variable), dataset.variables());
    assertEquals(60, dataset.length());
  }
  
  @Test
  public void subsetOutsideDataYieldsTypedEmptyChunk() throws Exception {
    final Dataset dataset = DatasetIterators.concat(extraction.subset(
        T0 + 60 * MINUTE, T0 + 61 * MINUTE, ImmutableList.of(TIME, variable)));
    assertEquals(ImmutableList.of(TIME, variable), dataset.variables());
    assertEquals(0, dataset.length());
    assertEquals(3, dataset.get(variable).width());
  }
  
  @Test
  public void subsetUnexpectedShape() throws Exception {
    store.write("MAG", "p2", "CHAOS", Column.ofDoubles(new double[600]), 
        ImmutableList.of(V1));
    try {
      DatasetIterators.concat(extraction.subset(T0 + 10 * MINUTE, 
          T0 + 11 * MINUTE, null));
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
  }
  
  @Test
  public void interpolate() throws Exception {
    final Dataset dataset = extraction.interpolate(
        new long[] { T0 + 1400, T0 + 10 * MINUTE + 1400 }, 
        ImmutableList.of(variable), null);
    assertEquals(ImmutableList.of(variable), dataset.variables());
    final double[] values = dataset.get(variable).doubles();
    assertEquals((T0 + 1000) / 1000.0, values[0], 0.0);
    assertTrue(Double.isNaN(values[3]));
  }
  
  /** @return The correct cached values of rows sampled every second. */
  static Column cachedColumn(final long begin, final int rows) {
    final double[] values = new double[rows * 3];
    for (int i = 0; i < rows; i++) {
      System.arraycopy(MockCacheableModel.expected(begin + i * SECOND), 0, 
          values, i * 3, 3);
    }
    return Column.ofVectors(3, values);
  }
}
