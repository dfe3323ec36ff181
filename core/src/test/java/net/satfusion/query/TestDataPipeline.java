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
package net.satfusion.query;

import static net.satfusion.storage.MockProducts.MINUTE;
import static net.satfusion.storage.MockProducts.T0;
import static net.satfusion.storage.MockProducts.TIME;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.satfusion.configuration.UnitTestConfiguration;
import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;
import net.satfusion.exceptions.QueryExecutionException;
import net.satfusion.filters.ScalarRangeFilter;
import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.models.ConstantLabel;
import net.satfusion.query.resolver.VariableResolver;
import net.satfusion.source.ProductTypeParameters;
import net.satfusion.source.SingleCollectionProductSource;
import net.satfusion.storage.MemoryColumnReader;
import net.satfusion.storage.MemoryRecordRepository;
import net.satfusion.storage.MockProducts;
import net.satfusion.storage.Product;
import net.satfusion.timeseries.ProductTimeSeries;

public class TestDataPipeline {
  private static final long SECOND = 1000;
  private static final List<String> OUTPUT = 
      ImmutableList.of(TIME, "F", "Kp", ConstantLabel.SPACECRAFT);
  
  private MemoryRecordRepository repository;
  private MemoryColumnReader reader;
  private ProductTimeSeries master;
  private ProductTimeSeries slave;
  
  @Before
  public void before() throws Exception {
    repository = new MemoryRecordRepository();
    reader = new MemoryColumnReader();
    MockProducts.add(repository, reader, "MAG", "p1", 
        T0, T0 + 10 * MINUTE - SECOND, SECOND);
    MockProducts.add(repository, reader, "MAG", "p2", 
        T0 + 10 * MINUTE, T0 + 20 * MINUTE - SECOND, SECOND);
    master = new ProductTimeSeries(new SingleCollectionProductSource(
        repository, "MAG", null), reader, ImmutableList.of(TIME, "F"));
    
    // one auxiliary sample per minute, Kp = t / 1000
    repository.add(Product.newBuilder()
        .setCollection("AUX")
        .setIdentifier("a1")
        .setBegin(T0 - 60 * MINUTE)
        .setEnd(T0 + 60 * MINUTE)
        .build());
    final long[] times = new long[121];
    final double[] kp = new double[121];
    for (int i = 0; i < times.length; i++) {
      times[i] = T0 + (i - 60) * MINUTE;
      kp[i] = times[i] / 1000.0;
    }
    reader.put("a1", new Dataset()
        .set(TIME, Column.ofTimestamps(times))
        .set("Kp", Column.ofDoubles(kp)));
    final ProductTypeParameters params = ProductTypeParameters.newBuilder()
        .setTimeOverlapMillis(2 * MINUTE)
        .setGapThresholdMillis(2 * MINUTE)
        .setSegmentNeighbourhoodMillis(MINUTE)
        .build();
    slave = new ProductTimeSeries(new SingleCollectionProductSource(
        repository, "AUX", params), reader, ImmutableList.of(TIME, "Kp"), 
        ImmutableMap.of("Kp", InterpolationKind.PREVIOUS));
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new DataPipeline(new VariableResolver(), TIME, 10);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new DataPipeline(null, TIME, 10);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new DataPipeline(resolver(), TIME, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void execute() throws Exception {
    final VariableResolver resolver = resolver(new ScalarRangeFilter("F", 
        (T0 + 60 * SECOND) / 1000.0, (T0 + 120 * SECOND) / 1000.0));
    final DataPipeline pipeline = new DataPipeline(resolver, TIME, 1000);
    final List<Dataset> chunks = Lists.newArrayList(
        pipeline.execute(T0, T0 + 20 * MINUTE));
    
    assertEquals(2, chunks.size());
    final Dataset first = chunks.get(0);
    assertEquals(OUTPUT, first.variables());
    assertEquals(61, first.length());
    final long[] times = first.get(TIME).longs();
    final double[] kp = first.get("Kp").doubles();
    assertEquals(T0 + 60 * SECOND, times[0]);
    assertEquals(T0 + 120 * SECOND, times[60]);
    // zero order hold of the minute samples
    assertEquals((T0 + MINUTE) / 1000.0, kp[0], 0.0);
    assertEquals((T0 + MINUTE) / 1000.0, kp[59], 0.0);
    assertEquals((T0 + 2 * MINUTE) / 1000.0, kp[60], 0.0);
    assertEquals("A", first.get(ConstantLabel.SPACECRAFT).strings()[0]);
    
    // the second product is filtered out
    assertEquals(0, chunks.get(1).length());
    assertEquals(ImmutableSet.of("p1", "p2"), master.products());
    assertEquals(ImmutableSet.of("a1"), slave.products());
  }
  
  @Test
  public void executeWithoutFilters() throws Exception {
    final DataPipeline pipeline = new DataPipeline(resolver(), TIME, 
        1200);
    int total = 0;
    final DatasetIterator iterator = pipeline.execute(T0, T0 + 20 * MINUTE);
    while (iterator.hasNext()) {
      final Dataset chunk = iterator.next();
      assertEquals(600, chunk.length());
      total += chunk.length();
    }
    iterator.close();
    assertEquals(1200, total);
  }
  
  @Test
  public void tooManySamples() throws Exception {
    final DataPipeline pipeline = new DataPipeline(resolver(), TIME, 
        UnitTestConfiguration.getConfiguration(ImmutableMap.of(
            DataPipeline.MAX_SAMPLES_KEY, "1000")));
    final DatasetIterator iterator = pipeline.execute(T0, T0 + 20 * MINUTE);
    assertEquals(600, iterator.next().length());
    try {
      iterator.next();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(DataPipeline.TOO_LARGE, e.getStatusCode());
    }
  }
  
  @Test
  public void unresolvedFilterRejectsEverything() throws Exception {
    final DataPipeline pipeline = new DataPipeline(resolver(
        new ScalarRangeFilter("Dst", -50, 50)), TIME, 1000);
    final DatasetIterator iterator = pipeline.execute(T0, T0 + 20 * MINUTE);
    while (iterator.hasNext()) {
      assertEquals(0, iterator.next().length());
    }
  }
  
  @Test
  public void filterLeftUnapplied() throws Exception {
    // declares X but never produces it
    final Model broken = mock(Model.class);
    when(broken.id()).thenReturn("broken");
    when(broken.requiredVariables()).thenReturn(ImmutableList.of(TIME));
    when(broken.variables()).thenReturn(ImmutableList.of("X"));
    when(broken.products()).thenReturn(ImmutableSet.<String>of());
    when(broken.eval(any(), any())).thenReturn(new Dataset());
    
    final VariableResolver resolver = new VariableResolver();
    resolver.addMaster(master);
    resolver.addModel(broken);
    resolver.addFilter(new ScalarRangeFilter("X", 0, 1));
    resolver.addOutputVariables(ImmutableList.of(TIME, "X"));
    resolver.reduce();
    
    final DatasetIterator iterator = new DataPipeline(resolver, TIME, 1000)
        .execute(T0, T0 + MINUTE);
    try {
      iterator.hasNext();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
  }
  
  @Test
  public void emptyWindow() throws Exception {
    final List<Dataset> chunks = Lists.newArrayList(new DataPipeline(
        resolver(), TIME, 1000).execute(T0 + 60 * MINUTE, T0 + 61 * MINUTE));
    assertEquals(1, chunks.size());
    assertEquals(OUTPUT, chunks.get(0).variables());
    assertEquals(0, chunks.get(0).length());
  }
  
  @Test
  public void slaveTimesFollowFilteredMaster() throws Exception {
    final VariableResolver resolver = resolver(new ScalarRangeFilter("F", 
        (T0 + 30 * SECOND) / 1000.0, (T0 + 31 * SECOND) / 1000.0));
    final Dataset chunk = new DataPipeline(resolver, TIME, 1000)
        .execute(T0, T0 + MINUTE).next();
    assertArrayEquals(new long[] { T0 + 30 * SECOND, T0 + 31 * SECOND }, 
        chunk.get(TIME).longs());
    assertArrayEquals(new double[] { T0 / 1000.0, T0 / 1000.0 }, 
        chunk.get("Kp").doubles(), 0.0);
  }
  
  private VariableResolver resolver(final Filter... filters) {
    final VariableResolver resolver = new VariableResolver();
    resolver.addMaster(master);
    resolver.addSlave(slave);
    resolver.addModel(ConstantLabel.spacecraft("A", TIME));
    resolver.addFilters(ImmutableList.copyOf(filters));
    resolver.addOutputVariables(OUTPUT);
    resolver.reduce();
    return resolver;
  }
}
