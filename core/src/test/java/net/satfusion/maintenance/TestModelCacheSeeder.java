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
package net.satfusion.maintenance;

import static net.satfusion.storage.MockProducts.MINUTE;
import static net.satfusion.storage.MockProducts.T0;
import static net.satfusion.storage.MockProducts.TIME;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.satfusion.data.Column;
import net.satfusion.exceptions.IllegalDataException;
import net.satfusion.models.MockCacheableModel;
import net.satfusion.query.ModelSource;
import net.satfusion.storage.MemoryColumnReader;
import net.satfusion.storage.MemoryModelCacheStore;
import net.satfusion.storage.MemoryRecordRepository;
import net.satfusion.storage.MockProducts;
import net.satfusion.storage.Product;

public class TestModelCacheSeeder {
  private static final long SECOND = 1000;
  private static final long DAY = 24 * 60 * MINUTE;
  private static final ModelSource V1 = 
      new ModelSource("CHAOS_v1", T0 - DAY, T0 + DAY);
  private static final ModelSource V2 = 
      new ModelSource("CHAOS_v2", T0 - DAY, T0 + DAY);
  private static final ModelSource FUTURE = 
      new ModelSource("CHAOS_v3", T0 + DAY, T0 + 2 * DAY);
  
  private MemoryRecordRepository repository;
  private MemoryColumnReader reader;
  private MemoryModelCacheStore store;
  private MockCacheableModel model;
  private ModelCacheSeeder seeder;
  private StreamExecutor executor;
  private Product p1;
  
  @Before
  public void before() throws Exception {
    repository = new MemoryRecordRepository();
    reader = new MemoryColumnReader();
    store = new MemoryModelCacheStore();
    p1 = MockProducts.add(repository, reader, "MAG", "p1", 
        T0, T0 + 10 * MINUTE - SECOND, SECOND);
    MockProducts.add(repository, reader, "MAG", "p2", 
        T0 + 10 * MINUTE, T0 + 20 * MINUTE - SECOND, SECOND);
    model = new MockCacheableModel("CHAOS", TIME, V1, FUTURE);
    seeder = new ModelCacheSeeder(repository, reader, store);
    executor = new StreamExecutor(2);
  }
  
  @After
  public void after() throws Exception {
    executor.close();
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new ModelCacheSeeder(null, reader, store);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new ModelCacheSeeder(repository, null, store);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new ModelCacheSeeder(repository, reader, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void seed() throws Exception {
    final MaintenanceSummary summary = seeder.seed("MAG", 
        ImmutableList.of(model), false, executor);
    assertEquals(2, summary.processed());
    assertEquals(2, summary.updated());
    assertEquals(0, summary.failed());
    assertEquals(2, summary.models());
    assertEquals(1200, model.evaluatedRows());
    
    final Column column = store.readColumn("MAG", "p1", "CHAOS");
    assertEquals(600, column.rows());
    assertEquals(3, column.width());
    assertEquals(T0 / 1000.0, column.getDouble(0, 0), 0.0001);
    assertEquals(2, column.getDouble(599, 2), 0.0001);
    
    // only the sources valid over the product are recorded
    final Map<String, List<ModelSource>> provenance = 
        store.readProvenance("MAG", "p2");
    assertEquals(ImmutableList.of(V1), provenance.get("CHAOS"));
  }
  
  @Test
  public void seedSkipsUpToDate() throws Exception {
    seeder.seed("MAG", ImmutableList.of(model), false, executor);
    
    MaintenanceSummary summary = seeder.seed("MAG", 
        ImmutableList.of(model), false, executor);
    assertEquals(2, summary.processed());
    assertEquals(0, summary.updated());
    assertEquals(0, summary.models());
    assertEquals(1200, model.evaluatedRows());
    
    summary = seeder.seed("MAG", ImmutableList.of(model), true, executor);
    assertEquals(2, summary.updated());
    assertEquals(2400, model.evaluatedRows());
  }
  
  @Test
  public void seedObsolete() throws Exception {
    seeder.seed("MAG", ImmutableList.of(model), false, executor);
    model.setSources(V2);
    
    final MaintenanceSummary summary = seeder.seed("MAG", 
        ImmutableList.of(model), false, executor);
    assertEquals(2, summary.updated());
    assertEquals(ImmutableList.of(V2), 
        store.readProvenance("MAG", "p1").get("CHAOS"));
  }
  
  @Test
  public void seedProduct() throws Exception {
    final MockCacheableModel igrf = new MockCacheableModel("IGRF", TIME, 
        new ModelSource("IGRF_13", T0 - DAY, T0 + DAY));
    assertEquals(2, seeder.seedProduct(p1, 
        ImmutableList.of(model, igrf), false));
    assertEquals(0, seeder.seedProduct(p1, 
        ImmutableList.of(model, igrf), false));
    assertEquals(2, store.readProvenance("MAG", "p1").size());
  }
  
  @Test
  public void seedMissingVariable() throws Exception {
    final MockCacheableModel broken = 
        new MockCacheableModel("BROKEN", "QDLat", V1);
    try {
      seeder.seedProduct(p1, ImmutableList.of(broken), false);
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
    
    final MaintenanceSummary summary = seeder.seed("MAG", 
        ImmutableList.of(broken), false, executor);
    assertEquals(2, summary.processed());
    assertEquals(2, summary.failed());
    assertEquals(0, summary.updated());
  }
  
  @Test
  public void seedDuplicateNames() throws Exception {
    try {
      seeder.seed("MAG", ImmutableList.of(model, 
          new MockCacheableModel("CHAOS", TIME, V2)), false, executor);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
