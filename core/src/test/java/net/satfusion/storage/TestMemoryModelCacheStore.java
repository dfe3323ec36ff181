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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.satfusion.data.Column;
import net.satfusion.query.ModelSource;

public class TestMemoryModelCacheStore {
  private static final ModelSource V1 = new ModelSource("CHAOS_v1", 0, 100);
  
  private MemoryModelCacheStore store;
  private Column column;
  
  @Before
  public void before() throws Exception {
    store = new MemoryModelCacheStore();
    column = Column.ofVectors(3, 1, 2, 3, 4, 5, 6);
  }
  
  @Test
  public void writeAndRead() throws Exception {
    assertNull(store.readProvenance("MAG", "p1"));
    assertNull(store.readColumn("MAG", "p1", "CHAOS"));
    
    store.write("MAG", "p1", "CHAOS", column, ImmutableList.of(V1));
    store.write("MAG", "p1", "IGRF", column, null);
    
    final Map<String, List<ModelSource>> provenance = 
        store.readProvenance("MAG", "p1");
    assertEquals(ImmutableList.of(V1), provenance.get("CHAOS"));
    assertTrue(provenance.get("IGRF").isEmpty());
    assertEquals(column, store.readColumn("MAG", "p1", "CHAOS"));
    assertNull(store.readColumn("MAG", "p1", "OLD"));
    assertEquals(ImmutableSet.of("p1"), store.listEntries("MAG"));
    assertTrue(store.listEntries("AUX").isEmpty());
  }
  
  @Test
  public void writeInvalid() throws Exception {
    try {
      store.write("MAG", "p1", null, column, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      store.write("MAG", "p1", "CHAOS", null, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      store.write(null, "p1", "CHAOS", column, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void remove() throws Exception {
    store.write("MAG", "p1", "CHAOS", column, ImmutableList.of(V1));
    assertFalse(store.remove("MAG", "p1", "IGRF"));
    assertFalse(store.remove("MAG", "p2", "CHAOS"));
    assertTrue(store.remove("MAG", "p1", "CHAOS"));
    
    // the entry outlives its models
    assertTrue(store.readProvenance("MAG", "p1").isEmpty());
    assertTrue(store.removeEntry("MAG", "p1"));
    assertFalse(store.removeEntry("MAG", "p1"));
    assertFalse(store.removeEntry("AUX", "p1"));
    assertNull(store.readProvenance("MAG", "p1"));
  }
}
