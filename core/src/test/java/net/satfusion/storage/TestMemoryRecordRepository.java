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

import static net.satfusion.storage.MockProducts.MINUTE;
import static net.satfusion.storage.MockProducts.T0;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class TestMemoryRecordRepository {
  
  private MemoryRecordRepository repository;
  private Product p1;
  private Product p2;
  
  @Before
  public void before() throws Exception {
    repository = new MemoryRecordRepository();
    p2 = product("p2", T0 + 10 * MINUTE, T0 + 20 * MINUTE - 1);
    p1 = product("p1", T0, T0 + 10 * MINUTE - 1);
    repository.add(p2).add(p1);
  }
  
  @Test
  public void listAll() throws Exception {
    final List<Product> products = repository.listAll("MAG");
    assertEquals(2, products.size());
    assertSame(p1, products.get(0));
    assertSame(p2, products.get(1));
    assertTrue(repository.listAll("AUX").isEmpty());
    
    try {
      repository.listAll(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void list() throws Exception {
    assertEquals(2, repository.list("MAG", T0, T0 + 20 * MINUTE, 0).size());
    
    List<Product> products = repository.list("MAG", 
        T0 + 12 * MINUTE, T0 + 13 * MINUTE, 0);
    assertEquals(1, products.size());
    assertSame(p2, products.get(0));
    
    // the end of a request is exclusive
    assertTrue(repository.list("MAG", T0 - MINUTE, T0, 0).isEmpty());
    products = repository.list("MAG", T0 - MINUTE, T0, 1);
    assertEquals(1, products.size());
    assertSame(p1, products.get(0));
    
    // the end of a product is inclusive
    products = repository.list("MAG", T0 + 10 * MINUTE - 1, 
        T0 + 10 * MINUTE, 0);
    assertEquals(1, products.size());
    assertSame(p1, products.get(0));
    
    products = repository.list("MAG", T0 + 20 * MINUTE + MINUTE, 
        T0 + 30 * MINUTE, 2 * MINUTE);
    assertEquals(1, products.size());
    assertSame(p2, products.get(0));
    
    try {
      repository.list("MAG", T0, T0 + MINUTE, -1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void addReplaces() throws Exception {
    final Product replacement = product("p1", T0 + 30 * MINUTE, 
        T0 + 40 * MINUTE);
    repository.add(replacement);
    final List<Product> products = repository.listAll("MAG");
    assertEquals(2, products.size());
    assertSame(p2, products.get(0));
    assertSame(replacement, products.get(1));
    
    try {
      repository.add(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void remove() throws Exception {
    assertTrue(repository.remove("MAG", "p1"));
    assertFalse(repository.remove("MAG", "p1"));
    assertFalse(repository.remove("AUX", "p2"));
    assertEquals(1, repository.listAll("MAG").size());
  }
  
  @Test
  public void sampleOne() throws Exception {
    assertSame(p1, repository.sampleOne("MAG"));
    assertNull(repository.sampleOne("AUX"));
  }
  
  private static Product product(final String identifier, 
                                 final long begin, 
                                 final long end) {
    return Product.newBuilder()
        .setCollection("MAG")
        .setIdentifier(identifier)
        .setBegin(begin)
        .setEnd(end)
        .build();
  }
}
