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

import static net.satfusion.storage.MockProducts.T0;
import static net.satfusion.storage.MockProducts.TIME;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;

import org.junit.Before;
import org.junit.Test;

import net.satfusion.data.Column;

public class TestMemoryColumnReader {
  
  private MemoryRecordRepository repository;
  private MemoryColumnReader reader;
  private Product product;
  
  @Before
  public void before() throws Exception {
    repository = new MemoryRecordRepository();
    reader = new MemoryColumnReader();
    product = MockProducts.add(repository, reader, "MAG", "p1", 
        T0, T0 + 9000, 1000);
    reader.putConstant("p1", "Spacecraft", Column.ofStrings("A"));
  }
  
  @Test
  public void read() throws Exception {
    assertEquals(10, reader.rowCount(product));
    assertTrue(reader.contains(product, TIME));
    assertTrue(reader.contains(product, "Spacecraft"));
    assertFalse(reader.contains(product, "Kp"));
    assertTrue(reader.isRecordVarying(product, "F"));
    assertFalse(reader.isRecordVarying(product, "Spacecraft"));
    
    assertArrayEquals(new long[] { T0 + 2000, T0 + 3000 }, 
        reader.read(product, TIME, 2, 4).longs());
    assertEquals(0, reader.read(product, "F", 5, 5).rows());
    assertArrayEquals(new String[] { "A" }, 
        reader.read(product, "Spacecraft", 0, 1).strings());
  }
  
  @Test
  public void readErrors() throws Exception {
    try {
      reader.read(product, "Kp", 0, 1);
      fail("Expected IOException");
    } catch (IOException e) { }
    
    try {
      reader.read(product, "F", 5, 11);
      fail("Expected IOException");
    } catch (IOException e) { }
    
    try {
      reader.read(product, "F", 5, 4);
      fail("Expected IOException");
    } catch (IOException e) { }
    
    final Product unknown = Product.newBuilder()
        .setCollection("MAG")
        .setIdentifier("p9")
        .setBegin(T0)
        .setEnd(T0 + 1000)
        .build();
    try {
      reader.rowCount(unknown);
      fail("Expected IOException");
    } catch (IOException e) { }
  }
  
  @Test
  public void putReplacesConstants() throws Exception {
    reader.put("p1", MockProducts.data(T0, T0 + 1000, 1000));
    assertEquals(2, reader.rowCount(product));
    assertFalse(reader.contains(product, "Spacecraft"));
  }
  
  @Test
  public void putConstantInvalid() throws Exception {
    try {
      reader.putConstant("p1", "Spacecraft", Column.ofStrings("A", "B"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      reader.putConstant("p9", "Spacecraft", Column.ofStrings("A"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      reader.put(null, MockProducts.data(T0, T0 + 1000, 1000));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
