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
package net.satfusion.models;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;

public class TestSimpleModels {
  
  private static final Dataset DATASET = new Dataset()
      .set("Timestamp", Column.ofTimestamps(1, 2, 3))
      .set("F", Column.ofDoubles(10, 20, 30));

  @Test
  public void identity() throws Exception {
    final Identity identity = new Identity("F", "F_copy");
    assertEquals(ImmutableList.of("F"), identity.requiredVariables());
    assertEquals(ImmutableList.of("F_copy"), identity.variables());
    assertTrue(identity.products().isEmpty());
    
    final Dataset output = identity.eval(DATASET, null);
    assertEquals(ImmutableList.of("F_copy"), output.variables());
    assertSame(DATASET.get("F"), output.get("F_copy"));
    assertTrue(identity.eval(DATASET, ImmutableList.of("F")).isEmpty());
    
    try {
      new Identity("F", "F");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new Identity("", "F");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void constantLabel() throws Exception {
    final ConstantLabel label = ConstantLabel.spacecraft("B", "Timestamp");
    assertEquals(ImmutableList.of("Timestamp"), label.requiredVariables());
    assertEquals(ImmutableList.of(ConstantLabel.SPACECRAFT), 
        label.variables());
    
    final Dataset output = label.eval(DATASET, null);
    assertArrayEquals(new String[] { "B", "B", "B" }, 
        output.get(ConstantLabel.SPACECRAFT).strings());
    assertTrue(label.eval(DATASET, ImmutableList.of("F")).isEmpty());
    
    assertEquals(0, label.eval(new Dataset().set("Timestamp", 
        Column.ofTimestamps()), null).length());
    
    try {
      new ConstantLabel("", "A", "Timestamp");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new ConstantLabel("Spacecraft", null, "Timestamp");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
