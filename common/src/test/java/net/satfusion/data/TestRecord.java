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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestRecord {

  @Test
  public void ctor() {
    final Record<String> record = new Record<String>(1, 1000, 2000, "p1");
    assertEquals(1, record.index());
    assertEquals(1000, record.start());
    assertEquals(2000, record.end());
    assertEquals("p1", record.payload());
    assertFalse(record.isEmpty());
    assertTrue(new Record<String>(0, 1000, 1000, "p1").isEmpty());
    
    try {
      new Record<String>(0, 2000, 1000, "p1");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new Record<String>(0, 1000, 2000, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void withStartAndEnd() {
    final Record<String> record = new Record<String>(1, 1000, 2000, "p1");
    assertEquals(new Record<String>(1, 1500, 2000, "p1"), 
        record.withStart(1500));
    assertEquals(new Record<String>(1, 1000, 1500, "p1"), 
        record.withEnd(1500));
    assertEquals(1000, record.start());
  }
  
  @Test
  public void overlaps() {
    final Record<String> record = new Record<String>(0, 1000, 2000, "p1");
    assertTrue(record.overlaps(new Record<String>(0, 1999, 3000, "p2")));
    assertFalse(record.overlaps(new Record<String>(0, 2000, 3000, "p2")));
    assertFalse(record.overlaps(new Record<String>(0, 0, 1000, "p2")));
  }
}
