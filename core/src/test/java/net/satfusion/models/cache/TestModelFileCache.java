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
package net.satfusion.models.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

import net.satfusion.configuration.UnitTestConfiguration;

public class TestModelFileCache {
  
  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();
  
  private TextLoader loader;
  
  @Before
  public void before() throws Exception {
    loader = new TextLoader(folder.getRoot());
    write("chaos", "CHAOS-7");
    write("igrf", "IGRF-13");
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new ModelFileCache<String>(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new ModelFileCache<String>(loader, null, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void getCaches() throws Exception {
    final ModelFileCache<String> cache = new ModelFileCache<String>(loader);
    final String model = cache.get("chaos");
    assertEquals("CHAOS-7", model);
    assertSame(model, cache.get("chaos"));
    assertEquals(1, loader.loads);
    assertEquals(1, cache.size());
    assertEquals(1, cache.stats().hitCount());
    assertEquals(1, cache.stats().missCount());
    
    assertNull(cache.get("unknown"));
    
    try {
      cache.get("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void getReloadsChangedModel() throws Exception {
    final ModelFileCache<String> cache = new ModelFileCache<String>(loader);
    assertEquals("CHAOS-7", cache.get("chaos"));
    final File file = write("chaos", "CHAOS-8");
    assertTrue(file.setLastModified(file.lastModified() + 60000));
    
    assertEquals("CHAOS-8", cache.get("chaos"));
    assertEquals(2, loader.loads);
    assertEquals("CHAOS-8", cache.get("chaos"));
    assertEquals(2, loader.loads);
  }
  
  @Test
  public void invalidateIfChanged() throws Exception {
    final ModelFileCache<String> cache = new ModelFileCache<String>(loader);
    cache.get("chaos");
    cache.get("igrf");
    assertEquals(0, cache.invalidateIfChanged());
    
    final File file = new File(folder.getRoot(), "igrf.txt");
    assertTrue(file.setLastModified(file.lastModified() + 60000));
    assertEquals(1, cache.invalidateIfChanged());
    assertEquals(1, cache.size());
    
    // a removed source counts as a change
    assertTrue(new File(folder.getRoot(), "chaos.txt").delete());
    assertEquals(1, cache.invalidateIfChanged());
    assertEquals(0, cache.size());
    assertNull(cache.get("chaos"));
  }
  
  @Test
  public void aliases() throws Exception {
    final ModelFileCache<String> cache = new ModelFileCache<String>(loader, 
        ImmutableMap.of("latest", "chaos"), 4);
    assertSame(cache.get("chaos"), cache.get("latest"));
    assertEquals(1, loader.loads);
  }
  
  @Test
  public void loadFailure() throws Exception {
    final ModelFileCache<String> cache = new ModelFileCache<String>(loader);
    write("broken", "");
    try {
      cache.get("broken");
      fail("Expected ModelLoadException");
    } catch (ModelLoadException e) {
      assertTrue(e.getCause() instanceof IOException);
    }
    assertEquals(0, cache.size());
  }
  
  @Test
  public void fromConfiguration() throws Exception {
    final ModelFileCache<String> cache = ModelFileCache.fromConfiguration(
        loader, null, UnitTestConfiguration.getConfiguration(ImmutableMap.of(
            ModelFileCache.MAX_OBJECTS_KEY, "1")));
    cache.get("chaos");
    cache.get("igrf");
    assertEquals(1, cache.size());
    
    cache.flush();
    assertEquals(0, cache.size());
  }
  
  private File write(final String model_id, final String content) 
      throws IOException {
    final File file = new File(folder.getRoot(), model_id + ".txt");
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
    return file;
  }
  
  /** Loads the text of {@code <model_id>.txt}, empty files are corrupt. */
  static class TextLoader implements ModelLoader<String> {
    private final File directory;
    int loads;
    
    TextLoader(final File directory) {
      this.directory = directory;
    }
    
    @Override
    public boolean canLoad(final String model_id) {
      return file(model_id).exists();
    }

    @Override
    public Collection<File> sourceFiles(final String model_id) {
      return ImmutableList.of(file(model_id));
    }

    @Override
    public String load(final String model_id) throws IOException {
      loads++;
      final String text = Files.asCharSource(file(model_id), 
          StandardCharsets.UTF_8).read();
      if (text.isEmpty()) {
        throw new IOException("Empty model file " + model_id);
      }
      return text;
    }
    
    private File file(final String model_id) {
      return new File(directory, model_id + ".txt");
    }
  }
}
