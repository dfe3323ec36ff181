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

import java.io.File;
import java.io.IOException;
import java.util.Collection;

/**
 * Loads models from their source files for the {@link ModelFileCache}.
 * 
 * @param <M> The type of the loaded models.
 * 
 * @since 1.0
 */
public interface ModelLoader<M> {

  /**
   * @param model_id A model identifier.
   * @return True if the loader knows the model.
   */
  public boolean canLoad(final String model_id);
  
  /**
   * @param model_id A model identifier accepted by {@link #canLoad(String)}.
   * @return The files the model is loaded from. A change of their 
   * modification times triggers a reload.
   */
  public Collection<File> sourceFiles(final String model_id);
  
  /**
   * Loads the model.
   * @param model_id A model identifier accepted by {@link #canLoad(String)}.
   * @return The non-null model.
   * @throws IOException if a source file could not be read.
   */
  public M load(final String model_id) throws IOException;
  
}
