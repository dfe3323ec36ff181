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

/**
 * Thrown when a model could not be loaded from its sources.
 * 
 * @since 1.0
 */
public class ModelLoadException extends RuntimeException {
  private static final long serialVersionUID = -2047705125624862713L;

  /**
   * Default ctor.
   * @param msg The message.
   * @param cause The cause.
   */
  public ModelLoadException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
  
}
