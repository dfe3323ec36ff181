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
package net.satfusion.configuration.provider;

import java.io.Closeable;

/**
 * A source of configuration values.
 * 
 * @since 1.0
 */
public interface Provider extends Closeable {
  
  /**
   * @param key A non-null and non-empty key.
   * @return The raw value of the key or null if the provider has no value 
   * for it.
   */
  public Object getSetting(final String key);
  
  /** @return The non-null name of this provider. */
  public String source();
  
}
