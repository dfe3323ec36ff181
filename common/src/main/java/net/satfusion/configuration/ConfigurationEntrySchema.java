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
package net.satfusion.configuration;

import java.lang.reflect.Type;

import com.google.common.base.Strings;

/**
 * The schema of a configuration entry: the key, the type its values are
 * converted to, a default and a description for the users.
 * 
 * @since 1.0
 */
public class ConfigurationEntrySchema {
  
  /** The key. */
  protected final String key;
  
  /** The value type. */
  protected final Type type;
  
  /** The default value, may be null. */
  protected final Object default_value;
  
  /** Whether null values are allowed. */
  protected final boolean nullable;
  
  /** The class that registered the schema. */
  protected final String source;
  
  /** A description for the users. */
  protected final String description;
  
  protected ConfigurationEntrySchema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (builder.type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (Strings.isNullOrEmpty(builder.description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    if (!builder.nullable && builder.default_value == null) {
      throw new IllegalArgumentException("Schema " + builder.key 
          + " is not nullable but the default value was null.");
    }
    key = builder.key;
    type = builder.type;
    default_value = builder.default_value;
    nullable = builder.nullable;
    source = builder.source;
    description = builder.description;
  }
  
  /** @return The key. */
  public String getKey() {
    return key;
  }
  
  /** @return The value type. */
  public Type getType() {
    return type;
  }
  
  /** @return The default value, may be null. */
  public Object getDefaultValue() {
    return default_value;
  }
  
  /** @return Whether null values are allowed. */
  public boolean isNullable() {
    return nullable;
  }
  
  /** @return The class that registered the schema, may be null. */
  public String getSource() {
    return source;
  }
  
  /** @return The description. */
  public String getDescription() {
    return description;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("key=")
        .append(key)
        .append(", type=")
        .append(type)
        .append(", defaultValue=")
        .append(default_value)
        .append(", nullable=")
        .append(nullable)
        .append(", source=")
        .append(source)
        .toString();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String key;
    private Type type;
    private Object default_value;
    private boolean nullable;
    private String source;
    private String description;
    
    public Builder setKey(final String key) {
      this.key = key;
      return this;
    }
    
    public Builder setType(final Type type) {
      this.type = type;
      return this;
    }
    
    public Builder setDefaultValue(final Object default_value) {
      this.default_value = default_value;
      return this;
    }
    
    public Builder isNullable() {
      nullable = true;
      return this;
    }
    
    public Builder notNullable() {
      nullable = false;
      return this;
    }
    
    public Builder setSource(final String source) {
      this.source = source;
      return this;
    }
    
    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }
    
    public ConfigurationEntrySchema build() {
      return new ConfigurationEntrySchema(this);
    }
  }
}
