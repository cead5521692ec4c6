/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package cn.edu.pku.asic.hexindex.common.cli;

import org.apache.hadoop.conf.Configuration;

/**
 * User options for the index components. Values are read from {@code hexindex-default.xml} on the classpath and
 * can be overridden programmatically. An instance is passed explicitly to every component that needs it.
 */
public class IndexOptions extends Configuration {
  /**Name of the resource that holds the default values of all index options*/
  public static final String DefaultResource = "hexindex-default.xml";

  static {
    Configuration.addDefaultResource(DefaultResource);
  }

  /**
   * Creates options initialized with the default values.
   */
  public IndexOptions() {
    this(true);
  }

  /**
   * Creates options.
   * @param loadDefaults whether to load the default resources or start with empty options
   */
  public IndexOptions(boolean loadDefaults) {
    super(loadDefaults);
  }

  /**
   * Sets an option and returns this object to allow chaining.
   * @param key the name of the option
   * @param value the value, converted to a string
   * @return this options object
   */
  public IndexOptions with(String key, Object value) {
    set(key, String.valueOf(value));
    return this;
  }
}
