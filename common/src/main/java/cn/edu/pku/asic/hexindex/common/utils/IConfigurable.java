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
package cn.edu.pku.asic.hexindex.common.utils;

import cn.edu.pku.asic.hexindex.common.cli.IndexOptions;
import cn.edu.pku.asic.hexindex.common.cli.OperationParam;

/**
 * Interface for objects that can be configured
 * @see OperationParam
 */
public interface IConfigurable {

  /**
   * Setup the component before it is used. At this step, the component reads the options it declares and can throw
   * an exception if they are invalid.
   * @param opts the user-defined options to initialize to
   */
  default void setup(IndexOptions opts) {}
}
