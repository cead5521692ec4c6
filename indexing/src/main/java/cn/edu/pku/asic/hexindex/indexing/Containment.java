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
package cn.edu.pku.asic.hexindex.indexing;

/**
 * The relationship between two cells as seen by the index.
 */
public enum Containment {
  /**The first cell is an ancestor of (or equal to) the second*/
  CONTAINS,
  /**The first cell is a descendant of the second*/
  CONTAINED_BY,
  /**Neither cell contains the other. Two distinct cells never partially overlap.*/
  DISJOINT
}
