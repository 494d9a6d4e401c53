/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.skc.transforms;

import java.util.Set;

import exm.skc.common.exceptions.TransformationError;
import exm.skc.ir.tree.Node;

/**
 * A rewrite of part of the IR tree.
 *
 * validate checks everything apply needs without changing the tree.
 * apply validates first and then performs the rewrite; if it raises,
 * the tree is left as it was.
 */
public interface Transformation {

  public String getName();

  /**
   * @return names of the options this transformation understands
   */
  public Set<String> getOptionNames();

  public void validate(Node node, TransformOptions options)
                                          throws TransformationError;

  /**
   * @return the node that now stands where the target was, e.g. the
   *        directive wrapping it
   */
  public Node apply(Node node, TransformOptions options)
                                          throws TransformationError;
}
