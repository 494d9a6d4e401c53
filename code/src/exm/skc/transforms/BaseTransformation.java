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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.skc.common.Logging;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
import exm.skc.ir.tree.Directives.Family;
import exm.skc.ir.tree.Directives.RegionDirective;
import exm.skc.ir.tree.Directives.RegionType;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Node;

/**
 * Option handling and tree surgery shared by the transformations.
 */
public abstract class BaseTransformation implements Transformation {

  protected static final Logger logger = Logging.getSKCLogger();

  /**
   * Builds the node that replaces a list of statements, once all
   * checks have passed.  The node is built with an empty body
   * (child 0, a Schedule) that the statements are then moved into.
   */
  public static interface Wrapper {
    public Statement wrap();
  }

  protected static final List<Statement> NO_STATEMENTS =
                                      Collections.emptyList();

  private final Set<String> optionNames;

  protected BaseTransformation(String... optionNames) {
    this.optionNames = Collections.unmodifiableSet(
                  new HashSet<String>(Arrays.asList(optionNames)));
  }

  @Override
  public Set<String> getOptionNames() {
    return optionNames;
  }

  /**
   * @param options may be null
   * @return options, or empty options if null
   * @throws TransformationError if there are unknown options
   */
  protected TransformOptions checkOptions(TransformOptions options)
                                            throws TransformationError {
    if (options == null) {
      return TransformOptions.none();
    }
    options.checkNames(getName(), optionNames);
    return options;
  }

  protected TransformationError error(String message) {
    return new TransformationError(getName(), message);
  }

  protected <T> Result<T, TransformationError> fail(String message) {
    return Result.error(error(message));
  }

  /**
   * Replace consecutive siblings with the node built from them
   * @param nodes already validated
   */
  protected Statement replace(List<Statement> nodes, Wrapper wrapper) {
    Node parent = nodes.get(0).parent();
    int pos = nodes.get(0).position();
    // Build before touching the tree
    Statement result = wrapper.wrap();
    Node body = result.getChild(0);
    for (Statement s: nodes) {
      s.detach();
      body.addChild(s);
    }
    parent.insertChild(pos, result);
    logger.debug(getName() + ": wrapped " + nodes.size() +
                 " node(s) in " + result.describe());
    return result;
  }

  /**
   * @return nearest enclosing region of the given family and type, or
   *        null
   */
  protected static RegionDirective enclosingRegion(Node node, Family family,
                                                   RegionType type) {
    Node n = node.parent();
    while (n != null) {
      if (n instanceof RegionDirective && matches((RegionDirective)n,
                                                  family, type)) {
        return (RegionDirective)n;
      }
      n = n.parent();
    }
    return null;
  }

  /**
   * @return a region of the given family and type at or below one of the
   *        nodes, or null
   */
  protected static RegionDirective containedRegion(
          List<? extends Node> nodes, Family family, RegionType type) {
    for (Node node: nodes) {
      for (RegionDirective d: node.walk(RegionDirective.class)) {
        if (matches(d, family, type)) {
          return d;
        }
      }
    }
    return null;
  }

  private static boolean matches(RegionDirective d, Family family,
                                 RegionType type) {
    return (family == null || d.family() == family) &&
           d.regionType() == type;
  }

  @Override
  public String toString() {
    return getName();
  }
}
