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
package exm.skc.backend;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.skc.common.Logging;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.UnsupportedConstructException;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.NodeVisitor;

/**
 * Base of backends that turn a tree into text.  Subclasses implement a
 * visit method for every node kind; kinds they have no translation for
 * are passed to {@link #unsupported(Node)}.
 */
public abstract class CodeWriter implements NodeVisitor<String> {
  protected final Logger logger = Logging.getSKCLogger();

  /**
   * If true, unsupported nodes are skipped with a marker instead of
   * raising an error
   */
  private final boolean skipNodes;
  private final String indentString;
  private int depth;

  /**
   * Writer configured from {@link Settings}
   */
  protected CodeWriter() {
    this(Settings.getBooleanUnchecked(Settings.BACKEND_SKIP_NODES),
         Settings.get(Settings.BACKEND_INDENT),
         Settings.getIntUnchecked(Settings.BACKEND_INITIAL_DEPTH));
  }

  protected CodeWriter(boolean skipNodes, String indentString,
                       int initialDepth) {
    if (initialDepth < 0) {
      throw new IllegalArgumentException("Initial depth must be " +
                              "non-negative but was " + initialDepth);
    }
    this.skipNodes = skipNodes;
    this.indentString = indentString;
    this.depth = initialDepth;
  }

  /**
   * @return short name for messages
   */
  public abstract String getName();

  public String emit(Node root) throws VisitorError {
    if (logger.isDebugEnabled()) {
      logger.debug(getName() + ": emitting " + root.describe());
    }
    return root.accept(this);
  }

  public boolean isSkipNodes() {
    return skipNodes;
  }

  protected String indent() {
    return StringUtils.repeat(indentString, depth);
  }

  /**
   * @return text for one level of indentation
   */
  protected String getIndentString() {
    return indentString;
  }

  protected int getDepth() {
    return depth;
  }

  protected void increaseDepth() {
    depth++;
  }

  protected void decreaseDepth() {
    assert(depth > 0);
    depth--;
  }

  /**
   * Output of each child, concatenated
   */
  protected String emitChildren(Node node) throws VisitorError {
    StringBuilder sb = new StringBuilder();
    for (Node child: node.children()) {
      sb.append(child.accept(this));
    }
    return sb.toString();
  }

  /**
   * Handle a node this backend can't translate.
   * @throws UnsupportedConstructException unless skipping nodes
   */
  protected String unsupported(Node node) throws VisitorError {
    String name = node.typeName();
    if (!skipNodes) {
      throw new UnsupportedConstructException("Unsupported node '" + name +
                                       "' found in " + getName());
    }
    logger.warn(getName() + ": skipping unsupported node " + node.describe());
    StringBuilder sb = new StringBuilder();
    sb.append(indent()).append("[ ").append(name).append(" start ]\n");
    sb.append(emitChildren(node));
    sb.append(indent()).append("[ ").append(name).append(" end ]\n");
    return sb.toString();
  }
}
