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
package exm.skc.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.graph.SuccessorsFunction;
import com.google.common.graph.Traverser;

import exm.skc.common.exceptions.InvalidTreeException;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolTable;

/**
 * Base class of all IR nodes.
 *
 * The position of a child is meaningful (e.g. a loop's children are
 * start, stop, step and body) and each node kind restricts what can
 * appear where.  The restriction is checked on every mutation, before
 * anything changes, so a failed mutation leaves the tree as it was.
 *
 * Parent and child links are held in a {@link NodeArena}; a node only
 * knows its arena and its handle in it.
 */
public abstract class Node {
  NodeArena arena;
  int handle;

  private static final SuccessorsFunction<Node> CHILDREN =
      new SuccessorsFunction<Node>() {
        @Override
        public Iterable<? extends Node> successors(Node node) {
          return node.children();
        }
      };

  protected Node() {
    arena = new NodeArena();
    handle = arena.allocate(this);
  }

  public abstract NodeKind kind();

  public abstract <T> T accept(NodeVisitor<T> visitor) throws VisitorError;

  /**
   * @param position
   * @param child
   * @return true if child may appear at position
   */
  protected abstract boolean isValidChild(int position, Node child);

  /**
   * @return description of valid children for error messages,
   *         e.g. "Expression, Expression, Expression, Schedule"
   */
  protected abstract String childrenFormat();

  /**
   * @return number of children needed for the node to be complete
   */
  protected int minChildren() {
    return 0;
  }

  protected int maxChildren() {
    return Integer.MAX_VALUE;
  }

  /**
   * Check a candidate child list.  Overridden by nodes whose rules
   * depend on more than the position.
   * @return null if valid, otherwise a description of the problem
   */
  protected String checkChildren(List<Node> candidate) {
    if (candidate.size() > maxChildren()) {
      return "'" + typeName() + "' can have at most " + maxChildren() +
             " children but would have " + candidate.size() +
             ". The valid format is: '" + childrenFormat() + "'.";
    }
    for (int i = 0; i < candidate.size(); i++) {
      Node child = candidate.get(i);
      if (!isValidChild(i, child)) {
        return "Item '" + child.typeName() + "' can't be child " + i +
               " of '" + typeName() + "'. The valid format is: '" +
               childrenFormat() + "'.";
      }
    }
    return null;
  }

  /**
   * Copy of everything but the children.  Scoping nodes copy their
   * symbol table and record the mapping from old to new symbols.
   */
  protected abstract Node shallowCopy(Map<Symbol, Symbol> remap);

  /**
   * @return symbols this node refers to (not including children)
   */
  public List<Symbol> referencedSymbols() {
    return Collections.emptyList();
  }

  /**
   * Replace references to symbols that are keys of remap
   */
  public void rebindSymbols(Map<Symbol, Symbol> remap) {
    // Most nodes refer to no symbols
  }

  /**
   * Add accesses made by this node, in execution order
   */
  public void referenceAccesses(VariablesAccessInfo info) {
    for (Node child: children()) {
      child.referenceAccesses(info);
    }
  }

  /**
   * @return true if this node and other have the same attributes,
   *         ignoring children
   */
  protected boolean sameAttributes(Node other) {
    return true;
  }

  public String typeName() {
    return getClass().getSimpleName();
  }

  /**
   * @return short description for messages
   */
  public String describe() {
    return typeName() + "[]";
  }

  /* ---- navigation ---- */

  public Node parent() {
    int p = arena.parentOf(handle);
    return p == NodeArena.NONE ? null : arena.node(p);
  }

  /**
   * @return snapshot of the current children
   */
  public List<Node> children() {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (int h: arena.childrenOf(handle)) {
      result.add(arena.node(h));
    }
    return result.build();
  }

  public Node getChild(int i) {
    return arena.node(arena.childrenOf(handle).get(i));
  }

  public int numChildren() {
    return arena.childrenOf(handle).size();
  }

  /**
   * @return index in parent's children, or -1 for a root
   */
  public int position() {
    int p = arena.parentOf(handle);
    if (p == NodeArena.NONE) {
      return -1;
    }
    return arena.childrenOf(p).indexOf(handle);
  }

  public Node root() {
    Node n = this;
    while (n.parent() != null) {
      n = n.parent();
    }
    return n;
  }

  /**
   * @return nearest proper ancestor of type cls, or null
   */
  public <T> T ancestor(Class<T> cls) {
    Node n = parent();
    while (n != null) {
      if (cls.isInstance(n)) {
        return cls.cast(n);
      }
      n = n.parent();
    }
    return null;
  }

  public boolean isDescendantOf(Node other) {
    Node n = parent();
    while (n != null) {
      if (n == other) {
        return true;
      }
      n = n.parent();
    }
    return false;
  }

  /**
   * @return symbol table of nearest enclosing scope (this node if it
   *         is a scoping node), or null if not within a scope
   */
  public SymbolTable scope() {
    Node n = this;
    while (n != null) {
      if (n instanceof ScopingNode) {
        return ((ScopingNode)n).getSymbolTable();
      }
      n = n.parent();
    }
    return null;
  }

  /**
   * Depth-first, pre-order walk of this node and its descendants.
   * Lazy: each iteration starts a new walk.
   * @param cls
   * @return nodes that are instances of cls
   */
  public <T> Iterable<T> walk(Class<T> cls) {
    Iterable<Node> all = Traverser.forTree(CHILDREN).depthFirstPreOrder(this);
    return Iterables.filter(all, cls);
  }

  public <T> List<T> walkList(Class<T> cls) {
    return Lists.newArrayList(walk(cls));
  }

  /* ---- mutation ---- */

  public void addChild(Node child) {
    insertChild(numChildren(), child);
  }

  /**
   * @param index
   * @param child a node without a parent
   * @throws InvalidTreeException if child can't go at that position
   */
  public void insertChild(int index, Node child) {
    if (index < 0 || index > numChildren()) {
      throw new InvalidTreeException("Index " + index + " out of range " +
          "for inserting into '" + typeName() + "' with " + numChildren() +
          " children");
    }
    checkOrphan(child);
    List<Node> candidate = new ArrayList<Node>(children());
    candidate.add(index, child);
    checkCandidate(candidate);
    NodeArena.attach(this, index, child);
  }

  /**
   * Remove this node from its parent.  Does nothing for a root.
   * @return this node
   * @throws InvalidTreeException if the parent would be left with
   *         children in invalid positions, or this is a child that a
   *         complete parent can't do without
   */
  public Node detach() {
    Node p = parent();
    if (p == null) {
      return this;
    }
    int pos = position();
    List<Node> candidate = new ArrayList<Node>(p.children());
    candidate.remove(pos);
    // Nodes still being built may be incomplete
    if (candidate.size() < p.minChildren() &&
        p.numChildren() >= p.minChildren()) {
      throw new InvalidTreeException("Can't detach '" + typeName() +
          "' (child " + pos + ") from '" + p.typeName() + "': it needs " +
          "at least " + p.minChildren() + " children. The valid format " +
          "is: '" + p.childrenFormat() + "'.");
    }
    p.checkCandidate(candidate);
    NodeArena.detach(this);
    return this;
  }

  /**
   * Put newNode at this node's position in its parent.  This node
   * is left detached.
   * @param newNode a node without a parent
   * @throws InvalidTreeException if this is a root, or newNode isn't
   *         valid at this position
   */
  public void replaceWith(Node newNode) {
    Node p = parent();
    if (p == null) {
      throw new InvalidTreeException("'" + typeName() + "' is a root " +
          "node and can't be replaced");
    }
    if (newNode == this) {
      return;
    }
    p.checkOrphan(newNode);
    int pos = position();
    List<Node> candidate = new ArrayList<Node>(p.children());
    candidate.set(pos, newNode);
    p.checkCandidate(candidate);
    NodeArena.detach(this);
    NodeArena.attach(p, pos, newNode);
  }

  private void checkOrphan(Node child) {
    if (child == null) {
      throw new InvalidTreeException("Can't add null as child of '" +
                                      typeName() + "'");
    }
    if (child.parent() != null) {
      throw new InvalidTreeException("Item '" + child.typeName() +
          "' can't be added as child of '" + typeName() + "' because it " +
          "is not an orphan. It already has a '" + child.parent().typeName() +
          "' as a parent.");
    }
    if (child == root()) {
      throw new InvalidTreeException("Adding '" + child.typeName() +
          "' as child of '" + typeName() + "' would create a cycle");
    }
  }

  private void checkCandidate(List<Node> candidate) {
    String problem = checkChildren(candidate);
    if (problem != null) {
      throw new InvalidTreeException(problem);
    }
  }

  /**
   * Check that this node has all the children it needs
   * @return null if valid, otherwise a description of the problem
   */
  public String checkComplete() {
    List<Node> current = children();
    if (current.size() < minChildren()) {
      return "'" + typeName() + "' needs at least " + minChildren() +
          " children but has " + current.size() + ". The valid format is: '"
          + childrenFormat() + "'.";
    }
    return checkChildren(current);
  }

  /* ---- copying and comparison ---- */

  /**
   * Deep copy of the subtree.  Copied scoping nodes get their own
   * tables with equivalent symbols, and references within the copy are
   * redirected to those symbols.
   * @return the copy, which has no parent
   */
  public Node copy() {
    Map<Symbol, Symbol> remap = new IdentityHashMap<Symbol, Symbol>();
    Node result = copyTree(remap);
    if (!remap.isEmpty()) {
      for (Node n: result.walk(Node.class)) {
        n.rebindSymbols(remap);
        if (n instanceof ScopingNode) {
          ((ScopingNode)n).getSymbolTable().remapReferences(remap);
        }
      }
    }
    return result;
  }

  private Node copyTree(Map<Symbol, Symbol> remap) {
    Node result = shallowCopy(remap);
    for (Node child: children()) {
      NodeArena.attach(result, result.numChildren(), child.copyTree(remap));
    }
    return result;
  }

  /**
   * @return true if other has the same shape, node types and attributes
   */
  public boolean structurallyEquals(Node other) {
    if (other == null || other.getClass() != getClass() ||
        !sameAttributes(other)) {
      return false;
    }
    List<Node> mine = children();
    List<Node> theirs = other.children();
    if (mine.size() != theirs.size()) {
      return false;
    }
    for (int i = 0; i < mine.size(); i++) {
      if (!mine.get(i).structurallyEquals(theirs.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return describe();
  }
}
