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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Storage for the parent/child links of one tree.  Nodes are addressed
 * by integer handles; links are stored as handles rather than as
 * references between node objects.
 *
 * Every tree lives in exactly one arena: a node without a parent is
 * the root of its own arena.  Attaching a subtree moves it into the
 * arena of its new parent, detaching moves it out into a fresh one.
 */
final class NodeArena {
  static final int NONE = -1;

  private final List<Node> nodes = new ArrayList<Node>();
  private final List<Integer> parents = new ArrayList<Integer>();
  private final List<List<Integer>> children = new ArrayList<List<Integer>>();
  /** Released handles available for reuse */
  private final Deque<Integer> freeList = new ArrayDeque<Integer>();

  int allocate(Node node) {
    int h;
    if (!freeList.isEmpty()) {
      h = freeList.pop();
      nodes.set(h, node);
      parents.set(h, NONE);
      children.set(h, new ArrayList<Integer>());
    } else {
      h = nodes.size();
      nodes.add(node);
      parents.add(NONE);
      children.add(new ArrayList<Integer>());
    }
    return h;
  }

  private void release(int h) {
    nodes.set(h, null);
    parents.set(h, NONE);
    children.set(h, null);
    freeList.push(h);
  }

  Node node(int h) {
    return nodes.get(h);
  }

  int parentOf(int h) {
    return parents.get(h);
  }

  List<Integer> childrenOf(int h) {
    return Collections.unmodifiableList(children.get(h));
  }

  /**
   * @return number of nodes currently stored
   */
  int liveCount() {
    return nodes.size() - freeList.size();
  }

  /**
   * Link child into parent's child list.  Caller has checked that child
   * has no parent and that the resulting child list is valid.
   */
  static void attach(Node parent, int index, Node child) {
    NodeArena target = parent.arena;
    if (child.arena != target) {
      relocate(child, target);
    }
    target.children.get(parent.handle).add(index, child.handle);
    target.parents.set(child.handle, parent.handle);
  }

  /**
   * Unlink node from its parent, moving its subtree to a new arena
   */
  static void detach(Node child) {
    NodeArena source = child.arena;
    int p = source.parents.get(child.handle);
    if (p == NONE) {
      return;
    }
    source.children.get(p).remove(Integer.valueOf(child.handle));
    source.parents.set(child.handle, NONE);
    relocate(child, new NodeArena());
  }

  /**
   * Move subtree rooted at node into target, freeing its old slots
   * @return new handle of node
   */
  private static int relocate(Node node, NodeArena target) {
    NodeArena source = node.arena;
    int oldHandle = node.handle;
    int newHandle = target.allocate(node);
    for (int oldChild: new ArrayList<Integer>(source.children.get(oldHandle))) {
      int newChild = relocate(source.nodes.get(oldChild), target);
      target.children.get(newHandle).add(newChild);
      target.parents.set(newChild, newHandle);
    }
    source.release(oldHandle);
    node.arena = target;
    node.handle = newHandle;
    return newHandle;
  }
}
