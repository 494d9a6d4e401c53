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

import java.util.ArrayList;
import java.util.List;

import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;

/**
 * Chooses the nodes of a tree that a pipeline step applies to
 */
public abstract class NodeSelector {

  /**
   * @return selected nodes, in tree order
   */
  public abstract List<Node> select(Node root);

  public abstract String describe();

  @Override
  public String toString() {
    return describe();
  }

  /**
   * The root itself
   */
  public static NodeSelector root() {
    return new NodeSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        result.add(root);
        return result;
      }

      @Override
      public String describe() {
        return "root";
      }
    };
  }

  /**
   * All nodes of a type, including nested ones
   */
  public static NodeSelector all(final Class<? extends Node> cls) {
    return new NodeSelector() {
      @Override
      public List<Node> select(Node root) {
        return new ArrayList<Node>(root.walkList(cls));
      }

      @Override
      public String describe() {
        return "all " + cls.getSimpleName();
      }
    };
  }

  /**
   * Loops of a loop type that are not inside another loop of the
   * same type
   */
  public static NodeSelector outermostLoops(final String loopType) {
    return new NodeSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        for (Loop loop: root.walk(Loop.class)) {
          if (loopType.equals(loop.getLoopType()) &&
              !insideLoopOfType(loop, loopType)) {
            result.add(loop);
          }
        }
        return result;
      }

      @Override
      public String describe() {
        return "outermost loops of type '" + loopType + "'";
      }
    };
  }

  private static boolean insideLoopOfType(Loop loop, String loopType) {
    Loop outer = loop.ancestor(Loop.class);
    while (outer != null) {
      if (loopType.equals(outer.getLoopType())) {
        return true;
      }
      outer = outer.ancestor(Loop.class);
    }
    return false;
  }

  /**
   * Statements making up the body of routines with the given name, or
   * of all routines if name is null
   */
  public static NodeSelector routineBody(final String name) {
    return new NodeSelector() {
      @Override
      public List<Node> select(Node root) {
        List<Node> result = new ArrayList<Node>();
        for (Routine r: root.walk(Routine.class)) {
          if (name == null || r.getName().equalsIgnoreCase(name)) {
            result.addAll(r.children());
          }
        }
        return result;
      }

      @Override
      public String describe() {
        return name == null ? "routine bodies" : "body of " + name;
      }
    };
  }
}
