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
import java.util.List;
import java.util.Map;

import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolTable;

/**
 * Statement and expression bases, and the block-level nodes of the IR:
 * schedules, routines, containers and code blocks.
 */
public class IRTree {

  /**
   * Node that can appear in a schedule
   */
  public static abstract class Statement extends Node {
  }

  /**
   * Node that produces a value
   */
  public static abstract class Expression extends Node {
  }

  /**
   * Ordered sequence of statements
   */
  public static class Schedule extends Node {

    public Schedule() {
    }

    public static Schedule create(List<? extends Statement> statements) {
      Schedule s = new Schedule();
      for (Statement stmt: statements) {
        s.addChild(stmt);
      }
      return s;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SCHEDULE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitSchedule(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return child instanceof Statement;
    }

    @Override
    protected String childrenFormat() {
      return "[Statement]*";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Schedule();
    }

    public List<Statement> statements() {
      List<Statement> result = new ArrayList<Statement>();
      for (Node child: children()) {
        result.add((Statement)child);
      }
      return result;
    }

    public boolean isEmpty() {
      return numChildren() == 0;
    }

    /**
     * @return true if n can be used as the body of a compound statement
     */
    public static boolean isBody(Node n) {
      return n instanceof Schedule && !(n instanceof ScopingNode);
    }
  }

  /**
   * Subroutine or main program.  Owns the symbol table of its body.
   */
  public static class Routine extends Schedule implements ScopingNode {
    private final String name;
    private final boolean isProgram;
    private final SymbolTable symbolTable;

    public Routine(String name) {
      this(name, false, new SymbolTable());
    }

    public Routine(String name, boolean isProgram) {
      this(name, isProgram, new SymbolTable());
    }

    public Routine(String name, boolean isProgram, SymbolTable symbolTable) {
      this.name = name;
      this.isProgram = isProgram;
      this.symbolTable = symbolTable;
      symbolTable.attach(this);
    }

    public static Routine create(String name, SymbolTable table,
                                 List<? extends Statement> statements) {
      Routine r = new Routine(name, false, table);
      for (Statement stmt: statements) {
        r.addChild(stmt);
      }
      return r;
    }

    public String getName() {
      return name;
    }

    public boolean isProgram() {
      return isProgram;
    }

    @Override
    public SymbolTable getSymbolTable() {
      return symbolTable;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ROUTINE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitRoutine(this);
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Routine(name, isProgram, symbolTable.deepCopy(remap));
    }

    @Override
    protected boolean sameAttributes(Node other) {
      Routine o = (Routine)other;
      return name.equalsIgnoreCase(o.name) && isProgram == o.isProgram;
    }

    @Override
    public String describe() {
      return "Routine[name='" + name + "']";
    }
  }

  /**
   * Module, or (with an empty name) the file holding top level
   * program units
   */
  public static class Container extends Node implements ScopingNode {
    private final String name;
    private final SymbolTable symbolTable;

    public Container(String name) {
      this(name, new SymbolTable());
    }

    public Container(String name, SymbolTable symbolTable) {
      this.name = name;
      this.symbolTable = symbolTable;
      symbolTable.attach(this);
    }

    public static Container createFile(List<? extends Node> units) {
      Container file = new Container("");
      for (Node unit: units) {
        file.addChild(unit);
      }
      return file;
    }

    public String getName() {
      return name;
    }

    public boolean isFile() {
      return name.length() == 0;
    }

    @Override
    public SymbolTable getSymbolTable() {
      return symbolTable;
    }

    public List<Routine> getRoutines() {
      List<Routine> result = new ArrayList<Routine>();
      for (Node child: children()) {
        if (child instanceof Routine) {
          result.add((Routine)child);
        }
      }
      return result;
    }

    /**
     * @return routine with name, or null
     */
    public Routine findRoutine(String routineName) {
      for (Routine r: getRoutines()) {
        if (r.getName().equalsIgnoreCase(routineName)) {
          return r;
        }
      }
      return null;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONTAINER;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitContainer(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return child instanceof Routine || child instanceof Container;
    }

    @Override
    protected String childrenFormat() {
      return "[Container | Routine]*";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new Container(name, symbolTable.deepCopy(remap));
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return name.equalsIgnoreCase(((Container)other).name);
    }

    @Override
    public String describe() {
      return isFile() ? "Container[file]" : "Container[name='" + name + "']";
    }
  }

  /**
   * Source that the IR doesn't model, kept verbatim
   */
  public static class CodeBlock extends Statement {
    private final List<String> lines;

    public CodeBlock(List<String> lines) {
      this.lines = Collections.unmodifiableList(new ArrayList<String>(lines));
    }

    public List<String> getLines() {
      return lines;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CODE_BLOCK;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitCodeBlock(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return false;
    }

    @Override
    protected int maxChildren() {
      return 0;
    }

    @Override
    protected String childrenFormat() {
      return "<LeafNode>";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new CodeBlock(lines);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return lines.equals(((CodeBlock)other).lines);
    }

    @Override
    public String describe() {
      return "CodeBlock[" + lines.size() + " lines]";
    }
  }
}
