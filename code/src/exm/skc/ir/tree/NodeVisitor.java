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

import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.tree.Directives.ExtractNode;
import exm.skc.ir.tree.Directives.RegionDirective;
import exm.skc.ir.tree.Directives.StandaloneDirective;
import exm.skc.ir.tree.Expressions.ArrayReference;
import exm.skc.ir.tree.Expressions.BinaryOperation;
import exm.skc.ir.tree.Expressions.Literal;
import exm.skc.ir.tree.Expressions.Member;
import exm.skc.ir.tree.Expressions.NaryOperation;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.Expressions.StructureReference;
import exm.skc.ir.tree.Expressions.UnaryOperation;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Statements.Assignment;
import exm.skc.ir.tree.Statements.Call;
import exm.skc.ir.tree.Statements.IfBlock;

/**
 * One method per {@link NodeKind}.  Adding a kind means every
 * implementation has to handle it before it compiles again.
 *
 * @param <T> result of visiting a node
 */
public interface NodeVisitor<T> {
  T visitAssignment(Assignment node) throws VisitorError;
  T visitReference(Reference node) throws VisitorError;
  T visitArrayReference(ArrayReference node) throws VisitorError;
  T visitStructureReference(StructureReference node) throws VisitorError;
  T visitMember(Member node) throws VisitorError;
  T visitLiteral(Literal node) throws VisitorError;
  T visitUnaryOperation(UnaryOperation node) throws VisitorError;
  T visitBinaryOperation(BinaryOperation node) throws VisitorError;
  T visitNaryOperation(NaryOperation node) throws VisitorError;
  T visitLoop(Loop node) throws VisitorError;
  T visitIfBlock(IfBlock node) throws VisitorError;
  T visitCall(Call node) throws VisitorError;
  T visitSchedule(Schedule node) throws VisitorError;
  T visitRegionDirective(RegionDirective node) throws VisitorError;
  T visitStandaloneDirective(StandaloneDirective node) throws VisitorError;
  T visitExtractNode(ExtractNode node) throws VisitorError;
  T visitCodeBlock(CodeBlock node) throws VisitorError;
  T visitRoutine(Routine node) throws VisitorError;
  T visitContainer(Container node) throws VisitorError;
}
