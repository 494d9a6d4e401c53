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

/**
 * The closed set of IR node kinds.  Every backend handles each of these,
 * see {@link NodeVisitor}.
 */
public enum NodeKind {
  ASSIGNMENT,
  REFERENCE,
  ARRAY_REFERENCE,
  STRUCTURE_REFERENCE,
  MEMBER,
  LITERAL,
  UNARY_OPERATION,
  BINARY_OPERATION,
  NARY_OPERATION,
  LOOP,
  IF_BLOCK,
  CALL,
  SCHEDULE,
  REGION_DIRECTIVE,
  STANDALONE_DIRECTIVE,
  EXTRACT_REGION,
  CODE_BLOCK,
  ROUTINE,
  CONTAINER;
}
