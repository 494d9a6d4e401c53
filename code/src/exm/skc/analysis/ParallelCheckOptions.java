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
package exm.skc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.skc.ir.access.Signature;
import exm.skc.ir.access.VariablesAccessInfo;

/**
 * Options for {@link DependencyTools#canLoopBeParallelised}.
 * Setters return this so options can be chained.
 */
public class ParallelCheckOptions {

  /** Null: use the variable of the loop being checked */
  private String loopVariable = null;
  private boolean onlyNestedLoops = true;
  private boolean testAllVariables = false;
  private List<Signature> signaturesToIgnore = new ArrayList<Signature>();
  /** Null: collect from the loop */
  private VariablesAccessInfo accesses = null;

  public ParallelCheckOptions() {
  }

  public String getLoopVariable() {
    return loopVariable;
  }

  public ParallelCheckOptions setLoopVariable(String loopVariable) {
    this.loopVariable = loopVariable;
    return this;
  }

  /**
   * If true, a loop needs an inner loop to be considered worth
   * parallelising
   */
  public boolean isOnlyNestedLoops() {
    return onlyNestedLoops;
  }

  public ParallelCheckOptions setOnlyNestedLoops(boolean onlyNestedLoops) {
    this.onlyNestedLoops = onlyNestedLoops;
    return this;
  }

  /**
   * If true, check every variable and report all problems, otherwise
   * stop at the first variable that prevents parallelisation
   */
  public boolean isTestAllVariables() {
    return testAllVariables;
  }

  public ParallelCheckOptions setTestAllVariables(boolean testAllVariables) {
    this.testAllVariables = testAllVariables;
    return this;
  }

  public List<Signature> getSignaturesToIgnore() {
    return Collections.unmodifiableList(signaturesToIgnore);
  }

  public ParallelCheckOptions setSignaturesToIgnore(
                                      List<Signature> signatures) {
    this.signaturesToIgnore = new ArrayList<Signature>(signatures);
    return this;
  }

  public ParallelCheckOptions ignore(Signature signature) {
    this.signaturesToIgnore.add(signature);
    return this;
  }

  public VariablesAccessInfo getAccesses() {
    return accesses;
  }

  /**
   * @param accesses precomputed accesses of the loop
   */
  public ParallelCheckOptions setAccesses(VariablesAccessInfo accesses) {
    this.accesses = accesses;
    return this;
  }
}
