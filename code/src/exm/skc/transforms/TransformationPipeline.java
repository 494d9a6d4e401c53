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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.skc.backend.FortranWriter;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.Validator;

/**
 * Applies a sequence of transformations to a tree.  Each step selects
 * its target nodes, then applies its transformation to each of them in
 * turn, or to all of them at once as one region.
 */
public class TransformationPipeline {

  public static class Step {
    private final Transformation transformation;
    private final NodeSelector selector;
    private final TransformOptions options;
    private final boolean asRegion;

    public Step(Transformation transformation, NodeSelector selector,
                TransformOptions options, boolean asRegion) {
      if (asRegion && !(transformation instanceof RegionTrans)) {
        throw new IllegalArgumentException(transformation.getName() +
                            " can't be applied to a region of nodes");
      }
      this.transformation = transformation;
      this.selector = selector;
      this.options = options;
      this.asRegion = asRegion;
    }

    public Transformation getTransformation() {
      return transformation;
    }

    public NodeSelector getSelector() {
      return selector;
    }

    public boolean isRegion() {
      return asRegion;
    }

    @Override
    public String toString() {
      return transformation.getName() + " on " + selector.describe() +
             (asRegion ? " as one region" : "") + " with " + options;
    }
  }

  private final List<Step> steps = new ArrayList<Step>();
  private final PrintStream irOutput;

  public TransformationPipeline() {
    this(null);
  }

  /**
   * @param irOutput if not null, Fortran for the tree is written here
   *        after every step
   */
  public TransformationPipeline(PrintStream irOutput) {
    this.irOutput = irOutput;
  }

  public TransformationPipeline add(Transformation transformation,
              NodeSelector selector, TransformOptions options) {
    steps.add(new Step(transformation, selector, options, false));
    return this;
  }

  public TransformationPipeline addRegion(RegionTrans transformation,
              NodeSelector selector, TransformOptions options) {
    steps.add(new Step(transformation, selector, options, true));
    return this;
  }

  public List<Step> getSteps() {
    return steps;
  }

  public void run(Logger logger, Node root) throws TransformationError {
    boolean validate = Settings.getBooleanUnchecked(Settings.VALIDATE_IR);
    int stepNum = 0;
    for (Step step: steps) {
      stepNum++;
      List<Node> targets = step.selector.select(root);
      logger.debug("Step: " + stepNum + " " + step + ": " +
                   targets.size() + " target(s)");
      if (targets.isEmpty()) {
        continue;
      }
      if (step.asRegion) {
        ((RegionTrans)step.transformation).apply(targets, step.options);
      } else {
        for (Node target: targets) {
          step.transformation.apply(target, step.options);
        }
      }
      if (validate) {
        Validator.validate(logger, root);
      }
      if (irOutput != null) {
        logIR(root, "Tree after step " + stepNum + ": " +
                    step.transformation.getName());
      }
    }
  }

  private void logIR(Node root, String title) {
    irOutput.println("! " + title);
    try {
      irOutput.print(new FortranWriter(true, "  ", 0).emit(root));
    } catch (VisitorError e) {
      // Lenient writer only fails on broken trees
      irOutput.println("! Could not write tree: " + e.getMessage());
    }
  }
}
