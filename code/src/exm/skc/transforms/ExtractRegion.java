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
import java.util.Collections;
import java.util.List;

/**
 * What an extraction records about a region: where it is, its inputs and
 * outputs, and the names used for the recorded data.
 */
public class ExtractRegion {
  private final String moduleName;
  private final String regionName;
  private final String prefix;
  private final List<String> inputs;
  private final List<String> outputs;
  private final String postfix;

  public ExtractRegion(String moduleName, String regionName, String prefix,
          List<String> inputs, List<String> outputs, String postfix) {
    this.moduleName = moduleName;
    this.regionName = regionName;
    this.prefix = prefix;
    this.inputs = Collections.unmodifiableList(
                                    new ArrayList<String>(inputs));
    this.outputs = Collections.unmodifiableList(
                                    new ArrayList<String>(outputs));
    this.postfix = postfix;
  }

  public String getModuleName() {
    return moduleName;
  }

  public String getRegionName() {
    return regionName;
  }

  public String getPrefix() {
    return prefix;
  }

  public List<String> getInputs() {
    return inputs;
  }

  public List<String> getOutputs() {
    return outputs;
  }

  /**
   * Appended to the names of outputs for their values after the region
   */
  public String getPostfix() {
    return postfix;
  }

  /**
   * @return postfix starting with base that doesn't turn any output name
   *        into the name of another input or output: base, then base0,
   *        base1, ...
   */
  public static String choosePostfix(List<String> inputs,
                                     List<String> outputs, String base) {
    List<String> all = new ArrayList<String>(inputs);
    all.addAll(outputs);
    String postfix = base;
    int suffix = 0;
    while (collides(all, outputs, postfix)) {
      postfix = base + suffix;
      suffix++;
    }
    return postfix;
  }

  private static boolean collides(List<String> all, List<String> outputs,
                                  String postfix) {
    for (String out: outputs) {
      if (all.contains(out + postfix)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return moduleName + ":" + regionName + " in: " + inputs + " out: " +
           outputs;
  }
}
