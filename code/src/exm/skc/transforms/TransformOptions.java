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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import exm.skc.common.exceptions.TransformationError;

/**
 * Named option values passed to a transformation.  Values are
 * Boolean, Integer or String; the typed getters reject anything else.
 */
public class TransformOptions {

  private final Map<String, Object> values =
                              new LinkedHashMap<String, Object>();

  public TransformOptions() {
  }

  public static TransformOptions none() {
    return new TransformOptions();
  }

  public TransformOptions set(String name, boolean value) {
    values.put(name, value);
    return this;
  }

  public TransformOptions set(String name, int value) {
    values.put(name, value);
    return this;
  }

  public TransformOptions set(String name, String value) {
    values.put(name, value);
    return this;
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public Set<String> getNames() {
    return Collections.unmodifiableSet(values.keySet());
  }

  /**
   * @throws TransformationError if an option isn't one of known
   */
  public void checkNames(String transName, Set<String> known)
                                      throws TransformationError {
    for (String name: values.keySet()) {
      if (!known.contains(name)) {
        throw new TransformationError(transName, "unknown option '" + name +
            "', supported options are " + new TreeSet<String>(known));
      }
    }
  }

  public boolean getBoolean(String transName, String name,
                            boolean defaultVal) throws TransformationError {
    Object val = values.get(name);
    if (val == null) {
      return defaultVal;
    } else if (!(val instanceof Boolean)) {
      throw wrongType(transName, name, "a boolean", val);
    }
    return (Boolean)val;
  }

  public int getInt(String transName, String name, int defaultVal)
                                          throws TransformationError {
    Object val = values.get(name);
    if (val == null) {
      return defaultVal;
    } else if (!(val instanceof Integer)) {
      throw wrongType(transName, name, "an integer", val);
    }
    return (Integer)val;
  }

  /**
   * @return value, or defaultVal (which may be null) if not set
   */
  public String getString(String transName, String name, String defaultVal)
                                          throws TransformationError {
    Object val = values.get(name);
    if (val == null) {
      return defaultVal;
    } else if (!(val instanceof String)) {
      throw wrongType(transName, name, "a string", val);
    }
    return (String)val;
  }

  private static TransformationError wrongType(String transName,
                            String name, String expected, Object val) {
    return new TransformationError(transName, "option '" + name +
        "' must be " + expected + " but got '" + val + "' of type " +
        val.getClass().getSimpleName());
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
