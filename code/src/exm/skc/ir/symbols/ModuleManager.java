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
package exm.skc.ir.symbols;

import java.util.HashMap;
import java.util.Map;

import exm.skc.common.Logging;
import exm.skc.ir.tree.IRTree.Container;

/**
 * Registry of modules that imports can be resolved against.
 */
public class ModuleManager {
  private static ModuleManager instance = null;

  /** Keyed by lower case module name */
  private final Map<String, Container> modules =
                          new HashMap<String, Container>();

  /**
   * @return process-wide registry
   */
  public static synchronized ModuleManager get() {
    if (instance == null) {
      instance = new ModuleManager();
    }
    return instance;
  }

  public void register(Container module) {
    String key = module.getName().toLowerCase();
    if (modules.containsKey(key)) {
      Logging.getSKCLogger().debug("Replacing registered module " + key);
    }
    modules.put(key, module);
  }

  /**
   * @param name
   * @return the module, or null if not registered
   */
  public Container find(String name) {
    return modules.get(name.toLowerCase());
  }

  public void clear() {
    modules.clear();
  }
}
