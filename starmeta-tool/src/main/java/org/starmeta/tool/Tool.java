/**
 * starmeta: STAR metadata toolkit.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of starmeta.
 *
 * starmeta is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.starmeta.tool;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.reflect.ClassPath;
import com.google.common.reflect.ClassPath.ClassInfo;

/**
 * Main class of starmeta tool, which provides command line functions to work with STAR files.
 *
 * @author Bastian Gloeckle
 */
public class Tool implements ToolFunction {
  private static final String BASE_PKG = "org.starmeta.tool";

  private static final Logger logger = LoggerFactory.getLogger(Tool.class);

  public static void main(String[] args) throws IOException, ReflectiveOperationException {
    Tool tool = new Tool(findToolFunctions());
    try {
      tool.execute(args);
    } catch (ToolExecutionException e) {
      logger.error(e.getMessage(), e.getCause());
      System.exit(1);
    }
  }

  /**
   * @return All {@link ToolFunction}s on the classpath by their name.
   */
  public static Map<String, ToolFunction> findToolFunctions() throws IOException, ReflectiveOperationException {
    Collection<ClassInfo> classInfos =
        ClassPath.from(Tool.class.getClassLoader()).getTopLevelClassesRecursive(BASE_PKG);

    Map<String, ToolFunction> toolFunctions = new TreeMap<>();

    for (ClassInfo classInfo : classInfos) {
      Class<?> clazz = classInfo.load();
      ToolFunctionName toolFunctionName = clazz.getAnnotation(ToolFunctionName.class);
      if (toolFunctionName != null) {
        ToolFunction functionInstance;
        try {
          functionInstance = (ToolFunction) clazz.getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException e) {
          throw new IllegalStateException("Could not instantiate " + clazz.getName(), e);
        }
        toolFunctions.put(toolFunctionName.value(), functionInstance);
      }
    }
    return toolFunctions;
  }

  private Map<String, ToolFunction> toolFunctions;

  private Tool(Map<String, ToolFunction> toolFunctions) {
    this.toolFunctions = toolFunctions;
  }

  @Override
  public void execute(String[] args) throws ToolExecutionException {
    if (args.length == 0 || !toolFunctions.containsKey(args[0])) {
      logger.error("No function name given or function unknown. Available functions: {}", toolFunctions.keySet());
      System.out.println();
      System.out.println("Copyright (C) 2015 Bastian Gloeckle");
      System.out.println();
      System.out.println(
          "starmeta is free software: you can redistribute it and/or modify it under the terms of the GNU Affero "
              + "General Public License as published by the Free Software Foundation, either version 3 of the License, or "
              + "(at your option) any later version. This program is distributed in the hope that it will be useful, but "
              + "WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR "
              + "PURPOSE. See the GNU Affero General Public License for more details.");
      throw new ToolExecutionException("No valid function given.");
    }

    String[] remainingArgs = new String[args.length - 1];
    for (int i = 0; i < args.length - 1; i++)
      remainingArgs[i] = args[i + 1];

    toolFunctions.get(args[0]).execute(remainingArgs);
  }
}
