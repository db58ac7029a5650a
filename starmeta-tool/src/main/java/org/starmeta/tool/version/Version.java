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
package org.starmeta.tool.version;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.starmeta.tool.ToolExecutionException;
import org.starmeta.tool.ToolFunction;
import org.starmeta.tool.ToolFunctionName;

/**
 * Prints version information.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Version.FUNCTION_NAME)
public class Version implements ToolFunction {
  public static final String FUNCTION_NAME = "version";

  private static final String VERSION_RESOURCE = "/starmeta-tool.properties";

  @Override
  public void execute(String[] args) throws ToolExecutionException {
    System.out.println("starmeta-tool " + readVersion());
    System.out.println();
    System.out.println("Copyright (C) 2015 Bastian Gloeckle");
    System.out.println();
    System.out.println("starmeta is free software: you can redistribute it and/or modify it under the terms of the "
        + "GNU Affero General Public License as published by the Free Software Foundation, either version 3 of the "
        + "License, or (at your option) any later version.");
  }

  /* package */ String readVersion() throws ToolExecutionException {
    Properties props = new Properties();
    try (InputStream is = Version.class.getResourceAsStream(VERSION_RESOURCE)) {
      if (is == null)
        throw new ToolExecutionException("Resource " + VERSION_RESOURCE + " not available.");
      props.load(is);
    } catch (IOException e) {
      throw new ToolExecutionException("Could not read " + VERSION_RESOURCE, e);
    }
    return props.getProperty("version", "unknown");
  }
}
