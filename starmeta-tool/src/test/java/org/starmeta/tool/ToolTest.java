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
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Tool}.
 *
 * @author Bastian Gloeckle
 */
public class ToolTest {
  @Test
  public void allFunctionsFound() throws IOException, ReflectiveOperationException {
    // WHEN
    Map<String, ToolFunction> functions = Tool.findToolFunctions();

    // THEN
    Assert.assertEquals(functions.keySet().toString(), "[info, merge, split, star, transform, version]");
  }

  @Test(expectedExceptions = ToolExecutionException.class)
  public void missingInputFails() throws IOException, ReflectiveOperationException {
    // GIVEN
    ToolFunction info = Tool.findToolFunctions().get("info");

    // WHEN
    info.execute(new String[] { "-i", "/does/not/exist.star" });

    // THEN: exception
  }
}
