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
package org.starmeta.tool.star;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;
import org.starmeta.loader.StarFormatException;
import org.starmeta.loader.StarParser;
import org.starmeta.tool.ToolExecutionException;
import org.starmeta.tool.ToolTestFiles;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Runs the {@link Star} function on files.
 *
 * @author Bastian Gloeckle
 */
public class StarTest {
  private ToolTestFiles files;

  private AnnotationConfigApplicationContext dataContext;

  private StarParser parser;

  @BeforeMethod
  public void setUp() throws IOException {
    files = new ToolTestFiles();
    dataContext = StarmetaContext.create();
    parser = dataContext.getBean(StarParser.class);
  }

  @AfterMethod
  public void shutDown() throws IOException {
    dataContext.close();
    files.close();
  }

  @Test
  public void selectClass() throws URISyntaxException, StarFormatException {
    // GIVEN
    Path out = files.temp("class1.star");

    // WHEN
    new Star().execute(new String[] { "-i", files.resource(ToolTestFiles.PARTICLES_CLASSPATH), "-o", out.toString(),
        "-c", "1" });

    // THEN
    StarTable res = parser.parse(out);
    Assert.assertEquals(res.getNumberOfRows(), 2);
    StarColumn classes = res.getColumn(StarField.CLASS);
    Assert.assertEquals(classes.getLong(0), 1L);
    Assert.assertEquals(classes.getLong(1), 1L);
    Assert.assertEquals(res.getColumn(StarField.COORDX).getDouble(1), 348., 1e-6, "Expected record order to be kept");
  }

  @Test
  public void zeroOriginsKeepsParticlePosition() throws URISyntaxException, StarFormatException {
    // GIVEN
    Path out = files.temp("zero");

    // WHEN
    new Star().execute(new String[] { "-i", files.resource(ToolTestFiles.PARTICLES_CLASSPATH), "-o", out.toString(),
        "--zero-origins" });

    // THEN
    StarTable res = parser.parse(files.temp("zero.star"));
    Assert.assertEquals(res.getNumberOfRows(), 4);
    Assert.assertEquals(res.getColumn(StarField.ORIGINX).getDouble(0), 0., 1e-6);
    Assert.assertEquals(res.getColumn(StarField.ORIGINY).getDouble(0), 0., 1e-6);
    Assert.assertEquals(res.getColumn(StarField.COORDX).getDouble(0), 1210. - 1.325, 1e-6);
    Assert.assertEquals(res.getColumn(StarField.COORDY).getDouble(0), 1876. + 2.675, 1e-6);
  }

  @Test
  public void toMicrographs() throws URISyntaxException, StarFormatException {
    // GIVEN
    Path out = files.temp("mics.star");

    // WHEN
    new Star().execute(new String[] { "-i", files.resource(ToolTestFiles.PARTICLES_CLASSPATH), "-o", out.toString(),
        "--to-micrographs" });

    // THEN
    StarTable res = parser.parse(out);
    Assert.assertEquals(res.getNumberOfRows(), 2);
    Assert.assertFalse(res.hasColumn(StarField.IMAGE_NAME), "Expected no particle fields");
    Assert.assertTrue(res.hasColumn(StarField.DEFOCUSU));
  }

  @Test(expectedExceptions = ToolExecutionException.class)
  public void unknownClassFails() throws URISyntaxException {
    // WHEN
    new Star().execute(new String[] { "-i", files.resource(ToolTestFiles.PARTICLES_CLASSPATH), "-o",
        files.temp("none.star").toString(), "-c", "7" });

    // THEN: exception
  }
}
