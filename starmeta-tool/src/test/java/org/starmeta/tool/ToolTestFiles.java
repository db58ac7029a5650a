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

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Access to the STAR files available to tool tests and a temporary directory to write to.
 *
 * @author Bastian Gloeckle
 */
public class ToolTestFiles implements AutoCloseable {
  public static final String PARTICLES_CLASSPATH = "/particles.star";
  public static final String MICROGRAPHS_CLASSPATH = "/micrographs.star";

  private Path tempDir;

  public ToolTestFiles() throws IOException {
    tempDir = Files.createTempDirectory("starmeta-tool");
  }

  public String resource(String classpathLocation) throws URISyntaxException {
    return new File(ToolTestFiles.class.getResource(classpathLocation).toURI()).getAbsolutePath();
  }

  public Path temp(String name) {
    return tempDir.resolve(name);
  }

  @Override
  public void close() throws IOException {
    try (Stream<Path> paths = Files.walk(tempDir)) {
      for (Path p : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator)
        Files.delete(p);
    }
  }
}
