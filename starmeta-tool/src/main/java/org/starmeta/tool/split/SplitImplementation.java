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
package org.starmeta.tool.split;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarMetadataException;
import org.starmeta.data.StarTable;
import org.starmeta.loader.StarFormatException;
import org.starmeta.loader.StarParser;
import org.starmeta.ops.table.MicrographOperations;
import org.starmeta.serialize.StarWriter;
import org.starmeta.tool.ToolExecutionException;
import org.starmeta.util.PathUtils;

/**
 * Implementation of splitting a STAR file by micrograph.
 *
 * @author Bastian Gloeckle
 */
public class SplitImplementation {
  private static final Logger logger = LoggerFactory.getLogger(SplitImplementation.class);

  private File inputFile;
  private File outputDir;
  private String suffix;

  public SplitImplementation(File inputFile, File outputDir, String suffix) {
    this.inputFile = inputFile;
    this.outputDir = outputDir;
    this.suffix = suffix;
  }

  public void split() throws ToolExecutionException {
    try (AnnotationConfigApplicationContext ctx = StarmetaContext.create()) {
      StarTable table;
      try {
        table = ctx.getBean(StarParser.class).parse(inputFile.toPath());
      } catch (StarFormatException e) {
        throw new ToolExecutionException("Could not read " + inputFile.getAbsolutePath(), e);
      }

      SortedMap<String, StarTable> byMicrograph;
      try {
        byMicrograph = ctx.getBean(MicrographOperations.class).splitByMicrograph(table);
      } catch (StarMetadataException e) {
        throw new ToolExecutionException(e.getMessage(), e);
      }

      Map<String, String> fileNames = new HashMap<>();
      for (String micrograph : byMicrograph.keySet()) {
        String previous = fileNames.put(fileName(micrograph), micrograph);
        if (previous != null)
          throw new ToolExecutionException("Micrographs '" + previous + "' and '" + micrograph
              + "' would both be written to " + fileName(micrograph) + ", not writing anything.");
      }

      StarWriter writer = ctx.getBean(StarWriter.class);
      try {
        Files.createDirectories(outputDir.toPath());
        for (Entry<String, StarTable> e : byMicrograph.entrySet()) {
          Path target = outputDir.toPath().resolve(fileName(e.getKey()));
          Path written = writer.write(target, e.getValue());
          logger.debug("Wrote {} records to {}.", e.getValue().getNumberOfRows(), written);
        }
      } catch (IOException e) {
        throw new ToolExecutionException("Could not write to " + outputDir.getAbsolutePath(), e);
      }
      logger.info("Wrote {} files to {}.", byMicrograph.size(), outputDir.getAbsolutePath());
    }
  }

  private String fileName(String micrographName) {
    String base = PathUtils.basename(micrographName);
    int dot = base.lastIndexOf('.');
    if (dot > 0)
      base = base.substring(0, dot);
    return base + suffix + ".star";
  }
}
