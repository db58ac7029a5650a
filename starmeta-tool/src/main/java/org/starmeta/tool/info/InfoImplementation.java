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
package org.starmeta.tool.info;

import java.io.File;
import java.util.HashSet;
import java.util.OptionalDouble;
import java.util.Set;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.TableInfo;
import org.starmeta.data.schema.StarField;
import org.starmeta.loader.StarFormatException;
import org.starmeta.loader.StarParser;
import org.starmeta.ops.transform.PixelSize;
import org.starmeta.tool.ToolExecutionException;

/**
 * Prints information about a single STAR file to stdout.
 *
 * @author Bastian Gloeckle
 */
public class InfoImplementation {
  private File inputFile;

  public InfoImplementation(File inputFile) {
    this.inputFile = inputFile;
  }

  public void printInfo() throws ToolExecutionException {
    try (AnnotationConfigApplicationContext ctx = StarmetaContext.create()) {
      StarParser parser = ctx.getBean(StarParser.class);

      StarTable table;
      try {
        table = parser.parse(inputFile.toPath(), false, false, null);
      } catch (StarFormatException e) {
        throw new ToolExecutionException("Could not read " + inputFile.getAbsolutePath(), e);
      }

      System.out.println("File: " + inputFile.getAbsolutePath());
      System.out.println("Type: " + (TableInfo.isParticleTable(table) ? "particles" : "micrographs"));
      System.out.println("Records: " + table.getNumberOfRows());

      if (table.hasColumn(StarField.MICROGRAPH_NAME)) {
        StarColumn micrographs = table.getColumn(StarField.MICROGRAPH_NAME);
        Set<String> distinct = new HashSet<>();
        for (int row = 0; row < micrographs.size(); row++)
          if (!micrographs.isMissing(row))
            distinct.add(micrographs.getString(row));
        System.out.println("Micrographs: " + distinct.size());
      }

      OptionalDouble pixelSize = PixelSize.calculatePixelSize(table);
      if (pixelSize.isPresent())
        System.out.println("Pixel size: " + pixelSize.getAsDouble() + " A");

      System.out.println("Fields:");
      for (StarColumn col : table.getColumns())
        System.out.println("  " + col.getName() + " (" + col.getType() + ")");
    }
  }
}
