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
package org.starmeta.tool.transform;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarMetadataException;
import org.starmeta.data.StarTable;
import org.starmeta.loader.StarFormatException;
import org.starmeta.loader.StarParser;
import org.starmeta.ops.transform.GeometricTransformer;
import org.starmeta.ops.transform.Translation;
import org.starmeta.serialize.StarWriter;
import org.starmeta.tool.ToolExecutionException;

/**
 * Implementation of transforming all particles of a STAR file.
 *
 * @author Bastian Gloeckle
 */
public class TransformImplementation {
  private static final Logger logger = LoggerFactory.getLogger(TransformImplementation.class);

  private File inputFile;
  private File outputFile;
  private RealMatrix rotation;
  private Translation translation;
  private boolean invert;
  private boolean rotate;
  private boolean adjustDefocus;

  public TransformImplementation(File inputFile, File outputFile, RealMatrix rotation, Translation translation,
      boolean invert, boolean rotate, boolean adjustDefocus) {
    this.inputFile = inputFile;
    this.outputFile = outputFile;
    this.rotation = rotation;
    this.translation = translation;
    this.invert = invert;
    this.rotate = rotate;
    this.adjustDefocus = adjustDefocus;
  }

  public void transform() throws ToolExecutionException {
    try (AnnotationConfigApplicationContext ctx = StarmetaContext.create()) {
      StarTable table;
      try {
        table = ctx.getBean(StarParser.class).parse(inputFile.toPath());
      } catch (StarFormatException e) {
        throw new ToolExecutionException("Could not read " + inputFile.getAbsolutePath(), e);
      }

      logger.info("Transforming {} records with rotation {} and translation {}.", table.getNumberOfRows(), rotation,
          translation);
      try {
        table = ctx.getBean(GeometricTransformer.class).transform(table, rotation, translation, invert, rotate,
            adjustDefocus, null, true);
      } catch (StarMetadataException | IllegalArgumentException e) {
        throw new ToolExecutionException("Could not transform: " + e.getMessage(), e);
      }

      try {
        Path written = ctx.getBean(StarWriter.class).write(outputFile.toPath(), table);
        logger.info("Wrote {} records to {}.", table.getNumberOfRows(), written);
      } catch (IOException e) {
        throw new ToolExecutionException("Could not write " + outputFile.getAbsolutePath(), e);
      }
    }
  }
}
