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

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarMetadataException;
import org.starmeta.data.StarTable;
import org.starmeta.loader.StarFormatException;
import org.starmeta.loader.StarParser;
import org.starmeta.ops.table.AngleOperations;
import org.starmeta.ops.table.ClassOperations;
import org.starmeta.ops.table.MicrographOperations;
import org.starmeta.ops.table.OriginOperations;
import org.starmeta.ops.table.ScalingOperations;
import org.starmeta.serialize.StarWriter;
import org.starmeta.tool.ToolExecutionException;

/**
 * Applies a sequence of table operations to a STAR file.
 * 
 * <p>
 * The operations are executed in the order they have been registered.
 *
 * @author Bastian Gloeckle
 */
public class StarImplementation {
  private static final Logger logger = LoggerFactory.getLogger(StarImplementation.class);

  private File inputFile;
  private File outputFile;
  private List<TableStep> steps = new ArrayList<>();
  private boolean sortRecords = false;
  private boolean simplify = true;

  public StarImplementation(File inputFile, File outputFile) {
    this.inputFile = inputFile;
    this.outputFile = outputFile;
  }

  public StarImplementation selectClasses(List<? extends Number> classes) {
    steps.add((ctx, table) -> ctx.getBean(ClassOperations.class).selectByClass(table, classes));
    return this;
  }

  public StarImplementation allSameClass() {
    steps.add((ctx, table) -> ctx.getBean(ClassOperations.class).allSameClass(table));
    return this;
  }

  public StarImplementation scaleCoordinates(double factor) {
    steps.add((ctx, table) -> ctx.getBean(ScalingOperations.class).scaleCoordinates(table, factor, true));
    return this;
  }

  public StarImplementation scaleOrigins(double factor) {
    steps.add((ctx, table) -> ctx.getBean(ScalingOperations.class).scaleOrigins(table, factor, true));
    return this;
  }

  public StarImplementation scaleMagnification(double factor) {
    steps.add((ctx, table) -> ctx.getBean(ScalingOperations.class).scaleMagnification(table, factor, true));
    return this;
  }

  public StarImplementation recenter(boolean fractional) {
    if (fractional)
      steps.add((ctx, table) -> ctx.getBean(OriginOperations.class).recenterFractional(table, true));
    else
      steps.add((ctx, table) -> ctx.getBean(OriginOperations.class).recenter(table, true));
    return this;
  }

  public StarImplementation zeroOrigins() {
    steps.add((ctx, table) -> ctx.getBean(OriginOperations.class).zeroOrigins(table, true));
    return this;
  }

  public StarImplementation invertHandedness() {
    steps.add((ctx, table) -> ctx.getBean(AngleOperations.class).invertHandedness(table, true));
    return this;
  }

  public StarImplementation micrographPath(String directory) {
    steps.add((ctx, table) -> ctx.getBean(MicrographOperations.class).rebaseMicrographPath(table, directory, true));
    return this;
  }

  public StarImplementation toMicrographs() {
    steps.add((ctx, table) -> ctx.getBean(MicrographOperations.class).aggregateToMicrographs(table));
    return this;
  }

  public StarImplementation sortRecords(boolean sortRecords) {
    this.sortRecords = sortRecords;
    return this;
  }

  public StarImplementation simplify(boolean simplify) {
    this.simplify = simplify;
    return this;
  }

  public void run() throws ToolExecutionException {
    try (AnnotationConfigApplicationContext ctx = StarmetaContext.create()) {
      StarTable table;
      try {
        table = ctx.getBean(StarParser.class).parse(inputFile.toPath());
      } catch (StarFormatException e) {
        throw new ToolExecutionException("Could not read " + inputFile.getAbsolutePath(), e);
      }
      logger.info("Read {} records from {}.", table.getNumberOfRows(), inputFile.getAbsolutePath());

      for (TableStep step : steps) {
        try {
          table = step.apply(ctx, table);
        } catch (StarMetadataException e) {
          throw new ToolExecutionException(e.getMessage(), e);
        }
      }

      try {
        Path written = ctx.getBean(StarWriter.class).write(outputFile.toPath(), table, true, sortRecords, simplify);
        logger.info("Wrote {} records to {}.", table.getNumberOfRows(), written);
      } catch (IOException e) {
        throw new ToolExecutionException("Could not write " + outputFile.getAbsolutePath(), e);
      }
    }
  }

  private static interface TableStep {
    StarTable apply(ApplicationContext ctx, StarTable table) throws StarMetadataException;
  }
}
