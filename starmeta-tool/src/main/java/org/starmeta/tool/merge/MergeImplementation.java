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
package org.starmeta.tool.merge;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarMetadataException;
import org.starmeta.data.StarTable;
import org.starmeta.loader.StarFormatException;
import org.starmeta.loader.StarParser;
import org.starmeta.ops.merge.MergeKey;
import org.starmeta.ops.merge.MergeKeyInference;
import org.starmeta.ops.merge.StarMerger;
import org.starmeta.serialize.StarWriter;
import org.starmeta.tool.ToolExecutionException;

/**
 * Implementation of merging fields of a secondary STAR file into a primary one.
 *
 * @author Bastian Gloeckle
 */
public class MergeImplementation {
  private static final Logger logger = LoggerFactory.getLogger(MergeImplementation.class);

  private File primaryFile;
  private File secondaryFile;
  private File outputFile;
  private List<String> fields;
  private MergeKey key;
  private MergeKey leftKey;
  private Double threshold;

  public MergeImplementation(File primaryFile, File secondaryFile, File outputFile, List<String> fields,
      MergeKey key, MergeKey leftKey, Double threshold) {
    this.primaryFile = primaryFile;
    this.secondaryFile = secondaryFile;
    this.outputFile = outputFile;
    this.fields = fields;
    this.key = key;
    this.leftKey = leftKey;
    this.threshold = threshold;
  }

  public void merge() throws ToolExecutionException {
    try (AnnotationConfigApplicationContext ctx = StarmetaContext.create()) {
      StarParser parser = ctx.getBean(StarParser.class);
      StarMerger merger = ctx.getBean(StarMerger.class);
      StarWriter writer = ctx.getBean(StarWriter.class);

      StarTable primary = read(parser, primaryFile);
      StarTable secondary = read(parser, secondaryFile);

      if (key == null && threshold != null) {
        Optional<MergeKey> inferred = ctx.getBean(MergeKeyInference.class).inferKey(primary, secondary, threshold);
        if (inferred.isPresent())
          key = inferred.get();
        else
          logger.warn("No merge key found with threshold {}.", threshold);
      }

      StarTable merged;
      try {
        merged = merger.merge(primary, secondary, fields, key, leftKey);
      } catch (StarMetadataException | IllegalArgumentException e) {
        throw new ToolExecutionException("Could not merge: " + e.getMessage(), e);
      }

      try {
        Path written = writer.write(outputFile.toPath(), merged);
        logger.info("Wrote {} records to {}.", merged.getNumberOfRows(), written);
      } catch (IOException e) {
        throw new ToolExecutionException("Could not write " + outputFile.getAbsolutePath(), e);
      }
    }
  }

  private StarTable read(StarParser parser, File file) throws ToolExecutionException {
    try {
      return parser.parse(file.toPath());
    } catch (StarFormatException e) {
      throw new ToolExecutionException("Could not read " + file.getAbsolutePath(), e);
    }
  }
}
