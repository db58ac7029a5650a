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
import java.util.Arrays;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.ops.merge.MergeKey;
import org.starmeta.tool.ToolArgs;
import org.starmeta.tool.ToolExecutionException;
import org.starmeta.tool.ToolFunction;
import org.starmeta.tool.ToolFunctionName;

/**
 * Merges fields of a secondary STAR file into the records of a primary one.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Merge.FUNCTION_NAME)
public class Merge implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Merge.class);

  public static final String FUNCTION_NAME = "merge";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";
  private static final String OPT_SECONDARY = "s";
  private static final String OPT_OUTPUT = "o";
  private static final String OPT_FIELDS = "f";
  private static final String OPT_KEY = "k";
  private static final String OPT_LEFT_KEY = "l";
  private static final String OPT_THRESHOLD = "t";

  @Override
  public void execute(String[] args) throws ToolExecutionException {
    Options cliOpt = createCliOptions();
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = null;
    boolean showHelp = false;
    try {
      cmd = parser.parse(cliOpt, args);
      showHelp |= cmd.hasOption(OPT_HELP);
    } catch (ParseException e) {
      logger.error(e.getMessage());
      showHelp = true;
    }

    if (showHelp) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp(Merge.FUNCTION_NAME + " [options]",
          "\nReads two .star files and copies the given fields of the secondary file into the matching records of "
              + "the primary file. If no key is given, the key is inferred from the fields available in both "
              + "files.\n\n",
          cliOpt, "");
      return;
    }

    File primaryFile = new File(cmd.getOptionValue(OPT_INPUT));
    File secondaryFile = new File(cmd.getOptionValue(OPT_SECONDARY));
    File outputFile = new File(cmd.getOptionValue(OPT_OUTPUT));

    for (File inputFile : Arrays.asList(primaryFile, secondaryFile)) {
      if (!inputFile.isFile() || !inputFile.exists())
        throw new ToolExecutionException(inputFile.getAbsolutePath() + " does not exist or is a directory.");
    }

    if (outputFile.exists() && outputFile.isDirectory())
      throw new ToolExecutionException(outputFile.getAbsolutePath() + " exists and is a directory.");

    List<String> fields = ToolArgs.parseList(String.join(",", cmd.getOptionValues(OPT_FIELDS)));
    MergeKey key = cmd.hasOption(OPT_KEY) ? MergeKey.of(ToolArgs.parseList(cmd.getOptionValue(OPT_KEY))) : null;
    MergeKey leftKey =
        cmd.hasOption(OPT_LEFT_KEY) ? MergeKey.of(ToolArgs.parseList(cmd.getOptionValue(OPT_LEFT_KEY))) : null;
    if (leftKey != null && key == null)
      throw new ToolExecutionException("A primary key can only be given together with a key.");
    Double threshold =
        cmd.hasOption(OPT_THRESHOLD) ? ToolArgs.parseDouble(OPT_THRESHOLD, cmd.getOptionValue(OPT_THRESHOLD)) : null;

    new MergeImplementation(primaryFile, secondaryFile, outputFile, fields, key, leftKey, threshold).merge();
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("file")
        .desc("The primary .star file whose records are kept (required).").required().build());
    res.addOption(Option.builder(OPT_SECONDARY).longOpt("secondary").numberOfArgs(1).argName("file")
        .desc("The secondary .star file providing the fields (required).").required().build());
    res.addOption(Option.builder(OPT_OUTPUT).longOpt("output").numberOfArgs(1).argName("file")
        .desc("Output file name (required).").required().build());
    res.addOption(Option.builder(OPT_FIELDS).longOpt("fields").numberOfArgs(Option.UNLIMITED_VALUES)
        .argName("field> <field> <...").desc("The fields to copy from the secondary file (required).").required()
        .build());
    res.addOption(Option.builder(OPT_KEY).longOpt("key").numberOfArgs(1).argName("field,field,...")
        .desc("Comma separated fields to match records on. Inferred if not given.").build());
    res.addOption(Option.builder(OPT_LEFT_KEY).longOpt("primary-key").numberOfArgs(1).argName("field,field,...")
        .desc("Comma separated fields of the primary file to match the key against. Defaults to the key.").build());
    res.addOption(Option.builder(OPT_THRESHOLD).longOpt("threshold").numberOfArgs(1).argName("fraction")
        .desc("Fraction of primary records that must match for a key to be inferred.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
