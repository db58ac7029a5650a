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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.tool.ToolExecutionException;
import org.starmeta.tool.ToolFunction;
import org.starmeta.tool.ToolFunctionName;

/**
 * Splits a particle STAR file into one file per micrograph.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Split.FUNCTION_NAME)
public class Split implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Split.class);

  public static final String FUNCTION_NAME = "split";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";
  private static final String OPT_OUTPUT_DIR = "o";
  private static final String OPT_SUFFIX = "s";

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
      formatter.printHelp(Split.FUNCTION_NAME + " [options]",
          "\nReads a .star file and writes the particles of each micrograph into a separate .star file named after "
              + "the micrograph.\n\n",
          cliOpt, "");
      return;
    }

    File inputFile = new File(cmd.getOptionValue(OPT_INPUT));
    File outputDir = new File(cmd.getOptionValue(OPT_OUTPUT_DIR));

    if (!inputFile.isFile() || !inputFile.exists())
      throw new ToolExecutionException(inputFile.getAbsolutePath() + " does not exist or is a directory.");
    if (outputDir.exists() && !outputDir.isDirectory())
      throw new ToolExecutionException(outputDir.getAbsolutePath() + " exists and is not a directory.");

    new SplitImplementation(inputFile, outputDir, cmd.getOptionValue(OPT_SUFFIX, "")).split();
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("file")
        .desc("The input .star file (required).").required().build());
    res.addOption(Option.builder(OPT_OUTPUT_DIR).longOpt("output").numberOfArgs(1).argName("dir")
        .desc("Output directory, created if it does not exist (required).").required().build());
    res.addOption(Option.builder(OPT_SUFFIX).longOpt("suffix").numberOfArgs(1).argName("string")
        .desc("Suffix to append to the name of each output file.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
