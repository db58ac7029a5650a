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
import java.util.ArrayList;
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
import org.starmeta.tool.ToolArgs;
import org.starmeta.tool.ToolExecutionException;
import org.starmeta.tool.ToolFunction;
import org.starmeta.tool.ToolFunctionName;

/**
 * Reads a STAR file, applies table operations and writes the result.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Star.FUNCTION_NAME)
public class Star implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Star.class);

  public static final String FUNCTION_NAME = "star";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";
  private static final String OPT_OUTPUT = "o";
  private static final String OPT_CLASS = "c";
  private static final String OPT_ALL_SAME_CLASS = "all-same-class";
  private static final String OPT_RECENTER = "recenter";
  private static final String OPT_RECENTER_FRACTIONAL = "recenter-fractional";
  private static final String OPT_ZERO_ORIGINS = "zero-origins";
  private static final String OPT_SCALE_COORDS = "scale-coords";
  private static final String OPT_SCALE_ORIGINS = "scale-origins";
  private static final String OPT_SCALE_MAG = "scale-mag";
  private static final String OPT_INVERT_HAND = "invert-hand";
  private static final String OPT_MICROGRAPH_PATH = "micrograph-path";
  private static final String OPT_TO_MICROGRAPHS = "to-micrographs";
  private static final String OPT_SORT = "sort";
  private static final String OPT_NO_SIMPLIFY = "no-simplify";

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
      formatter.printHelp(Star.FUNCTION_NAME + " [options]",
          "\nReads a .star file, applies the selected operations in the order they are listed below and writes the "
              + "result to a new .star file.\n\n",
          cliOpt, "");
      return;
    }

    File inputFile = new File(cmd.getOptionValue(OPT_INPUT));
    File outputFile = new File(cmd.getOptionValue(OPT_OUTPUT));

    if (!inputFile.isFile() || !inputFile.exists())
      throw new ToolExecutionException(inputFile.getAbsolutePath() + " does not exist or is a directory.");
    if (outputFile.exists() && outputFile.isDirectory())
      throw new ToolExecutionException(outputFile.getAbsolutePath() + " exists and is a directory.");
    if (cmd.hasOption(OPT_RECENTER) && cmd.hasOption(OPT_RECENTER_FRACTIONAL))
      throw new ToolExecutionException("Only one of --" + OPT_RECENTER + " and --" + OPT_RECENTER_FRACTIONAL
          + " can be given.");

    StarImplementation impl = new StarImplementation(inputFile, outputFile);

    if (cmd.hasOption(OPT_CLASS)) {
      List<Double> classes = new ArrayList<>();
      for (double d : ToolArgs.parseDoubles(OPT_CLASS, String.join(",", cmd.getOptionValues(OPT_CLASS))))
        classes.add(d);
      impl.selectClasses(classes);
    }
    if (cmd.hasOption(OPT_ALL_SAME_CLASS))
      impl.allSameClass();
    if (cmd.hasOption(OPT_SCALE_COORDS))
      impl.scaleCoordinates(ToolArgs.parseDouble(OPT_SCALE_COORDS, cmd.getOptionValue(OPT_SCALE_COORDS)));
    if (cmd.hasOption(OPT_SCALE_ORIGINS))
      impl.scaleOrigins(ToolArgs.parseDouble(OPT_SCALE_ORIGINS, cmd.getOptionValue(OPT_SCALE_ORIGINS)));
    if (cmd.hasOption(OPT_SCALE_MAG))
      impl.scaleMagnification(ToolArgs.parseDouble(OPT_SCALE_MAG, cmd.getOptionValue(OPT_SCALE_MAG)));
    if (cmd.hasOption(OPT_RECENTER))
      impl.recenter(false);
    if (cmd.hasOption(OPT_RECENTER_FRACTIONAL))
      impl.recenter(true);
    if (cmd.hasOption(OPT_ZERO_ORIGINS))
      impl.zeroOrigins();
    if (cmd.hasOption(OPT_INVERT_HAND))
      impl.invertHandedness();
    if (cmd.hasOption(OPT_MICROGRAPH_PATH))
      impl.micrographPath(cmd.getOptionValue(OPT_MICROGRAPH_PATH));
    if (cmd.hasOption(OPT_TO_MICROGRAPHS))
      impl.toMicrographs();
    impl.sortRecords(cmd.hasOption(OPT_SORT));
    impl.simplify(!cmd.hasOption(OPT_NO_SIMPLIFY));

    impl.run();
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("file")
        .desc("The input .star file (required).").required().build());
    res.addOption(Option.builder(OPT_OUTPUT).longOpt("output").numberOfArgs(1).argName("file")
        .desc("Output file name (required).").required().build());
    res.addOption(Option.builder(OPT_CLASS).longOpt("class").numberOfArgs(Option.UNLIMITED_VALUES)
        .argName("class> <class> <...").desc("Keep only records of the given classes.").build());
    res.addOption(Option.builder().longOpt(OPT_ALL_SAME_CLASS)
        .desc("Keep only particles whose copies are all in the same class.").build());
    res.addOption(Option.builder().longOpt(OPT_SCALE_COORDS).numberOfArgs(1).argName("factor")
        .desc("Multiply the micrograph coordinates by a factor.").build());
    res.addOption(Option.builder().longOpt(OPT_SCALE_ORIGINS).numberOfArgs(1).argName("factor")
        .desc("Multiply the origins by a factor.").build());
    res.addOption(Option.builder().longOpt(OPT_SCALE_MAG).numberOfArgs(1).argName("factor")
        .desc("Multiply the magnification by a factor.").build());
    res.addOption(Option.builder().longOpt(OPT_RECENTER)
        .desc("Move the coordinates by the rounded origins, keeping the remainder as origin.").build());
    res.addOption(Option.builder().longOpt(OPT_RECENTER_FRACTIONAL)
        .desc("Move the coordinates by the integer part of the origins, keeping the fraction as origin.").build());
    res.addOption(Option.builder().longOpt(OPT_ZERO_ORIGINS)
        .desc("Move the coordinates by the full origins and set the origins to zero.").build());
    res.addOption(Option.builder().longOpt(OPT_INVERT_HAND).desc("Invert the handedness of the angles.").build());
    res.addOption(Option.builder().longOpt(OPT_MICROGRAPH_PATH).numberOfArgs(1).argName("dir")
        .desc("Replace the directory of all micrograph names.").build());
    res.addOption(Option.builder().longOpt(OPT_TO_MICROGRAPHS)
        .desc("Aggregate the particles to one record per micrograph.").build());
    res.addOption(Option.builder().longOpt(OPT_SORT).desc("Sort the records naturally before writing.").build());
    res.addOption(Option.builder().longOpt(OPT_NO_SIMPLIFY)
        .desc("Write derived fields, too, instead of folding them back into the original fields.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
