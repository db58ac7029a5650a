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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.geom.EulerAngles;
import org.starmeta.ops.transform.Translation;
import org.starmeta.tool.ToolArgs;
import org.starmeta.tool.ToolExecutionException;
import org.starmeta.tool.ToolFunction;
import org.starmeta.tool.ToolFunctionName;

/**
 * Rotates and shifts all particles of a STAR file.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Transform.FUNCTION_NAME)
public class Transform implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Transform.class);

  public static final String FUNCTION_NAME = "transform";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";
  private static final String OPT_OUTPUT = "o";
  private static final String OPT_ANGLES = "a";
  private static final String OPT_MATRIX = "m";
  private static final String OPT_TRANSLATION = "t";
  private static final String OPT_SHIFT = "s";
  private static final String OPT_INVERT = "invert";
  private static final String OPT_NO_ROTATE = "no-rotate";
  private static final String OPT_ADJUST_DEFOCUS = "adjust-defocus";

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
      formatter.printHelp(Transform.FUNCTION_NAME + " [options]",
          "\nReads a .star file and applies a rotation and translation to each particle. The rotation is given as "
              + "Euler angles (ZYZ, degrees) or as a row-major 3x3 or 3x4 matrix; the fourth column of a 3x4 matrix "
              + "is the translation.\n\n",
          cliOpt, "");
      return;
    }

    File inputFile = new File(cmd.getOptionValue(OPT_INPUT));
    File outputFile = new File(cmd.getOptionValue(OPT_OUTPUT));

    if (!inputFile.isFile() || !inputFile.exists())
      throw new ToolExecutionException(inputFile.getAbsolutePath() + " does not exist or is a directory.");
    if (outputFile.exists() && outputFile.isDirectory())
      throw new ToolExecutionException(outputFile.getAbsolutePath() + " exists and is a directory.");
    if (cmd.hasOption(OPT_ANGLES) && cmd.hasOption(OPT_MATRIX))
      throw new ToolExecutionException("Only one of angles and matrix can be given.");
    if (cmd.hasOption(OPT_TRANSLATION) && cmd.hasOption(OPT_SHIFT))
      throw new ToolExecutionException("Only one of translation and shift can be given.");

    RealMatrix rotation = MatrixUtils.createRealIdentityMatrix(3);
    if (cmd.hasOption(OPT_ANGLES)) {
      double[] angles = ToolArgs.parseDoubles(OPT_ANGLES, cmd.getOptionValue(OPT_ANGLES));
      if (angles.length != 3)
        throw new ToolExecutionException("Exactly three angles need to be given.");
      rotation = EulerAngles.eulerDegreesToMatrix(angles);
    } else if (cmd.hasOption(OPT_MATRIX)) {
      double[] values = ToolArgs.parseDoubles(OPT_MATRIX, cmd.getOptionValue(OPT_MATRIX));
      if (values.length != 9 && values.length != 12)
        throw new ToolExecutionException("The matrix needs 9 or 12 values, but got " + values.length);
      int cols = values.length / 3;
      double[][] data = new double[3][cols];
      for (int i = 0; i < values.length; i++)
        data[i / cols][i % cols] = values[i];
      rotation = MatrixUtils.createRealMatrix(data);
    }

    Translation translation = null;
    if (cmd.hasOption(OPT_TRANSLATION)) {
      double[] t = ToolArgs.parseDoubles(OPT_TRANSLATION, cmd.getOptionValue(OPT_TRANSLATION));
      if (t.length != 3)
        throw new ToolExecutionException("The translation needs three values.");
      translation = Translation.vector(t[0], t[1], t[2]);
    } else if (cmd.hasOption(OPT_SHIFT))
      translation = Translation.scalar(ToolArgs.parseDouble(OPT_SHIFT, cmd.getOptionValue(OPT_SHIFT)));

    if (rotation.getColumnDimension() == 4 && translation != null)
      throw new ToolExecutionException("A 3x4 matrix already contains a translation.");

    new TransformImplementation(inputFile, outputFile, rotation, translation, cmd.hasOption(OPT_INVERT),
        !cmd.hasOption(OPT_NO_ROTATE), cmd.hasOption(OPT_ADJUST_DEFOCUS)).transform();
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("file")
        .desc("The input .star file (required).").required().build());
    res.addOption(Option.builder(OPT_OUTPUT).longOpt("output").numberOfArgs(1).argName("file")
        .desc("Output file name (required).").required().build());
    res.addOption(Option.builder(OPT_ANGLES).longOpt("angles").numberOfArgs(1).argName("rot,tilt,psi")
        .desc("The rotation as Euler angles in degrees.").build());
    res.addOption(Option.builder(OPT_MATRIX).longOpt("matrix").numberOfArgs(1).argName("v,v,...")
        .desc("The rotation as 9 or 12 comma separated values in row-major order.").build());
    res.addOption(Option.builder(OPT_TRANSLATION).longOpt("translation").numberOfArgs(1).argName("x,y,z")
        .desc("Translation in pixels, applied in the rotated frame.").build());
    res.addOption(Option.builder(OPT_SHIFT).longOpt("shift").numberOfArgs(1).argName("distance")
        .desc("Shift in pixels along the rotated Z axis.").build());
    res.addOption(Option.builder().longOpt(OPT_INVERT).desc("Apply the inverse transformation.").build());
    res.addOption(
        Option.builder().longOpt(OPT_NO_ROTATE).desc("Only shift the origins, keep the angles unchanged.").build());
    res.addOption(Option.builder().longOpt(OPT_ADJUST_DEFOCUS)
        .desc("Adjust the defocus values by the Z component of the shift.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
