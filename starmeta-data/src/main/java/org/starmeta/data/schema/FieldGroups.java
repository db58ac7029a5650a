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
package org.starmeta.data.schema;

import static org.starmeta.data.schema.StarField.AC;
import static org.starmeta.data.schema.StarField.ANGLEPSI;
import static org.starmeta.data.schema.StarField.ANGLEROT;
import static org.starmeta.data.schema.StarField.ANGLETILT;
import static org.starmeta.data.schema.StarField.AUTOPICKFIGUREOFMERIT;
import static org.starmeta.data.schema.StarField.BEAMTILTCLASS;
import static org.starmeta.data.schema.StarField.BEAMTILTX;
import static org.starmeta.data.schema.StarField.BEAMTILTY;
import static org.starmeta.data.schema.StarField.CLASS;
import static org.starmeta.data.schema.StarField.COORDX;
import static org.starmeta.data.schema.StarField.COORDY;
import static org.starmeta.data.schema.StarField.CS;
import static org.starmeta.data.schema.StarField.CTFBFACTOR;
import static org.starmeta.data.schema.StarField.CTFFIGUREOFMERIT;
import static org.starmeta.data.schema.StarField.CTFMAXRESOLUTION;
import static org.starmeta.data.schema.StarField.CTFSCALEFACTOR;
import static org.starmeta.data.schema.StarField.DEFOCUSANGLE;
import static org.starmeta.data.schema.StarField.DEFOCUSU;
import static org.starmeta.data.schema.StarField.DEFOCUSV;
import static org.starmeta.data.schema.StarField.DETECTORPIXELSIZE;
import static org.starmeta.data.schema.StarField.EVENZERNIKE;
import static org.starmeta.data.schema.StarField.GROUPNUMBER;
import static org.starmeta.data.schema.StarField.IMAGE_NAME;
import static org.starmeta.data.schema.StarField.IMAGE_ORIGINAL_NAME;
import static org.starmeta.data.schema.StarField.MAGMAT00;
import static org.starmeta.data.schema.StarField.MAGMAT01;
import static org.starmeta.data.schema.StarField.MAGMAT10;
import static org.starmeta.data.schema.StarField.MAGMAT11;
import static org.starmeta.data.schema.StarField.MAGNIFICATION;
import static org.starmeta.data.schema.StarField.MICROGRAPH_NAME;
import static org.starmeta.data.schema.StarField.MICROGRAPH_NAME_NODW;
import static org.starmeta.data.schema.StarField.ODDZERNIKE;
import static org.starmeta.data.schema.StarField.OPTICSGROUP;
import static org.starmeta.data.schema.StarField.ORIGINX;
import static org.starmeta.data.schema.StarField.ORIGINY;
import static org.starmeta.data.schema.StarField.ORIGINZ;
import static org.starmeta.data.schema.StarField.PHASESHIFT;
import static org.starmeta.data.schema.StarField.RANDOMSUBSET;
import static org.starmeta.data.schema.StarField.VOLTAGE;

import java.util.Arrays;

import com.google.common.collect.ImmutableList;

/**
 * Groups of {@link StarField}s that belong together semantically, as lists of literal field names.
 *
 * <p>
 * All lists are immutable.
 *
 * @author Bastian Gloeckle
 */
public class FieldGroups {
  public static final ImmutableList<String> COORDS = names(COORDX, COORDY);

  public static final ImmutableList<String> ORIGINS = names(ORIGINX, ORIGINY);

  public static final ImmutableList<String> ORIGINS_3D = names(ORIGINX, ORIGINY, ORIGINZ);

  /** Euler angles rot, tilt, psi - in this order. */
  public static final ImmutableList<String> ANGLES = names(ANGLEROT, ANGLETILT, ANGLEPSI);

  public static final ImmutableList<String> ALIGNMENTS =
      ImmutableList.<String> builder().addAll(ANGLES).addAll(ORIGINS_3D).build();

  public static final ImmutableList<String> DEFOCUS = names(DEFOCUSU, DEFOCUSV);

  public static final ImmutableList<String> CTF_PARAMS = names(DEFOCUSU, DEFOCUSV, DEFOCUSANGLE, CS, PHASESHIFT, AC,
      BEAMTILTX, BEAMTILTY, BEAMTILTCLASS, CTFSCALEFACTOR, CTFBFACTOR, CTFMAXRESOLUTION, CTFFIGUREOFMERIT);

  public static final ImmutableList<String> MICROSCOPE_PARAMS = names(VOLTAGE, MAGNIFICATION, DETECTORPIXELSIZE);

  public static final ImmutableList<String> MICROGRAPH_COORDS =
      ImmutableList.<String> builder().add(MICROGRAPH_NAME.getFieldName()).addAll(COORDS).build();

  /** Fields written by particle pickers. */
  public static final ImmutableList<String> PICK_PARAMS = ImmutableList.<String> builder().addAll(MICROGRAPH_COORDS)
      .addAll(names(ANGLEPSI, CLASS, AUTOPICKFIGUREOFMERIT)).build();

  /**
   * The order in which known fields are written into STAR files. Fields not contained here follow after these, in their
   * original order.
   */
  public static final ImmutableList<String> FIELD_ORDER = ImmutableList.<String> builder()
      .addAll(names(IMAGE_NAME, IMAGE_ORIGINAL_NAME, MICROGRAPH_NAME, MICROGRAPH_NAME_NODW)) //
      .addAll(COORDS) //
      .addAll(ALIGNMENTS) //
      .addAll(MICROSCOPE_PARAMS) //
      .addAll(CTF_PARAMS) //
      .addAll(names(CLASS, GROUPNUMBER, RANDOMSUBSET)) //
      .build();

  /**
   * Fields that were introduced with Relion 3. This is informational only, it is not validated whether files contain
   * these fields.
   */
  public static final ImmutableList<String> RELION3 = names(BEAMTILTX, BEAMTILTY, BEAMTILTCLASS, OPTICSGROUP,
      ODDZERNIKE, EVENZERNIKE, MAGMAT00, MAGMAT01, MAGMAT10, MAGMAT11);

  private static ImmutableList<String> names(StarField... fields) {
    return Arrays.stream(fields).map(StarField::getFieldName).collect(ImmutableList.toImmutableList());
  }

  private FieldGroups() {
  }
}
