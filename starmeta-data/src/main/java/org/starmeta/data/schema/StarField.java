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

import java.util.Map;
import java.util.Optional;

import org.starmeta.data.ColumnType;

import com.google.common.collect.ImmutableMap;

/**
 * All fields of STAR files that are known and interpreted by starmeta, mapping the logical role of a field to its
 * literal name.
 *
 * <p>
 * {@link Provenance#NATIVE} fields are read from and written to files ("rln" prefix). {@link Provenance#DERIVED} fields
 * ("ucsf" prefix) are computed from native ones when loading a file and are removed again before writing.
 *
 * <p>
 * Any other field name is valid in a STAR file, too, it is simply not interpreted.
 *
 * @author Bastian Gloeckle
 */
public enum StarField {
  MICROGRAPH_NAME("rlnMicrographName", ColumnType.STRING), //
  MICROGRAPH_NAME_NODW("rlnMicrographNameNoDW", ColumnType.STRING), //
  IMAGE_NAME("rlnImageName", ColumnType.STRING), //
  IMAGE_ORIGINAL_NAME("rlnImageOriginalName", ColumnType.STRING), //
  RECONSTRUCT_IMAGE_NAME("rlnReconstructImageName", ColumnType.STRING), //
  COORDX("rlnCoordinateX"), //
  COORDY("rlnCoordinateY"), //
  ORIGINX("rlnOriginX"), //
  ORIGINY("rlnOriginY"), //
  ORIGINZ("rlnOriginZ"), //
  ANGLEROT("rlnAngleRot"), //
  ANGLETILT("rlnAngleTilt"), //
  ANGLEPSI("rlnAnglePsi"), //
  CLASS("rlnClassNumber"), //
  DEFOCUSU("rlnDefocusU"), //
  DEFOCUSV("rlnDefocusV"), //
  DEFOCUSANGLE("rlnDefocusAngle"), //
  CS("rlnSphericalAberration"), //
  PHASESHIFT("rlnPhaseShift"), //
  AC("rlnAmplitudeContrast"), //
  VOLTAGE("rlnVoltage"), //
  MAGNIFICATION("rlnMagnification"), //
  DETECTORPIXELSIZE("rlnDetectorPixelSize"), //
  BEAMTILTX("rlnBeamTiltX"), //
  BEAMTILTY("rlnBeamTiltY"), //
  BEAMTILTCLASS("rlnBeamTiltClass"), //
  CTFSCALEFACTOR("rlnCtfScalefactor"), //
  CTFBFACTOR("rlnCtfBfactor"), //
  CTFMAXRESOLUTION("rlnCtfMaxResolution"), //
  CTFFIGUREOFMERIT("rlnCtfFigureOfMerit"), //
  GROUPNUMBER("rlnGroupNumber"), //
  OPTICSGROUP("rlnOpticsGroup"), //
  RANDOMSUBSET("rlnRandomSubset"), //
  AUTOPICKFIGUREOFMERIT("rlnAutopickFigureOfMerit"), //
  ODDZERNIKE("rlnOddZernike"), //
  EVENZERNIKE("rlnEvenZernike"), //
  MAGMAT00("rlnMagMat00"), //
  MAGMAT01("rlnMagMat01"), //
  MAGMAT10("rlnMagMat10"), //
  MAGMAT11("rlnMagMat11"), //

  IMAGE_PATH("ucsfImagePath", Provenance.DERIVED, ColumnType.STRING), //
  IMAGE_BASENAME("ucsfImageBasename", Provenance.DERIVED, ColumnType.STRING), //
  IMAGE_INDEX("ucsfImageIndex", Provenance.DERIVED, ColumnType.LONG), //
  IMAGE_ORIGINAL_PATH("ucsfImageOriginalPath", Provenance.DERIVED, ColumnType.STRING), //
  IMAGE_ORIGINAL_BASENAME("ucsfImageOriginalBasename", Provenance.DERIVED, ColumnType.STRING), //
  IMAGE_ORIGINAL_INDEX("ucsfImageOriginalIndex", Provenance.DERIVED, ColumnType.LONG), //
  MICROGRAPH_BASENAME("ucsfMicrographBasename", Provenance.DERIVED, ColumnType.STRING), //
  UID("ucsfUid", Provenance.DERIVED, null), //
  PARTICLE_UID("ucsfParticleUid", Provenance.DERIVED, null), //
  MICROGRAPH_UID("ucsfMicrographUid", Provenance.DERIVED, null);

  /**
   * Where the values of a field come from.
   */
  public static enum Provenance {
    /** Stored in STAR files. */
    NATIVE,
    /** Computed by starmeta, not written to STAR files. */
    DERIVED
  }

  private static final Map<String, StarField> BY_FIELD_NAME;

  static {
    ImmutableMap.Builder<String, StarField> builder = ImmutableMap.builder();
    for (StarField f : values())
      builder.put(f.getFieldName(), f);
    BY_FIELD_NAME = builder.build();
  }

  private final String fieldName;
  private final Provenance provenance;
  private final ColumnType fixedType;

  private StarField(String fieldName) {
    this(fieldName, Provenance.NATIVE, null);
  }

  private StarField(String fieldName, ColumnType fixedType) {
    this(fieldName, Provenance.NATIVE, fixedType);
  }

  private StarField(String fieldName, Provenance provenance, ColumnType fixedType) {
    this.fieldName = fieldName;
    this.provenance = provenance;
    this.fixedType = fixedType;
  }

  /**
   * @return The literal name of the field as used in STAR files and as column name in a
   *         {@link org.starmeta.data.StarTable}.
   */
  public String getFieldName() {
    return fieldName;
  }

  public Provenance getProvenance() {
    return provenance;
  }

  /**
   * @return The type the values of this field always have, independent of what the values look like. Empty if the type
   *         should be inferred from the values.
   */
  public Optional<ColumnType> getFixedType() {
    return Optional.ofNullable(fixedType);
  }

  /**
   * @return The {@link StarField} with the given literal field name, if known.
   */
  public static Optional<StarField> byFieldName(String fieldName) {
    return Optional.ofNullable(BY_FIELD_NAME.get(fieldName));
  }

  @Override
  public String toString() {
    return fieldName;
  }
}
