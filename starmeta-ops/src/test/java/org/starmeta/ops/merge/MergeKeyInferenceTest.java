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
package org.starmeta.ops.merge;

import java.util.Arrays;
import java.util.Optional;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldGroups;
import org.starmeta.data.schema.StarField;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link MergeKeyInference}.
 *
 * @author Bastian Gloeckle
 */
public class MergeKeyInferenceTest {
  private AnnotationConfigApplicationContext dataContext;

  private MergeKeyInference inference;

  @BeforeMethod
  public void setUp() {
    dataContext = StarmetaContext.create();
    inference = dataContext.getBean(MergeKeyInference.class);
  }

  @AfterMethod
  public void shutDown() {
    dataContext.close();
  }

  private StarTable particles(String... imageNames) {
    String[] mics = new String[imageNames.length];
    double[] coords = new double[imageNames.length];
    for (int i = 0; i < mics.length; i++) {
      mics[i] = "mic" + (i % 2) + ".mrc";
      coords[i] = i;
    }
    return new StarTable(Arrays.asList( //
        StarColumn.ofStrings("rlnImageName", imageNames), //
        StarColumn.ofStrings("rlnMicrographName", mics), //
        StarColumn.ofDoubles("rlnCoordinateX", coords), //
        StarColumn.ofDoubles("rlnCoordinateY", coords)));
  }

  @Test
  public void imageNameBeforeMicrographName() {
    // GIVEN
    StarTable primary = particles("1@a", "2@a", "3@a", "4@a");
    StarTable secondary = particles("1@a", "2@a", "3@a", "4@a");

    // WHEN
    Optional<MergeKey> key = inference.inferKey(primary, secondary);

    // THEN
    Assert.assertEquals(key, Optional.of(MergeKey.of(StarField.IMAGE_NAME)));
  }

  @Test
  public void micrographCoordsIfImagesNotCovered() {
    // GIVEN
    StarTable primary = particles("1@a", "2@a", "3@a", "4@a");
    StarTable secondary = particles("1@b", "2@b", "3@b", "4@a");

    // WHEN
    Optional<MergeKey> key = inference.inferKey(primary, secondary);

    // THEN
    Assert.assertEquals(key, Optional.of(MergeKey.of(FieldGroups.MICROGRAPH_COORDS)));
  }

  @Test
  public void micrographNameWithoutCoords() {
    // GIVEN
    StarTable primary = particles("1@a", "2@a");
    StarTable secondary = new StarTable(Arrays.asList( //
        StarColumn.ofStrings("rlnMicrographName", "mic0.mrc", "mic1.mrc"), //
        StarColumn.ofDoubles("rlnDefocusU", new double[] { 1., 2. })));

    // WHEN
    Optional<MergeKey> key = inference.inferKey(primary, secondary);

    // THEN
    Assert.assertEquals(key, Optional.of(MergeKey.of(StarField.MICROGRAPH_NAME)));
  }

  @Test
  public void imageBasenameAndIndex() {
    // GIVEN
    StarTable primary = new StarTable(Arrays.asList( //
        StarColumn.ofStrings("ucsfImageBasename", "a.mrcs", "a.mrcs"), //
        StarColumn.ofLongs("ucsfImageIndex", new long[] { 0, 1 })));
    StarTable secondary = primary.copy();

    // WHEN
    Optional<MergeKey> key = inference.inferKey(primary, secondary);

    // THEN
    Assert.assertEquals(key, Optional.of(MergeKey.of(StarField.IMAGE_BASENAME, StarField.IMAGE_INDEX)));
  }

  @Test
  public void micrographBasename() {
    // GIVEN
    StarTable primary = new StarTable(Arrays.asList( //
        StarColumn.ofStrings("rlnMicrographName", "a/mic1.mrc", "a/mic2.mrc"), //
        StarColumn.ofStrings("ucsfMicrographBasename", "mic1.mrc", "mic2.mrc")));
    StarTable secondary = new StarTable(Arrays.asList( //
        StarColumn.ofStrings("rlnMicrographName", "b/mic1.mrc", "b/mic2.mrc"), //
        StarColumn.ofStrings("ucsfMicrographBasename", "mic1.mrc", "mic2.mrc")));

    // WHEN
    Optional<MergeKey> key = inference.inferKey(primary, secondary);

    // THEN
    Assert.assertEquals(key, Optional.of(MergeKey.of(StarField.MICROGRAPH_BASENAME)));
  }

  @Test
  public void noSharedFields() {
    // GIVEN
    StarTable primary = new StarTable(Arrays.asList(StarColumn.ofStrings("rlnImageName", "1@a")));
    StarTable secondary = new StarTable(Arrays.asList(StarColumn.ofStrings("rlnMicrographName", "m")));

    // WHEN
    Optional<MergeKey> key = inference.inferKey(primary, secondary);

    // THEN
    Assert.assertFalse(key.isPresent());
  }

  @Test
  public void coverageCountsMultiplicity() {
    // GIVEN
    StarTable secondary = new StarTable(Arrays.asList(StarColumn.ofStrings("rlnMicrographName", "a", "x")));
    StarTable mostlyA = new StarTable(Arrays.asList(StarColumn.ofStrings("rlnMicrographName", "a", "a", "a", "b")));
    StarTable mostlyB = new StarTable(Arrays.asList(StarColumn.ofStrings("rlnMicrographName", "a", "b", "b", "b")));

    // WHEN
    Optional<MergeKey> keyA = inference.inferKey(mostlyA, secondary, 0.5);
    Optional<MergeKey> keyB = inference.inferKey(mostlyB, secondary, 0.5);
    Optional<MergeKey> keyBLowThreshold = inference.inferKey(mostlyB, secondary, 0.25);

    // THEN
    Assert.assertTrue(keyA.isPresent(), "Expected 3 of 4 records to be enough");
    Assert.assertFalse(keyB.isPresent(), "Expected 1 of 4 records to not be enough");
    Assert.assertTrue(keyBLowThreshold.isPresent(), "Expected 1 of 4 records to be enough for threshold 0.25");
  }
}
