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
package org.starmeta.loader;

import java.util.Arrays;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldNames;
import org.starmeta.data.schema.StarField;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests the {@link StarAugmenter}.
 *
 * @author Bastian Gloeckle
 */
public class StarAugmenterTest {
  private AnnotationConfigApplicationContext dataContext;

  private StarAugmenter augmenter;

  @BeforeMethod
  public void setUp() {
    dataContext = StarmetaContext.create();
    augmenter = dataContext.getBean(StarAugmenter.class);
  }

  @AfterMethod
  public void shutDown() {
    dataContext.close();
  }

  private StarTable createTable() {
    return new StarTable(Arrays.asList( //
        StarColumn.ofStrings("rlnImageName", "000003@Extract/a.mrcs", "000010@Extract/b.mrcs"), //
        StarColumn.ofStrings("rlnMicrographName", "Micrographs/a.mrc", "Micrographs/b.mrc")));
  }

  @Test
  public void derivesFields() {
    // GIVEN
    StarTable table = createTable();

    // WHEN
    StarTable res = augmenter.augment(table, false);

    // THEN
    Assert.assertEquals(res.getColumn(StarField.IMAGE_INDEX).getLong(1), 9L);
    Assert.assertEquals(res.getColumn(StarField.IMAGE_PATH).getString(1), "Extract/b.mrcs");
    Assert.assertEquals(res.getColumn(StarField.IMAGE_BASENAME).getString(1), "b.mrcs");
    Assert.assertEquals(res.getColumn(StarField.IMAGE_ORIGINAL_NAME).getString(0), "000003@Extract/a.mrcs");
    Assert.assertEquals(res.getColumn(StarField.IMAGE_ORIGINAL_INDEX).getLong(0), 2L);
    Assert.assertEquals(res.getColumn(StarField.IMAGE_ORIGINAL_BASENAME).getString(0), "a.mrcs");
    Assert.assertEquals(res.getColumn(StarField.MICROGRAPH_BASENAME).getString(0), "a.mrc");
    Assert.assertEquals(table.getNumberOfColumns(), 2, "Expected input table to be unchanged");
  }

  @Test
  public void existingOriginalIsKept() {
    // GIVEN
    StarTable table = createTable();
    table.putColumn(StarColumn.ofStrings("rlnImageOriginalName", "000001@orig.mrcs", "000002@orig.mrcs"));

    // WHEN
    augmenter.augment(table, true);

    // THEN
    Assert.assertEquals(table.getColumn(StarField.IMAGE_ORIGINAL_PATH).getString(0), "orig.mrcs");
    Assert.assertEquals(table.getColumn(StarField.IMAGE_ORIGINAL_INDEX).getLong(1), 1L);
  }

  @Test
  public void augmentTwiceIsNoop() {
    // GIVEN
    StarTable once = augmenter.augment(createTable(), false);
    once.getColumn(StarField.IMAGE_INDEX).set(0, 41L);

    // WHEN
    StarTable twice = augmenter.augment(once, false);

    // THEN
    Assert.assertEquals(twice, once, "Expected augmenting an augmented table to change nothing");
    Assert.assertEquals(twice.getColumn(StarField.IMAGE_INDEX).getLong(0), 41L);
  }

  @Test
  public void missingSourceFields() {
    // GIVEN
    StarTable table = new StarTable(Arrays.asList(StarColumn.ofDoubles("rlnCoordinateX", new double[] { 1. })));

    // WHEN
    augmenter.augment(table, true);

    // THEN
    Assert.assertEquals(table.getColumnNames(), Arrays.asList("rlnCoordinateX", "index"));
  }

  @Test
  public void invalidImageReference() {
    // GIVEN
    StarTable table = new StarTable(Arrays.asList(StarColumn.ofStrings("rlnImageName", "a.mrcs")));

    // WHEN
    augmenter.augment(table, true);

    // THEN
    Assert.assertTrue(table.getColumn(StarField.IMAGE_INDEX).isMissing(0));
    Assert.assertEquals(table.getColumn(StarField.IMAGE_PATH).getString(0), "a.mrcs");
  }

  @Test
  public void setOriginalFields() {
    // GIVEN
    StarTable table = augmenter.augment(createTable(), false);
    table.getColumn(StarField.IMAGE_NAME).set(0, "000005@new.mrcs");
    table.getColumn(StarField.IMAGE_INDEX).set(0, 4L);
    table.getColumn(StarField.IMAGE_PATH).set(0, "new.mrcs");

    // WHEN
    StarTable res = augmenter.setOriginalFields(table, false);

    // THEN
    Assert.assertEquals(res.getColumn(StarField.IMAGE_ORIGINAL_NAME).getString(0), "000005@new.mrcs");
    Assert.assertEquals(res.getColumn(StarField.IMAGE_ORIGINAL_INDEX).getLong(0), 4L);
    Assert.assertEquals(res.getColumn(StarField.IMAGE_ORIGINAL_PATH).getString(0), "new.mrcs");
    Assert.assertEquals(table.getColumn(StarField.IMAGE_ORIGINAL_NAME).getString(0), "000003@Extract/a.mrcs",
        "Expected input to be unchanged");
  }

  @Test
  public void recordPositionsAreStamped() {
    // GIVEN
    StarTable table = createTable();

    // WHEN
    StarTable res = augmenter.augment(table, false);

    // THEN
    Assert.assertEquals(res.getColumn(FieldNames.INDEX_COLUMN), StarColumn.ofLongs("index", new long[] { 0, 1 }));
  }
}
