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
package org.starmeta.serialize;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.starmeta.context.StarmetaContext;
import org.starmeta.data.ColumnType;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;
import org.starmeta.loader.StarFormatException;
import org.starmeta.loader.StarParser;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link StarWriter}.
 *
 * @author Bastian Gloeckle
 */
public class StarWriterTest {
  private static final String PARTICLES_CLASSPATH = "/particles.star";

  private AnnotationConfigApplicationContext dataContext;

  private StarWriter writer;

  private StarParser parser;

  private Path tempDir;

  @BeforeMethod
  public void setUp() throws IOException {
    dataContext = StarmetaContext.create();
    writer = dataContext.getBean(StarWriter.class);
    parser = dataContext.getBean(StarParser.class);
    tempDir = Files.createTempDirectory(StarWriterTest.class.getSimpleName());
  }

  @AfterMethod
  public void shutDown() throws IOException {
    dataContext.close();
    try (Stream<Path> paths = Files.walk(tempDir)) {
      for (Path p : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator)
        Files.delete(p);
    }
  }

  @Test
  public void headerAndValues() throws IOException {
    // GIVEN
    StarTable table = new StarTable(Arrays.asList( //
        StarColumn.ofDoubles("rlnCoordinateY", new double[] { 20.5, Double.NaN }), //
        StarColumn.ofDoubles("rlnCoordinateX", new double[] { 10., 30.1234567 }), //
        StarColumn.ofLongs("rlnClassNumber", new long[] { 1, 2 }), //
        StarColumn.ofStrings("myField", "a", "b")));

    // WHEN
    Path file = writer.write(tempDir.resolve("out"), table);

    // THEN
    Assert.assertEquals(file, tempDir.resolve("out.star"), "Expected suffix to be appended");
    String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    Assert.assertEquals(content, "\ndata_images\n\nloop_\n" //
        + "_rlnCoordinateX #1 \n" //
        + "_rlnCoordinateY #2 \n" //
        + "_rlnClassNumber #3 \n" //
        + "_myField #4 \n" //
        + "10.000000 20.500000 1 a\n" //
        + "30.123457 nan 2 b\n");
    Assert.assertEquals(table.getColumnNames().get(0), "rlnCoordinateY", "Expected input table to be unchanged");
  }

  @Test
  public void suffixNotDuplicated() throws IOException {
    // GIVEN
    StarTable table = new StarTable(Arrays.asList(StarColumn.ofDoubles("rlnCoordinateX", new double[] { 1. })));

    // WHEN
    Path file = writer.write(tempDir.resolve("out.star"), table);

    // THEN
    Assert.assertEquals(file, tempDir.resolve("out.star"));
    Assert.assertTrue(Files.exists(file));
  }

  @Test
  public void indexedNamesAreKept() throws IOException {
    // GIVEN
    StarTable table = new StarTable(Arrays.asList( //
        StarColumn.ofDoubles("_rlnCoordinateY #1", new double[] { 2. }), //
        StarColumn.ofDoubles("_rlnCoordinateX #2", new double[] { 1. })));

    // WHEN
    Path file = writer.write(tempDir.resolve("idx"), table);

    // THEN
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    Assert.assertEquals(lines.subList(4, 7), Arrays.asList("_rlnCoordinateY #1 ", "_rlnCoordinateX #2 ", "2.000000 1.000000"),
        "Expected fields to be neither resorted nor renamed");
  }

  @Test
  public void recordsSortedNaturally() throws IOException {
    // GIVEN
    StarTable table = new StarTable(Arrays.asList( //
        StarColumn.ofStrings("rlnMicrographName", "Micrographs/mic10.mrc", "Micrographs/mic9.mrc",
            "Micrographs/mic1.mrc"), //
        StarColumn.ofDoubles("rlnDefocusU", new double[] { 10., 9., 1. })));

    // WHEN
    Path file = writer.write(tempDir.resolve("mics"), table, true, true, true);

    // THEN
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    Assert.assertEquals(lines.subList(6, 9), Arrays.asList("Micrographs/mic1.mrc 1.000000",
        "Micrographs/mic9.mrc 9.000000", "Micrographs/mic10.mrc 10.000000"));
  }

  @Test
  public void roundTrip() throws IOException, StarFormatException, URISyntaxException {
    // GIVEN
    File source = new File(getClass().getResource(PARTICLES_CLASSPATH).toURI());
    StarTable original = parser.parse(source.toPath());

    // WHEN
    Path file = writer.write(tempDir.resolve("particles.star"), original);
    StarTable reread = parser.parse(file);

    // THEN
    Assert.assertEquals(reread.getNumberOfRows(), original.getNumberOfRows());
    Assert.assertEquals(reread.getNumberOfColumns(), original.getNumberOfColumns());
    for (StarColumn col : original.getColumns())
      Assert.assertEquals(reread.getColumn(col.getName()), col, "Expected column " + col.getName() + " to be equal");
    Assert.assertEquals(reread.getColumn(StarField.IMAGE_NAME).getType(), ColumnType.STRING);
  }

  @Test
  public void recordPositionsNotWritten() throws IOException, StarFormatException, URISyntaxException {
    // GIVEN
    File source = new File(getClass().getResource(PARTICLES_CLASSPATH).toURI());
    StarTable table = parser.parse(source.toPath());

    // WHEN
    Path file = writer.write(tempDir.resolve("unsimplified"), table, true, false, false);

    // THEN
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    Assert.assertTrue(lines.stream().noneMatch(l -> l.startsWith("_index ")), "Expected no index field in " + lines);
    Assert.assertTrue(table.hasColumn("index"), "Expected input table to be unchanged");
  }
}
