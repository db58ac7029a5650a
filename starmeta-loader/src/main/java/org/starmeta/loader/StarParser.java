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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.ColumnType;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * Parses STAR files into {@link StarTable}s.
 *
 * <p>
 * A STAR file consists of some preamble (like "data_images" and "loop_"), a header section which names one field per
 * line and then the data section, which contains one record per line:
 *
 * <pre>
 * data_images
 *
 * loop_
 * _rlnCoordinateX #1
 * _rlnCoordinateY #2
 * _rlnImageName #3
 * 10 20 000001&#64;a.mrcs
 * 30 40 000002&#64;a.mrcs
 * </pre>
 *
 * The header section is the first run of lines starting with '_'; everything before it is ignored. The optional "#n"
 * at the end of a header line is ignored, too, unless requested otherwise. The data values of a record are separated
 * by whitespace, there is no quoting.
 *
 * <p>
 * Files of older formats do not contain {@link StarField#PHASESHIFT}, that field is added with value 0 if it is
 * missing.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class StarParser {
  private static final Logger logger = LoggerFactory.getLogger(StarParser.class);

  private static final Splitter VALUE_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private static final String HEADER_PREFIX = "_";

  private static final char INDEX_SUFFIX_START = '#';

  @Inject
  private StarAugmenter augmenter;

  /**
   * Parse a STAR file completely, strip the "#n" suffixes of the field names and augment the result.
   *
   * @see #parse(Path, boolean, boolean, Integer)
   */
  public StarTable parse(Path file) throws StarFormatException {
    return parse(file, false, true, null);
  }

  /**
   * Parse a STAR file.
   *
   * @param file
   *          The file to read.
   * @param keepIndexSuffix
   *          If <code>true</code> the column names will be the complete header lines (e.g. "_rlnImageName #3"),
   *          otherwise the leading '_' and the "#n" suffix are removed.
   * @param augment
   *          Whether to add the derived fields to the table, see {@link StarAugmenter#augment(StarTable, boolean)}.
   * @param maxRecords
   *          Maximum number of records to read, <code>null</code> to read all.
   * @return The new table.
   * @throws StarFormatException
   *           If the file cannot be read or is not a valid STAR file.
   */
  public StarTable parse(Path file, boolean keepIndexSuffix, boolean augment, Integer maxRecords)
      throws StarFormatException {
    logger.info("Reading STAR file '{}'.", file);
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return parse(reader, file.toString(), keepIndexSuffix, augment, maxRecords);
    } catch (IOException e) {
      throw new StarFormatException("Could not read " + file, e);
    }
  }

  /**
   * Parse STAR data from a {@link Reader}. The reader is not closed.
   *
   * @param sourceName
   *          Name of the source, used in log and error messages.
   * @see #parse(Path, boolean, boolean, Integer)
   */
  public StarTable parse(Reader reader, String sourceName, boolean keepIndexSuffix, boolean augment,
      Integer maxRecords) throws StarFormatException {
    BufferedReader bufferedReader =
        (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);

    List<String> headers = new ArrayList<>();
    List<String[]> rows = new ArrayList<>();
    try {
      readHeaderAndData(bufferedReader, sourceName, keepIndexSuffix, maxRecords, headers, rows);
    } catch (IOException e) {
      throw new StarFormatException("Could not read " + sourceName, e);
    }

    StarTable table = createTable(sourceName, headers, rows);

    if (!table.hasColumn(StarField.PHASESHIFT)) {
      logger.debug("'{}' has no field {}, adding it with value 0.", sourceName, StarField.PHASESHIFT);
      table.putColumn(StarColumn.ofConstant(StarField.PHASESHIFT.getFieldName(), ColumnType.DOUBLE, 0.,
          table.getNumberOfRows()));
    }

    if (augment)
      augmenter.augment(table, true);

    logger.info("Read {} records with {} fields from '{}'.", table.getNumberOfRows(), headers.size(), sourceName);
    return table;
  }

  private void readHeaderAndData(BufferedReader reader, String sourceName, boolean keepIndexSuffix,
      Integer maxRecords, List<String> headers, List<String[]> rows) throws IOException, StarFormatException {
    boolean inData = false;
    int lineNo = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNo++;

      if (!inData) {
        String trimmed = line.trim();
        if (trimmed.startsWith(HEADER_PREFIX)) {
          headers.add(headerName(line, keepIndexSuffix));
          continue;
        }
        if (headers.isEmpty())
          // preamble
          continue;
        inData = true;
      }

      if (maxRecords != null && rows.size() >= maxRecords)
        break;

      List<String> values = VALUE_SPLITTER.splitToList(line);
      if (values.isEmpty())
        continue;

      if (values.size() != headers.size())
        throw new StarFormatException("Line " + lineNo + " of " + sourceName + " contains " + values.size()
            + " values, but there are " + headers.size() + " fields.");

      rows.add(values.toArray(new String[values.size()]));
    }

    if (headers.isEmpty())
      throw new StarFormatException("No header found in " + sourceName);
  }

  private String headerName(String line, boolean keepIndexSuffix) {
    if (keepIndexSuffix)
      return line.trim();

    int suffixIdx = line.indexOf(INDEX_SUFFIX_START);
    String res = (suffixIdx >= 0) ? line.substring(0, suffixIdx) : line;
    return CharMatcher.is('_').trimLeadingFrom(res.trim());
  }

  /**
   * Transposes the row-wise raw data into typed columns.
   */
  private StarTable createTable(String sourceName, List<String> headers, List<String[]> rows)
      throws StarFormatException {
    StarColumnInfo columnInfo = new StarColumnInfo();
    StarTable table = new StarTable(rows.size());
    Set<String> seen = new HashSet<>();

    for (int col = 0; col < headers.size(); col++) {
      String name = headers.get(col);
      if (!seen.add(name))
        throw new StarFormatException("Field '" + name + "' is defined multiple times in " + sourceName);

      String[] raw = new String[rows.size()];
      for (int row = 0; row < raw.length; row++)
        raw[row] = rows.get(row)[col];

      ColumnType type = columnInfo.getFinalColumnType(name, raw);
      Object[] values;
      try {
        values = columnInfo.getTransformationFunction(type).apply(raw);
      } catch (NumberFormatException e) {
        throw new StarFormatException("Invalid value in field '" + name + "' of " + sourceName + ": " + e.getMessage(),
            e);
      }
      table.putColumn(new StarColumn(name, type, values));
    }
    return table;
  }
}
