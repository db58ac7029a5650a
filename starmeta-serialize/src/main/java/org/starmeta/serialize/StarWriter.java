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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import javax.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.config.Config;
import org.starmeta.config.ConfigKey;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldNames;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

/**
 * Writes a {@link StarTable} into a STAR file.
 *
 * <p>
 * The file starts with a header block naming the data block and all fields, followed by one line per record:
 *
 * <pre>
 *
 * data_images
 *
 * loop_
 * _rlnCoordinateX #1
 * _rlnCoordinateY #2
 * 10.000000 20.000000
 * </pre>
 *
 * Floating point values are written with a fixed number of decimals, missing values as "nan".
 *
 * <p>
 * The given table is never changed.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class StarWriter {
  private static final Logger logger = LoggerFactory.getLogger(StarWriter.class);

  public static final String FILE_SUFFIX = ".star";

  private static final String MISSING_VALUE = "nan";

  @Config(ConfigKey.FLOAT_DECIMALS)
  private int floatDecimals;

  @Config(ConfigKey.DATA_BLOCK_NAME)
  private String dataBlockName;

  @Inject
  private StarSimplifier simplifier;

  @Inject
  private FieldSorter fieldSorter;

  @Inject
  private RecordSorter recordSorter;

  /**
   * Write a table, sorting its fields into canonical order and simplifying it before.
   *
   * @see #write(Path, StarTable, boolean, boolean, boolean)
   */
  public Path write(Path file, StarTable table) throws IOException {
    return write(file, table, true, false, true);
  }

  /**
   * Write a table into a file.
   *
   * @param file
   *          The file to write to. If the name does not end with ".star", that suffix is appended. An existing file is
   *          overwritten.
   * @param resortFields
   *          Sort the fields, see {@link FieldSorter}. Ignored if the first column name ends with an index suffix like
   *          "#1", in which case all names are expected to be complete header lines in the correct order already.
   * @param resortRecords
   *          Sort the records, see {@link RecordSorter}.
   * @param simplify
   *          Collapse and remove derived fields, see {@link StarSimplifier}.
   * @return The path of the file that has been written.
   */
  public Path write(Path file, StarTable table, boolean resortFields, boolean resortRecords, boolean simplify)
      throws IOException {
    Path target = file;
    if (!file.getFileName().toString().endsWith(FILE_SUFFIX))
      target = file.resolveSibling(file.getFileName().toString() + FILE_SUFFIX);

    StarTable res = table.copy();
    if (resortRecords)
      recordSorter.sortRecords(res, true);
    if (simplify)
      simplifier.simplify(res, false, true);
    res.removeColumn(FieldNames.INDEX_COLUMN);

    List<String> columnNames = res.getColumnNames();
    boolean indexed = !columnNames.isEmpty() && FieldNames.hasIndexSuffix(columnNames.get(0));
    if (!indexed && resortFields) {
      fieldSorter.sortFields(res, true);
      columnNames = res.getColumnNames();
    }

    logger.info("Writing {} records with {} fields to '{}'.", res.getNumberOfRows(), columnNames.size(), target);

    try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        ICSVWriter csvWriter = new CSVWriter(writer, ' ', ICSVWriter.NO_QUOTE_CHARACTER,
            ICSVWriter.NO_ESCAPE_CHARACTER, ICSVWriter.DEFAULT_LINE_END)) {
      writer.write(createHeader(columnNames, indexed));

      List<StarColumn> columns = res.getColumns();
      String[] line = new String[columns.size()];
      for (int row = 0; row < res.getNumberOfRows(); row++) {
        for (int col = 0; col < line.length; col++)
          line[col] = formatValue(columns.get(col), row);
        csvWriter.writeNext(line, false);
      }
      csvWriter.flush();
      if (csvWriter.checkError())
        throw new IOException("Could not write data to " + target);
    }

    return target;
  }

  private String createHeader(List<String> columnNames, boolean indexed) {
    StringBuilder sb = new StringBuilder();
    sb.append('\n');
    sb.append("data_").append(dataBlockName).append('\n');
    sb.append('\n');
    sb.append("loop_").append('\n');
    for (int i = 0; i < columnNames.size(); i++) {
      String name = indexed ? columnNames.get(i) : columnNames.get(i) + " #" + (i + 1);
      if (!name.startsWith("_"))
        sb.append('_');
      sb.append(name).append(" \n");
    }
    return sb.toString();
  }

  private String formatValue(StarColumn col, int row) {
    if (col.isMissing(row))
      return MISSING_VALUE;

    switch (col.getType()) {
    case DOUBLE:
      double d = col.getDouble(row);
      if (Double.isInfinite(d))
        return d > 0 ? "inf" : "-inf";
      return String.format(Locale.ROOT, "%." + floatDecimals + "f", d);
    case LONG:
      return Long.toString(col.getLong(row));
    default:
      return col.getString(row);
    }
  }
}
