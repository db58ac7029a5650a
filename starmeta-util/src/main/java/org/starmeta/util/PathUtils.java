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
package org.starmeta.util;

/**
 * Helpers for file paths that are stored as plain strings inside STAR files.
 * 
 * <p>
 * These paths are always '/'-separated, regardless of the platform the data is processed on, therefore
 * {@link java.nio.file.Path} is not used.
 *
 * @author Bastian Gloeckle
 */
public class PathUtils {
  public static final char SEPARATOR = '/';

  /**
   * @return The final component of the given path, i.e. everything after the last '/'. Returns the empty string if the
   *         path ends with a '/'.
   */
  public static String basename(String path) {
    int idx = path.lastIndexOf(SEPARATOR);
    if (idx < 0)
      return path;
    return path.substring(idx + 1);
  }

  /**
   * @return The directory part of the given path, without trailing '/'. Empty string if the path has no directory.
   */
  public static String dirname(String path) {
    int idx = path.lastIndexOf(SEPARATOR);
    if (idx < 0)
      return "";
    return path.substring(0, idx);
  }

  /**
   * Join a directory and a file name.
   * 
   * <p>
   * If the directory is empty, the file name is returned unchanged; no duplicate '/' is introduced if the directory
   * already ends with one.
   */
  public static String join(String directory, String fileName) {
    if (directory.isEmpty())
      return fileName;
    if (directory.charAt(directory.length() - 1) == SEPARATOR)
      return directory + fileName;
    return directory + SEPARATOR + fileName;
  }
}
