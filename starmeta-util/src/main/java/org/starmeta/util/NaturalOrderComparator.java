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

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * A {@link Comparator} on Strings which compares embedded runs of digits by their numeric value instead of
 * lexicographically.
 * 
 * <p>
 * Using this comparator, "img9" sorts before "img10" and "a2@b" before "a10@b". Runs of non-digits are compared
 * char-wise. If two numeric runs have the same value but a different number of leading zeros, the shorter run sorts
 * first, so the order is total and consistent with equals.
 *
 * @author Bastian Gloeckle
 */
public class NaturalOrderComparator implements Comparator<String>, Serializable {
  private static final long serialVersionUID = 1L;

  @Override
  public int compare(String left, String right) {
    int posLeft = 0;
    int posRight = 0;
    int leadingZeroTieBreak = 0;

    while (posLeft < left.length() && posRight < right.length()) {
      char l = left.charAt(posLeft);
      char r = right.charAt(posRight);

      if (Character.isDigit(l) && Character.isDigit(r)) {
        int endLeft = endOfDigits(left, posLeft);
        int endRight = endOfDigits(right, posRight);

        String numLeft = left.substring(posLeft, endLeft);
        String numRight = right.substring(posRight, endRight);

        int cmp = new BigInteger(numLeft).compareTo(new BigInteger(numRight));
        if (cmp != 0)
          return cmp;

        if (leadingZeroTieBreak == 0)
          leadingZeroTieBreak = Integer.compare(numLeft.length(), numRight.length());

        posLeft = endLeft;
        posRight = endRight;
        continue;
      }

      if (l != r)
        return Character.compare(l, r);

      posLeft++;
      posRight++;
    }

    int remaining = Integer.compare(left.length() - posLeft, right.length() - posRight);
    if (remaining != 0)
      return remaining;

    return leadingZeroTieBreak;
  }

  private static int endOfDigits(String s, int start) {
    int pos = start;
    while (pos < s.length() && Character.isDigit(s.charAt(pos)))
      pos++;
    return pos;
  }
}
