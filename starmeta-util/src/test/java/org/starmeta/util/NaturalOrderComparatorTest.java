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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link NaturalOrderComparator}.
 *
 * @author Bastian Gloeckle
 */
public class NaturalOrderComparatorTest {
  private NaturalOrderComparator comparator = new NaturalOrderComparator();

  @Test
  public void numbersComparedByValue() {
    Assert.assertTrue(comparator.compare("img9", "img10") < 0, "img9 should sort before img10");
    Assert.assertTrue(comparator.compare("img10", "img9") > 0, "img10 should sort after img9");
    Assert.assertEquals(comparator.compare("img10", "img10"), 0);
  }

  @Test
  public void sortsFileNames() {
    // GIVEN
    List<String> names = new ArrayList<>(Arrays.asList("mic/stack10.mrcs_2", "mic/stack2.mrcs_10",
        "mic/stack2.mrcs_1", "mic/stack1.mrcs_3"));

    // WHEN
    names.sort(comparator);

    // THEN
    Assert.assertEquals(names, Arrays.asList("mic/stack1.mrcs_3", "mic/stack2.mrcs_1", "mic/stack2.mrcs_10",
        "mic/stack10.mrcs_2"));
  }

  @Test
  public void leadingZerosBreakTiesOnly() {
    Assert.assertTrue(comparator.compare("a01", "a1") > 0);
    Assert.assertTrue(comparator.compare("a01", "a2") < 0);
  }

  @Test
  public void prefixSortsFirst() {
    Assert.assertTrue(comparator.compare("abc", "abcd") < 0);
    Assert.assertTrue(comparator.compare("", "a") < 0);
  }

  @Test
  public void hugeNumbers() {
    Assert.assertTrue(comparator.compare("x123456789012345678901", "x123456789012345678902") < 0);
  }
}
