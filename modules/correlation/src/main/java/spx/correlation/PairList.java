// ******************************************************************************
//
// Title:       Spatial Statistics X.
// Description: Spatial Statistics X - Pair Correlations of Periodic Particle Systems.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of Spatial Statistics X.
//
// Spatial Statistics X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Spatial Statistics X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Spatial Statistics X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package spx.correlation;

import static java.lang.String.format;

/**
 * A PairList holds every ordered pair (i, j) of distinct particles within a cutoff. Entries k and
 * k + P, where P is the number of unordered pairs, are the two orderings of the same pair, so the
 * size is always even.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PairList {

  /** The lower index of each unordered pair. */
  private final int[] first;
  /** The higher index of each unordered pair. */
  private final int[] second;

  /**
   * Constructor for a PairList.
   *
   * @param first the first particle of each unordered pair.
   * @param second the second particle of each unordered pair.
   */
  PairList(int[] first, int[] second) {
    if (first.length != second.length) {
      throw new IllegalArgumentException(
          format(" Pair arrays differ in length (%d, %d).", first.length, second.length));
    }
    this.first = first;
    this.second = second;
  }

  /**
   * The number of ordered pairs.
   *
   * @return twice the number of unordered pairs.
   */
  public int size() {
    return 2 * first.length;
  }

  /**
   * The number of unordered pairs.
   *
   * @return the number of unordered pairs.
   */
  public int getUnorderedCount() {
    return first.length;
  }

  /**
   * The origin particle i of ordered pair k.
   *
   * @param k the ordered pair index.
   * @return the particle index.
   */
  public int getI(int k) {
    int p = first.length;
    return k < p ? first[k] : second[k - p];
  }

  /**
   * The partner particle j of ordered pair k.
   *
   * @param k the ordered pair index.
   * @return the particle index.
   */
  public int getJ(int k) {
    int p = first.length;
    return k < p ? second[k] : first[k - p];
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %d ordered pairs (%d unordered)", size(), first.length);
  }
}
