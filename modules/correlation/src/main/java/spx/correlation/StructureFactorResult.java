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
 * The structure factor S(q) on a grid of wavenumbers.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class StructureFactorResult {

  private final double[] q;
  private final double[] s;

  StructureFactorResult(double[] q, double[] s) {
    this.q = q;
    this.s = s;
  }

  /**
   * The wavenumbers.
   *
   * @return a copy of q.
   */
  public double[] getWavenumbers() {
    return q.clone();
  }

  /**
   * The structure factor, aligned with the wavenumbers.
   *
   * @return a copy of S(q).
   */
  public double[] getValues() {
    return s.clone();
  }

  /**
   * Getter for one wavenumber.
   *
   * @param i the wavenumber index.
   * @return q_i.
   */
  public double getWavenumber(int i) {
    return q[i];
  }

  /**
   * Getter for the structure factor at one wavenumber.
   *
   * @param i the wavenumber index.
   * @return S(q_i).
   */
  public double getValue(int i) {
    return s[i];
  }

  /**
   * Getter for the number of wavenumbers.
   *
   * @return the number of (q, S) pairs.
   */
  public int size() {
    return q.length;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" Structure factor at %d wavenumbers\n", q.length));
    for (int i = 0; i < q.length; i++) {
      sb.append(format("  %10.6f %12.6f\n", q[i], s[i]));
    }
    return sb.toString();
  }
}
