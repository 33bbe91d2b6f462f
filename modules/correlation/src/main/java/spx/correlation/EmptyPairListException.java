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
 * Thrown when no particle pair lies within the cutoff. The calculation can be retried with a
 * larger cutoff.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class EmptyPairListException extends RuntimeException {

  private final int nParticles;
  private final double cutoff;

  /**
   * Constructor for EmptyPairListException.
   *
   * @param nParticles the number of particles searched.
   * @param cutoff the cutoff used.
   */
  public EmptyPairListException(int nParticles, double cutoff) {
    super(format("Counted 0 pairs among %d particles within %.4f. Try increasing rmax.",
        nParticles, cutoff));
    this.nParticles = nParticles;
    this.cutoff = cutoff;
  }

  public int getNumberOfParticles() {
    return nParticles;
  }

  public double getCutoff() {
    return cutoff;
  }
}
