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
package spx.numerics.atomic;

import java.util.concurrent.atomic.DoubleAdder;
import spx.numerics.parallel.WorkerTeam;

/**
 * Accumulates into one {@link DoubleAdder} per element. The memory cost does not grow with the
 * number of threads, and the totals are available without a reduction.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class AdderDoubleArray implements AtomicDoubleArray {

  private final DoubleAdder[] adders;

  /**
   * Constructor for AdderDoubleArray.
   *
   * @param size the number of elements.
   */
  public AdderDoubleArray(int size) {
    adders = new DoubleAdder[size];
    for (int i = 0; i < size; i++) {
      adders[i] = new DoubleAdder();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void add(int threadID, int index, double value) {
    adders[index].add(value);
  }

  /** {@inheritDoc} */
  @Override
  public double get(int index) {
    return adders[index].sum();
  }

  /** Totals are always current. */
  @Override
  public void reduce(int lb, int ub) {
    // Nothing to combine.
  }

  /** Totals are always current. */
  @Override
  public void reduce(WorkerTeam workerTeam, int lb, int ub) {
    // Nothing to combine.
  }

  /**
   * {@inheritDoc}
   *
   * <p>The adders are shared, so this clears the elements for every thread.
   */
  @Override
  public void reset(int threadID, int lb, int ub) {
    for (int i = lb; i <= ub; i++) {
      adders[i].reset();
    }
  }

  /** {@inheritDoc} */
  @Override
  public int size() {
    return adders.length;
  }
}
