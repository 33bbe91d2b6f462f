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
package spx.numerics.parallel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.atomic.AtomicIntegerArray;
import org.junit.Test;
import spx.utilities.SPXTest;

/**
 * Test partitioning of loops by the WorkerTeam.
 *
 * @author Michael J. Schnieders
 */
public class WorkerTeamTest extends SPXTest {

  @Test
  public void everyIndexVisitedOnce() {
    int n = 1003;
    AtomicIntegerArray visits = new AtomicIntegerArray(n);
    try (WorkerTeam workerTeam = new WorkerTeam(8)) {
      workerTeam.execute(0, n - 1, (threadIndex, first, last) -> {
        assertTrue(threadIndex >= 0 && threadIndex < 8);
        for (int i = first; i <= last; i++) {
          visits.incrementAndGet(i);
        }
      });
    }
    for (int i = 0; i < n; i++) {
      assertEquals(1, visits.get(i));
    }
  }

  @Test
  public void fewerIndicesThanThreads() {
    AtomicIntegerArray visits = new AtomicIntegerArray(3);
    try (WorkerTeam workerTeam = new WorkerTeam(8)) {
      workerTeam.execute(0, 2, (threadIndex, first, last) -> {
        assertTrue(threadIndex < 3);
        for (int i = first; i <= last; i++) {
          visits.incrementAndGet(i);
        }
      });
      // An empty range executes nothing.
      workerTeam.execute(5, 4, (threadIndex, first, last) -> fail("Empty range executed."));
    }
    for (int i = 0; i < 3; i++) {
      assertEquals(1, visits.get(i));
    }
  }

  @Test
  public void loopExceptionsPropagate() {
    try (WorkerTeam workerTeam = new WorkerTeam(2)) {
      workerTeam.execute(0, 9, (threadIndex, first, last) -> {
        throw new ArithmeticException("boom");
      });
      fail("Expected an ArithmeticException.");
    } catch (ArithmeticException e) {
      // The exception type of the loop body is preserved.
      assertTrue(e instanceof ArithmeticException);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void threadCountMustBePositive() {
    new WorkerTeam(0);
  }
}
