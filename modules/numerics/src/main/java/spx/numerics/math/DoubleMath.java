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
package spx.numerics.math;

import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The DoubleMath class is a simple math library that operates on 2 or 3-coordinate double arrays
 * and on small square matrices stored as double[row][column].
 *
 * <p>All methods are static and thread-safe. Methods that accept a <code>ret</code> argument write
 * into it and return it, so that inner loops can avoid allocation.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DoubleMath {

  private DoubleMath() {
    // Prevent instantiation.
  }

  /**
   * Compute the cross product of two 3-coordinate vectors.
   *
   * @param a First input vector.
   * @param b Second input vector.
   * @param ret The cross product a x b.
   * @return Returns the cross product a x b.
   */
  public static double[] X(double[] a, double[] b, double[] ret) {
    double x = a[1] * b[2] - a[2] * b[1];
    double y = a[2] * b[0] - a[0] * b[2];
    double z = a[0] * b[1] - a[1] * b[0];
    ret[0] = x;
    ret[1] = y;
    ret[2] = z;
    return ret;
  }

  /**
   * Finds the dot product between two vectors of equal length.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the dot product of a and b.
   */
  public static double dot(double[] a, double[] b) {
    double dot = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
    }
    return dot;
  }

  /**
   * Returns the length of a vector.
   *
   * @param d A vector.
   * @return Returns the length of the vector.
   */
  public static double length(double[] d) {
    return sqrt(dot(d, d));
  }

  /**
   * Normalize a vector.
   *
   * @param n A vector to normalize.
   * @param ret The normalized vector.
   * @return Returns the normalized vector.
   */
  public static double[] normalize(double[] n, double[] ret) {
    double length = length(n);
    for (int i = 0; i < n.length; i++) {
      ret[i] = n[i] / length;
    }
    return ret;
  }

  /**
   * Vector a minus vector b.
   *
   * @param a First vector.
   * @param b Second vector.
   * @param ret Return a - b.
   * @return Returns a - b.
   */
  public static double[] sub(double[] a, double[] b, double[] ret) {
    for (int i = 0; i < a.length; i++) {
      ret[i] = a[i] - b[i];
    }
    return ret;
  }

  /**
   * The identity matrix.
   *
   * @param n The number of rows and columns.
   * @return Returns an n x n identity matrix.
   */
  public static double[][] identity(int n) {
    double[][] m = new double[n][n];
    for (int i = 0; i < n; i++) {
      m[i][i] = 1.0;
    }
    return m;
  }

  /**
   * Multiply a square matrix and a column vector.
   *
   * @param m The matrix.
   * @param v The vector; may not be the same array as ret.
   * @param ret Return m * v.
   * @return Returns m * v.
   */
  public static double[] matVec(double[][] m, double[] v, double[] ret) {
    for (int i = 0; i < m.length; i++) {
      ret[i] = dot(m[i], v);
    }
    return ret;
  }

  /**
   * Multiply two square matrices.
   *
   * @param m The left matrix.
   * @param n The right matrix.
   * @return Returns m * n in a new matrix.
   */
  public static double[][] matMat(double[][] m, double[][] n) {
    int size = m.length;
    double[][] ret = new double[size][size];
    for (int i = 0; i < size; i++) {
      for (int j = 0; j < size; j++) {
        double sum = 0.0;
        for (int k = 0; k < size; k++) {
          sum += m[i][k] * n[k][j];
        }
        ret[i][j] = sum;
      }
    }
    return ret;
  }
}
