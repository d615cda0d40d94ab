/**
 **
 ** CorrespondenceFilterTest - tests of correspondence selection
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrespondenceFilterTest.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.facetrack.correspondence;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DimensionMismatchException;

public class CorrespondenceFilterTest {
	private static final double [] UP = {0, 0, 1};

	@Nested
	@DisplayName("individual conditions")
	class Conditions {
		private final CorrespondenceFilter filter = CorrespondenceFilter.fromAngle(0.01, 45.0, 1);

		@Test
		@DisplayName("each sub-condition is reported")
		void diagnostics() {
			boolean [] s_mask = {true, true,  true,  true,  false};
			boolean [] t_mask = {true, false, true,  true,  true};
			double [][] s_point = {{0, 0, 0}, {0, 0, 0}, {0, 0, 0}, {0, 0, 0}, {0, 0, 0}};
			double [][] t_point = {{0, 0, 0.005}, {0, 0, 0}, {0, 0, 0.02}, {0, 0, 0}, {0, 0, 0}};
			double [][] s_normal = {UP, UP, UP, UP, UP};
			double [][] t_normal = {{0, 0.6, 0.8}, UP, UP, {1, 0, 0}, UP};
			CorrespondenceMask m = filter.mask(s_mask, s_point, s_normal, t_mask, t_point, t_normal);
			assertArrayEquals(new boolean [] {true, false, false, false, false}, m.getMask());
			assertArrayEquals(new boolean [] {true, false, true, true, false}, m.getDiagnostic(CorrespondenceMask.VALID));
			assertArrayEquals(new boolean [] {true, true, false, true, true}, m.getDiagnostic(CorrespondenceMask.DISTANCE));
			assertArrayEquals(new boolean [] {true, true, true, false, true}, m.getDiagnostic(CorrespondenceMask.NORMAL));
			assertEquals(1, m.count());
		}

		@Test
		@DisplayName("non-finite geometry is never selected")
		void nonFinite() {
			CorrespondenceMask m = filter.mask(
					new boolean [] {true}, new double [][] {{Double.NaN, 0, 0}}, new double [][] {UP},
					new boolean [] {true}, new double [][] {{0, 0, 0}}, new double [][] {UP});
			assertFalse(m.getMask()[0]);
		}
	}

	@Test
	@DisplayName("mask is a subset of both validity masks")
	void subsetOfValidity() {
		Random rnd = new Random(17);
		int n = 500;
		boolean [] s_mask = new boolean [n], t_mask = new boolean [n];
		double [][] s_point = new double [n][3], t_point = new double [n][3];
		double [][] s_normal = new double [n][], t_normal = new double [n][];
		for (int i = 0; i < n; i++) {
			s_mask[i] = rnd.nextBoolean();
			t_mask[i] = rnd.nextDouble() > 0.2;
			for (int c = 0; c < 3; c++) {
				s_point[i][c] = 0.01 * rnd.nextGaussian();
				t_point[i][c] = s_point[i][c] + 0.005 * rnd.nextGaussian();
			}
			s_normal[i] = unit(rnd);
			t_normal[i] = unit(rnd);
		}
		CorrespondenceFilter filter = new CorrespondenceFilter(0.008, 0.0, 4);
		CorrespondenceMask m = filter.mask(s_mask, s_point, s_normal, t_mask, t_point, t_normal);
		for (int i = 0; i < n; i++) {
			if (m.getMask()[i]) {
				assertEquals(true, s_mask[i] && t_mask[i]);
			}
		}
		CorrespondenceMask m1 = new CorrespondenceFilter(0.008, 0.0, 1).mask(s_mask, s_point, s_normal, t_mask, t_point, t_normal);
		assertArrayEquals(m1.getMask(), m.getMask());
	}

	@Test
	@DisplayName("wrong buffer lengths and thresholds are rejected")
	void errors() {
		CorrespondenceFilter filter = new CorrespondenceFilter(0.01, 0.5, 1);
		assertThrows(DimensionMismatchException.class, () -> filter.mask(
				new boolean [2], new double [2][3], new double [2][3], new boolean [1], new double [2][3], new double [2][3]));
		assertThrows(ConfigurationException.class, () -> new CorrespondenceFilter(-1.0, 0.5, 1));
		assertThrows(ConfigurationException.class, () -> new CorrespondenceFilter(0.01, 1.5, 1));
		assertEquals(0.5, CorrespondenceFilter.fromAngle(0.01, 60.0, 1).getCosineThreshold(), 1e-12);
	}

	private static double [] unit(Random rnd) {
		double [] v = {rnd.nextGaussian(), rnd.nextGaussian(), rnd.nextGaussian()};
		double l = Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
		return new double [] {v[0] / l, v[1] / l, v[2] / l};
	}
}
