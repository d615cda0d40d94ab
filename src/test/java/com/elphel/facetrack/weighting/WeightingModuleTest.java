/**
 **
 ** WeightingModuleTest - tests of the robust weighting modules
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WeightingModuleTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.weighting;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DimensionMismatchException;

public class WeightingModuleTest {
	private static final double [][] S_POINT =  {{0, 0, 0},   {0, 0, 0},   {0, 0, 0}};
	private static final double [][] S_NORMAL = {{0, 0, 1},   {0, 0, 1},   {0, 0, 1}};
	private static final double [][] T_POINT =  {{0, 0, 0.5}, {0, 0, 4.0}, {1, 0, -2.0}};
	private static final double [][] T_NORMAL = {{0, 0, 1},   {0, 0, 1},   {0, 0, 1}};

	@Test
	@DisplayName("dummy module returns ones for every correspondence")
	void dummyOnes() {
		WeightOutput out = new DummyWeightModule().predict(S_POINT, S_NORMAL, T_POINT, T_NORMAL);
		assertArrayEquals(new double [] {1.0, 1.0, 1.0}, out.getWeights());
		assertEquals(0, out.getLatent().length);
		assertEquals(0, new DummyWeightModule().predict(new double [0][], null, new double [0][], null).getWeights().length);
	}

	@Nested
	@DisplayName("learned module")
	class Learned {
		@Test
		@DisplayName("negative and non-finite weights are replaced by zeros, latent passes through")
		void clamps() {
			final double [] latent = {7.0};
			LearnedWeightModule module = new LearnedWeightModule(
					(sp, sn, tp, tn) -> new WeightOutput(new double [] {-1.0, Double.NaN, 0.25}, latent));
			WeightOutput out = module.predict(S_POINT, S_NORMAL, T_POINT, T_NORMAL);
			assertArrayEquals(new double [] {0.0, 0.0, 0.25}, out.getWeights());
			assertSame(latent, out.getLatent());
		}

		@Test
		@DisplayName("weights of a wrong length are rejected")
		void wrongLength() {
			LearnedWeightModule module = new LearnedWeightModule(
					(sp, sn, tp, tn) -> new WeightOutput(new double [] {1.0, 1.0}, null));
			DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
					() -> module.predict(S_POINT, S_NORMAL, T_POINT, T_NORMAL));
			assertEquals(3, e.getExpected());
			assertEquals(2, e.getActual());
		}
	}

	@Nested
	@DisplayName("Huber module")
	class Huber {
		@Test
		@DisplayName("inliers get 1, outliers k/|r|")
		void weights() {
			WeightOutput out = new HuberWeightModule(1.0).predict(S_POINT, S_NORMAL, T_POINT, T_NORMAL);
			assertArrayEquals(new double [] {1.0, 0.25, 0.5}, out.getWeights());
			assertArrayEquals(new double [] {0.25, 1.0, 1.75 / 3}, out.getMinMaxMean(), 1e-15);
		}

		@Test
		@DisplayName("missing rows get zero weight")
		void missing() {
			double [][] t_point = {null, {0, 0, Double.NaN}, {0, 0, 0}};
			WeightOutput out = new HuberWeightModule(1.0).predict(S_POINT, S_NORMAL, t_point, T_NORMAL);
			assertArrayEquals(new double [] {0.0, 0.0, 1.0}, out.getWeights());
		}

		@Test
		@DisplayName("threshold must be positive")
		void threshold() {
			assertThrows(ConfigurationException.class, () -> new HuberWeightModule(0.0));
			assertEquals(0.5, new HuberWeightModule(0.5).getThreshold());
		}
	}
}
