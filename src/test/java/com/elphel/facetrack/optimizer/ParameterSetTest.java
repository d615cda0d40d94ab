/**
 **
 ** ParameterSetTest - tests of parameter groups, layouts and batching
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ParameterSetTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.optimizer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class ParameterSetTest {

	private static ParameterSet sample() {
		return new ParameterSet()
				.add(ParameterSet.TRANSL,      0.1, 0.2, 0.3)
				.add(ParameterSet.GLOBAL_POSE, 0.0, 0.0, 0.0)
				.add(ParameterSet.EXPRESSION,  1.0, 2.0);
	}

	@Nested
	@DisplayName("ParameterSet")
	class Groups {
		@Test
		@DisplayName("keeps declaration order and returns copies")
		void orderAndCopies() {
			ParameterSet ps = sample();
			assertEquals(Arrays.asList("transl", "global_pose", "expression"), ps.names());
			double [] t = ps.get(ParameterSet.TRANSL);
			t[0] = 100.0;
			assertEquals(0.1, ps.getValue(ParameterSet.TRANSL, 0));
			assertEquals(8, ps.totalSize());
		}

		@Test
		@DisplayName("rejects duplicate names, unknown names and length changes")
		void errors() {
			ParameterSet ps = sample();
			assertThrows(ConfigurationException.class, () -> ps.add(ParameterSet.TRANSL, 1.0));
			assertThrows(ConfigurationException.class, () -> ps.get("unknown"));
			assertThrows(DimensionMismatchException.class, () -> ps.set(ParameterSet.EXPRESSION, new double [3]));
		}

		@Test
		@DisplayName("copies are independent and compare equal")
		void copyEquals() {
			ParameterSet ps = sample();
			ParameterSet copy = ps.copy();
			assertEquals(ps, copy);
			assertEquals(ps.hashCode(), copy.hashCode());
			copy.set(ParameterSet.EXPRESSION, new double [] {1.0, 2.5});
			assertNotEquals(ps, copy);
			assertArrayEquals(new double [] {1.0, 2.0}, ps.get(ParameterSet.EXPRESSION));
		}

		@Test
		@DisplayName("detects non-finite values")
		void finite() {
			ParameterSet ps = sample();
			assertTrue(ps.isFinite());
			ps.set(ParameterSet.TRANSL, new double [] {0.0, Double.NaN, 0.0});
			assertFalse(ps.isFinite());
		}

		@Test
		@DisplayName("stack and unstack batch items")
		void batching() {
			ParameterSet a = sample();
			ParameterSet b = sample();
			b.set(ParameterSet.EXPRESSION, new double [] {3.0, 4.0});
			ParameterSet batch = ParameterSet.stack(Arrays.asList(a, b));
			assertEquals(2, batch.getBatchSize());
			assertEquals(2, batch.dimension(ParameterSet.EXPRESSION));
			assertEquals(4, batch.size(ParameterSet.EXPRESSION));
			assertArrayEquals(new double [] {1.0, 2.0, 3.0, 4.0}, batch.get(ParameterSet.EXPRESSION));
			List<ParameterSet> items = batch.unstack();
			assertEquals(a, items.get(0));
			assertEquals(b, items.get(1));
		}
	}

	@Nested
	@DisplayName("ParameterLayout")
	class Layout {
		@Test
		@DisplayName("flattens active groups in the declared order")
		void flatten() {
			ParameterSet ps = sample();
			ParameterLayout layout = new ParameterLayout(ps, Arrays.asList(ParameterSet.EXPRESSION, ParameterSet.TRANSL));
			assertEquals(5, layout.getNumParameters());
			assertEquals(0, layout.getOffset(ParameterSet.EXPRESSION));
			assertEquals(2, layout.getOffset(ParameterSet.TRANSL));
			assertArrayEquals(new double [] {1.0, 2.0, 0.1, 0.2, 0.3}, layout.flatten(ps));
			assertEquals("transl[1]", layout.getColumnName(3));
		}

		@Test
		@DisplayName("overlay replaces only active groups")
		void overlay() {
			ParameterSet ps = sample();
			ParameterLayout layout = new ParameterLayout(ps, Arrays.asList(ParameterSet.EXPRESSION));
			ParameterSet over = layout.overlay(ps, new double [] {5.0, 6.0});
			assertArrayEquals(new double [] {5.0, 6.0}, over.get(ParameterSet.EXPRESSION));
			assertArrayEquals(ps.get(ParameterSet.TRANSL), over.get(ParameterSet.TRANSL));
			assertArrayEquals(new double [] {1.0, 2.0}, ps.get(ParameterSet.EXPRESSION));
			assertThrows(DimensionMismatchException.class, () -> layout.overlay(ps, new double [3]));
		}

		@Test
		@DisplayName("batched columns are grouped by parameter, then by item")
		void batchedColumns() {
			ParameterSet batch = ParameterSet.stack(Arrays.asList(sample(), sample()));
			ParameterLayout layout = new ParameterLayout(batch, Arrays.asList(ParameterSet.TRANSL, ParameterSet.EXPRESSION));
			assertEquals(10, layout.getNumParameters());
			assertEquals(4, layout.getColumn(ParameterSet.TRANSL, 1, 1));
			assertEquals(8, layout.getColumn(ParameterSet.EXPRESSION, 1, 0));
			ParameterLayout item = layout.itemLayout();
			assertEquals(5, item.getNumParameters());
			assertEquals(3, item.getOffset(ParameterSet.EXPRESSION));
		}

		@Test
		@DisplayName("unknown and repeated names are configuration errors")
		void errors() {
			ParameterSet ps = sample();
			assertThrows(ConfigurationException.class, () -> new ParameterLayout(ps, Arrays.asList("shape")));
			assertThrows(ConfigurationException.class,
					() -> new ParameterLayout(ps, Arrays.asList(ParameterSet.TRANSL, ParameterSet.TRANSL)));
		}
	}
}
