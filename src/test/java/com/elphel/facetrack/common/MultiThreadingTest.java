/**
 **
 ** MultiThreadingTest - tests of the indexed thread pool helper
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiThreadingTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.common;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class MultiThreadingTest {

	@Test
	@DisplayName("every index is processed once, independent of the thread count")
	void runIndexed() {
		final int n = 1000;
		final double [] single = new double [n];
		final double [] multi =  new double [n];
		final AtomicInteger calls = new AtomicInteger();
		MultiThreading.runIndexed(n, 1, (i) -> single[i] = Math.sqrt(i));
		MultiThreading.runIndexed(n, 8, (i) -> {
			multi[i] = Math.sqrt(i);
			calls.incrementAndGet();
		});
		assertArrayEquals(single, multi, 0.0);
		assertEquals(n, calls.get());
		MultiThreading.runIndexed(0, 8, (i) -> calls.incrementAndGet());
		assertEquals(n, calls.get());
	}

	@Test
	@DisplayName("exception of a worker thread reaches the caller")
	void failure() {
		IllegalStateException e = assertThrows(IllegalStateException.class,
				() -> MultiThreading.runIndexed(100, 4, (i) -> {
					if (i == 42) {
						throw new IllegalStateException("index "+i);
					}
				}));
		assertEquals("index 42", e.getMessage());
	}

	@Test
	@DisplayName("thread array is limited by the requested maximum")
	void threadArray() {
		assertEquals(1, MultiThreading.newThreadArray(1).length);
		assertEquals(1, MultiThreading.newThreadArray(0).length);
	}
}
