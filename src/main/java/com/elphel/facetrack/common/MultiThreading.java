/**
 **
 ** MultiThreading - thread array helpers for the data-parallel loops over correspondences, residuals and Jacobian columns
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiThreading.java is free software: you can redistribute it and/or modify
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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;

public class MultiThreading {
	public static final int THREADS_MAX = 100;

	/* Create a Thread[] array as large as the number of processors available, limited by maxCPUs.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus > maxCPUs) n_cpus = maxCPUs;
		if (n_cpus < 1)       n_cpus = 1;
		return new Thread[n_cpus];
	}

	/* Start all given threads and wait on each of them until all are done. */
	public static void startAndJoin(Thread[] threads) {
		for (int ithread = 0; ithread < threads.length; ++ithread) {
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try {
			for (int ithread = 0; ithread < threads.length; ++ithread) {
				threads[ithread].join();
			}
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}

	/**
	 * Run body for every index in [0, num_items), distributing indices over a thread array.
	 * Each index is processed by exactly one thread, so results written to per-index slots
	 * do not depend on the number of threads. The first exception thrown by any thread is
	 * re-thrown in the caller.
	 * @param num_items   number of indices to process
	 * @param threads_max maximal number of threads (1 - run in the calling thread)
	 * @param body        per-index operation
	 */
	public static void runIndexed(
			final int         num_items,
			final int         threads_max,
			final IntConsumer body) {
		if (num_items <= 0) {
			return;
		}
		if ((threads_max <= 1) || (num_items == 1)) {
			for (int i = 0; i < num_items; i++) {
				body.accept(i);
			}
			return;
		}
		final Thread[] threads = newThreadArray(Math.min(threads_max, num_items));
		final AtomicInteger ai = new AtomicInteger(0);
		final AtomicReference<RuntimeException> failure = new AtomicReference<RuntimeException>();
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				public void run() {
					for (int indx = ai.getAndIncrement(); indx < num_items; indx = ai.getAndIncrement()) {
						if (failure.get() != null) {
							break;
						}
						try {
							body.accept(indx);
						} catch (RuntimeException e) {
							failure.compareAndSet(null, e);
						}
					}
				}
			};
		}
		startAndJoin(threads);
		if (failure.get() != null) {
			throw failure.get();
		}
	}
}
