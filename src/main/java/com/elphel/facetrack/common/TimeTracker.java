/**
 **
 ** TimeTracker - accumulates wall-clock time of named sections of the tracking loop
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TimeTracker.java is free software: you can redistribute it and/or modify
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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class TimeTracker {
	private final Map<String, Long>    started =  new HashMap<String, Long>();
	private final Map<String, Long>    total_ns = new LinkedHashMap<String, Long>();
	private final Map<String, Integer> counts =   new LinkedHashMap<String, Integer>();

	public void start(String name) {
		started.put(name, System.nanoTime());
	}

	/**
	 * Stop a running section and add its duration to the section total.
	 * @param name section name
	 * @return duration of this run in milliseconds
	 */
	public double stop(String name) {
		Long t0 = started.remove(name);
		if (t0 == null) {
			throw new IllegalStateException("Section \""+name+"\" was not started");
		}
		long dt = System.nanoTime() - t0;
		total_ns.merge(name, dt, Long::sum);
		counts.merge(name, 1, Integer::sum);
		return dt * 1E-6;
	}

	public boolean isRunning(String name) {
		return started.containsKey(name);
	}

	public double getTotalMs(String name) {
		Long t = total_ns.get(name);
		return (t == null) ? 0.0 : t * 1E-6;
	}

	public int getCount(String name) {
		Integer n = counts.get(name);
		return (n == null) ? 0 : n;
	}

	public double getMeanMs(String name) {
		int n = getCount(name);
		return (n == 0) ? 0.0 : getTotalMs(name) / n;
	}

	/**
	 * @return section name to total milliseconds, in the order sections were first stopped
	 */
	public Map<String, Double> getTotals() {
		Map<String, Double> rslt = new LinkedHashMap<String, Double>();
		for (String name : total_ns.keySet()) {
			rslt.put(name, getTotalMs(name));
		}
		return Collections.unmodifiableMap(rslt);
	}

	public void reset() {
		started.clear();
		total_ns.clear();
		counts.clear();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (String name : total_ns.keySet()) {
			sb.append(String.format("%-22s total=%10.3f ms, runs=%5d, mean=%9.3f ms%n",
					name, getTotalMs(name), getCount(name), getMeanMs(name)));
		}
		return sb.toString();
	}
}
