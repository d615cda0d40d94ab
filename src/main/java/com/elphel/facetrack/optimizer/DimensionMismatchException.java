/**
 **
 ** DimensionMismatchException - residual vector length changed between evaluations of the same optimizer step
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DimensionMismatchException.java is free software: you can redistribute it and/or modify
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

public class DimensionMismatchException extends TrackingException {
	private static final long serialVersionUID = -1250378126612394713L;
	private final int expected;
	private final int actual;

	public DimensionMismatchException(String what, int expected, int actual) {
		super(what+": expected length "+expected+", got "+actual);
		this.expected = expected;
		this.actual =   actual;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}
}
