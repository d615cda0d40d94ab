/**
 **
 ** StepStatus - outcome of a single optimizer step
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StepStatus.java is free software: you can redistribute it and/or modify
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

public enum StepStatus {
	APPLIED,
	NO_ACTIVE_PARAMETERS,
	EMPTY_RESIDUAL,
	NON_FINITE_RESIDUAL,
	NON_FINITE_JACOBIAN,
	NON_FINITE_UPDATE,
	SOLVE_FAILED,
	REJECTED;

	public boolean isApplied() {
		return this == APPLIED;
	}

	/** Numerical failures, as opposed to no-op steps with nothing to solve */
	public boolean isFailure() {
		switch (this) {
		case NON_FINITE_RESIDUAL:
		case NON_FINITE_JACOBIAN:
		case NON_FINITE_UPDATE:
		case SOLVE_FAILED:
			return true;
		default:
			return false;
		}
	}
}
