/**
 **
 ** NumericalException - non-finite residuals/Jacobian/update or failed normal-equation solve inside one step
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  NumericalException.java is free software: you can redistribute it and/or modify
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

/**
 * Raised inside {@link DifferentiableOptimizer#step} only. The optimizer converts it to
 * the carried {@link StepStatus}, discards the update and reports it in the statistics.
 */
public class NumericalException extends TrackingException {
	private static final long serialVersionUID = 6044193745862236711L;
	private final StepStatus status;

	public NumericalException(StepStatus status, String message) {
		super(message);
		this.status = status;
	}

	public StepStatus getStatus() {
		return status;
	}
}
