/**
 **
 ** RegularizeModule - predicts regularization priors for the active parameters
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  RegularizeModule.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.regularize;

import java.util.List;

import com.elphel.facetrack.optimizer.ParameterSet;

/**
 * Each active group is pulled toward reference + delta with confidence weight. A null delta
 * or weight removes the group's regularization rows.
 */
public interface RegularizeModule {
	RegularizeOutput predict(ParameterSet params, List<String> active_names, double [] latent);

	default String getName() {
		return getClass().getSimpleName();
	}
}
