/**
 **
 ** DummyRegularizeModule - zero offsets with zero weights, same result as no regularization
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DummyRegularizeModule.java is free software: you can redistribute it and/or modify
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

import java.util.LinkedHashMap;
import java.util.List;

import com.elphel.facetrack.optimizer.ParameterSet;

public class DummyRegularizeModule implements RegularizeModule {
	@Override
	public RegularizeOutput predict(ParameterSet params, List<String> active_names, double [] latent) {
		LinkedHashMap<String, double []> deltas =  new LinkedHashMap<String, double []>();
		LinkedHashMap<String, double []> weights = new LinkedHashMap<String, double []>();
		for (String name : active_names) {
			deltas.put(name,  new double [params.size(name)]);
			weights.put(name, new double [params.size(name)]);
		}
		return new RegularizeOutput(deltas, weights);
	}
}
