/**
 **
 ** ParameterLayout - position of the active parameter groups in the flat vector of free variables
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ParameterLayout.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Maps the active parameter groups, in the declared order, onto a flat vector.
 * Group values of a batched set occupy a contiguous range, item after item:
 * column = offset(name) + item * dimension(name) + k.
 */
public class ParameterLayout {
	private final List<String> names;
	private final int []       offsets;
	private final int []       dimensions;
	private final int          batch_size;
	private final int          num_pars;

	public ParameterLayout(ParameterSet params, List<String> active_names) {
		this.batch_size = params.getBatchSize();
		this.names =      Collections.unmodifiableList(new ArrayList<String>(active_names));
		this.offsets =    new int [names.size()];
		this.dimensions = new int [names.size()];
		HashSet<String> seen = new HashSet<String>();
		int offset = 0;
		for (int i = 0; i < names.size(); i++) {
			String name = names.get(i);
			if (!params.has(name)) {
				throw new ConfigurationException("Unknown active parameter \""+name+"\", defined are "+params.names());
			}
			if (!seen.add(name)) {
				throw new ConfigurationException("Active parameter \""+name+"\" is listed more than once");
			}
			offsets[i] =    offset;
			dimensions[i] = params.dimension(name);
			offset +=       params.size(name);
		}
		this.num_pars = offset;
	}

	private ParameterLayout(List<String> names, int [] dimensions) {
		this.batch_size = 1;
		this.names =      names;
		this.dimensions = dimensions.clone();
		this.offsets =    new int [names.size()];
		int offset = 0;
		for (int i = 0; i < names.size(); i++) {
			offsets[i] = offset;
			offset +=    dimensions[i];
		}
		this.num_pars = offset;
	}

	/** @return layout of the same groups for a single (non-batched) item */
	public ParameterLayout itemLayout() {
		if (batch_size == 1) {
			return this;
		}
		return new ParameterLayout(names, dimensions);
	}

	public List<String> names() {
		return names;
	}

	public boolean isEmpty() {
		return num_pars == 0;
	}

	public int getNumParameters() {
		return num_pars;
	}

	public int getBatchSize() {
		return batch_size;
	}

	public int indexOf(String name) {
		return names.indexOf(name);
	}

	private int require(String name) {
		int indx = names.indexOf(name);
		if (indx < 0) {
			throw new ConfigurationException("Parameter \""+name+"\" is not active, active are "+names);
		}
		return indx;
	}

	public int getOffset(String name) {
		return offsets[require(name)];
	}

	public int getDimension(String name) {
		return dimensions[require(name)];
	}

	public int getColumn(String name, int item, int k) {
		int indx = require(name);
		return offsets[indx] + item * dimensions[indx] + k;
	}

	public String getColumnName(int column) {
		for (int i = names.size() - 1; i >= 0; i--) {
			if (column >= offsets[i]) {
				return names.get(i)+"["+(column - offsets[i])+"]";
			}
		}
		return "?["+column+"]";
	}

	/**
	 * Gather active group values into a flat vector
	 * @param params parameter set with the same groups and sizes this layout was built for
	 * @return flat vector of the free variables
	 */
	public double [] flatten(ParameterSet params) {
		double [] vector = new double [num_pars];
		for (int i = 0; i < names.size(); i++) {
			double [] v = params.get(names.get(i));
			if (v.length != dimensions[i] * batch_size) {
				throw new DimensionMismatchException("Parameter \""+names.get(i)+"\"", dimensions[i] * batch_size, v.length);
			}
			System.arraycopy(v, 0, vector, offsets[i], v.length);
		}
		return vector;
	}

	/**
	 * Build a full parameter set from fixed values and the free variables.
	 * @param base   parameter set providing values of the inactive groups (not modified)
	 * @param vector flat values of the active groups, in the layout order
	 * @return new parameter set, active groups replaced with vector values
	 */
	public ParameterSet overlay(ParameterSet base, double [] vector) {
		if (vector.length != num_pars) {
			throw new DimensionMismatchException("Active parameter vector", num_pars, vector.length);
		}
		ParameterSet ps = base.copy();
		for (int i = 0; i < names.size(); i++) {
			int len = dimensions[i] * batch_size;
			double [] v = new double [len];
			System.arraycopy(vector, offsets[i], v, 0, len);
			ps.set(names.get(i), v);
		}
		return ps;
	}

	@Override
	public String toString() {
		return "ParameterLayout"+names+" ("+num_pars+" values, batch "+batch_size+")";
	}
}
