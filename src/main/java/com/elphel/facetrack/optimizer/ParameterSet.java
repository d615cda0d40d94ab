/**
 **
 ** ParameterSet - ordered mapping from model parameter group names to value vectors
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ParameterSet.java is free software: you can redistribute it and/or modify
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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named parameter groups of the face model (shape, expression, poses, translation, scale).
 * The set of names is fixed once the set is built, only the values change while tracking.
 * A batched set holds the values of batch_size items concatenated per group, item after item.
 */
public class ParameterSet {
	public static final String SHAPE =       "shape";
	public static final String EXPRESSION =  "expression";
	public static final String GLOBAL_POSE = "global_pose";
	public static final String NECK_POSE =   "neck_pose";
	public static final String JAW_POSE =    "jaw_pose";
	public static final String EYE_POSE =    "eye_pose";
	public static final String TRANSL =      "transl";
	public static final String SCALE =       "scale";

	private final LinkedHashMap<String, double []> values = new LinkedHashMap<String, double []>();
	private final int batch_size;

	public ParameterSet() {
		this(1);
	}

	public ParameterSet(int batch_size) {
		if (batch_size < 1) {
			throw new ConfigurationException("Batch size should be positive, got "+batch_size);
		}
		this.batch_size = batch_size;
	}

	/**
	 * Declare a new parameter group. Only used while building the set.
	 * @param name  group name, should not be already defined
	 * @param value initial values (copied), for a batched set - all items concatenated
	 * @return this set
	 */
	public ParameterSet add(String name, double ... value) {
		if (values.containsKey(name)) {
			throw new ConfigurationException("Parameter \""+name+"\" is already defined");
		}
		if ((value == null) || ((value.length % batch_size) != 0)) {
			throw new ConfigurationException("Parameter \""+name+"\" length should be a multiple of the batch size "+batch_size);
		}
		values.put(name, value.clone());
		return this;
	}

	public boolean has(String name) {
		return values.containsKey(name);
	}

	public List<String> names() {
		return Collections.unmodifiableList(new ArrayList<String>(values.keySet()));
	}

	public int getBatchSize() {
		return batch_size;
	}

	private double [] require(String name) {
		double [] v = values.get(name);
		if (v == null) {
			throw new ConfigurationException("Unknown parameter \""+name+"\", defined are "+values.keySet());
		}
		return v;
	}

	/** @return copy of the (stacked) group values */
	public double [] get(String name) {
		return require(name).clone();
	}

	public double getValue(String name, int indx) {
		return require(name)[indx];
	}

	/** @return stacked length of the group (dimension * batch size) */
	public int size(String name) {
		return require(name).length;
	}

	/** @return per-item length of the group */
	public int dimension(String name) {
		return require(name).length / batch_size;
	}

	public int totalSize() {
		int n = 0;
		for (double [] v : values.values()) {
			n += v.length;
		}
		return n;
	}

	/**
	 * Replace values of an existing group
	 * @param name  existing group name
	 * @param value new values, same length as the current ones (copied)
	 */
	public void set(String name, double [] value) {
		double [] v = require(name);
		if (value.length != v.length) {
			throw new DimensionMismatchException("Parameter \""+name+"\"", v.length, value.length);
		}
		System.arraycopy(value, 0, v, 0, v.length);
	}

	public ParameterSet copy() {
		ParameterSet ps = new ParameterSet(batch_size);
		for (Map.Entry<String, double []> entry : values.entrySet()) {
			ps.values.put(entry.getKey(), entry.getValue().clone());
		}
		return ps;
	}

	public boolean isFinite() {
		for (double [] v : values.values()) {
			for (double d : v) {
				if (!Double.isFinite(d)) {
					return false;
				}
			}
		}
		return true;
	}

	/**
	 * Extract a single item of a batched set
	 * @param item item index, 0 &lt;= item &lt; batch size
	 * @return non-batched copy of the item parameters
	 */
	public ParameterSet item(int item) {
		if ((item < 0) || (item >= batch_size)) {
			throw new IndexOutOfBoundsException("Item "+item+" of batch size "+batch_size);
		}
		if (batch_size == 1) {
			return copy();
		}
		ParameterSet ps = new ParameterSet();
		for (Map.Entry<String, double []> entry : values.entrySet()) {
			int dim = entry.getValue().length / batch_size;
			ps.values.put(entry.getKey(), Arrays.copyOfRange(entry.getValue(), item * dim, (item + 1) * dim));
		}
		return ps;
	}

	public List<ParameterSet> unstack() {
		List<ParameterSet> items = new ArrayList<ParameterSet>(batch_size);
		for (int i = 0; i < batch_size; i++) {
			items.add(item(i));
		}
		return items;
	}

	/**
	 * Combine per-item sets into one batched set. All items should have the same names and dimensions.
	 * @param items non-batched parameter sets
	 * @return batched set, values of each group concatenated in the item order
	 */
	public static ParameterSet stack(List<ParameterSet> items) {
		if ((items == null) || items.isEmpty()) {
			throw new ConfigurationException("Can not stack an empty list of parameter sets");
		}
		ParameterSet first = items.get(0);
		ParameterSet ps = new ParameterSet(items.size());
		for (String name : first.values.keySet()) {
			int dim = first.size(name);
			double [] v = new double [dim * items.size()];
			for (int i = 0; i < items.size(); i++) {
				ParameterSet item = items.get(i);
				if (item.batch_size != 1) {
					throw new ConfigurationException("Can not stack already batched parameter sets");
				}
				double [] iv = item.require(name);
				if (iv.length != dim) {
					throw new DimensionMismatchException("Parameter \""+name+"\" of item "+i, dim, iv.length);
				}
				System.arraycopy(iv, 0, v, i * dim, dim);
			}
			ps.values.put(name, v);
		}
		for (ParameterSet item : items) {
			if (!item.values.keySet().equals(first.values.keySet())) {
				throw new ConfigurationException("Stacked parameter sets have different names: "+
						item.values.keySet()+" and "+first.values.keySet());
			}
		}
		return ps;
	}

	public Map<String, double []> toMap() {
		Map<String, double []> map = new LinkedHashMap<String, double []>();
		for (Map.Entry<String, double []> entry : values.entrySet()) {
			map.put(entry.getKey(), entry.getValue().clone());
		}
		return map;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ParameterSet)) return false;
		ParameterSet other = (ParameterSet) o;
		if ((other.batch_size != batch_size) || !other.values.keySet().equals(values.keySet())) {
			return false;
		}
		for (Map.Entry<String, double []> entry : values.entrySet()) {
			if (!Arrays.equals(entry.getValue(), other.values.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int h = batch_size;
		for (Map.Entry<String, double []> entry : values.entrySet()) {
			h = 31 * h + entry.getKey().hashCode();
			h = 31 * h + Arrays.hashCode(entry.getValue());
		}
		return h;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		boolean first = true;
		for (Map.Entry<String, double []> entry : values.entrySet()) {
			if (!first) sb.append(", ");
			sb.append(entry.getKey()).append("=").append(Arrays.toString(entry.getValue()));
			first = false;
		}
		return sb.append("}").toString();
	}
}
