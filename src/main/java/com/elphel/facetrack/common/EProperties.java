/**
 **
 ** EProperties - java.util.Properties with typed getters used by the parameter classes
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EProperties.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public class EProperties extends Properties{
	private static final long serialVersionUID = 3287342250218405762L;

	public EProperties() {
		super();
	}

	public EProperties(Properties defaults) {
		super();
		if (defaults != null) {
			putAll(defaults);
		}
	}

	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value).trim());
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value).trim());
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value).trim());
	}
	public double [] getProperty(String key, double [] value){
		String s = getProperty(key);
		if (s == null) {
			return value;
		}
		return parseDoubles(s);
	}
	public int [] getProperty(String key, int [] value){
		String s = getProperty(key);
		if (s == null) {
			return value;
		}
		return parseInts(s);
	}

	public static double [] parseDoubles(String s) {
		String [] items = splitList(s);
		double [] rslt = new double [items.length];
		for (int i = 0; i < items.length; i++) {
			rslt[i] = Double.parseDouble(items[i]);
		}
		return rslt;
	}

	public static int [] parseInts(String s) {
		String [] items = splitList(s);
		int [] rslt = new int [items.length];
		for (int i = 0; i < items.length; i++) {
			rslt[i] = Integer.parseInt(items[i]);
		}
		return rslt;
	}

	/**
	 * Split comma-separated list, dropping empty items and surrounding spaces
	 * @param s comma-separated list (may be null or empty)
	 * @return array of non-empty trimmed items
	 */
	public static String [] splitList(String s) {
		List<String> items = new ArrayList<String>();
		if (s != null) {
			for (String item : s.split(",")) {
				if (!item.trim().isEmpty()) {
					items.add(item.trim());
				}
			}
		}
		return items.toArray(new String[items.size()]);
	}

	public static String joinList(double [] values) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < values.length; i++) {
			if (i > 0) sb.append(",");
			sb.append(values[i]);
		}
		return sb.toString();
	}

	public static String joinList(int [] values) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < values.length; i++) {
			if (i > 0) sb.append(",");
			sb.append(values[i]);
		}
		return sb.toString();
	}
}
