/**
 **
 ** CorrespondenceMask - valid correspondences between observed and rendered geometry with diagnostic sub-masks
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrespondenceMask.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.correspondence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class CorrespondenceMask {
	public static final String S_MASK =   "s_mask";
	public static final String T_MASK =   "t_mask";
	public static final String VALID =    "valid";    // s_mask & t_mask
	public static final String DISTANCE = "distance";
	public static final String NORMAL =   "normal";

	private final boolean []              mask;
	private final Map<String, boolean []> diagnostics;

	public CorrespondenceMask(boolean [] mask, Map<String, boolean []> diagnostics) {
		this.mask = mask;
		this.diagnostics = Collections.unmodifiableMap(new LinkedHashMap<String, boolean []>(diagnostics));
	}

	public boolean [] getMask() {
		return mask;
	}

	public Map<String, boolean []> getDiagnostics() {
		return diagnostics;
	}

	public boolean [] getDiagnostic(String name) {
		return diagnostics.get(name);
	}

	public int length() {
		return mask.length;
	}

	public int count() {
		return count(mask);
	}

	public static int count(boolean [] mask) {
		int n = 0;
		for (boolean b : mask) if (b) n++;
		return n;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("CorrespondenceMask{selected="+count()+"/"+mask.length);
		for (Map.Entry<String, boolean []> entry : diagnostics.entrySet()) {
			sb.append(", ").append(entry.getKey()).append("=").append(count(entry.getValue()));
		}
		return sb.append("}").toString();
	}
}
