/**
 **
 ** Barycentric - barycentric interpolation of per-vertex attributes at the masked pixels
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Barycentric.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.model;

public class Barycentric {

	/**
	 * Interpolate vertex attributes for pixels with mask == true, in the pixel order
	 * @param vertices_idx per-pixel triangle vertex indices [num_pixels][3]
	 * @param bary_coords  per-pixel barycentric coordinates [num_pixels][3]
	 * @param attributes   per-vertex attributes [num_vertices][n]
	 * @param mask         selected pixels
	 * @return [number of selected pixels][n]
	 */
	public static double [][] interpolate(
			int [][]    vertices_idx,
			double [][] bary_coords,
			double [][] attributes,
			boolean []  mask)
	{
		int num_sel = count(mask);
		int n = (attributes.length > 0) ? attributes[0].length : 3;
		double [][] rslt = new double [num_sel][n];
		int indx = 0;
		for (int pix = 0; pix < mask.length; pix++) if (mask[pix]) {
			double [] r = rslt[indx++];
			for (int k = 0; k < 3; k++) {
				double b = bary_coords[pix][k];
				if (b != 0.0) {
					double [] a = attributes[vertices_idx[pix][k]];
					for (int c = 0; c < n; c++) {
						r[c] += b * a[c];
					}
				}
			}
		}
		return rslt;
	}

	public static int count(boolean [] mask) {
		int n = 0;
		for (boolean b : mask) if (b) n++;
		return n;
	}

	/**
	 * Select rows for the masked pixels
	 * @param data per-pixel data
	 * @param mask selected pixels
	 * @return copy of the selected rows in the pixel order
	 */
	public static double [][] select(double [][] data, boolean [] mask) {
		double [][] rslt = new double [count(mask)][];
		int indx = 0;
		for (int pix = 0; pix < mask.length; pix++) if (mask[pix]) {
			rslt[indx++] = data[pix].clone();
		}
		return rslt;
	}

	public static double [] select(double [] data, boolean [] mask) {
		double [] rslt = new double [count(mask)];
		int indx = 0;
		for (int pix = 0; pix < mask.length; pix++) if (mask[pix]) {
			rslt[indx++] = data[pix];
		}
		return rslt;
	}
}
