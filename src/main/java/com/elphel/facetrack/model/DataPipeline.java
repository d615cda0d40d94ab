/**
 **
 ** DataPipeline - source of the observed frames at the current working resolution
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DataPipeline.java is free software: you can redistribute it and/or modify
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

public interface DataPipeline extends Rescalable {
	/**
	 * @return observed batch at the scale set by the last {@link #rescale(int)}
	 */
	FrameBatch fetch();

	/**
	 * Pipeline that always returns the same batch and ignores rescaling
	 */
	static DataPipeline of(final FrameBatch batch) {
		return new DataPipeline() {
			@Override
			public FrameBatch fetch() {
				return batch;
			}
			@Override
			public void rescale(int scale) {
			}
		};
	}
}
