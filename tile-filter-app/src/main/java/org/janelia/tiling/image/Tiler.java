/*
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.tiling.image;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits images into contiguous horizontal bands.
 */
public class Tiler {

	private Tiler() {}

	/**
	 * Create a {@link List} of count regions that together cover the rows
	 * [0, height) of a buffer with the given width and channel depth.
	 * Every region except the last one has height / count rows,
	 * the last region also absorbs the remainder of that division.
	 *
	 * @throws InvalidPartitionCountException
	 *   if count is not between 1 and height (inclusive).
	 */
	public static List<Region> tile(
			final int width,
			final int height,
			final int channels,
			final int count) throws InvalidPartitionCountException {

		if ((count < 1) || (count > height))
			throw new InvalidPartitionCountException(height, count);

		final int partHeight = height / count;
		final List<Region> regions = new ArrayList<>(count);
		for (int i = 0; i < count - 1; ++i) {
			final int start = i * partHeight;
			regions.add(new Region(i, start, start + partHeight, width, channels));
		}
		regions.add(new Region(count - 1, (count - 1) * partHeight, height, width, channels));

		return regions;
	}

	/**
	 * Create a {@link List} of count regions covering the specified buffer.
	 */
	public static List<Region> tile(
			final PixelBuffer buffer,
			final int count) throws InvalidPartitionCountException {

		return tile(buffer.getWidth(), buffer.getHeight(), buffer.getChannels(), count);
	}
}
