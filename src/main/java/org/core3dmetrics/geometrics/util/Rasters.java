package org.core3dmetrics.geometrics.util;

import net.imglib2.Dimensions;
import net.imglib2.Interval;

public class Rasters
{
	/**
	 * Throws IllegalArgumentException unless 'imgB' is of the same
	 * dimensionality and size as 'imgA'. The names are used in the message.
	 */
	static public
	void checkSameSize(final Dimensions imgA, final String nameA,
	                   final Dimensions imgB, final String nameB)
	{
		if (imgA.numDimensions() != imgB.numDimensions())
			throw new IllegalArgumentException("Rasters "+nameA+" and "+nameB
				+" are not of the same dimensionality.");

		final int n = imgA.numDimensions();
		int i = 0;
		while ( i < n && imgA.dimension(i) == imgB.dimension(i) ) ++i;
		if (i < n)
			throw new IllegalArgumentException("Rasters "+nameA+" and "+nameB
				+" differ in size in dimension "+i+".");
	}

	/** Number of pixels covered by the interval. */
	static public
	long countPixels(final Interval img)
	{
		long cnt = 1;
		for (int d=0; d < img.numDimensions(); ++d) cnt *= img.dimension(d);
		return cnt;
	}
}
