package org.core3dmetrics.geometrics.util;

import java.util.Arrays;

/**
 * Affine pixel-to-ground transform with the usual six coefficients:
 * x = t0 + col*t1 + row*t2, y = t3 + col*t4 + row*t5
 */
public class GeoTransform
{
	private final double[] t;

	public GeoTransform(final double... coefficients)
	{
		if (coefficients.length != 6)
			throw new IllegalArgumentException("Geotransform needs 6 coefficients, got "
				+coefficients.length+".");
		t = coefficients.clone();
	}

	/** Ground size of a pixel along the raster rows. */
	public double getUnitWidth()
	{
		return Math.abs(t[1]);
	}

	/** Mean ground size of a pixel, used to quantize heights into voxels. */
	public double getUnitHeight()
	{
		return (Math.abs(t[1]) + Math.abs(t[5])) / 2.0;
	}

	@Override
	public String toString()
	{
		return Arrays.toString(t);
	}
}
