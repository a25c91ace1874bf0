package org.core3dmetrics.geometrics.util;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Height adjustments of the elevation rasters before the evaluation.
 * The input rasters are never modified, new images are returned.
 */
public class ElevationAdjust
{
	/** Returns a copy of the 'img' with 'dz' added to every pixel where 'validMask' is true. */
	static public
	Img<FloatType> applyVerticalOffset(final RandomAccessibleInterval<FloatType> img,
	                                   final RandomAccessibleInterval<BitType> validMask,
	                                   final double dz)
	{
		Rasters.checkSameSize(img,"elevation", validMask,"validMask");

		final Img<FloatType> out = ArrayImgs.floats( Intervals.dimensionsAsLongArray(img) );
		LoopBuilder.setImages(Views.zeroMin(img),Views.zeroMin(validMask),out).forEachPixel(
			(i,v,o) -> o.setReal( v.get() ? i.getRealDouble() + dz : i.getRealDouble() ) );
		return out;
	}

	/**
	 * Returns a copy of the 'img' with heights rounded to multiples of 'unitHeight',
	 * so that the vertical spacing matches the horizontal one (voxels).
	 */
	static public
	Img<FloatType> quantize(final RandomAccessibleInterval<FloatType> img,
	                        final double unitHeight)
	{
		if (!(unitHeight > 0))
			throw new IllegalArgumentException("Unit height must be positive, got "+unitHeight+".");

		final Img<FloatType> out = ArrayImgs.floats( Intervals.dimensionsAsLongArray(img) );
		LoopBuilder.setImages(Views.zeroMin(img),out).forEachPixel(
			(i,o) -> o.setReal( Math.rint(i.getRealDouble() / unitHeight) * unitHeight ) );
		return out;
	}
}
