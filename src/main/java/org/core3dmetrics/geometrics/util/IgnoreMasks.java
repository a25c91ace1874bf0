package org.core3dmetrics.geometrics.util;

import net.imglib2.Dimensions;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Helpers to build the mask of "data voids", pixels that are excluded
 * from all evaluations.
 */
public class IgnoreMasks
{
	/** No-data value assigned to the warped elevation rasters. */
	public static final float NO_DATA_VALUE = -9999f;

	/** Creates an all-false mask of the given size. */
	static public
	Img<BitType> createMask(final Dimensions dims)
	{
		return ArrayImgs.bits( Intervals.dimensionsAsLongArray(dims) );
	}

	/** Sets the 'mask' to true wherever the 'img' holds the 'value'. */
	static public < T extends RealType<T> >
	void markValue(final RandomAccessibleInterval<BitType> mask,
	               final RandomAccessibleInterval<T> img,
	               final double value)
	{
		Rasters.checkSameSize(mask,"ignoreMask", img,"image");
		LoopBuilder.setImages(Views.zeroMin(mask),Views.zeroMin(img)).forEachPixel(
			(m,i) -> { if (i.getRealDouble() == value) m.set(true); } );
	}

	/** Returns a mask that is true wherever the 'img' holds a valid (not NO_DATA_VALUE) value. */
	static public < T extends RealType<T> >
	Img<BitType> validDataMask(final RandomAccessibleInterval<T> img)
	{
		final Img<BitType> mask = createMask(img);
		LoopBuilder.setImages(mask,Views.zeroMin(img)).forEachPixel(
			(m,i) -> m.set( i.getRealDouble() != NO_DATA_VALUE ) );
		return mask;
	}
}
