package org.core3dmetrics.geometrics.metrics;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;

import java.util.Map;

/**
 * Relative (horizontal and vertical) accuracy of the test objects with respect
 * to the reference objects.
 */
public interface RelativeAccuracyMetric
{
	/**
	 * @param unitWidth  horizontal size of one pixel in ground units,
	 *                   used to convert pixel offsets to ground offsets
	 */
	Map<String,Object> evaluate(final RandomAccessibleInterval<FloatType> refDSM,
	                            final RandomAccessibleInterval<FloatType> testDSM,
	                            final RandomAccessibleInterval<BitType> refMask,
	                            final RandomAccessibleInterval<BitType> testMask,
	                            final RandomAccessibleInterval<BitType> ignoreMask,
	                            final double unitWidth);
}
