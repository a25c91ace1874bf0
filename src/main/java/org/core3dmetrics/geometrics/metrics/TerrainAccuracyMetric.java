package org.core3dmetrics.geometrics.metrics;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;

import java.util.Map;

public interface TerrainAccuracyMetric
{
	/**
	 * Height errors of the test terrain model. The 'refMask' marks elevated
	 * objects under which the terrain estimate is expected to be inaccurate,
	 * 'zThreshold' is the tolerated vertical error.
	 */
	Map<String,Object> evaluate(final RandomAccessibleInterval<FloatType> refDTM,
	                            final RandomAccessibleInterval<FloatType> testDTM,
	                            final RandomAccessibleInterval<BitType> refMask,
	                            final double zThreshold);
}
