package org.core3dmetrics.geometrics.metrics;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;

import java.util.Map;

import org.core3dmetrics.geometrics.util.GeoTransform;

/**
 * Threshold geometry metrics (completeness, correctness, IOU, ...) of the test
 * model evaluated over the object regions given by the reference and test masks.
 */
public interface ThresholdGeometryMetric
{
	/**
	 * Evaluates the metric for one pair of masks and returns its results
	 * keyed by metric name. The returned map is owned by the caller.
	 *
	 * @param refDSM      reference surface elevations
	 * @param refDTM      reference terrain elevations
	 * @param refMask     reference object region
	 * @param testDSM     test surface elevations
	 * @param testDTM     terrain elevations to be used with the test surface
	 * @param testMask    test object region
	 * @param tform       geotransform of the rasters
	 * @param ignoreMask  pixels excluded from the evaluation (data voids)
	 */
	Map<String,Object> evaluate(final RandomAccessibleInterval<FloatType> refDSM,
	                            final RandomAccessibleInterval<FloatType> refDTM,
	                            final RandomAccessibleInterval<BitType> refMask,
	                            final RandomAccessibleInterval<FloatType> testDSM,
	                            final RandomAccessibleInterval<FloatType> testDTM,
	                            final RandomAccessibleInterval<BitType> testMask,
	                            final GeoTransform tform,
	                            final RandomAccessibleInterval<BitType> ignoreMask);
}
