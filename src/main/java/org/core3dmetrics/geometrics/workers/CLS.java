/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2026 core3d-geometrics developers
 */
package org.core3dmetrics.geometrics.workers;

import org.scijava.log.LogService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.real.FloatType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.core3dmetrics.geometrics.metrics.RelativeAccuracyMetric;
import org.core3dmetrics.geometrics.metrics.ThresholdGeometryMetric;
import org.core3dmetrics.geometrics.util.ClassMasks;
import org.core3dmetrics.geometrics.util.GeoTransform;
import org.core3dmetrics.geometrics.util.Rasters;

/**
 * Per-class evaluation driver: for every pair of reference and test
 * match-value sets it builds the object masks and runs the threshold
 * geometry and relative accuracy metrics over them.
 */
public class CLS
{
	///shortcuts to some Fiji services
	private final LogService log;

	///the metrics this driver feeds with masks
	private final ThresholdGeometryMetric thresholdGeometry;
	private final RelativeAccuracyMetric relativeAccuracy;

	///a constructor requiring connection to Fiji report/log services
	public CLS(final LogService _log,
	           final ThresholdGeometryMetric _thresholdGeometry,
	           final RelativeAccuracyMetric _relativeAccuracy)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");
		if (_thresholdGeometry == null || _relativeAccuracy == null)
			throw new NullPointerException("No metric implementation supplied.");

		log = _log;
		thresholdGeometry = _thresholdGeometry;
		relativeAccuracy  = _relativeAccuracy;
	}

	/** Key under which the used match values are stored in every result. */
	public static final String CLS_VALUE_KEY = "CLSValue";


	/** Results of all match-value pairs, in the order of the pairs. */
	public static class Results
	{
		/** One entry per match-value pair. */
		public final List<Map<String,Object>> thresholdGeometry = new ArrayList<>();

		/** Entries only for the pairs that were not skipped, see CLS.calculate(). */
		public final List<Map<String,Object>> relativeAccuracy = new ArrayList<>();
	}


	/**
	 * Returns the value to be stored under CLS_VALUE_KEY: the list itself
	 * when both lists are equal, otherwise a map {Ref: refValues, Test: testValues}.
	 */
	public static
	Object tagOf(final List<Integer> refValues, final List<Integer> testValues)
	{
		if (refValues.equals(testValues)) return new ArrayList<>(refValues);

		final Map<String,Object> tag = new LinkedHashMap<>();
		tag.put("Ref", new ArrayList<>(refValues));
		tag.put("Test", new ArrayList<>(testValues));
		return tag;
	}

	private static
	Map<String,Object> tagged(final Map<String,Object> result, final Object tag)
	{
		final Map<String,Object> out = new LinkedHashMap<>();
		if (result != null) out.putAll(result);
		out.put(CLS_VALUE_KEY, tag);
		return out;
	}


	//---------------------------------------------------------------------/
	/**
	 * Evaluates every pair (refSets[i], testSets[i]). All match values are
	 * validated against the values present in the class rasters before any
	 * mask is built, so a misconfigured run yields no partial results.
	 *
	 * The reference terrain is used also as the test terrain in the threshold
	 * geometry metric so that terrain modeling errors do not affect the
	 * detection of elevated objects. The relative accuracy metric is run
	 * only if neither mask spans the whole raster and the test set is not empty.
	 */
	public <CT extends IntegerType<CT>>
	Results calculate(final RandomAccessibleInterval<FloatType> refDSM,
	                  final RandomAccessibleInterval<FloatType> refDTM,
	                  final RandomAccessibleInterval<CT> refCLS,
	                  final RandomAccessibleInterval<FloatType> testDSM,
	                  final RandomAccessibleInterval<CT> testCLS,
	                  final List<List<Integer>> refSets,
	                  final List<List<Integer>> testSets,
	                  final GeoTransform tform,
	                  final RandomAccessibleInterval<BitType> ignoreMask)
	{
		Rasters.checkSameSize(refCLS,"refCLS", testCLS,"testCLS");
		Rasters.checkSameSize(refCLS,"refCLS", refDSM,"refDSM");
		Rasters.checkSameSize(refCLS,"refCLS", refDTM,"refDTM");
		Rasters.checkSameSize(refCLS,"refCLS", testDSM,"testDSM");
		Rasters.checkSameSize(refCLS,"refCLS", ignoreMask,"ignoreMask");

		ClassMasks.validateMatchValueSets(refSets, testSets,
			ClassMasks.observedValues(refCLS), ClassMasks.observedValues(testCLS));

		final Results results = new Results();
		for (int i=0; i < refSets.size(); ++i)
		{
			final List<Integer> refValues  = refSets.get(i);
			final List<Integer> testValues = testSets.get(i);
			log.info("Evaluating CLS values");
			log.info("  Reference match values: "+refValues);
			log.info("  Test match values: "+testValues);

			final Img<BitType> refMask  = ClassMasks.buildMask(refCLS, refValues);
			final Img<BitType> testMask = ClassMasks.buildMask(testCLS, testValues);
			final Object tag = tagOf(refValues, testValues);

			results.thresholdGeometry.add( tagged(thresholdGeometry.evaluate(
				refDSM, refDTM, refMask, testDSM, refDTM, testMask, tform, ignoreMask), tag) );

			if (ClassMasks.coversEverything(refMask) || ClassMasks.coversEverything(testMask)
			    || testValues.isEmpty())
			{
				log.info("  Skipping relative accuracy for this match-value pair.");
				continue;
			}

			results.relativeAccuracy.add( tagged(relativeAccuracy.evaluate(
				refDSM, testDSM, refMask, testMask, ignoreMask, tform.getUnitWidth()), tag) );
		}

		return results;
	}
}
