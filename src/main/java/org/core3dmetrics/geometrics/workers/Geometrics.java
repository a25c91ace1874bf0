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
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.core3dmetrics.geometrics.GeometricsConfig;
import org.core3dmetrics.geometrics.GeometricsConfig.TestIgnoreMode;
import org.core3dmetrics.geometrics.metrics.RelativeAccuracyMetric;
import org.core3dmetrics.geometrics.metrics.TerrainAccuracyMetric;
import org.core3dmetrics.geometrics.metrics.ThresholdGeometryMetric;
import org.core3dmetrics.geometrics.util.ClassMasks;
import org.core3dmetrics.geometrics.util.ElevationAdjust;
import org.core3dmetrics.geometrics.util.IgnoreMasks;
import org.core3dmetrics.geometrics.util.Rasters;

/**
 * Runs all evaluations of one test model against the reference model
 * and collects their results into one report.
 */
public class Geometrics
{
	///shortcuts to some Fiji services
	private final LogService log;

	private final ThresholdGeometryMetric thresholdGeometry;
	private final RelativeAccuracyMetric relativeAccuracy;
	private final TerrainAccuracyMetric terrainAccuracy;

	///a constructor requiring connection to Fiji report/log services
	public Geometrics(final LogService _log,
	                  final ThresholdGeometryMetric _thresholdGeometry,
	                  final RelativeAccuracyMetric _relativeAccuracy,
	                  final TerrainAccuracyMetric _terrainAccuracy)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");
		if (_thresholdGeometry == null || _relativeAccuracy == null || _terrainAccuracy == null)
			throw new NullPointerException("No metric implementation supplied.");

		log = _log;
		thresholdGeometry = _thresholdGeometry;
		relativeAccuracy  = _relativeAccuracy;
		terrainAccuracy   = _terrainAccuracy;
	}

	/** Calculation option: report the primary materials of every structure. */
	public boolean doLogReports = false;

	//report keys
	public static final String THRESHOLD_GEOMETRY  = "threshold_geometry";
	public static final String RELATIVE_ACCURACY   = "relative_accuracy";
	public static final String REGISTRATION_OFFSET = "registration_offset";
	public static final String TERRAIN_ACCURACY    = "terrain_accuracy";
	public static final String THRESHOLD_MATERIALS = "threshold_materials";


	//---------------------------------------------------------------------/
	/**
	 * The main evaluation pipeline.
	 *
	 * @param config     settings of this run
	 * @param layers     co-registered reference and test rasters
	 * @param xyzOffset  registration offset of the test model, or null if
	 *                   the registration was skipped (no vertical offset applied)
	 * @return report with entries in the order: threshold_geometry, relative_accuracy,
	 *         registration_offset (only with xyzOffset), terrain_accuracy (only with
	 *         test DTM), threshold_materials (only with test MTL)
	 */
	public Map<String,Object> calculate(final GeometricsConfig config,
	                                    final ModelLayers layers,
	                                    final double[] xyzOffset)
	{
		if (xyzOffset != null && xyzOffset.length != 3)
			throw new IllegalArgumentException("Registration offset must have 3 components, got "
				+xyzOffset.length+".");

		log.info("Configuration:\n"+config);

		//configuration checks that need the raster content, before anything is evaluated
		ClassMasks.validateMatchValueSets(config.getRefClsMatchSets(), config.getTestClsMatchSets(),
			ClassMasks.observedValues(layers.refCLS), ClassMasks.observedValues(layers.testCLS));
		if (layers.getTestDTM() != null)
			ClassMasks.validateMatchValues(config.getTerrainClsIgnoreValues(),
				ClassMasks.observedValues(layers.refCLS));

		if (xyzOffset == null)
			log.info("SKIPPING REGISTRATION");
		else
			log.info("Registration offset: "+Arrays.toString(xyzOffset));

		//apply the vertical offset, only to valid data to allow better tracking of bad data
		final double dz = xyzOffset != null ? xyzOffset[2] : 0.0;
		final Img<BitType> testValidData = IgnoreMasks.validDataMask(layers.testDSM);
		if (layers.getTestDTM() != null)
			LoopBuilder.setImages(testValidData,Views.zeroMin(layers.getTestDTM())).forEachPixel(
				(v,d) -> { if (d.getRealDouble() == IgnoreMasks.NO_DATA_VALUE) v.set(false); } );

		RandomAccessibleInterval<FloatType> testDSM
			= ElevationAdjust.applyVerticalOffset(layers.testDSM, testValidData, dz);
		RandomAccessibleInterval<FloatType> testDTM;
		if (layers.getTestDTM() != null)
			testDTM = ElevationAdjust.applyVerticalOffset(layers.getTestDTM(), testValidData, dz);
		else
		{
			log.info("NO TEST DTM: defaults to reference DTM");
			testDTM = layers.refDTM;
		}

		final Img<BitType> ignoreMask = buildIgnoreMask(config.getTestIgnoreMode(), layers, testDSM);

		//if quantizing to voxels, then match vertical spacing to horizontal spacing
		RandomAccessibleInterval<FloatType> refDSM = layers.refDSM;
		RandomAccessibleInterval<FloatType> refDTM = layers.refDTM;
		if (config.isQuantizeHeight())
		{
			final double unitHgt = layers.tform.getUnitHeight();
			log.info("Quantizing heights to "+unitHgt);
			refDSM  = ElevationAdjust.quantize(refDSM, unitHgt);
			refDTM  = ElevationAdjust.quantize(refDTM, unitHgt);
			testDSM = ElevationAdjust.quantize(testDSM, unitHgt);
			testDTM = ElevationAdjust.quantize(testDTM, unitHgt);
		}

		final Map<String,Object> metrics = new LinkedHashMap<>();

		//threshold geometry and relative accuracy
		final CLS.Results clsResults = new CLS(log, thresholdGeometry, relativeAccuracy)
			.calculate(refDSM, refDTM, layers.refCLS, testDSM, layers.testCLS,
			           config.getRefClsMatchSets(), config.getTestClsMatchSets(),
			           layers.tform, ignoreMask);
		metrics.put(THRESHOLD_GEOMETRY, clsResults.thresholdGeometry);
		metrics.put(RELATIVE_ACCURACY, clsResults.relativeAccuracy);

		if (xyzOffset != null)
			metrics.put(REGISTRATION_OFFSET, Arrays.asList(xyzOffset[0], xyzOffset[1], xyzOffset[2]));

		//terrain model
		if (layers.getTestDTM() != null)
		{
			//reference mask of elevated objects under which the terrain estimate is expected to be inaccurate
			final List<Integer> terrainIgnoreValues = config.getTerrainClsIgnoreValues();
			final Img<BitType> refMaskTerrainAcc = ClassMasks.buildMask(layers.refCLS, terrainIgnoreValues);
			metrics.put(TERRAIN_ACCURACY, terrainAccuracy.evaluate(refDTM, testDTM, refMaskTerrainAcc,
				config.getTerrainZErrorThreshold()));
		}
		else
			log.warn("No test DTM file, skipping terrain accuracy metrics");

		//material labeling
		if (layers.getTestMTL() == null)
			log.warn("No test MTL file, skipping material metrics");
		else if (layers.getRefMTL() == null || layers.getRefNDX() == null)
			log.warn("No reference MTL or NDX file, skipping material metrics");
		else
		{
			final MTL mtl = new MTL(log);
			mtl.doLogReports = doLogReports;
			metrics.put(THRESHOLD_MATERIALS, mtl.calculate(layers.getRefNDX(), layers.getRefMTL(),
				layers.getTestMTL(), config.getMaterialNames(), config.getMaterialIndicesToIgnore()).toMap());
		}

		return metrics;
	}


	/**
	 * Creates the mask of pixels that are ignored in all evaluations: reference
	 * DSM/DTM no-data pixels, reference CLS no-data pixels and, depending on the
	 * 'mode', also no-data pixels of the test model. The 'testDSM' is expected
	 * to be the offset-applied test surface, no-data pixels kept intact.
	 * Throws IllegalArgumentException if all pixels end up ignored.
	 */
	public Img<BitType> buildIgnoreMask(final TestIgnoreMode mode,
	                                    final ModelLayers layers,
	                                    final RandomAccessibleInterval<FloatType> testDSM)
	{
		Rasters.checkSameSize(layers.refCLS,"refCLS", testDSM,"testDSM");

		final Img<BitType> ignoreMask = IgnoreMasks.createMask(layers.refCLS);
		IgnoreMasks.markValue(ignoreMask, layers.refDSM, IgnoreMasks.NO_DATA_VALUE);
		IgnoreMasks.markValue(ignoreMask, layers.refDTM, IgnoreMasks.NO_DATA_VALUE);
		if (layers.getRefClsNoDataValue() != null)
			IgnoreMasks.markValue(ignoreMask, layers.refCLS, layers.getRefClsNoDataValue());

		switch (mode)
		{
		case CLS:
			if (layers.getTestClsNoDataValue() != null)
			{
				log.info("Ignoring test CLS NoDataValue");
				IgnoreMasks.markValue(ignoreMask, layers.testCLS, layers.getTestClsNoDataValue());
			}
			break;
		case ELEVATION:
			log.info("Ignoring test DSM NoDataValue");
			IgnoreMasks.markValue(ignoreMask, testDSM, IgnoreMasks.NO_DATA_VALUE);
			if (layers.getTestDTM() != null)
			{
				log.info("Ignoring test DTM NoDataValue");
				IgnoreMasks.markValue(ignoreMask, layers.getTestDTM(), IgnoreMasks.NO_DATA_VALUE);
			}
			break;
		default:
			break;
		}

		//sanity check
		final long numDataVoids = ClassMasks.countSet(ignoreMask);
		if (numDataVoids == Rasters.countPixels(ignoreMask))
			throw new IllegalArgumentException("All pixels are ignored");

		log.info("Number of data voids in ignore mask = "+numDataVoids);
		return ignoreMask;
	}
}
