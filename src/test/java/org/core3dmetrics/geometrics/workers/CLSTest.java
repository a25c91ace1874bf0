package org.core3dmetrics.geometrics.workers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.scijava.Context;
import org.scijava.log.LogService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.core3dmetrics.geometrics.RasterFixtures;
import org.core3dmetrics.geometrics.metrics.RelativeAccuracyMetric;
import org.core3dmetrics.geometrics.metrics.ThresholdGeometryMetric;
import org.core3dmetrics.geometrics.util.ClassMasks;
import org.core3dmetrics.geometrics.util.GeoTransform;
import org.core3dmetrics.geometrics.util.IgnoreMasks;

public class CLSTest
{
	private Context context;
	private LogService log;

	//what the metric stubs were called with
	private final List<long[]> geometryMaskSizes = new ArrayList<>();
	private final List<RandomAccessibleInterval<FloatType>> geometryTestDTMs = new ArrayList<>();
	private final List<Double> relativeUnitWidths = new ArrayList<>();

	private final ThresholdGeometryMetric geometry =
		(refDSM, refDTM, refMask, testDSM, testDTM, testMask, tform, ignoreMask) ->
		{
			geometryMaskSizes.add(new long[] { ClassMasks.countSet(refMask), ClassMasks.countSet(testMask) });
			geometryTestDTMs.add(testDTM);
			final Map<String,Object> r = new HashMap<>();
			r.put("call", geometryMaskSizes.size());
			return r;
		};

	private final RelativeAccuracyMetric relative =
		(refDSM, testDSM, refMask, testMask, ignoreMask, unitWidth) ->
		{
			relativeUnitWidths.add(unitWidth);
			final Map<String,Object> r = new HashMap<>();
			r.put("call", relativeUnitWidths.size());
			return r;
		};

	private static final int[][] REF_CLS = {
		{6, 6, 2, 2},
		{6, 6, 2,17},
		{0, 0, 0,17} };

	private static final int[][] TEST_CLS = {
		{6, 6, 6, 2},
		{6, 0, 2, 2},
		{0, 0, 0, 2} };

	private final GeoTransform tform = new GeoTransform(100.0, 0.5, 0.0, 200.0, 0.0, -0.5);

	private Img<FloatType> refDSM, refDTM, testDSM;
	private Img<BitType> ignoreMask;

	@Before
	public void setUp()
	{
		context = new Context(LogService.class);
		log = context.getService(LogService.class);

		refDSM  = RasterFixtures.constFloats(4,3,10f);
		refDTM  = RasterFixtures.constFloats(4,3,1f);
		testDSM = RasterFixtures.constFloats(4,3,9f);
		ignoreMask = IgnoreMasks.createMask(refDSM);
	}

	@After
	public void tearDown()
	{
		context.dispose();
	}

	private CLS.Results run(final int[][] refCls, final int[][] testCls,
	                        final List<List<Integer>> refSets, final List<List<Integer>> testSets)
	{
		final Img<UnsignedShortType> ref  = RasterFixtures.labels(refCls);
		final Img<UnsignedShortType> test = RasterFixtures.labels(testCls);
		return new CLS(log, geometry, relative)
			.calculate(refDSM, refDTM, ref, testDSM, test, refSets, testSets, tform, ignoreMask);
	}

	@Test
	public void testOneGeometryResultPerPairInOrder()
	{
		final List<List<Integer>> refSets  = Arrays.asList(Arrays.asList(6), Arrays.asList(2,17), Arrays.asList(6));
		final List<List<Integer>> testSets = Arrays.asList(Arrays.asList(6), Arrays.asList(2), Collections.<Integer>emptyList());

		final CLS.Results r = run(REF_CLS, TEST_CLS, refSets, testSets);

		assertEquals(3, r.thresholdGeometry.size());
		for (int i=0; i < 3; ++i)
			assertEquals(i+1, r.thresholdGeometry.get(i).get("call"));

		//masks were built from the paired sets
		assertEquals(4, geometryMaskSizes.get(0)[0]);
		assertEquals(4, geometryMaskSizes.get(0)[1]);
		assertEquals(5, geometryMaskSizes.get(1)[0]);
		assertEquals(4, geometryMaskSizes.get(1)[1]);
		assertEquals(0, geometryMaskSizes.get(2)[1]);

		//the reference terrain is handed over also as the test terrain
		for (RandomAccessibleInterval<FloatType> dtm : geometryTestDTMs)
			assertSame(refDTM, dtm);

		//the empty test set skips the relative accuracy
		assertEquals(2, r.relativeAccuracy.size());
		assertEquals(0.5, relativeUnitWidths.get(0), 1e-12);
	}

	@Test
	public void testResultsAreTaggedWithMatchValues()
	{
		final List<List<Integer>> refSets  = Arrays.asList(Arrays.asList(6), Arrays.asList(2,17));
		final List<List<Integer>> testSets = Arrays.asList(Arrays.asList(6), Arrays.asList(2));

		final CLS.Results r = run(REF_CLS, TEST_CLS, refSets, testSets);

		assertEquals(Arrays.asList(6), r.thresholdGeometry.get(0).get(CLS.CLS_VALUE_KEY));
		assertEquals(Arrays.asList(6), r.relativeAccuracy.get(0).get(CLS.CLS_VALUE_KEY));

		final Object tag = r.thresholdGeometry.get(1).get(CLS.CLS_VALUE_KEY);
		assertTrue(tag instanceof Map);
		assertEquals(Arrays.asList(2,17), ((Map<?,?>)tag).get("Ref"));
		assertEquals(Arrays.asList(2), ((Map<?,?>)tag).get("Test"));
		assertEquals(tag, r.relativeAccuracy.get(1).get(CLS.CLS_VALUE_KEY));
	}

	@Test
	public void testMaskCoveringEverythingSkipsRelativeAccuracy()
	{
		final int[][] allSix = { {6,6,6,6}, {6,6,6,6}, {6,6,6,6} };
		final List<List<Integer>> sets = Arrays.asList(Arrays.asList(6));

		final CLS.Results r = run(REF_CLS, allSix, sets, sets);
		assertEquals(1, r.thresholdGeometry.size());
		assertTrue(r.relativeAccuracy.isEmpty());

		final CLS.Results r2 = run(allSix, TEST_CLS, sets, sets);
		assertEquals(1, r2.thresholdGeometry.size());
		assertTrue(r2.relativeAccuracy.isEmpty());
	}

	@Test
	public void testMisconfigurationYieldsNoMetricCalls()
	{
		//the second pair asks for a value that the test raster does not contain
		final List<List<Integer>> refSets  = Arrays.asList(Arrays.asList(6), Arrays.asList(17));
		final List<List<Integer>> testSets = Arrays.asList(Arrays.asList(6), Arrays.asList(17));

		try {
			run(REF_CLS, TEST_CLS, refSets, testSets);
			fail("Match value 17 is absent from the test raster.");
		}
		catch (IllegalArgumentException e) {
			assertTrue(geometryMaskSizes.isEmpty());
			assertTrue(relativeUnitWidths.isEmpty());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testListsOfDifferentLength()
	{
		run(REF_CLS, TEST_CLS, Arrays.asList(Arrays.asList(6), Arrays.asList(2)), Arrays.asList(Arrays.asList(6)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testShapeMismatch()
	{
		final int[][] small = { {6,6}, {2,2} };
		run(REF_CLS, small, Arrays.asList(Arrays.asList(6)), Arrays.asList(Arrays.asList(6)));
	}
}
