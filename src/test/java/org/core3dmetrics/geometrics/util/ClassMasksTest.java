package org.core3dmetrics.geometrics.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.UnsignedShortType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.core3dmetrics.geometrics.RasterFixtures;

public class ClassMasksTest
{
	private static final int[][] CLS = {
		{2, 6, 6,17},
		{2, 2, 6,17},
		{0, 0, 0, 5} };

	@Test
	public void testObservedValues()
	{
		assertEquals(new ArrayList<>(Arrays.asList(0,2,5,6,17)),
			new ArrayList<>(ClassMasks.observedValues(RasterFixtures.labels(CLS))));
	}

	@Test
	public void testSingleValueMask()
	{
		final Img<BitType> mask = ClassMasks.buildMask(RasterFixtures.labels(CLS), Arrays.asList(6));
		assertEquals(3, ClassMasks.countSet(mask));

		final RandomAccess<BitType> ra = mask.randomAccess();
		ra.setPosition(new long[] {1,0});
		assertTrue(ra.get().get());
		ra.setPosition(new long[] {0,0});
		assertFalse(ra.get().get());
	}

	@Test
	public void testGroupedValuesMask()
	{
		final Img<BitType> mask = ClassMasks.buildMask(RasterFixtures.labels(CLS), Arrays.asList(6,17));
		assertEquals(5, ClassMasks.countSet(mask));
		assertEquals(4, mask.dimension(0));
		assertEquals(3, mask.dimension(1));
	}

	@Test
	public void testEmptySetGivesAllFalseMask()
	{
		final Img<UnsignedShortType> cls = RasterFixtures.constLabels(5,3,0);
		final Img<BitType> mask = ClassMasks.buildMask(cls, Collections.<Integer>emptyList());
		assertEquals(0, ClassMasks.countSet(mask));
		assertEquals(5, mask.dimension(0));
		assertEquals(3, mask.dimension(1));
	}

	@Test
	public void testCoversEverything()
	{
		assertTrue(ClassMasks.coversEverything(
			ClassMasks.buildMask(RasterFixtures.constLabels(3,3,6), Arrays.asList(6))));
		assertFalse(ClassMasks.coversEverything(
			ClassMasks.buildMask(RasterFixtures.labels(CLS), Arrays.asList(0,2,5,6))));
	}

	@Test
	public void testMissingMatchValueIsAnError()
	{
		final Set<Integer> observed = ClassMasks.observedValues(RasterFixtures.labels(CLS));
		assertEquals(Arrays.asList(2,6), ClassMasks.validateMatchValues(Arrays.asList(2,6), observed));

		try {
			ClassMasks.validateMatchValues(Arrays.asList(6,9), observed);
			fail("Value 9 is not in the raster.");
		}
		catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("9"));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testPairedListsMustAgreeInLength()
	{
		final Set<Integer> observed = ClassMasks.observedValues(RasterFixtures.labels(CLS));
		final List<List<Integer>> ref = Arrays.asList(Arrays.asList(6), Arrays.asList(17));
		final List<List<Integer>> test = Arrays.asList(Arrays.asList(6));
		ClassMasks.validateMatchValueSets(ref, test, observed, observed);
	}

	@Test
	public void testEmptyTestSetIsValid()
	{
		final Set<Integer> observed = ClassMasks.observedValues(RasterFixtures.labels(CLS));
		final List<List<Integer>> ref = Arrays.asList(Arrays.asList(6));
		final List<List<Integer>> test = Arrays.asList(Collections.<Integer>emptyList());
		ClassMasks.validateMatchValueSets(ref, test, observed, observed);
	}
}
