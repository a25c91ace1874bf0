package org.core3dmetrics.geometrics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.core3dmetrics.geometrics.GeometricsConfig.TestIgnoreMode;
import org.core3dmetrics.geometrics.util.MaterialMap;

public class GeometricsConfigTest
{
	@SafeVarargs
	private static List<List<Integer>> sets(final List<Integer>... sets)
	{
		return Arrays.asList(sets);
	}

	@Test
	public void testDefaults()
	{
		final GeometricsConfig c = GeometricsConfig.builder()
			.clsMatchSets(sets(Arrays.asList(6)))
			.build();

		assertEquals(MaterialMap.DEFAULT_NAMES, c.getMaterialNames());
		assertTrue(c.getMaterialIndicesToIgnore().isEmpty());
		assertEquals(Arrays.asList(6,17), c.getTerrainClsIgnoreValues());
		assertEquals(1.0, c.getTerrainZErrorThreshold(), 0.0);
		assertEquals(TestIgnoreMode.OFF, c.getTestIgnoreMode());
	}

	@Test
	public void testDifferentlyCodedTestClasses()
	{
		final GeometricsConfig c = GeometricsConfig.builder()
			.refClsMatchSets(sets(Arrays.asList(6), Arrays.asList(2,17)))
			.testClsMatchSets(sets(Arrays.asList(1), Collections.<Integer>emptyList()))
			.testIgnoreMode(2)
			.build();

		assertEquals(Arrays.asList(2,17), c.getRefClsMatchSets().get(1));
		assertEquals(Arrays.asList(1), c.getTestClsMatchSets().get(0));
		assertTrue(c.getTestClsMatchSets().get(1).isEmpty());
		assertEquals(TestIgnoreMode.ELEVATION, c.getTestIgnoreMode());
	}

	@Test
	public void testConfigIsDetachedFromBuilderInput()
	{
		final List<Integer> set = new ArrayList<>(Arrays.asList(6));
		final GeometricsConfig c = GeometricsConfig.builder()
			.clsMatchSets(Collections.singletonList(set))
			.build();
		set.add(17);
		assertEquals(Arrays.asList(6), c.getRefClsMatchSets().get(0));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownTestIgnoreMode()
	{
		GeometricsConfig.builder().testIgnoreMode(3);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testListsOfDifferentLength()
	{
		GeometricsConfig.builder()
			.refClsMatchSets(sets(Arrays.asList(6), Arrays.asList(17)))
			.testClsMatchSets(sets(Arrays.asList(6)))
			.build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyReferenceSet()
	{
		GeometricsConfig.builder()
			.clsMatchSets(sets(Arrays.asList(6), Collections.<Integer>emptyList()))
			.build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testIgnoredMaterialOutOfRange()
	{
		GeometricsConfig.builder()
			.materialNames(Arrays.asList("Asphalt","Glass"))
			.materialIndicesToIgnore(Collections.singleton(2))
			.build();
	}
}
