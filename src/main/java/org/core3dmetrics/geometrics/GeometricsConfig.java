/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2026 core3d-geometrics developers
 */
package org.core3dmetrics.geometrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.core3dmetrics.geometrics.util.MaterialMap;

/**
 * All recognized settings of one evaluation run. The settings are checked
 * once in Builder.build() and cannot be changed afterwards.
 */
public class GeometricsConfig
{
	/** Which test-model no-data pixels are added to the ignore mask. */
	public enum TestIgnoreMode
	{
		/** only the reference no-data pixels are ignored */
		OFF(0),
		/** also test CLS pixels with the test CLS no-data value */
		CLS(1),
		/** also test DSM/DTM pixels with the elevation no-data value */
		ELEVATION(2);

		public final int code;

		TestIgnoreMode(final int code)
		{ this.code = code; }

		/** Translates the numeric code, complains with IllegalArgumentException if unknown. */
		public static TestIgnoreMode fromCode(final int code)
		{
			for (TestIgnoreMode m : values())
				if (m.code == code) return m;
			throw new IllegalArgumentException("Unrecognized test ignore value="+code);
		}
	}

	/** Building and bridge deck. */
	public static final List<Integer> DEFAULT_TERRAIN_CLS_IGNORE_VALUES
		= Collections.unmodifiableList(Arrays.asList(6, 17));

	public static final double DEFAULT_TERRAIN_Z_ERROR_THRESHOLD = 1.0;

	private final List<List<Integer>> refClsMatchSets;
	private final List<List<Integer>> testClsMatchSets;
	private final List<String> materialNames;
	private final Set<Integer> materialIndicesToIgnore;
	private final List<Integer> terrainClsIgnoreValues;
	private final double terrainZErrorThreshold;
	private final boolean quantizeHeight;
	private final TestIgnoreMode testIgnoreMode;

	private GeometricsConfig(final Builder b)
	{
		refClsMatchSets  = copyOfSets(b.refClsMatchSets);
		testClsMatchSets = copyOfSets(b.testClsMatchSets);
		materialNames = Collections.unmodifiableList(new ArrayList<>(b.materialNames));
		materialIndicesToIgnore = Collections.unmodifiableSet(new TreeSet<>(b.materialIndicesToIgnore));
		terrainClsIgnoreValues = Collections.unmodifiableList(new ArrayList<>(b.terrainClsIgnoreValues));
		terrainZErrorThreshold = b.terrainZErrorThreshold;
		quantizeHeight = b.quantizeHeight;
		testIgnoreMode = b.testIgnoreMode;
	}

	private static List<List<Integer>> copyOfSets(final List<List<Integer>> sets)
	{
		final List<List<Integer>> copy = new ArrayList<>(sets.size());
		for (List<Integer> s : sets)
			copy.add( Collections.unmodifiableList(new ArrayList<>(s)) );
		return Collections.unmodifiableList(copy);
	}

	/** Reference match-value sets, paired by position with getTestClsMatchSets(). */
	public List<List<Integer>> getRefClsMatchSets()
	{ return refClsMatchSets; }

	/** Test match-value sets, an empty set means "no test detections for this class". */
	public List<List<Integer>> getTestClsMatchSets()
	{ return testClsMatchSets; }

	public List<String> getMaterialNames()
	{ return materialNames; }

	public Set<Integer> getMaterialIndicesToIgnore()
	{ return materialIndicesToIgnore; }

	public List<Integer> getTerrainClsIgnoreValues()
	{ return terrainClsIgnoreValues; }

	public double getTerrainZErrorThreshold()
	{ return terrainZErrorThreshold; }

	public boolean isQuantizeHeight()
	{ return quantizeHeight; }

	public TestIgnoreMode getTestIgnoreMode()
	{ return testIgnoreMode; }

	@Override
	public String toString()
	{
		return "REF CLSMatchValue: "+refClsMatchSets
			+"\nTEST CLSMatchValue: "+testClsMatchSets
			+"\nMaterialNames: "+materialNames
			+"\nMaterialIndicesToIgnore: "+materialIndicesToIgnore
			+"\nTerrainCLSIgnoreValues: "+terrainClsIgnoreValues
			+"\nTerrainZErrorThreshold: "+terrainZErrorThreshold
			+"\nQuantizeHeight: "+quantizeHeight
			+"\nTestIgnore: "+testIgnoreMode;
	}


	public static Builder builder()
	{
		return new Builder();
	}

	public static class Builder
	{
		private List<List<Integer>> refClsMatchSets = new ArrayList<>();
		private List<List<Integer>> testClsMatchSets = new ArrayList<>();
		private List<String> materialNames = MaterialMap.DEFAULT_NAMES;
		private Set<Integer> materialIndicesToIgnore = new TreeSet<>();
		private List<Integer> terrainClsIgnoreValues = DEFAULT_TERRAIN_CLS_IGNORE_VALUES;
		private double terrainZErrorThreshold = DEFAULT_TERRAIN_Z_ERROR_THRESHOLD;
		private boolean quantizeHeight = false;
		private TestIgnoreMode testIgnoreMode = TestIgnoreMode.OFF;

		private Builder() {}

		/** Sets the same match-value sets for both the reference and test side. */
		public Builder clsMatchSets(final List<List<Integer>> sets)
		{
			this.refClsMatchSets = sets;
			this.testClsMatchSets = sets;
			return this;
		}

		public Builder refClsMatchSets(final List<List<Integer>> sets)
		{
			this.refClsMatchSets = sets;
			return this;
		}

		public Builder testClsMatchSets(final List<List<Integer>> sets)
		{
			this.testClsMatchSets = sets;
			return this;
		}

		public Builder materialNames(final List<String> names)
		{
			this.materialNames = names;
			return this;
		}

		public Builder materialIndicesToIgnore(final Set<Integer> indices)
		{
			this.materialIndicesToIgnore = indices;
			return this;
		}

		public Builder terrainClsIgnoreValues(final List<Integer> values)
		{
			this.terrainClsIgnoreValues = values;
			return this;
		}

		public Builder terrainZErrorThreshold(final double threshold)
		{
			this.terrainZErrorThreshold = threshold;
			return this;
		}

		public Builder quantizeHeight(final boolean quantize)
		{
			this.quantizeHeight = quantize;
			return this;
		}

		public Builder testIgnoreMode(final TestIgnoreMode mode)
		{
			this.testIgnoreMode = mode;
			return this;
		}

		/** Numeric variant: 0 = off, 1 = test CLS, 2 = test DSM/DTM. */
		public Builder testIgnoreMode(final int code)
		{
			this.testIgnoreMode = TestIgnoreMode.fromCode(code);
			return this;
		}

		/** Validates the settings, throws IllegalArgumentException on any inconsistency. */
		public GeometricsConfig build()
		{
			if (refClsMatchSets == null || testClsMatchSets == null)
				throw new IllegalArgumentException("CLSMatchValue must be given for both reference and test.");
			if (refClsMatchSets.size() != testClsMatchSets.size())
				throw new IllegalArgumentException("Reference and test CLSMatchValue lists differ in length: "
					+refClsMatchSets.size()+" vs. "+testClsMatchSets.size()+".");
			for (int i=0; i < refClsMatchSets.size(); ++i)
				if (refClsMatchSets.get(i) == null || refClsMatchSets.get(i).isEmpty()
				    || testClsMatchSets.get(i) == null)
					throw new IllegalArgumentException("Missing CLSMatchValue(s) at position "+i+".");

			if (materialNames == null || materialNames.isEmpty())
				throw new IllegalArgumentException("No MaterialNames given.");
			if (materialIndicesToIgnore == null)
				throw new IllegalArgumentException("MaterialIndicesToIgnore must not be null.");
			for (int i : materialIndicesToIgnore)
				if (i < 0 || i >= materialNames.size())
					throw new IllegalArgumentException("MaterialIndicesToIgnore contains "+i
						+" which is not among the "+materialNames.size()+" MaterialNames.");

			if (terrainClsIgnoreValues == null)
				throw new IllegalArgumentException("TerrainCLSIgnoreValues must not be null.");
			if (!(terrainZErrorThreshold > 0))
				throw new IllegalArgumentException("TerrainZErrorThreshold must be positive, got "
					+terrainZErrorThreshold+".");
			if (testIgnoreMode == null)
				throw new IllegalArgumentException("Test ignore mode must not be null.");

			return new GeometricsConfig(this);
		}
	}
}
