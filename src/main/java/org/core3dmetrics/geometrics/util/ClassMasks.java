/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2026 core3d-geometrics developers
 */
package org.core3dmetrics.geometrics.util;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Conversion of class-code rasters into boolean region-of-interest masks.
 * A match-value set is a group of class codes treated as one logical class.
 */
public class ClassMasks
{
	/** Returns all distinct values that are present in the 'clsImg'. */
	static public < T extends IntegerType<T> >
	TreeSet<Integer> observedValues(final RandomAccessibleInterval<T> clsImg)
	{
		final TreeSet<Integer> values = new TreeSet<>();
		final Cursor<T> c = Views.iterable(clsImg).cursor();
		while (c.hasNext()) values.add( c.next().getInteger() );
		return values;
	}

	/**
	 * Checks that every value of 'matchValues' is present among the 'observedValues'.
	 * A value that never occurs could not be matched at all, which is treated
	 * as a configuration error (IllegalArgumentException). Returns the input list.
	 */
	static public
	List<Integer> validateMatchValues(final List<Integer> matchValues,
	                                  final Set<Integer> observedValues)
	{
		final List<Integer> missing = new ArrayList<>();
		for (Integer v : matchValues)
			if (!observedValues.contains(v)) missing.add(v);

		if (!missing.isEmpty())
			throw new IllegalArgumentException("Match value(s) "+missing
				+" not found in the raster, present values are "+observedValues+".");

		return matchValues;
	}

	/**
	 * Checks the reference and test lists of match-value sets before any mask
	 * is built: both lists must be of the same length (sets are paired by their
	 * position) and every value must be present in the corresponding raster.
	 */
	static public
	void validateMatchValueSets(final List<List<Integer>> refSets,
	                            final List<List<Integer>> testSets,
	                            final Set<Integer> refObservedValues,
	                            final Set<Integer> testObservedValues)
	{
		if (refSets.size() != testSets.size())
			throw new IllegalArgumentException("Reference and test lists of match-value sets"
				+" differ in length: "+refSets.size()+" vs. "+testSets.size()+".");

		for (int i=0; i < refSets.size(); ++i)
		{
			if (refSets.get(i).isEmpty())
				throw new IllegalArgumentException("Reference match-value set no. "+i+" is empty.");

			validateMatchValues(refSets.get(i), refObservedValues);
			validateMatchValues(testSets.get(i), testObservedValues);
		}
	}


	/**
	 * Creates a mask of the same size as the 'clsImg' that is true wherever
	 * the class code is one of the 'matchValues'. An empty 'matchValues'
	 * gives an all-false mask.
	 */
	static public < T extends IntegerType<T> >
	Img<BitType> buildMask(final RandomAccessibleInterval<T> clsImg,
	                       final Collection<Integer> matchValues)
	{
		final Img<BitType> mask = ArrayImgs.bits( Intervals.dimensionsAsLongArray(clsImg) );
		if (matchValues.isEmpty()) return mask;

		final Set<Integer> values = new HashSet<>(matchValues);
		LoopBuilder.setImages(Views.zeroMin(clsImg),mask).forEachPixel(
			(c,m) -> m.set( values.contains(c.getInteger()) ) );

		return mask;
	}


	/** Returns the number of true pixels in the 'mask'. */
	static public
	long countSet(final RandomAccessibleInterval<BitType> mask)
	{
		long cnt = 0;
		for (BitType b : Views.iterable(mask))
			if (b.get()) ++cnt;
		return cnt;
	}

	/** Returns true if the 'mask' is true everywhere. */
	static public
	boolean coversEverything(final RandomAccessibleInterval<BitType> mask)
	{
		return countSet(mask) == Rasters.countPixels(mask);
	}
}
