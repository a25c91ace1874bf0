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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.view.Views;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeMap;

public class StructureIndex
{
	///shortcuts to some Fiji services
	private final LogService log;

	///a constructor requiring connection to Fiji report/log services
	public StructureIndex(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}

	/** Value in the structure-index raster that marks pixels outside any structure. */
	public static final int NO_STRUCTURE = 0;

	/** Structures with fewer pixels than this are discarded. They occur
	    where neighbouring structure footprints slightly overlap. */
	public static final int MIN_STRUCTURE_SIZE = 10;


	/**
	 * Record of just one structure, that is, one physical object instance
	 * found in the reference structure-index raster.
	 */
	public static class Structure
	{
		/** Structure identifier, the value found in the index raster.
		    The value is strictly positive. */
		final int m_id;

		/** Pixel coordinates (x,y) of this structure, in row-major scan order. */
		final List<long[]> m_pixels = new ArrayList<>();

		/** Primary (most abundant) material in the reference model,
		    MaterialAttributor.NO_VALID_MATERIAL until set. */
		int m_truthPrimaryMaterial = MaterialAttributor.NO_VALID_MATERIAL;

		/** Primary (most abundant) material in the test model,
		    MaterialAttributor.NO_VALID_MATERIAL until set. */
		int m_testPrimaryMaterial = MaterialAttributor.NO_VALID_MATERIAL;

		Structure(final int id)
		{
			m_id = id;
		}

		public int getId()
		{ return m_id; }

		public List<long[]> getPixels()
		{ return Collections.unmodifiableList(m_pixels); }

		public int size()
		{ return m_pixels.size(); }

		public int getTruthPrimaryMaterial()
		{ return m_truthPrimaryMaterial; }

		public int getTestPrimaryMaterial()
		{ return m_testPrimaryMaterial; }
	}


	/**
	 * Sweeps the structure-index raster in the row-major order and collects
	 * pixel coordinates of every positive label (structure). Structures with
	 * less than MIN_STRUCTURE_SIZE pixels are removed afterwards. The returned
	 * map is ordered by the structure identifiers; an all-zero raster gives
	 * an empty map.
	 */
	public <T extends IntegerType<T>>
	TreeMap<Integer,Structure> getStructures(final RandomAccessibleInterval<T> ndxImg)
	{
		if (ndxImg.numDimensions() != 2)
			throw new IllegalArgumentException("Structure-index raster must be 2D, got "
				+ndxImg.numDimensions()+" dimensions.");

		final TreeMap<Integer,Structure> structures = new TreeMap<>();

		//NB: flatIterable() guarantees the x-fastest (row-major) order
		final Cursor<T> c = Views.flatIterable(ndxImg).localizingCursor();
		while (c.hasNext())
		{
			final int label = c.next().getInteger();
			if (label <= NO_STRUCTURE) continue;

			Structure s = structures.get(label);
			if (s == null)
			{
				s = new Structure(label);
				structures.put(label, s);
			}
			s.m_pixels.add( new long[] { c.getLongPosition(0), c.getLongPosition(1) } );
		}

		int removed = 0;
		for (Iterator<Structure> it = structures.values().iterator(); it.hasNext(); )
		{
			if (it.next().size() < MIN_STRUCTURE_SIZE)
			{
				it.remove();
				++removed;
			}
		}
		if (removed > 0)
			log.info("Removed "+removed+" structure(s) smaller than "+MIN_STRUCTURE_SIZE+" pixels.");

		return structures;
	}
}
