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

import java.util.List;

/**
 * Square table of counts indexed by label identifiers 0..N-1.
 * The position (i,j) holds the number of units (pixels or structures)
 * whose truth label is i and whose test label is j.
 */
public class ConfusionMatrix
{
	/** Number of labels, the matrix is m_size x m_size. */
	private final int m_size;

	/**
	 * Counts stored as a plain 1D array, position (i,j), that is, the i-th row
	 * and j-th column, is found at m_counts[i*m_size + j].
	 */
	private final long[] m_counts;

	public ConfusionMatrix(final int size)
	{
		if (size < 1)
			throw new IllegalArgumentException("Confusion matrix needs at least one label, got "+size+".");

		m_size = size;
		m_counts = new long[size*size];
	}

	public int size()
	{ return m_size; }

	/** Returns true if the 'label' can index this matrix. */
	public boolean isValidLabel(final int label)
	{
		return label >= 0 && label < m_size;
	}

	/** Increases the count at (truthLabel,testLabel) by one. */
	public void add(final int truthLabel, final int testLabel)
	{
		if (!isValidLabel(truthLabel) || !isValidLabel(testLabel))
			throw new IllegalArgumentException("Label pair ("+truthLabel+","+testLabel
				+") is outside the range of "+m_size+" defined labels.");

		++m_counts[truthLabel*m_size + testLabel];
	}

	public long get(final int truthLabel, final int testLabel)
	{
		return m_counts[truthLabel*m_size + testLabel];
	}

	/** Total number of scored units. */
	public long sum()
	{
		long sum = 0;
		for (long c : m_counts) sum += c;
		return sum;
	}

	/** Number of correctly classified units. */
	public long trace()
	{
		long trace = 0;
		for (int i=0; i < m_size; ++i) trace += m_counts[i*m_size + i];
		return trace;
	}

	/** Returns trace()/sum(), or Double.NaN if nothing was scored. */
	public double fractionCorrect()
	{
		final long sum = sum();
		return sum > 0 ? (double)trace() / (double)sum : Double.NaN;
	}

	/** Returns a copy of the matrix as rows. */
	public long[][] toArray()
	{
		final long[][] rows = new long[m_size][m_size];
		for (int i=0; i < m_size; ++i)
			System.arraycopy(m_counts, i*m_size, rows[i], 0, m_size);
		return rows;
	}

	/**
	 * Renders the matrix as a tab-separated table, one truth label per line.
	 * The first column holds the label names if 'labelNames' is given.
	 */
	public String toText(final List<String> labelNames)
	{
		final StringBuilder sb = new StringBuilder();
		for (int i=0; i < m_size; ++i)
		{
			if (labelNames != null && i < labelNames.size())
				sb.append(labelNames.get(i)).append(":\t");
			else
				sb.append(i).append(":\t");

			for (int j=0; j < m_size; ++j)
				sb.append(m_counts[i*m_size + j]).append('\t');
			sb.append('\n');
		}
		return sb.toString();
	}

	@Override
	public String toString()
	{
		return toText(null);
	}
}
