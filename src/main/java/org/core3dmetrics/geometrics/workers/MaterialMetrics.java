package org.core3dmetrics.geometrics.workers;

import org.core3dmetrics.geometrics.util.ConfusionMatrix;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of the material labeling evaluation. Fractions are Double.NaN
 * when there was nothing to score.
 */
public class MaterialMetrics
{
	/** Pixel-level truth x test material counts. */
	public final ConfusionMatrix pixelMatrix;
	/** Structure-level truth x test primary material counts. */
	public final ConfusionMatrix structureMatrix;

	/** Pixels inside structures whose truth material is ignored. */
	public final long ignoredPixels;
	/** Retained structures without a valid primary material in the truth or in the test model. */
	public final long unscoredStructures;

	MaterialMetrics(final ConfusionMatrix pixelMatrix, final ConfusionMatrix structureMatrix,
	                final long ignoredPixels, final long unscoredStructures)
	{
		this.pixelMatrix = pixelMatrix;
		this.structureMatrix = structureMatrix;
		this.ignoredPixels = ignoredPixels;
		this.unscoredStructures = unscoredStructures;
	}

	public long getScoredPixels()
	{ return pixelMatrix.sum(); }

	public long getCorrectPixels()
	{ return pixelMatrix.trace(); }

	public double getFractionPixelsCorrect()
	{ return pixelMatrix.fractionCorrect(); }

	public long getScoredStructures()
	{ return structureMatrix.sum(); }

	public long getCorrectStructures()
	{ return structureMatrix.trace(); }

	public double getFractionStructuresCorrect()
	{
		final long scored = getScoredStructures();
		return scored > 0 ? (double)getCorrectStructures() / (double)scored : Double.NaN;
	}

	/**
	 * Exports the summary in the layout of the metrics report,
	 * undefined fractions are exported as null.
	 */
	public Map<String,Object> toMap()
	{
		final Map<String,Object> map = new LinkedHashMap<>();
		map.put("scored_structures", getScoredStructures());
		map.put("fraction_structures_correct", orNull(getFractionStructuresCorrect()));
		map.put("fraction_pixels_correct", orNull(getFractionPixelsCorrect()));
		return map;
	}

	private static Double orNull(final double value)
	{
		return Double.isNaN(value) ? null : value;
	}
}
