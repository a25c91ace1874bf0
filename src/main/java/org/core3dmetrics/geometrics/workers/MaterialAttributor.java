package org.core3dmetrics.geometrics.workers;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.IntegerType;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Determines the most abundant material within a structure footprint.
 *
 * @param <MT>  voxel type of the material-label raster
 */
public class MaterialAttributor<MT extends IntegerType<MT>>
{
	/** Returned when no valid (non-ignored) material is present in the footprint. */
	public static final int NO_VALID_MATERIAL = -1;

	/**
	 * Counts occurrences of every material label at the given pixel positions.
	 * Ignored labels are counted too, they are only skipped when the winner
	 * is chosen in findPrimaryMaterial().
	 */
	public
	TreeMap<Integer,Integer> countMaterials(final RandomAccessibleInterval<MT> mtlImg,
	                                        final Collection<long[]> pixels)
	{
		final TreeMap<Integer,Integer> labelCounter = new TreeMap<>();
		final RandomAccess<MT> ra = mtlImg.randomAccess();

		for (long[] pos : pixels)
		{
			ra.setPosition(pos);
			final int label = ra.get().getInteger();
			labelCounter.put(label, labelCounter.getOrDefault(label,0)+1);
		}

		return labelCounter;
	}

	/**
	 * Returns the material label that occurs most frequently over the 'pixels'
	 * in the 'mtlImg' and that is not listed in the 'ignoredMaterials'. When
	 * several labels share the highest count, the lowest label wins. The
	 * method returns NO_VALID_MATERIAL if only ignored labels are present.
	 */
	public
	int findPrimaryMaterial(final RandomAccessibleInterval<MT> mtlImg,
	                        final Collection<long[]> pixels,
	                        final Set<Integer> ignoredMaterials)
	{
		int bestLabel = NO_VALID_MATERIAL;
		int bestCount = 0;

		//NB: TreeMap iterates in ascending labels, strict '>' keeps the lowest on ties
		for (Map.Entry<Integer,Integer> e : countMaterials(mtlImg, pixels).entrySet())
		{
			if (e.getValue() > bestCount && !ignoredMaterials.contains(e.getKey()))
			{
				bestLabel = e.getKey();
				bestCount = e.getValue();
			}
		}

		return bestLabel;
	}
}
