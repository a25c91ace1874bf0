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
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.view.Views;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import org.core3dmetrics.geometrics.util.ConfusionMatrix;
import org.core3dmetrics.geometrics.util.Rasters;
import org.core3dmetrics.geometrics.workers.StructureIndex.Structure;

/**
 * Material labeling measure: compares the truth and test material rasters
 * inside the footprints of the reference structures, both per pixel and per
 * structure (using the primary, most abundant, material of each structure).
 */
public class MTL
{
	///shortcuts to some Fiji services
	private final LogService log;

	///a constructor requiring connection to Fiji report/log services
	public MTL(final LogService _log)
	{
		//check that non-null was given for _log!
		if (_log == null)
			throw new NullPointerException("No log service supplied.");

		log = _log;
	}

	/**
	 * Calculation option: do report the primary materials of every structure.
	 * The confusion matrices and totals are reported always.
	 */
	public boolean doLogReports = false;


	//---------------------------------------------------------------------/
	/**
	 * This is the main material measure calculator.
	 *
	 * @param refNDX  reference structure-index raster, 0 means no structure
	 * @param refMTL  reference (truth) material labels
	 * @param testMTL test material labels
	 * @param materialNames  names of the defined materials, the index into this list is the label
	 * @param ignoredMaterials  truth labels excluded from the scoring
	 */
	public <NT extends IntegerType<NT>, MT extends IntegerType<MT>>
	MaterialMetrics calculate(final RandomAccessibleInterval<NT> refNDX,
	                          final RandomAccessibleInterval<MT> refMTL,
	                          final RandomAccessibleInterval<MT> testMTL,
	                          final List<String> materialNames,
	                          final Set<Integer> ignoredMaterials)
	{
		Rasters.checkSameSize(refNDX,"refNDX", refMTL,"refMTL");
		Rasters.checkSameSize(refNDX,"refNDX", testMTL,"testMTL");

		final int noOfMaterials = materialNames.size();
		for (int i : ignoredMaterials)
			if (i < 0 || i >= noOfMaterials)
				throw new IllegalArgumentException("Ignored material index "+i
					+" is not among the "+noOfMaterials+" defined materials.");

		log.info("Defined materials: "+String.join(", ", materialNames));
		final StringJoiner ignoredNames = new StringJoiner(", ");
		for (int i : ignoredMaterials) ignoredNames.add(materialNames.get(i));
		log.info("Ignored materials in truth: "+ignoredNames);

		log.info("Building dictionary of reference structure locations and labels...");
		final Map<Integer,Structure> structures = new StructureIndex(log).getStructures(refNDX);
		log.info("There are "+structures.size()+" reference structures.");

		final MaterialAttributor<MT> attributor = new MaterialAttributor<>();
		log.info("Selecting the most abundant material for each structure in reference model...");
		for (Structure s : structures.values())
			s.m_truthPrimaryMaterial = attributor.findPrimaryMaterial(refMTL, s.m_pixels, ignoredMaterials);

		log.info("Selecting the most abundant material for each structure in test model...");
		for (Structure s : structures.values())
			s.m_testPrimaryMaterial = attributor.findPrimaryMaterial(testMTL, s.m_pixels, ignoredMaterials);

		if (doLogReports)
			for (Structure s : structures.values())
				log.info(String.format("structure=%d size=%d truth_material=%d test_material=%d",
					s.m_id, s.size(), s.m_truthPrimaryMaterial, s.m_testPrimaryMaterial));

		//pixel label confusion matrix, limited to inside of the structure outlines
		final ConfusionMatrix pixelMatrix = new ConfusionMatrix(noOfMaterials);
		long ignoredPixels = 0;

		final Cursor<NT> ndxCursor = Views.flatIterable(refNDX).localizingCursor();
		final RandomAccess<MT> refRA  = refMTL.randomAccess();
		final RandomAccess<MT> testRA = testMTL.randomAccess();
		while (ndxCursor.hasNext())
		{
			if (ndxCursor.next().getInteger() == StructureIndex.NO_STRUCTURE) continue;

			refRA.setPosition(ndxCursor);
			final int truthLabel = refRA.get().getInteger();
			if (ignoredMaterials.contains(truthLabel))
			{
				++ignoredPixels;
				continue;
			}

			testRA.setPosition(ndxCursor);
			pixelMatrix.add(truthLabel, testRA.get().getInteger());
		}

		//structure label confusion matrix
		final ConfusionMatrix structureMatrix = new ConfusionMatrix(noOfMaterials);
		//every retained structure ends up either in the matrix or among the unscored ones
		long unscoredCount = 0;
		for (Structure s : structures.values())
		{
			if (s.m_truthPrimaryMaterial == MaterialAttributor.NO_VALID_MATERIAL
			    || s.m_testPrimaryMaterial == MaterialAttributor.NO_VALID_MATERIAL
			    || ignoredMaterials.contains(s.m_truthPrimaryMaterial))
				++unscoredCount;
			else
				structureMatrix.add(s.m_truthPrimaryMaterial, s.m_testPrimaryMaterial);
		}

		final MaterialMetrics metrics = new MaterialMetrics(pixelMatrix, structureMatrix,
			ignoredPixels, unscoredCount);
		reportMetrics(metrics, materialNames);
		return metrics;
	}


	private void reportMetrics(final MaterialMetrics m, final List<String> materialNames)
	{
		log.info("Pixel material confusion matrix:\n"+m.pixelMatrix.toText(materialNames));
		log.info("Total pixels scored: "+m.getScoredPixels());
		log.info("Total pixels correctly classified: "+m.getCorrectPixels());
		log.info("Percent pixels correctly classified: "+percent(m.getFractionPixelsCorrect()));

		log.info("Primary structure material confusion matrix:\n"+m.structureMatrix.toText(materialNames));
		log.info("Structures marked as non-scored: "+m.unscoredStructures);
		log.info("Total structures scored: "+m.getScoredStructures());
		log.info("Total structures correctly classified: "+m.getCorrectStructures());
		log.info("Percent structures correctly classified: "+percent(m.getFractionStructuresCorrect()));
	}

	private static String percent(final double fraction)
	{
		return Double.isNaN(fraction) ? "undefined (nothing scored)" : (fraction*100.0)+"%";
	}
}
