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

import org.scijava.ItemIO;
import org.scijava.command.Command;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.log.LogService;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedShortType;

import java.util.List;
import java.util.Set;

import org.core3dmetrics.geometrics.util.MaterialMap;
import org.core3dmetrics.geometrics.util.NumberSequenceHandler;
import org.core3dmetrics.geometrics.workers.MTL;
import org.core3dmetrics.geometrics.workers.MaterialMetrics;

@Plugin(type = Command.class, menuPath = "Plugins>CORE3D>Material labeling measure",
        name = "CORE3D_MTL", headless = true,
        description = "Compares material labels of a test model with the reference model\n"
                     +"inside the footprints of the reference structures, per pixel\n"
                     +"and per structure (primary material).")
public class plugin_MTLmeasure implements Command
{
	@Parameter
	LogService log;

	@Parameter(label = "Reference structure-index raster:",
		description = "Pixels of the same positive value form one structure, 0 is background.")
	RandomAccessibleInterval<UnsignedShortType> refNDX;

	@Parameter(label = "Reference material raster:")
	RandomAccessibleInterval<UnsignedShortType> refMTL;

	@Parameter(label = "Test material raster:")
	RandomAccessibleInterval<UnsignedShortType> testMTL;

	@Parameter(label = "Material names (comma separated):",
		description = "The position in this list is the material label.",
		validater = "materialNamesValidator")
	String materialNamesStr = String.join(",", MaterialMap.DEFAULT_NAMES);

	@Parameter(label = "Materials to ignore in the reference (e.g. 0,12-13):",
		description = "Comma separated list of numbers or intervals, interval is number-hyphen-number.",
		validater = "ignoredMaterialsValidator")
	String ignoredMaterialsStr = "0";

	@Parameter(label = "Do verbose logging",
		description = "Reports also the primary materials of every structure.")
	boolean optionVerboseLogging = false;


	//hidden output values
	@Parameter(type = ItemIO.OUTPUT)
	long scoredStructures = -1;

	@Parameter(type = ItemIO.OUTPUT)
	double fractionStructuresCorrect = Double.NaN;

	@Parameter(type = ItemIO.OUTPUT)
	double fractionPixelsCorrect = Double.NaN;


	@SuppressWarnings("unused")
	private void materialNamesValidator()
	{
		if (NumberSequenceHandler.toNames(materialNamesStr).isEmpty())
			throw new IllegalArgumentException("No material names given.");
	}

	@SuppressWarnings("unused")
	private void ignoredMaterialsValidator()
	{
		//check the string is parse-able
		final String complaint = NumberSequenceHandler.whyIsInputInvalid(ignoredMaterialsStr);
		if (complaint != null)
			throw new IllegalArgumentException(complaint);
	}


	@Override
	public void run()
	{
		try {
			final List<String> names = NumberSequenceHandler.toNames(materialNamesStr);
			final Set<Integer> ignored = NumberSequenceHandler.toSet(ignoredMaterialsStr);

			//validates the settings the same way a full evaluation run does
			final GeometricsConfig config = GeometricsConfig.builder()
				.materialNames(names)
				.materialIndicesToIgnore(ignored)
				.build();

			final MTL mtl = new MTL(log);
			mtl.doLogReports = optionVerboseLogging;

			final MaterialMetrics metrics = mtl.calculate(refNDX, refMTL, testMTL,
				config.getMaterialNames(), config.getMaterialIndicesToIgnore());

			scoredStructures = metrics.getScoredStructures();
			fractionStructuresCorrect = metrics.getFractionStructuresCorrect();
			fractionPixelsCorrect = metrics.getFractionPixelsCorrect();
		}
		catch (RuntimeException e) {
			log.error("CORE3D MTL measure problem: "+e.getMessage());
		}

		//do not report anything explicitly (unless special format for parsing is
		//desired) as ItemIO.OUTPUT will make it output automatically
	}
}
