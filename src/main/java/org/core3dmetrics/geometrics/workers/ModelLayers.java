package org.core3dmetrics.geometrics.workers;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;

import org.core3dmetrics.geometrics.util.GeoTransform;
import org.core3dmetrics.geometrics.util.Rasters;

/**
 * Co-registered rasters of one evaluation run, already warped onto the grid
 * of the reference CLS raster. Every raster given here is checked to be of
 * the same size as the reference CLS raster.
 */
public class ModelLayers
{
	public final GeoTransform tform;

	public final RandomAccessibleInterval<UnsignedShortType> refCLS;
	public final RandomAccessibleInterval<FloatType> refDSM;
	public final RandomAccessibleInterval<FloatType> refDTM;

	public final RandomAccessibleInterval<UnsignedShortType> testCLS;
	public final RandomAccessibleInterval<FloatType> testDSM;

	/** optional layers, null when not available */
	private RandomAccessibleInterval<FloatType> testDTM = null;
	private RandomAccessibleInterval<UnsignedShortType> refNDX = null;
	private RandomAccessibleInterval<UnsignedShortType> refMTL = null;
	private RandomAccessibleInterval<UnsignedShortType> testMTL = null;

	/** no-data values of the CLS rasters, null if the raster declares none */
	private Integer refClsNoDataValue = null;
	private Integer testClsNoDataValue = null;

	public ModelLayers(final GeoTransform tform,
	                   final RandomAccessibleInterval<UnsignedShortType> refCLS,
	                   final RandomAccessibleInterval<FloatType> refDSM,
	                   final RandomAccessibleInterval<FloatType> refDTM,
	                   final RandomAccessibleInterval<UnsignedShortType> testCLS,
	                   final RandomAccessibleInterval<FloatType> testDSM)
	{
		if (tform == null || refCLS == null || refDSM == null || refDTM == null
		    || testCLS == null || testDSM == null)
			throw new NullPointerException("Geotransform, reference CLS/DSM/DTM and test CLS/DSM are required.");

		Rasters.checkSameSize(refCLS,"refCLS", refDSM,"refDSM");
		Rasters.checkSameSize(refCLS,"refCLS", refDTM,"refDTM");
		Rasters.checkSameSize(refCLS,"refCLS", testCLS,"testCLS");
		Rasters.checkSameSize(refCLS,"refCLS", testDSM,"testDSM");

		this.tform = tform;
		this.refCLS = refCLS;
		this.refDSM = refDSM;
		this.refDTM = refDTM;
		this.testCLS = testCLS;
		this.testDSM = testDSM;
	}

	public ModelLayers setTestDTM(final RandomAccessibleInterval<FloatType> img)
	{
		Rasters.checkSameSize(refCLS,"refCLS", img,"testDTM");
		testDTM = img;
		return this;
	}

	public ModelLayers setRefNDX(final RandomAccessibleInterval<UnsignedShortType> img)
	{
		Rasters.checkSameSize(refCLS,"refCLS", img,"refNDX");
		refNDX = img;
		return this;
	}

	public ModelLayers setRefMTL(final RandomAccessibleInterval<UnsignedShortType> img)
	{
		Rasters.checkSameSize(refCLS,"refCLS", img,"refMTL");
		refMTL = img;
		return this;
	}

	public ModelLayers setTestMTL(final RandomAccessibleInterval<UnsignedShortType> img)
	{
		Rasters.checkSameSize(refCLS,"refCLS", img,"testMTL");
		testMTL = img;
		return this;
	}

	public ModelLayers setRefClsNoDataValue(final Integer value)
	{
		refClsNoDataValue = value;
		return this;
	}

	public ModelLayers setTestClsNoDataValue(final Integer value)
	{
		testClsNoDataValue = value;
		return this;
	}

	public RandomAccessibleInterval<FloatType> getTestDTM()
	{ return testDTM; }

	public RandomAccessibleInterval<UnsignedShortType> getRefNDX()
	{ return refNDX; }

	public RandomAccessibleInterval<UnsignedShortType> getRefMTL()
	{ return refMTL; }

	public RandomAccessibleInterval<UnsignedShortType> getTestMTL()
	{ return testMTL; }

	public Integer getRefClsNoDataValue()
	{ return refClsNoDataValue; }

	public Integer getTestClsNoDataValue()
	{ return testClsNoDataValue; }
}
