package org.core3dmetrics.geometrics.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Default material labels, the position in the list is the label index. */
public class MaterialMap
{
	public static final List<String> DEFAULT_NAMES = Collections.unmodifiableList(Arrays.asList(
		"Unclassified",
		"Asphalt",
		"Concrete",
		"Glass",
		"Tree",
		"Vegetation",
		"Metal",
		"Ceramic",
		"Soil",
		"Solar_panel",
		"Water",
		"Polymer",
		"Unscored",
		"Indeterminate" ));
}
