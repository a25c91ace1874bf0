package org.core3dmetrics.geometrics.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;

public class NumberSequenceHandlerTest
{
	@Test
	public void testSetWithIntervals()
	{
		assertEquals(new ArrayList<>(Arrays.asList(0,12,13)),
			new ArrayList<>(NumberSequenceHandler.toSet("13, 0,12-13")));
	}

	@Test
	public void testListKeepsOrder()
	{
		assertEquals(Arrays.asList(17,6,2,3,4), NumberSequenceHandler.toList("17,6,2-4,6"));
	}

	@Test
	public void testEmptyInputGivesNothing()
	{
		assertTrue(NumberSequenceHandler.toSet("").isEmpty());
		assertTrue(NumberSequenceHandler.toList(" ").isEmpty());
	}

	@Test
	public void testNegativeNumber()
	{
		assertEquals(Arrays.asList(-3,4), NumberSequenceHandler.toList("-3,4"));
	}

	@Test
	public void testNegativeNumberAfterSpace()
	{
		assertNull(NumberSequenceHandler.whyIsInputInvalid("1, -3"));
		assertEquals(Arrays.asList(1,-3), NumberSequenceHandler.toList("1, -3"));
		assertEquals(Arrays.asList(-5,-4,-3), NumberSequenceHandler.toList(" -5--3"));
		assertEquals(Arrays.asList(1,2,3), NumberSequenceHandler.toList("1 - 3"));
	}

	@Test
	public void testInvalidInput()
	{
		assertNull(NumberSequenceHandler.whyIsInputInvalid("1-9,23"));
		assertNotNull(NumberSequenceHandler.whyIsInputInvalid("1,x"));
		assertNotNull(NumberSequenceHandler.whyIsInputInvalid("9-1"));
		assertNotNull(NumberSequenceHandler.whyIsInputInvalid("6;17"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnparsableThrows()
	{
		NumberSequenceHandler.toSet("a-b");
	}

	@Test
	public void testNames()
	{
		assertEquals(Arrays.asList("Asphalt","Glass"), NumberSequenceHandler.toNames(" Asphalt, Glass,"));
	}
}
