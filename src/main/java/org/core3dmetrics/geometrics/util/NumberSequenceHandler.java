/*
 * CC BY-SA 4.0
 *
 * The code is licensed with "Attribution-ShareAlike 4.0 International license".
 * See the license details:
 *     https://creativecommons.org/licenses/by-sa/4.0/
 *
 * Copyright (C) 2018 Vladimír Ulman
 */
package org.core3dmetrics.geometrics.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;
import java.text.ParseException;

/**
 * Parsing of the succinct textual forms of the configuration items:
 * number sequences such as "0,12-13" (label indices, class codes)
 * and comma-separated names.
 */
public class NumberSequenceHandler
{
	/** Attempts to parse input 'inStr' and returns 'null' only if that can be done,
	    otherwise a string with complaint message is returned. */
	public static
	String whyIsInputInvalid(final String inStr)
	{
		try {
			parseSequenceOfNumbers(inStr,null);
		}
		catch (ParseException e)
		{
			return e.getMessage();
		}
		return null;
	}


	/** Parses the input 'inStr' and returns an expanded, sorted set that corresponds
	    to the (succinct) string input. */
	public static
	TreeSet<Integer> toSet(final String inStr)
	{
		final TreeSet<Integer> outSet = new TreeSet<>();
		parseOrComplain(inStr,outSet);
		return outSet;
	}

	/** Parses the input 'inStr' and returns an expanded list that keeps the order
	    of the (succinct) string input, repeated numbers are listed only once. */
	public static
	List<Integer> toList(final String inStr)
	{
		final LinkedHashSet<Integer> outSet = new LinkedHashSet<>();
		parseOrComplain(inStr,outSet);
		return new ArrayList<>(outSet);
	}

	/** Splits the comma-separated names, surrounding spaces are removed. */
	public static
	List<String> toNames(final String inStr)
	{
		final List<String> names = new ArrayList<>();
		for (String name : inStr.split(","))
			if (!name.trim().isEmpty()) names.add(name.trim());
		return names;
	}
	// -------------------------------------------------------------------------

	private static
	void parseOrComplain(final String inStr, final Collection<Integer> outList)
	{
		try {
			parseSequenceOfNumbers(inStr,outList);
		}
		catch (ParseException e)
		{
			throw new IllegalArgumentException(e.getMessage());
		}
	}

	/** Reads inStr and parses it into outList (if outList is not null).
	    This is the string-to-numbers conversion workhorse. An empty
	    or blank inStr gives no numbers. */
	public static
	void parseSequenceOfNumbers(final String inStr, final Collection<Integer> outList)
	throws ParseException
	{
		//marker where we pretend that the input string begins
		//aka "how much has been parsed so far"
		int strFakeBegin = 0;
		if (inStr.trim().isEmpty()) return;

		try {
			while (strFakeBegin < inStr.length())
			{
				int ic = inStr.indexOf(',',strFakeBegin);

				//NB: a hyphen right at the beginning of a term (after spaces) is a minus sign
				int termBegin = strFakeBegin;
				while (termBegin < inStr.length() && Character.isWhitespace(inStr.charAt(termBegin)))
					++termBegin;
				int ih = inStr.indexOf('-',termBegin+1);

				if (ic == -1)
					//if no comma is found, then we are processing the last term
					ic = inStr.length();

				if (ih == -1 || ih > ic)
				{
					//"comma branch"
					//we're parsing out N,
					final int N = Integer.parseInt( inStr.substring(strFakeBegin, ic).trim() );
					if (outList != null) outList.add(N);
				}
				else
				{
					//"hyphen branch"
					//we're parsing out N-M,
					final int N = Integer.parseInt( inStr.substring(strFakeBegin, ih).trim() );
					final int M = Integer.parseInt( inStr.substring(ih+1, ic).trim() );
					if (N > M)
						throw new ParseException("Interval "+N+"-"+M+" is decreasing.",strFakeBegin);
					if (outList != null)
						for (int n=N; n <= M; ++n) outList.add(n);
				}

				strFakeBegin = ic+1;
			}
		}
		catch (NumberFormatException e)
		{
			throw new ParseException("Parsing problem after reading "
			                         +inStr.substring(0,Math.min(strFakeBegin,inStr.length()))
			                         +": "+e.getMessage(),0);
		}
	}
}
