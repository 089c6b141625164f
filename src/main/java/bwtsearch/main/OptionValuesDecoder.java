/*******************************************************************************
 * BWTSearch - Wildcard substring search over Burrows-Wheeler indexes
 * Copyright 2026 The BWTSearch contributors
 *
 * This file is part of BWTSearch.
 *
 *     BWTSearch is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     BWTSearch is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with BWTSearch.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package bwtsearch.main;

import java.io.IOException;
import java.util.logging.Logger;

import bwtsearch.sequences.BWTWildcardIndex;
import bwtsearch.sequences.SuffixArrayAlgorithm;
import bwtsearch.sequences.io.TextSequenceLoader;

/**
 * Decoding of option values and loading of the inputs shared by the commands
 */
public class OptionValuesDecoder {

	/**
	 * Decodes an option value that must have exactly one character
	 * @param value given by the user
	 * @param optionName Name of the option for error messages
	 * @return char The only character of the value
	 */
	public static char decodeSymbol(String value, String optionName) {
		if(value==null || value.length()!=1) throw new IllegalArgumentException("The "+optionName+" must be a single character. Invalid value: \""+value+"\"");
		return value.charAt(0);
	}

	/**
	 * Decodes the name of a constant of the given enum ignoring case
	 * @param value given by the user
	 * @param type Enum class
	 * @return T constant with the given name
	 * @throws IllegalArgumentException If the enum does not have a constant with the given name
	 */
	public static <T> T decodeEnum(String value, Class<T> type) {
		T [] constants = type.getEnumConstants();
		if(constants==null) throw new IllegalArgumentException(type.getName()+" is not an enum");
		String name = (value==null)?"":value.trim();
		StringBuilder validNames = new StringBuilder();
		for(T constant:constants) {
			String constantName = ((Enum<?>)constant).name();
			if(constantName.equalsIgnoreCase(name)) return constant;
			if(validNames.length()>0) validNames.append(", ");
			validNames.append(constantName);
		}
		throw new IllegalArgumentException("Invalid value \""+value+"\" for "+type.getSimpleName()+". Valid values are "+validNames);
	}

	public static String loadText(String textFile, Logger log) throws IOException {
		log.info("Loading text from: "+textFile);
		TextSequenceLoader loader = new TextSequenceLoader();
		loader.setLog(log);
		String text = loader.loadText(textFile);
		log.info("Loaded text with "+text.length()+" characters from file: "+textFile);
		return text;
	}

	public static BWTWildcardIndex buildIndex(String text, char wildcard, char terminator, SuffixArrayAlgorithm algorithm, Logger log) {
		log.info("Building index for text of length "+text.length()+" with suffix array algorithm "+algorithm);
		long time = System.currentTimeMillis();
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex(text, wildcard, terminator, algorithm);
		log.info("Built index with "+index.getAlphabet().size()+" symbols in "+(System.currentTimeMillis()-time)+" milliseconds");
		return index;
	}

	public static BWTWildcardIndex loadIndex(String indexFile, Logger log) throws IOException {
		log.info("Loading index from: "+indexFile);
		BWTWildcardIndex index = BWTWildcardIndex.load(indexFile);
		log.info("Loaded index for text of length "+index.getTextLength()+" with "+index.getAlphabet().size()+" symbols from file: "+indexFile);
		return index;
	}
}
