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
package bwtsearch.sequences;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stable mapping between the symbols of an indexed text and dense indexes.
 * Index 0 is always the terminator, which sorts before every other symbol regardless of
 * its character value. Indexes 1 to size()-1 are the text symbols in ascending order
 */
public class SymbolAlphabet {

	public static final int TERMINATOR_INDEX = 0;

	private final char terminator;
	//Sorted distinct symbols of the text. The terminator is not included
	private final char [] symbols;

	/**
	 * Creates an alphabet from the given sorted symbols
	 * @param terminator Special character appended to the text
	 * @param symbols Distinct symbols sorted in ascending order. Must not include the terminator
	 */
	public SymbolAlphabet(char terminator, char [] symbols) {
		for(int i=0;i<symbols.length;i++) {
			if(symbols[i]==terminator) throw new IllegalArgumentException("The terminator symbol "+terminator+" can not be part of the alphabet");
			if(i>0 && symbols[i-1]>=symbols[i]) throw new IllegalArgumentException("Alphabet symbols must be distinct and sorted. Found "+symbols[i-1]+" before "+symbols[i]);
		}
		this.terminator = terminator;
		this.symbols = Arrays.copyOf(symbols, symbols.length);
	}

	/**
	 * Infers the alphabet of the given text
	 * @param text Text to analyze
	 * @param terminator Special character that will be appended to the text
	 * @return SymbolAlphabet Alphabet with the distinct characters of the text
	 * @throws IllegalArgumentException If the text contains the terminator
	 */
	public static SymbolAlphabet fromText(CharSequence text, char terminator) {
		Set<Character> sortedAlphabet = new TreeSet<Character>();
		for(int i=0;i<text.length();i++) {
			char c = text.charAt(i);
			if(c==terminator) throw new IllegalArgumentException("Text contains the terminator symbol "+terminator+" at position "+i);
			sortedAlphabet.add(c);
		}
		char [] symbols = new char[sortedAlphabet.size()];
		int i=0;
		for(char c:sortedAlphabet) symbols[i++] = c;
		return new SymbolAlphabet(terminator, symbols);
	}

	public char getTerminator() {
		return terminator;
	}

	/**
	 * @return int Number of symbols including the terminator
	 */
	public int size() {
		return symbols.length+1;
	}

	/**
	 * @param c Character to look for
	 * @return int Dense index of the given character. -1 if the character is not part of the alphabet
	 */
	public int getIndex(char c) {
		if(c==terminator) return TERMINATOR_INDEX;
		int idx = Arrays.binarySearch(symbols, c);
		if(idx<0) return -1;
		return idx+1;
	}

	public char getSymbol(int index) {
		if(index==TERMINATOR_INDEX) return terminator;
		return symbols[index-1];
	}

	/**
	 * @return String Text symbols in ascending order, without the terminator
	 */
	public String getSymbolsString() {
		return new String(symbols);
	}

	/**
	 * Translates the given text into dense indexes and appends the terminator
	 * @param text to encode. Every character must belong to this alphabet
	 * @return int [] Array of length text.length()+1 whose last entry is TERMINATOR_INDEX
	 */
	public int [] encode(CharSequence text) {
		int n = text.length();
		int [] codes = new int[n+1];
		for(int i=0;i<n;i++) {
			char c = text.charAt(i);
			int idx = getIndex(c);
			if(idx<=TERMINATOR_INDEX) throw new IllegalArgumentException("Character "+c+" at position "+i+" can not be encoded with alphabet "+getSymbolsString());
			codes[i] = idx;
		}
		codes[n] = TERMINATOR_INDEX;
		return codes;
	}

	@Override
	public String toString() {
		return terminator+getSymbolsString();
	}
}
