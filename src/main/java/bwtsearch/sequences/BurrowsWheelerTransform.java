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

/**
 * Burrows Wheeler transform of a text extended with a terminator, together with the
 * complete suffix array used to calculate it
 */
public class BurrowsWheelerTransform {

	private final SymbolAlphabet alphabet;
	// Dense alphabet index of the last character of each row of the BW matrix
	private final int [] bwt;
	// Start position in the extended text of each row of the BW matrix
	private final int [] suffixArray;
	private final int rowTerminator;

	/**
	 * Calculates the transform of the given text
	 * @param sequence Text to transform. It must not contain the terminator of the alphabet
	 * @param alphabet Alphabet of the text
	 * @param suffixArrayGenerator Generator of the suffix array of the given text
	 */
	public BurrowsWheelerTransform(CharSequence sequence, SymbolAlphabet alphabet, SuffixArrayGenerator suffixArrayGenerator) {
		this.alphabet = alphabet;
		int [] sa = suffixArrayGenerator.getSuffixArray();
		int n = sequence.length();
		if(sa.length!=n+1) throw new IllegalArgumentException("Suffix array has length "+sa.length+" but the extended text has length "+(n+1));
		if(sa[0]!=n) throw new IllegalArgumentException("Suffix array should have "+n+" as first entry");
		bwt = new int[n+1];
		int row = -1;
		for (int j=0;j<sa.length;j++) {
			int i = sa[j];
			if (i > 0) {
				bwt[j] = alphabet.getIndex(sequence.charAt(i - 1));
				if(bwt[j]<=SymbolAlphabet.TERMINATOR_INDEX) throw new IllegalArgumentException("Character "+sequence.charAt(i-1)+" at position "+(i-1)+" does not belong to the alphabet "+alphabet.getSymbolsString());
			} else {
				bwt[j] = SymbolAlphabet.TERMINATOR_INDEX;
				row = j;
			}
		}
		this.suffixArray = sa;
		this.rowTerminator = row;
	}

	/**
	 * Rebuilds a transform from previously calculated arrays. Consistency is not verified here
	 * @param alphabet of the transformed text
	 * @param bwt Dense alphabet indexes of the transform
	 * @param suffixArray of the extended text
	 */
	public BurrowsWheelerTransform(SymbolAlphabet alphabet, int [] bwt, int [] suffixArray) {
		this.alphabet = alphabet;
		this.bwt = bwt.clone();
		this.suffixArray = suffixArray.clone();
		int row = -1;
		for(int i=0;i<bwt.length;i++) {
			if(bwt[i]==SymbolAlphabet.TERMINATOR_INDEX) {
				row = i;
				break;
			}
		}
		this.rowTerminator = row;
	}

	public SymbolAlphabet getAlphabet() {
		return alphabet;
	}

	/**
	 * @return int Length of the extended text, which is also the number of rows of the BW matrix
	 */
	public int length() {
		return bwt.length;
	}

	/**
	 * @return int Length of the text without the terminator
	 */
	public int getTextLength() {
		return bwt.length-1;
	}

	/**
	 * @return int Row of the BW matrix whose last character is the terminator
	 */
	public int getRowTerminator() {
		return rowTerminator;
	}

	public int getSymbolIndex(int row) {
		return bwt[row];
	}

	public int getSuffixArrayValue(int row) {
		return suffixArray[row];
	}

	public int [] getSymbolIndexes() {
		return bwt.clone();
	}

	public int [] getSuffixArray() {
		return suffixArray.clone();
	}

	/**
	 * @return String The transform using the characters of the alphabet, including the terminator
	 */
	public String getBWT() {
		StringBuilder answer = new StringBuilder(bwt.length);
		for(int i=0;i<bwt.length;i++) answer.append(alphabet.getSymbol(bwt[i]));
		return answer.toString();
	}

	/**
	 * Rebuilds the original text walking the LF mapping from the row of the terminator
	 * @param tables Occurrence tables calculated from this transform
	 * @return String The text without the terminator
	 */
	public String inverse(OccurrenceTables tables) {
		int n = getTextLength();
		char [] text = new char[n];
		int row = 0;
		for(int i=n-1;i>=0;i--) {
			int c = bwt[row];
			text[i] = alphabet.getSymbol(c);
			row = tables.lfMapping(c, row);
		}
		return new String(text);
	}
}
