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
 * Rank and first occurrence tables derived from a Burrows Wheeler transform.
 * Tables are indexed by dense alphabet index
 */
public class OccurrenceTables {

	// Ranks in the bwt for each character in the alphabet for every row of the BW matrix.
	// ranks[c][i] is the number of times c appears in bwt[0..i-1]
	private final int[][] ranks;

	// For each character tells the number of times it appears
	private final int [] characterCounts;

	// For each character tells the first time it appears in the left column of the BW matrix
	private final int [] firstRowsInMatrix;

	public OccurrenceTables(BurrowsWheelerTransform bwt) {
		this(bwt.getSymbolIndexes(), bwt.getAlphabet().size());
	}

	/**
	 * Builds the tables for the given transform
	 * @param bwt Dense alphabet indexes of the transform
	 * @param alphabetSize Number of symbols including the terminator
	 */
	public OccurrenceTables(int [] bwt, int alphabetSize) {
		int n = bwt.length;
		ranks = new int[alphabetSize][n+1];
		for (int i = 0; i < n; i++) {
			int c = bwt[i];
			if(c<0 || c>=alphabetSize) throw new IllegalArgumentException("Invalid symbol index "+c+" at row "+i+" of the BWT. Alphabet size: "+alphabetSize);
			for(int k=0;k<alphabetSize;k++) {
				ranks[k][i+1] = ranks[k][i];
			}
			ranks[c][i+1]++;
		}
		characterCounts = new int[alphabetSize];
		firstRowsInMatrix = new int[alphabetSize];
		int totalChars = 0;
		for(int k=0;k<alphabetSize;k++) {
			characterCounts[k] = ranks[k][n];
			firstRowsInMatrix[k] = totalChars;
			totalChars += characterCounts[k];
		}
	}

	public int getAlphabetSize() {
		return characterCounts.length;
	}

	/**
	 * @return int Length of the transform used to build these tables
	 */
	public int getBWTLength() {
		return ranks[0].length-1;
	}

	/**
	 * @param symbolIndex Dense index of the symbol to count
	 * @param row of the BW matrix in [0,getBWTLength()]
	 * @return int Number of times the symbol appears in the transform before the given row
	 */
	public int getRank(int symbolIndex, int row) {
		return ranks[symbolIndex][row];
	}

	/**
	 * @param symbolIndex Dense index of the symbol
	 * @return int [] Copy of the complete rank array of the given symbol
	 */
	public int [] getRankTable(int symbolIndex) {
		return ranks[symbolIndex].clone();
	}

	public int getCount(int symbolIndex) {
		return characterCounts[symbolIndex];
	}

	public int getFirstOccurrence(int symbolIndex) {
		return firstRowsInMatrix[symbolIndex];
	}

	/**
	 * LF mapping. Row of the BW matrix whose rotation starts with the given symbol followed
	 * by the rotation at the given row
	 * @param symbolIndex Dense index of the symbol to prepend
	 * @param row of the BW matrix. Can be getBWTLength() to map the end of a range
	 * @return int First occurrence of the symbol plus its rank at the given row
	 */
	public int lfMapping(int symbolIndex, int row) {
		return firstRowsInMatrix[symbolIndex] + ranks[symbolIndex][row];
	}
}
