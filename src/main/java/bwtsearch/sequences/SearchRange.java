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
 * Inclusive range of rows of the BW matrix sharing the pattern suffix matched so far,
 * together with the position of the next pattern character to consume
 */
public class SearchRange {
	private final int firstRow;
	private final int lastRow;
	private final int patternIndex;

	public SearchRange(int firstRow, int lastRow, int patternIndex) {
		this.firstRow = firstRow;
		this.lastRow = lastRow;
		this.patternIndex = patternIndex;
	}

	public int getFirstRow() {
		return firstRow;
	}

	public int getLastRow() {
		return lastRow;
	}

	/**
	 * @return int Position of the next pattern character to consume. -1 if the whole pattern was matched
	 */
	public int getPatternIndex() {
		return patternIndex;
	}

	public boolean isEmpty() {
		return firstRow>lastRow;
	}

	/**
	 * @return boolean true if every character of the pattern has been consumed
	 */
	public boolean isTerminal() {
		return patternIndex<0;
	}

	public int size() {
		if(isEmpty()) return 0;
		return lastRow-firstRow+1;
	}

	@Override
	public String toString() {
		return "["+firstRow+"-"+lastRow+"] next: "+patternIndex;
	}
}
