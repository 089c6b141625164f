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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Transforms terminal search ranges into sorted start positions in the text
 */
public class MatchCollector {

	/**
	 * Provides the start positions in the text for the rows of the given ranges
	 * @param ranges Terminal ranges produced by the backward search
	 * @param bwt Transform holding the suffix array
	 * @param patternLength Length of the searched pattern
	 * @return List<Integer> Unique 0-based start positions sorted in ascending order
	 */
	public static List<Integer> collect(List<SearchRange> ranges, BurrowsWheelerTransform bwt, int patternLength) {
		int n = bwt.getTextLength();
		Set<Integer> startIndexes = new TreeSet<>();
		for(SearchRange range:ranges) {
			for(int row=range.getFirstRow();row<=range.getLastRow();row++) {
				int start = bwt.getSuffixArrayValue(row);
				//Match running over the terminator
				if(start+patternLength>n) continue;
				startIndexes.add(start);
			}
		}
		return Collections.unmodifiableList(new ArrayList<>(startIndexes));
	}
}
