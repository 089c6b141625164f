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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Backward search of patterns with wildcards over rank and first occurrence tables.
 * The pattern is consumed from right to left. A regular character narrows the current range
 * through the LF mapping. A wildcard splits the range into one branch per symbol of the
 * alphabet, excluding the terminator
 */
public class WildcardBackwardSearch {

	private final SymbolAlphabet alphabet;
	private final OccurrenceTables tables;
	private final char wildcard;

	public WildcardBackwardSearch(SymbolAlphabet alphabet, OccurrenceTables tables, char wildcard) {
		if(alphabet.size()!=tables.getAlphabetSize()) throw new IllegalArgumentException("Alphabet with "+alphabet.size()+" symbols does not match tables with "+tables.getAlphabetSize()+" symbols");
		if(wildcard==alphabet.getTerminator()) throw new IllegalArgumentException("The wildcard can not be equal to the terminator symbol "+wildcard);
		this.alphabet = alphabet;
		this.tables = tables;
		this.wildcard = wildcard;
	}

	public char getWildcard() {
		return wildcard;
	}

	/**
	 * Looks for the ranges of rows having matches to the given pattern
	 * @param pattern to search. The wildcard matches any symbol of the text
	 * @param traversal Order to explore pending ranges
	 * @return List<SearchRange> Disjoint non empty terminal ranges. Empty if the pattern is empty or has no matches
	 */
	public List<SearchRange> search(CharSequence pattern, SearchTraversal traversal) {
		List<SearchRange> answer = new ArrayList<>();
		int m = pattern.length();
		if(m==0) return answer;
		Deque<SearchRange> worklist = new ArrayDeque<>();
		traversal.add(worklist, new SearchRange(0, tables.getBWTLength()-1, m-1));
		while(!worklist.isEmpty()) {
			SearchRange range = traversal.next(worklist);
			if(range.isTerminal()) {
				answer.add(range);
				continue;
			}
			char c = pattern.charAt(range.getPatternIndex());
			if(c==wildcard) {
				for(int k=SymbolAlphabet.TERMINATOR_INDEX+1;k<alphabet.size();k++) {
					SearchRange next = extend(range, k);
					if(!next.isEmpty()) traversal.add(worklist, next);
				}
			} else {
				int k = alphabet.getIndex(c);
				//Characters outside the alphabet and the terminator itself can not match
				if(k<=SymbolAlphabet.TERMINATOR_INDEX) continue;
				SearchRange next = extend(range, k);
				if(!next.isEmpty()) traversal.add(worklist, next);
			}
		}
		return answer;
	}

	/**
	 * Calculates the range of rows whose rotations start with the given symbol followed by
	 * the rotations of the given range
	 * @param range Current range
	 * @param symbolIndex Dense index of the symbol to prepend
	 * @return SearchRange New range for the previous pattern position. It can be empty
	 */
	public SearchRange extend(SearchRange range, int symbolIndex) {
		int newFirst = tables.lfMapping(symbolIndex, range.getFirstRow());
		int newLast = tables.lfMapping(symbolIndex, range.getLastRow()+1) - 1;
		return new SearchRange(newFirst, newLast, range.getPatternIndex()-1);
	}
}
