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

import java.util.List;

public interface WildcardPatternMatcher {
	/**
	 * Finds the occurrences of a pattern in a text. The wildcard of the matcher matches any character
	 * @param text to search in
	 * @param pattern to search
	 * @return List<Integer> Sorted unique 0-based start positions. Empty if the text or the pattern
	 * are empty or if the pattern is longer than the text
	 */
	public List<Integer> findMatches(CharSequence text, CharSequence pattern);
}
