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

import java.util.Collections;
import java.util.List;

/**
 * Matcher building a BWT index of the text for each call
 */
public class BWTWildcardPatternMatcher implements WildcardPatternMatcher {

	private char wildcard = BWTWildcardIndex.DEF_WILDCARD;
	private char terminator = BWTWildcardIndex.DEF_TERMINATOR;
	private SuffixArrayAlgorithm suffixArrayAlgorithm = BWTWildcardIndex.DEF_SUFFIX_ARRAY_ALGORITHM;
	private SearchTraversal traversal = BWTWildcardIndex.DEF_TRAVERSAL;

	public char getWildcard() {
		return wildcard;
	}
	public void setWildcard(char wildcard) {
		this.wildcard = wildcard;
	}
	public char getTerminator() {
		return terminator;
	}
	public void setTerminator(char terminator) {
		this.terminator = terminator;
	}
	public SuffixArrayAlgorithm getSuffixArrayAlgorithm() {
		return suffixArrayAlgorithm;
	}
	public void setSuffixArrayAlgorithm(SuffixArrayAlgorithm suffixArrayAlgorithm) {
		this.suffixArrayAlgorithm = suffixArrayAlgorithm;
	}
	public SearchTraversal getTraversal() {
		return traversal;
	}
	public void setTraversal(SearchTraversal traversal) {
		this.traversal = traversal;
	}

	@Override
	public List<Integer> findMatches(CharSequence text, CharSequence pattern) {
		if(text.length()==0 || pattern.length()==0 || pattern.length()>text.length()) return Collections.emptyList();
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex(text, wildcard, terminator, suffixArrayAlgorithm);
		return index.search(pattern, traversal);
	}
}
