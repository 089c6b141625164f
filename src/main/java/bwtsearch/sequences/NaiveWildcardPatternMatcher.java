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
import java.util.List;

/**
 * Compares the pattern against every start position of the text
 */
public class NaiveWildcardPatternMatcher implements WildcardPatternMatcher {

	private char wildcard = BWTWildcardIndex.DEF_WILDCARD;

	public NaiveWildcardPatternMatcher() {
		super();
	}

	public NaiveWildcardPatternMatcher(char wildcard) {
		super();
		this.wildcard = wildcard;
	}

	public char getWildcard() {
		return wildcard;
	}

	public void setWildcard(char wildcard) {
		this.wildcard = wildcard;
	}

	@Override
	public List<Integer> findMatches(CharSequence text, CharSequence pattern) {
		List<Integer> answer = new ArrayList<>();
		int n = text.length();
		int m = pattern.length();
		if(m==0 || m>n) return answer;
		for(int i=0;i+m<=n;i++) {
			if(matchesAt(text, pattern, i)) answer.add(i);
		}
		return answer;
	}

	private boolean matchesAt(CharSequence text, CharSequence pattern, int start) {
		for(int j=0;j<pattern.length();j++) {
			char p = pattern.charAt(j);
			if(p!=wildcard && p!=text.charAt(start+j)) return false;
		}
		return true;
	}
}
