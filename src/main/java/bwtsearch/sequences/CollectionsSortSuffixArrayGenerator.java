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
import java.util.Comparator;
import java.util.List;

/**
 * Builds the suffix array sorting suffix start positions with a comparator.
 * Because the terminator is unique and sorts first, ordering suffixes is equivalent to
 * ordering the full rotations of the extended text
 */
public class CollectionsSortSuffixArrayGenerator implements SuffixArrayGenerator, Comparator<Integer> {

	private final CharSequence sequence;
	private final int [] suffixArray;

	public CollectionsSortSuffixArrayGenerator(CharSequence sequence) {
		this.sequence = sequence;
		int n = sequence.length();
		List<Integer> saList = new ArrayList<Integer>(n+1);
		for(int i=0;i<=n;i++) saList.add(i);
		Collections.sort(saList,this);
		suffixArray = new int [saList.size()];
		for(int i=0;i<suffixArray.length;i++) suffixArray[i] = saList.get(i);
	}
	@Override
	public int [] getSuffixArray() {
		return suffixArray.clone();
	}
	@Override
	public int compare(Integer o1, Integer o2) {
		int i1 = o1;
		int i2 = o2;
		if(i1==i2) return 0;
		int n = sequence.length();
		while (i1<n && i2<n) {
			char c1 = sequence.charAt(i1);
			char c2 = sequence.charAt(i2);
			if(c1!=c2) return c1-c2;
			i1++;
			i2++;
		}
		//The suffix reaching the terminator first is the smallest
		if(i1==n) return -1;
		return 1;
	}

}
