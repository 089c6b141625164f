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

/**
 * Linear time suffix array construction by induced sorting (SA-IS, Nong, Zhang and Chan 2009).
 * Works on dense symbol codes whose last entry is a unique terminator with code 0
 */
public class InducedSortingSuffixArrayGenerator implements SuffixArrayGenerator {

	/** the suffix array */
	private final int [] suffixArray;

	/**
	 * Builds the suffix array of the given text
	 * @param text to process
	 * @param alphabet Alphabet used to encode the text. The terminator is appended
	 */
	public InducedSortingSuffixArrayGenerator(CharSequence text, SymbolAlphabet alphabet) {
		this(alphabet.encode(text), alphabet.size());
	}

	/**
	 * Builds the suffix array of an encoded text
	 * @param codes Symbol codes in [0,alphabetSize). The last code must be 0 and 0 can not appear elsewhere
	 * @param alphabetSize Number of distinct codes, including the terminator
	 */
	public InducedSortingSuffixArrayGenerator(int [] codes, int alphabetSize) {
		if(codes.length==0 || codes[codes.length-1]!=0) throw new IllegalArgumentException("Encoded text must end with the terminator code 0");
		for(int i=0;i<codes.length-1;i++) {
			if(codes[i]<=0 || codes[i]>=alphabetSize) throw new IllegalArgumentException("Invalid code "+codes[i]+" at position "+i+" for alphabet size "+alphabetSize);
		}
		suffixArray = buildSuffixArray(codes, alphabetSize);
	}

	@Override
	public int[] getSuffixArray() {
		return suffixArray.clone();
	}

	private static int [] buildSuffixArray(int [] s, int alphabetSize) {
		int n = s.length;
		int [] sa = new int[n];
		if(n==1) return sa;

		//S-type suffixes are smaller than the suffix starting one position later
		boolean [] sType = new boolean[n];
		sType[n-1] = true;
		for(int i=n-2;i>=0;i--) {
			sType[i] = s[i]<s[i+1] || (s[i]==s[i+1] && sType[i+1]);
		}
		int [] bucketSizes = new int[alphabetSize];
		for(int c:s) bucketSizes[c]++;

		//Approximate order of LMS suffixes, placed in text order at the end of their buckets
		Arrays.fill(sa, -1);
		int [] ends = calculateBucketEnds(bucketSizes);
		int lmsCount = 0;
		for(int i=1;i<n;i++) {
			if(isLMS(sType, i)) {
				sa[--ends[s[i]]] = i;
				lmsCount++;
			}
		}
		induceL(s, sa, sType, bucketSizes);
		induceS(s, sa, sType, bucketSizes);

		//Name LMS substrings in their sorted order
		int [] sortedLMS = new int[lmsCount];
		int j=0;
		for(int i=0;i<n;i++) {
			if(isLMS(sType, sa[i])) sortedLMS[j++] = sa[i];
		}
		int [] names = new int[n];
		Arrays.fill(names, -1);
		int name = 0;
		names[sortedLMS[0]] = name;
		for(int i=1;i<lmsCount;i++) {
			if(!equalLMSSubstrings(s, sType, sortedLMS[i-1], sortedLMS[i])) name++;
			names[sortedLMS[i]] = name;
		}

		//Reduced text keeps LMS substrings in text order. The terminator keeps the unique name 0
		int [] lmsPositions = new int[lmsCount];
		int [] reduced = new int[lmsCount];
		j=0;
		for(int i=1;i<n;i++) {
			if(isLMS(sType, i)) {
				lmsPositions[j] = i;
				reduced[j] = names[i];
				j++;
			}
		}
		int [] reducedSA;
		if(name+1==lmsCount) {
			reducedSA = new int[lmsCount];
			for(int i=0;i<lmsCount;i++) reducedSA[reduced[i]] = i;
		} else {
			reducedSA = buildSuffixArray(reduced, name+1);
		}

		//Exact order of LMS suffixes induces the order of every other suffix
		Arrays.fill(sa, -1);
		ends = calculateBucketEnds(bucketSizes);
		for(int i=lmsCount-1;i>=0;i--) {
			int pos = lmsPositions[reducedSA[i]];
			sa[--ends[s[pos]]] = pos;
		}
		induceL(s, sa, sType, bucketSizes);
		induceS(s, sa, sType, bucketSizes);
		return sa;
	}

	private static boolean isLMS(boolean [] sType, int pos) {
		return pos>0 && sType[pos] && !sType[pos-1];
	}

	private static boolean equalLMSSubstrings(int [] s, boolean [] sType, int a, int b) {
		int n = s.length;
		if(a==n-1 || b==n-1) return a==b;
		for(int k=0;;k++) {
			int i = a+k;
			int j = b+k;
			if(s[i]!=s[j] || sType[i]!=sType[j]) return false;
			if(k>0) {
				boolean endA = isLMS(sType, i);
				boolean endB = isLMS(sType, j);
				if(endA && endB) return true;
				if(endA!=endB) return false;
			}
		}
	}

	private static void induceL(int [] s, int [] sa, boolean [] sType, int [] bucketSizes) {
		int [] heads = calculateBucketHeads(bucketSizes);
		for(int i=0;i<sa.length;i++) {
			if(sa[i]<=0) continue;
			int j = sa[i]-1;
			if(!sType[j]) sa[heads[s[j]]++] = j;
		}
	}

	private static void induceS(int [] s, int [] sa, boolean [] sType, int [] bucketSizes) {
		int [] ends = calculateBucketEnds(bucketSizes);
		for(int i=sa.length-1;i>=0;i--) {
			if(sa[i]<=0) continue;
			int j = sa[i]-1;
			if(sType[j]) sa[--ends[s[j]]] = j;
		}
	}

	private static int [] calculateBucketHeads(int [] bucketSizes) {
		int [] heads = new int[bucketSizes.length];
		int sum = 0;
		for(int c=0;c<bucketSizes.length;c++) {
			heads[c] = sum;
			sum+=bucketSizes[c];
		}
		return heads;
	}

	/**
	 * @return int [] Exclusive end of each bucket
	 */
	private static int [] calculateBucketEnds(int [] bucketSizes) {
		int [] ends = new int[bucketSizes.length];
		int sum = 0;
		for(int c=0;c<bucketSizes.length;c++) {
			sum+=bucketSizes[c];
			ends[c] = sum;
		}
		return ends;
	}
}
