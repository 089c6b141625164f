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

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import htsjdk.samtools.util.IOUtil;

/**
 * Index based on the Burrows Wheeler transform to find the occurrences of patterns with
 * wildcards in a single text. Instances are immutable and can be queried concurrently
 */
public class BWTWildcardIndex {

	private static final Logger log = Logger.getLogger(BWTWildcardIndex.class.getName());

	public static final char DEF_WILDCARD = '#';
	public static final char DEF_TERMINATOR = '$';
	public static final SuffixArrayAlgorithm DEF_SUFFIX_ARRAY_ALGORITHM = SuffixArrayAlgorithm.INDUCED_SORTING;
	public static final SearchTraversal DEF_TRAVERSAL = SearchTraversal.DEPTH_FIRST;

	//Number of values per line in index files
	private static final int VALUES_PER_LINE = 10000;

	private final BurrowsWheelerTransform bwt;
	private final OccurrenceTables tables;
	private final WildcardBackwardSearch searchEngine;

	private BWTWildcardIndex(BurrowsWheelerTransform bwt, char wildcard) {
		this.bwt = bwt;
		this.tables = new OccurrenceTables(bwt);
		validate();
		this.searchEngine = new WildcardBackwardSearch(bwt.getAlphabet(), tables, wildcard);
	}

	/**
	 * Builds an index with the default wildcard and terminator
	 * @param text to index
	 * @return BWTWildcardIndex index of the given text
	 * @throws IllegalArgumentException If the text is empty or contains the terminator
	 */
	public static BWTWildcardIndex buildIndex(CharSequence text) {
		return buildIndex(text, DEF_WILDCARD, DEF_TERMINATOR);
	}

	public static BWTWildcardIndex buildIndex(CharSequence text, char wildcard, char terminator) {
		return buildIndex(text, wildcard, terminator, DEF_SUFFIX_ARRAY_ALGORITHM);
	}

	/**
	 * Builds an index of the given text
	 * @param text to index
	 * @param wildcard Pattern character matching any symbol of the text
	 * @param terminator Character appended to the text. It must not appear in the text
	 * @param algorithm Strategy to build the suffix array
	 * @return BWTWildcardIndex index of the given text
	 * @throws IllegalArgumentException If the text is empty, contains the terminator or the terminator is equal to the wildcard
	 */
	public static BWTWildcardIndex buildIndex(CharSequence text, char wildcard, char terminator, SuffixArrayAlgorithm algorithm) {
		if(text==null || text.length()==0) throw new IllegalArgumentException("Can not build an index for an empty text");
		if(wildcard==terminator) throw new IllegalArgumentException("The wildcard can not be equal to the terminator symbol "+terminator);
		long time = System.currentTimeMillis();
		SymbolAlphabet alphabet = SymbolAlphabet.fromText(text, terminator);
		SuffixArrayGenerator generator = algorithm.createGenerator(text, alphabet);
		BurrowsWheelerTransform bwt = new BurrowsWheelerTransform(text, alphabet, generator);
		BWTWildcardIndex index = new BWTWildcardIndex(bwt, wildcard);
		log.fine("Built index for text of length "+text.length()+" with "+alphabet.size()+" symbols in "+(System.currentTimeMillis()-time)+" milliseconds");
		return index;
	}

	public BurrowsWheelerTransform getTransform() {
		return bwt;
	}

	/**
	 * @return String The Burrows Wheeler transform of the text, including the terminator
	 */
	public String getBWT() {
		return bwt.getBWT();
	}

	public int [] getSuffixArray() {
		return bwt.getSuffixArray();
	}

	public OccurrenceTables getOccurrenceTables() {
		return tables;
	}

	public SymbolAlphabet getAlphabet() {
		return bwt.getAlphabet();
	}

	/**
	 * @return int Length of the indexed text without the terminator
	 */
	public int getTextLength() {
		return bwt.getTextLength();
	}

	public char getWildcard() {
		return searchEngine.getWildcard();
	}

	public char getTerminator() {
		return bwt.getAlphabet().getTerminator();
	}

	/**
	 * @return String The indexed text, rebuilt from the transform
	 */
	public String getText() {
		return bwt.inverse(tables);
	}

	/**
	 * Searches the given pattern in the given index
	 * @param index to query
	 * @param pattern Pattern to search. It can contain wildcards
	 * @return List<Integer> Sorted unique 0-based start positions of the matches
	 * @throws IllegalArgumentException If the index is null
	 */
	public static List<Integer> search(BWTWildcardIndex index, CharSequence pattern) {
		if(index==null) throw new IllegalArgumentException("A valid index is required to search patterns");
		return index.search(pattern);
	}

	public List<Integer> search(CharSequence pattern) {
		return search(pattern, DEF_TRAVERSAL);
	}

	/**
	 * Searches the given pattern in this index
	 * @param pattern Pattern to search. It can contain wildcards
	 * @param traversal Order to explore the branches created by wildcards
	 * @return List<Integer> Sorted unique 0-based start positions of the matches.
	 * Empty if the pattern is empty or longer than the text
	 */
	public List<Integer> search(CharSequence pattern, SearchTraversal traversal) {
		int m = (pattern==null)?0:pattern.length();
		if(m==0 || m>getTextLength()) return Collections.emptyList();
		List<SearchRange> ranges = searchEngine.search(pattern, traversal);
		return MatchCollector.collect(ranges, bwt, m);
	}

	/**
	 * Checks the consistency between the transform, the suffix array and the tables
	 * @throws IllegalArgumentException If some of the index structures is malformed
	 */
	private void validate() {
		int [] sa = bwt.getSuffixArray();
		int length = bwt.length();
		int n = length-1;
		if(n<=0) throw new IllegalArgumentException("Invalid index. The indexed text is empty");
		if(sa.length!=length) throw new IllegalArgumentException("Invalid index. Suffix array has length "+sa.length+" but the transform has length "+length);
		if(tables.getBWTLength()!=length) throw new IllegalArgumentException("Invalid index. Tables built for length "+tables.getBWTLength()+" but the transform has length "+length);
		if(sa[0]!=n) throw new IllegalArgumentException("Invalid index. Suffix array should have "+n+" as first entry");
		boolean [] seen = new boolean[length];
		for(int i=0;i<length;i++) {
			int v = sa[i];
			if(v<0 || v>n) throw new IllegalArgumentException("Invalid index. Suffix array value "+v+" at row "+i+" out of range");
			if(seen[v]) throw new IllegalArgumentException("Invalid index. Suffix array value "+v+" is repeated");
			seen[v] = true;
		}
		if(tables.getCount(SymbolAlphabet.TERMINATOR_INDEX)!=1) throw new IllegalArgumentException("Invalid index. The terminator appears "+tables.getCount(SymbolAlphabet.TERMINATOR_INDEX)+" times in the transform");
		for(int k=SymbolAlphabet.TERMINATOR_INDEX+1;k<tables.getAlphabetSize();k++) {
			if(tables.getCount(k)==0) throw new IllegalArgumentException("Invalid index. Symbol "+bwt.getAlphabet().getSymbol(k)+" does not appear in the transform");
		}
		int row = bwt.getRowTerminator();
		if(sa[row]!=0) throw new IllegalArgumentException("Invalid index. Row "+row+" of the terminator has suffix array value "+sa[row]);
		for(int i=0;i<length;i++) {
			if(sa[i]==0) continue;
			int next = tables.lfMapping(bwt.getSymbolIndex(i), i);
			if(sa[next]!=sa[i]-1) throw new IllegalArgumentException("Invalid index. LF mapping of row "+i+" leads to suffix "+sa[next]+" instead of "+(sa[i]-1));
		}
	}

	/**
	 * Saves this index in a gzip compressed text file
	 * @param filename Path of the file to write
	 * @throws IOException If the file can not be written
	 */
	public void save (String filename) throws IOException {
		try(OutputStream os = new GZIPOutputStream(new FileOutputStream(filename))) {
			save(os);
		} catch (IOException e) {
			throw new IOException("Can not write index to "+filename, e);
		}
	}

	/**
	 * Writes this index in the text format read by load
	 * @param os Stream to write. It is flushed but not closed
	 * @throws IOException If some write to the stream fails
	 */
	public void save (OutputStream os) throws IOException {
		PrintStream out = new PrintStream(os);
		save(out);
		out.flush();
		if(out.checkError()) throw new IOException("Write error while saving index");
	}

	/**
	 * Writes this index in the text format read by load. Write errors are reported through out.checkError()
	 * @param out Stream to write
	 */
	public void save (PrintStream out) {
		SymbolAlphabet alphabet = bwt.getAlphabet();
		out.println("#BWTINDEX\t"+(int)alphabet.getTerminator()+"\t"+(int)getWildcard()+"\t"+bwt.length());
		StringBuilder alphabetLine = new StringBuilder("#ALPHABET");
		for(int k=SymbolAlphabet.TERMINATOR_INDEX+1;k<alphabet.size();k++) alphabetLine.append("\t"+(int)alphabet.getSymbol(k));
		out.println(alphabetLine.toString());
		out.println("#BWT");
		saveValues(bwt.getSymbolIndexes(), out);
		out.println("#SUFFIXARRAY");
		saveValues(bwt.getSuffixArray(), out);
		out.println("#END");
	}

	private static void saveValues(int [] values, PrintStream out) {
		StringBuilder buffer = new StringBuilder();
		for(int i=0;i<values.length;i++) {
			if(buffer.length()>0) buffer.append("\t");
			buffer.append(values[i]);
			if((i+1)%VALUES_PER_LINE==0 || i==values.length-1) {
				out.println(buffer.toString());
				buffer = new StringBuilder();
			}
		}
	}

	/**
	 * Loads an index saved with the save method
	 * @param filename Path of the index file. It can be gzip compressed
	 * @return BWTWildcardIndex Loaded index
	 * @throws IOException If the file can not be read or it is not a valid index file
	 * @throws IllegalArgumentException If the loaded structures are inconsistent
	 */
	public static BWTWildcardIndex load (String filename) throws IOException {
		try (InputStream is = openIndexStream(filename);
			 InputStreamReader isr = new InputStreamReader(is);
			 BufferedReader reader = new BufferedReader(isr)) {
			return load(reader);
		}
	}

	private static InputStream openIndexStream(String filename) throws IOException {
		BufferedInputStream in = new BufferedInputStream(new FileInputStream(filename));
		try {
			if(IOUtil.isGZIPInputStream(in)) return new GZIPInputStream(in);
		} catch (IOException | RuntimeException e) {
			in.close();
			throw e;
		}
		return in;
	}

	public static BWTWildcardIndex load (BufferedReader reader) throws IOException {
		String line = reader.readLine();
		if(line==null) throw new IOException("Empty index file");
		if(!line.startsWith("#BWTINDEX")) throw new IOException("#BWTINDEX header not found. Line: "+line);
		String [] items = line.split("\t");
		if(items.length!=4) throw new IOException("Malformed index header. Line: "+line);
		char terminator = parseCharacter(items[1], line);
		char wildcard = parseCharacter(items[2], line);
		int bwtLength = parseInt(items[3], line);
		if(bwtLength<=1) throw new IOException("Invalid transform length "+bwtLength+". Line: "+line);

		line = reader.readLine();
		if(line==null || !line.startsWith("#ALPHABET")) throw new IOException("#ALPHABET section not found. Line: "+line);
		items = line.split("\t");
		char [] symbols = new char[items.length-1];
		for(int i=1;i<items.length;i++) symbols[i-1] = parseCharacter(items[i], line);
		SymbolAlphabet alphabet = new SymbolAlphabet(terminator, symbols);

		line = reader.readLine();
		if(line==null || !line.equals("#BWT")) throw new IOException("#BWT section not found. Line: "+line);
		int [] bwtValues = new int[bwtLength];
		line = loadValues(reader, bwtValues, "#SUFFIXARRAY");
		int [] sa = new int[bwtLength];
		line = loadValues(reader, sa, "#END");
		BurrowsWheelerTransform bwt = new BurrowsWheelerTransform(alphabet, bwtValues, sa);
		return new BWTWildcardIndex(bwt, wildcard);
	}

	private static String loadValues(BufferedReader reader, int [] values, String nextSection) throws IOException {
		int i=0;
		String line = reader.readLine();
		while (line!=null && !line.equals(nextSection)) {
			for(String item:line.split("\t")) {
				if(i>=values.length) throw new IOException("More values than expected length "+values.length+" before section "+nextSection);
				values[i] = parseInt(item, line);
				i++;
			}
			line = reader.readLine();
		}
		if(line == null) throw new IOException("Unexpected end of file looking for "+nextSection);
		if(i!=values.length) throw new IOException("Expected "+values.length+" values before section "+nextSection+" but found "+i);
		return line;
	}

	private static int parseInt(String value, String line) throws IOException {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IOException("Can not parse number "+value+" in line: "+line, e);
		}
	}

	private static char parseCharacter(String value, String line) throws IOException {
		int code = parseInt(value, line);
		if(code<Character.MIN_VALUE || code>Character.MAX_VALUE) throw new IOException("Invalid character code "+code+" in line: "+line);
		return (char)code;
	}

}
