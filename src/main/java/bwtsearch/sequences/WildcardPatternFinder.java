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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.logging.Logger;

import bwtsearch.main.CommandsDescriptor;
import bwtsearch.main.OptionValuesDecoder;
import bwtsearch.sequences.io.TextSequenceLoader;

/**
 * Finds the start positions of a pattern with wildcards within a text
 */
public class WildcardPatternFinder {

	// Constants for default values
	public static final MatchingAlgorithm DEF_ALGORITHM = MatchingAlgorithm.BWT;
	public static final char DEF_WILDCARD = BWTWildcardIndex.DEF_WILDCARD;
	public static final char DEF_TERMINATOR = BWTWildcardIndex.DEF_TERMINATOR;
	public static final SuffixArrayAlgorithm DEF_SUFFIX_ARRAY_ALGORITHM = BWTWildcardIndex.DEF_SUFFIX_ARRAY_ALGORITHM;

	// Logging
	private Logger log = Logger.getLogger(WildcardPatternFinder.class.getName());

	// Parameters
	private String textFile = null;
	private String indexFile = null;
	private String patternFile = null;
	private String outputFile = null;
	private char wildcard = DEF_WILDCARD;
	private char terminator = DEF_TERMINATOR;
	private MatchingAlgorithm algorithm = DEF_ALGORITHM;
	private SuffixArrayAlgorithm suffixArrayAlgorithm = DEF_SUFFIX_ARRAY_ALGORITHM;
	private boolean breadthFirst = false;

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	public String getTextFile() {
		return textFile;
	}
	public void setTextFile(String textFile) {
		this.textFile = textFile;
	}

	public String getIndexFile() {
		return indexFile;
	}
	public void setIndexFile(String indexFile) {
		this.indexFile = indexFile;
	}

	public String getPatternFile() {
		return patternFile;
	}
	public void setPatternFile(String patternFile) {
		this.patternFile = patternFile;
	}

	public String getOutputFile() {
		return outputFile;
	}
	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

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

	public MatchingAlgorithm getAlgorithm() {
		return algorithm;
	}
	public void setAlgorithm(MatchingAlgorithm algorithm) {
		this.algorithm = algorithm;
	}

	public SuffixArrayAlgorithm getSuffixArrayAlgorithm() {
		return suffixArrayAlgorithm;
	}
	public void setSuffixArrayAlgorithm(SuffixArrayAlgorithm suffixArrayAlgorithm) {
		this.suffixArrayAlgorithm = suffixArrayAlgorithm;
	}

	public boolean isBreadthFirst() {
		return breadthFirst;
	}
	public void setBreadthFirst(boolean breadthFirst) {
		this.breadthFirst = breadthFirst;
	}

	public static void main(String[] args) throws Exception {
		WildcardPatternFinder instance = new WildcardPatternFinder();
		if(!CommandsDescriptor.getInstance().configure(instance, args)) return;
		instance.run();
	}

	public void run() throws IOException {
		logParameters();
		if(patternFile==null) throw new IOException("A file with the pattern to search is required");
		if(textFile==null && indexFile==null) throw new IOException("Either a text file or a saved index is required");
		if(wildcard==terminator) throw new IllegalArgumentException("The wildcard and the terminator must be different characters");
		TextSequenceLoader loader = new TextSequenceLoader();
		loader.setLog(log);
		String pattern = loader.loadPlainText(patternFile);
		log.info("Loaded pattern with "+pattern.length()+" characters from: "+patternFile);
		List<Integer> matches = findMatches(pattern);
		String destination = outputFile!=null?outputFile:"standard output";
		if(outputFile!=null) {
			try (PrintStream out = new PrintStream(outputFile)) {
				printMatches(matches, out);
			}
		} else {
			printMatches(matches, System.out);
			System.out.flush();
		}
		log.info("Found "+matches.size()+" matches. Results written to "+destination);
	}

	private void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		if(indexFile!=null) out.println("Index file: "+indexFile);
		else out.println("Text file: "+textFile);
		out.println("Pattern file: "+patternFile);
		if(outputFile!=null) out.println("Output file: "+outputFile);
		else out.println("Output written to standard output");
		out.println("Matching algorithm: "+algorithm);
		if(indexFile==null) {
			out.println("Wildcard: "+wildcard);
			out.println("Terminator: "+terminator);
			out.println("Suffix array algorithm: "+suffixArrayAlgorithm);
		}
		if(breadthFirst) out.println("Wildcard branches traversed breadth first");
		log.info(os.toString());
	}

	/**
	 * Finds the matches of the given pattern in the text or index configured in this finder
	 * @param pattern to search. Wildcards match any symbol of the text
	 * @return List<Integer> Sorted 0-based start positions of the matches
	 * @throws IOException If the text or the index can not be loaded
	 */
	public List<Integer> findMatches(String pattern) throws IOException {
		if(indexFile!=null) {
			BWTWildcardIndex index = OptionValuesDecoder.loadIndex(indexFile, log);
			if(index.getWildcard()!=wildcard) log.warning("Using wildcard '"+index.getWildcard()+"' stored in the index instead of '"+wildcard+"'");
			if(algorithm == MatchingAlgorithm.NAIVE) {
				return new NaiveWildcardPatternMatcher(index.getWildcard()).findMatches(index.getText(), pattern);
			}
			return index.search(pattern, getTraversal());
		}
		String text = OptionValuesDecoder.loadText(textFile, log);
		return createMatcher().findMatches(text, pattern);
	}

	private SearchTraversal getTraversal() {
		return breadthFirst?SearchTraversal.BREADTH_FIRST:SearchTraversal.DEPTH_FIRST;
	}

	/**
	 * Creates the matcher for the selected algorithm
	 * @return WildcardPatternMatcher configured with the parameters of this finder
	 */
	public WildcardPatternMatcher createMatcher() {
		if(algorithm == MatchingAlgorithm.NAIVE) return new NaiveWildcardPatternMatcher(wildcard);
		BWTWildcardPatternMatcher matcher = new BWTWildcardPatternMatcher();
		matcher.setWildcard(wildcard);
		matcher.setTerminator(terminator);
		matcher.setSuffixArrayAlgorithm(suffixArrayAlgorithm);
		matcher.setTraversal(getTraversal());
		return matcher;
	}

	/**
	 * Prints one 1-based start position per line
	 * @param matches 0-based positions
	 * @param out Stream to print
	 */
	public void printMatches(List<Integer> matches, PrintStream out) {
		for(int start:matches) {
			out.println(start+1);
		}
	}
}
