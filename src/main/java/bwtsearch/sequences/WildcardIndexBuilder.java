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
import java.util.logging.Logger;

import bwtsearch.main.CommandsDescriptor;
import bwtsearch.main.OptionValuesDecoder;

/**
 * Builds the index of a text and saves it so that patterns can be searched without rebuilding it
 */
public class WildcardIndexBuilder {

	// Constants for default values
	public static final char DEF_WILDCARD = BWTWildcardIndex.DEF_WILDCARD;
	public static final char DEF_TERMINATOR = BWTWildcardIndex.DEF_TERMINATOR;
	public static final SuffixArrayAlgorithm DEF_SUFFIX_ARRAY_ALGORITHM = BWTWildcardIndex.DEF_SUFFIX_ARRAY_ALGORITHM;

	// Logging
	private Logger log = Logger.getLogger(WildcardIndexBuilder.class.getName());

	// Parameters
	private String inputFile = null;
	private String outputFile = null;
	private char wildcard = DEF_WILDCARD;
	private char terminator = DEF_TERMINATOR;
	private SuffixArrayAlgorithm suffixArrayAlgorithm = DEF_SUFFIX_ARRAY_ALGORITHM;

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public String getInputFile() {
		return inputFile;
	}
	public void setInputFile(String inputFile) {
		this.inputFile = inputFile;
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
	public SuffixArrayAlgorithm getSuffixArrayAlgorithm() {
		return suffixArrayAlgorithm;
	}
	public void setSuffixArrayAlgorithm(SuffixArrayAlgorithm suffixArrayAlgorithm) {
		this.suffixArrayAlgorithm = suffixArrayAlgorithm;
	}

	public static void main(String[] args) throws Exception {
		WildcardIndexBuilder instance = new WildcardIndexBuilder();
		if(!CommandsDescriptor.getInstance().configure(instance, args)) return;
		instance.run();
	}

	public void run() throws IOException {
		logParameters();
		if(inputFile==null) throw new IOException("The input file with the text to index is a required parameter");
		if(outputFile==null) throw new IOException("An output file path is required");
		BWTWildcardIndex index = buildIndex();
		index.save(outputFile);
		log.info("Index saved to: "+outputFile);
	}

	private void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		out.println("Input file: "+inputFile);
		out.println("Output file: "+outputFile);
		out.println("Wildcard: "+wildcard);
		out.println("Terminator: "+terminator);
		out.println("Suffix array algorithm: "+suffixArrayAlgorithm);
		log.info(os.toString());
	}

	public BWTWildcardIndex buildIndex() throws IOException {
		String text = OptionValuesDecoder.loadText(inputFile, log);
		return OptionValuesDecoder.buildIndex(text, wildcard, terminator, suffixArrayAlgorithm, log);
	}
}
