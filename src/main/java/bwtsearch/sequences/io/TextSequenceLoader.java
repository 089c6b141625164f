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
package bwtsearch.sequences.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.IOUtil;

/**
 * Loads texts and patterns from files. Fasta files are read with htsjdk and only the first
 * sequence is kept. Other files are read completely. Both can be gzip compressed
 */
public class TextSequenceLoader {

	public static final String [] FASTA_EXTENSIONS = {".fa",".fasta",".fna"};

	private Logger log = Logger.getLogger(TextSequenceLoader.class.getName());

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * Loads a text choosing the format from the file extension
	 * @param filename Path of the file to read
	 * @return String Text stored in the file
	 * @throws IOException If the file can not be read
	 */
	public String loadText(String filename) throws IOException {
		if(isFasta(filename)) return loadFastaText(filename);
		return loadPlainText(filename);
	}

	/**
	 * @param filename Path of a file
	 * @return boolean true if the name of the file has a fasta extension, optionally followed by .gz
	 */
	public static boolean isFasta(String filename) {
		String name = filename.toLowerCase();
		if(name.endsWith(".gz")) name = name.substring(0,name.length()-3);
		for(String extension:FASTA_EXTENSIONS) {
			if(name.endsWith(extension)) return true;
		}
		return false;
	}

	/**
	 * Loads the whole content of the given file removing leading and trailing whitespace
	 * @param filename Path of the file to read
	 * @return String Content of the file
	 * @throws IOException If the file can not be read
	 */
	public String loadPlainText(String filename) throws IOException {
		File file = new File(filename);
		if(!file.isFile()) throw new IOException("File "+filename+" does not exist");
		StringBuilder content = new StringBuilder();
		try (BufferedReader in = IOUtil.openFileForBufferedReading(file)) {
			char [] buffer = new char[8192];
			int read = in.read(buffer);
			while(read>=0) {
				content.append(buffer,0,read);
				read = in.read(buffer);
			}
		} catch (SAMException e) {
			throw new IOException("Can not read file "+filename,e);
		}
		String text = content.toString().trim();
		log.fine("Loaded "+text.length()+" characters from "+filename);
		return text;
	}

	/**
	 * Loads the first sequence of the given fasta file
	 * @param filename Path of the fasta file to read
	 * @return String Characters of the first sequence
	 * @throws IOException If the file can not be read or it has no sequences
	 */
	public String loadFastaText(String filename) throws IOException {
		File file = new File(filename);
		if(!file.isFile()) throw new IOException("File "+filename+" does not exist");
		try (FastaSequenceFile fasta = new FastaSequenceFile(file, true)) {
			ReferenceSequence first = fasta.nextSequence();
			if(first==null) throw new IOException("Fasta file "+filename+" does not have sequences");
			int ignored = 0;
			while(fasta.nextSequence()!=null) ignored++;
			if(ignored>0) log.warning("Only the first sequence ("+first.getName()+") of "+filename+" will be indexed. Ignored sequences: "+ignored);
			String text = first.getBaseString();
			log.fine("Loaded sequence "+first.getName()+" with "+text.length()+" characters from "+filename);
			return text;
		} catch (SAMException e) {
			throw new IOException("Can not read fasta file "+filename,e);
		}
	}
}
