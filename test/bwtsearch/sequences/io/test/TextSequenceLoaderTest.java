package bwtsearch.sequences.io.test;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;

import junit.framework.TestCase;
import bwtsearch.sequences.io.TextSequenceLoader;

public class TextSequenceLoaderTest extends TestCase {

	private TextSequenceLoader loader;

	@Override
	protected void setUp() {
		loader = new TextSequenceLoader();
		Logger log = Logger.getLogger(TextSequenceLoaderTest.class.getName());
		log.setLevel(Level.SEVERE);
		loader.setLog(log);
	}

	public void testPlainText() throws IOException {
		File file = createTempFile(".txt");
		Files.write(file.toPath(), "  banana split\n\n".getBytes("UTF-8"));
		assertEquals("banana split", loader.loadText(file.getAbsolutePath()));
	}

	public void testCompressedText() throws IOException {
		File file = createTempFile(".txt.gz");
		try (PrintStream out = new PrintStream(new GZIPOutputStream(new FileOutputStream(file)))) {
			out.print("aabbabab\n");
		}
		assertEquals("aabbabab", loader.loadText(file.getAbsolutePath()));
	}

	public void testFastaFirstSequence() throws IOException {
		File file = createTempFile(".fa");
		Files.write(file.toPath(), ">seq1 first\nACGTAC\nGGTT\n>seq2\nTTTT\n".getBytes("UTF-8"));
		assertEquals("ACGTACGGTT", loader.loadText(file.getAbsolutePath()));
	}

	public void testCompressedFasta() throws IOException {
		File file = createTempFile(".fasta.gz");
		try (PrintStream out = new PrintStream(new GZIPOutputStream(new FileOutputStream(file)))) {
			out.print(">chr1\nNNACGT\nACGT\n");
		}
		assertEquals("NNACGTACGT", loader.loadText(file.getAbsolutePath()));
	}

	public void testFastaDetection() {
		assertTrue(TextSequenceLoader.isFasta("genome.fa"));
		assertTrue(TextSequenceLoader.isFasta("genome.FASTA.gz"));
		assertTrue(TextSequenceLoader.isFasta("/data/genome.fna"));
		assertFalse(TextSequenceLoader.isFasta("text.txt"));
		assertFalse(TextSequenceLoader.isFasta("text.gz"));
	}

	public void testMissingFile() {
		try {
			loader.loadText("/nonexistent/dir/text.txt");
			fail("Missing file should raise an exception");
		} catch (IOException e) {
			//Expected
		}
		try {
			loader.loadText("/nonexistent/dir/genome.fa");
			fail("Missing file should raise an exception");
		} catch (IOException e) {
			//Expected
		}
	}

	private File createTempFile(String suffix) throws IOException {
		File file = File.createTempFile("loader", suffix);
		file.deleteOnExit();
		return file;
	}
}
