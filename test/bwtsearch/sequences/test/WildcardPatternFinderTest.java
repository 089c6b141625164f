package bwtsearch.sequences.test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;
import bwtsearch.sequences.MatchingAlgorithm;
import bwtsearch.sequences.SuffixArrayAlgorithm;
import bwtsearch.sequences.WildcardIndexBuilder;
import bwtsearch.sequences.WildcardPatternFinder;

public class WildcardPatternFinderTest extends TestCase {

	private Logger log;

	@Override
	protected void setUp() {
		log = Logger.getLogger(WildcardPatternFinderTest.class.getName());
		log.setLevel(Level.WARNING);
	}

	public void testFindFromText() throws IOException {
		WildcardPatternFinder finder = new WildcardPatternFinder();
		finder.setLog(log);
		finder.setTextFile(writeFile("text", ".txt", "banana\n"));
		finder.setPatternFile(writeFile("pattern", ".txt", "ana\n"));
		File output = createTempFile("matches", ".txt");
		finder.setOutputFile(output.getAbsolutePath());
		finder.run();
		assertEquals(Arrays.asList("2","4"), Files.readAllLines(output.toPath()));
	}

	public void testAlgorithmsAgree() throws IOException {
		String text = "aabbabababbbbaabaabbabbaa";
		String textFile = writeFile("text", ".txt", text);
		WildcardPatternFinder finder = new WildcardPatternFinder();
		finder.setLog(log);
		finder.setTextFile(textFile);
		List<Integer> bwt = finder.findMatches("a#a");
		finder.setAlgorithm(MatchingAlgorithm.NAIVE);
		List<Integer> naive = finder.findMatches("a#a");
		assertEquals(naive, bwt);
		finder.setAlgorithm(MatchingAlgorithm.BWT);
		finder.setBreadthFirst(true);
		finder.setSuffixArrayAlgorithm(SuffixArrayAlgorithm.COLLECTIONS_SORT);
		assertEquals(Arrays.asList(4,6,14), finder.findMatches("aba"));
	}

	public void testFindFromIndex() throws IOException {
		WildcardIndexBuilder builder = new WildcardIndexBuilder();
		builder.setLog(log);
		builder.setInputFile(writeFile("text", ".txt", "ACGTACGTTTACG"));
		builder.setWildcard('N');
		File indexFile = createTempFile("index", ".bwt.gz");
		builder.setOutputFile(indexFile.getAbsolutePath());
		builder.run();

		WildcardPatternFinder finder = new WildcardPatternFinder();
		finder.setLog(log);
		finder.setIndexFile(indexFile.getAbsolutePath());
		assertEquals(Arrays.asList(0,4,10), finder.findMatches("ACG"));
		assertEquals(Arrays.asList(0,4,10), finder.findMatches("ANG"));
		finder.setAlgorithm(MatchingAlgorithm.NAIVE);
		assertEquals(Arrays.asList(2,6), finder.findMatches("GTN"));
	}

	public void testPrintMatches() {
		WildcardPatternFinder finder = new WildcardPatternFinder();
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		finder.printMatches(Arrays.asList(0,9), out);
		out.flush();
		assertEquals("1"+System.lineSeparator()+"10"+System.lineSeparator(), os.toString());
	}

	public void testInvalidParameters() throws IOException {
		WildcardPatternFinder finder = new WildcardPatternFinder();
		finder.setLog(log);
		finder.setTextFile(writeFile("text", ".txt", "banana"));
		try {
			finder.run();
			fail("Pattern file is required");
		} catch (IOException e) {
			//Expected
		}
		finder.setTextFile(null);
		finder.setPatternFile(writeFile("pattern", ".txt", "ana"));
		try {
			finder.run();
			fail("Text or index is required");
		} catch (IOException e) {
			//Expected
		}
		finder.setTextFile(writeFile("text", ".txt", "banana"));
		finder.setWildcard('$');
		try {
			finder.run();
			fail("Wildcard equal to the terminator should not be accepted");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	private String writeFile(String prefix, String suffix, String content) throws IOException {
		File file = createTempFile(prefix, suffix);
		Files.write(file.toPath(), content.getBytes("UTF-8"));
		return file.getAbsolutePath();
	}

	private File createTempFile(String prefix, String suffix) throws IOException {
		File file = File.createTempFile(prefix, suffix);
		file.deleteOnExit();
		return file;
	}
}
