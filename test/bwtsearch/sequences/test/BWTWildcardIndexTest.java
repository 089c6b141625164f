package bwtsearch.sequences.test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import junit.framework.TestCase;
import bwtsearch.sequences.BWTWildcardIndex;
import bwtsearch.sequences.NaiveWildcardPatternMatcher;
import bwtsearch.sequences.SearchTraversal;
import bwtsearch.sequences.SuffixArrayAlgorithm;

public class BWTWildcardIndexTest extends TestCase {

	private static final String LONG_TEXT = "aabbabababbbbaabaabbabbaa";

	public void testBanana() {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex("banana");
		assertEquals("annb$aa", index.getBWT());
		assertTrue(Arrays.equals(new int[] {6,5,3,1,0,4,2}, index.getSuffixArray()));
		assertEquals(6, index.getTextLength());
		assertEquals('#', index.getWildcard());
		assertEquals('$', index.getTerminator());
		assertEquals(Arrays.asList(1,3), BWTWildcardIndex.search(index, "ana"));
		assertEquals(Arrays.asList(1,3,5), index.search("a"));
		assertEquals(Arrays.asList(0), index.search("banana"));
		assertTrue(index.search("nab").isEmpty());
		assertEquals("banana", index.getText());
	}

	public void testExamples() {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex(LONG_TEXT);
		assertEquals(Arrays.asList(4,6,14), index.search("aba"));
		BWTWildcardIndex small = BWTWildcardIndex.buildIndex("abcaba");
		assertEquals(Arrays.asList(3), small.search("a#a"));
		assertEquals(new NaiveWildcardPatternMatcher().findMatches("abcaba", "a#a"), small.search("a#a"));
		assertEquals(Arrays.asList(0,3), small.search("ab"));
		assertEquals(Arrays.asList(0,1,2,3,4,5), small.search("#"));
	}

	public void testWildcards() {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex(LONG_TEXT);
		int n = LONG_TEXT.length();
		for(int m=1;m<=n;m++) {
			StringBuilder pattern = new StringBuilder();
			for(int j=0;j<m;j++) pattern.append('#');
			List<Integer> matches = index.search(pattern);
			assertEquals(n-m+1, matches.size());
			for(int k=0;k<=n-m;k++) assertEquals(k, (int)matches.get(k));
		}
		assertEquals(Arrays.asList(0,1,8,13,16,17,20), index.search("a#b"));
		assertEquals(index.search("#b#a"), new NaiveWildcardPatternMatcher().findMatches(LONG_TEXT, "#b#a"));
		//Wildcards never match the terminator
		assertTrue(index.search("a#").contains(23));
		assertFalse(index.search("a#").contains(24));
	}

	public void testSubstringsAreFound() {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex(LONG_TEXT, '*', '!', SuffixArrayAlgorithm.COLLECTIONS_SORT);
		for(int k=0;k<LONG_TEXT.length();k++) {
			for(int end=k+1;end<=LONG_TEXT.length();end++) {
				String pattern = LONG_TEXT.substring(k,end);
				List<Integer> matches = index.search(pattern);
				assertTrue(matches.contains(k));
				assertEquals(matches, index.search(pattern, SearchTraversal.BREADTH_FIRST));
			}
		}
	}

	public void testTraversalsAgree() {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex("ACGTTGCAACGTAGGCTAGCTAGCATCGATCGNNACGT");
		String [] patterns = {"A#G","##T#","C###A","N#A","#","ACGT","G#C#A","TTT"};
		for(String pattern:patterns) {
			List<Integer> dfs = index.search(pattern, SearchTraversal.DEPTH_FIRST);
			List<Integer> bfs = index.search(pattern, SearchTraversal.BREADTH_FIRST);
			assertEquals(dfs, bfs);
		}
	}

	public void testBoundaries() {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex("banana");
		assertTrue(index.search("").isEmpty());
		assertTrue(index.search("bananas").isEmpty());
		assertTrue(index.search("#######").isEmpty());
		assertTrue(index.search("x").isEmpty());
		assertTrue(index.search("$").isEmpty());
		List<Integer> matches = index.search("ana");
		try {
			matches.add(7);
			fail("Matches should not be modifiable");
		} catch (UnsupportedOperationException e) {
			//Expected
		}
	}

	public void testValidationErrors() {
		try {
			BWTWildcardIndex.buildIndex("");
			fail("Empty text should not be accepted");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			BWTWildcardIndex.buildIndex("ban$ana");
			fail("Text with the terminator should not be accepted");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			BWTWildcardIndex.buildIndex("banana", '$', '$');
			fail("Wildcard equal to terminator should not be accepted");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			BWTWildcardIndex.search(null, "ana");
			fail("Null index should not be accepted");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testSaveLoad() throws IOException {
		String text = "first line\tsecond field\nsecond line with $ymbols";
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex(text, '?', '\u0001');
		File file = File.createTempFile("bwtindex", ".bwt.gz");
		file.deleteOnExit();
		index.save(file.getAbsolutePath());
		BWTWildcardIndex loaded = BWTWildcardIndex.load(file.getAbsolutePath());
		assertEquals(text, loaded.getText());
		assertEquals('?', loaded.getWildcard());
		assertEquals('\u0001', loaded.getTerminator());
		assertEquals(index.getBWT(), loaded.getBWT());
		assertTrue(Arrays.equals(index.getSuffixArray(), loaded.getSuffixArray()));
		String [] patterns = {"line","?e?","\t","\n?","$","s"};
		for(String pattern:patterns) {
			assertEquals(index.search(pattern), loaded.search(pattern));
		}
	}

	public void testSaveFormat() throws IOException {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex("ab");
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		index.save(out);
		out.flush();
		String [] lines = os.toString().split("\n");
		assertEquals("#BWTINDEX\t36\t35\t3", lines[0]);
		assertEquals("#ALPHABET\t97\t98", lines[1]);
		assertEquals("#BWT", lines[2]);
		assertEquals("2\t0\t1", lines[3]);
		assertEquals("#SUFFIXARRAY", lines[4]);
		assertEquals("2\t0\t1", lines[5]);
		assertEquals("#END", lines[6]);
		BWTWildcardIndex loaded = BWTWildcardIndex.load(new BufferedReader(new StringReader(os.toString())));
		assertEquals("ab", loaded.getText());
		//Uncompressed index files are also accepted
		File file = File.createTempFile("bwtindex", ".bwt");
		file.deleteOnExit();
		Files.write(file.toPath(), os.toByteArray());
		loaded = BWTWildcardIndex.load(file.getAbsolutePath());
		assertEquals(Arrays.asList(0), loaded.search("#b"));
	}

	public void testSaveWriteError() {
		BWTWildcardIndex index = BWTWildcardIndex.buildIndex("aabbabababbbbaabaabbabbaa");
		//Accepts a few bytes and then fails every write
		OutputStream failing = new OutputStream() {
			private int written = 0;
			@Override
			public void write(int b) throws IOException {
				if(written>=16) throw new IOException("Device full");
				written++;
			}
		};
		try {
			index.save(failing);
			fail("Write errors should be reported");
		} catch (IOException e) {
			//Expected
		}
	}

	public void testLoadInconsistentIndex() throws IOException {
		//Suffix array is a permutation but disagrees with the transform
		File file = writeIndexFile("#BWTINDEX\t36\t35\t3\n#ALPHABET\t97\t98\n#BWT\n2\t0\t1\n#SUFFIXARRAY\n2\t1\t0\n#END\n");
		try {
			BWTWildcardIndex.load(file.getAbsolutePath());
			fail("Inconsistent index should not be loaded");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		//Two terminators in the transform
		file = writeIndexFile("#BWTINDEX\t36\t35\t3\n#ALPHABET\t97\t98\n#BWT\n0\t0\t1\n#SUFFIXARRAY\n2\t0\t1\n#END\n");
		try {
			BWTWildcardIndex.load(file.getAbsolutePath());
			fail("Inconsistent index should not be loaded");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	public void testLoadMalformedFile() throws IOException {
		String [] contents = {
			"",
			"#INDEX\t36\t35\t3\n",
			"#BWTINDEX\t36\t35\n",
			"#BWTINDEX\t36\t35\t3\n#ALPHABET\t97\t98\n#BWT\n2\tx\t1\n#SUFFIXARRAY\n2\t0\t1\n#END\n",
			"#BWTINDEX\t36\t35\t3\n#ALPHABET\t97\t98\n#BWT\n2\t0\n#SUFFIXARRAY\n2\t0\t1\n#END\n",
			"#BWTINDEX\t36\t35\t3\n#ALPHABET\t97\t98\n#BWT\n2\t0\t1\n#SUFFIXARRAY\n2\t0\t1\n"
		};
		for(String content:contents) {
			File file = writeIndexFile(content);
			try {
				BWTWildcardIndex.load(file.getAbsolutePath());
				fail("Malformed file should not be loaded. Content: "+content);
			} catch (IOException e) {
				//Expected
			}
		}
	}

	private File writeIndexFile(String content) throws IOException {
		File file = File.createTempFile("bwtindex", ".bwt.gz");
		file.deleteOnExit();
		try (PrintStream out = new PrintStream(new GZIPOutputStream(new FileOutputStream(file)))) {
			out.print(content);
		}
		return file;
	}
}
