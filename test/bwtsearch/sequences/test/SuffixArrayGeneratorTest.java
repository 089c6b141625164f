package bwtsearch.sequences.test;

import java.util.Arrays;
import java.util.Random;

import junit.framework.TestCase;
import bwtsearch.sequences.CollectionsSortSuffixArrayGenerator;
import bwtsearch.sequences.InducedSortingSuffixArrayGenerator;
import bwtsearch.sequences.SuffixArrayAlgorithm;
import bwtsearch.sequences.SymbolAlphabet;

public class SuffixArrayGeneratorTest extends TestCase {

	private static final String [] SPECIAL_TEXTS = {"a","ab","ba","aaaaaaaaaa","banana","mississippi","abababababab","aabbabababbbbaabaabbabbaa","zyxwvutsrqponm","CTCAACTAGATCGCACAACGTCGGAATGGTTTCATCC"};

	public void testBanana() {
		String text = "banana";
		SymbolAlphabet alphabet = SymbolAlphabet.fromText(text, '$');
		int [] expected = {6,5,3,1,0,4,2};
		assertTrue(Arrays.equals(expected, new InducedSortingSuffixArrayGenerator(text, alphabet).getSuffixArray()));
		assertTrue(Arrays.equals(expected, new CollectionsSortSuffixArrayGenerator(text).getSuffixArray()));
	}

	public void testSpecialTexts() {
		for(String text:SPECIAL_TEXTS) {
			assertGeneratorsAgree(text);
		}
	}

	public void testRandomTexts() {
		Random random = new Random(42);
		String [] alphabets = {"ab","ACGT","abcdefghijklmnopqrstuvwxyz0123456789"};
		for(int i=0;i<300;i++) {
			String symbols = alphabets[i%alphabets.length];
			int length = 1+random.nextInt(200);
			StringBuilder text = new StringBuilder();
			for(int j=0;j<length;j++) text.append(symbols.charAt(random.nextInt(symbols.length())));
			assertGeneratorsAgree(text.toString());
		}
	}

	public void testAlgorithmEnum() {
		String text = "mississippi";
		SymbolAlphabet alphabet = SymbolAlphabet.fromText(text, '$');
		int [] induced = SuffixArrayAlgorithm.INDUCED_SORTING.createGenerator(text, alphabet).getSuffixArray();
		int [] sorted = SuffixArrayAlgorithm.COLLECTIONS_SORT.createGenerator(text, alphabet).getSuffixArray();
		assertTrue(Arrays.equals(induced, sorted));
		assertTrue(Arrays.equals(new int[] {11,10,7,4,1,0,9,8,6,3,5,2}, induced));
	}

	public void testInvalidCodes() {
		try {
			new InducedSortingSuffixArrayGenerator(new int[] {1,2,1}, 3);
			fail("Codes without terminator should not be accepted");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			new InducedSortingSuffixArrayGenerator(new int[] {1,0,2,0}, 3);
			fail("Codes with a terminator in the middle should not be accepted");
		} catch (IllegalArgumentException e) {
			//Expected
		}
	}

	private void assertGeneratorsAgree(String text) {
		SymbolAlphabet alphabet = SymbolAlphabet.fromText(text, '$');
		int [] induced = new InducedSortingSuffixArrayGenerator(text, alphabet).getSuffixArray();
		int [] sorted = new CollectionsSortSuffixArrayGenerator(text).getSuffixArray();
		int [] naive = sortRotations(text);
		assertEquals(text.length()+1, induced.length);
		assertEquals(text.length(), induced[0]);
		assertTrue("Suffix arrays differ for text "+text, Arrays.equals(naive, induced));
		assertTrue("Suffix arrays differ for text "+text, Arrays.equals(naive, sorted));
		boolean [] seen = new boolean[induced.length];
		for(int v:induced) {
			assertFalse(seen[v]);
			seen[v] = true;
		}
	}

	/**
	 * Sorts the rotations of the text extended with a character smaller than any other
	 */
	private int [] sortRotations(String text) {
		final String extended = text+"\u0000";
		int n = extended.length();
		Integer [] rotations = new Integer[n];
		for(int i=0;i<n;i++) rotations[i] = i;
		Arrays.sort(rotations, (r1,r2) -> {
			for(int k=0;k<n;k++) {
				char c1 = extended.charAt((r1+k)%n);
				char c2 = extended.charAt((r2+k)%n);
				if(c1!=c2) return c1-c2;
			}
			return 0;
		});
		int [] answer = new int[n];
		for(int i=0;i<n;i++) answer[i] = rotations[i];
		return answer;
	}
}
