package gr.imsi.athenarc.ahocorasick.matcher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.ahocorasick.config.MatcherConfiguration;

public class MatcherTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Both "she" and its suffix "he" end at the last character and are reported once each,
     * the longer one first.
     */
    @Test
    public void testSuffixPatternReportedOnce() {
        Matcher matcher = Matcher.fromStrings("he", "she");
        assertEquals(Arrays.asList(1, 0), matcher.match("she"));
        assertEquals(Arrays.asList(1, 0), matcher.matchThreadSafe("she"));
    }

    @Test
    public void testClassicDictionary() {
        Matcher matcher = Matcher.fromStrings("he", "she", "his", "hers");
        assertEquals(Arrays.asList(1, 0, 3), matcher.match("ushers"));
        assertEquals(Arrays.asList(1, 0, 3), matcher.matchThreadSafe("ushers"));
        assertTrue(matcher.contains("ushers"));
        assertEquals(1, matcher.matchFirst("ushers").getIndex());
    }

    @Test
    public void testMultiByteCharacters() {
        Matcher matcher = Matcher.fromStrings("中文");
        String text = "这是中文内容";

        assertEquals(Collections.singletonList(0), matcher.match(text));
        assertEquals(Collections.singletonList(0), matcher.match(utf8(text)));
        assertEquals(Collections.singletonList(new PatternOccurrence(0, "中文", 2, 4)), matcher.findAll(text));
    }

    @Test
    public void testNoMatchInsideEncodedCharacter() {
        // Trailing bytes of "中" (E4 B8 AD) are not characters on their own
        Matcher matcher = Matcher.fromBytes(Collections.singletonList(new byte[] {(byte) 0xB8, (byte) 0xAD}));
        assertFalse(matcher.contains(utf8("中")));
        assertTrue(matcher.match(utf8("这是中文内容")).isEmpty());
        assertFalse(matcher.matchFirst(utf8("中")).isFound());
    }

    @Test
    public void testInvalidBytesDoNotTruncateTheScan() {
        Matcher matcher = Matcher.fromStrings("cd");
        byte[] text = {'a', 'b', (byte) 0xFF, 'c', 'd'};
        assertEquals(Collections.singletonList(0), matcher.match(text));
        assertEquals(Collections.singletonList(new PatternOccurrence(0, "cd", 3, 5)), matcher.findAll(text));
    }

    @Test
    public void testByteAndStringInputsAgree() {
        Matcher matcher = Matcher.fromBytes(Arrays.asList(utf8("naïve"), utf8("café"), utf8("é")));
        String text = "a naïve café owner";
        assertEquals(matcher.match(text), matcher.match(utf8(text)));
        assertEquals(matcher.matchThreadSafe(text), matcher.matchThreadSafe(utf8(text)));
        assertEquals(matcher.contains(text), matcher.contains(utf8(text)));
        assertEquals(matcher.matchFirst(text), matcher.matchFirst(utf8(text)));
        assertEquals(matcher.findAll(text), matcher.findAll(utf8(text)));
        assertEquals(Arrays.asList(0, 1, 2), matcher.match(text));
    }

    @Test
    public void testStateReportedOncePerCall() {
        Matcher matcher = Matcher.fromStrings("a");
        assertEquals(Collections.singletonList(0), matcher.match("aaa"));
        assertEquals(Collections.singletonList(0), matcher.matchThreadSafe("aaa"));
        assertEquals(3, matcher.findAll("aaa").size());
    }

    @Test
    public void testNestedSuffixChain() {
        Matcher matcher = Matcher.fromStrings("a", "aa", "aaa");
        assertEquals(Arrays.asList(0, 1, 2), matcher.match("aaaa"));
        assertEquals(Arrays.asList(0, 1, 2), matcher.matchThreadSafe("aaaa"));

        List<PatternOccurrence> occurrences = matcher.findAll("aaa");
        assertEquals(Arrays.asList(
                new PatternOccurrence(0, "a", 0, 1),
                new PatternOccurrence(1, "aa", 0, 2),
                new PatternOccurrence(0, "a", 1, 2),
                new PatternOccurrence(2, "aaa", 0, 3),
                new PatternOccurrence(1, "aa", 1, 3),
                new PatternOccurrence(0, "a", 2, 3)), occurrences);
    }

    @Test
    public void testRepeatedCallsReturnTheSameMatches() {
        Matcher matcher = Matcher.fromStrings("he", "she", "his", "hers");
        List<Integer> first = matcher.match("he said his shears were hers");
        for (int i = 0; i < 5; i++) {
            assertEquals(first, matcher.match("he said his shears were hers"));
            assertEquals(first, matcher.matchThreadSafe("he said his shears were hers"));
        }
        assertEquals(Arrays.asList(0, 2, 1, 3), first);
    }

    @Test
    public void testFailureTransitionsAfterPartialMatch() {
        Matcher matcher = Matcher.fromStrings("abc");
        assertEquals(Collections.singletonList(0), matcher.match("ababc"));
        assertEquals(Collections.singletonList(new PatternOccurrence(0, "abc", 2, 5)), matcher.findAll("ababc"));
        assertTrue(matcher.match("abab").isEmpty());
    }

    @Test
    public void testEmptyDictionaryAndEmptyText() {
        Matcher empty = Matcher.fromStrings(Collections.emptyList());
        assertTrue(empty.match("anything").isEmpty());
        assertTrue(empty.matchThreadSafe("anything").isEmpty());
        assertFalse(empty.contains("anything"));
        assertFalse(empty.matchFirst("anything").isFound());
        assertTrue(empty.findAll("anything").isEmpty());

        Matcher matcher = Matcher.fromStrings("a");
        assertTrue(matcher.match("").isEmpty());
        assertTrue(matcher.matchThreadSafe(new byte[0]).isEmpty());
        assertFalse(matcher.contains(""));
    }

    @Test
    public void testEmptyPatternNeverMatches() {
        Matcher matcher = Matcher.fromStrings("", "b");
        assertEquals(Collections.singletonList(1), matcher.match("abc"));
        assertTrue(matcher.match("ac").isEmpty());
        assertFalse(matcher.contains("ac"));
    }

    @Test
    public void testDuplicatePatternsReportLastIndex() {
        Matcher matcher = Matcher.fromStrings("x", "y", "x");
        assertEquals(Collections.singletonList(2), matcher.match("x"));
        assertEquals(2, matcher.matchFirst("x").getIndex());
        assertEquals("x", matcher.getPattern(0));
        assertEquals(3, matcher.size());
    }

    @Test
    public void testMatchFirst() {
        Matcher matcher = Matcher.fromStrings("bcd", "c");
        FirstMatch first = matcher.matchFirst("abcd");
        assertTrue(first.isFound());
        assertEquals(1, first.getIndex());

        // own output wins over the suffix chain
        assertEquals(0, Matcher.fromStrings("she", "he").matchFirst("she").getIndex());

        FirstMatch none = matcher.matchFirst("xyz");
        assertFalse(none.isFound());
        assertEquals(FirstMatch.NOT_FOUND, none.getIndex());
    }

    @Test
    public void testContains() {
        Matcher matcher = Matcher.fromStrings("needle", "dle");
        assertTrue(matcher.contains("haystack with a needle"));
        assertTrue(matcher.contains("candle"));
        assertFalse(matcher.contains("haystack"));
    }

    @Test
    public void testSurrogatePairs() {
        Matcher matcher = Matcher.fromStrings("😀x", "x");
        String text = "a😀x";
        assertEquals(Arrays.asList(0, 1), matcher.match(text));
        assertEquals(Arrays.asList(
                new PatternOccurrence(0, "😀x", 1, 4),
                new PatternOccurrence(1, "x", 3, 4)), matcher.findAll(text));
        assertTrue(matcher.match("a\uD83Dx").contains(1));
        assertFalse(matcher.match("a\uD83Dx").contains(0));
    }

    @Test
    public void testCustomConfiguration() {
        MatcherConfiguration configuration = MatcherConfiguration.builder()
                .poolCapacity(1)
                .initialHitCapacity(0)
                .build();
        Matcher matcher = Matcher.fromStrings(Arrays.asList("a", "b"), configuration);
        assertEquals(Arrays.asList(0, 1), matcher.matchThreadSafe("ab"));
        assertEquals(1, matcher.getPool().idleTables());
        assertEquals(configuration, matcher.getConfiguration());
    }

    @Test
    public void testNullArgumentsAreRejected() {
        Matcher matcher = Matcher.fromStrings("a");
        assertThrows(NullPointerException.class, () -> matcher.match((String) null));
        assertThrows(NullPointerException.class, () -> matcher.matchThreadSafe((byte[]) null));
        assertThrows(NullPointerException.class, () -> matcher.contains((String) null));
        assertThrows(NullPointerException.class, () -> matcher.findAll((String) null));
        assertThrows(NullPointerException.class, () -> Matcher.fromStrings((List<String>) null));
        assertThrows(NullPointerException.class, () -> Matcher.fromBytes(Arrays.asList(new byte[] {'a'}, null)));
    }
}
