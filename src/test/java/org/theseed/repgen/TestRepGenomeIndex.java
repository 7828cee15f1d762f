package org.theseed.repgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.theseed.repgen.sequence.KmerSet;

/**
 * Tests for the representative-genome index.
 */
public class TestRepGenomeIndex {

    public static final String PROT_A = "MKTAYIAKQRQISFVKSHFSRQLEERLGLIEVQAPILSRVGDGTQDNLSGAEKAVQVKVKALPDAQFEVVHSLAKWKRQTLGQHDFSAGEGLYTHMKALRPDEDRLSPLHSVYVDQWDWELVMGDGERQFSTLKSTVEAIWAGIKATEAAVSEEFGLAPFLPDQIHFVHSQELLSRYPDLDAKGRERAIAKDLGAVFLVGIGGKLSDGHRHDVRAPDYDDWSTPSELGHAGLNGDILVWNPVLEDAFELSSMGIRVDADTLKHQLALTGDEDRLELEWHQALLRGEMPQTIGGGIGQSRLTMLLLQLPHIGQVQAGVWPAAVRESVPSLL";

    /**
     * @return a copy of a sequence with the residues at the specified positions changed
     *
     * @param seq		sequence to mutate
     * @param points	positions to change
     */
    public static String mutate(String seq, int... points) {
        char[] buffer = seq.toCharArray();
        for (int point : points)
            buffer[point] = (buffer[point] == 'W' ? 'C' : 'W');
        return new String(buffer);
    }

    public static final String PROT_B = mutate(PROT_A, 20, 60, 100, 140, 180, 220, 260);

    @Test
    public void testBestMatch() throws RepGenomeException {
        RepGenomeIndex index = new RepGenomeIndex(8, 100);
        index.insert("100.1", "genome A", PROT_A);
        index.insert("200.2", "genome B", PROT_B);
        assertEquals(2, index.size());
        // The query is the front of A, mutated at places where B is not.
        String query = mutate(PROT_A.substring(0, 200), 40, 80, 120, 160);
        KmerSet queryKmers = KmerSet.protein(query, 8);
        int scoreA = queryKmers.intersectionSize(KmerSet.protein(PROT_A, 8));
        int scoreB = queryKmers.intersectionSize(KmerSet.protein(PROT_B, 8));
        assertTrue(scoreA > scoreB);
        RepMatch match = index.bestMatch(query);
        assertTrue(match.isFound());
        assertEquals("100.1", match.getGenomeId());
        assertEquals(scoreA, match.getScore());
        // A query closer to B goes to B.
        String queryB = PROT_B.substring(0, 150);
        match = index.bestMatch(queryB);
        assertEquals("200.2", match.getGenomeId());
        assertEquals(KmerSet.protein(queryB, 8).size(), match.getScore());
        // Repeated queries give the same answer.
        assertEquals(match.toString(), index.bestMatch(queryB).toString());
        // An unrelated query has no match.
        match = index.bestMatch("WWWWWWWWWWCCCCCCCCCCWWWWWWWWWW");
        assertFalse(match.isFound());
        assertNull(match.getGenomeId());
        assertEquals(0, match.getScore());
    }

    @Test
    public void testTies() throws RepGenomeException {
        RepGenomeIndex index = new RepGenomeIndex(8, 10);
        index.insert("300.3", "genome C", PROT_A);
        index.insert("100.1", "genome A", PROT_A);
        index.insert("200.2", "genome B", PROT_B);
        RepMatch match = index.bestMatch(PROT_A);
        assertEquals("300.3", match.getGenomeId());
        Map<String, Integer> matches = index.matchesAbove(PROT_A, 10);
        assertEquals(Arrays.asList("300.3", "100.1", "200.2"), new ArrayList<String>(matches.keySet()));
        assertEquals(Arrays.asList("300.3", "100.1", "200.2"), index.getGenomeIds());
        List<RepMatch> closest = index.findClosest(PROT_A, 2, 10);
        assertEquals(2, closest.size());
        assertEquals("300.3", closest.get(0).getGenomeId());
        assertEquals("100.1", closest.get(1).getGenomeId());
        closest = index.findClosest(PROT_B, 5, 10);
        assertEquals(3, closest.size());
        assertEquals("200.2", closest.get(0).getGenomeId());
        assertEquals("300.3", closest.get(1).getGenomeId());
        assertTrue(closest.get(0).getScore() > closest.get(1).getScore());
        assertEquals(0, index.findClosest(PROT_B, 0, 10).size());
    }

    @Test
    public void testThresholds() throws RepGenomeException {
        RepGenomeIndex index = new RepGenomeIndex(8, 100);
        index.insert("100.1", "genome A", PROT_A);
        index.insert("200.2", "genome B", PROT_B);
        String query = PROT_B.substring(50, 250);
        KmerSet queryKmers = index.kmersOf(query);
        int max = 0;
        for (RepGenome rep : index)
            max = Math.max(max, rep.similarity(queryKmers));
        assertEquals(max, index.bestMatch(queryKmers).getScore());
        assertTrue(index.matchesAbove(query, max + 1).isEmpty());
        assertEquals(0, index.countAbove(query, max + 1));
        assertEquals(1, index.countAbove(query, max));
        // Every match at or above the threshold is reported, and nothing below it.
        Map<String, Integer> matches = index.matchesAbove(query, 50);
        for (Map.Entry<String, Integer> found : matches.entrySet()) {
            assertTrue(found.getValue() >= 50);
            assertEquals(index.get(found.getKey()).similarity(queryKmers), (int) found.getValue());
        }
        int previous = Integer.MAX_VALUE;
        for (int t = 0; t <= max + 1; t += 7) {
            int count = index.countAbove(query, t);
            assertTrue(count <= previous);
            assertEquals(count, index.matchesAbove(query, t).size());
            previous = count;
        }
    }

    @Test
    public void testEmptyQuery() throws RepGenomeException {
        RepGenomeIndex index = new RepGenomeIndex(8, 100);
        index.insert("100.1", "genome A", PROT_A);
        assertFalse(index.bestMatch("MKTAY").isFound());
        assertTrue(index.matchesAbove("MKTAY", 0).isEmpty());
        assertEquals(0, index.countAbove("MKTAY", -1));
        assertTrue(index.findClosest("XXXXXXXXXXXXXXX", 3, 0).isEmpty());
        // An empty index represents nothing.
        RepGenomeIndex empty = new RepGenomeIndex();
        assertEquals(RepGenomeIndex.DEFAULT_K, empty.getKmerSize());
        assertEquals(RepGenomeIndex.DEFAULT_SCORE, empty.getThreshold());
        assertFalse(empty.bestMatch(PROT_A).isFound());
        assertEquals(0, empty.countAbove(PROT_A, 0));
    }

    @Test
    public void testInsertErrors() throws RepGenomeException {
        RepGenomeIndex index = new RepGenomeIndex(8, 100);
        RepGenome first = index.insert("100.1", "genome A", PROT_A);
        try {
            index.insert("100.1", "other genome", PROT_B);
            fail("Duplicate genome inserted.");
        } catch (DuplicateGenomeException e) {
            assertEquals("100.1", e.getGenomeId());
        }
        assertEquals(1, index.size());
        assertSame(first, index.get("100.1"));
        assertEquals("genome A", index.get("100.1").getName());
        assertEquals(PROT_A, index.get("100.1").getProtein());
        try {
            index.insert("200.2", "short genome", "MKTAYIAK");
            fail("Short sequence inserted.");
        } catch (SequenceTooShortException e) {
            // expected
        }
        assertFalse(index.isRepresentative("200.2"));
        assertNull(index.get("200.2"));
        assertEquals(1, index.size());
    }

    @Test
    public void testConnections() throws RepGenomeException {
        RepGenomeIndex index = new RepGenomeIndex(8, 100);
        index.insert("100.1", "genome A", PROT_A);
        index.insert("200.2", "genome B", PROT_B);
        index.connect("100.1", "500.5", 150);
        index.connect("100.1", "600.6", 120);
        index.connect("200.2", "700.7", 110);
        assertEquals(3, index.connectedCount());
        RepMatch rep = index.checkRep("600.6");
        assertEquals("100.1", rep.getGenomeId());
        assertEquals(120, rep.getScore());
        assertFalse(index.checkRep("800.8").isFound());
        assertFalse(index.checkRep("100.1").isFound());
        assertEquals(Arrays.asList("500.5", "600.6"), new ArrayList<String>(index.representedList("100.1").keySet()));
        // Connecting again moves the genome.
        index.connect("200.2", "500.5", 130);
        assertEquals(3, index.connectedCount());
        assertEquals("200.2", index.checkRep("500.5").getGenomeId());
        assertEquals(130, index.checkRep("500.5").getScore());
        assertFalse(index.representedList("100.1").containsKey("500.5"));
        assertEquals(Arrays.asList("700.7", "500.5"), new ArrayList<String>(index.representedList("200.2").keySet()));
        try {
            index.connect("900.9", "500.5", 200);
            fail("Connected to unknown representative.");
        } catch (UnknownRepresentativeException e) {
            assertEquals("900.9", e.getRepId());
        }
        assertEquals("200.2", index.checkRep("500.5").getGenomeId());
        try {
            index.representedList("900.9");
            fail("Listed unknown representative.");
        } catch (UnknownRepresentativeException e) {
            // expected
        }
        index.clearConnections();
        assertEquals(0, index.connectedCount());
        assertTrue(index.representedList("100.1").isEmpty());
    }

    @Test
    public void testPairs() throws RepGenomeException {
        RepGenomeIndex index = new RepGenomeIndex(8, 100);
        index.insert("100.1", "genome A", PROT_A);
        index.insert("200.2", "genome B", PROT_B);
        index.insert("300.3", "genome C", "WWWWWWWWWWCCCCCCCCCCWWWWWWWWWW");
        RepGenome a = index.get("100.1");
        RepGenome b = index.get("200.2");
        List<RepGenomeIndex.Pair> pairs = index.pairsAbove(1);
        assertEquals(1, pairs.size());
        RepGenomeIndex.Pair pair = pairs.get(0);
        assertEquals("100.1", pair.getGenome1());
        assertEquals("200.2", pair.getGenome2());
        assertEquals(a.similarity(b), pair.getScore());
        assertEquals(b.similarity(a), pair.getScore());
        assertTrue(index.pairsAbove(pair.getScore() + 1).isEmpty());
        assertEquals(3, index.pairsAbove(0).size());
        assertEquals(0.0, a.distance(a), 1e-9);
        assertTrue(a.distance(b) > 0.0 && a.distance(b) < 1.0);
    }

}
