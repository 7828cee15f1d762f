package org.theseed.repgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.theseed.repgen.sequence.Sequence;

/**
 * Tests for loading and saving representative-genome directories.
 */
public class TestRepGenomeDirectory {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private static final String PROT_C = TestRepGenomeIndex.mutate(TestRepGenomeIndex.PROT_A.substring(100), 10, 50, 90);

    /**
     * @return a small index with connections
     *
     * @throws RepGenomeException
     */
    private RepGenomeIndex buildIndex() throws RepGenomeException {
        RepGenomeIndex retVal = new RepGenomeIndex(9, 150);
        retVal.insert("200.2", "genome B", TestRepGenomeIndex.PROT_B);
        retVal.insert("100.1", "genome A", TestRepGenomeIndex.PROT_A);
        retVal.insert("300.3", "genome C", PROT_C);
        retVal.connect("100.1", "500.5", 160);
        retVal.connect("300.3", "400.4", 200);
        retVal.connect("100.1", "600.6", 155);
        return retVal;
    }

    /**
     * Write a text file in a directory.
     *
     * @param dir		target directory
     * @param name		file name
     * @param text		file contents
     *
     * @throws IOException
     */
    private static void writeFile(File dir, String name, String text) throws IOException {
        FileUtils.writeStringToFile(new File(dir, name), text, StandardCharsets.UTF_8);
    }

    @Test
    public void testRoundTrip() throws Exception {
        RepGenomeIndex original = this.buildIndex();
        File dir = new File(this.tempFolder.getRoot(), "reps");
        RepGenomeDirectory.save(original, dir);
        assertEquals("9\n150\n", FileUtils.readFileToString(new File(dir, RepGenomeDirectory.PARM_FILE_NAME),
                StandardCharsets.UTF_8));
        RepGenomeIndex loaded = RepGenomeDirectory.load(dir);
        assertEquals(9, loaded.getKmerSize());
        assertEquals(150, loaded.getThreshold());
        assertEquals(original.getGenomeIds(), loaded.getGenomeIds());
        Iterator<RepGenome> iter = loaded.iterator();
        for (RepGenome rep : original) {
            RepGenome other = iter.next();
            assertEquals(rep, other);
            assertEquals(rep.getName(), other.getName());
            assertEquals(rep.getProtein(), other.getProtein());
            assertEquals(rep.getKmers(), other.getKmers());
            assertEquals(rep.getRepresented(), other.getRepresented());
        }
        assertEquals(3, loaded.connectedCount());
        assertEquals("100.1", loaded.checkRep("600.6").getGenomeId());
        assertEquals(original.bestMatch(PROT_C).toString(), loaded.bestMatch(PROT_C).toString());
        // Loading without connections skips the represented genomes.
        RepGenomeIndex unconnected = RepGenomeDirectory.load(dir, false);
        assertEquals(3, unconnected.size());
        assertEquals(0, unconnected.connectedCount());
        // Saving the loaded copy reproduces the files exactly.
        File dir2 = new File(this.tempFolder.getRoot(), "reps2");
        RepGenomeDirectory.save(loaded, dir2);
        for (String name : new String[] { RepGenomeDirectory.PARM_FILE_NAME, RepGenomeDirectory.GENOME_FILE_NAME,
                RepGenomeDirectory.PROTEIN_FILE_NAME, RepGenomeDirectory.REP_DB_FILE_NAME })
            assertTrue(name, FileUtils.contentEquals(new File(dir, name), new File(dir2, name)));
    }

    @Test
    public void testUnusualIds() throws Exception {
        RepGenomeIndex original = new RepGenomeIndex(8, 100);
        original.insert("83333.1.peg.5", "feature-shaped ID", TestRepGenomeIndex.PROT_A);
        original.insert("fig|511145.12.peg.7", "  padded name ", TestRepGenomeIndex.PROT_B);
        original.insert("300.3", "genome C", PROT_C);
        File dir = new File(this.tempFolder.getRoot(), "unusual");
        RepGenomeDirectory.save(original, dir);
        RepGenomeIndex loaded = RepGenomeDirectory.load(dir);
        assertEquals(original.getGenomeIds(), loaded.getGenomeIds());
        assertEquals("feature-shaped ID", loaded.get("83333.1.peg.5").getName());
        assertEquals("  padded name ", loaded.get("fig|511145.12.peg.7").getName());
        assertEquals(TestRepGenomeIndex.PROT_B, loaded.get("fig|511145.12.peg.7").getProtein());
        assertFalse(loaded.isRepresentative("83333.1"));
        // IDs that cannot be saved are rejected.
        for (String badId : new String[] { "my genome", "", "tab\tid" }) {
            try {
                original.insert(badId, "bad genome", TestRepGenomeIndex.PROT_A);
                fail("Invalid genome ID \"" + badId + "\" accepted.");
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
        assertEquals(3, original.size());
    }

    @Test
    public void testMissingFiles() throws IOException {
        File dir = this.tempFolder.newFolder("bad");
        try {
            RepGenomeDirectory.load(new File(dir, "nowhere"));
            fail("Missing directory loaded.");
        } catch (MalformedDirectoryException e) {
            // expected
        }
        writeFile(dir, RepGenomeDirectory.GENOME_FILE_NAME, "100.1\tgenome A\n");
        try {
            RepGenomeDirectory.load(dir);
            fail("Directory without proteins loaded.");
        } catch (MalformedDirectoryException e) {
            // expected
        }
        FileUtils.forceDelete(new File(dir, RepGenomeDirectory.GENOME_FILE_NAME));
        writeFile(dir, RepGenomeDirectory.PROTEIN_FILE_NAME, ">100.1\n" + TestRepGenomeIndex.PROT_A + "\n");
        try {
            RepGenomeDirectory.load(dir);
            fail("Directory without names loaded.");
        } catch (MalformedDirectoryException e) {
            // expected
        }
        writeFile(dir, RepGenomeDirectory.GENOME_FILE_NAME, "100.1\tgenome A\n");
        writeFile(dir, RepGenomeDirectory.PARM_FILE_NAME, "eight\n");
        try {
            RepGenomeDirectory.load(dir);
            fail("Invalid parameter file accepted.");
        } catch (MalformedDirectoryException e) {
            // expected
        }
    }

    @Test
    public void testParameters() throws IOException {
        File dir = this.tempFolder.newFolder("parms");
        writeFile(dir, RepGenomeDirectory.GENOME_FILE_NAME, "100.1\tgenome A\n");
        writeFile(dir, RepGenomeDirectory.PROTEIN_FILE_NAME, ">100.1\n" + TestRepGenomeIndex.PROT_A + "\n");
        RepGenomeIndex index = RepGenomeDirectory.load(dir);
        assertEquals(RepGenomeIndex.DEFAULT_K, index.getKmerSize());
        assertEquals(RepGenomeIndex.DEFAULT_SCORE, index.getThreshold());
        // An old parameter file has only the kmer size.
        writeFile(dir, RepGenomeDirectory.PARM_FILE_NAME, "10\n");
        index = RepGenomeDirectory.load(dir);
        assertEquals(10, index.getKmerSize());
        assertEquals(RepGenomeIndex.DEFAULT_SCORE, index.getThreshold());
        writeFile(dir, RepGenomeDirectory.PARM_FILE_NAME, "7\n50\n");
        index = RepGenomeDirectory.load(dir);
        assertEquals(7, index.getKmerSize());
        assertEquals(50, index.getThreshold());
        // Negative values and numbers after other text are invalid.
        for (String parms : new String[] { "8\n-5\n", "-8\n100\n", "K=8\n100\n", "8\nscore 100\n" }) {
            writeFile(dir, RepGenomeDirectory.PARM_FILE_NAME, parms);
            try {
                RepGenomeDirectory.load(dir);
                fail("Invalid parameter file \"" + parms + "\" accepted.");
            } catch (MalformedDirectoryException e) {
                // expected
            }
        }
        writeFile(dir, RepGenomeDirectory.PARM_FILE_NAME, "  9\n 0 \n");
        index = RepGenomeDirectory.load(dir);
        assertEquals(9, index.getKmerSize());
        assertEquals(0, index.getThreshold());
    }

    @Test
    public void testBadRecords() throws IOException {
        File dir = this.tempFolder.newFolder("records");
        writeFile(dir, RepGenomeDirectory.GENOME_FILE_NAME,
                "100.1\tgenome A\n200.2\tgenome B\n300.3\tgenome C\nbad line\n400.4\tgenome D\n");
        writeFile(dir, RepGenomeDirectory.PROTEIN_FILE_NAME,
                ">fig|100.1.peg.3\n" + TestRepGenomeIndex.PROT_A + "\n"
                + ">999.9\n" + TestRepGenomeIndex.PROT_B + "\n"
                + ">300.3\nMKTAY\n"
                + ">fig|200.2.peg.7\n" + TestRepGenomeIndex.PROT_B + "\n"
                + ">100.1\n" + PROT_C + "\n"
                + ">pheS 400.4 genome D\n" + PROT_C + "\n");
        writeFile(dir, RepGenomeDirectory.REP_DB_FILE_NAME,
                "500.5\t100.1\t120\n600.6\t999.9\t130\n700.7\t200.2\n800.8\t200.2\tabc\n");
        RepGenomeIndex index = RepGenomeDirectory.load(dir);
        // 999.9 has no name, 300.3 is too short, and the second 100.1 is a duplicate.
        assertEquals(3, index.size());
        assertEquals("100.1", index.getGenomeIds().get(0));
        assertEquals("200.2", index.getGenomeIds().get(1));
        assertEquals("400.4", index.getGenomeIds().get(2));
        assertEquals(TestRepGenomeIndex.PROT_A, index.get("100.1").getProtein());
        assertFalse(index.isRepresentative("999.9"));
        assertFalse(index.isRepresentative("300.3"));
        assertEquals(1, index.connectedCount());
        assertEquals(120, index.checkRep("500.5").getScore());
    }

    @Test
    public void testGenomeIds() {
        assertEquals("83333.1", RepGenomeDirectory.genomeIdOf("fig|83333.1.peg.1234"));
        assertEquals("83333.1", RepGenomeDirectory.genomeIdOf("83333.1.peg.5"));
        assertEquals("83333.1", RepGenomeDirectory.genomeIdOf("83333.1"));
        assertEquals("pheS", RepGenomeDirectory.genomeIdOf("pheS"));
        assertEquals("83333.1", RepGenomeDirectory.genomeIdOf(new Sequence("83333.1", "511145.12", "")));
        assertEquals("511145.12", RepGenomeDirectory.genomeIdOf(new Sequence("pheS", "511145.12 E. coli", "")));
        assertEquals("pheS", RepGenomeDirectory.genomeIdOf(new Sequence("pheS", "", "")));
        // A comment that does not start with a genome ID is a genome name.
        assertEquals("pheS", RepGenomeDirectory.genomeIdOf(new Sequence("pheS", "Escherichia coli K-12", "")));
    }

}
