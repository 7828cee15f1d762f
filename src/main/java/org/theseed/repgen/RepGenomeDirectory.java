/**
 *
 */
package org.theseed.repgen;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.sequence.FastaInputStream;
import org.theseed.repgen.sequence.FastaOutputStream;
import org.theseed.repgen.sequence.Sequence;

/**
 * This class loads and saves representative-genome indexes.  A representative-genome directory contains the
 * following files.
 *
 * 6.1.1.20.fasta		a FASTA file containing the marker protein (Phenylalanyl tRNA synthetase alpha chain)
 * 						for each representative genome; the sequence ID is the genome ID or a feature ID
 * complete.genomes		a tab-delimited file (no headers) containing the genome ID and genome name for each
 * 						representative genome
 * K					a parameter file containing the kmer size on the first line and the minimum similarity
 * 						score on the second line
 * rep_db.tbl			a tab-delimited file (no headers) containing the ID of each represented genome, the
 * 						ID of its representative, and the similarity score
 *
 * The FASTA file and the genome-name file are required.  If the parameter file is missing, the kmer size is 8
 * and the score is 100.  If the represented-genome file is missing, there are no connections.
 *
 * Saving writes all four files in the index's insertion order, so saving an unchanged index always produces
 * the same output.
 *
 * @author Bruce Parrello
 *
 */
public class RepGenomeDirectory {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RepGenomeDirectory.class);
    /** name of the marker protein FASTA file */
    public static final String PROTEIN_FILE_NAME = "6.1.1.20.fasta";
    /** name of the genome-name file */
    public static final String GENOME_FILE_NAME = "complete.genomes";
    /** name of the parameter file */
    public static final String PARM_FILE_NAME = "K";
    /** name of the represented-genome file */
    public static final String REP_DB_FILE_NAME = "rep_db.tbl";
    /** pattern for a genome ID */
    private static final Pattern GENOME_ID = Pattern.compile("\\d+\\.\\d+");
    /** pattern for a feature ID */
    private static final Pattern FEATURE_ID = Pattern.compile("(?:fig\\|)?(\\d+\\.\\d+)\\.[a-z]+\\.\\d+");
    /** pattern for a number at the start of a parameter-file line */
    private static final Pattern NUMBER = Pattern.compile("^\\s*(-?\\d+)");

    private RepGenomeDirectory() { }

    /**
     * Load a representative-genome index from a directory, including the connections.
     *
     * @param inDir		input directory
     *
     * @return the index loaded
     *
     * @throws IOException
     */
    public static RepGenomeIndex load(File inDir) throws IOException {
        return load(inDir, true);
    }

    /**
     * Load a representative-genome index from a directory.
     *
     * @param inDir			input directory
     * @param connected		TRUE to load the represented-genome connections, FALSE to skip them
     *
     * @return the index loaded
     *
     * @throws IOException
     */
    public static RepGenomeIndex load(File inDir, boolean connected) throws IOException {
        if (! inDir.isDirectory())
            throw new MalformedDirectoryException("Representative-genome directory " + inDir + " not found or invalid.");
        File protFile = new File(inDir, PROTEIN_FILE_NAME);
        File genomeFile = new File(inDir, GENOME_FILE_NAME);
        if (! protFile.canRead())
            throw new MalformedDirectoryException("Marker protein file " + protFile + " not found or unreadable.");
        if (! genomeFile.canRead())
            throw new MalformedDirectoryException("Genome name file " + genomeFile + " not found or unreadable.");
        // Read the parameters and create the index.
        int[] parms = readParms(new File(inDir, PARM_FILE_NAME));
        log.info("Loading representative genomes from {} with K = {} and score {}.", inDir, parms[0], parms[1]);
        RepGenomeIndex retVal = new RepGenomeIndex(parms[0], parms[1]);
        // Read the genome names and the proteins.
        Map<String, String> names = readNames(genomeFile);
        addProteins(retVal, protFile, names);
        // Connect the represented genomes.
        File repDbFile = new File(inDir, REP_DB_FILE_NAME);
        if (connected && repDbFile.canRead())
            readConnections(retVal, repDbFile);
        log.info("{} representative genomes and {} represented genomes loaded from {}.", retVal.size(),
                retVal.connectedCount(), inDir);
        return retVal;
    }

    /**
     * Read the parameter file.
     *
     * @param parmFile	parameter file name
     *
     * @return a two-element array containing the kmer size and the minimum score
     *
     * @throws IOException
     */
    protected static int[] readParms(File parmFile) throws IOException {
        int[] retVal = new int[] { RepGenomeIndex.DEFAULT_K, RepGenomeIndex.DEFAULT_SCORE };
        if (! parmFile.exists() || parmFile.length() == 0)
            log.info("No parameter file found:  using defaults.");
        else {
            List<String> lines = FileUtils.readLines(parmFile, StandardCharsets.UTF_8);
            // Older parameter files have only the kmer size.
            for (int i = 0; i < 2 && i < lines.size(); i++) {
                Matcher m = NUMBER.matcher(lines.get(i));
                if (! m.find())
                    throw new MalformedDirectoryException("Invalid line " + (i+1) + " in parameter file " + parmFile + ".");
                retVal[i] = Integer.parseInt(m.group(1));
            }
            if (retVal[0] < 1)
                throw new MalformedDirectoryException("Invalid kmer size in parameter file " + parmFile + ".");
            if (retVal[1] < 0)
                throw new MalformedDirectoryException("Negative score in parameter file " + parmFile + ".");
        }
        return retVal;
    }

    /**
     * Read a genome-name file.
     *
     * @param genomeFile	tab-delimited file of genome IDs and names
     *
     * @return a map from genome IDs to names
     *
     * @throws IOException
     */
    public static Map<String, String> readNames(File genomeFile) throws IOException {
        Map<String, String> retVal = new HashMap<String, String>();
        try (LineIterator iter = FileUtils.lineIterator(genomeFile, "UTF-8")) {
            while (iter.hasNext()) {
                String line = iter.next();
                String[] fields = line.split("\t", 2);
                if (fields.length < 2 || fields[0].isEmpty())
                    log.warn("WARNING: Invalid line \"{}\" in genome name file {}.", line, genomeFile);
                else
                    retVal.put(fields[0], fields[1]);
            }
        }
        log.info("{} genome names read from {}.", retVal.size(), genomeFile);
        return retVal;
    }

    /**
     * Add representative genomes to an index from a marker protein FASTA file.  Only genomes with names are
     * added.  Duplicate genomes and sequences that are too short are skipped with a warning.
     *
     * @param index			index to update
     * @param protFile		marker protein FASTA file
     * @param names			map of genome IDs to names
     *
     * @return the number of genomes added
     *
     * @throws IOException
     */
    public static int addProteins(RepGenomeIndex index, File protFile, Map<String, String> names) throws IOException {
        int inCount = 0;
        int addCount = 0;
        int skipCount = 0;
        int badCount = 0;
        try (FastaInputStream inStream = new FastaInputStream(protFile)) {
            for (Sequence seq : inStream) {
                inCount++;
                // A label that is itself in the name table is used unchanged.
                String genomeId = seq.getLabel();
                if (! names.containsKey(genomeId))
                    genomeId = genomeIdOf(seq);
                String name = names.get(genomeId);
                if (name == null) {
                    log.warn("WARNING: No name found for genome {} in {}:  skipped.", genomeId, protFile);
                    skipCount++;
                } else {
                    try {
                        index.insert(genomeId, name, seq.getSequence());
                        addCount++;
                    } catch (RepGenomeException e) {
                        log.warn("WARNING: {}  Record skipped.", e.getMessage());
                        badCount++;
                    }
                }
            }
        }
        log.info("{} proteins read from {}:  {} added, {} unnamed, {} rejected.", inCount, protFile, addCount,
                skipCount, badCount);
        return addCount;
    }

    /**
     * Read the connections for represented genomes.
     *
     * @param index			index to update
     * @param repDbFile		tab-delimited file of represented genome IDs, representative IDs, and scores
     *
     * @throws IOException
     */
    protected static void readConnections(RepGenomeIndex index, File repDbFile) throws IOException {
        try (LineIterator iter = FileUtils.lineIterator(repDbFile, "UTF-8")) {
            while (iter.hasNext()) {
                String line = iter.next();
                String[] fields = line.split("\t");
                if (fields.length < 3)
                    log.warn("WARNING: Invalid line \"{}\" in represented-genome file {}.", line, repDbFile);
                else {
                    try {
                        index.connect(fields[1], fields[0], Integer.parseInt(fields[2].trim()));
                    } catch (NumberFormatException e) {
                        log.warn("WARNING: Invalid score in line \"{}\" of represented-genome file {}.", line, repDbFile);
                    } catch (UnknownRepresentativeException e) {
                        log.warn("WARNING: {}  Genome {} not connected.", e.getMessage(), fields[0]);
                    }
                }
            }
        }
    }

    /**
     * Save a representative-genome index to a directory.  The directory is created if necessary.
     *
     * @param index		index to save
     * @param outDir	output directory
     *
     * @throws IOException
     */
    public static void save(RepGenomeIndex index, File outDir) throws IOException {
        FileUtils.forceMkdir(outDir);
        try (PrintWriter parmStream = new PrintWriter(new File(outDir, PARM_FILE_NAME), "UTF-8")) {
            parmStream.print(index.getKmerSize() + "\n" + index.getThreshold() + "\n");
        }
        try (PrintWriter genomeStream = new PrintWriter(new File(outDir, GENOME_FILE_NAME), "UTF-8");
                FastaOutputStream protStream = new FastaOutputStream(new File(outDir, PROTEIN_FILE_NAME));
                PrintWriter repStream = new PrintWriter(new File(outDir, REP_DB_FILE_NAME), "UTF-8")) {
            for (RepGenome rep : index) {
                String genomeId = rep.getGenomeId();
                genomeStream.print(genomeId + "\t" + rep.getName() + "\n");
                protStream.write(new Sequence(genomeId, "", rep.getProtein()));
                for (Map.Entry<String, Integer> represented : rep.getRepresented().entrySet())
                    repStream.print(represented.getKey() + "\t" + genomeId + "\t" + represented.getValue() + "\n");
            }
        }
        log.info("{} representative genomes saved to {}.", index.size(), outDir);
    }

    /**
     * Compute the genome ID for a marker sequence.  If the label is a genome ID, it is used directly.  If it
     * is a feature ID, the genome ID is extracted from it.  Otherwise, the comment is used if it begins with a
     * genome ID, and the label is used if not.
     *
     * @param seq	marker sequence read from a FASTA file
     *
     * @return the ID of the genome containing the marker
     */
    public static String genomeIdOf(Sequence seq) {
        String label = seq.getLabel();
        String retVal = label;
        if (! GENOME_ID.matcher(label).matches()) {
            retVal = genomeIdOf(label);
            if (retVal.equals(label)) {
                String first = seq.getComment().split("\\s+", 2)[0];
                if (GENOME_ID.matcher(first).matches())
                    retVal = first;
            }
        }
        return retVal;
    }

    /**
     * Compute the genome ID for a sequence label.  Feature IDs are converted to the ID of the genome
     * containing the feature.  Any other label is returned unchanged.
     *
     * @param label		sequence label to convert
     *
     * @return the genome ID for the label
     */
    public static String genomeIdOf(String label) {
        String retVal = label;
        Matcher m = FEATURE_ID.matcher(label);
        if (m.matches())
            retVal = m.group(1);
        return retVal;
    }

}
