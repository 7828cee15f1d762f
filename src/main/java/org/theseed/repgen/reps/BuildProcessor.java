/**
 *
 */
package org.theseed.repgen.reps;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Map;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.utils.BaseProcessor;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command builds a new representative-genome directory from a FASTA file of marker proteins and a
 * table of genome names.  Every genome in the FASTA file that has a name is made a representative, in
 * file order.  Duplicate genomes and sequences too short to produce kmers are skipped with a warning.
 *
 * The positional parameters are the name of the marker-protein FASTA file, the name of the genome-name
 * table (tab-delimited, genome ID followed by genome name), and the name of the output directory.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -K	protein kmer size (default 8)
 *
 * --score	minimum similarity score for representation (default 100)
 *
 * @author Bruce Parrello
 *
 */
public class BuildProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BuildProcessor.class);

    // COMMAND-LINE OPTIONS

    /** kmer size */
    @Option(name = "--kmer", aliases = { "-K" }, metaVar = "9", usage = "protein kmer size")
    private int kmerSize;

    /** minimum similarity score for representation */
    @Option(name = "--score", aliases = { "--minScore" }, metaVar = "200", usage = "minimum similarity score for representation")
    private int score;

    /** marker-protein FASTA file */
    @Argument(index = 0, metaVar = "markers.faa", usage = "FASTA file of marker proteins", required = true)
    private File protFile;

    /** genome-name table */
    @Argument(index = 1, metaVar = "genomes.tbl", usage = "tab-delimited file of genome IDs and names", required = true)
    private File genomeFile;

    /** output directory */
    @Argument(index = 2, metaVar = "outDir", usage = "output representative-genome directory", required = true)
    private File outDir;

    @Override
    protected void setDefaults() {
        this.kmerSize = RepGenomeIndex.DEFAULT_K;
        this.score = RepGenomeIndex.DEFAULT_SCORE;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (this.kmerSize < 1)
            throw new ParseFailureException("Kmer size must be positive.");
        if (this.score < 1)
            throw new ParseFailureException("Minimum score must be positive.");
        if (! this.protFile.canRead())
            throw new FileNotFoundException("Marker file " + this.protFile + " is not found or unreadable.");
        if (! this.genomeFile.canRead())
            throw new FileNotFoundException("Genome name file " + this.genomeFile + " is not found or unreadable.");
        if (this.outDir.isFile())
            throw new FileNotFoundException("Output directory " + this.outDir + " is a file.");
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        RepGenomeIndex repDb = new RepGenomeIndex(this.kmerSize, this.score);
        Map<String, String> names = RepGenomeDirectory.readNames(this.genomeFile);
        log.info("{} genome names read from {}.", names.size(), this.genomeFile);
        int count = RepGenomeDirectory.addProteins(repDb, this.protFile, names);
        log.info("{} representatives added from {}.", count, this.protFile);
        RepGenomeDirectory.save(repDb, this.outDir);
        log.info("All done.  {} representatives saved to {}.", repDb.size(), this.outDir);
    }

}
