/**
 *
 */
package org.theseed.repgen.reps;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.sequence.FastaInputStream;
import org.theseed.repgen.utils.BaseProcessor;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This is the base class for commands that read a FASTA file of marker proteins and compare them to the
 * genomes in a representative-genome directory.  The first positional parameter is the name of the
 * directory.  The FASTA file is read from the standard input.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	name of the input FASTA file (if not STDIN)
 * -o	name of the output report file (if not STDOUT)
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseQueryProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseQueryProcessor.class);
    /** representative-genome index */
    private RepGenomeIndex repDb;
    /** query input stream */
    private FastaInputStream inStream;

    // COMMAND-LINE OPTIONS

    /** input file name (if not STDIN) */
    @Option(name = "--input", aliases = { "-i" }, metaVar = "queries.faa", usage = "input FASTA file (if not STDIN)")
    private File inFile;

    /** output file name (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "report.tbl", usage = "output report file (if not STDOUT)")
    private File outFile;

    /** representative-genome directory */
    @Argument(index = 0, metaVar = "repDir", usage = "representative-genome directory", required = true)
    private File repDir;

    @Override
    protected final void setDefaults() {
        this.inFile = null;
        this.outFile = null;
        this.setQueryDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        this.validateQueryParms();
        // Load the representative-genome index.
        this.repDb = RepGenomeDirectory.load(this.repDir, this.needsConnections());
        log.info("Index has kmer size {} and minimum score {}.", this.repDb.getKmerSize(), this.repDb.getThreshold());
        // Open the query input.
        if (this.inFile == null) {
            log.info("Queries will be read from the standard input.");
            this.inStream = new FastaInputStream(System.in);
        } else if (! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
        else {
            log.info("Queries will be read from {}.", this.inFile);
            this.inStream = new FastaInputStream(this.inFile);
        }
        return true;
    }

    @Override
    protected final void runCommand() throws Exception {
        try {
            this.runQueries(this.repDb, this.inStream);
        } finally {
            this.inStream.close();
        }
    }

    /**
     * @return the output report file, or NULL to use the standard output
     */
    protected File getOutFile() {
        return this.outFile;
    }

    /**
     * @return the representative-genome directory
     */
    protected File getRepDir() {
        return this.repDir;
    }

    /**
     * @return TRUE if the represented-genome connections should be loaded
     */
    protected boolean needsConnections() {
        return false;
    }

    /**
     * Set the defaults for the subclass options.
     */
    protected abstract void setQueryDefaults();

    /**
     * Validate the subclass options.
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract void validateQueryParms() throws IOException, ParseFailureException;

    /**
     * Process the queries.
     *
     * @param repDb		representative-genome index
     * @param queries	query input stream
     *
     * @throws Exception
     */
    protected abstract void runQueries(RepGenomeIndex repDb, FastaInputStream queries) throws Exception;

}
