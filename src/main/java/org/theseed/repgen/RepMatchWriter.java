/**
 *
 */
package org.theseed.repgen;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a utility object used in writing representative-genome reports.  The constructor creates the output
 * stream, and the output methods write tab-delimited lines.  Match results below the minimum score are held
 * back as outliers and written after a blank line when the report is closed.
 *
 * It is auto-closeable so that the outliers are written and the file is closed properly.
 *
 * @author Bruce Parrello
 *
 */
public class RepMatchWriter implements AutoCloseable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RepMatchWriter.class);
    /** output stream */
    private final PrintWriter outStream;
    /** TRUE if the output stream should be closed at the end */
    private final boolean closeFlag;
    /** index used to find representative names */
    private final RepGenomeIndex index;
    /** minimum score for a match to be in the main report */
    private final int minScore;
    /** held-back outlier lines */
    private final List<String> outliers;
    /** number of lines written */
    private int outCount;

    /**
     * Construct a match report writer.
     *
     * @param outFile	output file, or NULL to use the standard output
     * @param index		index containing the representative genomes
     * @param minScore	minimum score for a match to be in the main report
     *
     * @throws IOException
     */
    public RepMatchWriter(File outFile, RepGenomeIndex index, int minScore) throws IOException {
        OutputStream stream;
        if (outFile == null) {
            log.info("Report will be written to the standard output.");
            stream = System.out;
            this.closeFlag = false;
        } else {
            log.info("Report will be written to {}.", outFile);
            stream = new FileOutputStream(outFile);
            this.closeFlag = true;
        }
        this.outStream = new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
        this.index = index;
        this.minScore = minScore;
        this.outliers = new ArrayList<String>();
        this.outCount = 0;
    }

    /**
     * Write a line of tab-delimited fields.
     *
     * @param fields	fields to write
     */
    public void writeLine(String... fields) {
        this.outStream.print(String.join("\t", fields) + "\n");
        this.outCount++;
    }

    /**
     * Write the match result for a query.  The output line contains the query ID, the representative ID,
     * the representative's name, and the score.  If no representative was found, the ID is "<none>" and
     * the name is empty.
     *
     * @param queryId	ID of the query sequence
     * @param match		match result
     */
    public void writeMatch(String queryId, RepMatch match) {
        String repId = RepMatch.NONE;
        String repName = "";
        if (match.isFound()) {
            repId = match.getGenomeId();
            repName = this.index.get(repId).getName();
        }
        String line = String.join("\t", queryId, repId, repName, Integer.toString(match.getScore()));
        if (match.isFound() && match.getScore() >= this.minScore) {
            this.outStream.print(line + "\n");
            this.outCount++;
        } else
            this.outliers.add(line);
    }

    /**
     * @return the number of outliers held back
     */
    public int getOutlierCount() {
        return this.outliers.size();
    }

    @Override
    public void close() {
        if (! this.outliers.isEmpty()) {
            this.outStream.print("\n");
            for (String line : this.outliers)
                this.outStream.print(line + "\n");
        }
        if (this.closeFlag)
            this.outStream.close();
        else
            this.outStream.flush();
        log.info("{} lines written, {} outliers.", this.outCount, this.outliers.size());
    }

}
