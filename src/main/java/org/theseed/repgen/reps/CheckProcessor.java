/**
 *
 */
package org.theseed.repgen.reps;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeException;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.RepMatch;
import org.theseed.repgen.UnknownRepresentativeException;
import org.theseed.repgen.sequence.FastaInputStream;
import org.theseed.repgen.sequence.Sequence;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command checks a FASTA file of genome marker proteins against a representative-genome directory.  Each
 * genome that is not already a representative or a represented genome is compared to the representatives.  If
 * its best score meets the index score, it is connected to the best representative.  Otherwise it becomes a
 * new representative, so that later genomes in the file can be represented by it.  The updated index is saved
 * to an output directory.
 *
 * The positional parameters are the name of the input representative-genome directory and the name of the output
 * directory.  The FASTA file is read from the standard input.  The sequence IDs should be genome IDs or feature
 * IDs, and the comments should be genome names.
 *
 * Genomes that could not be represented are listed in the file "outliers.tbl" in the output directory.  Each record
 * contains (0) the genome ID, (1) the genome name, (2) the closest representative ID, and (3) its score.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	name of the input FASTA file (if not STDIN)
 *
 * --checkOnly	if specified, unrepresented genomes are not added as new representatives
 * --middle		if positive, genomes whose best score is at least this value but below the index score are
 * 				listed in the file "middle.tbl" in the output directory (default 0)
 *
 * @author Bruce Parrello
 *
 */
public class CheckProcessor extends BaseQueryProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CheckProcessor.class);
    /** name of the outlier file */
    public static final String OUTLIER_FILE_NAME = "outliers.tbl";
    /** name of the middle-distance file */
    public static final String MIDDLE_FILE_NAME = "middle.tbl";

    // COMMAND-LINE OPTIONS

    /** TRUE to leave the representative set unchanged */
    @Option(name = "--checkOnly", usage = "if specified, no new representatives will be added")
    private boolean checkOnly;

    /** minimum score for a middle-distance genome */
    @Option(name = "--middle", metaVar = "50", usage = "if positive, minimum score for a genome to be listed as middle-distance")
    private int middleScore;

    /** output directory */
    @Argument(index = 1, metaVar = "outDir", usage = "output representative-genome directory", required = true)
    private File outDir;

    @Override
    protected void setQueryDefaults() {
        this.checkOnly = false;
        this.middleScore = 0;
    }

    @Override
    protected void validateQueryParms() throws IOException, ParseFailureException {
        if (this.middleScore < 0)
            throw new ParseFailureException("Middle score cannot be negative.");
        if (this.outDir.isFile())
            throw new ParseFailureException("Output directory " + this.outDir + " is a file.");
    }

    @Override
    protected boolean needsConnections() {
        return true;
    }

    @Override
    protected void runQueries(RepGenomeIndex repDb, FastaInputStream queries) throws Exception {
        int minScore = repDb.getThreshold();
        if (this.middleScore >= minScore)
            log.warn("WARNING: middle score {} is not below index score {}.  No middle genomes will be found.",
                    this.middleScore, minScore);
        FileUtils.forceMkdir(this.outDir);
        int count = 0;
        int repCount = 0;
        int alreadyCount = 0;
        int connectCount = 0;
        int newCount = 0;
        int middleCount = 0;
        int outlierCount = 0;
        File middleFile = new File(this.outDir, MIDDLE_FILE_NAME);
        try (PrintWriter outliers = new PrintWriter(new File(this.outDir, OUTLIER_FILE_NAME), "UTF-8");
                PrintWriter middles = (this.middleScore > 0 ? new PrintWriter(middleFile, "UTF-8") : null)) {
            for (Sequence query : queries) {
                count++;
                String genomeId = RepGenomeDirectory.genomeIdOf(query);
                String name = query.getComment();
                if (repDb.isRepresentative(genomeId))
                    repCount++;
                else if (repDb.checkRep(genomeId).isFound())
                    alreadyCount++;
                else {
                    RepMatch match = repDb.bestMatch(query.getSequence());
                    if (match.isFound() && match.getScore() >= minScore) {
                        this.connect(repDb, match, genomeId);
                        connectCount++;
                    } else {
                        if (middles != null && match.getScore() >= this.middleScore) {
                            middles.print(formatLine(genomeId, name, match));
                            middleCount++;
                        }
                        boolean added = false;
                        if (! this.checkOnly) {
                            try {
                                repDb.insert(genomeId, name, query.getSequence());
                                added = true;
                                newCount++;
                            } catch (RepGenomeException e) {
                                log.warn("WARNING: {}  Genome not added.", e.getMessage());
                            }
                        }
                        if (! added) {
                            outliers.print(formatLine(genomeId, name, match));
                            outlierCount++;
                        }
                    }
                }
                if (count % 100 == 0)
                    log.info("{} genomes processed.  {} connected, {} new representatives.", count, connectCount,
                            newCount);
            }
        }
        RepGenomeDirectory.save(repDb, this.outDir);
        log.info("All done.  {} genomes read, {} already representatives, {} already represented, {} connected, "
                + "{} new representatives, {} middle-distance, {} outliers.", count, repCount, alreadyCount,
                connectCount, newCount, middleCount, outlierCount);
    }

    /**
     * Connect a genome to the representative it matched.
     *
     * @param repDb		representative-genome index
     * @param match		best match for the genome
     * @param genomeId	ID of the genome to connect
     */
    private void connect(RepGenomeIndex repDb, RepMatch match, String genomeId) {
        try {
            repDb.connect(match.getGenomeId(), genomeId, match.getScore());
        } catch (UnknownRepresentativeException e) {
            // The match came from the index itself.
            throw new IllegalStateException(e);
        }
    }

    /**
     * @return an output line describing a genome and its closest representative
     *
     * @param genomeId	ID of the genome
     * @param name		name of the genome
     * @param match		closest representative found
     */
    private static String formatLine(String genomeId, String name, RepMatch match) {
        String repId = (match.isFound() ? match.getGenomeId() : RepMatch.NONE);
        return genomeId + "\t" + name + "\t" + repId + "\t" + match.getScore() + "\n";
    }

}
