/**
 *
 */
package org.theseed.repgen.reps;

import java.io.IOException;
import java.util.List;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.RepMatch;
import org.theseed.repgen.RepMatchWriter;
import org.theseed.repgen.sequence.FastaInputStream;
import org.theseed.repgen.sequence.Sequence;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command lists the closest representative genomes for each marker protein in a FASTA file.  For each
 * query, the best N representatives with the minimum score or better are listed, highest score first.
 *
 * The positional parameter is the name of the representative-genome directory.  The FASTA file is read from the
 * standard input.
 *
 * The report is tab-delimited, with each record containing (0) the query sequence ID, (1) the representative
 * genome ID, (2) the representative genome name, and (3) the similarity score.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	name of the input FASTA file (if not STDIN)
 * -o	name of the output report file (if not STDOUT)
 * -m	minimum similarity score (default is the index score)
 * -n	number of representatives to list per query (default 1)
 *
 * @author Bruce Parrello
 *
 */
public class CloseProcessor extends BaseQueryProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CloseProcessor.class);

    // COMMAND-LINE OPTIONS

    /** minimum similarity score */
    @Option(name = "--min", aliases = { "-m", "--minScore" }, metaVar = "100",
            usage = "minimum score for a representative (default is the index score)")
    private int minScore;

    /** number of representatives to keep */
    @Option(name = "--nBest", aliases = { "-n", "--N" }, metaVar = "5", usage = "number of representatives to list per query")
    private int nBest;

    @Override
    protected void setQueryDefaults() {
        this.minScore = -1;
        this.nBest = 1;
    }

    @Override
    protected void validateQueryParms() throws IOException, ParseFailureException {
        if (this.minScore < -1)
            throw new ParseFailureException("Minimum score cannot be negative.");
        if (this.nBest < 1)
            throw new ParseFailureException("Number of representatives must be at least 1.");
    }

    @Override
    protected void runQueries(RepGenomeIndex repDb, FastaInputStream queries) throws Exception {
        int min = (this.minScore < 0 ? repDb.getThreshold() : this.minScore);
        log.info("Listing up to {} representatives with score {} or better.", this.nBest, min);
        int count = 0;
        int unrepCount = 0;
        try (RepMatchWriter writer = new RepMatchWriter(this.getOutFile(), repDb, min)) {
            writer.writeLine("id", "rep_id", "genome_name", "similarity");
            for (Sequence query : queries) {
                count++;
                List<RepMatch> found = repDb.findClosest(query.getSequence(), this.nBest, min);
                if (found.isEmpty()) {
                    log.debug("No representatives found for {}.", query);
                    unrepCount++;
                }
                for (RepMatch match : found)
                    writer.writeMatch(query.getLabel(), match);
            }
        }
        log.info("All done.  {} queries processed, {} without representatives.", count, unrepCount);
    }

}
