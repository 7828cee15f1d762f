/**
 *
 */
package org.theseed.repgen.reps;

import java.io.IOException;

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
 * This command reads a FASTA file of marker proteins and lists the closest representative genome for each one,
 * along with the similarity score.
 *
 * The positional parameter is the name of the representative-genome directory.  The FASTA file is read from the
 * standard input.
 *
 * The report is tab-delimited, with each record containing (0) the query sequence ID, (1) the representative
 * genome ID, (2) the representative genome name, and (3) the similarity score.  Queries whose best score is
 * below the minimum are listed at the end, after a blank line.  A query with no representative is shown with
 * a representative ID of "<none>".
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	name of the input FASTA file (if not STDIN)
 * -o	name of the output report file (if not STDOUT)
 * -m	minimum score for a query to be considered represented (default is the index score)
 *
 * @author Bruce Parrello
 *
 */
public class ListProcessor extends BaseQueryProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ListProcessor.class);

    // COMMAND-LINE OPTIONS

    /** minimum similarity score */
    @Option(name = "--min", aliases = { "-m", "--minScore" }, metaVar = "100",
            usage = "minimum score for a representative (default is the index score)")
    private int minScore;

    @Override
    protected void setQueryDefaults() {
        this.minScore = -1;
    }

    @Override
    protected void validateQueryParms() throws IOException, ParseFailureException {
        if (this.minScore < -1)
            throw new ParseFailureException("Minimum score cannot be negative.");
    }

    @Override
    protected void runQueries(RepGenomeIndex repDb, FastaInputStream queries) throws Exception {
        int min = (this.minScore < 0 ? repDb.getThreshold() : this.minScore);
        log.info("Minimum score for output is {}.", min);
        int count = 0;
        try (RepMatchWriter writer = new RepMatchWriter(this.getOutFile(), repDb, min)) {
            writer.writeLine("id", "rep_id", "genome_name", "similarity");
            for (Sequence query : queries) {
                count++;
                RepMatch match = repDb.bestMatch(query.getSequence());
                writer.writeMatch(query.getLabel(), match);
                if (log.isInfoEnabled() && count % 5000 == 0)
                    log.info("{} queries processed.", count);
            }
            log.info("All done.  {} queries processed, {} outliers.", count, writer.getOutlierCount());
        }
    }

}
