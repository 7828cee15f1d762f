/**
 *
 */
package org.theseed.repgen.reps;

import java.io.IOException;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.RepMatchWriter;
import org.theseed.repgen.sequence.FastaInputStream;
import org.theseed.repgen.sequence.Sequence;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command reads a FASTA file of marker proteins and counts the representative genomes at the specified
 * similarity or better for each one.
 *
 * The positional parameter is the name of the representative-genome directory.  The FASTA file is read from the
 * standard input.  The sequence IDs should be genome IDs or feature IDs, and the comments should be genome names.
 *
 * The report is tab-delimited, with each record containing (0) the genome ID, (1) the genome name, and (2) the
 * number of representatives found.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	name of the input FASTA file (if not STDIN)
 * -o	name of the output report file (if not STDOUT)
 * -m	minimum similarity score (default is the index score)
 *
 * @author Bruce Parrello
 *
 */
public class CountProcessor extends BaseQueryProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CountProcessor.class);

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
        log.info("Counting representatives with score {} or better.", min);
        int count = 0;
        int unrepCount = 0;
        try (RepMatchWriter writer = new RepMatchWriter(this.getOutFile(), repDb, min)) {
            writer.writeLine("genome_id", "genome_name", "count");
            for (Sequence query : queries) {
                count++;
                int found = repDb.countAbove(query.getSequence(), min);
                if (found == 0) unrepCount++;
                writer.writeLine(RepGenomeDirectory.genomeIdOf(query), query.getComment(),
                        Integer.toString(found));
            }
        }
        log.info("All done.  {} queries processed, {} unrepresented.", count, unrepCount);
    }

}
