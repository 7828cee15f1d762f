/**
 *
 */
package org.theseed.repgen.reps;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.RepMatchWriter;
import org.theseed.repgen.sequence.FastaInputStream;
import org.theseed.repgen.sequence.KmerSet;
import org.theseed.repgen.sequence.Sequence;
import org.theseed.repgen.sequence.SimilarityScorer;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command measures each marker protein in a FASTA file against all the representative genomes that
 * represent it.  If a genome is close to three representatives, three measurements are output.  Genomes
 * that are themselves representatives are skipped.
 *
 * The positional parameter is the name of the representative-genome directory.  The FASTA file is read from the
 * standard input.  The sequence IDs should be genome IDs or feature IDs.
 *
 * The report is tab-delimited, with each record containing (0) the query genome ID, (1) the representative
 * genome ID, and (2) the measurement.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	name of the input FASTA file (if not STDIN)
 * -o	name of the output report file (if not STDOUT)
 *
 * --measure	scoring strategy for the output (RAW, SCALED, or DISTANCE; default DISTANCE)
 *
 * @author Bruce Parrello
 *
 */
public class DistanceProcessor extends BaseQueryProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DistanceProcessor.class);

    // COMMAND-LINE OPTIONS

    /** scoring strategy */
    @Option(name = "--measure", aliases = { "--scoring" }, usage = "scoring strategy for output measurements")
    private SimilarityScorer.Type measure;

    @Override
    protected void setQueryDefaults() {
        this.measure = SimilarityScorer.Type.DISTANCE;
    }

    @Override
    protected void validateQueryParms() throws IOException, ParseFailureException {
        log.info("Output measure is {}.", this.measure);
    }

    @Override
    protected void runQueries(RepGenomeIndex repDb, FastaInputStream queries) throws Exception {
        int minScore = repDb.getThreshold();
        int count = 0;
        int repCount = 0;
        int unrepCount = 0;
        int multiCount = 0;
        int outCount = 0;
        try (RepMatchWriter writer = new RepMatchWriter(this.getOutFile(), repDb, minScore)) {
            writer.writeLine("genome1", "genome2", this.measure.name().toLowerCase(Locale.ROOT));
            for (Sequence query : queries) {
                count++;
                String genomeId = RepGenomeDirectory.genomeIdOf(query);
                if (repDb.isRepresentative(genomeId))
                    repCount++;
                else {
                    KmerSet kmers = repDb.kmersOf(query.getSequence());
                    Map<String, Integer> reps = repDb.matchesAbove(kmers, minScore);
                    if (reps.isEmpty()) {
                        log.warn("WARNING: Genome {} is unrepresented.", genomeId);
                        unrepCount++;
                    } else if (reps.size() > 1)
                        multiCount++;
                    for (String repId : reps.keySet()) {
                        double value = this.measure.score(kmers, repDb.get(repId).getKmers());
                        writer.writeLine(genomeId, repId, this.measure.format(value));
                        outCount++;
                    }
                }
                if (count % 100 == 0)
                    log.info("{} input genomes processed.", count);
            }
        }
        log.info("All done.  {} genomes read, {} representatives skipped, {} unrepresented, {} multiply-represented, {} measurements output.",
                count, repCount, unrepCount, multiCount, outCount);
    }

}
