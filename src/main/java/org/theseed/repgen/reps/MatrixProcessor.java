/**
 *
 */
package org.theseed.repgen.reps;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.RepMatch;
import org.theseed.repgen.RepMatchWriter;
import org.theseed.repgen.utils.BaseProcessor;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command computes the similarities between the representative genomes in a directory.  Every pair of
 * representatives with the minimum score or better is written to the output, with each pair listed once.
 *
 * The positional parameter is the name of the representative-genome directory.
 *
 * The report is tab-delimited, with each record containing (0) the first genome ID, (1) the second genome ID,
 * and (2) the similarity score.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	name of the output report file (if not STDOUT)
 * -m	minimum similarity score (default 25)
 *
 * --lists	if specified, a file "repLists.tbl" will be written to the directory; each line contains a
 * 			representative genome ID followed by the IDs of its neighbors, closest first
 *
 * @author Bruce Parrello
 *
 */
public class MatrixProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MatrixProcessor.class);
    /** representative-genome index */
    private RepGenomeIndex repDb;
    /** name of the neighbor-list file */
    public static final String LIST_FILE_NAME = "repLists.tbl";

    // COMMAND-LINE OPTIONS

    /** output file name (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "matrix.tbl", usage = "output report file (if not STDOUT)")
    private File outFile;

    /** minimum similarity score */
    @Option(name = "--min", aliases = { "-m", "--minScore" }, metaVar = "25", usage = "minimum similarity score for output")
    private int minScore;

    /** TRUE to write the neighbor lists */
    @Option(name = "--lists", usage = "if specified, neighbor lists will be written to the directory")
    private boolean listFlag;

    /** representative-genome directory */
    @Argument(index = 0, metaVar = "repDir", usage = "representative-genome directory", required = true)
    private File repDir;

    @Override
    protected void setDefaults() {
        this.outFile = null;
        this.minScore = 25;
        this.listFlag = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (this.minScore < 1)
            throw new ParseFailureException("Minimum score must be positive.");
        this.repDb = RepGenomeDirectory.load(this.repDir, false);
        if (this.minScore > this.repDb.getThreshold())
            log.warn("WARNING: minimum score {} is higher than index score {}.  Few neighbors will be found.",
                    this.minScore, this.repDb.getThreshold());
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        log.info("Computing pair similarities for {} representative genomes.", this.repDb.size());
        List<RepGenomeIndex.Pair> pairs = this.repDb.pairsAbove(this.minScore);
        try (RepMatchWriter writer = new RepMatchWriter(this.outFile, this.repDb, this.minScore)) {
            writer.writeLine("genome1", "genome2", "score");
            for (RepGenomeIndex.Pair pair : pairs)
                writer.writeLine(pair.getGenome1(), pair.getGenome2(), Integer.toString(pair.getScore()));
        }
        if (this.listFlag) {
            File listFile = new File(this.repDir, LIST_FILE_NAME);
            log.info("Writing neighbor lists to {}.", listFile);
            Map<String, List<RepMatch>> neighbors = neighborLists(this.repDb, pairs);
            try (PrintWriter listStream = new PrintWriter(listFile, "UTF-8")) {
                for (Map.Entry<String, List<RepMatch>> neighborList : neighbors.entrySet()) {
                    StringBuilder line = new StringBuilder(neighborList.getKey());
                    for (RepMatch neighbor : neighborList.getValue())
                        line.append('\t').append(neighbor.getGenomeId());
                    listStream.print(line + "\n");
                }
            }
        }
        log.info("All done.  {} pairs output.", pairs.size());
    }

    /**
     * Compute the neighbor list of each representative genome from the close pairs.
     *
     * @param repDb		representative-genome index
     * @param pairs		list of close pairs
     *
     * @return a map from each representative ID to its neighbors, closest first with ties in index order
     */
    public static Map<String, List<RepMatch>> neighborLists(RepGenomeIndex repDb, List<RepGenomeIndex.Pair> pairs) {
        Map<String, List<RepMatch>> retVal = new LinkedHashMap<String, List<RepMatch>>(repDb.size() * 4 / 3 + 1);
        for (String genomeId : repDb.getGenomeIds())
            retVal.put(genomeId, new ArrayList<RepMatch>());
        // Pairs are in index order of the first genome, so each list is filled in index order of the neighbor.
        for (RepGenomeIndex.Pair pair : pairs) {
            retVal.get(pair.getGenome1()).add(new RepMatch(pair.getGenome2(), pair.getScore()));
            retVal.get(pair.getGenome2()).add(new RepMatch(pair.getGenome1(), pair.getScore()));
        }
        for (List<RepMatch> list : retVal.values())
            list.sort(Comparator.comparingInt(RepMatch::getScore).reversed());
        return retVal;
    }

}
