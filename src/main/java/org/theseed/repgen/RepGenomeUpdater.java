/**
 *
 */
package org.theseed.repgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object merges the representative genomes of one index into another as represented genomes.  For each
 * source representative that is not already a representative or a represented genome in the target, the
 * closest target representative is found.  If its score meets the target's threshold, the source genome is
 * connected to it.  Otherwise the source genome is unrepresentable and is left out.
 *
 * @author Bruce Parrello
 *
 */
public class RepGenomeUpdater {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RepGenomeUpdater.class);
    /** target index */
    private final RepGenomeIndex target;
    /** number of source genomes that are target representatives */
    private int repCount;
    /** number of source genomes already represented in the target */
    private int alreadyCount;
    /** number of source genomes connected */
    private int foundCount;
    /** list of source genomes that could not be represented */
    private final List<RepGenome> unrepresented;

    /**
     * Construct an updater for a target index.
     *
     * @param target	index to receive the new connections
     * @param clear		TRUE to erase the target's existing connections first
     */
    public RepGenomeUpdater(RepGenomeIndex target, boolean clear) {
        this.target = target;
        if (clear) {
            log.info("Erasing {} existing connections in target.", target.connectedCount());
            target.clearConnections();
        }
        this.repCount = 0;
        this.alreadyCount = 0;
        this.foundCount = 0;
        this.unrepresented = new ArrayList<RepGenome>();
    }

    /**
     * Merge the representatives of a source index into the target.
     *
     * @param source	source index
     */
    public void merge(RepGenomeIndex source) {
        if (source.getKmerSize() != this.target.getKmerSize() || source.getType() != this.target.getType())
            throw new IllegalArgumentException("Source kmer size " + source.getKmerSize() +
                    " is incompatible with target kmer size " + this.target.getKmerSize() + ".");
        int score = this.target.getThreshold();
        log.info("Target score is {}.  {} source genomes to process.", score, source.size());
        int count = 0;
        for (RepGenome genome : source) {
            String genomeId = genome.getGenomeId();
            if (this.target.isRepresentative(genomeId))
                this.repCount++;
            else if (this.target.checkRep(genomeId).isFound())
                this.alreadyCount++;
            else {
                RepMatch match = this.target.bestMatch(genome.getKmers());
                if (! match.isFound() || match.getScore() < score) {
                    log.info("{} has no representatives.", genome);
                    this.unrepresented.add(genome);
                } else {
                    try {
                        this.target.connect(match.getGenomeId(), genomeId, match.getScore());
                    } catch (UnknownRepresentativeException e) {
                        // The match came from the target itself.
                        throw new IllegalStateException(e);
                    }
                    this.foundCount++;
                }
            }
            count++;
            if (count % 100 == 0)
                log.info("{} genomes processed, {} representatives found.", count, this.foundCount);
        }
    }

    /**
     * @return the number of source genomes that were already target representatives
     */
    public int getRepCount() {
        return this.repCount;
    }

    /**
     * @return the number of source genomes that were already represented in the target
     */
    public int getAlreadyCount() {
        return this.alreadyCount;
    }

    /**
     * @return the number of source genomes connected to a target representative
     */
    public int getFoundCount() {
        return this.foundCount;
    }

    /**
     * @return the source genomes that could not be represented
     */
    public List<RepGenome> getUnrepresented() {
        return Collections.unmodifiableList(this.unrepresented);
    }

}
