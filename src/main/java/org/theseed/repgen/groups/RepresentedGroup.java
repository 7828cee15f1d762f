/**
 *
 */
package org.theseed.repgen.groups;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.theseed.repgen.RepGenome;

/**
 * This object describes the group of genomes represented by a single representative genome.  It contains the
 * representative, the score threshold used to build the group, and a map from each member genome ID to its
 * similarity score.  Every member's score is at least the threshold.
 *
 * @author Bruce Parrello
 *
 */
public class RepresentedGroup {

    // FIELDS
    /** representative genome */
    private final RepGenome rep;
    /** minimum score for membership */
    private final int threshold;
    /** map of member genome IDs to scores */
    private final Map<String, Integer> members;

    /**
     * Create an empty represented group.
     *
     * @param rep			representative genome
     * @param threshold		minimum score for membership
     */
    public RepresentedGroup(RepGenome rep, int threshold) {
        this.rep = rep;
        this.threshold = threshold;
        this.members = new LinkedHashMap<String, Integer>();
    }

    /**
     * Add a member to this group.
     *
     * @param genomeId	ID of the member genome
     * @param score		similarity score to the representative
     */
    public void add(String genomeId, int score) {
        if (score < this.threshold)
            throw new IllegalArgumentException("Score " + score + " for " + genomeId + " is below the threshold " +
                    this.threshold + " for group " + this.rep.getGenomeId() + ".");
        this.members.put(genomeId, score);
    }

    /**
     * @return the ID of the representative genome
     */
    public String getRepId() {
        return this.rep.getGenomeId();
    }

    /**
     * @return the representative genome
     */
    public RepGenome getRep() {
        return this.rep;
    }

    /**
     * @return the minimum score for membership
     */
    public int getThreshold() {
        return this.threshold;
    }

    /**
     * @return an unmodifiable map of member genome IDs to scores
     */
    public Map<String, Integer> getMembers() {
        return Collections.unmodifiableMap(this.members);
    }

    /**
     * @return TRUE if the specified genome is a member of this group
     *
     * @param genomeId	ID of the genome of interest
     */
    public boolean contains(String genomeId) {
        return this.members.containsKey(genomeId);
    }

    /**
     * @return the score of a member, or 0 if the genome is not a member
     *
     * @param genomeId	ID of the genome of interest
     */
    public int getScore(String genomeId) {
        return this.members.getOrDefault(genomeId, 0);
    }

    /**
     * @return the number of members
     */
    public int size() {
        return this.members.size();
    }

    @Override
    public String toString() {
        return String.format("R%d %s (%s)", this.threshold, this.rep.getGenomeId(), this.rep.getName());
    }

}
