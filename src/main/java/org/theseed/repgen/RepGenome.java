/**
 *
 */
package org.theseed.repgen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.theseed.repgen.sequence.KmerSet;
import org.theseed.repgen.sequence.SimilarityScorer;

/**
 * This object describes a representative genome.  It contains the genome ID and name, the sequence of the
 * marker protein, and the kmer set of the marker protein.  The kmer set is computed once, at construction.
 *
 * A representative genome also tracks the genomes connected to it (the genomes it represents) along with
 * their similarity scores, in the order they were connected.
 *
 * @author Bruce Parrello
 *
 */
public class RepGenome {

    // FIELDS
    /** ID of the genome */
    private final String genomeId;
    /** name of the genome */
    private final String name;
    /** marker protein sequence */
    private final String protein;
    /** kmers of the marker protein */
    private final KmerSet kmers;
    /** map of represented genome IDs to similarity scores */
    private final Map<String, Integer> represented;

    /**
     * Construct a representative genome.
     *
     * @param genomeId		ID of the genome
     * @param name			name of the genome
     * @param protein		marker protein sequence
     * @param k				kmer size
     * @param type			sequence type
     *
     * @throws SequenceTooShortException	if the marker sequence is not longer than the kmer size
     */
    public RepGenome(String genomeId, String name, String protein, int k, KmerSet.Type type)
            throws SequenceTooShortException {
        if (protein.length() <= k)
            throw new SequenceTooShortException(genomeId, protein.length(), k);
        this.genomeId = genomeId;
        this.name = name;
        this.protein = protein;
        this.kmers = KmerSet.extract(protein, k, type);
        this.represented = new LinkedHashMap<String, Integer>();
    }

    /**
     * @return the number of kmers in common with the specified kmer set
     *
     * @param other		kmer set to compare
     */
    public int similarity(KmerSet other) {
        return SimilarityScorer.score(this.kmers, other);
    }

    /**
     * @return the number of kmers in common with another representative genome
     *
     * @param other		genome to compare
     */
    public int similarity(RepGenome other) {
        return this.similarity(other.kmers);
    }

    /**
     * @return the kmer distance to another representative genome
     *
     * @param other		genome to compare
     */
    public double distance(RepGenome other) {
        return SimilarityScorer.Type.DISTANCE.score(this.kmers, other.kmers);
    }

    /**
     * Record a genome as represented by this one.  If the genome is already present, its score is
     * updated.
     *
     * @param genome	ID of the represented genome
     * @param score		similarity score
     */
    protected void addGenome(String genome, int score) {
        this.represented.put(genome, score);
    }

    /**
     * Remove a genome from this representative's list.
     *
     * @param genome	ID of the genome to remove
     */
    protected void removeGenome(String genome) {
        this.represented.remove(genome);
    }

    /**
     * Remove all the represented genomes.
     */
    protected void clearGenomes() {
        this.represented.clear();
    }

    /**
     * @return the similarity score of a represented genome, or 0 if it is not represented by this one
     *
     * @param genome	ID of the genome of interest
     */
    public int getScore(String genome) {
        return this.represented.getOrDefault(genome, 0);
    }

    /**
     * @return an unmodifiable map of represented genome IDs to scores, in connection order
     */
    public Map<String, Integer> getRepresented() {
        return Collections.unmodifiableMap(this.represented);
    }

    /**
     * @return the genome ID
     */
    public String getGenomeId() {
        return this.genomeId;
    }

    /**
     * @return the genome name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the marker protein sequence
     */
    public String getProtein() {
        return this.protein;
    }

    /**
     * @return the kmer set of the marker protein
     */
    public KmerSet getKmers() {
        return this.kmers;
    }

    @Override
    public int hashCode() {
        return this.genomeId.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RepGenome)) {
            return false;
        }
        RepGenome other = (RepGenome) obj;
        return this.genomeId.equals(other.genomeId);
    }

    @Override
    public String toString() {
        return this.genomeId + " (" + this.name + ")";
    }

}
