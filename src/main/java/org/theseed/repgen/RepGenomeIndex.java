/**
 *
 */
package org.theseed.repgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.sequence.KmerSet;

/**
 * This object is a representative-genome index.  It contains an ordered list of representative genomes, each
 * identified by the kmer set of a single marker protein, along with the kmer size and the minimum similarity
 * score used to build the representative set.  A query protein is scored against every representative using
 * the number of kmers in common.
 *
 * The insertion order of the representatives is stored explicitly.  All searches run through the genomes in
 * insertion order, and ties are always won by the first-inserted representative, so the results are
 * reproducible for an unchanged index.
 *
 * The index also remembers which genomes are represented by each representative.  A represented genome
 * belongs to at most one representative at a time.
 *
 * @author Bruce Parrello
 *
 */
public class RepGenomeIndex implements Iterable<RepGenome> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RepGenomeIndex.class);
    /** kmer size */
    private final int kmerSize;
    /** minimum similarity score for a genome to be represented */
    private final int threshold;
    /** sequence type */
    private final KmerSet.Type type;
    /** representative genomes in insertion order */
    private final List<RepGenome> genomeList;
    /** map of genome IDs to representative genomes */
    private final Map<String, RepGenome> genomeMap;
    /** map of represented genome IDs to their representatives */
    private final Map<String, RepGenome> repMap;
    /** default kmer size */
    public static final int DEFAULT_K = KmerSet.DEFAULT_PROTEIN_K;
    /** default minimum similarity score */
    public static final int DEFAULT_SCORE = 100;
    /** pattern for white space in a genome ID */
    private static final Pattern WHITE_SPACE = Pattern.compile("\\s");

    /**
     * Create an empty protein index with the default parameters.
     */
    public RepGenomeIndex() {
        this(DEFAULT_K, DEFAULT_SCORE);
    }

    /**
     * Create an empty protein index.
     *
     * @param k			kmer size
     * @param score		minimum similarity score for a genome to be represented
     */
    public RepGenomeIndex(int k, int score) {
        this(k, score, KmerSet.Type.PROTEIN);
    }

    /**
     * Create an empty index.
     *
     * @param k			kmer size
     * @param score		minimum similarity score for a genome to be represented
     * @param type		type of marker sequence
     */
    public RepGenomeIndex(int k, int score, KmerSet.Type type) {
        if (k < 1)
            throw new IllegalArgumentException("Kmer size must be positive.");
        this.kmerSize = k;
        this.threshold = score;
        this.type = type;
        this.genomeList = new ArrayList<RepGenome>();
        this.genomeMap = new HashMap<String, RepGenome>();
        this.repMap = new HashMap<String, RepGenome>();
    }

    /**
     * Add a representative genome to this index.
     *
     * @param genomeId		ID of the new genome
     * @param name			name of the new genome
     * @param sequence		marker sequence of the new genome
     *
     * @return the representative-genome object added
     *
     * @throws DuplicateGenomeException		if the genome is already a representative
     * @throws SequenceTooShortException	if the sequence is not longer than the kmer size
     * @throws IllegalArgumentException		if the genome ID is empty or contains white space
     */
    public RepGenome insert(String genomeId, String name, String sequence)
            throws DuplicateGenomeException, SequenceTooShortException {
        // Genome IDs are saved as FASTA labels and table keys.
        if (genomeId.isEmpty() || WHITE_SPACE.matcher(genomeId).find())
            throw new IllegalArgumentException("Invalid genome ID \"" + genomeId + "\".");
        if (this.genomeMap.containsKey(genomeId))
            throw new DuplicateGenomeException(genomeId);
        RepGenome retVal = new RepGenome(genomeId, name, sequence, this.kmerSize, this.type);
        this.genomeList.add(retVal);
        this.genomeMap.put(genomeId, retVal);
        return retVal;
    }

    /**
     * @return TRUE if the specified genome is a representative in this index
     *
     * @param genomeId	ID of the genome to check
     */
    public boolean isRepresentative(String genomeId) {
        return this.genomeMap.containsKey(genomeId);
    }

    /**
     * @return the representative genome with the specified ID, or NULL if it is not in the index
     *
     * @param genomeId	ID of the desired genome
     */
    public RepGenome get(String genomeId) {
        return this.genomeMap.get(genomeId);
    }

    /**
     * @return the kmer set of a query sequence computed with this index's parameters
     *
     * @param sequence	sequence to process
     */
    public KmerSet kmersOf(String sequence) {
        return KmerSet.extract(sequence, this.kmerSize, this.type);
    }

    /**
     * Find the closest representative to a query sequence.
     *
     * @param sequence	query sequence
     *
     * @return the closest representative and its score, or a no-match result if no representative shares a kmer
     */
    public RepMatch bestMatch(String sequence) {
        return this.bestMatch(this.kmersOf(sequence));
    }

    /**
     * Find the closest representative to a query kmer set.  Ties go to the representative inserted first.
     *
     * @param kmers		kmer set of the query
     *
     * @return the closest representative and its score, or a no-match result if no representative shares a kmer
     */
    public RepMatch bestMatch(KmerSet kmers) {
        RepGenome best = null;
        int bestScore = 0;
        if (! kmers.isEmpty()) {
            for (RepGenome rep : this.genomeList) {
                int score = rep.similarity(kmers);
                if (score > bestScore) {
                    best = rep;
                    bestScore = score;
                }
            }
        }
        RepMatch retVal;
        if (best == null)
            retVal = RepMatch.none();
        else
            retVal = new RepMatch(best.getGenomeId(), bestScore);
        return retVal;
    }

    /**
     * Find all the representatives with a specified similarity or better to a query sequence.
     *
     * @param sequence	query sequence
     * @param minScore	minimum acceptable score
     *
     * @return a map from representative IDs to scores, in insertion order; an empty map means the
     * 		   query is unrepresented
     */
    public Map<String, Integer> matchesAbove(String sequence, int minScore) {
        return this.matchesAbove(this.kmersOf(sequence), minScore);
    }

    /**
     * Find all the representatives with a specified similarity or better to a query kmer set.
     *
     * @param kmers		kmer set of the query
     * @param minScore	minimum acceptable score
     *
     * @return a map from representative IDs to scores, in insertion order
     */
    public Map<String, Integer> matchesAbove(KmerSet kmers, int minScore) {
        Map<String, Integer> retVal = new LinkedHashMap<String, Integer>();
        if (! kmers.isEmpty()) {
            for (RepGenome rep : this.genomeList) {
                int score = rep.similarity(kmers);
                if (score >= minScore)
                    retVal.put(rep.getGenomeId(), score);
            }
        }
        return retVal;
    }

    /**
     * Count the representatives with a specified similarity or better to a query sequence.
     *
     * @param sequence	query sequence
     * @param minScore	minimum acceptable score
     *
     * @return the number of representatives found
     */
    public int countAbove(String sequence, int minScore) {
        return this.countAbove(this.kmersOf(sequence), minScore);
    }

    /**
     * Count the representatives with a specified similarity or better to a query kmer set.
     *
     * @param kmers		kmer set of the query
     * @param minScore	minimum acceptable score
     *
     * @return the number of representatives found
     */
    public int countAbove(KmerSet kmers, int minScore) {
        int retVal = 0;
        if (! kmers.isEmpty()) {
            for (RepGenome rep : this.genomeList) {
                if (rep.similarity(kmers) >= minScore)
                    retVal++;
            }
        }
        return retVal;
    }

    /**
     * Find the closest representatives to a query sequence.
     *
     * @param sequence	query sequence
     * @param n			maximum number of representatives to return
     * @param minScore	minimum acceptable score
     *
     * @return a list of the best matches, highest score first, with ties in insertion order
     */
    public List<RepMatch> findClosest(String sequence, int n, int minScore) {
        List<RepMatch> retVal = new ArrayList<RepMatch>(n + 1);
        if (n > 0) {
            for (Map.Entry<String, Integer> found : this.matchesAbove(sequence, minScore).entrySet()) {
                int score = found.getValue();
                // Find the insertion point.  Equal scores stay in front.
                int i = retVal.size();
                while (i > 0 && retVal.get(i - 1).getScore() < score) i--;
                if (i < n) {
                    retVal.add(i, new RepMatch(found.getKey(), score));
                    if (retVal.size() > n)
                        retVal.remove(n);
                }
            }
        }
        return retVal;
    }

    /**
     * Find all the pairs of representatives with a specified similarity or better.  Each pair is listed once,
     * with the first-inserted genome first.
     *
     * @param minScore	minimum acceptable score
     *
     * @return a list of the close pairs, in index order
     */
    public List<Pair> pairsAbove(int minScore) {
        List<Pair> retVal = new ArrayList<Pair>();
        final int n = this.genomeList.size();
        for (int i = 0; i < n; i++) {
            RepGenome rep = this.genomeList.get(i);
            for (int j = i + 1; j < n; j++) {
                RepGenome other = this.genomeList.get(j);
                int score = rep.similarity(other);
                if (score >= minScore)
                    retVal.add(new Pair(rep.getGenomeId(), other.getGenomeId(), score));
            }
            if (log.isDebugEnabled() && (i + 1) % 100 == 0)
                log.debug("{} of {} genomes processed.  {} pairs found.", i + 1, n, retVal.size());
        }
        return retVal;
    }

    /**
     * This object describes a pair of close representative genomes.
     */
    public static class Pair {

        /** ID of the first genome */
        private final String genome1;
        /** ID of the second genome */
        private final String genome2;
        /** similarity score */
        private final int score;

        public Pair(String genome1, String genome2, int score) {
            this.genome1 = genome1;
            this.genome2 = genome2;
            this.score = score;
        }

        /**
         * @return the ID of the first genome
         */
        public String getGenome1() {
            return this.genome1;
        }

        /**
         * @return the ID of the second genome
         */
        public String getGenome2() {
            return this.genome2;
        }

        /**
         * @return the similarity score
         */
        public int getScore() {
            return this.score;
        }

    }

    /**
     * Connect a represented genome to its representative.  If the genome is already connected to a different
     * representative, it is moved.
     *
     * @param repId		ID of the representative genome
     * @param genomeId	ID of the represented genome
     * @param score		similarity score between the two
     *
     * @throws UnknownRepresentativeException	if the representative is not in the index
     */
    public void connect(String repId, String genomeId, int score) throws UnknownRepresentativeException {
        RepGenome rep = this.genomeMap.get(repId);
        if (rep == null)
            throw new UnknownRepresentativeException(repId);
        RepGenome oldRep = this.repMap.put(genomeId, rep);
        if (oldRep != null && oldRep != rep) {
            log.debug("Moving {} from {} to {}.", genomeId, oldRep.getGenomeId(), repId);
            oldRep.removeGenome(genomeId);
        }
        rep.addGenome(genomeId, score);
    }

    /**
     * @return the genomes represented by a representative genome, mapped to their scores in connection order
     *
     * @param repId		ID of the representative genome
     *
     * @throws UnknownRepresentativeException	if the representative is not in the index
     */
    public Map<String, Integer> representedList(String repId) throws UnknownRepresentativeException {
        RepGenome rep = this.genomeMap.get(repId);
        if (rep == null)
            throw new UnknownRepresentativeException(repId);
        return rep.getRepresented();
    }

    /**
     * @return the representative a genome is connected to and its stored score, or a no-match result if the
     * 		   genome is not connected
     *
     * @param genomeId	ID of the genome to check
     */
    public RepMatch checkRep(String genomeId) {
        RepMatch retVal;
        RepGenome rep = this.repMap.get(genomeId);
        if (rep == null)
            retVal = RepMatch.none();
        else
            retVal = new RepMatch(rep.getGenomeId(), rep.getScore(genomeId));
        return retVal;
    }

    /**
     * Remove all the represented-genome connections.
     */
    public void clearConnections() {
        for (RepGenome rep : this.genomeList)
            rep.clearGenomes();
        this.repMap.clear();
    }

    /**
     * @return the number of connected genomes
     */
    public int connectedCount() {
        return this.repMap.size();
    }

    /**
     * @return the IDs of the representative genomes, in insertion order
     */
    public List<String> getGenomeIds() {
        List<String> retVal = new ArrayList<String>(this.genomeList.size());
        for (RepGenome rep : this.genomeList)
            retVal.add(rep.getGenomeId());
        return retVal;
    }

    /**
     * @return the number of representative genomes
     */
    public int size() {
        return this.genomeList.size();
    }

    /**
     * @return the kmer size
     */
    public int getKmerSize() {
        return this.kmerSize;
    }

    /**
     * @return the minimum similarity score for a genome to be represented
     */
    public int getThreshold() {
        return this.threshold;
    }

    /**
     * @return the marker sequence type
     */
    public KmerSet.Type getType() {
        return this.type;
    }

    @Override
    public Iterator<RepGenome> iterator() {
        return Collections.unmodifiableList(this.genomeList).iterator();
    }

    @Override
    public String toString() {
        return "RepGen index (K = " + this.kmerSize + ", score = " + this.threshold + ", " + this.genomeList.size()
                + " genomes)";
    }

}
