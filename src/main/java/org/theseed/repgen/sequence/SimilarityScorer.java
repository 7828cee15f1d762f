/**
 *
 */
package org.theseed.repgen.sequence;

/**
 * This class computes similarity between kmer sets.  The standard similarity score is the raw number of
 * kmers in common.  It is not normalized:  thresholds are calibrated for a particular marker protein and
 * kmer size (for the PheS protein at K=8, a score of 100 is typical).
 *
 * The scoring strategies used for reports are enumerated by {@link Type}.  A strategy is chosen once when a
 * command is configured.
 *
 * @author Bruce Parrello
 *
 */
public final class SimilarityScorer {

    /**
     * This enum describes the available scoring strategies.
     */
    public static enum Type {
        /** number of kmers in common */
        RAW {
            @Override
            public double score(KmerSet query, KmerSet target) {
                return query.intersectionSize(target);
            }

            @Override
            public String format(double score) {
                return Integer.toString((int) score);
            }
        },
        /** kmers in common per thousand query kmers */
        SCALED {
            @Override
            public double score(KmerSet query, KmerSet target) {
                double retVal = 0.0;
                if (! query.isEmpty())
                    retVal = query.intersectionSize(target) * 1000.0 / query.size();
                return retVal;
            }
        },
        /** Jaccard distance:  0 for identical sets, 1 for disjoint ones */
        DISTANCE {
            @Override
            public double score(KmerSet query, KmerSet target) {
                double retVal = 1.0;
                int common = query.intersectionSize(target);
                int union = query.size() + target.size() - common;
                if (union > 0)
                    retVal = 1.0 - ((double) common) / union;
                return retVal;
            }
        };

        /**
         * Compute the score of a query against a target.
         *
         * @param query		kmer set of the query sequence
         * @param target	kmer set of the target sequence
         *
         * @return the score for this strategy
         */
        public abstract double score(KmerSet query, KmerSet target);

        /**
         * @return a display string for a score computed by this strategy
         *
         * @param score		score to format
         */
        public String format(double score) {
            return String.format("%6.4f", score);
        }

    }

    private SimilarityScorer() { }

    /**
     * @return the number of kmers two sets have in common
     *
     * @param a		first kmer set
     * @param b		second kmer set
     */
    public static int score(KmerSet a, KmerSet b) {
        return a.intersectionSize(b);
    }

    /**
     * @return the number of kmers two protein sequences have in common
     *
     * @param seqA	first sequence
     * @param seqB	second sequence
     * @param k		kmer size
     */
    public static int scoreSequences(String seqA, String seqB, int k) {
        return scoreSequences(seqA, seqB, k, KmerSet.Type.PROTEIN);
    }

    /**
     * @return the number of kmers two sequences have in common
     *
     * @param seqA	first sequence
     * @param seqB	second sequence
     * @param k		kmer size
     * @param type	sequence type
     */
    public static int scoreSequences(String seqA, String seqB, int k, KmerSet.Type type) {
        return score(KmerSet.extract(seqA, k, type), KmerSet.extract(seqB, k, type));
    }

}
