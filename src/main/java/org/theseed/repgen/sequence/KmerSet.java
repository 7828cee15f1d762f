/**
 *
 */
package org.theseed.repgen.sequence;

import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

/**
 * This object contains the set of distinct kmers in a sequence.  The kmers are taken with a sliding window of
 * stride 1 over the upper-cased sequence.  A kmer containing a letter outside the alphabet of the sequence type
 * is discarded.  DNA kmers are stored in canonical form, which is the lesser of the kmer and its reverse
 * complement, so that both strands of a sequence produce the same set.
 *
 * A sequence no longer than the kmer size produces an empty set.  An empty set means the similarity of the
 * sequence is indeterminate; it does not mean the sequence is dissimilar to everything.
 *
 * @author Bruce Parrello
 *
 */
public class KmerSet implements Iterable<String> {

    // FIELDS
    /** the distinct kmers */
    private final Set<String> kmers;
    /** kmer size */
    private final int kmerSize;
    /** sequence type */
    private final Type type;
    /** default protein kmer size */
    public static final int DEFAULT_PROTEIN_K = 8;
    /** amino acid letters */
    private static final String AMINO_ACIDS = "ACDEFGHIKLMNPQRSTVWY";
    /** DNA letters */
    private static final String NUCLEOTIDES = "ACGT";

    /**
     * This enum describes the two sequence alphabets.
     */
    public static enum Type {
        /** amino acid sequences:  20 standard residues, no canonicalization */
        PROTEIN(AMINO_ACIDS) {
            @Override
            public String normalize(String kmer) {
                return kmer;
            }
        },
        /** DNA sequences:  ACGT only, canonicalized by reverse complement */
        DNA(NUCLEOTIDES) {
            @Override
            public String normalize(String kmer) {
                String rev = reverseComplement(kmer);
                return (rev.compareTo(kmer) < 0 ? rev : kmer);
            }
        };

        /** table of legal upper-case letters */
        private final boolean[] legal;

        private Type(String alphabet) {
            this.legal = new boolean[128];
            for (int i = 0; i < alphabet.length(); i++)
                this.legal[alphabet.charAt(i)] = true;
        }

        /**
         * @return TRUE if the specified upper-case letter belongs to this alphabet
         *
         * @param c		letter to check
         */
        public boolean isLegal(char c) {
            return (c < 128 && this.legal[c]);
        }

        /**
         * @return the canonical form of a clean, upper-case kmer
         *
         * @param kmer	kmer to normalize
         */
        public abstract String normalize(String kmer);

    }

    /**
     * Construct an empty kmer set.
     *
     * @param k		kmer size
     * @param type	sequence type
     */
    private KmerSet(int k, Type type, Set<String> kmers) {
        this.kmerSize = k;
        this.type = type;
        this.kmers = kmers;
    }

    /**
     * Extract the kmer set for a sequence.
     *
     * @param sequence	sequence letters
     * @param k			kmer size
     * @param type		sequence type
     *
     * @return the set of distinct, clean, canonical kmers in the sequence
     */
    public static KmerSet extract(String sequence, int k, Type type) {
        if (k < 1)
            throw new IllegalArgumentException("Invalid kmer size " + k + ".");
        Set<String> kmers;
        int n = sequence.length();
        if (n <= k)
            kmers = Collections.emptySet();
        else {
            kmers = new HashSet<String>(n * 4 / 3 + 1);
            String seq = sequence.toUpperCase(Locale.ROOT);
            // "run" is the number of consecutive legal letters ending at position i.
            int run = 0;
            for (int i = 0; i < n; i++) {
                if (type.isLegal(seq.charAt(i)))
                    run++;
                else
                    run = 0;
                if (run >= k)
                    kmers.add(type.normalize(seq.substring(i - k + 1, i + 1)));
            }
        }
        return new KmerSet(k, type, kmers);
    }

    /**
     * @return the kmer set for a protein sequence
     *
     * @param sequence	amino acid sequence
     * @param k			kmer size
     */
    public static KmerSet protein(String sequence, int k) {
        return extract(sequence, k, Type.PROTEIN);
    }

    /**
     * @return the kmer set for a DNA sequence
     *
     * @param sequence	nucleotide sequence
     * @param k			kmer size
     */
    public static KmerSet dna(String sequence, int k) {
        return extract(sequence, k, Type.DNA);
    }

    /**
     * @return the reverse complement of an upper-case DNA string
     *
     * @param dna	string to reverse
     */
    public static String reverseComplement(String dna) {
        int n = dna.length();
        char[] retVal = new char[n];
        for (int i = 0; i < n; i++) {
            char c = dna.charAt(n - i - 1);
            switch (c) {
            case 'A' :
                c = 'T';
                break;
            case 'C' :
                c = 'G';
                break;
            case 'G' :
                c = 'C';
                break;
            case 'T' :
                c = 'A';
                break;
            default :
                c = 'N';
            }
            retVal[i] = c;
        }
        return new String(retVal);
    }

    /**
     * @return the number of kmers in common with another set
     *
     * @param other		other kmer set
     */
    public int intersectionSize(KmerSet other) {
        if (other.kmerSize != this.kmerSize || other.type != this.type)
            throw new IllegalArgumentException("Cannot compare " + this.type + " " + this.kmerSize + "-mers to " +
                    other.type + " " + other.kmerSize + "-mers.");
        Set<String> small = this.kmers;
        Set<String> big = other.kmers;
        if (small.size() > big.size()) {
            small = other.kmers;
            big = this.kmers;
        }
        int retVal = 0;
        for (String kmer : small) {
            if (big.contains(kmer))
                retVal++;
        }
        return retVal;
    }

    /**
     * @return the number of distinct kmers in this set
     */
    public int size() {
        return this.kmers.size();
    }

    /**
     * @return TRUE if this set is empty (indeterminate similarity)
     */
    public boolean isEmpty() {
        return this.kmers.isEmpty();
    }

    /**
     * @return TRUE if the specified canonical kmer is in this set
     *
     * @param kmer	kmer to check
     */
    public boolean contains(String kmer) {
        return this.kmers.contains(kmer);
    }

    /**
     * @return the kmer size
     */
    public int getKmerSize() {
        return this.kmerSize;
    }

    /**
     * @return the sequence type
     */
    public Type getType() {
        return this.type;
    }

    /**
     * @return an unmodifiable view of the kmers
     */
    public Set<String> getKmers() {
        return Collections.unmodifiableSet(this.kmers);
    }

    @Override
    public Iterator<String> iterator() {
        return this.getKmers().iterator();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.kmerSize;
        result = prime * result + this.type.hashCode();
        result = prime * result + this.kmers.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof KmerSet)) {
            return false;
        }
        KmerSet other = (KmerSet) obj;
        return (this.kmerSize == other.kmerSize && this.type == other.type && this.kmers.equals(other.kmers));
    }

    @Override
    public String toString() {
        return this.type + " " + this.kmerSize + "-mer set (" + this.kmers.size() + ")";
    }

}
