/**
 *
 */
package org.theseed.repgen;

/**
 * This exception is thrown when a marker sequence is not longer than the kmer size.
 *
 * @author Bruce Parrello
 *
 */
public class SequenceTooShortException extends RepGenomeException {

    /** serialization version ID */
    private static final long serialVersionUID = 7736521980471122349L;

    public SequenceTooShortException(String genomeId, int length, int k) {
        super("Marker sequence for " + genomeId + " has length " + length + ", which is not greater than the kmer size " +
                k + ".");
    }

}
