/**
 *
 */
package org.theseed.repgen.sequence;

/**
 * This object represents a sequence read from or written to a FASTA file.  It contains a label (the sequence ID),
 * a comment, and the sequence string itself.  Sequences are immutable.
 *
 * @author Bruce Parrello
 *
 */
public class Sequence {

    // FIELDS
    /** sequence ID */
    private final String label;
    /** comment (may be empty) */
    private final String comment;
    /** sequence letters */
    private final String sequence;

    /**
     * Construct a sequence.
     *
     * @param label		ID of the sequence
     * @param comment	comment text, or NULL if there is none
     * @param sequence	sequence letters
     */
    public Sequence(String label, String comment, String sequence) {
        this.label = label;
        this.comment = (comment == null ? "" : comment);
        this.sequence = sequence;
    }

    /**
     * @return the sequence ID
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the comment, or an empty string if there is none
     */
    public String getComment() {
        return this.comment;
    }

    /**
     * @return the sequence letters
     */
    public String getSequence() {
        return this.sequence;
    }

    /**
     * @return the sequence length
     */
    public int length() {
        return this.sequence.length();
    }

    @Override
    public String toString() {
        return this.label;
    }

}
