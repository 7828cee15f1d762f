/**
 *
 */
package org.theseed.repgen;

/**
 * This exception is thrown when a genome is inserted into an index that already contains it.
 *
 * @author Bruce Parrello
 *
 */
public class DuplicateGenomeException extends RepGenomeException {

    /** serialization version ID */
    private static final long serialVersionUID = -3405597614250347281L;

    /** ID of the duplicate genome */
    private final String genomeId;

    public DuplicateGenomeException(String genomeId) {
        super("Genome " + genomeId + " is already in the representative-genome index.");
        this.genomeId = genomeId;
    }

    /**
     * @return the ID of the duplicate genome
     */
    public String getGenomeId() {
        return this.genomeId;
    }

}
