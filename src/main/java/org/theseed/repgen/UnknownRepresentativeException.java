/**
 *
 */
package org.theseed.repgen;

/**
 * This exception is thrown when an operation names a representative genome that is not in the index.
 *
 * @author Bruce Parrello
 *
 */
public class UnknownRepresentativeException extends RepGenomeException {

    /** serialization version ID */
    private static final long serialVersionUID = 1950612837043598807L;

    /** ID of the missing representative */
    private final String repId;

    public UnknownRepresentativeException(String repId) {
        super(repId + " not found in representative-genome index.");
        this.repId = repId;
    }

    /**
     * @return the ID of the missing representative
     */
    public String getRepId() {
        return this.repId;
    }

}
