/**
 *
 */
package org.theseed.repgen;

/**
 * This is the base class for errors that reject a single operation on a representative-genome index.
 * The index is unchanged when one of these is thrown, so the caller decides whether to skip the record
 * or abort.
 *
 * @author Bruce Parrello
 *
 */
public class RepGenomeException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 4418201776631542080L;

    public RepGenomeException(String message) {
        super(message);
    }

}
