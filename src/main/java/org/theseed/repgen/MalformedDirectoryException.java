/**
 *
 */
package org.theseed.repgen;

import java.io.IOException;

/**
 * This exception is thrown when a representative-genome directory is missing or does not contain the
 * required files.
 *
 * @author Bruce Parrello
 *
 */
public class MalformedDirectoryException extends IOException {

    /** serialization version ID */
    private static final long serialVersionUID = -6018855325716463920L;

    public MalformedDirectoryException(String message) {
        super(message);
    }

}
