/**
 *
 */
package org.theseed.repgen.utils;

/**
 * This exception is thrown when a command-line parameter is invalid.  It is caught by the command framework,
 * which displays the message along with the command usage.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -2471053093185213467L;

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
