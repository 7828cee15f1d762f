/**
 *
 */
package org.theseed.repgen;

/**
 * This object describes the result of a representative-genome search:  the ID of the representative found
 * and its similarity score.  A search that finds nothing returns a match with no genome ID and a score of 0.
 *
 * @author Bruce Parrello
 *
 */
public class RepMatch {

    // FIELDS
    /** ID of the representative genome, or NULL if none was found */
    private final String genomeId;
    /** similarity score */
    private final int score;
    /** display string for a missing representative */
    public static final String NONE = "<none>";

    /**
     * Construct a match result.
     *
     * @param genomeId	ID of the representative genome, or NULL if none was found
     * @param score		similarity score
     */
    public RepMatch(String genomeId, int score) {
        this.genomeId = genomeId;
        this.score = score;
    }

    /**
     * @return a match result indicating nothing was found
     */
    public static RepMatch none() {
        return new RepMatch(null, 0);
    }

    /**
     * @return TRUE if a representative was found
     */
    public boolean isFound() {
        return this.genomeId != null;
    }

    /**
     * @return the ID of the representative genome, or NULL if none was found
     */
    public String getGenomeId() {
        return this.genomeId;
    }

    /**
     * @return the similarity score
     */
    public int getScore() {
        return this.score;
    }

    @Override
    public String toString() {
        return (this.genomeId == null ? NONE : this.genomeId) + " (" + this.score + ")";
    }

}
