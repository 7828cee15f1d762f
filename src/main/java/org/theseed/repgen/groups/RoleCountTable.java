/**
 *
 */
package org.theseed.repgen.groups;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object holds the role-occurrence counts for a set of genomes.  It is built once for a batch run and
 * passed to the methods that need role information.
 *
 * The input file is tab-delimited without headers, each record containing (0) a genome ID, (1) a role ID, and
 * (2) the number of times the role occurs in the genome.  If the count column is missing, the count is 1.
 *
 * @author Bruce Parrello
 *
 */
public class RoleCountTable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RoleCountTable.class);
    /** map of genome IDs to role counts */
    private final Map<String, Map<String, Integer>> genomeMap;

    /**
     * Create an empty role-count table.
     */
    public RoleCountTable() {
        this.genomeMap = new HashMap<String, Map<String, Integer>>();
    }

    /**
     * Load a role-count table from a file.
     *
     * @param inFile	tab-delimited input file
     *
     * @return the table loaded
     *
     * @throws IOException
     */
    public static RoleCountTable load(File inFile) throws IOException {
        RoleCountTable retVal = new RoleCountTable();
        int lineCount = 0;
        try (LineIterator iter = FileUtils.lineIterator(inFile, "UTF-8")) {
            while (iter.hasNext()) {
                String line = iter.next();
                lineCount++;
                String[] fields = line.split("\t");
                if (fields.length < 2)
                    log.warn("WARNING: Invalid line {} in role-count file {}.", lineCount, inFile);
                else {
                    int count = 1;
                    if (fields.length >= 3) {
                        try {
                            count = Integer.parseInt(fields[2].trim());
                        } catch (NumberFormatException e) {
                            throw new IOException("Invalid role count \"" + fields[2] + "\" in line " + lineCount +
                                    " of " + inFile + ".", e);
                        }
                    }
                    retVal.count(fields[0], fields[1], count);
                }
            }
        }
        log.info("{} genomes found in role-count file {}.", retVal.size(), inFile);
        return retVal;
    }

    /**
     * Add occurrences of a role to a genome.
     *
     * @param genomeId	ID of the genome
     * @param roleId	ID of the role
     * @param count		number of occurrences to add
     */
    public void count(String genomeId, String roleId, int count) {
        Map<String, Integer> roleCounts = this.genomeMap.computeIfAbsent(genomeId, x -> new TreeMap<String, Integer>());
        roleCounts.merge(roleId, count, Integer::sum);
    }

    /**
     * @return the role counts for a genome, or NULL if the genome is not in the table
     *
     * @param genomeId	ID of the genome of interest
     */
    public Map<String, Integer> getRoleCounts(String genomeId) {
        Map<String, Integer> retVal = this.genomeMap.get(genomeId);
        if (retVal != null)
            retVal = Collections.unmodifiableMap(retVal);
        return retVal;
    }

    /**
     * @return the number of times a role occurs in a genome
     *
     * @param genomeId	ID of the genome of interest
     * @param roleId	ID of the role of interest
     */
    public int getCount(String genomeId, String roleId) {
        int retVal = 0;
        Map<String, Integer> roleCounts = this.genomeMap.get(genomeId);
        if (roleCounts != null)
            retVal = roleCounts.getOrDefault(roleId, 0);
        return retVal;
    }

    /**
     * @return TRUE if the specified genome is in this table
     *
     * @param genomeId	ID of the genome of interest
     */
    public boolean contains(String genomeId) {
        return this.genomeMap.containsKey(genomeId);
    }

    /**
     * @return the number of genomes in this table
     */
    public int size() {
        return this.genomeMap.size();
    }

}
