/**
 *
 */
package org.theseed.repgen.groups;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenome;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.sequence.KmerSet;
import org.theseed.repgen.sequence.Sequence;

/**
 * This object sorts genomes into represented groups and computes the common roles of each group.
 *
 * A query genome belongs to every group whose representative has the minimum score or better against the
 * query's marker protein, so a genome near a threshold boundary may be in several groups.  Groups smaller than
 * the minimum group size are not used for role derivation, since their role statistics are unreliable.
 *
 * @author Bruce Parrello
 *
 */
public class RepresentedGroupBuilder {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RepresentedGroupBuilder.class);
    /** minimum number of members for a group to be used in role derivation */
    private final int minGroupSize;
    /** TRUE to count only roles that occur exactly once in a genome */
    private boolean singletonsOnly;
    /** number of queries in no group */
    private int unrepCount;
    /** number of queries in more than one group */
    private int multiCount;
    /** number of queries with no usable kmers */
    private int emptyCount;
    /** default minimum group size */
    public static final int DEFAULT_MIN_SIZE = 100;
    /** allowance for floating-point error when computing role limits */
    private static final double EPSILON = 1e-9;

    /**
     * Construct a group builder with the default minimum group size.
     */
    public RepresentedGroupBuilder() {
        this(DEFAULT_MIN_SIZE);
    }

    /**
     * Construct a group builder.
     *
     * @param minGroupSize		minimum number of members for a group to be used in role derivation
     */
    public RepresentedGroupBuilder(int minGroupSize) {
        this.minGroupSize = minGroupSize;
        this.singletonsOnly = false;
    }

    /**
     * Sort query genomes into represented groups.
     *
     * @param index		representative-genome index
     * @param queries	marker sequences of the query genomes; the genome ID is computed from the label and comment
     * @param minScore	minimum score for group membership
     *
     * @return a map from representative IDs to groups, in index order; only groups with members are included
     */
    public Map<String, RepresentedGroup> buildGroups(RepGenomeIndex index, Iterable<Sequence> queries, int minScore) {
        this.unrepCount = 0;
        this.multiCount = 0;
        this.emptyCount = 0;
        Map<String, RepresentedGroup> found = new HashMap<String, RepresentedGroup>();
        int count = 0;
        for (Sequence query : queries) {
            String genomeId = RepGenomeDirectory.genomeIdOf(query);
            KmerSet kmers = index.kmersOf(query.getSequence());
            if (kmers.isEmpty()) {
                log.warn("WARNING: Marker sequence for {} has no usable kmers.", genomeId);
                this.emptyCount++;
            } else {
                Map<String, Integer> matches = index.matchesAbove(kmers, minScore);
                if (matches.isEmpty())
                    this.unrepCount++;
                else if (matches.size() > 1)
                    this.multiCount++;
                for (Map.Entry<String, Integer> match : matches.entrySet()) {
                    String repId = match.getKey();
                    RepresentedGroup group = found.computeIfAbsent(repId,
                            x -> new RepresentedGroup(index.get(x), minScore));
                    group.add(genomeId, match.getValue());
                }
            }
            count++;
            if (count % 5000 == 0)
                log.info("{} queries processed:  {} unrepresented, {} in multiple groups.", count, this.unrepCount,
                        this.multiCount);
        }
        log.info("{} queries placed in {} groups.  {} unrepresented, {} in multiple groups, {} indeterminate.",
                count, found.size(), this.unrepCount, this.multiCount, this.emptyCount);
        return this.indexOrder(index, found);
    }

    /**
     * Build represented groups from the connections stored in an index.  Each group contains the representative
     * itself and the genomes connected to it.  Connections scoring below the index threshold are skipped.
     *
     * @param index		representative-genome index
     *
     * @return a map from representative IDs to groups, in index order
     */
    public Map<String, RepresentedGroup> connectedGroups(RepGenomeIndex index) {
        int threshold = index.getThreshold();
        Map<String, RepresentedGroup> retVal = new LinkedHashMap<String, RepresentedGroup>();
        for (RepGenome rep : index) {
            RepresentedGroup group = new RepresentedGroup(rep, threshold);
            int selfScore = rep.getKmers().size();
            if (selfScore >= threshold)
                group.add(rep.getGenomeId(), selfScore);
            for (Map.Entry<String, Integer> member : rep.getRepresented().entrySet()) {
                if (member.getValue() < threshold)
                    log.warn("WARNING: Genome {} has score {} with {}, below the threshold {}.", member.getKey(),
                            member.getValue(), rep.getGenomeId(), threshold);
                else
                    group.add(member.getKey(), member.getValue());
            }
            retVal.put(rep.getGenomeId(), group);
        }
        return retVal;
    }

    /**
     * Compute the common roles of a group.  A role is common if it is present in at least the specified
     * percentage of the group's members, rounded up.  Members with no role data count as lacking every role.
     *
     * @param group			group to analyze
     * @param roleCounts	role-count table for the group members
     * @param minPercent	minimum percentage of members that must contain a role
     *
     * @return the sorted set of common roles, or an empty set if the group is too small
     */
    public Set<String> commonRoles(RepresentedGroup group, RoleCountTable roleCounts, double minPercent) {
        Set<String> retVal = new TreeSet<String>();
        if (! this.isUsable(group))
            log.debug("Group {} has only {} members:  no roles computed.", group, group.size());
        else {
            Map<String, Integer> roleMembers = new HashMap<String, Integer>();
            int missing = 0;
            for (String genomeId : group.getMembers().keySet()) {
                Map<String, Integer> counts = roleCounts.getRoleCounts(genomeId);
                if (counts == null) {
                    log.warn("WARNING: No role data for genome {} in group {}.", genomeId, group.getRepId());
                    missing++;
                } else {
                    for (Map.Entry<String, Integer> roleCount : counts.entrySet()) {
                        int occurrences = roleCount.getValue();
                        if (this.singletonsOnly ? occurrences == 1 : occurrences > 0)
                            roleMembers.merge(roleCount.getKey(), 1, Integer::sum);
                    }
                }
            }
            int limit = (int) Math.ceil(minPercent * group.size() / 100.0 - EPSILON);
            for (Map.Entry<String, Integer> roleMember : roleMembers.entrySet()) {
                if (roleMember.getValue() >= limit)
                    retVal.add(roleMember.getKey());
            }
            log.info("{} common roles found for {} ({} members without role data).", retVal.size(), group, missing);
        }
        return retVal;
    }

    /**
     * @return TRUE if a group is large enough for role derivation
     *
     * @param group		group to check
     */
    public boolean isUsable(RepresentedGroup group) {
        return group.size() >= this.minGroupSize;
    }

    /**
     * @return a map of groups ordered by the position of their representatives in the index
     *
     * @param index		representative-genome index
     * @param groups	unordered map of groups
     */
    private Map<String, RepresentedGroup> indexOrder(RepGenomeIndex index, Map<String, RepresentedGroup> groups) {
        Map<String, RepresentedGroup> retVal = new LinkedHashMap<String, RepresentedGroup>(groups.size() * 4 / 3 + 1);
        for (RepGenome rep : index) {
            RepresentedGroup group = groups.get(rep.getGenomeId());
            if (group != null)
                retVal.put(rep.getGenomeId(), group);
        }
        return retVal;
    }

    /**
     * Specify whether only single-occurrence roles should count as present.
     *
     * @param singletonsOnly	TRUE to count only roles occurring exactly once in a genome
     */
    public void setSingletonsOnly(boolean singletonsOnly) {
        this.singletonsOnly = singletonsOnly;
    }

    /**
     * @return the minimum group size for role derivation
     */
    public int getMinGroupSize() {
        return this.minGroupSize;
    }

    /**
     * @return the number of queries in the last build that were in no group
     */
    public int getUnrepCount() {
        return this.unrepCount;
    }

    /**
     * @return the number of queries in the last build that were in more than one group
     */
    public int getMultiCount() {
        return this.multiCount;
    }

    /**
     * @return the number of queries in the last build whose similarity was indeterminate
     */
    public int getEmptyCount() {
        return this.emptyCount;
    }

}
