/**
 *
 */
package org.theseed.repgen.reps;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Map;
import java.util.Set;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.RepMatchWriter;
import org.theseed.repgen.groups.RepresentedGroup;
import org.theseed.repgen.groups.RepresentedGroupBuilder;
import org.theseed.repgen.groups.RoleCountTable;
import org.theseed.repgen.sequence.FastaInputStream;
import org.theseed.repgen.utils.BaseProcessor;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command computes the common roles of each represented-genome group.  The groups are built either by
 * comparing a FASTA file of genome marker proteins to the representatives or, if no FASTA file is given, from
 * the represented genomes stored in the directory.  Only groups with the minimum number of members are analyzed.
 *
 * The positional parameters are the name of the representative-genome directory and the name of the role-count
 * file.  The role-count file is tab-delimited, with each record containing (0) a genome ID, (1) a role ID, and
 * optionally (2) the number of occurrences of the role in the genome.
 *
 * For each usable group, the output contains a header line with the representative ID, representative name,
 * and group size, then one line per common role (indented by a tab), and finally a "//" line.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	FASTA file of genome marker proteins (if omitted, the stored represented genomes are used)
 * -o	name of the output file (if not STDOUT)
 * -m	minimum similarity score for group membership (default is the index score)
 *
 * --percent	minimum percentage of group members that must contain a common role (default 97)
 * --size		minimum group size for analysis (default 100)
 * --single		if specified, only roles occurring exactly once in a genome are counted
 *
 * @author Bruce Parrello
 *
 */
public class GroupProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(GroupProcessor.class);
    /** representative-genome index */
    private RepGenomeIndex repDb;
    /** role counts for the genomes */
    private RoleCountTable roleCounts;

    // COMMAND-LINE OPTIONS

    /** query FASTA file */
    @Option(name = "--input", aliases = { "-i" }, metaVar = "markers.faa", usage = "FASTA file of genome marker proteins")
    private File inFile;

    /** output file name (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "roles.txt", usage = "output file (if not STDOUT)")
    private File outFile;

    /** minimum similarity score for group membership */
    @Option(name = "--min", aliases = { "-m", "--minScore" }, metaVar = "100",
            usage = "minimum score for group membership (default is the index score)")
    private int minScore;

    /** minimum percentage for a common role */
    @Option(name = "--percent", metaVar = "90", usage = "minimum percentage of members containing a common role")
    private double minPercent;

    /** minimum group size */
    @Option(name = "--size", metaVar = "50", usage = "minimum group size for analysis")
    private int minSize;

    /** TRUE to count only single-occurrence roles */
    @Option(name = "--single", usage = "if specified, only roles occurring once in a genome are counted")
    private boolean singleFlag;

    /** representative-genome directory */
    @Argument(index = 0, metaVar = "repDir", usage = "representative-genome directory", required = true)
    private File repDir;

    /** role-count file */
    @Argument(index = 1, metaVar = "roles.tbl", usage = "tab-delimited file of genome IDs, roles, and counts", required = true)
    private File roleFile;

    @Override
    protected void setDefaults() {
        this.inFile = null;
        this.outFile = null;
        this.minScore = -1;
        this.minPercent = 97.0;
        this.minSize = RepresentedGroupBuilder.DEFAULT_MIN_SIZE;
        this.singleFlag = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (this.minPercent <= 0.0 || this.minPercent > 100.0)
            throw new ParseFailureException("Percentage must be greater than 0 and no more than 100.");
        if (this.minSize < 1)
            throw new ParseFailureException("Minimum group size must be positive.");
        if (this.minScore < -1)
            throw new ParseFailureException("Minimum score cannot be negative.");
        if (this.inFile != null && ! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
        if (! this.roleFile.canRead())
            throw new FileNotFoundException("Role-count file " + this.roleFile + " is not found or unreadable.");
        this.repDb = RepGenomeDirectory.load(this.repDir, this.inFile == null);
        this.roleCounts = RoleCountTable.load(this.roleFile);
        log.info("Role counts read for {} genomes.", this.roleCounts.size());
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        RepresentedGroupBuilder builder = new RepresentedGroupBuilder(this.minSize);
        builder.setSingletonsOnly(this.singleFlag);
        Map<String, RepresentedGroup> groups;
        if (this.inFile == null) {
            if (this.minScore >= 0)
                log.warn("WARNING: minimum score is ignored when the stored represented genomes are used.");
            log.info("Building groups from the represented genomes in {}.", this.repDir);
            groups = builder.connectedGroups(this.repDb);
        } else {
            int min = (this.minScore < 0 ? this.repDb.getThreshold() : this.minScore);
            log.info("Building groups from {} with minimum score {}.", this.inFile, min);
            try (FastaInputStream inStream = new FastaInputStream(this.inFile)) {
                groups = builder.buildGroups(this.repDb, inStream, min);
            }
        }
        int usable = 0;
        try (RepMatchWriter writer = new RepMatchWriter(this.outFile, this.repDb, 0)) {
            for (RepresentedGroup group : groups.values()) {
                if (builder.isUsable(group)) {
                    usable++;
                    Set<String> roles = builder.commonRoles(group, this.roleCounts, this.minPercent);
                    writer.writeLine(group.getRepId(), group.getRep().getName(), Integer.toString(group.size()));
                    for (String role : roles)
                        writer.writeLine("", role);
                    writer.writeLine("//");
                }
            }
        }
        log.info("All done.  {} groups found, {} analyzed.", groups.size(), usable);
    }

}
