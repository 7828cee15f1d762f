/**
 *
 */
package org.theseed.repgen.reps;

import java.io.File;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.repgen.RepGenome;
import org.theseed.repgen.RepGenomeDirectory;
import org.theseed.repgen.RepGenomeIndex;
import org.theseed.repgen.RepGenomeUpdater;
import org.theseed.repgen.utils.BaseProcessor;
import org.theseed.repgen.utils.ParseFailureException;

/**
 * This command uses the representatives of one directory to update the represented genomes of another.  Each
 * source representative is connected to the closest target representative that meets the target score.  The
 * target directory is updated in place.
 *
 * The positional parameters are the names of the source directory and the target directory.  The two
 * directories must have the same kmer size.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --clear	if specified, the existing represented genomes in the target are erased before the update
 *
 * @author Bruce Parrello
 *
 */
public class UpdateProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(UpdateProcessor.class);
    /** source index */
    private RepGenomeIndex source;
    /** target index */
    private RepGenomeIndex target;

    // COMMAND-LINE OPTIONS

    /** TRUE to erase existing connections */
    @Option(name = "--clear", usage = "if specified, existing represented genomes will be erased")
    private boolean clearFlag;

    /** source directory */
    @Argument(index = 0, metaVar = "sourceDir", usage = "source representative-genome directory", required = true)
    private File sourceDir;

    /** target directory */
    @Argument(index = 1, metaVar = "targetDir", usage = "target representative-genome directory", required = true)
    private File targetDir;

    @Override
    protected void setDefaults() {
        this.clearFlag = false;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        this.source = RepGenomeDirectory.load(this.sourceDir, false);
        this.target = RepGenomeDirectory.load(this.targetDir, ! this.clearFlag);
        if (this.source.getKmerSize() != this.target.getKmerSize())
            throw new ParseFailureException("Source kmer size " + this.source.getKmerSize()
                    + " does not match target kmer size " + this.target.getKmerSize() + ".");
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        RepGenomeUpdater updater = new RepGenomeUpdater(this.target, this.clearFlag);
        updater.merge(this.source);
        for (RepGenome genome : updater.getUnrepresented())
            log.debug("Unrepresented: {}.", genome);
        RepGenomeDirectory.save(this.target, this.targetDir);
        log.info("All done.  {} already representatives, {} already represented, {} connected, {} unrepresented.",
                updater.getRepCount(), updater.getAlreadyCount(), updater.getFoundCount(),
                updater.getUnrepresented().size());
    }

}
