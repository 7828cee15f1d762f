/**
 *
 */
package org.theseed.repgen.sequence;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * This object writes sequences to a FASTA file.  Each sequence is written as a header line followed by the
 * entire sequence on a single line, so the output is a deterministic function of the sequences written.
 *
 * @author Bruce Parrello
 *
 */
public class FastaOutputStream implements AutoCloseable {

    // FIELDS
    /** underlying writer */
    private final PrintWriter writer;

    /**
     * Open a FASTA file for output.
     *
     * @param outFile	file to write
     *
     * @throws IOException
     */
    public FastaOutputStream(File outFile) throws IOException {
        this(new FileOutputStream(outFile));
    }

    /**
     * Write FASTA sequences to an output stream.
     *
     * @param outStream		stream to write
     */
    public FastaOutputStream(OutputStream outStream) {
        this.writer = new PrintWriter(new OutputStreamWriter(outStream, StandardCharsets.UTF_8));
    }

    /**
     * Write a sequence.
     *
     * @param seq	sequence to write
     */
    public void write(Sequence seq) {
        this.writer.print('>');
        this.writer.print(seq.getLabel());
        if (! seq.getComment().isEmpty()) {
            this.writer.print(' ');
            this.writer.print(seq.getComment());
        }
        this.writer.print('\n');
        this.writer.print(seq.getSequence());
        this.writer.print('\n');
    }

    @Override
    public void close() {
        this.writer.close();
    }

}
