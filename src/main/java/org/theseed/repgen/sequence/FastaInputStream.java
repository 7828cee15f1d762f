/**
 *
 */
package org.theseed.repgen.sequence;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * This object iterates through the sequences in a FASTA file.  The header line is split at the first
 * whitespace into a label and a comment.  Sequence lines are concatenated with surrounding white space
 * removed.
 *
 * @author Bruce Parrello
 *
 */
public class FastaInputStream implements Iterable<Sequence>, Iterator<Sequence>, AutoCloseable {

    // FIELDS
    /** underlying reader */
    private final BufferedReader reader;
    /** header line of the next sequence, or NULL at end-of-file */
    private String nextHeader;

    /**
     * Open a FASTA file for input.
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    public FastaInputStream(File inFile) throws IOException {
        this(new FileInputStream(inFile));
    }

    /**
     * Read FASTA sequences from an input stream.
     *
     * @param inStream	stream to read
     *
     * @throws IOException
     */
    public FastaInputStream(InputStream inStream) throws IOException {
        this.reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8));
        // Skip to the first header.
        String line = this.reader.readLine();
        while (line != null && ! line.startsWith(">"))
            line = this.reader.readLine();
        this.nextHeader = line;
    }

    /**
     * Read all the sequences in a FASTA file into memory.
     *
     * @param inFile	file to read
     *
     * @return a list of the sequences in the file
     *
     * @throws IOException
     */
    public static List<Sequence> readAll(File inFile) throws IOException {
        List<Sequence> retVal = new ArrayList<Sequence>();
        try (FastaInputStream inStream = new FastaInputStream(inFile)) {
            for (Sequence seq : inStream)
                retVal.add(seq);
        }
        return retVal;
    }

    @Override
    public Iterator<Sequence> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return this.nextHeader != null;
    }

    @Override
    public Sequence next() {
        if (this.nextHeader == null)
            throw new NoSuchElementException("Attempt to read past end of FASTA file.");
        // Parse the header.
        String header = this.nextHeader.substring(1).trim();
        String label = header;
        String comment = "";
        int split = indexOfSpace(header);
        if (split >= 0) {
            label = header.substring(0, split);
            comment = header.substring(split + 1).trim();
        }
        // Accumulate the sequence lines.
        StringBuilder buffer = new StringBuilder(1000);
        try {
            String line = this.reader.readLine();
            while (line != null && ! line.startsWith(">")) {
                buffer.append(line.trim());
                line = this.reader.readLine();
            }
            this.nextHeader = line;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new Sequence(label, comment, buffer.toString());
    }

    /**
     * @return the position of the first white space character in a string, or -1 if there is none
     *
     * @param header	string to search
     */
    private static int indexOfSpace(String header) {
        int retVal = -1;
        for (int i = 0; i < header.length() && retVal < 0; i++) {
            if (Character.isWhitespace(header.charAt(i)))
                retVal = i;
        }
        return retVal;
    }

    @Override
    public void close() {
        try {
            this.reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
