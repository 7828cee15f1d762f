package org.theseed.repgen.reps;

import java.util.Arrays;

import org.theseed.repgen.utils.BaseProcessor;

/**
 * This manages representative-genome directories.  The possible commands are:
 *
 * build		create a representative-genome directory from a marker FASTA file and a genome-name table
 * check		compare genomes to a directory, connecting or adding them as representatives
 * list			list the closest representative for each query sequence
 * count		count the representatives close to each query sequence
 * close		list the N closest representatives for each query sequence
 * matrix		compute the similarities between the representatives in a directory
 * distances	measure each query genome against all the representatives that represent it
 * update		connect the representatives of one directory to the representatives of another
 * groups		compute the common roles of the represented-genome groups
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1)
            throw new RuntimeException("No command specified.");
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        switch (command) {
        case "build" :
            processor = new BuildProcessor();
            break;
        case "check" :
            processor = new CheckProcessor();
            break;
        case "list" :
            processor = new ListProcessor();
            break;
        case "count" :
            processor = new CountProcessor();
            break;
        case "close" :
            processor = new CloseProcessor();
            break;
        case "matrix" :
            processor = new MatrixProcessor();
            break;
        case "distances" :
            processor = new DistanceProcessor();
            break;
        case "update" :
            processor = new UpdateProcessor();
            break;
        case "groups" :
            processor = new GroupProcessor();
            break;
        default :
            throw new RuntimeException("Invalid command " + command + ".");
        }
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
    }
}
