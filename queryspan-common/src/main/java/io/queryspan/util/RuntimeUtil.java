package io.queryspan.util;

import com.google.common.base.Splitter;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;

import java.util.Collections;
import java.util.List;

public class RuntimeUtil {
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public static CmdLineParser parseArgs(String[] args, Object t) {
        CmdLineParser parser = new CmdLineParser(t);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            System.err.println();
            System.exit(1);
        }
        return parser;
    }

    /**
     * Split an option value like "a, b,,c" into [a, b, c].
     */
    public static List<String> splitList(String value) {
        if (value == null) {
            return Collections.emptyList();
        }
        return LIST_SPLITTER.splitToList(value);
    }
}
