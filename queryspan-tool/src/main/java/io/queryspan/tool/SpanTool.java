package io.queryspan.tool;

import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import io.queryspan.connector.ConnectorFactory;
import io.queryspan.jdbc.JdbcConnectorFactory;
import io.queryspan.jdbc.JdbcSpanStorage;
import io.queryspan.span.QuerySpan;
import io.queryspan.span.QuerySpanRunner;
import io.queryspan.span.SpanSearch;
import io.queryspan.span.SpanSearchException;
import io.queryspan.store.SpanStorage;
import io.queryspan.store.StorageException;
import io.queryspan.util.JsonUtil;
import io.queryspan.util.RuntimeUtil;

/**
 * Approximates and stores the span of a batch of query files.
 */
public class SpanTool {
    private static final Logger logger = LoggerFactory.getLogger(SpanTool.class);

    private static class MyOptions {
        @Option(name = "-h", usage = "print this help. \nUsage: -q <paths> [-option ...]")
        boolean help;
        @Option(name = "-c", metaVar = "<configPath>", usage = "the path of the config properties")
        String configPath;
        @Option(name = "-q", metaVar = "<paths>", usage = "query files or directories of *.sql files, splited by `,`")
        String queries;
        @Option(name = "-mode", metaVar = "<mode>", usage = "exploration mode: none, iterative or batch")
        String mode;
        @Option(name = "-threads", metaVar = "<n>", usage = "number of parallel explains")
        int threads = -1;
        @Option(name = "-skipfailed", usage = "continue with the next query if one fails")
        boolean skipFailed = false;
        @Option(name = "-print", usage = "print each span as json")
        boolean print = false;
    }

    private final QuerySpanRunner runner;
    private final boolean skipFailed;
    private final PrintStream out;

    public SpanTool(ConnectorFactory connectorFactory, SpanStorage storage, SpanConfig config, boolean skipFailed, PrintStream out) {
        SpanSearch search = new SpanSearch(connectorFactory, config.explainThreads(), config.exploreMode());
        this.runner = new QuerySpanRunner(storage, search);
        this.skipFailed = skipFailed;
        this.out = out;
    }

    /**
     * @return the spans of the queries which succeeded, in input order.
     */
    public List<QuerySpan> run(List<Path> queryFiles) throws StorageException {
        List<QuerySpan> spans = new ArrayList<>(queryFiles.size());
        for (Path queryFile : queryFiles) {
            String queryId = queryFile.toString();
            try {
                QuerySpan span = runner.run(queryId);
                spans.add(span);
                if (out != null) {
                    out.println(JsonUtil.toJsonPretty(new SpanReport(queryId, span)));
                }
            } catch (SpanSearchException | StorageException e) {
                if (!skipFailed) {
                    throw e;
                }
                logger.error(String.format("Approximate query span for [%s] failed, skip it", queryId), e);
            }
        }
        return spans;
    }

    public static List<Path> listQueryFiles(List<String> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (String path : paths) {
            File file = new File(path);
            if (file.isDirectory()) {
                Collection<File> sqlFiles = FileUtils.listFiles(file, new String[]{"sql"}, false);
                sqlFiles.stream().map(File::toPath).sorted().forEach(files::add);
            } else if (file.isFile()) {
                files.add(file.toPath());
            } else {
                throw new IOException(String.format("query path [%s] not found", path));
            }
        }
        return files;
    }

    public static void main(String[] args) throws Exception {
        MyOptions options = new MyOptions();
        CmdLineParser parser = RuntimeUtil.parseArgs(args, options);
        if (options.help || options.queries == null) {
            parser.printUsage(System.out);
            return;
        }

        SpanConfig config = SpanConfig.load(options.configPath == null ? null : Paths.get(options.configPath));
        if (options.mode != null) {
            config.set(SpanConfig.EXPLORE_MODE, options.mode);
        }
        if (options.threads > 0) {
            config.set(SpanConfig.EXPLAIN_THREADS, String.valueOf(options.threads));
        }

        List<Path> queryFiles = listQueryFiles(RuntimeUtil.splitList(options.queries));
        logger.info("{} queries to approximate, mode: {}", queryFiles.size(), config.exploreMode());

        ConnectorFactory connectorFactory = JdbcConnectorFactory.load(config.connectorConfig());
        try (JdbcSpanStorage storage = new JdbcSpanStorage(config.storageUrl(), config.storageUser(), config.storagePassword())) {
            SpanTool tool = new SpanTool(connectorFactory, storage, config, options.skipFailed, options.print ? System.out : null);
            List<QuerySpan> spans = tool.run(queryFiles);
            logger.info("Approximated {} of {} queries", spans.size(), queryFiles.size());
        }
    }
}
