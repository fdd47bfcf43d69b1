package io.queryspan.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import io.queryspan.connector.Connector;
import io.queryspan.connector.ConnectorFactory;
import io.queryspan.jdbc.JdbcSpanStorage;
import io.queryspan.span.QuerySpan;
import io.queryspan.store.StorageException;
import io.queryspan.util.JsonUtil;

public class SpanToolTest {
    private static final String URL = "jdbc:hsqldb:mem:tool_test";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private JdbcSpanStorage storage;

    /**
     * Disabling "hash" gives another plan for queries with a join, disabling "scan" always fails.
     */
    private static class FakeOptimizer implements ConnectorFactory {
        @Override
        public Set<String> knobs() {
            return new LinkedHashSet<>(Arrays.asList("hash", "merge", "scan"));
        }

        @Override
        public Connector open() {
            return new Connector() {
                private Set<String> disabled = Collections.emptySet();

                @Override
                public void setDisabledKnobs(Set<String> knobs) {
                    disabled = knobs;
                }

                @Override
                public String explain(String sql) {
                    if (disabled.contains("scan")) {
                        return FAILED;
                    }
                    boolean join = sql.contains("JOIN");
                    if (join && disabled.contains("hash")) {
                        return disabled.contains("merge") ? "nestloop" : "mergejoin";
                    }
                    return join ? "hashjoin" : "seqscan";
                }

                @Override
                public void close() {
                }
            };
        }
    }

    @Before
    public void setUp() throws Exception {
        storage = new JdbcSpanStorage(URL, "SA", "");
    }

    @After
    public void tearDown() throws Exception {
        storage.close();
        try (Connection connection = DriverManager.getConnection(URL, "SA", "");
             Statement statement = connection.createStatement()) {
            statement.execute("SHUTDOWN");
        }
    }

    private Path query(String name, String sql) throws Exception {
        File file = folder.newFile(name);
        FileUtils.writeStringToFile(file, sql, StandardCharsets.UTF_8);
        return file.toPath();
    }

    private static SpanConfig config(String mode) {
        Properties properties = new Properties();
        properties.setProperty(SpanConfig.EXPLORE_MODE, mode);
        properties.setProperty(SpanConfig.EXPLAIN_THREADS, "2");
        return new SpanConfig(properties);
    }

    @Test
    public void runTest() throws Exception {
        Path q1 = query("q1.sql", "SELECT * FROM a JOIN b ON a.id = b.id");
        Path q2 = query("q2.sql", "SELECT * FROM a");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SpanTool tool = new SpanTool(new FakeOptimizer(), storage, config("iterative"), false,
                new PrintStream(out, true, "UTF-8"));
        List<QuerySpan> spans = tool.run(Arrays.asList(q1, q2));

        Assert.assertEquals(2, spans.size());
        Assert.assertEquals("[, scan, hash, hash/merge]", spans.get(0).toString());
        Assert.assertEquals("[, scan]", spans.get(1).toString());

        MappingIterator<JsonNode> reports = JsonUtil.jsonMapper.readerFor(JsonNode.class).readValues(out.toString("UTF-8"));
        JsonNode report = reports.next();
        Assert.assertEquals(q1.toString(), report.get("query").asText());
        Assert.assertEquals(4, report.get("hintSets").size());
        Assert.assertTrue(report.get("hintSets").get(1).get("required").asBoolean());
        Assert.assertEquals("hash", report.get("hintSets").get(3).get("dependency").asText());
        Assert.assertEquals(q2.toString(), reports.next().get("query").asText());
        Assert.assertFalse(reports.hasNext());
    }

    @Test
    public void skipFailedTest() throws Exception {
        Path q1 = query("q1.sql", "SELECT * FROM a");
        Path missing = new File(folder.getRoot(), "missing.sql").toPath();

        SpanTool tool = new SpanTool(new FakeOptimizer(), storage, config("none"), true, null);
        List<QuerySpan> spans = tool.run(Arrays.asList(missing, q1));
        Assert.assertEquals(1, spans.size());

        SpanTool strict = new SpanTool(new FakeOptimizer(), storage, config("none"), false, null);
        try {
            strict.run(Arrays.asList(missing, q1));
            Assert.fail();
        } catch (StorageException e) {
            // expected
        }
    }

    @Test
    public void listQueryFilesTest() throws Exception {
        File dir = folder.newFolder("queries");
        FileUtils.writeStringToFile(new File(dir, "2.sql"), "SELECT 2", StandardCharsets.UTF_8);
        FileUtils.writeStringToFile(new File(dir, "1.sql"), "SELECT 1", StandardCharsets.UTF_8);
        FileUtils.writeStringToFile(new File(dir, "notes.txt"), "", StandardCharsets.UTF_8);
        Path single = query("3.sql", "SELECT 3");

        List<Path> files = SpanTool.listQueryFiles(Arrays.asList(dir.getPath(), single.toString()));
        Assert.assertEquals(3, files.size());
        Assert.assertEquals("1.sql", files.get(0).getFileName().toString());
        Assert.assertEquals("2.sql", files.get(1).getFileName().toString());
        Assert.assertEquals(single, files.get(2));
    }
}
