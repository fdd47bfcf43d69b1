package io.queryspan.jdbc;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;

import io.queryspan.span.QuerySpanRunner;
import io.queryspan.store.SpanStorage;
import io.queryspan.store.StorageException;

/**
 * Stores queries and their hint-sets in a relational database. Query ids are the paths of the
 * query files, the sql text is read from there.
 */
public class JdbcSpanStorage implements SpanStorage, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSpanStorage.class);

    public static final String QUERY_TABLE = "queries";

    private static final ImmutableSet<String> OPTIMIZER_TABLES = ImmutableSet.of(QuerySpanRunner.EFFECTIVE_TABLE);
    private static final ImmutableSet<String> DEPENDENCY_TABLES = ImmutableSet.of(QuerySpanRunner.DEPENDENCY_TABLE);

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS " + QUERY_TABLE + " (" +
                    "query_path VARCHAR(1024) NOT NULL PRIMARY KEY)",
            "CREATE TABLE IF NOT EXISTS " + QuerySpanRunner.EFFECTIVE_TABLE + " (" +
                    "query_path VARCHAR(1024) NOT NULL, " +
                    "disabled_rules VARCHAR(4096) NOT NULL, " +
                    "PRIMARY KEY (query_path, disabled_rules))",
            "CREATE TABLE IF NOT EXISTS " + QuerySpanRunner.DEPENDENCY_TABLE + " (" +
                    "query_path VARCHAR(1024) NOT NULL, " +
                    "disabled_rules VARCHAR(4096) NOT NULL, " +
                    "required_disabled_rules VARCHAR(4096) NOT NULL, " +
                    "PRIMARY KEY (query_path, disabled_rules, required_disabled_rules))",
    };

    private final Connection connection;

    public JdbcSpanStorage(String url, String user, String password) throws StorageException {
        try {
            this.connection = DriverManager.getConnection(url, user, password);
        } catch (SQLException e) {
            throw new StorageException(String.format("Connect to storage [%s] failed", url), e);
        }
        try (Statement statement = connection.createStatement()) {
            for (String sql : SCHEMA) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            closeQuietly();
            throw new StorageException("Create storage tables failed", e);
        }
        logger.info("Storage ready at {}", url);
    }

    @Override
    public void registerQuery(String queryId) throws StorageException {
        insertIfAbsent(QUERY_TABLE, new String[]{"query_path"}, queryId);
    }

    @Override
    public String readSql(String queryId) throws StorageException {
        try {
            return FileUtils.readFileToString(new File(queryId), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException(String.format("Read sql file [%s] failed", queryId), e);
        }
    }

    @Override
    public void registerOptimizer(String queryId, String knobKey, String tableName) throws StorageException {
        Preconditions.checkArgument(OPTIMIZER_TABLES.contains(tableName), "Illegal optimizer table: %s", tableName);
        insertIfAbsent(tableName, new String[]{"query_path", "disabled_rules"}, queryId, knobKey);
    }

    @Override
    public void registerOptimizerDependency(String queryId, String childKey, String parentKey, String tableName) throws StorageException {
        Preconditions.checkArgument(DEPENDENCY_TABLES.contains(tableName), "Illegal dependency table: %s", tableName);
        insertIfAbsent(tableName, new String[]{"query_path", "disabled_rules", "required_disabled_rules"}, queryId, childKey, parentKey);
    }

    private void insertIfAbsent(String table, String[] columns, String... values) throws StorageException {
        String where = String.join(" = ? AND ", columns) + " = ?";
        String placeholders = String.join(", ", Collections.nCopies(columns.length, "?"));
        try {
            try (PreparedStatement select = connection.prepareStatement(
                    String.format("SELECT COUNT(*) FROM %s WHERE %s", table, where))) {
                bind(select, values);
                try (ResultSet rs = select.executeQuery()) {
                    if (rs.next() && rs.getLong(1) > 0) {
                        return;
                    }
                }
            }
            try (PreparedStatement insert = connection.prepareStatement(
                    String.format("INSERT INTO %s (%s) VALUES (%s)", table, String.join(", ", columns), placeholders))) {
                bind(insert, values);
                insert.executeUpdate();
            }
        } catch (SQLException e) {
            throw new StorageException(String.format("Insert into %s failed", table), e);
        }
    }

    private static void bind(PreparedStatement statement, String... values) throws SQLException {
        for (int i = 0; i < values.length; i++) {
            statement.setString(i + 1, values[i]);
        }
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Close storage connection failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IOException(e);
        }
    }
}
