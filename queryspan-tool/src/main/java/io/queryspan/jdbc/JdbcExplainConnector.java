package io.queryspan.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;
import java.util.TreeSet;

import io.queryspan.connector.Connector;
import io.queryspan.connector.ConnectorException;

/**
 * Explains queries on a dedicated JDBC session. The plan is the text of every column of every
 * row the explain statement returns, one row per line.
 */
public class JdbcExplainConnector implements Connector {
    private static final Logger logger = LoggerFactory.getLogger(JdbcExplainConnector.class);

    /** SQLSTATE class of connection exceptions. */
    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    private final Connection connection;
    private final JdbcConnectorDescriptor descriptor;

    public JdbcExplainConnector(Connection connection, JdbcConnectorDescriptor descriptor) {
        this.connection = connection;
        this.descriptor = descriptor;
    }

    @Override
    public void setDisabledKnobs(Set<String> knobs) throws ConnectorException {
        try (Statement statement = connection.createStatement()) {
            for (String knob : new TreeSet<>(knobs)) {
                statement.execute(String.format(descriptor.disableStatement, knob));
            }
        } catch (SQLException e) {
            throw new ConnectorException(String.format("Disable knobs %s failed", knobs), e);
        }
    }

    @Override
    public String explain(String sql) throws ConnectorException {
        String explainSql = String.format(descriptor.explainStatement, sql);
        try (Statement statement = connection.createStatement()) {
            if (!statement.execute(explainSql)) {
                return "";
            }
            try (ResultSet rs = statement.getResultSet()) {
                return planText(rs);
            }
        } catch (SQLException e) {
            if (isConnectionFault(e)) {
                throw new ConnectorException("Explain failed by connection fault", e);
            }
            logger.debug("Optimizer failed to plan: {}", e.getMessage());
            return FAILED;
        }
    }

    private static String planText(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        StringBuilder plan = new StringBuilder();
        while (rs.next()) {
            if (plan.length() > 0) {
                plan.append('\n');
            }
            for (int i = 1; i <= columnCount; i++) {
                if (i > 1) {
                    plan.append('\t');
                }
                plan.append(rs.getString(i));
            }
        }
        return plan.toString();
    }

    private static boolean isConnectionFault(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS);
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
