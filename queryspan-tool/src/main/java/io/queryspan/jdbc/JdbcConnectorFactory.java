package io.queryspan.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Set;

import io.queryspan.connector.Connector;
import io.queryspan.connector.ConnectorException;
import io.queryspan.connector.ConnectorFactory;
import io.queryspan.util.JsonUtil;

public class JdbcConnectorFactory implements ConnectorFactory {
    private static final Logger logger = LoggerFactory.getLogger(JdbcConnectorFactory.class);

    private final JdbcConnectorDescriptor descriptor;

    public JdbcConnectorFactory(JdbcConnectorDescriptor descriptor) {
        this.descriptor = descriptor;
        if (descriptor.driver != null) {
            try {
                Class.forName(descriptor.driver);
            } catch (ClassNotFoundException e) {
                throw new IllegalArgumentException(String.format("jdbc driver [%s] not found", descriptor.driver), e);
            }
        }
        logger.info("Jdbc connector: {}", descriptor);
    }

    public static JdbcConnectorFactory load(Path path) throws IOException {
        return new JdbcConnectorFactory(JsonUtil.load(path, JdbcConnectorDescriptor.class));
    }

    @Override
    public Set<String> knobs() {
        return new LinkedHashSet<>(descriptor.knobs);
    }

    @Override
    public Connector open() throws ConnectorException {
        try {
            Connection connection = DriverManager.getConnection(descriptor.url, descriptor.user, descriptor.password);
            return new JdbcExplainConnector(connection, descriptor);
        } catch (SQLException e) {
            throw new ConnectorException(String.format("Connect to [%s] failed", descriptor.url), e);
        }
    }
}
