package io.queryspan.jdbc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

import java.util.Collections;
import java.util.List;

/**
 * How to reach an optimizer over JDBC and how to drive its knobs, e.g. for PostgreSQL:
 * <pre>
 * {
 *   "url": "jdbc:postgresql://localhost:5432/imdb",
 *   "user": "postgres",
 *   "knobs": ["enable_hashjoin", "enable_mergejoin", "enable_nestloop"],
 *   "disableStatement": "SET %s TO off",
 *   "explainStatement": "EXPLAIN (FORMAT JSON) %s"
 * }
 * </pre>
 */
public class JdbcConnectorDescriptor {
    @JsonProperty("url")
    public final String url;
    @JsonProperty("user")
    public final String user;
    @JsonProperty("password")
    public final String password;
    @JsonProperty("driver")
    public final String driver;
    @JsonProperty("knobs")
    public final List<String> knobs;
    @JsonProperty("disableStatement")
    public final String disableStatement;
    @JsonProperty("explainStatement")
    public final String explainStatement;

    @JsonCreator
    public JdbcConnectorDescriptor(@JsonProperty("url") String url,
                                   @JsonProperty("user") String user,
                                   @JsonProperty("password") String password,
                                   @JsonProperty("driver") String driver,
                                   @JsonProperty("knobs") List<String> knobs,
                                   @JsonProperty("disableStatement") String disableStatement,
                                   @JsonProperty("explainStatement") String explainStatement) {
        Preconditions.checkArgument(StringUtils.isNotBlank(url), "url should be specified");
        Preconditions.checkArgument(StringUtils.contains(disableStatement, "%s"), "disableStatement should contain the knob placeholder, got [%s]", disableStatement);
        Preconditions.checkArgument(StringUtils.contains(explainStatement, "%s"), "explainStatement should contain the query placeholder, got [%s]", explainStatement);

        this.url = url;
        this.user = StringUtils.defaultString(user);
        this.password = StringUtils.defaultString(password);
        this.driver = StringUtils.trimToNull(driver);
        this.knobs = knobs == null ? Collections.emptyList() : Collections.unmodifiableList(knobs);
        this.disableStatement = disableStatement;
        this.explainStatement = explainStatement;
    }

    @Override
    public String toString() {
        return String.format("%s, %d knobs", url, knobs.size());
    }
}
