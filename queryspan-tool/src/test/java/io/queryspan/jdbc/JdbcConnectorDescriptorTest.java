package io.queryspan.jdbc;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import io.queryspan.util.JsonUtil;

public class JdbcConnectorDescriptorTest {

    @Test
    public void fromJsonTest() {
        String json = "{" +
                "\"url\": \"jdbc:postgresql://localhost:5432/imdb\"," +
                "\"user\": \"postgres\"," +
                "\"knobs\": [\"enable_hashjoin\", \"enable_nestloop\"]," +
                "\"disableStatement\": \"SET %s TO off\"," +
                "\"explainStatement\": \"EXPLAIN (FORMAT JSON) %s\"," +
                "\"comment\": \"ignored\"" +
                "}";
        JdbcConnectorDescriptor descriptor = JsonUtil.fromJson(json, JdbcConnectorDescriptor.class);
        Assert.assertEquals("jdbc:postgresql://localhost:5432/imdb", descriptor.url);
        Assert.assertEquals("postgres", descriptor.user);
        Assert.assertEquals("", descriptor.password);
        Assert.assertNull(descriptor.driver);
        Assert.assertEquals(Arrays.asList("enable_hashjoin", "enable_nestloop"), descriptor.knobs);
        Assert.assertEquals("SET enable_hashjoin TO off", String.format(descriptor.disableStatement, "enable_hashjoin"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingPlaceholderTest() {
        new JdbcConnectorDescriptor("jdbc:hsqldb:mem:x", null, null, null, null, "SET %s TO off", "EXPLAIN PLAN FOR");
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingKnobPlaceholderTest() {
        new JdbcConnectorDescriptor("jdbc:hsqldb:mem:x", null, null, null, null, "SET SCHEMA PUBLIC", "EXPLAIN PLAN FOR %s");
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingUrlTest() {
        new JdbcConnectorDescriptor(" ", null, null, null, null, "SET %s TO off", "EXPLAIN %s");
    }
}
