package com.cistrade.infrastructure.impala;

import com.cistrade.config.ImpalaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Properties;

/**
 * Opens Impala sessions through the JDBC {@link DriverManager}.
 *
 * The Impala (or Hive2-compatible) driver is not bundled; it must be on the runtime
 * classpath. URL shape for the Cloudera driver:
 * <pre>
 * jdbc:impala://host:21050/gmp_cis;AuthMech=1;SSL=1;KrbServiceName=impala;KrbHostFQDN=host;SocketTimeout=60
 * </pre>
 * An explicit {@code IMPALA_JDBC_URL} wins over the built URL; a {@code {database}}
 * placeholder in it is replaced by the requested database.
 */
public final class JdbcConnectionFactory implements ConnectionFactory {
    private static final Logger log = LoggerFactory.getLogger(JdbcConnectionFactory.class);

    static final String DATABASE_PLACEHOLDER = "{database}";

    private final ImpalaConfig config;

    public JdbcConnectionFactory(ImpalaConfig config) {
        this.config = config;
    }

    @Override
    public Connection create(String database) throws SQLException {
        String db = database == null || database.isBlank() ? config.database() : database;
        String url = buildUrl(db);
        log.debug("[ImpalaJdbc] Connecting to {}:{} database={} auth={}",
            config.host(), config.port(), db, config.authMechanism());
        Connection conn = DriverManager.getConnection(url, credentials());
        log.info("[ImpalaJdbc] Successfully connected to Impala database: {}", db);
        return conn;
    }

    /**
     * Build the JDBC URL for {@code database}.
     */
    public String buildUrl(String database) {
        if (config.hasExplicitUrl()) {
            return config.jdbcUrl().replace(DATABASE_PLACEHOLDER, database);
        }

        StringBuilder url = new StringBuilder("jdbc:impala://")
            .append(config.host()).append(':').append(config.port())
            .append('/').append(database)
            .append(";AuthMech=").append(authMech(config.authMechanism()))
            .append(";SSL=").append(config.useSsl() ? 1 : 0);

        if (isKerberos(config.authMechanism())) {
            url.append(";KrbServiceName=").append(config.krbServiceName())
               .append(";KrbHostFQDN=").append(config.host());
        }
        if (config.timeoutSeconds() > 0) {
            url.append(";SocketTimeout=").append(config.timeoutSeconds());
        }
        return url.toString();
    }

    /**
     * Cloudera driver AuthMech codes: 0 none, 1 Kerberos, 3 user name and password.
     */
    public static int authMech(String mechanism) {
        String m = mechanism == null ? "" : mechanism.trim().toUpperCase(Locale.ROOT);
        return switch (m) {
            case "NOSASL", "NONE" -> 0;
            case "GSSAPI", "KERBEROS" -> 1;
            case "LDAP", "PLAIN" -> 3;
            default -> throw new IllegalArgumentException("Unsupported Impala auth mechanism: " + mechanism);
        };
    }

    private static boolean isKerberos(String mechanism) {
        return authMech(mechanism) == 1;
    }

    private Properties credentials() {
        Properties props = new Properties();
        if (authMech(config.authMechanism()) == 3) {
            props.setProperty("UID", config.user());
            props.setProperty("PWD", config.password());
            props.setProperty("user", config.user());
            props.setProperty("password", config.password());
        }
        return props;
    }
}
