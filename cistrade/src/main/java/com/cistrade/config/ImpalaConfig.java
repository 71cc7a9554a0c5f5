package com.cistrade.config;

import com.cistrade.util.Env;

import java.util.Locale;

/**
 * Connection settings for the Impala/Kudu analytic database.
 *
 * @param host           Impala daemon host
 * @param port           HiveServer2 port of the daemon (21050 by default)
 * @param database       default database used when callers do not name one
 * @param useSsl         whether to negotiate TLS
 * @param authMechanism  NOSASL, GSSAPI, LDAP or PLAIN
 * @param krbServiceName Kerberos service principal name (GSSAPI only)
 * @param timeoutSeconds socket timeout handed to the driver
 * @param user           user for LDAP/PLAIN auth, empty otherwise
 * @param password       password for LDAP/PLAIN auth, empty otherwise
 * @param jdbcUrl        explicit URL overriding the built one; may contain {database}
 */
public record ImpalaConfig(
    String host,
    int port,
    String database,
    boolean useSsl,
    String authMechanism,
    String krbServiceName,
    int timeoutSeconds,
    String user,
    String password,
    String jdbcUrl
) {

    public static ImpalaConfig fromEnv() {
        return new ImpalaConfig(
            Env.get("IMPALA_HOST", "localhost"),
            Env.getInt("IMPALA_PORT", 21050),
            Env.get("IMPALA_DB", "gmp_cis"),
            Env.getBool("IMPALA_USE_SSL", true),
            Env.get("IMPALA_AUTH", "GSSAPI").toUpperCase(Locale.ROOT),
            Env.get("KRB_SERVICE_NAME", "impala"),
            Env.getInt("IMPALA_TIMEOUT", 60),
            Env.get("IMPALA_USER", ""),
            Env.get("IMPALA_PASSWORD", ""),
            Env.get("IMPALA_JDBC_URL", "")
        );
    }

    public boolean hasExplicitUrl() {
        return jdbcUrl != null && !jdbcUrl.isBlank();
    }

    @Override
    public String toString() {
        // password stays out of logs
        return "ImpalaConfig[host=" + host + ", port=" + port + ", database=" + database
            + ", ssl=" + useSsl + ", auth=" + authMechanism + ", timeout=" + timeoutSeconds + "s]";
    }
}
