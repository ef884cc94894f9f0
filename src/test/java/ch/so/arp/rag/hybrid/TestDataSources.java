package ch.so.arp.rag.hybrid;

import java.util.UUID;

import javax.sql.DataSource;

import org.springframework.jdbc.datasource.DriverManagerDataSource;

public final class TestDataSources {

    private TestDataSources() {
    }

    /**
     * Fresh in-memory H2 database in PostgreSQL mode, kept open until the JVM
     * exits.
     */
    public static DataSource h2() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        return dataSource;
    }
}
