package com.ureca.mimus.support;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * 테스트용 인메모리 H2 (MySQL 모드)
 * 테스트마다 이름이 다른 DB 를 만든다
 */
public final class H2Database {

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final DataSourceTransactionManager transactionManager;

    private H2Database(DataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionManager = new DataSourceTransactionManager(dataSource);
    }

    public static H2Database create() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:mimus_" + UUID.randomUUID().toString().replace("-", "")
                        + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
                "sa",
                "");
        dataSource.setDriverClassName("org.h2.Driver");

        H2Database database = new H2Database(dataSource);
        database.createGameTables();
        return database;
    }

    // ROW_FORMAT 등 MySQL 전용 옵션을 뺀 같은 구조
    private void createGameTables() {
        jdbcTemplate.execute("CREATE TABLE player ("
                + "id BIGINT NOT NULL PRIMARY KEY, "
                + "slots INT NOT NULL DEFAULT 0, "
                + "points INT NOT NULL DEFAULT 0, "
                + "stones INT NOT NULL DEFAULT 0, "
                + "stamina INT NOT NULL DEFAULT 0)");
        jdbcTemplate.execute("CREATE TABLE card ("
                + "id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY, "
                + "ownerid BIGINT NOT NULL DEFAULT 0, "
                + "type INT NOT NULL DEFAULT 0, "
                + "stones INT NOT NULL DEFAULT 0, "
                + "points INT NOT NULL DEFAULT 0, "
                + "evolves BIGINT NOT NULL DEFAULT 0, "
                + "levels BIGINT NOT NULL DEFAULT 0, "
                + "xp01 INT NOT NULL DEFAULT 0, "
                + "xp02 INT NOT NULL DEFAULT 0)");
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public DataSourceTransactionManager transactionManager() {
        return transactionManager;
    }

    public void shutdown() {
        jdbcTemplate.execute("SHUTDOWN");
    }
}
