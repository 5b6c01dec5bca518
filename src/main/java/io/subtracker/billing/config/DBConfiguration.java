package io.subtracker.billing.config;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import com.zaxxer.hikari.HikariDataSource;

import io.subtracker.billing.util.ConstantUtility;

/**
 * Subscriptions, currencies and payment histories live in one database, read through
 * {@code subtrackerJdbcTemplate}.
 */
@Configuration
public class DBConfiguration {

	@Primary
	@Bean(name = "subtrackerDb")
	@ConfigurationProperties(prefix = "spring.datasource.subtracker")
	public HikariDataSource subtrackerDataSource() {
		HikariDataSource dataSource = DataSourceBuilder.create().type(HikariDataSource.class).build();
		dataSource.setPoolName(ConstantUtility.SUBTRACKER_POOL);
		return dataSource;
	}

	@Bean(name = "subtrackerJdbcTemplate")
	public JdbcTemplate subtrackerJdbcTemplate(@Qualifier("subtrackerDb") DataSource subtrackerDb) {
		return new JdbcTemplate(subtrackerDb, false);
	}
}
