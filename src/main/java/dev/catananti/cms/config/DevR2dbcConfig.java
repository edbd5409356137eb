package dev.catananti.cms.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.data.r2dbc.dialect.H2Dialect;
import org.springframework.data.r2dbc.dialect.R2dbcDialect;

/**
 * Dev profile runs on in-memory H2; pin the dialect so identifiers are not quoted PostgreSQL-style.
 */
@Configuration(proxyBeanMethods = false)
@Profile("dev")
public class DevR2dbcConfig {

    @Bean
    @Primary
    public R2dbcDialect r2dbcDialect(ConnectionFactory connectionFactory) {
        return H2Dialect.INSTANCE;
    }
}
