package com.gt.flashcards.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.flashcards.lifecycle.*;
import com.gt.flashcards.lifecycle.impl.*;
import com.gt.flashcards.suspension.SuspensionDao;
import com.gt.flashcards.suspension.impl.SuspensionDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

@Configuration
public class BeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${flashcards.datasource.postgres.url}") String url,
                                    @Value("${flashcards.datasource.postgres.username}") String username,
                                    @Value("${flashcards.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate getTransactionTemplate(PlatformTransactionManager transactionManager,
                                                      @Value("${flashcards.transaction.timeoutSec:30}") int timeoutSec) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        transactionTemplate.setTimeout(timeoutSec);

        return transactionTemplate;
    }

    @Bean
    // Day boundaries for timed pauses are UTC dates regardless of the host zone
    public Clock getClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CardDao getCardDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CardDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public NoteDao getNoteDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new NoteDaoPG(namedParameterJdbcTemplate, objectMapper);
    }

    @Bean
    public TagDao getTagDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new TagDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public DeckDao getDeckDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new DeckDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewLogDao getReviewLogDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewLogDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public SuspensionDao getSuspensionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new SuspensionDaoPG(namedParameterJdbcTemplate);
    }
}
