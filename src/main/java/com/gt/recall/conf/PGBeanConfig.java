package com.gt.recall.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.recall.content.ContentDao;
import com.gt.recall.content.impl.ContentDaoPG;
import com.gt.recall.history.ReviewHistoryDao;
import com.gt.recall.history.impl.ReviewHistoryDaoPG;
import com.gt.recall.schedule.ScheduleDao;
import com.gt.recall.schedule.impl.ScheduleDaoPG;
import com.gt.recall.session.ReviewSessionDao;
import com.gt.recall.session.impl.ReviewSessionDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${recall.datasource.postgres.url}") String url,
                                    @Value("${recall.datasource.postgres.username}") String username,
                                    @Value("${recall.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ScheduleDao getScheduleDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ScheduleDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewHistoryDao getReviewHistoryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewHistoryDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewSessionDao getReviewSessionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new ReviewSessionDaoPG(namedParameterJdbcTemplate, objectMapper);
    }

    @Bean
    public ContentDao getContentDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ContentDaoPG(namedParameterJdbcTemplate);
    }
}
