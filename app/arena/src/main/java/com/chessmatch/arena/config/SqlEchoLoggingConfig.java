/*
 * どこで: Arena 設定
 * 何を: SQL_ECHO=TRUE のとき JdbcTemplate の実行 SQL を DEBUG で出力する
 * なぜ: SQL_ECHO はフラグ値であり、ログレベルとして直接束縛できないため
 */
package com.chessmatch.arena.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "SQL_ECHO", havingValue = "TRUE")
public class SqlEchoLoggingConfig {

  static final String JDBC_LOGGER = "org.springframework.jdbc.core";

  private static final Logger logger = LoggerFactory.getLogger(SqlEchoLoggingConfig.class);

  private final LoggingSystem loggingSystem;

  public SqlEchoLoggingConfig(LoggingSystem loggingSystem) {
    this.loggingSystem = loggingSystem;
  }

  @PostConstruct
  void enableSqlEcho() {
    loggingSystem.setLogLevel(JDBC_LOGGER, LogLevel.DEBUG);
    logger.info("SQL echo enabled logger={}", JDBC_LOGGER);
  }
}
