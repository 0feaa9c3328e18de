/*
 * どこで: Arena 設定
 * 何を: chess-workers 呼び出し専用 RestClient を提供する
 * なぜ: 下流ごとに baseUrl とタイムアウトの責務を分離するため
 */
package com.chessmatch.arena.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ChessWorkersClientProperties.class)
public class ChessWorkersClientConfig {

  @Bean
  RestClient chessWorkersRestClient(
      RestClient.Builder builder, ChessWorkersClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
