/*
 * どこで: Arena サービス層
 * 何を: chess-workers へ着手検証/着手提案を同期で問い合わせる
 * なぜ: 合法手判定と終局判定を外部エンジンへ委譲し、失敗を利用者起因/下流障害に分類するため
 */
package com.chessmatch.arena.service;

import com.chessmatch.arena.config.ChessWorkersClientProperties;
import com.chessmatch.arena.service.dto.ChessWorkersErrorResponse;
import com.chessmatch.arena.service.dto.ChessWorkersMoveRequest;
import com.chessmatch.arena.service.dto.ChessWorkersMoveResponse;
import com.chessmatch.arena.service.dto.ChessWorkersSuggestRequest;
import com.chessmatch.arena.service.dto.ChessWorkersSuggestResponse;
import com.chessmatch.arena.service.dto.MoveResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class ChessWorkersClient {

  private static final Logger logger = LoggerFactory.getLogger(ChessWorkersClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient chessWorkersRestClient;

  private final ChessWorkersClientProperties properties;
  private final ObjectMapper objectMapper;
  private final ArenaMetrics metrics;

  public ChessWorkersClient(
      RestClient chessWorkersRestClient,
      ChessWorkersClientProperties properties,
      ObjectMapper objectMapper,
      ArenaMetrics metrics) {
    this.chessWorkersRestClient = chessWorkersRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
  }

  public MoveResult move(String fen, String move, String states) {
    final ChessWorkersMoveRequest request =
        new ChessWorkersMoveRequest(fen, move, readStates(states));
    try {
      final ChessWorkersMoveResponse response =
          requireMoveResponse(
              chessWorkersRestClient
                  .post()
                  .uri(properties.movePath())
                  .body(request)
                  .retrieve()
                  .body(ChessWorkersMoveResponse.class));
      return new MoveResult(response.status(), response.fen(), response.states().toString());
    } catch (RestClientResponseException ex) {
      throw record(mapResponseException(ex, "move"));
    } catch (ResourceAccessException ex) {
      throw record(mapResourceException(ex, "move"));
    } catch (ChessWorkersIntegrationException ex) {
      throw record(ex);
    } catch (RuntimeException ex) {
      logger.warn("chess-workers move response parse failed", ex);
      throw record(
          new ChessWorkersIntegrationException(
              ChessWorkersIntegrationException.Reason.INVALID_RESPONSE,
              "chess-workers response parse failed",
              ex));
    }
  }

  public String suggest(String fen, String states) {
    final ChessWorkersSuggestRequest request =
        new ChessWorkersSuggestRequest(fen, readStates(states));
    try {
      final ChessWorkersSuggestResponse response =
          chessWorkersRestClient
              .post()
              .uri(properties.suggestPath())
              .body(request)
              .retrieve()
              .body(ChessWorkersSuggestResponse.class);
      if (response == null || isBlank(response.move())) {
        throw new ChessWorkersIntegrationException(
            ChessWorkersIntegrationException.Reason.INVALID_RESPONSE,
            "chess-workers suggestion is invalid");
      }
      return response.move();
    } catch (RestClientResponseException ex) {
      throw record(mapResponseException(ex, "suggest"));
    } catch (ResourceAccessException ex) {
      throw record(mapResourceException(ex, "suggest"));
    } catch (ChessWorkersIntegrationException ex) {
      throw record(ex);
    } catch (RuntimeException ex) {
      logger.warn("chess-workers suggest response parse failed", ex);
      throw record(
          new ChessWorkersIntegrationException(
              ChessWorkersIntegrationException.Reason.INVALID_RESPONSE,
              "chess-workers response parse failed",
              ex));
    }
  }

  private ChessWorkersMoveResponse requireMoveResponse(ChessWorkersMoveResponse response) {
    if (response == null
        || isBlank(response.status())
        || isBlank(response.fen())
        || response.states() == null
        || !response.states().isObject()) {
      throw new ChessWorkersIntegrationException(
          ChessWorkersIntegrationException.Reason.INVALID_RESPONSE,
          "chess-workers response is invalid");
    }
    return response;
  }

  private ChessWorkersIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "chess-workers {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().is4xxClientError()) {
      return new ChessWorkersIntegrationException(
          ChessWorkersIntegrationException.Reason.MOVE_REJECTED, clientMessage(ex), ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new ChessWorkersIntegrationException(
          ChessWorkersIntegrationException.Reason.BAD_GATEWAY, "chess-workers server error", ex);
    }
    return new ChessWorkersIntegrationException(
        ChessWorkersIntegrationException.Reason.BAD_GATEWAY, "chess-workers request failed", ex);
  }

  private ChessWorkersIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("chess-workers {} timed out", operation);
      return new ChessWorkersIntegrationException(
          ChessWorkersIntegrationException.Reason.TIMEOUT, "chess-workers request timeout", ex);
    }
    logger.warn("chess-workers {} connection failed", operation, ex);
    return new ChessWorkersIntegrationException(
        ChessWorkersIntegrationException.Reason.BAD_GATEWAY, "chess-workers connection failed", ex);
  }

  // 4xx 本文の message (invalid move, move puts player in check など) を利用者へそのまま返す
  private String clientMessage(RestClientResponseException ex) {
    try {
      final ChessWorkersErrorResponse body =
          objectMapper.readValue(ex.getResponseBodyAsString(), ChessWorkersErrorResponse.class);
      if (body != null && !isBlank(body.message())) {
        return body.message();
      }
    } catch (JsonProcessingException parseFailure) {
      logger.debug("chess-workers error body is not json", parseFailure);
    }
    return "invalid move";
  }

  private JsonNode readStates(String states) {
    try {
      return objectMapper.readTree(isBlank(states) ? "{}" : states);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored game states are not valid json", ex);
    }
  }

  private ChessWorkersIntegrationException record(ChessWorkersIntegrationException ex) {
    metrics.recordWorkersError(ex.reason().name());
    return ex;
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
