package com.chessmatch.arena.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.chessmatch.arena.config.ChessWorkersClientProperties;
import com.chessmatch.arena.service.dto.MoveResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class ChessWorkersClientTest {

  private static final String FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";
  private static final String FEN_AFTER_E4 =
      "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1";

  @Test
  void moveSendsBoardMoveAndStates() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/move"))
        .andExpect(method(POST))
        .andExpect(
            content()
                .json(
                    """
                    {"fen":"%s","move":"e2e4","states":{"halfmove":"0"}}
                    """
                        .formatted(FEN)))
        .andRespond(
            withSuccess(
                """
                {"status":"MOVEOK","fen":"%s","states":{"halfmove":"1"}}
                """
                    .formatted(FEN_AFTER_E4),
                MediaType.APPLICATION_JSON));

    final MoveResult result = fixture.client.move(FEN, "e2e4", "{\"halfmove\":\"0\"}");

    assertThat(result.status()).isEqualTo("MOVEOK");
    assertThat(result.fen()).isEqualTo(FEN_AFTER_E4);
    assertThat(result.states()).isEqualTo("{\"halfmove\":\"1\"}");
    fixture.server.verify();
  }

  @Test
  void moveMaps400ToRejectedMoveWithWorkersMessage() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/move"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"message\":\"move puts player in check\"}"));

    assertThatThrownBy(() -> fixture.client.move(FEN, "e1e2", "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .hasMessage("move puts player in check")
        .extracting(ex -> ((ChessWorkersIntegrationException) ex).reason())
        .isEqualTo(ChessWorkersIntegrationException.Reason.MOVE_REJECTED);
  }

  @Test
  void moveFallsBackToGenericMessageWhenErrorBodyIsNotJson() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/move"))
        .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("nope"));

    assertThatThrownBy(() -> fixture.client.move(FEN, "zz", "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .hasMessage("invalid move");
  }

  @Test
  void moveMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("http://workers.test/move")).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.move(FEN, "e2e4", "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .satisfies(
            ex -> {
              final ChessWorkersIntegrationException integration =
                  (ChessWorkersIntegrationException) ex;
              assertThat(integration.reason())
                  .isEqualTo(ChessWorkersIntegrationException.Reason.BAD_GATEWAY);
              assertThat(integration.isClientError()).isFalse();
            });
    assertThat(fixture.meterRegistry.counter("arena.workers.error.total", "reason", "BAD_GATEWAY")
            .count())
        .isEqualTo(1.0);
  }

  @Test
  void moveMapsIncompleteBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/move"))
        .andRespond(withSuccess("{\"status\":\"MOVEOK\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.move(FEN, "e2e4", "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .extracting(ex -> ((ChessWorkersIntegrationException) ex).reason())
        .isEqualTo(ChessWorkersIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void moveMapsUnparseableBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/move"))
        .andRespond(withSuccess("not-json", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.move(FEN, "e2e4", "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .extracting(ex -> ((ChessWorkersIntegrationException) ex).reason())
        .isEqualTo(ChessWorkersIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void moveMapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/move"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.move(FEN, "e2e4", "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .extracting(ex -> ((ChessWorkersIntegrationException) ex).reason())
        .isEqualTo(ChessWorkersIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void moveMapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/move"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.client.move(FEN, "e2e4", "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .extracting(ex -> ((ChessWorkersIntegrationException) ex).reason())
        .isEqualTo(ChessWorkersIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void suggestReturnsWorkersMove() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/suggest"))
        .andExpect(method(POST))
        .andExpect(content().json("{\"fen\":\"%s\",\"states\":{}}".formatted(FEN)))
        .andRespond(withSuccess("{\"move\":\"e2e4\"}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.suggest(FEN, "{}")).isEqualTo("e2e4");
    fixture.server.verify();
  }

  @Test
  void suggestRejectsEmptySuggestion() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://workers.test/suggest"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.suggest(FEN, "{}"))
        .isInstanceOf(ChessWorkersIntegrationException.class)
        .extracting(ex -> ((ChessWorkersIntegrationException) ex).reason())
        .isEqualTo(ChessWorkersIntegrationException.Reason.INVALID_RESPONSE);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://workers.test").build();
    final ChessWorkersClientProperties properties =
        new ChessWorkersClientProperties("http://workers.test", "/move", "/suggest", null, null);
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    final ChessWorkersClient client =
        new ChessWorkersClient(
            restClient, properties, new ObjectMapper(), new ArenaMetrics(meterRegistry));
    return new ClientFixture(client, server, meterRegistry);
  }

  private record ClientFixture(
      ChessWorkersClient client, MockRestServiceServer server, SimpleMeterRegistry meterRegistry) {}
}
