package com.nfservice.plugboleto.client;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nfservice.plugboleto.configuration.PlugBoletoProperties;
import com.nfservice.plugboleto.exception.TransportFailureException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

@DisplayName("PlugBoletoClient")
class PlugBoletoClientImplTest {

  private static final String BASE_URL = "http://localhost:8080/api/v1";

  private PlugBoletoClientImpl client;
  private MockRestServiceServer mockServer;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplate();
    mockServer = MockRestServiceServer.createServer(restTemplate);
    PlugBoletoProperties properties = PlugBoletoProperties
        .sandbox("01001001000113", "token-abc", "20202020000120")
        .withBaseUrl(BASE_URL + "/");
    client = new PlugBoletoClientImpl(restTemplate, properties, new ObjectMapper());
  }

  @Nested
  @DisplayName("Requests")
  class Requests {

    @Test
    @DisplayName("Should send credential headers and a JSON body")
    void shouldSendCredentialHeaders() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/retornos"))
          .andExpect(method(HttpMethod.POST))
          .andExpect(header("cnpj-sh", "01001001000113"))
          .andExpect(header("token-sh", "token-abc"))
          .andExpect(header("cnpj-cedente", "20202020000120"))
          .andExpect(content().json("{\"arquivo\": \"abc\"}"))
          .andRespond(withSuccess(
              "{\"_status\": \"sucesso\", \"_dados\": {\"protocolo\": \"P1\"}}",
              MediaType.APPLICATION_JSON));

      // when
      ApiResponse response = client.post("retornos", Map.of("arquivo", "abc"), null);

      // then
      assertEquals(200, response.getHttpCode());
      assertEquals("P1", response.envelope().getData().path("protocolo").asText());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should repeat multi-valued parameters and drop blank ones")
    void shouldEncodeRepeatedParameters() {
      // given
      MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
      params.add("idintegracao", "a");
      params.add("idintegracao", "b");
      params.add("limit", "2");
      params.add("situacao", "");
      mockServer.expect(requestTo(BASE_URL + "/boletos?idintegracao=a&idintegracao=b&limit=2"))
          .andExpect(method(HttpMethod.GET))
          .andRespond(withSuccess("{\"_status\": \"sucesso\", \"_dados\": []}",
              MediaType.APPLICATION_JSON));

      // when
      ApiResponse response = client.get("boletos", params);

      // then
      assertTrue(response.isDecoded());
      mockServer.verify();
    }

    @Test
    @DisplayName("Should select the production or sandbox base URL")
    void shouldSelectEnvironmentUrl() {
      PlugBoletoProperties sandbox = PlugBoletoProperties.sandbox("a", "b", "c");
      PlugBoletoProperties production = new PlugBoletoProperties("a", "b", "c", true, "",
          null, null);

      assertEquals("https://homologacao.plugboleto.com.br/api/v1", sandbox.getBaseUrl());
      assertEquals("https://plugboleto.com.br/api/v1", production.getBaseUrl());
      assertTrue(production.isProduction());
    }

    @Test
    @DisplayName("Should send PUT and DELETE to the same base URL")
    void shouldSendPutAndDelete() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/cedentes/1"))
          .andExpect(method(HttpMethod.PUT))
          .andExpect(header("token-sh", "token-abc"))
          .andRespond(withSuccess("{\"_status\": \"sucesso\"}", MediaType.APPLICATION_JSON));
      mockServer.expect(requestTo(BASE_URL + "/cedentes/1"))
          .andExpect(method(HttpMethod.DELETE))
          .andRespond(withSuccess("", MediaType.APPLICATION_JSON));

      // when
      ApiResponse updated = client.put("cedentes/1", Map.of("nome", "x"), null);
      ApiResponse deleted = client.delete("/cedentes/1", null);

      // then
      assertFalse(updated.envelope().isError());
      assertTrue(deleted.getBody().isNull());
      mockServer.verify();
    }
  }

  @Nested
  @DisplayName("Responses")
  class Responses {

    @Test
    @DisplayName("Should return the error envelope of a 4xx response")
    void shouldReturnErrorEnvelope_on4xx() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/boletos/lote"))
          .andRespond(withStatus(HttpStatus.BAD_REQUEST)
              .contentType(MediaType.APPLICATION_JSON)
              .body("{\"_status\": \"erro\", \"_mensagem\": \"Lote inválido\","
                  + " \"_dados\": [{\"_erro\": \"campo obrigatório\"}]}"));

      // when
      ApiResponse response = client.post("boletos/lote", new Object[0], null);

      // then
      assertEquals(400, response.getHttpCode());
      ServiceEnvelope envelope = response.envelope();
      assertTrue(envelope.isError());
      assertEquals("Lote inválido", envelope.getMessage());
      assertEquals(java.util.List.of("campo obrigatório"), envelope.reasons("_erro"));
      mockServer.verify();
    }

    @Test
    @DisplayName("Should throw TransportFailureException on 5xx")
    void shouldThrow_on5xx() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/boletos")).andRespond(withServerError());

      // when / then
      assertThrows(TransportFailureException.class, () -> client.get("boletos", null));
      mockServer.verify();
    }

    @Test
    @DisplayName("Should throw TransportFailureException on an unreadable body")
    void shouldThrow_onUnreadableBody() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/boletos"))
          .andRespond(withSuccess("<html>", MediaType.TEXT_HTML));

      // when / then
      assertThrows(TransportFailureException.class, () -> client.get("boletos", null));
    }

    @Test
    @DisplayName("Should keep a 200 body raw when decoding is off")
    void shouldKeepBinaryBody() {
      // given
      byte[] pdf = "%PDF-1.4 fake".getBytes();
      mockServer.expect(requestTo(BASE_URL + "/boletos/impressao/lote/P9"))
          .andRespond(withSuccess(pdf, MediaType.APPLICATION_PDF));

      // when
      ApiResponse response = client.getBinary("boletos/impressao/lote/P9", null);

      // then
      assertFalse(response.isDecoded());
      assertArrayEquals(pdf, response.getRaw());
    }

    @Test
    @DisplayName("Should decode non-200 binary responses as envelopes")
    void shouldDecodeBinaryErrors() {
      // given
      mockServer.expect(requestTo(BASE_URL + "/boletos/impressao/lote/P9"))
          .andRespond(withStatus(HttpStatus.NOT_FOUND)
              .contentType(MediaType.APPLICATION_JSON)
              .body("{\"_status\": \"erro\", \"_mensagem\": \"Protocolo não encontrado\"}"));

      // when
      ApiResponse response = client.getBinary("boletos/impressao/lote/P9", null);

      // then
      assertTrue(response.isDecoded());
      assertTrue(response.envelope().isError());
    }
  }
}
