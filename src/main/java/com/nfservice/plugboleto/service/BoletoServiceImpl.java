package com.nfservice.plugboleto.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nfservice.plugboleto.client.ApiResponse;
import com.nfservice.plugboleto.client.PlugBoletoClient;
import com.nfservice.plugboleto.client.ServiceEnvelope;
import com.nfservice.plugboleto.correlation.BatchCorrelator;
import com.nfservice.plugboleto.correlation.Correlation;
import com.nfservice.plugboleto.correlation.IssuanceReconciler;
import com.nfservice.plugboleto.exception.InvalidBoletoRequestException;
import com.nfservice.plugboleto.exception.ProcessingTimeoutException;
import com.nfservice.plugboleto.exception.SubmissionRejectedException;
import com.nfservice.plugboleto.exception.TransportFailureException;
import com.nfservice.plugboleto.model.FailedTitle;
import com.nfservice.plugboleto.model.IssuanceResult;
import com.nfservice.plugboleto.model.IssuedTitle;
import com.nfservice.plugboleto.model.PrintMode;
import com.nfservice.plugboleto.model.RemittanceResult;
import com.nfservice.plugboleto.model.RemittanceResult.RemittanceFailure;
import com.nfservice.plugboleto.model.Title;
import com.nfservice.plugboleto.model.TitleRequest;
import com.nfservice.plugboleto.polling.PollOutcome;
import com.nfservice.plugboleto.polling.PollPolicy;
import com.nfservice.plugboleto.polling.Poller;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Service implementation for issuance, querying, printing and the batch write operations.
 *
 * <p>Observability: structured log events are emitted per operation with the service
 * latency. The print protocol is added to MDC while its job is polled.
 * <ul>
 *   <li>{@code boleto.issue.submitted} - batch sent, with accepted and refused counts</li>
 *   <li>{@code boleto.issue.reconciled} - final success, error and unresolved counts</li>
 *   <li>{@code print.submitted}, {@code print.ready}, {@code print.timeout}</li>
 * </ul>
 */
@Service
public class BoletoServiceImpl implements BoletoService {

  private static final Logger LOG = LoggerFactory.getLogger(BoletoServiceImpl.class);

  static final String DEFAULT_LIMIT = "200";

  private final PlugBoletoClient client;
  private final Poller poller;
  private final BatchCorrelator correlator;
  private final IssuanceReconciler reconciler;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public BoletoServiceImpl(PlugBoletoClient client, Poller poller, BatchCorrelator correlator,
      IssuanceReconciler reconciler, ObjectMapper objectMapper, Clock clock) {
    this.client = client;
    this.poller = poller;
    this.correlator = correlator;
    this.reconciler = reconciler;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public IssuanceResult issue(List<TitleRequest> titles) {
    if (titles == null || titles.isEmpty()) {
      throw new InvalidBoletoRequestException(
          "É necessário informar pelo menos 1 (um) boleto para a emissão");
    }
    titles.forEach(TitleRequest::applyIssuanceDefaults);

    long start = clock.millis();
    ServiceEnvelope envelope = client.post("boletos/lote", titles, null).envelope();
    JsonNode data = envelope.getData();
    List<IssuedTitle> accepted = readList(data.path("_sucesso"), IssuedTitle.class);

    LOG.info("event=boleto.issue.submitted count={} accepted={} refused={} latencyMs={}",
        titles.size(), accepted.size(), data.path("_falha").size(), clock.millis() - start);

    IssuanceResult result = new IssuanceResult();
    result.setStatus(!envelope.isError());
    collectRefused(data, result);

    if (!accepted.isEmpty()) {
      List<String> ids = new ArrayList<>();
      accepted.forEach(title -> ids.add(title.getIntegrationId()));
      Correlation<Title> correlation = poller.pollUntilReady(
          () -> correlator.correlate(ids, this::readBackIssued, Title::getIntegrationId),
          ignored -> true,
          PollPolicy.ISSUANCE_CONFIRMATION).getResult();
      reconciler.reconcile(accepted, correlation, result);
    }

    LOG.info("event=boleto.issue.reconciled status={} success={} errors={} unresolved={}",
        result.isStatus(), result.getSuccess().size(), result.getErrors().size(),
        result.getUnresolved().size());
    return result;
  }

  @Override
  public List<Title> query(MultiValueMap<String, String> params) {
    MultiValueMap<String, String> effective = new LinkedMultiValueMap<>();
    if (params != null) {
      effective.addAll(params);
    }
    if (!effective.containsKey("limit")) {
      effective.add("limit", DEFAULT_LIMIT);
    }
    ServiceEnvelope envelope = requireSuccess(client.get("boletos", effective));
    return readList(envelope.getData(), Title.class);
  }

  @Override
  public List<Title> findByIntegrationIds(List<String> integrationIds) {
    if (integrationIds.isEmpty()) {
      return List.of();
    }
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("limit", String.valueOf(integrationIds.size()));
    integrationIds.forEach(id -> params.add("idintegracao", id));
    return query(params);
  }

  @Override
  public JsonNode discard(List<String> integrationIds) {
    requireIds(integrationIds, "o descarte");
    return requireSuccess(client.post("boletos/descarta/lote", integrationIds, defaultLimit()))
        .getData();
  }

  @Override
  public JsonNode writeOff(List<String> integrationIds) {
    requireIds(integrationIds, "a baixa");
    return requireSuccess(client.post("boletos/baixa/lote", integrationIds, defaultLimit()))
        .getData();
  }

  @Override
  public byte[] print(List<String> integrationIds, PrintMode mode) {
    requireIds(integrationIds, "a impressão");
    if (mode.isCustomLayout()) {
      throw new InvalidBoletoRequestException(
          "A impressão personalizada exige o layout, não a lista de boletos");
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("Boletos", integrationIds);
    body.put("TipoImpressao", mode.getCode());
    return submitPrint(body);
  }

  @Override
  public byte[] printCustomLayout(JsonNode layout) {
    if (layout == null || layout.isNull() || layout.isEmpty()) {
      throw new InvalidBoletoRequestException(
          "É necessário informar a personalização para a impressão");
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("Personalizacao", layout);
    body.put("TipoImpressao", PrintMode.CUSTOM.getCode());
    return submitPrint(body);
  }

  @Override
  public RemittanceResult generateRemittance(List<String> integrationIds) {
    requireIds(integrationIds, "gerar o arquivo remessa");
    ServiceEnvelope envelope = client.post("remessas/lote", integrationIds, null).envelope();
    JsonNode data = envelope.getData();

    RemittanceResult result = new RemittanceResult();
    JsonNode generated = data.path("_sucesso").path(0);
    if (!generated.isMissingNode() && !generated.isNull()) {
      result.setRemittance(generated);
      for (JsonNode title : generated.path("titulos")) {
        result.getTitles().add(title.path("idintegracao").asText());
      }
    }
    result.setStatus(!envelope.isError() && result.getRemittance() != null);
    for (JsonNode failure : data.path("_falha")) {
      result.getErrors().add(new RemittanceFailure(failure.path("idintegracao").asText(null),
          text(failure.path("_erro"))));
    }
    LOG.info("event=remittance.generated status={} titles={} errors={}", result.isStatus(),
        result.getTitles().size(), result.getErrors().size());
    return result;
  }

  private byte[] submitPrint(Map<String, Object> body) {
    ServiceEnvelope submitted = client.post("boletos/impressao/lote", body, defaultLimit())
        .envelope();
    if (submitted.isError()) {
      throw new SubmissionRejectedException(submitted.getMessage(), submitted.reasons("_erro"));
    }
    String protocol = submitted.getData().path("protocolo").asText(null);
    if (protocol == null || protocol.isBlank()) {
      throw new SubmissionRejectedException("Impressão enviada sem protocolo de processamento");
    }
    MDC.put("protocol", protocol);
    try {
      LOG.info("event=print.submitted protocol={} mode={}", protocol, body.get("TipoImpressao"));
      PollOutcome<ApiResponse> outcome = poller.pollUntilReady(
          () -> client.getBinary("boletos/impressao/lote/" + protocol, null),
          response -> !isStatusEnvelope(response),
          PollPolicy.PRINT_JOB);

      if (outcome.isReady()) {
        LOG.info("event=print.ready protocol={} attempts={} bytes={}", protocol,
            outcome.getAttempts(), outcome.getResult().getRaw().length);
        return outcome.getResult().getRaw();
      }

      ServiceEnvelope last = new ServiceEnvelope(asJson(outcome.getResult()));
      LOG.warn("event=print.timeout protocol={} attempts={} message={}", protocol,
          outcome.getAttempts(), last.getMessage());
      throw new ProcessingTimeoutException(protocol, last.getMessage(), last.reasons("situacao"));
    } finally {
      MDC.remove("protocol");
    }
  }

  /**
   * A print poll answer is a status envelope when it was decoded (non-200) or when its bytes
   * are a JSON object carrying {@code _status}. Anything else is the finished artifact.
   */
  boolean isStatusEnvelope(ApiResponse response) {
    if (response.isDecoded()) {
      return true;
    }
    return ServiceEnvelope.isEnvelope(sniffJson(response.getRaw()));
  }

  private JsonNode asJson(ApiResponse response) {
    return response.isDecoded() ? response.getBody() : sniffJson(response.getRaw());
  }

  private JsonNode sniffJson(byte[] raw) {
    if (raw == null || raw.length == 0) {
      return null;
    }
    int first = 0;
    while (first < raw.length && Character.isWhitespace(raw[first])) {
      first++;
    }
    if (first == raw.length || raw[first] != '{') {
      return null;
    }
    try {
      return objectMapper.readTree(new String(raw, StandardCharsets.UTF_8));
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private List<Title> readBackIssued(List<String> ids) {
    try {
      return findByIntegrationIds(ids);
    } catch (SubmissionRejectedException e) {
      LOG.warn("event=boleto.issue.readback_failed ids={} message={}", ids, e.getMessage());
      return List.of();
    }
  }

  private void collectRefused(JsonNode data, IssuanceResult result) {
    if (data.has("_falha")) {
      for (JsonNode item : data.path("_falha")) {
        result.getErrors().add(refused(item));
      }
    } else if (data.has("_erro")) {
      result.setError(text(data.path("_erro")));
    }
  }

  private FailedTitle refused(JsonNode item) {
    String integrationId = item.path("idintegracao").asText(null);
    if (item.has("TituloNossoNumero") && item.has("TituloNumeroDocumento")) {
      return new FailedTitle(integrationId, item.path("TituloNossoNumero").asText(),
          item.path("TituloNumeroDocumento").asText(), item.path("_erros").toString());
    }
    if (item.has("_erro") && item.has("_dados")) {
      return new FailedTitle(integrationId, null, null,
          item.path("_erro").path("erros").toString());
    }
    return new FailedTitle(integrationId, null, null, item.toString());
  }

  private ServiceEnvelope requireSuccess(ApiResponse response) {
    ServiceEnvelope envelope = response.envelope();
    if (envelope.isError()) {
      throw new SubmissionRejectedException(envelope.getMessage(), envelope.reasons("_erro"));
    }
    return envelope;
  }

  private <T> List<T> readList(JsonNode node, Class<T> type) {
    List<T> items = new ArrayList<>();
    if (!node.isArray()) {
      return items;
    }
    for (JsonNode item : node) {
      try {
        items.add(objectMapper.treeToValue(item, type));
      } catch (JsonProcessingException e) {
        throw new TransportFailureException(
            "Unexpected " + type.getSimpleName() + " payload from PlugBoleto", e);
      }
    }
    return items;
  }

  private static void requireIds(List<String> ids, String purpose) {
    if (ids == null || ids.isEmpty()) {
      throw new InvalidBoletoRequestException(
          "É necessário informar o idIntegracao de pelo menos 1 (um) boleto para " + purpose);
    }
  }

  private static MultiValueMap<String, String> defaultLimit() {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("limit", DEFAULT_LIMIT);
    return params;
  }

  private static String text(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) {
      return null;
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }
}
