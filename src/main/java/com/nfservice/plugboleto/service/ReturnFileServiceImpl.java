package com.nfservice.plugboleto.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nfservice.plugboleto.client.PlugBoletoClient;
import com.nfservice.plugboleto.client.ServiceEnvelope;
import com.nfservice.plugboleto.correlation.BatchCorrelator;
import com.nfservice.plugboleto.correlation.Correlation;
import com.nfservice.plugboleto.exception.InvalidBoletoRequestException;
import com.nfservice.plugboleto.exception.SubmissionRejectedException;
import com.nfservice.plugboleto.exception.TransportFailureException;
import com.nfservice.plugboleto.model.AsyncOperation;
import com.nfservice.plugboleto.model.Occurrence;
import com.nfservice.plugboleto.model.OperationStatus;
import com.nfservice.plugboleto.model.ReturnFileResult;
import com.nfservice.plugboleto.model.Title;
import com.nfservice.plugboleto.model.UnreconciledTitle;
import com.nfservice.plugboleto.polling.PollOutcome;
import com.nfservice.plugboleto.polling.PollPolicy;
import com.nfservice.plugboleto.polling.Poller;
import com.nfservice.plugboleto.translation.LayoutVersion;
import com.nfservice.plugboleto.translation.NormalizedAction;
import com.nfservice.plugboleto.translation.OccurrenceTranslator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Return-file processing: submit, wait for {@code PROCESSADO}, fetch the referenced titles
 * and translate their movements.
 *
 * <p>States: submitted, then processing, then processed; or submitted then error. When the
 * processing budget runs out the flow still proceeds with the last status read (soft
 * timeout, see {@link AsyncOperation#isTimedOut()}).
 */
@Service
public class ReturnFileServiceImpl implements ReturnFileService {

  private static final Logger LOG = LoggerFactory.getLogger(ReturnFileServiceImpl.class);

  private final PlugBoletoClient client;
  private final Poller poller;
  private final BatchCorrelator correlator;
  private final BoletoService boletoService;
  private final OccurrenceTranslator translator;
  private final ObjectMapper objectMapper;

  public ReturnFileServiceImpl(PlugBoletoClient client, Poller poller,
      BatchCorrelator correlator, BoletoService boletoService, OccurrenceTranslator translator,
      ObjectMapper objectMapper) {
    this.client = client;
    this.poller = poller;
    this.correlator = correlator;
    this.boletoService = boletoService;
    this.translator = translator;
    this.objectMapper = objectMapper;
  }

  @Override
  public ReturnFileResult process(String content, LayoutVersion layout) {
    if (content == null || content.isBlank()) {
      throw new InvalidBoletoRequestException(
          "É obrigatório o envio do conteúdo do arquivo retorno");
    }

    ServiceEnvelope submitted = client.post("retornos", Map.of("arquivo", content), null)
        .envelope();
    if (submitted.isError()) {
      throw new SubmissionRejectedException(submitted.getMessage(), submitted.reasons("_erro"));
    }
    String protocol = submitted.getData().path("protocolo").asText(null);
    if (protocol == null || protocol.isBlank()) {
      throw new SubmissionRejectedException("Retorno enviado sem protocolo de processamento");
    }

    MDC.put("protocol", protocol);
    try {
      LOG.info("event=return.submitted protocol={} layout={}", protocol, layout.getCode());
      return processSubmitted(protocol, layout);
    } finally {
      MDC.remove("protocol");
    }
  }

  private ReturnFileResult processSubmitted(String protocol, LayoutVersion layout) {
    AsyncOperation operation = AsyncOperation.submitted(protocol, PollPolicy.RETURN_FILE_STATUS);

    PollOutcome<ServiceEnvelope> first = poller.pollUntilReady(
        () -> fetchStatus(protocol, null), ignored -> true, PollPolicy.RETURN_FILE_STATUS);
    ServiceEnvelope status = first.getResult();
    operation = operation.after(first, statusOf(status), PollPolicy.RETURN_FILE_STATUS);

    if (operation.getStatus() == OperationStatus.PROCESSING) {
      int processed = status.getData().path("processados").asInt(0);
      MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
      if (processed > 0) {
        params.add("limit", String.valueOf(processed));
      }
      LOG.info("event=return.polling protocol={} processed={}", protocol, processed);

      PollOutcome<ServiceEnvelope> outcome = poller.pollUntilReady(
          () -> fetchStatus(protocol, params),
          envelope -> statusOf(envelope) != OperationStatus.PROCESSING,
          PollPolicy.RETURN_FILE_PROCESSING);
      status = outcome.getResult();
      operation = operation.after(outcome, statusOf(status), PollPolicy.RETURN_FILE_PROCESSING);
      if (operation.isTimedOut()) {
        LOG.warn("event=return.timeout protocol={} attempts={} processed={}", protocol,
            operation.getAttemptsConsumed(), status.getData().path("processados").asText());
      }
    }

    if (operation.getStatus() == OperationStatus.ERROR) {
      String situacao = status.getData().path("situacao").asText("");
      throw new SubmissionRejectedException(
          "Situação inesperada no processamento do retorno " + protocol + ": " + situacao,
          status.reasons("_erro"));
    }

    ReturnFileResult result = new ReturnFileResult();
    result.setOperation(operation);
    JsonNode data = status.getData();
    result.setUnreconciled(readUnreconciled(data.path("titulosNaoConciliados")));

    List<String> ids = new ArrayList<>();
    for (JsonNode title : data.path("titulos")) {
      ids.add(title.path("idIntegracao").asText());
    }
    Correlation<Title> correlation = correlator.correlate(ids,
        boletoService::findByIntegrationIds, Title::getIntegrationId);

    correlation.getResolved().forEach((id, title) ->
        result.getTitles().put(id, translate(title, layout)));
    result.setUnresolved(new ArrayList<>(correlation.getUnresolved()));

    LOG.info("event=return.processed protocol={} titles={} unreconciled={} unresolved={} "
            + "timedOut={}", protocol, result.getTitles().size(), result.getUnreconciled().size(),
        result.getUnresolved().size(), operation.isTimedOut());
    return result;
  }

  private List<NormalizedAction> translate(Title title, LayoutVersion layout) {
    List<NormalizedAction> actions = new ArrayList<>();
    for (Occurrence occurrence : title.getOccurrences()) {
      actions.add(translator.translate(title.getBankCode(), layout, occurrence, title)
          .withOrigin(occurrence.getCode(), occurrence.getDate()));
    }
    return actions;
  }

  private ServiceEnvelope fetchStatus(String protocol, MultiValueMap<String, String> params) {
    ServiceEnvelope envelope = client.get("retornos/" + protocol, params).envelope();
    if (envelope.isError()) {
      throw new SubmissionRejectedException(envelope.getMessage(), envelope.reasons("_erro"));
    }
    return envelope;
  }

  private static OperationStatus statusOf(ServiceEnvelope envelope) {
    return OperationStatus.fromSituacao(envelope.getData().path("situacao").asText(null));
  }

  private List<UnreconciledTitle> readUnreconciled(JsonNode node) {
    List<UnreconciledTitle> titles = new ArrayList<>();
    for (JsonNode item : node) {
      try {
        titles.add(objectMapper.treeToValue(item, UnreconciledTitle.class));
      } catch (JsonProcessingException e) {
        throw new TransportFailureException("Unexpected unreconciled title payload", e);
      }
    }
    return titles;
  }
}
