package com.nfservice.plugboleto.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nfservice.plugboleto.model.IssuanceResult;
import com.nfservice.plugboleto.model.PrintMode;
import com.nfservice.plugboleto.model.RemittanceResult;
import com.nfservice.plugboleto.model.Title;
import com.nfservice.plugboleto.model.TitleRequest;
import java.util.List;
import org.springframework.util.MultiValueMap;

/**
 * Boleto operations against PlugBoleto.
 *
 * <p>Every operation that receives an error envelope throws
 * {@link com.nfservice.plugboleto.exception.SubmissionRejectedException}, except issuance,
 * which reports batch-level failure through {@link IssuanceResult#isStatus()}. Transport
 * failures propagate as
 * {@link com.nfservice.plugboleto.exception.TransportFailureException}.
 */
public interface BoletoService {

  /**
   * Submits a batch for issuance, waits once, reads back the accepted titles and splits them
   * into success, failure and unresolved.
   *
   * @throws com.nfservice.plugboleto.exception.InvalidBoletoRequestException if the batch is
   *     empty
   */
  IssuanceResult issue(List<TitleRequest> titles);

  /** Titles query; {@code limit=200} is added when the caller gives no limit. */
  List<Title> query(MultiValueMap<String, String> params);

  /** Titles for the given integration ids, fetched in one page sized to the id count. */
  List<Title> findByIntegrationIds(List<String> integrationIds);

  JsonNode discard(List<String> integrationIds);

  JsonNode writeOff(List<String> integrationIds);

  /**
   * Requests a print job for the titles and waits for the PDF.
   *
   * @return the PDF bytes
   * @throws com.nfservice.plugboleto.exception.ProcessingTimeoutException if the PDF is not
   *     ready after every attempt
   */
  byte[] print(List<String> integrationIds, PrintMode mode);

  /** Print job using a custom layout ({@link PrintMode#CUSTOM}). */
  byte[] printCustomLayout(JsonNode layout);

  RemittanceResult generateRemittance(List<String> integrationIds);
}
