package com.nfservice.plugboleto.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.nfservice.plugboleto.exception.InvalidBoletoRequestException;
import com.nfservice.plugboleto.model.IssuanceResult;
import com.nfservice.plugboleto.model.PrintMode;
import com.nfservice.plugboleto.model.RemittanceResult;
import com.nfservice.plugboleto.model.ReturnFileRequest;
import com.nfservice.plugboleto.model.ReturnFileResult;
import com.nfservice.plugboleto.model.Title;
import com.nfservice.plugboleto.model.TitleRequest;
import com.nfservice.plugboleto.model.TranslationRequest;
import com.nfservice.plugboleto.service.BoletoService;
import com.nfservice.plugboleto.service.ReturnFileService;
import com.nfservice.plugboleto.translation.LayoutVersion;
import com.nfservice.plugboleto.translation.NormalizedAction;
import com.nfservice.plugboleto.translation.OccurrenceTranslator;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the boleto operations.
 *
 * <ul>
 *   <li>POST /api/v1/boletos - issue a batch of titles</li>
 *   <li>GET /api/v1/boletos - query titles (query parameters are forwarded)</li>
 *   <li>POST /api/v1/boletos/discard, /api/v1/boletos/write-off - batch discard and write-off</li>
 *   <li>POST /api/v1/boletos/print - print titles, returns the PDF</li>
 *   <li>POST /api/v1/boletos/print/custom - print with a custom layout</li>
 *   <li>POST /api/v1/remittances - generate a remittance file</li>
 *   <li>POST /api/v1/returns - process a bank return file</li>
 *   <li>POST /api/v1/occurrences/translate - translate one occurrence</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1")
public class BoletoController {

  private final BoletoService boletoService;
  private final ReturnFileService returnFileService;
  private final OccurrenceTranslator translator;

  public BoletoController(BoletoService boletoService, ReturnFileService returnFileService,
      OccurrenceTranslator translator) {
    this.boletoService = boletoService;
    this.returnFileService = returnFileService;
    this.translator = translator;
  }

  @PostMapping("/boletos")
  public ResponseEntity<IssuanceResult> issue(@RequestBody List<TitleRequest> titles) {
    return new ResponseEntity<>(boletoService.issue(titles), HttpStatus.OK);
  }

  @GetMapping("/boletos")
  public ResponseEntity<List<Title>> query(@RequestParam MultiValueMap<String, String> params) {
    return new ResponseEntity<>(boletoService.query(params), HttpStatus.OK);
  }

  @PostMapping("/boletos/discard")
  public ResponseEntity<JsonNode> discard(@RequestBody List<String> integrationIds) {
    return new ResponseEntity<>(boletoService.discard(integrationIds), HttpStatus.OK);
  }

  @PostMapping("/boletos/write-off")
  public ResponseEntity<JsonNode> writeOff(@RequestBody List<String> integrationIds) {
    return new ResponseEntity<>(boletoService.writeOff(integrationIds), HttpStatus.OK);
  }

  /**
   * Prints the titles and returns the PDF produced by the service.
   *
   * @param mode {@code TipoImpressao} code ({@code 0} normal, {@code 1}-{@code 4} booklet and
   *     watermark variants)
   */
  @PostMapping("/boletos/print")
  public ResponseEntity<byte[]> print(@RequestBody List<String> integrationIds,
      @RequestParam(value = "mode", defaultValue = "0") String mode) {
    byte[] pdf = boletoService.print(integrationIds, parseMode(mode));
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_PDF).body(pdf);
  }

  @PostMapping("/boletos/print/custom")
  public ResponseEntity<byte[]> printCustom(@RequestBody JsonNode layout) {
    byte[] pdf = boletoService.printCustomLayout(layout);
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_PDF).body(pdf);
  }

  @PostMapping("/remittances")
  public ResponseEntity<RemittanceResult> generateRemittance(
      @RequestBody List<String> integrationIds) {
    return new ResponseEntity<>(boletoService.generateRemittance(integrationIds), HttpStatus.OK);
  }

  @PostMapping("/returns")
  public ResponseEntity<ReturnFileResult> processReturn(@RequestBody ReturnFileRequest request) {
    ReturnFileResult result = returnFileService.process(request.getContent(),
        LayoutVersion.fromCode(request.getLayout()));
    return new ResponseEntity<>(result, HttpStatus.OK);
  }

  @PostMapping("/occurrences/translate")
  public ResponseEntity<NormalizedAction> translate(@RequestBody TranslationRequest request) {
    if (request.getOccurrence() == null || request.getTitle() == null) {
      throw new InvalidBoletoRequestException("Occurrence and title are required");
    }
    NormalizedAction action = translator.translate(request.getBankId(), request.getLayout(),
        request.getOccurrence(), request.getTitle());
    return new ResponseEntity<>(action, HttpStatus.OK);
  }

  private static PrintMode parseMode(String mode) {
    try {
      return PrintMode.fromCode(mode);
    } catch (IllegalArgumentException e) {
      throw new InvalidBoletoRequestException(e.getMessage());
    }
  }
}
