package com.nfservice.plugboleto.service;

import com.nfservice.plugboleto.model.ReturnFileResult;
import com.nfservice.plugboleto.translation.LayoutVersion;

/** Submits a bank return file and normalizes the occurrences it reports. */
public interface ReturnFileService {

  /**
   * Uploads the file, waits for the service to process it and translates every occurrence
   * of every reconciled title.
   *
   * <p>Only the "still processing" state is retried. If processing is not finished after
   * every attempt the flow continues with what the service reports and flags the operation
   * as timed out.
   *
   * @param content the raw return file content
   * @param layout the CNAB layout the file was written in
   * @throws com.nfservice.plugboleto.exception.SubmissionRejectedException if the service
   *     refuses the file or reports an error at any step
   * @throws com.nfservice.plugboleto.exception.InvalidBoletoRequestException if the content
   *     is empty
   */
  ReturnFileResult process(String content, LayoutVersion layout);
}
