package com.nfservice.plugboleto.correlation;

import com.nfservice.plugboleto.model.FailedTitle;
import com.nfservice.plugboleto.model.IssuanceResult;
import com.nfservice.plugboleto.model.IssuedTitle;
import com.nfservice.plugboleto.model.Title;
import com.nfservice.plugboleto.model.TitleStatus;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Splits accepted titles into success, failure and unresolved using the status read back
 * after issuance.
 *
 * <p>This is a best-effort read taken once after a fixed wait: a title can still change
 * status on the service side afterwards. Titles resolved as {@code FALHA} or
 * {@code REJEITADO} move to the failure bucket with the service motive; any other resolved
 * status stays in success, enriched with the query fields.
 */
@Component
public class IssuanceReconciler {

  private static final Set<TitleStatus> NOT_ISSUED = EnumSet.of(TitleStatus.REJECTED,
      TitleStatus.FAILED);

  public void reconcile(List<IssuedTitle> accepted, Correlation<Title> correlation,
      IssuanceResult result) {
    for (IssuedTitle title : accepted) {
      Title resolved = correlation.find(title.getIntegrationId()).orElse(null);
      if (resolved == null) {
        result.getUnresolved().add(title);
      } else if (NOT_ISSUED.contains(resolved.getStatus())) {
        String ourNumber = resolved.getOurNumber() != null
            ? resolved.getOurNumber()
            : title.getOurNumber();
        String documentNumber = resolved.getDocumentNumber() != null
            ? resolved.getDocumentNumber()
            : title.getDocumentNumber();
        result.getErrors().add(new FailedTitle(title.getIntegrationId(), ourNumber,
            documentNumber, resolved.getMotive()));
      } else {
        title.enrich(resolved);
        result.getSuccess().add(title);
      }
    }
  }
}
