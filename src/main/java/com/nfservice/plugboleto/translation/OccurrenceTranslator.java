package com.nfservice.plugboleto.translation;

import com.nfservice.plugboleto.model.Occurrence;
import com.nfservice.plugboleto.model.Title;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Translates a bank occurrence into a {@link NormalizedAction}.
 *
 * <p>Lookup is bank id, then layout, then occurrence code, against {@link BankRuleTable}.
 * Unknown banks and codes fall back to {@link ActionGenerators#DEFAULT}; translation never
 * fails because of a missing entry. Stateless.
 */
@Component
public class OccurrenceTranslator {

  private static final Logger LOG = LoggerFactory.getLogger(OccurrenceTranslator.class);

  public NormalizedAction translate(String bankId, LayoutVersion layout, Occurrence occurrence,
      Title title) {
    ActionGenerator generator = BankRuleTable.lookup(bankId, layout, occurrence.getCode())
        .orElseGet(() -> {
          LOG.debug("event=translation.fallback bank={} layout={} code={}", bankId,
              layout.getCode(), occurrence.getCode());
          return ActionGenerators.DEFAULT;
        });
    return generator.generate(title, occurrence);
  }

  public NormalizedAction translate(String bankId, String layoutCode, Occurrence occurrence,
      Title title) {
    return translate(bankId, LayoutVersion.fromCode(layoutCode), occurrence, title);
  }
}
