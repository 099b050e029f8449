package com.nfservice.plugboleto.translation;

import com.nfservice.plugboleto.model.Occurrence;
import com.nfservice.plugboleto.model.Title;

/**
 * Builds the normalized action for one occurrence. Implementations must be pure: the result
 * depends only on the title snapshot and the occurrence.
 */
@FunctionalInterface
public interface ActionGenerator {

  NormalizedAction generate(Title title, Occurrence occurrence);
}
