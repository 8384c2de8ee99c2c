package com.eainde.boardingpass.pipeline;

import com.eainde.boardingpass.document.LoadedDocument;
import com.eainde.boardingpass.model.ExtractionMethod;

/**
 * One way of turning a document into a {@link Candidate}. Implementations report recoverable
 * problems through {@link StrategyOutcome#failure} instead of throwing.
 */
public interface ExtractionStrategy {

    String name();

    ExtractionMethod.Kind kind();

    StrategyOutcome attempt(LoadedDocument document, Deadline deadline);
}
