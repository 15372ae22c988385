package com.phillippitts.vani.service.extract;

import com.phillippitts.vani.domain.ExtractionResult;
import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.NormalizedUtterance;

/**
 * Fills the slot schema of a resolved intent from the utterance text.
 *
 * <p>Extraction never invents values: a required slot that cannot be found is reported as
 * missing, and optional slots (the browser of a website command) are simply left out.
 * Pure function of (intent, text, language).
 */
public interface ParameterExtractor {

    /**
     * @param intent    intent chosen by the resolver
     * @param utterance normalized utterance the intent was resolved from
     * @return complete command, or the list of missing required slots
     */
    ExtractionResult extract(Intent intent, NormalizedUtterance utterance);
}
