package com.phillippitts.vani.presentation.controller;

import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.service.turn.AssistantTurnService;
import com.phillippitts.vani.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs one assistant turn from a transcript, for clients that do their own speech handling.
 *
 * <p>Turns from concurrent callers are serialized by the turn service.
 */
@RestController
@RequestMapping("/api/turns")
class TurnController {

    private static final Logger LOG = LogManager.getLogger(TurnController.class);

    private final AssistantTurnService turns;

    TurnController(AssistantTurnService turns) {
        this.turns = turns;
    }

    @PostMapping
    ResponseEntity<TurnResult> handle(@Valid @RequestBody TurnRequest request) {
        LOG.debug("Turn request: {}", LogSanitizer.preview(request.transcript()));
        Language hint = Language.fromTag(request.language()).orElse(null);
        TurnResponse response = turns.handle(request.transcript(), hint);
        return ResponseEntity.ok(TurnResult.from(response));
    }

    /**
     * @param transcript raw transcript; empty is allowed and answered with a re-prompt
     * @param language   optional ISO 639-1 hint ("en", "hi", "gu")
     */
    record TurnRequest(
            @NotNull @Size(max = 2000) String transcript,
            @Pattern(regexp = "(?i)en|hi|gu", message = "language must be one of en, hi, gu") String language
    ) {}

    record TurnResult(
            String response,
            String sideEffect,
            String intent,
            String language,
            String status,
            boolean sessionFinished
    ) {
        static TurnResult from(TurnResponse r) {
            return new TurnResult(r.responseText(), r.sideEffect(), r.intent().name(),
                    r.language().tag(), r.status().name(), r.sessionFinished());
        }
    }
}
