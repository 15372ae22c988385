package com.phillippitts.vani.service.turn;

import com.phillippitts.vani.domain.ExtractionResult;
import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.NormalizedUtterance;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.domain.TurnStatus;
import com.phillippitts.vani.domain.Utterance;
import com.phillippitts.vani.exception.EmptyUtteranceException;
import com.phillippitts.vani.service.context.ContextStore;
import com.phillippitts.vani.service.dispatch.Dispatcher;
import com.phillippitts.vani.service.dispatch.ResponseTemplates;
import com.phillippitts.vani.service.extract.ParameterExtractor;
import com.phillippitts.vani.service.intent.IntentResolver;
import com.phillippitts.vani.service.language.LanguageNormalizer;
import com.phillippitts.vani.service.metrics.TurnMetricsPublisher;
import com.phillippitts.vani.service.turn.event.TurnCompletedEvent;
import com.phillippitts.vani.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one utterance through normalize, resolve, extract and dispatch.
 *
 * <p><b>Turn discipline:</b> a turn is fully processed before the next one starts. Callers on
 * different threads (voice loop, REST) are serialized by a single lock, which is also the one
 * mutual-exclusion boundary around the context store's read-modify-write sequences.
 *
 * <p><b>Logging:</b> the ThreadContext carries {@code turnId}, {@code lang} and {@code intent}
 * for the duration of the turn. Transcripts are logged as previews only.
 *
 * @since 1.0
 */
public final class DefaultAssistantTurnService implements AssistantTurnService {

    private static final Logger LOG = LogManager.getLogger(DefaultAssistantTurnService.class);

    static final String MDC_TURN_ID = "turnId";
    static final String MDC_LANG = "lang";
    static final String MDC_INTENT = "intent";

    private final LanguageNormalizer normalizer;
    private final IntentResolver resolver;
    private final ParameterExtractor extractor;
    private final Dispatcher dispatcher;
    private final ResponseTemplates templates;
    private final ContextStore context;
    private final ApplicationEventPublisher publisher;
    private final TurnMetricsPublisher metrics;
    private final Lock turnLock = new ReentrantLock();

    public DefaultAssistantTurnService(LanguageNormalizer normalizer,
                                       IntentResolver resolver,
                                       ParameterExtractor extractor,
                                       Dispatcher dispatcher,
                                       ResponseTemplates templates,
                                       ContextStore context,
                                       ApplicationEventPublisher publisher,
                                       TurnMetricsPublisher metrics) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.publisher = publisher;
        this.metrics = metrics != null ? metrics : TurnMetricsPublisher.NOOP;
    }

    @Override
    public TurnResponse handle(Utterance utterance) {
        Objects.requireNonNull(utterance, "utterance must not be null");
        String turnId = UUID.randomUUID().toString().substring(0, 8);
        turnLock.lock();
        ThreadContext.put(MDC_TURN_ID, turnId);
        long start = System.nanoTime();
        try {
            TurnResponse response = process(utterance);
            long elapsed = System.nanoTime() - start;
            metrics.recordTurn(response.intent(), response.status(), elapsed);
            LOG.info("Turn done: intent={}, status={}, effect='{}', {}ms", response.intent(), response.status(),
                    response.sideEffect(), TimeUnit.NANOSECONDS.toMillis(elapsed));
            if (publisher != null) {
                publisher.publishEvent(new TurnCompletedEvent(turnId, response, Instant.now()));
            }
            return response;
        } finally {
            ThreadContext.remove(MDC_INTENT);
            ThreadContext.remove(MDC_LANG);
            ThreadContext.remove(MDC_TURN_ID);
            turnLock.unlock();
        }
    }

    private TurnResponse process(Utterance utterance) {
        NormalizedUtterance normalized = normalizer.normalize(utterance.text(), utterance.languageHint());
        ThreadContext.put(MDC_LANG, normalized.language().tag());
        String text;
        try {
            text = normalized.requireText();
        } catch (EmptyUtteranceException e) {
            LOG.debug("Empty utterance; re-prompting");
            return TurnResponse.failed(templates.emptyUtterance(normalized.language()), Intent.CONVERSATION,
                    normalized.language(), TurnStatus.EMPTY_UTTERANCE);
        }

        Intent intent = resolver.resolve(text, normalized.language());
        ThreadContext.put(MDC_INTENT, intent.name());
        LOG.info("Heard '{}' -> {}", LogSanitizer.preview(text), intent);

        ExtractionResult extraction = extractor.extract(intent, normalized);
        return dispatcher.dispatch(extraction, normalized.language(), context);
    }
}
