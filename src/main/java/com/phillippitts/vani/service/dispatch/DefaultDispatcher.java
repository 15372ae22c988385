package com.phillippitts.vani.service.dispatch;

import com.phillippitts.vani.domain.ConversationTurn;
import com.phillippitts.vani.domain.ExtractionResult;
import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.ParsedCommand;
import com.phillippitts.vani.domain.SearchSource;
import com.phillippitts.vani.domain.Slots;
import com.phillippitts.vani.domain.SystemStatus;
import com.phillippitts.vani.domain.TurnResponse;
import com.phillippitts.vani.domain.TurnStatus;
import com.phillippitts.vani.domain.VisionContext;
import com.phillippitts.vani.domain.VolumeDirection;
import com.phillippitts.vani.exception.CollaboratorException;
import com.phillippitts.vani.exception.CollaboratorTimeoutException;
import com.phillippitts.vani.exception.CollaboratorUnavailableException;
import com.phillippitts.vani.exception.DesktopActionFailedException;
import com.phillippitts.vani.exception.ResourceBusyException;
import com.phillippitts.vani.exception.StaleContextException;
import com.phillippitts.vani.exception.TurnCancelledException;
import com.phillippitts.vani.service.collaborator.CollaboratorNames;
import com.phillippitts.vani.service.collaborator.ConversationRequest;
import com.phillippitts.vani.service.collaborator.ImageFrame;
import com.phillippitts.vani.service.collaborator.SearchKind;
import com.phillippitts.vani.service.collaborator.SearchSnippet;
import com.phillippitts.vani.service.collaborator.WebSearchRequest;
import com.phillippitts.vani.service.context.ContextStore;
import com.phillippitts.vani.service.context.ContextUpdate;
import com.phillippitts.vani.service.dispatch.event.CollaboratorFailureEvent;
import com.phillippitts.vani.service.metrics.TurnMetricsPublisher;
import com.phillippitts.vani.service.resource.ExclusiveResource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Routes each intent to exactly one collaborator call, with one exception: search and
 * knowledge turns may fall back to the other source once.
 *
 * <p><b>Fallback policy:</b>
 * <ul>
 *   <li>web search timed out or found nothing: one knowledge lookup</li>
 *   <li>knowledge lookup timed out or found nothing: one web search</li>
 *   <li>fallback also failed: "could not find information" response</li>
 * </ul>
 * Other collaborator failures become an error response immediately. Desktop failures are
 * spoken verbatim.
 *
 * <p><b>Context writes:</b> a successful turn commits the user turn, the reply and any new
 * vision or search context in one {@link ContextStore#apply(ContextUpdate)}. Failed turns
 * commit nothing. Reset is the only intent that clears the store.
 *
 * <p>Every collaborator failure, recovered or not, is published as a
 * {@link CollaboratorFailureEvent} and counted.
 *
 * @since 1.0
 */
public final class DefaultDispatcher implements Dispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultDispatcher.class);

    private static final int MAX_SNIPPET_CHARS = 400;
    private static final String REASON_TIMEOUT = "timeout";
    private static final String REASON_UNAVAILABLE = "unavailable";
    private static final String REASON_FAILED = "failed";

    private final DispatchSettings settings;
    private final DispatchCollaborators collaborators;
    private final ExclusiveResource camera;
    private final ApplicationEventPublisher publisher;
    private final TurnMetricsPublisher metrics;
    private final ResponseTemplates templates;
    private final PromptBuilder prompts;

    /**
     * @param settings      fixed assistant configuration
     * @param collaborators collaborator per capability domain
     * @param camera        camera lease held while a frame is captured
     * @param publisher     failure event sink (nullable)
     * @param metrics       metrics sink (use {@link TurnMetricsPublisher#NOOP} when not needed)
     */
    public DefaultDispatcher(DispatchSettings settings,
                             DispatchCollaborators collaborators,
                             ExclusiveResource camera,
                             ApplicationEventPublisher publisher,
                             TurnMetricsPublisher metrics) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators must not be null");
        this.camera = Objects.requireNonNull(camera, "camera must not be null");
        this.publisher = publisher;
        this.metrics = metrics != null ? metrics : TurnMetricsPublisher.NOOP;
        this.templates = new ResponseTemplates(settings);
        this.prompts = new PromptBuilder(settings);
    }

    public ResponseTemplates templates() {
        return templates;
    }

    @Override
    public TurnResponse dispatch(ParsedCommand command, ContextStore context) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Language language = command.language();
        Intent intent = command.intent();
        Outcome outcome;
        try {
            outcome = route(command, context);
        } catch (DesktopActionFailedException e) {
            report(CollaboratorNames.DESKTOP, REASON_FAILED, e, false);
            return TurnResponse.failed(e.getReason(), intent, language, TurnStatus.DESKTOP_ACTION_FAILED);
        } catch (CollaboratorTimeoutException e) {
            report(e.getCollaborator(), REASON_TIMEOUT, e, false);
            return TurnResponse.failed(templates.timedOut(language), intent, language,
                    TurnStatus.COLLABORATOR_TIMEOUT);
        } catch (CollaboratorException e) {
            report(e.getCollaborator(), REASON_UNAVAILABLE, e, false);
            String text = isCameraSide(e.getCollaborator())
                    ? templates.cameraUnavailable(language)
                    : templates.couldNotProcess(language);
            return TurnResponse.failed(text, intent, language, TurnStatus.COLLABORATOR_UNAVAILABLE);
        } catch (StaleContextException e) {
            LOG.info("Follow-up referenced expired {} context", e.getKind());
            return TurnResponse.failed(templates.staleVision(language), intent, language, TurnStatus.STALE_CONTEXT);
        } catch (ResourceBusyException e) {
            LOG.warn("{} busy; turn not dispatched", e.getResourceName());
            return TurnResponse.failed(templates.deviceBusy(language), intent, language, TurnStatus.RESOURCE_BUSY);
        } catch (TurnCancelledException e) {
            LOG.info("Turn cancelled: {}", e.getMessage());
            return TurnResponse.failed(templates.cancelled(language), intent, language, TurnStatus.CANCELLED);
        }
        if (outcome.update() != null) {
            context.apply(outcome.update());
        }
        return outcome.response();
    }

    @Override
    public TurnResponse clarify(ExtractionResult incomplete, Language language) {
        Objects.requireNonNull(incomplete, "incomplete must not be null");
        Objects.requireNonNull(language, "language must not be null");
        if (incomplete.isComplete()) {
            throw new IllegalArgumentException("Extraction for " + incomplete.intent() + " is complete");
        }
        String slot = incomplete.missingSlots().get(0);
        LOG.debug("Asking for missing slot '{}' of {}", slot, incomplete.intent());
        return TurnResponse.failed(templates.clarify(language, incomplete.intent(), slot),
                incomplete.intent(), language, TurnStatus.MISSING_PARAMETER);
    }

    private Outcome route(ParsedCommand command, ContextStore context) {
        return switch (command.intent()) {
            case EXIT -> exit(command);
            case RESET -> reset(command, context);
            case IDENTITY -> ok(command, templates.identity(command.language()), "introduced assistant",
                    exchange(command, templates.identity(command.language())));
            case VISION -> vision(command, context);
            case OPEN_WEBSITE -> openWebsite(command);
            case OPEN_APP -> openApplication(command);
            case CLOSE_APP -> closeApplication(command);
            case SCREENSHOT -> screenshot(command);
            case SYSTEM_STATUS -> systemStatus(command);
            case VOLUME_CONTROL -> volume(command);
            case WEB_SEARCH -> settings.webSearchEnabled() ? webSearch(command) : conversation(command, context);
            case KNOWLEDGE -> settings.webSearchEnabled() ? knowledge(command) : conversation(command, context);
            case CONVERSATION -> conversation(command, context);
        };
    }

    private Outcome exit(ParsedCommand command) {
        String text = templates.goodbye(command.language());
        TurnResponse response = new TurnResponse(text, "session finished", Intent.EXIT, command.language(),
                TurnStatus.OK, true);
        return new Outcome(response, exchange(command, text).build());
    }

    private Outcome reset(ParsedCommand command, ContextStore context) {
        context.reset();
        return new Outcome(TurnResponse.ok(templates.historyCleared(command.language()), "context reset",
                Intent.RESET, command.language()), null);
    }

    private Outcome vision(ParsedCommand command, ContextStore context) {
        Language language = command.language();
        String text = command.text();
        if (VisionQuestions.isFollowUp(text)) {
            Optional<VisionContext> current = context.getVisionContext();
            if (current.isPresent()) {
                List<ConversationTurn> history = promptHistory(context, language);
                String reply = reply(prompts.visionFollowUp(text, language, history, current.get()), history,
                        language);
                return ok(command, reply, "answered from last frame", exchange(command, reply).refreshVision());
            }
            if (context.isVisionContextExpired()) {
                throw new StaleContextException(StaleContextException.ContextKind.VISION);
            }
        }

        String question = VisionQuestions.questionFor(text);
        ImageFrame frame;
        try (ExclusiveResource.Lease lease = camera.acquire()) {
            frame = collaborators.camera().capture();
        }
        LOG.debug("Asking vision model: '{}'", question);
        String description = collaborators.vision().describe(frame, question);
        if (description == null || description.isBlank()) {
            throw new CollaboratorUnavailableException("Empty description", CollaboratorNames.VISION_MODEL);
        }
        description = description.trim();
        String response = templates.visionDescription(language, description);
        return ok(command, response, "described camera frame", exchange(command, response).vision(description));
    }

    private Outcome openWebsite(ParsedCommand command) {
        String site = command.require(Slots.SITE);
        String browser = command.slot(Slots.BROWSER)
                .orElse(settings.hasDefaultBrowser() ? settings.defaultBrowser() : null);
        collaborators.desktop().openWebsite("https://" + site, browser);
        String effect = browser == null ? "opened " + site : "opened " + site + " in " + browser;
        String text = templates.openedWebsite(command.language(), site);
        return ok(command, text, effect, exchange(command, text));
    }

    private Outcome openApplication(ParsedCommand command) {
        String app = command.require(Slots.APP);
        collaborators.desktop().openApplication(app);
        String text = templates.openedApplication(command.language(), app);
        return ok(command, text, "opened " + app, exchange(command, text));
    }

    private Outcome closeApplication(ParsedCommand command) {
        String app = command.require(Slots.APP);
        collaborators.desktop().closeApplication(app);
        String text = templates.closedApplication(command.language(), app);
        return ok(command, text, "closed " + app, exchange(command, text));
    }

    private Outcome screenshot(ParsedCommand command) {
        String location = collaborators.desktop().takeScreenshot();
        String text = templates.screenshotSaved(command.language(), location);
        return ok(command, text, "screenshot saved", exchange(command, text));
    }

    private Outcome systemStatus(ParsedCommand command) {
        SystemStatus status = collaborators.desktop().systemStatus();
        String text = templates.systemStatus(command.language(), status);
        return ok(command, text, "system status read", exchange(command, text));
    }

    private Outcome volume(ParsedCommand command) {
        VolumeDirection direction = VolumeDirection.fromSlot(command.require(Slots.DIRECTION))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown volume direction: " + command.require(Slots.DIRECTION)));
        collaborators.desktop().adjustVolume(direction);
        String text = templates.volume(command.language(), direction);
        return ok(command, text, "volume " + direction.slotValue(), exchange(command, text));
    }

    private Outcome webSearch(ParsedCommand command) {
        String query = command.require(Slots.QUERY);
        SearchKind kind = "news".equals(command.slot(Slots.SEARCH_KIND).orElse(""))
                ? SearchKind.NEWS : SearchKind.GENERAL;
        List<SearchSnippet> hits;
        try {
            hits = search(query, kind);
        } catch (CollaboratorTimeoutException e) {
            LOG.info("Web search timed out; trying knowledge lookup");
            return knowledgeFallback(command, query, e);
        }
        if (hits.isEmpty()) {
            LOG.info("Web search found nothing; trying knowledge lookup");
            return knowledgeFallback(command, query, null);
        }
        return webAnswer(command, query, hits);
    }

    private Outcome knowledge(ParsedCommand command) {
        String query = command.require(Slots.QUERY);
        Optional<String> snippet;
        try {
            snippet = lookup(query, command.language());
        } catch (CollaboratorTimeoutException e) {
            LOG.info("Knowledge lookup timed out; trying web search");
            return webFallback(command, query, e);
        }
        if (snippet.isEmpty()) {
            LOG.info("Knowledge lookup found nothing; trying web search");
            return webFallback(command, query, null);
        }
        return knowledgeAnswer(command, query, snippet.get());
    }

    private Outcome knowledgeFallback(ParsedCommand command, String query, CollaboratorTimeoutException primary) {
        Optional<String> snippet;
        try {
            snippet = lookup(query, command.language());
        } catch (CollaboratorTimeoutException e) {
            reportPrimary(primary, false);
            report(e.getCollaborator(), REASON_TIMEOUT, e, false);
            return notFound(command);
        } catch (CollaboratorException e) {
            reportPrimary(primary, false);
            throw e;
        }
        reportPrimary(primary, snippet.isPresent());
        return snippet.map(s -> knowledgeAnswer(command, query, s)).orElseGet(() -> notFound(command));
    }

    private Outcome webFallback(ParsedCommand command, String query, CollaboratorTimeoutException primary) {
        List<SearchSnippet> hits;
        try {
            hits = search(query, SearchKind.GENERAL);
        } catch (CollaboratorTimeoutException e) {
            reportPrimary(primary, false);
            report(e.getCollaborator(), REASON_TIMEOUT, e, false);
            return notFound(command);
        } catch (CollaboratorException e) {
            reportPrimary(primary, false);
            throw e;
        }
        reportPrimary(primary, !hits.isEmpty());
        return hits.isEmpty() ? notFound(command) : webAnswer(command, query, hits);
    }

    private List<SearchSnippet> search(String query, SearchKind kind) {
        List<SearchSnippet> hits = collaborators.webSearch()
                .search(new WebSearchRequest(query, kind, settings.maxSearchResults()));
        if (hits == null) {
            return List.of();
        }
        return hits.stream().filter(h -> !h.text().isBlank()).collect(Collectors.toList());
    }

    private Optional<String> lookup(String query, Language language) {
        Optional<String> snippet = collaborators.knowledge().lookup(query, language);
        return snippet == null ? Optional.empty() : snippet.map(String::trim).filter(s -> !s.isEmpty());
    }

    private Outcome webAnswer(ParsedCommand command, String query, List<SearchSnippet> hits) {
        String summary = hits.stream()
                .limit(settings.maxSearchResults())
                .map(h -> truncate(h.text().trim()))
                .collect(Collectors.joining(" "));
        String text = templates.searchResults(command.language(), summary);
        return ok(command, text, "searched web (" + hits.size() + " results)",
                exchange(command, text).search(query, summary, SearchSource.WEB));
    }

    private Outcome knowledgeAnswer(ParsedCommand command, String query, String snippet) {
        return ok(command, snippet, "knowledge lookup",
                exchange(command, snippet).search(query, snippet, SearchSource.WIKIPEDIA));
    }

    private Outcome notFound(ParsedCommand command) {
        return new Outcome(TurnResponse.failed(templates.notFound(command.language()), command.intent(),
                command.language(), TurnStatus.NOT_FOUND), null);
    }

    private Outcome conversation(ParsedCommand command, ContextStore context) {
        Language language = command.language();
        List<ConversationTurn> history = promptHistory(context, language);
        String prompt = prompts.conversation(command.text(), language, history,
                context.getVisionContext(), context.getSearchContext());
        String reply = reply(prompt, history, language);
        return ok(command, reply, "conversation reply", exchange(command, reply));
    }

    private String reply(String prompt, List<ConversationTurn> history, Language language) {
        String reply = collaborators.conversation().reply(new ConversationRequest(prompt, history, language));
        if (reply == null || reply.isBlank()) {
            throw new CollaboratorUnavailableException("Empty reply", CollaboratorNames.CONVERSATION_MODEL);
        }
        return reply.trim();
    }

    private List<ConversationTurn> promptHistory(ContextStore context, Language language) {
        return PromptBuilder.sameLanguage(context.recentTurns(settings.promptHistorySize()), language);
    }

    private static ContextUpdate.Builder exchange(ParsedCommand command, String reply) {
        return ContextUpdate.builder()
                .turn(ConversationTurn.user(command.text(), command.language()))
                .turn(ConversationTurn.assistant(reply, command.language()));
    }

    private static Outcome ok(ParsedCommand command, String text, String sideEffect, ContextUpdate.Builder update) {
        return new Outcome(TurnResponse.ok(text, sideEffect, command.intent(), command.language()), update.build());
    }

    private void reportPrimary(CollaboratorTimeoutException primary, boolean recovered) {
        if (primary != null) {
            report(primary.getCollaborator(), REASON_TIMEOUT, primary, recovered);
        }
    }

    private void report(String collaborator, String reason, Exception e, boolean recovered) {
        metrics.recordCollaboratorFailure(collaborator, reason);
        if (publisher != null) {
            publisher.publishEvent(new CollaboratorFailureEvent(collaborator, reason, e.getMessage(), recovered,
                    Instant.now()));
        }
    }

    private static boolean isCameraSide(String collaborator) {
        return CollaboratorNames.CAMERA.equals(collaborator) || CollaboratorNames.VISION_MODEL.equals(collaborator);
    }

    private static String truncate(String text) {
        return text.length() <= MAX_SNIPPET_CHARS ? text : text.substring(0, MAX_SNIPPET_CHARS).trim() + "...";
    }

    private record Outcome(TurnResponse response, ContextUpdate update) {
    }
}
