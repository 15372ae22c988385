package com.phillippitts.vani.domain;

import com.phillippitts.vani.exception.MissingParameterException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Either a complete {@link ParsedCommand} or the list of required slots that could not be
 * filled (the MissingParameter condition). Never both.
 *
 * @param intent       intent extraction was attempted for
 * @param command      complete command, or null when slots are missing
 * @param missingSlots required slots not found in the text; empty when {@code command} is set
 * @param partialSlots slots that were found even though extraction is incomplete
 */
public record ExtractionResult(Intent intent,
                               ParsedCommand command,
                               List<String> missingSlots,
                               Map<String, String> partialSlots) {

    public ExtractionResult {
        Objects.requireNonNull(intent, "intent must not be null");
        missingSlots = missingSlots == null ? List.of() : List.copyOf(missingSlots);
        partialSlots = partialSlots == null ? Map.of() : Map.copyOf(partialSlots);
        if ((command == null) == missingSlots.isEmpty()) {
            throw new IllegalArgumentException("Exactly one of command or missingSlots must be present");
        }
    }

    public static ExtractionResult complete(ParsedCommand command) {
        return new ExtractionResult(command.intent(), command, List.of(), command.slots());
    }

    public static ExtractionResult missing(Intent intent, List<String> missingSlots,
                                           Map<String, String> partialSlots) {
        return new ExtractionResult(intent, null, missingSlots, partialSlots);
    }

    public boolean isComplete() {
        return command != null;
    }

    public Optional<ParsedCommand> parsedCommand() {
        return Optional.ofNullable(command);
    }

    /**
     * @throws MissingParameterException if required slots were not found
     */
    public ParsedCommand requireCommand() {
        if (command == null) {
            throw new MissingParameterException(intent, missingSlots);
        }
        return command;
    }
}
