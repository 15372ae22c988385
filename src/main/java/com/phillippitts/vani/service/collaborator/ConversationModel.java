package com.phillippitts.vani.service.collaborator;

/**
 * Text-generation model used for free conversation and vision follow-ups.
 */
public interface ConversationModel {

    /**
     * @return reply text, never blank
     * @throws com.phillippitts.vani.exception.CollaboratorUnavailableException if the model cannot be reached
     * @throws com.phillippitts.vani.exception.CollaboratorTimeoutException     if no reply arrives in time
     */
    String reply(ConversationRequest request);
}
