package com.phillippitts.vani.service.dispatch;

import com.phillippitts.vani.service.collaborator.CameraSource;
import com.phillippitts.vani.service.collaborator.ConversationModel;
import com.phillippitts.vani.service.collaborator.DesktopActions;
import com.phillippitts.vani.service.collaborator.KnowledgeLookup;
import com.phillippitts.vani.service.collaborator.VisionModel;
import com.phillippitts.vani.service.collaborator.WebSearch;

import java.util.Objects;

/**
 * The collaborators a dispatcher calls, one per capability domain.
 */
public record DispatchCollaborators(ConversationModel conversation,
                                    VisionModel vision,
                                    CameraSource camera,
                                    KnowledgeLookup knowledge,
                                    WebSearch webSearch,
                                    DesktopActions desktop) {

    public DispatchCollaborators {
        Objects.requireNonNull(conversation, "conversation must not be null");
        Objects.requireNonNull(vision, "vision must not be null");
        Objects.requireNonNull(camera, "camera must not be null");
        Objects.requireNonNull(knowledge, "knowledge must not be null");
        Objects.requireNonNull(webSearch, "webSearch must not be null");
        Objects.requireNonNull(desktop, "desktop must not be null");
    }
}
