package com.phillippitts.vani.service.collaborator;

/**
 * Grabs a single frame from the camera. Callers hold the camera lease for the duration of the call.
 */
public interface CameraSource {

    ImageFrame capture();
}
