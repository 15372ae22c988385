package com.phillippitts.vani.service.collaborator;

import com.phillippitts.vani.domain.SystemStatus;
import com.phillippitts.vani.domain.VolumeDirection;

/**
 * OS-level actions. Every method either succeeds or throws
 * {@link com.phillippitts.vani.exception.DesktopActionFailedException} carrying a
 * user-presentable reason such as "firefox is not running".
 */
public interface DesktopActions {

    void openApplication(String application);

    void closeApplication(String application);

    void openWebsite(String url, String browser);

    /**
     * @return location the screenshot was saved to
     */
    String takeScreenshot();

    SystemStatus systemStatus();

    void adjustVolume(VolumeDirection direction);
}
