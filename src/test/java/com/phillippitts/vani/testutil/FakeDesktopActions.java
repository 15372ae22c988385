package com.phillippitts.vani.testutil;

import com.phillippitts.vani.domain.SystemStatus;
import com.phillippitts.vani.domain.VolumeDirection;
import com.phillippitts.vani.exception.DesktopActionFailedException;
import com.phillippitts.vani.service.collaborator.DesktopActions;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for DesktopActions that records each action as a short string
 * ("close firefox", "website https://youtube.com firefox").
 *
 * <p>{@link #failWith(String)} makes every following action fail with that reason.
 */
public class FakeDesktopActions implements DesktopActions {
    public final List<String> calls = new CopyOnWriteArrayList<>();

    private volatile String failureReason;
    private volatile SystemStatus status = new SystemStatus(12.5, 40.0, null, false);

    public FakeDesktopActions failWith(String reason) {
        this.failureReason = reason;
        return this;
    }

    public FakeDesktopActions status(SystemStatus status) {
        this.status = status;
        return this;
    }

    @Override
    public void openApplication(String application) {
        record("open " + application);
    }

    @Override
    public void closeApplication(String application) {
        record("close " + application);
    }

    @Override
    public void openWebsite(String url, String browser) {
        record("website " + url + " " + browser);
    }

    @Override
    public String takeScreenshot() {
        record("screenshot");
        return "/tmp/screenshot.png";
    }

    @Override
    public SystemStatus systemStatus() {
        record("status");
        return status;
    }

    @Override
    public void adjustVolume(VolumeDirection direction) {
        record("volume " + direction.slotValue());
    }

    private void record(String call) {
        calls.add(call);
        if (failureReason != null) {
            throw new DesktopActionFailedException(failureReason);
        }
    }
}
