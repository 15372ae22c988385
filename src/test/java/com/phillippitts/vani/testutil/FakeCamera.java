package com.phillippitts.vani.testutil;

import com.phillippitts.vani.service.collaborator.CameraSource;
import com.phillippitts.vani.service.collaborator.ImageFrame;
import com.phillippitts.vani.service.collaborator.VisionModel;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Camera and vision model in one test double: every capture returns a tiny frame and every
 * describe call returns the configured description. Questions asked are recorded.
 */
public class FakeCamera implements CameraSource, VisionModel {
    public final List<String> questions = new CopyOnWriteArrayList<>();
    public final AtomicInteger captures = new AtomicInteger();

    private volatile String description = "a red mug on a wooden desk";
    private volatile RuntimeException captureFailure;

    public FakeCamera describeAs(String description) {
        this.description = description;
        return this;
    }

    public FakeCamera failCaptureWith(RuntimeException failure) {
        this.captureFailure = failure;
        return this;
    }

    @Override
    public ImageFrame capture() {
        captures.incrementAndGet();
        if (captureFailure != null) {
            throw captureFailure;
        }
        return new ImageFrame(new byte[] {1, 2, 3}, "image/jpeg", Instant.now());
    }

    @Override
    public String describe(ImageFrame frame, String question) {
        questions.add(question);
        return description;
    }
}
