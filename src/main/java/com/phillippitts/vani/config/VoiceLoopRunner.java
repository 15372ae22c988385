package com.phillippitts.vani.config;

import com.phillippitts.vani.service.turn.VoiceSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.Objects;

/**
 * Runs {@link VoiceSession#run()} on a dedicated thread once the context is up and stops it on
 * shutdown.
 */
public class VoiceLoopRunner implements ApplicationRunner, DisposableBean {

    private static final Logger LOG = LogManager.getLogger(VoiceLoopRunner.class);

    private final VoiceSession session;
    private volatile Thread thread;

    public VoiceLoopRunner(VoiceSession session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    @Override
    public void run(ApplicationArguments args) {
        Thread t = new Thread(session::run, "voice-session");
        t.setDaemon(true);
        thread = t;
        t.start();
        LOG.info("Voice loop thread started");
    }

    @Override
    public void destroy() {
        session.stop();
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }

    boolean isStarted() {
        return thread != null;
    }
}
