package com.phillippitts.glasscast.testutil;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.exception.SourceErrorKind;
import com.phillippitts.glasscast.service.source.AbstractSourceSession;
import com.phillippitts.glasscast.service.source.FrameSource;
import com.phillippitts.glasscast.service.source.SourceConfig;
import com.phillippitts.glasscast.service.source.SourceSession;
import com.phillippitts.glasscast.service.source.SourceState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Frame source driven by the test: state transitions and frames are emitted on demand.
 * Session opens and closes are appended to a shared call log so teardown order can be asserted.
 */
public class FakeFrameSource implements FrameSource {

    private final List<String> calls;
    private final List<FakeSourceSession> sessions = new CopyOnWriteArrayList<>();
    private volatile RuntimeException startFailure;

    public FakeFrameSource(List<String> calls) {
        this.calls = calls;
    }

    public FakeFrameSource() {
        this(new CopyOnWriteArrayList<>());
    }

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public SourceSession startSession(SourceConfig config) {
        RuntimeException failure = startFailure;
        if (failure != null) {
            startFailure = null;
            throw failure;
        }
        FakeSourceSession session = new FakeSourceSession(config);
        sessions.add(session);
        calls.add("source.start");
        return session;
    }

    /** The next {@link #startSession(SourceConfig)} throws {@code failure}. */
    public void failNextStart(RuntimeException failure) {
        this.startFailure = failure;
    }

    public FakeSourceSession lastSession() {
        return sessions.get(sessions.size() - 1);
    }

    public int sessionCount() {
        return sessions.size();
    }

    public class FakeSourceSession extends AbstractSourceSession {

        private final SourceConfig config;
        private volatile RuntimeException closeFailure;

        FakeSourceSession(SourceConfig config) {
            super("fake");
            this.config = config;
        }

        public SourceConfig config() {
            return config;
        }

        public void streaming() {
            emitState(SourceState.STREAMING);
        }

        /** The device stops by itself, as when the glasses are powered off. */
        public void stopUnprompted() {
            emitState(SourceState.STOPPED);
        }

        public void fail(SourceErrorKind kind, String detail) {
            emitError(kind, detail);
        }

        public void video(RawVideoFrame frame) {
            emitVideo(frame);
        }

        public void audio(AudioChunk chunk) {
            emitAudio(chunk);
        }

        public void failOnClose(RuntimeException failure) {
            this.closeFailure = failure;
        }

        @Override
        protected void doClose() {
            calls.add("source.close");
            RuntimeException failure = closeFailure;
            if (failure != null) {
                throw failure;
            }
        }
    }
}
