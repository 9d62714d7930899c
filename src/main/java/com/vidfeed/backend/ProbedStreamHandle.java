package com.vidfeed.backend;

import com.vidfeed.model.VideoIdentifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a source whose container was verified by {@link RemoteProbeDecoderBackend}.
 * Tracks the playback flag the renderer binds to.
 */
@Slf4j
@Getter
public class ProbedStreamHandle implements DecoderHandle {

    private final VideoIdentifier identifier;
    private final URI sourceUri;
    private final ContainerFormat format;
    private final int probedBytes;
    private final AtomicBoolean playing = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ProbedStreamHandle(VideoIdentifier identifier, URI sourceUri, ContainerFormat format, int probedBytes) {
        this.identifier = identifier;
        this.sourceUri = sourceUri;
        this.format = format;
        this.probedBytes = probedBytes;
    }

    @Override
    public void play() {
        if (closed.get()) {
            throw new IllegalStateException("Decoder for video " + identifier + " is closed");
        }
        playing.set(true);
    }

    @Override
    public void pause() {
        playing.set(false);
    }

    @Override
    public boolean isPlaying() {
        return playing.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            playing.set(false);
            log.debug("Closed decoder for video {} ({})", identifier.shortId(), format);
        }
    }
}
