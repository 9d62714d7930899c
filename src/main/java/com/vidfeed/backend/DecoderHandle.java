package com.vidfeed.backend;

/**
 * Playable decoder/controller produced by a successful warm-up.
 * Owned by exactly one resource slot; closing it frees the native codec.
 */
public interface DecoderHandle extends AutoCloseable {

    void play();

    void pause();

    boolean isPlaying();

    /**
     * Releases the decoder. Must be idempotent and must not throw checked exceptions.
     */
    @Override
    void close();
}
