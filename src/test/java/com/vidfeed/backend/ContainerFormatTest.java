package com.vidfeed.backend;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContainerFormatTest {

    static byte[] mp4Header() {
        return new byte[]{0, 0, 0, 0x18, 'f', 't', 'y', 'p', 'i', 's', 'o', 'm', 0, 0, 2, 0};
    }

    @Test
    void detectsMp4() {
        assertThat(ContainerFormat.detect(mp4Header())).contains(ContainerFormat.MP4);
    }

    @Test
    void detectsMatroska() {
        assertThat(ContainerFormat.detect(new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3, 0x01}))
                .contains(ContainerFormat.MATROSKA);
    }

    @Test
    void detectsHlsPlaylistWithBom() {
        byte[] body = "\uFEFF#EXTM3U\n#EXT-X-VERSION:3\n".getBytes(StandardCharsets.UTF_8);

        assertThat(ContainerFormat.detect(body)).contains(ContainerFormat.HLS_PLAYLIST);
    }

    @Test
    void detectsTransportStreamBySyncBytes() {
        byte[] packets = new byte[376];
        packets[0] = 0x47;
        packets[188] = 0x47;

        assertThat(ContainerFormat.detect(packets)).contains(ContainerFormat.MPEG_TS);
    }

    @Test
    void unknownDataIsNotAContainer() {
        assertThat(ContainerFormat.detect("<html></html>".getBytes(StandardCharsets.US_ASCII))).isEmpty();
        assertThat(ContainerFormat.detect(new byte[0])).isEmpty();
        assertThat(ContainerFormat.detect(null)).isEmpty();
    }
}
