package com.vidfeed.backend;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Containers recognised from the first bytes of a source.
 */
public enum ContainerFormat {
    MP4,
    MATROSKA,
    MPEG_TS,
    HLS_PLAYLIST;

    private static final byte[] EBML_MAGIC = {0x1A, 0x45, (byte) 0xDF, (byte) 0xA3};
    private static final byte[] HLS_MAGIC = "#EXTM3U".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FTYP = "ftyp".getBytes(StandardCharsets.US_ASCII);
    private static final int TS_PACKET_SIZE = 188;
    private static final byte TS_SYNC = 0x47;

    public static Optional<ContainerFormat> detect(byte[] header) {
        if (header == null) {
            return Optional.empty();
        }
        // ISO-BMFF: 4-byte box size followed by "ftyp"
        if (matchesAt(header, 4, FTYP)) {
            return Optional.of(MP4);
        }
        if (matchesAt(header, 0, EBML_MAGIC)) {
            return Optional.of(MATROSKA);
        }
        if (matchesAt(header, skipBom(header), HLS_MAGIC)) {
            return Optional.of(HLS_PLAYLIST);
        }
        if (header.length > TS_PACKET_SIZE && header[0] == TS_SYNC && header[TS_PACKET_SIZE] == TS_SYNC) {
            return Optional.of(MPEG_TS);
        }
        return Optional.empty();
    }

    private static int skipBom(byte[] header) {
        if (header.length >= 3 && header[0] == (byte) 0xEF && header[1] == (byte) 0xBB && header[2] == (byte) 0xBF) {
            return 3;
        }
        return 0;
    }

    private static boolean matchesAt(byte[] data, int offset, byte[] expected) {
        if (data.length < offset + expected.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (data[offset + i] != expected[i]) {
                return false;
            }
        }
        return true;
    }
}
