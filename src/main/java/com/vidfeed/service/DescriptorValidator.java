package com.vidfeed.service;

import com.vidfeed.model.VideoDescriptor;
import org.apache.commons.io.FilenameUtils;

import java.net.URI;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public class DescriptorValidator {

    // Event ids are hex, but other feeds use slugs or UUIDs
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-:.]+$");

    private static final int MAX_ID_LENGTH = 256;

    private static final Set<String> SUPPORTED_SCHEMES = new HashSet<>(Arrays.asList("http", "https", "file"));

    // Sources without an extension are accepted; a known non-video extension is not
    private static final Set<String> SUPPORTED_VIDEO_FORMATS = new HashSet<>(Arrays.asList(
            "mp4", "m4v", "mov", "webm", "mkv", "m3u8", "ts", "3gp"
    ));

    /**
     * Rejects descriptors the manager could never warm up.
     */
    public void validate(VideoDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("Video descriptor cannot be null");
        }

        String id = descriptor.getIdentifier().getValue();
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException("Video identifier exceeds maximum length");
        }
        if (!VALID_ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Video identifier contains invalid characters: " + id);
        }

        URI uri = descriptor.getSourceUri();
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_SCHEMES.contains(scheme)) {
            throw new IllegalArgumentException("Invalid video URL format: " + uri);
        }
        if (!"file".equals(scheme) && (uri.getHost() == null || uri.getHost().isEmpty())) {
            throw new IllegalArgumentException("Video URL has no host: " + uri);
        }

        String extension = FilenameUtils.getExtension(uri.getPath() == null ? "" : uri.getPath()).toLowerCase(Locale.ROOT);
        if (!extension.isEmpty() && !SUPPORTED_VIDEO_FORMATS.contains(extension)) {
            throw new IllegalArgumentException("Unsupported video format: '" + extension +
                    "'. Supported formats: " + String.join(", ", SUPPORTED_VIDEO_FORMATS));
        }

        if (descriptor.getDeclaredDuration().isNegative()) {
            throw new IllegalArgumentException("Declared duration cannot be negative");
        }
    }
}
