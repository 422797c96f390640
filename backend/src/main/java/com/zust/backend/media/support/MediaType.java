package com.zust.backend.media.support;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of file inside an account directory.
 * AVATAR and COVER live at the directory root under a fixed name, the others in a subdirectory.
 */
public enum MediaType {
    AVATAR("avatar", "avatar.png"),
    COVER("cover", "cover.png"),
    RESOURCE("resource", null),
    THUMBNAIL("thumbnail", null);

    private final String segment;
    private final String fixedFilename;

    MediaType(String segment, String fixedFilename) {
        this.segment = segment;
        this.fixedFilename = fixedFilename;
    }

    public String segment() {
        return segment;
    }

    public boolean hasFixedFilename() {
        return fixedFilename != null;
    }

    public String fixedFilename() {
        return fixedFilename;
    }

    public static Optional<MediaType> fromSegment(String raw) {
        return Arrays.stream(values())
                .filter(t -> t.segment.equals(raw))
                .findFirst();
    }
}
