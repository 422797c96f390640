package com.zust.backend.media.support;

import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.zust.backend.media.config.MediaProperties;

/**
 * Opaque public links to files in account directories.
 *
 * <pre>
 * id   = base64url("{accountId}:{type}:{filename}")
 * link = {public-base-url}/media/{id}
 * </pre>
 *
 * resolve() only ever returns paths inside the resource root.
 */
@Component
public class MediaLinks {

    private static final String SEPARATOR = ":";

    private final String publicBaseUrl;
    private final Path root;

    public MediaLinks(MediaProperties props) {
        this.publicBaseUrl = stripTrailingSlash(props.publicBaseUrl());
        this.root = Paths.get(props.resourcePath()).toAbsolutePath().normalize();
    }

    public String avatarLink(UUID accountId) {
        return link(accountId, MediaType.AVATAR, null);
    }

    public String link(UUID accountId, MediaType type, String filename) {
        if (accountId == null) throw new IllegalArgumentException("accountId must not be null");
        if (type == null) throw new IllegalArgumentException("type must not be null");

        String name = type.hasFixedFilename() ? type.fixedFilename() : filename;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("filename must not be blank for " + type);
        }

        String raw = accountId + SEPARATOR + type.segment() + SEPARATOR + name;
        String id = Base64.getUrlEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        return publicBaseUrl + "/media/" + id;
    }

    /** @return the file path behind {@code opaqueId}, empty when undecodable or outside the root */
    public Optional<Path> resolve(String opaqueId) {
        if (opaqueId == null || opaqueId.isBlank()) return Optional.empty();

        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(opaqueId), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        String[] parts = decoded.split(SEPARATOR, -1);
        if (parts.length != 3 || parts[0].isBlank() || parts[2].isBlank()) return Optional.empty();

        Optional<MediaType> type = MediaType.fromSegment(parts[1]);
        if (type.isEmpty()) return Optional.empty();

        Path normalized;
        try {
            Path accountDir = root.resolve(parts[0]);
            Path path = type.get().hasFixedFilename()
                    ? accountDir.resolve(parts[2])
                    : accountDir.resolve(type.get().segment()).resolve(parts[2]);
            normalized = path.normalize();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }

        if (!normalized.startsWith(root) || normalized.equals(root)) return Optional.empty();
        return Optional.of(normalized);
    }

    public Path accountDirectory(UUID accountId) {
        return root.resolve(accountId.toString());
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
