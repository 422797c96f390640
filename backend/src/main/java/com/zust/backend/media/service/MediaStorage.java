package com.zust.backend.media.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.zust.backend.media.config.MediaProperties;
import com.zust.backend.media.support.MediaLinks;
import com.zust.backend.media.support.MediaType;

import lombok.extern.slf4j.Slf4j;

/**
 * Local file storage of account media.
 *
 * <pre>
 * {resource-path}
 * └── {accountId}
 *     ├── resource/
 *     ├── thumbnail/
 *     ├── avatar.png
 *     └── cover.png
 * </pre>
 */
@Slf4j
@Component
public class MediaStorage {

    static final String DEFAULT_ASSET_DIR = "assets/";

    private final MediaLinks mediaLinks;
    private final RestClient restClient;
    private final int downloadAttempts;
    private final long maxAvatarBytes;

    public MediaStorage(MediaLinks mediaLinks, RestClient.Builder restClientBuilder, MediaProperties props) {
        this.mediaLinks = mediaLinks;
        this.restClient = restClientBuilder.build();
        this.downloadAttempts = props.avatarDownloadAttempts();
        this.maxAvatarBytes = props.avatarMaxSize().toBytes();
    }

    /** Creates the account directory with its subdirectories and the default avatar and cover. */
    public Path createUserRepository(UUID accountId) throws IOException {
        Path dir = mediaLinks.accountDirectory(accountId);

        Files.createDirectories(dir.resolve(MediaType.RESOURCE.segment()));
        Files.createDirectories(dir.resolve(MediaType.THUMBNAIL.segment()));

        copyDefault(MediaType.AVATAR.fixedFilename(), dir);
        copyDefault(MediaType.COVER.fixedFilename(), dir);

        log.info("Account media directory created. accountId={}, path={}", accountId, dir);
        return dir;
    }

    /**
     * Replaces the account avatar with the image at {@code url}.
     *
     * The body is streamed into a temp file next to the avatar and moved over it only when complete,
     * so a failed download leaves the previous avatar in place. Bodies above avatar-max-size are
     * dropped without retrying.
     *
     * @return true once a download succeeded, false after all attempts failed or the image was too large
     */
    public boolean downloadAvatar(UUID accountId, String url) {
        Path target = mediaLinks.accountDirectory(accountId).resolve(MediaType.AVATAR.fixedFilename());

        for (int attempt = 1; attempt <= downloadAttempts; attempt++) {
            Download result;
            try {
                result = restClient.get()
                        .uri(url)
                        .exchange((request, response) -> {
                            if (!response.getStatusCode().is2xxSuccessful()) {
                                log.warn("Avatar download answered {}. accountId={}", response.getStatusCode(), accountId);
                                return Download.FAILED;
                            }
                            long declared = response.getHeaders().getContentLength(); // -1 when absent
                            if (declared > maxAvatarBytes) {
                                return Download.TOO_LARGE;
                            }
                            try (InputStream body = response.getBody()) {
                                return store(body, target);
                            }
                        });
            } catch (RestClientException e) {
                log.warn("Avatar download failed. accountId={}, attempt={}/{}, cause={}",
                        accountId, attempt, downloadAttempts, e.getMessage());
                continue;
            }

            switch (result) {
                case STORED:
                    return true;
                case TOO_LARGE:
                    log.warn("Avatar larger than {} bytes, keeping the default. accountId={}", maxAvatarBytes, accountId);
                    return false;
                case EMPTY:
                    log.warn("Avatar download returned an empty body. accountId={}, attempt={}", accountId, attempt);
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    private Download store(InputStream body, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Path part = Files.createTempFile(target.getParent(), "avatar-", ".part");
        try {
            long copied = copyAtMost(body, part, maxAvatarBytes);
            if (copied < 0) return Download.TOO_LARGE;
            if (copied == 0) return Download.EMPTY;

            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            return Download.STORED;
        } finally {
            Files.deleteIfExists(part);
        }
    }

    // -1 as soon as more than limit bytes arrive
    private static long copyAtMost(InputStream in, Path out, long limit) throws IOException {
        byte[] buffer = new byte[8192];
        long total = 0;
        try (OutputStream os = Files.newOutputStream(out)) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                total += n;
                if (total > limit) {
                    return -1;
                }
                os.write(buffer, 0, n);
            }
        }
        return total;
    }

    private enum Download { STORED, EMPTY, TOO_LARGE, FAILED }

    private static void copyDefault(String filename, Path dir) throws IOException {
        ClassPathResource asset = new ClassPathResource(DEFAULT_ASSET_DIR + filename);
        try (InputStream in = asset.getInputStream()) {
            Files.copy(in, dir.resolve(filename), StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
