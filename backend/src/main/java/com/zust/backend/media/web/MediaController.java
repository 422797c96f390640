package com.zust.backend.media.web;

import java.nio.file.Files;
import java.nio.file.Path;

import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import com.zust.backend.global.ApiException;
import com.zust.backend.global.ErrorCode;
import com.zust.backend.media.support.MediaLinks;

import lombok.RequiredArgsConstructor;

/**
 * Serves files referenced by opaque media links. Public, no bearer token required.
 */
@RestController
@RequiredArgsConstructor
public class MediaController {

    private final MediaLinks mediaLinks;

    @GetMapping("/media/{id}")
    public ResponseEntity<Resource> serve(@PathVariable("id") String id) {
        Path path = mediaLinks.resolve(id)
                .filter(Files::isRegularFile)
                .orElseThrow(() -> new ApiException(ErrorCode.MEDIA_NOT_FOUND));

        Resource resource = new FileSystemResource(path);
        return ResponseEntity.ok()
                .contentType(MediaTypeFactory.getMediaType(resource)
                        .orElse(MediaType.APPLICATION_OCTET_STREAM))
                .body(resource);
    }
}
