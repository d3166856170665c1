package org.example.studio.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.studio.generation.LocalBlobStorage;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.TimeUnit;

/**
 * Serves stored images when no CDN is configured.
 */
@RestController
public class AssetController {

    private final LocalBlobStorage blobStorage;

    public AssetController(LocalBlobStorage blobStorage) {
        this.blobStorage = blobStorage;
    }

    @GetMapping("/assets/**")
    public ResponseEntity<byte[]> getAsset(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (!path.startsWith(LocalBlobStorage.PUBLIC_PATH)) {
            return ResponseEntity.notFound().build();
        }
        return blobStorage.readKey(path.substring(LocalBlobStorage.PUBLIC_PATH.length()))
                .map(bytes -> ResponseEntity.ok()
                        .contentType(MediaType.IMAGE_PNG)
                        .cacheControl(CacheControl.maxAge(1, TimeUnit.DAYS))
                        .body(bytes))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
