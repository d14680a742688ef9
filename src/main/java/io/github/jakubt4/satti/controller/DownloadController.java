package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.dto.ClearImagesResponse;
import io.github.jakubt4.satti.dto.SaveLocalResponse;
import io.github.jakubt4.satti.service.UplinkService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Access to downlinked products on disk.
 */
@RestController
@RequiredArgsConstructor
public class DownloadController {

    private final UplinkService uplinkService;

    @GetMapping("/downloads/{commandId}")
    public ResponseEntity<byte[]> download(@PathVariable final String commandId) {
        final var bytes = uplinkService.download(commandId);
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(commandId + ".png").build().toString())
                .body(bytes);
    }

    @PostMapping("/downloads/{commandId}/save-local")
    public SaveLocalResponse saveLocal(@PathVariable final String commandId) {
        return uplinkService.saveLocal(commandId);
    }

    @PostMapping("/images/clear")
    public ClearImagesResponse clearImages() {
        return uplinkService.clearImages();
    }
}
