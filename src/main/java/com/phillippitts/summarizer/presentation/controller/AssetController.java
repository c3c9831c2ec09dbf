package com.phillippitts.summarizer.presentation.controller;

import com.phillippitts.summarizer.domain.AssetAvailability;
import com.phillippitts.summarizer.service.asset.AssetDownloadCoordinator;
import com.phillippitts.summarizer.service.asset.AssetDownloader;
import com.phillippitts.summarizer.service.asset.DownloadProgress;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Model catalog and background downloads of models and the bundled server.
 *
 * <p>Downloads answer 202 immediately; poll {@code GET /api/v1/assets/{id}/progress}.
 */
@RestController
@RequestMapping("/api/v1/assets")
class AssetController {

    private final AssetDownloader downloader;
    private final AssetDownloadCoordinator coordinator;

    AssetController(AssetDownloader downloader, AssetDownloadCoordinator coordinator) {
        this.downloader = downloader;
        this.coordinator = coordinator;
    }

    @GetMapping("/models")
    List<AssetView> models() {
        return downloader.listModels().stream().map(AssetView::from).toList();
    }

    @PostMapping("/models/{id}/download")
    ResponseEntity<DownloadProgress> downloadModel(@PathVariable("id") String id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(coordinator.downloadModel(id));
    }

    @DeleteMapping("/models/{id}")
    ResponseEntity<Void> deleteModel(@PathVariable("id") String id) {
        downloader.delete(downloader.catalog().requireModel(id));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/server/download")
    ResponseEntity<DownloadProgress> downloadServer() {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(coordinator.downloadServer());
    }

    @GetMapping("/{id}/progress")
    ResponseEntity<DownloadProgress> progress(@PathVariable("id") String id) {
        return coordinator.progress(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Catalog row as exposed to clients.
     */
    public record AssetView(String id, String name, String description, long sizeBytes, boolean downloaded,
                            boolean downloading) {

        static AssetView from(AssetAvailability a) {
            return new AssetView(a.descriptor().id(), a.descriptor().humanName(), a.descriptor().description(),
                    a.sizeBytes(), a.downloaded(), a.downloading());
        }
    }
}
