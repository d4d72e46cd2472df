package com.starscape.mediaindex.features.batch.api;

import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.batch.api.dto.BatchResponse;
import com.starscape.mediaindex.features.batch.api.dto.SelectionRequest;
import com.starscape.mediaindex.features.batch.app.ApprovePhotosHandler;
import com.starscape.mediaindex.features.batch.app.ArchivePhotosHandler;
import com.starscape.mediaindex.features.batch.app.DeleteAlbumsHandler;
import com.starscape.mediaindex.features.batch.app.DeleteLabelsHandler;
import com.starscape.mediaindex.features.batch.app.DeletePhotosHandler;
import com.starscape.mediaindex.features.batch.app.RestorePhotosHandler;
import com.starscape.mediaindex.features.batch.app.TogglePrivateHandler;
import com.starscape.mediaindex.features.batch.domain.Selection;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for batch lifecycle commands on photos, albums and labels.
 */
@RestController
@RequestMapping("/commands/batch")
public class BatchController {
    
    private final ArchivePhotosHandler archivePhotosHandler;
    private final RestorePhotosHandler restorePhotosHandler;
    private final ApprovePhotosHandler approvePhotosHandler;
    private final TogglePrivateHandler togglePrivateHandler;
    private final DeletePhotosHandler deletePhotosHandler;
    private final DeleteAlbumsHandler deleteAlbumsHandler;
    private final DeleteLabelsHandler deleteLabelsHandler;
    
    public BatchController(
            ArchivePhotosHandler archivePhotosHandler,
            RestorePhotosHandler restorePhotosHandler,
            ApprovePhotosHandler approvePhotosHandler,
            TogglePrivateHandler togglePrivateHandler,
            DeletePhotosHandler deletePhotosHandler,
            DeleteAlbumsHandler deleteAlbumsHandler,
            DeleteLabelsHandler deleteLabelsHandler) {
        this.archivePhotosHandler = archivePhotosHandler;
        this.restorePhotosHandler = restorePhotosHandler;
        this.approvePhotosHandler = approvePhotosHandler;
        this.togglePrivateHandler = togglePrivateHandler;
        this.deletePhotosHandler = deletePhotosHandler;
        this.deleteAlbumsHandler = deleteAlbumsHandler;
        this.deleteLabelsHandler = deleteLabelsHandler;
    }
    
    /**
     * POST /commands/batch/photos/archive
     */
    @PostMapping("/photos/archive")
    public ResponseEntity<BatchResponse> archivePhotos(
            @RequestBody(required = false) SelectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(BatchResponse.ok(archivePhotosHandler.handle(principal, selection(request))));
    }
    
    /**
     * POST /commands/batch/photos/restore
     */
    @PostMapping("/photos/restore")
    public ResponseEntity<BatchResponse> restorePhotos(
            @RequestBody(required = false) SelectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(BatchResponse.ok(restorePhotosHandler.handle(principal, selection(request))));
    }
    
    /**
     * POST /commands/batch/photos/approve
     */
    @PostMapping("/photos/approve")
    public ResponseEntity<BatchResponse> approvePhotos(
            @RequestBody(required = false) SelectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(BatchResponse.ok(approvePhotosHandler.handle(principal, selection(request))));
    }
    
    /**
     * POST /commands/batch/photos/private
     */
    @PostMapping("/photos/private")
    public ResponseEntity<BatchResponse> togglePrivate(
            @RequestBody(required = false) SelectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(BatchResponse.ok(togglePrivateHandler.handle(principal, selection(request))));
    }
    
    /**
     * Permanently delete photos and their files.
     * POST /commands/batch/photos/delete
     */
    @PostMapping("/photos/delete")
    public ResponseEntity<BatchResponse> deletePhotos(
            @RequestBody(required = false) SelectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(BatchResponse.ok(deletePhotosHandler.handle(principal, selection(request))));
    }
    
    /**
     * POST /commands/batch/albums/delete
     */
    @PostMapping("/albums/delete")
    public ResponseEntity<BatchResponse> deleteAlbums(
            @RequestBody(required = false) SelectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(BatchResponse.ok(deleteAlbumsHandler.handle(principal, selection(request))));
    }
    
    /**
     * POST /commands/batch/labels/delete
     */
    @PostMapping("/labels/delete")
    public ResponseEntity<BatchResponse> deleteLabels(
            @RequestBody(required = false) SelectionRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(BatchResponse.ok(deleteLabelsHandler.handle(principal, selection(request))));
    }
    
    private static Selection selection(SelectionRequest request) {
        return request != null ? request.toSelection() : new Selection(null, null, null);
    }
}
