package com.starscape.mediaindex.features.indexing.api;

import com.starscape.mediaindex.common.exception.NotFoundException;
import com.starscape.mediaindex.common.security.AccessControl;
import com.starscape.mediaindex.common.security.Action;
import com.starscape.mediaindex.common.security.Resource;
import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.indexing.api.dto.FileResponse;
import com.starscape.mediaindex.features.indexing.app.FileIndexService;
import com.starscape.mediaindex.features.indexing.domain.FileView;
import com.starscape.mediaindex.features.indexing.domain.Hydrate;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only access to indexed files.
 */
@RestController
@RequestMapping("/queries")
public class FileQueryController {
    
    private static final int MAX_PAGE_SIZE = 1000;
    
    private final FileIndexService fileIndexService;
    private final AccessControl accessControl;
    
    public FileQueryController(FileIndexService fileIndexService, AccessControl accessControl) {
        this.fileIndexService = fileIndexService;
        this.accessControl = accessControl;
    }
    
    /**
     * GET /queries/files/{fileUid}?photo=true
     */
    @GetMapping("/files/{fileUid}")
    public ResponseEntity<FileResponse> getFile(
            @PathVariable String fileUid,
            @RequestParam(defaultValue = "false") boolean photo,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        accessControl.check(principal, Resource.FILES, Action.READ);
        FileView view = fileIndexService.fileByUid(fileUid, hydrate(photo))
            .orElseThrow(() -> new NotFoundException("File not found: " + fileUid));
        return ResponseEntity.ok(FileResponse.from(view));
    }
    
    /**
     * GET /queries/files?hash={sha1}
     */
    @GetMapping(value = "/files", params = "hash")
    public ResponseEntity<FileResponse> getFileByHash(
            @RequestParam String hash,
            @RequestParam(defaultValue = "false") boolean photo,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        accessControl.check(principal, Resource.FILES, Action.READ);
        FileView view = fileIndexService.fileByHash(hash, hydrate(photo))
            .orElseThrow(() -> new NotFoundException("No file with hash " + hash));
        return ResponseEntity.ok(FileResponse.from(view));
    }
    
    /**
     * GET /queries/files?path=2024/05&missing=false&page=0&size=100
     */
    @GetMapping(value = "/files", params = "!hash")
    public ResponseEntity<List<FileResponse>> listFiles(
            @RequestParam(defaultValue = "") String path,
            @RequestParam(defaultValue = "false") boolean missing,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        accessControl.check(principal, Resource.FILES, Action.READ);
        List<FileResponse> files = fileIndexService.files(path, missing, Math.max(page, 0), pageSize(size))
            .stream()
            .map(file -> FileResponse.from(new FileView(file, null)))
            .toList();
        return ResponseEntity.ok(files);
    }
    
    /**
     * GET /queries/photos/{photoUid}/primary
     */
    @GetMapping("/photos/{photoUid}/primary")
    public ResponseEntity<FileResponse> getPrimaryFile(
            @PathVariable String photoUid,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        accessControl.check(principal, Resource.FILES, Action.READ);
        FileView view = fileIndexService.primaryFile(photoUid, Hydrate.NONE)
            .orElseThrow(() -> new NotFoundException("No primary file for photo " + photoUid));
        return ResponseEntity.ok(FileResponse.from(view));
    }
    
    private static Hydrate hydrate(boolean photo) {
        return photo ? Hydrate.PHOTO : Hydrate.NONE;
    }
    
    private static int pageSize(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }
}
