package com.starscape.mediaindex.features.primaryfile.api;

import com.starscape.mediaindex.common.security.UserPrincipal;
import com.starscape.mediaindex.features.primaryfile.api.dto.PrimaryFileResponse;
import com.starscape.mediaindex.features.primaryfile.app.SetPrimaryFileHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands/photos")
public class PrimaryFileController {
    
    private final SetPrimaryFileHandler setPrimaryFileHandler;
    
    public PrimaryFileController(SetPrimaryFileHandler setPrimaryFileHandler) {
        this.setPrimaryFileHandler = setPrimaryFileHandler;
    }
    
    /**
     * Mark a file as primary. Without fileUid the widest JPEG is chosen.
     * POST /commands/photos/{photoUid}/primary?fileUid={fileUid}
     */
    @PostMapping("/{photoUid}/primary")
    public ResponseEntity<PrimaryFileResponse> setPrimary(
            @PathVariable String photoUid,
            @RequestParam(required = false) String fileUid,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        String primary = setPrimaryFileHandler.handle(principal, photoUid, fileUid);
        return ResponseEntity.ok(new PrimaryFileResponse(photoUid, primary));
    }
}
