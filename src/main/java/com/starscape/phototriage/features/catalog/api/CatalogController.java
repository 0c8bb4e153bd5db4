package com.starscape.phototriage.features.catalog.api;

import com.starscape.phototriage.features.catalog.api.dto.*;
import com.starscape.phototriage.features.catalog.app.ImportPriorHashesHandler;
import com.starscape.phototriage.features.catalog.app.RegisterPhotosHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class CatalogController {
    
    private final RegisterPhotosHandler registerPhotosHandler;
    private final ImportPriorHashesHandler importPriorHashesHandler;
    
    public CatalogController(
            RegisterPhotosHandler registerPhotosHandler,
            ImportPriorHashesHandler importPriorHashesHandler) {
        this.registerPhotosHandler = registerPhotosHandler;
        this.importPriorHashesHandler = importPriorHashesHandler;
    }
    
    @PostMapping("/photos")
    public ResponseEntity<RegisterPhotosResponse> registerPhotos(@Valid @RequestBody RegisterPhotosRequest request) {
        return ResponseEntity.ok(registerPhotosHandler.handle(request));
    }
    
    /**
     * Load perceptual hashes from a previous scan. Unknown photo ids are counted, not rejected.
     */
    @PostMapping("/hashes/import")
    public ResponseEntity<ImportHashesResponse> importHashes(@Valid @RequestBody ImportHashesRequest request) {
        return ResponseEntity.ok(importPriorHashesHandler.handle(request));
    }
}
