package com.eduhub.data.api;

import com.eduhub.data.schema.SchemaManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/schema")
public class SchemaController {
    private final SchemaManager schemaManager;

    public SchemaController(SchemaManager schemaManager) {
        this.schemaManager = schemaManager;
    }

    @PostMapping("/setup")
    public ResponseEntity<Void> setup() {
        schemaManager.setupAll();
        schemaManager.createIndexes();
        return ResponseEntity.noContent().build();
    }
}
