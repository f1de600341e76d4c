package com.lynkvertx.vzev.controller;

import com.lynkvertx.vzev.dto.ApiResponse;
import com.lynkvertx.vzev.dto.CollectiveDTO;
import com.lynkvertx.vzev.dto.IntervalReadingDTO;
import com.lynkvertx.vzev.service.CollectiveService;
import com.lynkvertx.vzev.service.IntervalReadingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Collective REST Controller
 * Handles collective setup and interval reading import
 */
@RestController
@RequestMapping("/api/collectives")
@RequiredArgsConstructor
@Tag(name = "Collectives", description = "Collective, member and meter management APIs")
public class CollectiveController {

    private final CollectiveService collectiveService;
    private final IntervalReadingService readingService;

    @GetMapping("/{id}")
    @Operation(summary = "Get collective by ID", description = "Retrieves a collective with its members and meters")
    public ResponseEntity<ApiResponse<CollectiveDTO>> getCollectiveById(@PathVariable Long id) {
        CollectiveDTO collective = collectiveService.getCollectiveById(id);
        return ResponseEntity.ok(ApiResponse.success(collective));
    }

    @PostMapping
    @Operation(summary = "Create a new collective", description = "Creates a collective with its members and meters")
    public ResponseEntity<ApiResponse<CollectiveDTO>> createCollective(@Valid @RequestBody CollectiveDTO dto) {
        CollectiveDTO created = collectiveService.createCollective(dto);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Collective created successfully", created));
    }

    @PostMapping("/{id}/readings")
    @Operation(summary = "Import interval readings",
        description = "Stores normalized 15-minute readings; the whole batch is rejected on duplicates")
    public ResponseEntity<ApiResponse<IntervalReadingDTO.ImportResultDTO>> importReadings(
            @PathVariable Long id,
            @Valid @RequestBody IntervalReadingDTO.BatchDTO batch) {
        IntervalReadingDTO.ImportResultDTO result = readingService.importReadings(id, batch);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.success("Readings imported successfully", result));
    }
}
