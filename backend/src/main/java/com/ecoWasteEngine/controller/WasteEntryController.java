package com.ecoWasteEngine.controller;

import com.ecoWasteEngine.dto.SubmissionResponseDTO;
import com.ecoWasteEngine.dto.WasteEntryResponseDTO;
import com.ecoWasteEngine.exception.StorageException;
import com.ecoWasteEngine.service.IngestionOrchestrator;
import com.ecoWasteEngine.service.SubmissionResult;
import com.ecoWasteEngine.service.WasteEntryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/entries")
@RequiredArgsConstructor
@Validated
public class WasteEntryController {

    private final IngestionOrchestrator ingestionOrchestrator;
    private final WasteEntryService entryService;

    /** Upload a photo. A repeat of the same photo within the dedup window returns the first entry. */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmissionResponseDTO> submit(
            @RequestPart("file") MultipartFile file,
            Authentication authentication) {
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new StorageException("Could not read uploaded file", e);
        }
        SubmissionResult result = ingestionOrchestrator.submit(authentication.getName(), bytes, file.getContentType());
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(SubmissionResponseDTO.fromResult(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WasteEntryResponseDTO> getEntry(@PathVariable String id, Authentication authentication) {
        return ResponseEntity.ok(WasteEntryResponseDTO.fromModel(entryService.getEntry(id, authentication.getName())));
    }

    /** The caller's own entries, newest first */
    @GetMapping
    public ResponseEntity<List<WasteEntryResponseDTO>> listEntries(
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            Authentication authentication) {
        List<WasteEntryResponseDTO> dtos = entryService.listEntries(authentication.getName(), limit).stream()
                .map(WasteEntryResponseDTO::fromModel)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }
}
