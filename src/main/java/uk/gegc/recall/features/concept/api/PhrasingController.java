package uk.gegc.recall.features.concept.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.recall.features.concept.api.dto.PhrasingDto;
import uk.gegc.recall.features.concept.api.dto.UpdatePhrasingRequest;
import uk.gegc.recall.features.concept.application.ConceptService;
import uk.gegc.recall.shared.api.ApiHeaders;

import java.util.UUID;

@Tag(name = "Phrasings", description = "Edit and archive individual phrasings")
@RestController
@RequestMapping("/api/v1/phrasings")
@RequiredArgsConstructor
@Validated
public class PhrasingController {

    private final ConceptService conceptService;

    @PatchMapping("/{phrasingId}")
    @Operation(summary = "Edit a phrasing", description = "Attempt statistics are preserved.")
    public ResponseEntity<PhrasingDto> updatePhrasing(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID phrasingId,
            @Valid @RequestBody UpdatePhrasingRequest request
    ) {
        return ResponseEntity.ok(conceptService.updatePhrasing(userId, phrasingId, request));
    }

    @PostMapping("/{phrasingId}/archive")
    @Operation(summary = "Archive a phrasing", description = "The last active phrasing of a concept cannot be archived.")
    public ResponseEntity<PhrasingDto> archive(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID phrasingId
    ) {
        return ResponseEntity.ok(conceptService.archivePhrasing(userId, phrasingId));
    }

    @PostMapping("/{phrasingId}/unarchive")
    @Operation(summary = "Unarchive a phrasing")
    public ResponseEntity<PhrasingDto> unarchive(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID phrasingId
    ) {
        return ResponseEntity.ok(conceptService.unarchivePhrasing(userId, phrasingId));
    }
}
