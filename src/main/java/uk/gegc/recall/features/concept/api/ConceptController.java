package uk.gegc.recall.features.concept.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.recall.features.concept.api.dto.BulkActionRequest;
import uk.gegc.recall.features.concept.api.dto.BulkActionResultDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDetailDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDto;
import uk.gegc.recall.features.concept.api.dto.SetCanonicalPhrasingRequest;
import uk.gegc.recall.features.concept.api.dto.UpdateConceptRequest;
import uk.gegc.recall.features.concept.application.ConceptLibraryView;
import uk.gegc.recall.features.concept.application.ConceptService;
import uk.gegc.recall.features.generation.api.dto.GenerationJobDto;
import uk.gegc.recall.shared.api.ApiHeaders;

import java.util.Map;
import java.util.UUID;

@Tag(name = "Concepts", description = "Concept library: browse, edit, archive, delete and restore")
@RestController
@RequestMapping("/api/v1/concepts")
@RequiredArgsConstructor
@Validated
public class ConceptController {

    private final ConceptService conceptService;

    @GetMapping
    @Operation(
            summary = "List concepts",
            description = "Page through one library view. Page size is clamped to 10-100."
    )
    public ResponseEntity<Page<ConceptDto>> listConcepts(
            @Parameter(description = "Caller user ID", required = true)
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestParam(defaultValue = "ALL") ConceptLibraryView view,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "25") int size
    ) {
        return ResponseEntity.ok(conceptService.listForLibrary(userId, view, page, size));
    }

    @GetMapping("/{conceptId}")
    @Operation(summary = "Get a concept with its phrasings")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Concept found",
                    content = @Content(schema = @Schema(implementation = ConceptDetailDto.class))),
            @ApiResponse(responseCode = "404", description = "Concept not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ConceptDetailDto> getConcept(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId
    ) {
        return ResponseEntity.ok(conceptService.getConcept(userId, conceptId));
    }

    @PatchMapping("/{conceptId}")
    @Operation(summary = "Edit a concept's title and description")
    public ResponseEntity<ConceptDto> updateConcept(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId,
            @Valid @RequestBody UpdateConceptRequest request
    ) {
        return ResponseEntity.ok(conceptService.updateConcept(userId, conceptId, request));
    }

    @PostMapping("/{conceptId}/archive")
    @Operation(summary = "Archive a concept", description = "Removes it and its phrasings from review. Idempotent.")
    public ResponseEntity<Map<String, Boolean>> archive(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId
    ) {
        return ResponseEntity.ok(Map.of("changed", conceptService.archiveConcept(userId, conceptId)));
    }

    @PostMapping("/{conceptId}/unarchive")
    @Operation(summary = "Unarchive a concept", description = "Returns it to review. Idempotent.")
    public ResponseEntity<Map<String, Boolean>> unarchive(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId
    ) {
        return ResponseEntity.ok(Map.of("changed", conceptService.unarchiveConcept(userId, conceptId)));
    }

    @PostMapping("/{conceptId}/delete")
    @Operation(summary = "Move a concept to the trash", description = "Soft delete; the concept can be restored. Idempotent.")
    public ResponseEntity<Map<String, Boolean>> delete(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId
    ) {
        return ResponseEntity.ok(Map.of("changed", conceptService.softDeleteConcept(userId, conceptId)));
    }

    @PostMapping("/{conceptId}/restore")
    @Operation(summary = "Restore a concept from the trash", description = "Idempotent; has no effect on concepts that are not deleted.")
    public ResponseEntity<Map<String, Boolean>> restore(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId
    ) {
        return ResponseEntity.ok(Map.of("changed", conceptService.restoreConcept(userId, conceptId)));
    }

    @PostMapping("/bulk")
    @Operation(summary = "Apply a lifecycle action to up to 100 concepts")
    public ResponseEntity<BulkActionResultDto> bulk(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @Valid @RequestBody BulkActionRequest request
    ) {
        return ResponseEntity.ok(conceptService.runBulkAction(userId, request.action(), request.conceptIds()));
    }

    @PutMapping("/{conceptId}/canonical-phrasing")
    @Operation(summary = "Pin or unpin the canonical phrasing")
    public ResponseEntity<ConceptDto> setCanonicalPhrasing(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId,
            @RequestBody SetCanonicalPhrasingRequest request
    ) {
        return ResponseEntity.ok(conceptService.setCanonicalPhrasing(userId, conceptId, request.phrasingId()));
    }

    @PostMapping("/{conceptId}/phrasings/generate")
    @Operation(summary = "Generate more phrasings", description = "Starts a single-concept generation job.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted",
                    content = @Content(schema = @Schema(implementation = GenerationJobDto.class))),
            @ApiResponse(responseCode = "422", description = "A job is already generating for this concept",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<GenerationJobDto> generatePhrasings(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID conceptId
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(conceptService.requestPhrasingGeneration(userId, conceptId));
    }
}
