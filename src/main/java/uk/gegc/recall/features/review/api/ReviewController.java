package uk.gegc.recall.features.review.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.recall.features.review.api.dto.InteractionResultDto;
import uk.gegc.recall.features.review.api.dto.NextReviewDto;
import uk.gegc.recall.features.review.api.dto.RecordInteractionRequest;
import uk.gegc.recall.features.review.application.ReviewService;
import uk.gegc.recall.features.stats.api.dto.DueCountDto;
import uk.gegc.recall.features.stats.api.dto.UserCardStatsDto;
import uk.gegc.recall.features.stats.application.UserStatsService;
import uk.gegc.recall.shared.api.ApiHeaders;

import java.util.UUID;

@Tag(name = "Review", description = "Review queue, answer submission and cached review stats")
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
@Validated
public class ReviewController {

    private final ReviewService reviewService;
    private final UserStatsService userStatsService;

    @GetMapping("/next")
    @Operation(
            summary = "Get the next item to review",
            description = "Returns the most urgent due concept with the phrasing to present. Falls back to new concepts when nothing is due; returns 204 when there is nothing to review."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Next review item",
                    content = @Content(schema = @Schema(implementation = NextReviewDto.class))),
            @ApiResponse(responseCode = "204", description = "Nothing to review right now")
    })
    public ResponseEntity<NextReviewDto> getNext(
            @Parameter(description = "Caller user ID", required = true)
            @RequestHeader(ApiHeaders.USER_ID) UUID userId
    ) {
        return reviewService.getNextReview(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/interactions")
    @Operation(summary = "Submit an answer", description = "Records the answer and reschedules the concept.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer recorded",
                    content = @Content(schema = @Schema(implementation = InteractionResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Concept or phrasing not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Concurrent update could not be resolved",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<InteractionResultDto> recordInteraction(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @Valid @RequestBody RecordInteractionRequest request
    ) {
        return ResponseEntity.ok(reviewService.recordInteraction(userId, request));
    }

    @GetMapping("/due-count")
    @Operation(summary = "Get due counts", description = "Reads the cached stats row; zeros when the user has none.")
    public ResponseEntity<DueCountDto> getDueCount(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(userStatsService.getDueCount(userId));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get card stats")
    public ResponseEntity<UserCardStatsDto> getStats(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(userStatsService.getUserCardStats(userId));
    }

    @PostMapping("/stats/reconcile")
    @Operation(summary = "Rebuild card stats", description = "Recomputes the cached counters from the concept table.")
    public ResponseEntity<UserCardStatsDto> reconcileStats(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(userStatsService.reconcile(userId));
    }
}
