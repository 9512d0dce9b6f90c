package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "SetCanonicalPhrasingRequest", description = "Pin the phrasing shown for a concept")
public record SetCanonicalPhrasingRequest(
        @Schema(description = "Phrasing to pin; null clears the pin")
        UUID phrasingId
) {
}
