package dev.aparikh.searchindexer.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Registered indexer types")
public record IndexerListResponse(
        @Schema(description = "Type tags that can be reindexed", example = "[\"article\", \"author\"]")
        List<String> types
) {
}
