package dev.aparikh.searchindexer.reindex;

import dev.aparikh.searchindexer.api.ErrorResponse;
import dev.aparikh.searchindexer.api.IndexerListResponse;
import dev.aparikh.searchindexer.api.ReindexResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for triggering reindex passes.
 */
@RestController
@RequestMapping("/api/indexers")
@Tag(name = "Indexers", description = "List indexer types and rebuild their documents")
public class IndexerController {

    private final IndexerService indexerService;

    public IndexerController(IndexerService indexerService) {
        this.indexerService = indexerService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List indexer types", description = "Returns the type tags registered with the application.")
    public ResponseEntity<IndexerListResponse> listIndexers() {
        return ResponseEntity.ok(new IndexerListResponse(indexerService.types()));
    }

    @PostMapping(value = "/{type}/reindex", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Reindex one type",
            description = "Streams every record of the type into the index with a single commit, then deletes " +
                    "documents of that type which the pass did not refresh. Blocks until the pass completes. " +
                    "Only one pass per type may run at a time."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Reindex completed",
                    content = @Content(schema = @Schema(implementation = ReindexResponse.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "No indexer registered for the type",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "409",
                    description = "A reindex of the type is already running",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "A record is missing a required field",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "502",
                    description = "The search backend rejected a write",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<ReindexResponse> reindex(
            @Parameter(description = "Indexer type tag", required = true, example = "article")
            @PathVariable String type) {

        ReindexResult result = indexerService.reindex(type);
        ReindexResponse response = new ReindexResponse(
                result.type(), result.indexed(), result.startedAt(), result.finishedAt());
        return ResponseEntity.ok(response);
    }
}
