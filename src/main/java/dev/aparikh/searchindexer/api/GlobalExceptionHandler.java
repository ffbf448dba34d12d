package dev.aparikh.searchindexer.api;

import dev.aparikh.searchindexer.indexing.FieldResolutionException;
import dev.aparikh.searchindexer.indexing.IndexBackendException;
import dev.aparikh.searchindexer.indexing.IndexerConfigurationException;
import dev.aparikh.searchindexer.indexing.SchemaBindingException;
import dev.aparikh.searchindexer.reindex.ReindexInProgressException;
import dev.aparikh.searchindexer.reindex.UnknownIndexerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Global exception handler for REST API endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownIndexerException.class)
    public ResponseEntity<ErrorResponse> handleUnknownIndexer(UnknownIndexerException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ex.getMessage(), "INDEXER_NOT_FOUND"));
    }

    @ExceptionHandler(ReindexInProgressException.class)
    public ResponseEntity<ErrorResponse> handleReindexInProgress(ReindexInProgressException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(ex.getMessage(), "REINDEX_IN_PROGRESS"));
    }

    @ExceptionHandler(SchemaBindingException.class)
    public ResponseEntity<ErrorResponse> handleSchemaBinding(SchemaBindingException ex) {
        ErrorResponse error = new ErrorResponse(
                ex.getMessage(),
                "SCHEMA_BINDING_ERROR",
                ex.getUnknownFields(),
                Instant.now()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(IndexerConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(IndexerConfigurationException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ex.getMessage(), "CONFIGURATION_ERROR"));
    }

    /**
     * The exception message embeds the failing record, so it is only logged. Clients get the path.
     */
    @ExceptionHandler(FieldResolutionException.class)
    public ResponseEntity<ErrorResponse> handleFieldResolution(FieldResolutionException ex) {
        log.warn("Record could not be indexed: {}", ex.getMessage());
        String message;
        List<String> details;
        if (ex.getPath() == null) {
            message = "A required computed field could not be resolved";
            details = List.of();
        } else {
            message = "Required attribute '" + ex.getPath() + "' could not be resolved at '" + ex.getSegment() + "'";
            details = List.of(ex.getPath());
        }
        ErrorResponse error = new ErrorResponse(
                message,
                "FIELD_RESOLUTION_ERROR",
                details,
                Instant.now()
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(IndexBackendException.class)
    public ResponseEntity<ErrorResponse> handleBackend(IndexBackendException ex) {
        log.error("Search backend call failed", ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse(ex.getMessage(), "BACKEND_WRITE_ERROR"));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex) {
        log.error("Unexpected error during API operation", ex);

        ErrorResponse error = new ErrorResponse(
                "An unexpected error occurred",
                "INTERNAL_ERROR"
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
