package dev.aparikh.mailindex.indexing;

import dev.aparikh.mailindex.api.ErrorResponse;
import dev.aparikh.mailindex.api.IngestRequest;
import dev.aparikh.mailindex.model.Message;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/messages")
@Tag(name = "Message Ingest", description = "Create and index messages")
public class MessageIngestController {

    private final MessageIngestService ingestService;

    public MessageIngestController(MessageIngestService ingestService) {
        this.ingestService = ingestService;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Ingest a message",
            description = "Stores the message and indexes it by date key, sender and subject/body terms."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Message created",
                    content = @Content(schema = @Schema(implementation = Message.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Empty sender or missing fields",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "500",
                    description = "Index left inconsistent",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<Message> ingest(@Valid @RequestBody IngestRequest request) {
        Message created = ingestService.ingest(request);
        return ResponseEntity.created(URI.create("/api/messages/" + created.id())).body(created);
    }

    @PostMapping(value = "/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Ingest several messages in order")
    public ResponseEntity<List<Message>> ingestAll(@RequestBody List<IngestRequest> requests) {
        return ResponseEntity.ok(ingestService.ingestAll(requests));
    }
}
