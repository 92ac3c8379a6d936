package dev.aparikh.mailindex.search;

import dev.aparikh.mailindex.api.CountResponse;
import dev.aparikh.mailindex.api.ErrorResponse;
import dev.aparikh.mailindex.api.MessagePageResponse;
import dev.aparikh.mailindex.config.MailIndexProperties;
import dev.aparikh.mailindex.indexing.IndexStats;
import dev.aparikh.mailindex.model.Message;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * REST Controller for message lookups.
 */
@RestController
@RequestMapping("/api/messages")
@Tag(name = "Message Search", description = "Date-ordered listing, sender lookup, keyword lookup and streaming")
public class MessageSearchController {

    private final MessageSearchService messageSearchService;
    private final MailIndexProperties properties;

    public MessageSearchController(MessageSearchService messageSearchService, MailIndexProperties properties) {
        this.messageSearchService = messageSearchService;
        this.properties = properties;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List messages by date",
            description = "Returns messages in ascending date key order; messages sharing a date key keep " +
                    "the order they were ingested in. Use 'page' and 'size' for pagination."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Page returned",
                    content = @Content(schema = @Schema(implementation = MessagePageResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid paging parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<MessagePageResponse> listOrdered(
            @Parameter(description = "Page number (0-based)") @RequestParam(required = false) Integer page,
            @Parameter(description = "Page size") @RequestParam(required = false) Integer size) {

        ListQuery query = new ListQuery(
                page != null ? page : 0,
                size != null ? size : properties.getDefaultPageSize());
        List<Message> messages = messageSearchService.ordered(query);
        long totalCount = messageSearchService.count();

        MessagePageResponse response = new MessagePageResponse(
                messages, totalCount, query.page(), query.size(), query.totalPages(totalCount));
        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get message by id")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Message found",
                    content = @Content(schema = @Schema(implementation = Message.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "No message with that id",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<Message> getById(@PathVariable long id) {
        return ResponseEntity.ok(messageSearchService.getById(id));
    }

    @GetMapping(value = "/by-sender", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Messages from a sender",
            description = "Exact, case-sensitive sender match. Results are in ingestion order; " +
                    "an unknown sender yields an empty list."
    )
    public ResponseEntity<List<Message>> bySender(@RequestParam String sender) {
        return ResponseEntity.ok(messageSearchService.bySender(sender));
    }

    @GetMapping(value = "/by-keyword", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Messages containing a word",
            description = "Case-insensitive whole-token match against subject and body. " +
                    "No prefix, substring or fuzzy matching."
    )
    public ResponseEntity<List<Message>> byKeyword(@RequestParam String word) {
        return ResponseEntity.ok(messageSearchService.byKeyword(word));
    }

    @GetMapping(value = "/count", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Count messages")
    public ResponseEntity<CountResponse> count() {
        return ResponseEntity.ok(new CountResponse(messageSearchService.count()));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Index statistics")
    public ResponseEntity<IndexStats> stats() {
        return ResponseEntity.ok(messageSearchService.stats());
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
            summary = "Stream messages by date",
            description = "Streams the full date-ordered listing as server-sent events. " +
                    "Suitable for exporting large datasets."
    )
    public Flux<ServerSentEvent<Message>> streamOrdered(
            @Parameter(description = "Messages pulled per batch") @RequestParam(required = false) Integer batchSize) {

        int batch = batchSize != null ? batchSize : properties.getStreamBatchSize();
        return messageSearchService.streamOrdered(batch)
                .map(message -> ServerSentEvent.<Message>builder()
                        .id(String.valueOf(message.id()))
                        .data(message)
                        .build());
    }
}
