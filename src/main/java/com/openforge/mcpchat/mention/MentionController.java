package com.openforge.mcpchat.mention;

import com.openforge.mcpchat.mention.dto.MentionRequest;
import com.openforge.mcpchat.mention.dto.MentionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Pin management for one conversation.
 *
 * Endpoints:
 *   GET    /api/conversations/{id}/mentions — current pins, in insertion order
 *   POST   /api/conversations/{id}/mentions — add a pin (200 even if it already existed)
 *   DELETE /api/conversations/{id}/mentions — remove a pin (404 if absent)
 */
@RestController
@RequestMapping("/api/conversations/{conversationId}/mentions")
@RequiredArgsConstructor
public class MentionController {

    private final MentionService mentionService;

    @GetMapping
    public List<MentionResponse> list(@PathVariable String conversationId) {
        return mentionService.snapshot(conversationId).stream()
                .map(MentionResponse::from)
                .toList();
    }

    @PostMapping
    public List<MentionResponse> add(@PathVariable String conversationId,
                                     @Valid @RequestBody MentionRequest request) {
        mentionService.add(conversationId, toMention(request));
        return list(conversationId);
    }

    @DeleteMapping
    public ResponseEntity<Void> remove(@PathVariable String conversationId,
                                       @Valid @RequestBody MentionRequest request) {
        if (!mentionService.remove(conversationId, toMention(request))) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Pin not found");
        }
        return ResponseEntity.noContent().build();
    }

    private static Mention toMention(MentionRequest request) {
        if (request.kind() == MentionKind.TOOL
                && (request.serverId() == null || request.serverId().isBlank())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "serverId is required for tool pins");
        }
        return request.toMention();
    }
}
