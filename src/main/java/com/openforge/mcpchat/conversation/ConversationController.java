package com.openforge.mcpchat.conversation;

import com.openforge.mcpchat.conversation.dto.RunResponse;
import com.openforge.mcpchat.conversation.dto.SendMessageRequest;
import com.openforge.mcpchat.websocket.ChatEventPublisher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for conversations.
 *
 * Endpoints:
 *   POST   /api/conversations/{id}/messages — start a run for a user message (202)
 *   GET    /api/conversations/{id}/messages — visible history, oldest first
 *   DELETE /api/conversations/{id}/run      — cancel the run in flight (404 if none)
 *   DELETE /api/conversations/{id}          — clear history and pins (409 while running)
 *
 * The run itself is observed over WebSocket: subscribe to
 * /topic/chat/{id} before posting the message.
 */
@Slf4j
@RestController
@RequestMapping("/api/conversations/{conversationId}")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    @PostMapping("/messages")
    public ResponseEntity<RunResponse> sendMessage(@PathVariable String conversationId,
                                                   @Valid @RequestBody SendMessageRequest request) {
        conversationService.submit(conversationId, request.message());
        log.info("[Controller] Run accepted for conversation {}", conversationId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(RunResponse.accepted(conversationId, ChatEventPublisher.TOPIC_PREFIX));
    }

    @GetMapping("/messages")
    public List<ConversationMessage> history(@PathVariable String conversationId) {
        return conversationService.history(conversationId);
    }

    @DeleteMapping("/run")
    public ResponseEntity<Void> cancel(@PathVariable String conversationId) {
        if (!conversationService.cancel(conversationId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "No response is being generated for conversation " + conversationId);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clear(@PathVariable String conversationId) {
        conversationService.clear(conversationId);
        return ResponseEntity.noContent().build();
    }
}
