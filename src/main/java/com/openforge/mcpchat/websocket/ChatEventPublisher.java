package com.openforge.mcpchat.websocket;

import com.openforge.mcpchat.conversation.event.ChatEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes ChatEvents to the STOMP topic of their conversation:
 *
 *   /topic/chat/{conversationId}
 *
 * Delivery is best effort. A failed send is logged and dropped so a slow or
 * broken subscriber can never stall a run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/chat/";

    private final SimpMessagingTemplate messagingTemplate;

    public void publish(ChatEvent event) {
        String destination = TOPIC_PREFIX + event.conversationId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
