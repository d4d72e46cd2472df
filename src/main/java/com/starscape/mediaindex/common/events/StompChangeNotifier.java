package com.starscape.mediaindex.common.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Broadcasts change events to WebSocket subscribers.
 * Destinations: /topic/entities/{kind} and /topic/library/counts.
 */
@Service
public class StompChangeNotifier implements ChangeNotifier {
    
    private static final Logger log = LoggerFactory.getLogger(StompChangeNotifier.class);
    
    static final String COUNTS_DESTINATION = "/topic/library/counts";
    
    private final SimpMessagingTemplate messagingTemplate;
    
    public StompChangeNotifier(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }
    
    @Override
    public void entitiesArchived(EntityKind kind, List<String> uids) {
        publish(EntityChangeEvent.of(kind, ChangeType.ARCHIVED, uids));
    }
    
    @Override
    public void entitiesRestored(EntityKind kind, List<String> uids) {
        publish(EntityChangeEvent.of(kind, ChangeType.RESTORED, uids));
    }
    
    @Override
    public void entitiesUpdated(EntityKind kind, List<String> uids) {
        publish(EntityChangeEvent.of(kind, ChangeType.UPDATED, uids));
    }
    
    @Override
    public void entitiesDeleted(EntityKind kind, List<String> uids) {
        publish(EntityChangeEvent.of(kind, ChangeType.DELETED, uids));
    }
    
    @Override
    public void countsChanged(LibraryCounts counts) {
        try {
            messagingTemplate.convertAndSend(COUNTS_DESTINATION, counts);
            log.debug("Broadcasted library counts: photos={}, archived={}", counts.photos(), counts.archived());
        } catch (MessagingException e) {
            log.warn("Failed to broadcast library counts: {}", e.getMessage());
        }
    }
    
    static String destination(EntityKind kind) {
        return "/topic/entities/" + kind.topic();
    }
    
    private void publish(EntityChangeEvent event) {
        String destination = destination(event.kind());
        try {
            messagingTemplate.convertAndSend(destination, event);
            log.debug("Broadcasted {} to {}: {} uids", event.getEventType(), destination, event.uids().size());
        } catch (MessagingException e) {
            log.warn("Failed to broadcast {} to {}: {}", event.getEventType(), destination, e.getMessage());
        }
    }
}
