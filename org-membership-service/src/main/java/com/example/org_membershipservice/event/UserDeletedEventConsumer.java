package com.example.org_membershipservice.event;

import com.example.common.events.UserDeletedEvent;
import com.example.org_membershipservice.service.OrgMembershipService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka Consumer for user.deleted events.
 * Pending invites are cancelled, coordinator roles handed over and memberships removed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true")
public class UserDeletedEventConsumer {

    private final OrgMembershipService membershipService;

    @KafkaListener(
        topics = "user.deleted",
        groupId = "org-membership-service",
        containerFactory = "userDeletedEventKafkaListenerContainerFactory"
    )
    public void handleUserDeleted(UserDeletedEvent event) {
        log.info("Received user.deleted event: userId={}, eventId={}", event.getUserId(), event.getEventId());

        if (event.getUserId() == null) {
            log.warn("Ignoring user.deleted event without userId: eventId={}", event.getEventId());
            return;
        }
        membershipService.removeDeletedUser(event.getUserId());
    }
}
