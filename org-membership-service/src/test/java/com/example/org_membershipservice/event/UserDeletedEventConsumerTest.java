package com.example.org_membershipservice.event;

import com.example.common.events.UserDeletedEvent;
import com.example.org_membershipservice.service.OrgMembershipService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserDeletedEventConsumerTest {

    @Mock
    private OrgMembershipService membershipService;

    @InjectMocks
    private UserDeletedEventConsumer consumer;

    @Test
    void handleUserDeleted_delegatesCleanup() {
        UUID userId = UUID.randomUUID();

        consumer.handleUserDeleted(UserDeletedEvent.builder().userId(userId).eventId("evt-1").build());

        verify(membershipService).removeDeletedUser(userId);
    }

    @Test
    void handleUserDeleted_ignoresEventWithoutUser() {
        consumer.handleUserDeleted(UserDeletedEvent.builder().eventId("evt-2").build());

        verifyNoInteractions(membershipService);
    }
}
