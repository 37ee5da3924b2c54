package com.tongji.pipeline.event;

import com.tongji.pipeline.common.exception.ErrorCode;
import com.tongji.pipeline.common.exception.EventValidationException;
import com.tongji.pipeline.event.payload.PostCreated;
import com.tongji.pipeline.event.payload.PostRead;
import com.tongji.pipeline.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventValidator Unit Tests")
class EventValidatorTest {

    private final EventValidator validator = TestFixtures.validator();

    @Test
    @DisplayName("should accept events built by the factory")
    void shouldAcceptFactoryEvents() {
        assertThat(validator.violations(DomainEvents.postRead("u1", "p1"))).isEmpty();
        assertThat(validator.violations(DomainEvents.postLiked("u1", "p1", false))).isEmpty();
    }

    @Test
    @DisplayName("should report envelope and nested payload violations")
    void shouldReportViolations() {
        DomainEvent event = new DomainEvent(" ", EventType.POST_CREATED, Instant.now(),
                new PostCreated("", "u1", "alice", null, null, false, null));

        assertThat(validator.violations(event))
                .anyMatch(v -> v.startsWith("eventId"))
                .anyMatch(v -> v.startsWith("payload.postId"))
                .anyMatch(v -> v.startsWith("payload.createdAt"));
    }

    @Test
    @DisplayName("should reject an eventType that disagrees with the payload")
    void shouldRejectTypeMismatch() {
        DomainEvent event = new DomainEvent("e-1", EventType.POST_DELETED, Instant.now(), new PostRead("u1", "p1"));

        assertThatThrownBy(() -> validator.requireValid(event))
                .isInstanceOf(EventValidationException.class)
                .satisfies(e -> {
                    EventValidationException ex = (EventValidationException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.EVENT_INVALID);
                    assertThat(ex.getViolations()).hasSize(1);
                });
    }
}
