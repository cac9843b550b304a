package dev.commentguard.controller;

import dev.commentguard.dto.AdminCommentResponse;
import dev.commentguard.dto.BulkModerationRequest;
import dev.commentguard.dto.ModerationActionResponse;
import dev.commentguard.dto.PageResponse;
import dev.commentguard.service.CommentModerationService;
import dev.commentguard.service.CommentModerationService.QueueFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminCommentControllerTest {

    @Mock
    private CommentModerationService moderationService;

    @InjectMocks
    private AdminCommentController controller;

    private final AdminCommentResponse view = AdminCommentResponse.builder()
            .id("1").status("pending").userEmail("jane@example.com").build();

    @Nested
    @DisplayName("GET /api/v1/admin/comments")
    class GetQueue {

        @Test
        @DisplayName("Should pass the parsed filter to the service")
        void shouldListQueue() {
            PageResponse<AdminCommentResponse> page = PageResponse.of(List.of(view), 0, 20, 1);
            when(moderationService.listQueue(QueueFilter.SPAM, 0, 20)).thenReturn(Mono.just(page));

            StepVerifier.create(controller.getQueue("SPAM", 0, 20))
                    .assertNext(result -> assertThat(result.getContent()).containsExactly(view))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("State transitions")
    class Transitions {

        @Test
        @DisplayName("Should return 200 on approve")
        void shouldApprove() {
            when(moderationService.approve(1L)).thenReturn(Mono.just(ModerationActionResponse.ok("Comment approved", view)));

            StepVerifier.create(controller.approve(1L))
                    .assertNext(entity -> {
                        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(entity.getBody().getComment()).isEqualTo(view);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return 500 when the transition failed")
        void shouldMapFailureTo500() {
            when(moderationService.markSpam(1L)).thenReturn(Mono.just(ModerationActionResponse.error("Failed to mark spam")));

            StepVerifier.create(controller.markSpam(1L))
                    .assertNext(entity -> {
                        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                        assertThat(entity.getBody().getError()).isEqualTo("Failed to mark spam");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should delete a comment")
        void shouldDelete() {
            when(moderationService.delete(1L)).thenReturn(Mono.just(ModerationActionResponse.builder()
                    .success(true).message("Comment deleted").build()));

            StepVerifier.create(controller.delete(1L))
                    .assertNext(entity -> assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Bulk operations")
    class Bulk {

        @Test
        @DisplayName("Should forward ids for bulk approve")
        void shouldBulkApprove() {
            List<Long> ids = List.of(1L, 2L);
            when(moderationService.bulkApprove(ids)).thenReturn(Mono.just(ModerationActionResponse.ok("Bulk approve completed", 2)));

            StepVerifier.create(controller.bulkApprove(new BulkModerationRequest(ids)))
                    .assertNext(entity -> assertThat(entity.getBody().getCount()).isEqualTo(2))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should forward ids for bulk spam and delete")
        void shouldBulkSpamAndDelete() {
            List<Long> ids = List.of(3L);
            when(moderationService.bulkMarkSpam(ids)).thenReturn(Mono.just(ModerationActionResponse.ok("Bulk mark spam completed", 1)));
            when(moderationService.bulkDelete(ids)).thenReturn(Mono.just(ModerationActionResponse.ok("Bulk delete completed", 1)));

            StepVerifier.create(controller.bulkMarkSpam(new BulkModerationRequest(ids)))
                    .assertNext(entity -> assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK))
                    .verifyComplete();
            StepVerifier.create(controller.bulkDelete(new BulkModerationRequest(ids)))
                    .assertNext(entity -> assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK))
                    .verifyComplete();
        }
    }
}
