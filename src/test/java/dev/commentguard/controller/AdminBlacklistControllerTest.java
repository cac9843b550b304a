package dev.commentguard.controller;

import dev.commentguard.dto.BlacklistEntryRequest;
import dev.commentguard.dto.BlacklistEntryResponse;
import dev.commentguard.dto.PageResponse;
import dev.commentguard.service.BlacklistService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminBlacklistControllerTest {

    @Mock
    private BlacklistService blacklistService;

    @InjectMocks
    private AdminBlacklistController controller;

    private final BlacklistEntryResponse entry = BlacklistEntryResponse.builder()
            .id("5").type("domain").value("spam.io").build();

    @Test
    @DisplayName("Should list blacklist entries")
    void shouldList() {
        when(blacklistService.list(0, 50)).thenReturn(Mono.just(PageResponse.of(List.of(entry), 0, 50, 1)));

        StepVerifier.create(controller.list(0, 50))
                .assertNext(page -> assertThat(page.getContent()).containsExactly(entry))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should create a blacklist entry")
    void shouldCreate() {
        BlacklistEntryRequest request = BlacklistEntryRequest.builder().type("domain").value("spam.io").build();
        when(blacklistService.create(request)).thenReturn(Mono.just(entry));

        StepVerifier.create(controller.create(request))
                .expectNext(entry)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should delete a blacklist entry")
    void shouldDelete() {
        when(blacklistService.delete(5L)).thenReturn(Mono.empty());

        StepVerifier.create(controller.delete(5L)).verifyComplete();
        verify(blacklistService).delete(5L);
    }
}
