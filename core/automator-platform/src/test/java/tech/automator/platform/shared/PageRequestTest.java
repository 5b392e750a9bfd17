package tech.automator.platform.shared;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for list pagination parameters and page metadata.
 */
class PageRequestTest {

    @Test
    @DisplayName("of should default to limit 100 and skip 0")
    void of_shouldApplyDefaults_whenParametersAbsent() {
        ServiceResult<PageRequest> result = PageRequest.of(null, null);

        assertThat(result.value()).isEqualTo(new PageRequest(100, 0));
    }

    @Test
    @DisplayName("of should accept the limit boundaries")
    void of_shouldAcceptBoundaries() {
        assertThat(PageRequest.of(1, 0).isSuccess()).isTrue();
        assertThat(PageRequest.of(1000, 5).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("of should reject a limit outside 1..1000")
    void of_shouldReturnInvalidLimit_whenOutOfRange() {
        assertThat(((ServiceResult.Failure<?>) PageRequest.of(0, 0)).code()).isEqualTo(ErrorCode.INVALID_LIMIT);
        assertThat(((ServiceResult.Failure<?>) PageRequest.of(1001, 0)).code()).isEqualTo(ErrorCode.INVALID_LIMIT);
    }

    @Test
    @DisplayName("of should reject a negative skip")
    void of_shouldReturnInvalidSkip_whenNegative() {
        assertThat(((ServiceResult.Failure<?>) PageRequest.of(10, -1)).code()).isEqualTo(ErrorCode.INVALID_SKIP);
    }

    @Test
    @DisplayName("Page.of should compute has_more from skip, returned count and total")
    void pageOf_shouldComputeHasMore() {
        PageRequest request = new PageRequest(2, 2);

        Page<String> middle = Page.of(List.of("c", "d"), 5, request);
        Page<String> last = Page.of(List.of("e"), 5, new PageRequest(2, 4));

        assertThat(middle.pagination().hasMore()).isTrue();
        assertThat(middle.pagination().returnedCount()).isEqualTo(2);
        assertThat(middle.pagination().totalCount()).isEqualTo(5);
        assertThat(last.pagination().hasMore()).isFalse();
        assertThat(request.lastIndex()).isEqualTo(3);
    }
}
