package com.ryuqq.uploadgate.application.search;

import com.ryuqq.uploadgate.core.model.FoundItem;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SearchResult 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SearchResultTest {

    @Test
    void none_발견_없음() {
        // when
        SearchResult result = SearchResult.none();

        // then
        assertThat(result.found()).isFalse();
        assertThat(result.firstMatch()).isEmpty();
        assertThat(result.searched()).isZero();
    }

    @Test
    void firstMatch가_있으면_found() {
        // given
        FoundItem item = new FoundItem("a", "r", "dir", "file.txt");

        // when
        SearchResult result = new SearchResult(Optional.of(item), 2, 1, 0);

        // then
        assertThat(result.found()).isTrue();
        assertThat(result.firstMatch()).contains(item);
    }

    @Test
    void null_firstMatch는_empty로_정규화() {
        assertThat(new SearchResult(null, 0, 0, 0).found()).isFalse();
    }

    @Test
    void 음수_카운터는_예외() {
        assertThatThrownBy(() -> new SearchResult(Optional.empty(), -1, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
