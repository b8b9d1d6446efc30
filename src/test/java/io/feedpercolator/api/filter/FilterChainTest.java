package io.feedpercolator.api.filter;

import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.exception.ErrorCategory;
import io.feedpercolator.api.exception.FilterExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterChainTest {

    private final FeedItem item = new FeedItem("id-1", "Hello", List.of(), Instant.EPOCH, "body", null);

    @Test
    @DisplayName("Should include every item when no filters are configured")
    void shouldIncludeEveryItemWhenNoFiltersAreConfigured() {
        assertThat(new FilterChain(null).evaluate(item)).isEqualTo(FilterAction.INCLUDE);
        assertThat(new FilterChain(List.of()).evaluate(item)).isEqualTo(FilterAction.INCLUDE);
    }

    @Test
    @DisplayName("Should let a later filter override an earlier one")
    void shouldLetLaterFilterOverrideEarlierOne() {
        Filter excludeAll = i -> FilterAction.EXCLUDE;
        Filter includeAll = i -> FilterAction.INCLUDE;

        assertThat(new FilterChain(List.of(excludeAll, includeAll)).includes(item)).isTrue();
        assertThat(new FilterChain(List.of(includeAll, excludeAll)).includes(item)).isFalse();
    }

    @Test
    @DisplayName("Should never change the decision when a filter abstains")
    void shouldNeverChangeDecisionWhenFilterAbstains() {
        Filter abstain = i -> FilterAction.ABSTAIN;
        Filter exclude = i -> FilterAction.EXCLUDE;

        assertThat(new FilterChain(List.of(abstain, abstain)).evaluate(item)).isEqualTo(FilterAction.INCLUDE);
        assertThat(new FilterChain(List.of(exclude, abstain)).evaluate(item)).isEqualTo(FilterAction.EXCLUDE);
    }

    @Test
    @DisplayName("Should run every filter in definition order")
    void shouldRunEveryFilterInDefinitionOrder() {
        List<String> calls = new ArrayList<>();
        Filter first = i -> { calls.add("first"); return FilterAction.EXCLUDE; };
        Filter second = i -> { calls.add("second"); return FilterAction.ABSTAIN; };
        Filter third = i -> { calls.add("third"); return FilterAction.ABSTAIN; };

        FilterAction result = new FilterChain(List.of(first, second, third)).evaluate(item);

        assertThat(calls).containsExactly("first", "second", "third");
        assertThat(result).isEqualTo(FilterAction.EXCLUDE);
    }

    @Test
    @DisplayName("Should narrow a broad exclusion with a specific inclusion")
    void shouldNarrowBroadExclusionWithSpecificInclusion() {
        Filter dropEverything = i -> FilterAction.EXCLUDE;
        Filter keepHello = i -> i.title().startsWith("Hello") ? FilterAction.INCLUDE : FilterAction.ABSTAIN;
        FilterChain chain = new FilterChain(List.of(dropEverything, keepHello));

        FeedItem other = new FeedItem("id-2", "Goodbye", List.of(), Instant.EPOCH, null, null);

        assertThat(chain.includes(item)).isTrue();
        assertThat(chain.includes(other)).isFalse();
    }

    @Test
    @DisplayName("Should abort with filter name when a filter throws")
    void shouldAbortWithFilterNameWhenFilterThrows() {
        Filter broken = new Filter() {
            @Override
            public FilterAction apply(FeedItem i) {
                throw new IllegalStateException("boom");
            }

            @Override
            public String name() {
                return "broken";
            }
        };

        assertThatThrownBy(() -> new FilterChain(List.of(broken)).evaluate(item))
                .isInstanceOf(FilterExecutionException.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("id-1")
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting(e -> ((FilterExecutionException) e).getCategory())
                .isEqualTo(ErrorCategory.FILTER_ERROR);
    }

    @Test
    @DisplayName("Should treat a missing action as a filter failure")
    void shouldTreatMissingActionAsFilterFailure() {
        Filter returnsNull = i -> null;

        assertThatThrownBy(() -> new FilterChain(List.of(returnsNull)).evaluate(item))
                .isInstanceOf(FilterExecutionException.class);
    }
}
