package tech.automator.platform.shared;

import java.util.List;
import java.util.function.Function;

/**
 * A window of list results plus the metadata clients need to page further.
 */
public record Page<T>(List<T> items, Pagination pagination) {

    public record Pagination(long totalCount, int returnedCount, int limit, int skip, boolean hasMore) {
    }

    public static <T> Page<T> of(List<T> items, long totalCount, PageRequest request) {
        boolean hasMore = request.skip() + items.size() < totalCount;
        return new Page<>(List.copyOf(items),
            new Pagination(totalCount, items.size(), request.limit(), request.skip(), hasMore));
    }

    public <U> Page<U> map(Function<? super T, ? extends U> mapper) {
        List<U> mapped = items.stream().<U>map(mapper).toList();
        return new Page<>(mapped, pagination);
    }
}
