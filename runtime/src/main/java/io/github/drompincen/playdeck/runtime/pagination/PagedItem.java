package io.github.drompincen.playdeck.runtime.pagination;

import org.springframework.data.domain.Page;

/**
 * An item yielded by {@link Paginator#items()}, with the page and paginator it came from.
 */
public record PagedItem<T>(
        T item,
        Page<T> page,
        Paginator<T> paginator
) {
    /** 1-based number of the page holding the item. */
    public int pageNumber() {
        return page.getNumber() + 1;
    }
}
