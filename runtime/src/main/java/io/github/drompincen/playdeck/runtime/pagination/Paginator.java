package io.github.drompincen.playdeck.runtime.pagination;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a pageable query in chunks of {@code chunkSize}.
 *
 * <p>The item count is read once, from the first page, and fixes {@link #numPages()}.
 * Iteration fetches each page only when it is reached; iterating again re-runs the query.
 * The query must have a stable sort order for {@link #items()} to yield each item once.
 *
 * <pre>{@code
 * new Paginator<>(repository::findAllByOrderByCreatedAtAsc, 500)
 *         .items()
 *         .forEach(item -> handle(item.item()));
 * }</pre>
 */
public class Paginator<T> implements Iterable<Page<T>> {

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    private final Function<Pageable, Page<T>> query;
    private final int chunkSize;
    private Long count;

    public Paginator(Function<Pageable, Page<T>> query) {
        this(query, DEFAULT_CHUNK_SIZE);
    }

    public Paginator(Function<Pageable, Page<T>> query, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.query = query;
        this.chunkSize = chunkSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public long count() {
        if (count == null) {
            count = query.apply(PageRequest.of(0, chunkSize)).getTotalElements();
        }
        return count;
    }

    public int numPages() {
        long total = count();
        return (int) ((total + chunkSize - 1) / chunkSize);
    }

    /**
     * @param number 1-based page number
     */
    public Page<T> page(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("That page number is less than 1");
        }
        if (number > numPages() && number != 1) {
            throw new IllegalArgumentException("That page contains no results");
        }
        return query.apply(PageRequest.of(number - 1, chunkSize));
    }

    @Override
    public Iterator<Page<T>> iterator() {
        int pages = numPages();
        return new Iterator<>() {
            private int next = 1;

            @Override
            public boolean hasNext() {
                return next <= pages;
            }

            @Override
            public Page<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return page(next++);
            }
        };
    }

    public Stream<Page<T>> pages() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), numPages(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public Stream<PagedItem<T>> items() {
        return pages().flatMap(page -> page.getContent().stream()
                .map(item -> new PagedItem<>(item, page, this)));
    }
}
