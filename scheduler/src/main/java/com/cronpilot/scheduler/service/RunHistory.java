package com.cronpilot.scheduler.service;

import com.cronpilot.scheduler.model.JobRun;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A job's run history, newest first, at most {@code limit} runs long.
 *
 * Nothing is read until iteration starts; runs are then fetched one page at
 * a time. Every call to {@link #iterator()} starts again from the newest run,
 * so the same RunHistory can be walked more than once.
 */
public final class RunHistory implements Iterable<JobRun> {

    private final Function<Pageable, Slice<JobRun>> pageFetcher;
    private final int limit;
    private final int pageSize;

    RunHistory(Function<Pageable, Slice<JobRun>> pageFetcher, int limit, int pageSize) {
        if (limit < 0)     throw new IllegalArgumentException("limit must be >= 0");
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
        this.pageFetcher = pageFetcher;
        this.limit       = limit;
        this.pageSize    = Math.min(pageSize, Math.max(limit, 1));
    }

    @Override
    public Iterator<JobRun> iterator() {
        return new PagingIterator();
    }

    public Stream<JobRun> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<JobRun> toList() {
        return stream().toList();
    }

    private final class PagingIterator implements Iterator<JobRun> {

        private Pageable nextPage = PageRequest.of(0, pageSize);
        private Iterator<JobRun> current = List.<JobRun>of().iterator();
        private int returned = 0;

        @Override
        public boolean hasNext() {
            if (returned >= limit) return false;
            while (!current.hasNext() && nextPage != null) {
                Slice<JobRun> slice = pageFetcher.apply(nextPage);
                current  = slice.getContent().iterator();
                nextPage = slice.hasNext() ? slice.nextPageable() : null;
            }
            return current.hasNext();
        }

        @Override
        public JobRun next() {
            if (!hasNext()) throw new NoSuchElementException();
            returned++;
            return current.next();
        }
    }
}
