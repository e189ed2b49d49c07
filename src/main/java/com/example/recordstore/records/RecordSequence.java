package com.example.recordstore.records;

import am.ik.pagination.CursorPage;
import am.ik.pagination.CursorPageRequest;
import am.ik.pagination.CursorPageRequest.Navigation;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy view over the records of one {@link QueryMode}, in id order. Every call to
 * {@link #iterator()} reads the store again from the first page.
 */
public final class RecordSequence implements Iterable<StoredRecord> {

	private final AtomicReference<CursorPage<StoredRecord, Long>> prefetchedPage;

	private final int pageSize;

	private final Function<CursorPageRequest<Long>, CursorPage<StoredRecord, Long>> pageFetcher;

	RecordSequence(CursorPage<StoredRecord, Long> firstPage, int pageSize,
			Function<CursorPageRequest<Long>, CursorPage<StoredRecord, Long>> pageFetcher) {
		this.prefetchedPage = new AtomicReference<>(firstPage);
		this.pageSize = pageSize;
		this.pageFetcher = pageFetcher;
	}

	@Override
	public Iterator<StoredRecord> iterator() {
		CursorPage<StoredRecord, Long> firstPage = this.prefetchedPage.getAndSet(null);
		if (firstPage == null) {
			firstPage = this.pageFetcher.apply(new CursorPageRequest<>(null, this.pageSize, Navigation.NEXT));
		}
		return new PagingIterator(firstPage);
	}

	public Stream<StoredRecord> stream() {
		return StreamSupport.stream(this.spliterator(), false);
	}

	public List<StoredRecord> toList() {
		return this.stream().toList();
	}

	private final class PagingIterator implements Iterator<StoredRecord> {

		private CursorPage<StoredRecord, Long> page;

		private int index = 0;

		PagingIterator(CursorPage<StoredRecord, Long> page) {
			this.page = page;
		}

		@Override
		public boolean hasNext() {
			while (this.index >= this.page.content().size()) {
				if (!this.page.hasNext() || this.page.content().isEmpty()) {
					return false;
				}
				List<StoredRecord> content = this.page.content();
				Long cursor = content.get(content.size() - 1).id();
				this.page = RecordSequence.this.pageFetcher
					.apply(new CursorPageRequest<>(cursor, RecordSequence.this.pageSize, Navigation.NEXT));
				this.index = 0;
			}
			return true;
		}

		@Override
		public StoredRecord next() {
			if (!this.hasNext()) {
				throw new NoSuchElementException();
			}
			return this.page.content().get(this.index++);
		}

	}

}
