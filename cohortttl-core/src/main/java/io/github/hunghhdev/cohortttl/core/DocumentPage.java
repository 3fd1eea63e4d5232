package io.github.hunghhdev.cohortttl.core;

import java.util.Collections;
import java.util.List;

/**
 * One page of a partition listing. Pages are ordered by document id; {@link #getNextCursor()}
 * is the id to continue after, or null once the partition is exhausted.
 */
public final class DocumentPage {

    private static final DocumentPage EMPTY = new DocumentPage(Collections.emptyList(), null);

    private final List<Document> documents;
    private final String nextCursor;

    public DocumentPage(List<Document> documents, String nextCursor) {
        this.documents = Collections.unmodifiableList(documents);
        this.nextCursor = nextCursor;
    }

    public static DocumentPage empty() {
        return EMPTY;
    }

    public List<Document> getDocuments() {
        return documents;
    }

    public String getNextCursor() {
        return nextCursor;
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
