package com.mailrag.ingest;

import java.util.List;

public interface MailSource {
    List<Document> listCandidates(TimeWindow window, String query) throws FetchException;

    Document fetch(String sourceId) throws FetchException;
}
