package de.jwiegmann.trainingdata.control.batch;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InMemoryDocumentSource implements DocumentSource {

    private final String name;
    private final String contentType;
    private final byte[] content;

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getContentType() {
        return contentType;
    }

    @Override
    public byte[] read() {
        return content;
    }
}
