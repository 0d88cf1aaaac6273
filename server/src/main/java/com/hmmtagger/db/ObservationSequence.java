package com.hmmtagger.db;

public class ObservationSequence {
    private final long id;
    private final String sequenceText;
    private final String sequenceHash;
    private final long createdTs;

    public ObservationSequence(long id, String sequenceText, String sequenceHash, long createdTs) {
        this.id = id;
        this.sequenceText = sequenceText;
        this.sequenceHash = sequenceHash;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getSequenceText() {
        return sequenceText;
    }

    public String getSequenceHash() {
        return sequenceHash;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "ObservationSequence{id=" + id + ", text='" + sequenceText + "'}";
    }
}
