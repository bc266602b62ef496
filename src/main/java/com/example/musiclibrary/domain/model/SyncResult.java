package com.example.musiclibrary.domain.model;

import lombok.Data;

@Data
public class SyncResult {

    private int tracksUpserted;

    private int filesFailed;

    private int tracksRemoved;

    private int albumsPruned;

    private int artistsPruned;

    private int drValuesResolved;

    public void merge(SyncResult other) {
        if (other == null) {
            return;
        }
        tracksUpserted += other.tracksUpserted;
        filesFailed += other.filesFailed;
        tracksRemoved += other.tracksRemoved;
        albumsPruned += other.albumsPruned;
        artistsPruned += other.artistsPruned;
        drValuesResolved += other.drValuesResolved;
    }

    public boolean hasChanges() {
        return tracksUpserted > 0 || tracksRemoved > 0 || albumsPruned > 0 || artistsPruned > 0
                || drValuesResolved > 0;
    }
}
