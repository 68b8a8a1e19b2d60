package com.simsci.cvd.api;

import com.simsci.cvd.paf.DrawOutput;
import com.simsci.cvd.paf.LocationArtifact;

import java.io.IOException;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Versioned, per-location store of draw outputs and assembled artifacts.
 *
 * <p>
 * A draw is either fully stored or absent: {@link #writeDraw} must be atomic,
 * so a job killed mid-write looks exactly like one that never started.
 * Writes to one location are serialized by the store.
 */
public interface ArtifactStore {

    /** Artifact version this store reads and writes. */
    String version();

    /** Persists a draw atomically, replacing any earlier output of the same draw. */
    void writeDraw(DrawOutput output) throws IOException;

    /** Indices of the draws stored for a location. */
    SortedSet<Integer> completedDraws(String location) throws IOException;

    /** Number of stored draws holding a value for {@code key}. */
    int drawCount(String location, String key) throws IOException;

    /** Reads one stored draw. */
    Optional<DrawOutput> readDraw(String location, int draw) throws IOException;

    /**
     * Combines the stored draws {@code [0, drawCount)} of a location into its
     * artifact and persists it.
     *
     * @throws IllegalStateException if any draw is missing.
     */
    LocationArtifact assemble(String location, int drawCount) throws IOException;

    /** The assembled artifact of a location, if one was written. */
    Optional<LocationArtifact> readArtifact(String location) throws IOException;
}
