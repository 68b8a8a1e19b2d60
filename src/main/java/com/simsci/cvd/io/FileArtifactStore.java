package com.simsci.cvd.io;

import com.simsci.cvd.api.ArtifactStore;
import com.simsci.cvd.paf.DrawOutput;
import com.simsci.cvd.paf.LocationArtifact;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ArtifactStore} on the local file system.
 *
 * <pre>
 * root/
 *   version/
 *     location/
 *       draw_0000.json   one per completed draw
 *       artifact.json    written by assemble
 * </pre>
 *
 * Files are written to a temporary sibling and renamed into place, so readers
 * never observe a partial draw. Location names are mapped onto safe directory
 * names by replacing every character outside {@code [A-Za-z0-9._-]} with '_'.
 */
public final class FileArtifactStore implements ArtifactStore {
    private static final Logger log = LogManager.getLogger(FileArtifactStore.class);
    private static final Pattern DRAW_FILE = Pattern.compile("draw_(\\d+)\\.json");
    private static final String ARTIFACT_FILE = "artifact.json";

    private final ObjectMapper mapper = new ObjectMapper();
    private final Path root;
    private final String version;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileArtifactStore(Path root, String version) {
        this.root = root;
        this.version = version;
    }

    @Override
    public String version() {
        return version;
    }

    public Path locationDir(String location) {
        return root.resolve(version).resolve(location.replaceAll("[^A-Za-z0-9._-]", "_"));
    }

    private static String drawFileName(int draw) {
        return String.format("draw_%04d.json", draw);
    }

    @Override
    public void writeDraw(DrawOutput output) throws IOException {
        if (!version.equals(output.version()))
            throw new IllegalArgumentException("Draw " + output.draw() + " of " + output.location()
                    + " belongs to version " + output.version() + ", store is " + version);
        ReentrantLock lock = lock(output.location());
        lock.lock();
        try {
            Path dir = locationDir(output.location());
            writeAtomically(dir, dir.resolve(drawFileName(output.draw())), output);
        } finally {
            lock.unlock();
        }
        log.debug("Stored draw {} of {} ({} values)", output.draw(), output.location(), output.values().size());
    }

    @Override
    public SortedSet<Integer> completedDraws(String location) throws IOException {
        SortedSet<Integer> out = new TreeSet<>();
        Path dir = locationDir(location);
        if (!Files.isDirectory(dir))
            return out;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "draw_*.json")) {
            for (Path f : files) {
                Matcher m = DRAW_FILE.matcher(f.getFileName().toString());
                if (m.matches())
                    out.add(Integer.parseInt(m.group(1)));
            }
        }
        return out;
    }

    @Override
    public int drawCount(String location, String key) throws IOException {
        int count = 0;
        for (int d : completedDraws(location)) {
            Optional<DrawOutput> out = readDraw(location, d);
            if (out.isPresent() && out.get().values().containsKey(key))
                count++;
        }
        return count;
    }

    @Override
    public Optional<DrawOutput> readDraw(String location, int draw) throws IOException {
        Path f = locationDir(location).resolve(drawFileName(draw));
        if (!Files.exists(f))
            return Optional.empty();
        DrawOutput out = mapper.readValue(f.toFile(), DrawOutput.class);
        if (out.draw() != draw || !out.location().equals(location))
            throw new IOException("File " + f + " holds draw " + out.draw() + " of " + out.location());
        return Optional.of(out);
    }

    @Override
    public LocationArtifact assemble(String location, int drawCount) throws IOException {
        ReentrantLock lock = lock(location);
        lock.lock();
        try {
            SortedSet<Integer> done = completedDraws(location);
            List<Integer> missing = new ArrayList<>();
            for (int d = 0; d < drawCount; d++)
                if (!done.contains(d))
                    missing.add(d);
            if (!missing.isEmpty())
                throw new IllegalStateException("Location " + location + " is missing draws " + missing);

            Map<String, double[]> values = new LinkedHashMap<>();
            for (int d = 0; d < drawCount; d++) {
                DrawOutput out = readDraw(location, d).orElseThrow();
                for (var e : out.values().entrySet()) {
                    double[] v = values.computeIfAbsent(e.getKey(), k -> {
                        double[] a = new double[drawCount];
                        Arrays.fill(a, Double.NaN);
                        return a;
                    });
                    v[d] = e.getValue();
                }
            }
            for (var e : values.entrySet())
                for (int d = 0; d < drawCount; d++)
                    if (Double.isNaN(e.getValue()[d]))
                        throw new IllegalStateException("Key " + e.getKey() + " has no value in draw " + d
                                + " of " + location);

            LocationArtifact artifact = new LocationArtifact(version, location, drawCount, values);
            Path dir = locationDir(location);
            writeAtomically(dir, dir.resolve(ARTIFACT_FILE), artifact);
            log.info("Assembled {} {}: {} keys x {} draws", location, version, values.size(), drawCount);
            return artifact;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<LocationArtifact> readArtifact(String location) throws IOException {
        Path f = locationDir(location).resolve(ARTIFACT_FILE);
        if (!Files.exists(f))
            return Optional.empty();
        return Optional.of(mapper.readValue(f.toFile(), LocationArtifact.class));
    }

    private ReentrantLock lock(String location) {
        return locks.computeIfAbsent(location, k -> new ReentrantLock());
    }

    private void writeAtomically(Path dir, Path target, Object value) throws IOException {
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        boolean moved = false;
        try {
            mapper.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, falling back to replace", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved)
                Files.deleteIfExists(tmp);
        }
    }
}
