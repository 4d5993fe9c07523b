package com.phillippitts.actiontracker.service.accumulate;

import com.phillippitts.actiontracker.exception.AccumulationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Performs an exclusive read-modify-write cycle on a text file.
 *
 * <p>OS file locks are held per process, so threads of this JVM are serialised first by a
 * {@link ReentrantLock} per normalised path and then by a {@link FileLock} against other
 * processes. The file is opened without truncation; the new content is written from offset zero
 * and the file truncated to its length.
 */
final class LockedFileUpdater {

    private static final Logger LOG = LogManager.getLogger(LockedFileUpdater.class);

    private static final ConcurrentMap<Path, ReentrantLock> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();

    private LockedFileUpdater() {}

    /**
     * @param file      file to update; created with its parent directories when missing
     * @param transform maps current content (empty string for a new file) to new content
     * @throws AccumulationException on any I/O or locking failure
     */
    static void update(Path file, UnaryOperator<String> transform) {
        Path key = file.toAbsolutePath().normalize();
        ReentrantLock lock = IN_PROCESS_LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Path parent = key.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(key,
                    StandardOpenOption.READ, StandardOpenOption.WRITE, StandardOpenOption.CREATE);
                 FileLock ignored = channel.lock()) {
                String current = read(channel);
                String updated = transform.apply(current);
                write(channel, updated);
                LOG.debug("Rewrote {} ({} chars)", key, updated.length());
            }
        } catch (IOException | OverlappingFileLockException e) {
            throw new AccumulationException("Failed to update accumulation file", key, e);
        } finally {
            lock.unlock();
        }
    }

    private static String read(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size > Integer.MAX_VALUE) {
            throw new IOException("Accumulation file too large: " + size + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) size);
        channel.position(0);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                break;
            }
        }
        buffer.flip();
        return StandardCharsets.UTF_8.decode(buffer).toString();
    }

    private static void write(FileChannel channel, String content) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
        channel.position(0);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        channel.truncate(channel.position());
        channel.force(false);
    }
}
