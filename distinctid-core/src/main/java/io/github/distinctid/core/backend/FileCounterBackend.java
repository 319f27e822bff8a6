package io.github.distinctid.core.backend;

import io.github.distinctid.core.BackendUnavailableException;
import io.github.distinctid.core.log.Log;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counters stored as decimal text, one file per key, for producers running on a single host.
 * <p>
 * An exclusive {@link FileLock} serializes processes. File locks are held per JVM, so
 * threads of this process, across every instance, are serialized by a lock per counter file.
 */
public class FileCounterBackend implements CounterBackend {

    public static final String FILE_SUFFIX = ".counter";

    private static final Map<Path, Lock> LOCKS = new ConcurrentHashMap<>();

    private final Log log = Log.get(FileCounterBackend.class);

    private final Path directory;

    public FileCounterBackend(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new BackendUnavailableException("cannot create counter directory " + directory, e);
        }
    }

    @Override
    public long incrementBy(String key, long delta) {
        CounterBackend.requirePositive(delta);
        Path file = fileOf(key);
        Lock lock = lockOf(file);
        lock.lock();
        try {
            long total = addAndGet(file, delta);
            log.trace(() -> "counter '" + key + "' +" + delta + " = " + total);
            return total;
        } catch (IOException | OverlappingFileLockException e) {
            throw BackendUnavailableException.of(key, e);
        } finally {
            lock.unlock();
        }
    }

    private long addAndGet(Path file, long delta) throws IOException {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            long total = read(channel) + delta;
            byte[] bytes = Long.toString(total).getBytes(StandardCharsets.US_ASCII);
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(bytes), 0);
            channel.force(false);
            return total;
        }
    }

    private static long read(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return 0;
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) size);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, buffer.position()) < 0) {
                break;
            }
        }
        String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.US_ASCII).trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IOException("corrupted counter value: " + text, e);
        }
    }

    /**
     * Writes {@code value} as the current total of {@code key}.
     */
    public void set(String key, long value) {
        Path file = fileOf(key);
        Lock lock = lockOf(file);
        lock.lock();
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(Long.toString(value).getBytes(StandardCharsets.US_ASCII)), 0);
        } catch (IOException | OverlappingFileLockException e) {
            throw BackendUnavailableException.of(key, e);
        } finally {
            lock.unlock();
        }
    }

    private static Lock lockOf(Path file) {
        return LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), f -> new ReentrantLock());
    }

    Path fileOf(String key) {
        String name = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(key.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(name + FILE_SUFFIX);
    }
}
