package io.cleaninterfaces.observability.sink;

import io.cleaninterfaces.observability.ConfigurationException;
import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.format.RecordFormatter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends one formatted line per record to a local file.
 *
 * <p>Each line is written as a single buffer while holding the write lock, so concurrent
 * writers never interleave partial lines.</p>
 */
public final class FileSink extends Sink.AbstractSink {

    public static final String NAME = "file";

    private static final Logger logger = LoggerFactory.getLogger(FileSink.class);

    private final Path path;
    private final RecordFormatter formatter;
    private final FileChannel channel;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FileSink(Path path, RecordFormatter formatter, Level minimumLevel, Duration timeout, MeterRegistry registry) {
        super(NAME, minimumLevel, timeout, registry);
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.channel = open(this.path);
        logger.debug("File sink opened {}", this.path);
    }

    private static FileChannel open(Path path) {
        Path parent = path.getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            throw new ConfigurationException("Log directory does not exist: " + parent);
        }
        if (!Files.isWritable(parent)) {
            throw new ConfigurationException("Log directory is not writable: " + parent);
        }
        try {
            return FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException | SecurityException e) {
            throw new ConfigurationException("Cannot open log file " + path + ": " + e.getMessage(), e);
        }
    }

    public Path path() {
        return path;
    }

    @Override
    protected SinkOutcome doDeliver(LogRecord record) {
        String line = formatter.format(record) + "\n";
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
        writeLock.lock();
        try {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            return SinkOutcome.delivered();
        } catch (IOException e) {
            logger.warn("Failed to write log record to {}", path, e);
            return SinkOutcome.failed(describe(e));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void flush() {
        if (isClosed()) {
            return;
        }
        writeLock.lock();
        try {
            channel.force(false);
        } catch (IOException e) {
            logger.warn("Failed to flush log file {}", path, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    protected void doClose() {
        writeLock.lock();
        try {
            channel.force(false);
        } catch (IOException e) {
            logger.warn("Failed to flush log file {} on close", path, e);
        } finally {
            try {
                channel.close();
            } catch (IOException e) {
                logger.warn("Failed to close log file {}", path, e);
            }
            writeLock.unlock();
        }
    }
}
