package com.swipesentinel.audit;

import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipesentinel.core.ConfigException;
import com.swipesentinel.model.Packet;
import com.swipesentinel.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSONL packet log: one {@link Packet} per line, flushed as soon as
 * it is written so a crash loses at most the cycle in flight.
 *
 * A log left with an unterminated last line (a write cut short) is closed off with
 * a line break before the first new packet, and {@link #readAll} skips truncated
 * packets, so one torn write never costs the rest of the session.
 *
 * ## Thread Safety
 * {@link #append} is synchronized; one logger may be shared by several sessions
 * writing to the same file.
 */
public class PacketLogger implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(PacketLogger.class);

    private final Path           path;
    private final ObjectMapper   mapper = JsonSupport.compactMapper();
    private final BufferedWriter writer;
    private int                  written;

    public PacketLogger(Path path) {
        this.path = path;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            boolean torn = endsWithoutLineBreak(path);
            this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            if (torn) {
                log.warn("PacketLogger: {} ends mid-line, terminating the partial packet", path.toAbsolutePath());
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("PacketLogger: cannot open " + path, e);
        }
        log.info("PacketLogger: appending packets to {}", path.toAbsolutePath());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public synchronized void append(Packet packet) {
        try {
            writer.write(mapper.writeValueAsString(packet));
            writer.newLine();
            writer.flush();
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException("PacketLogger: failed to append packet to " + path, e);
        }
    }

    public Path getPath()              { return path; }
    public synchronized int getWritten() { return written; }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }

    // ── Reading ───────────────────────────────────────────────────────────────

    /**
     * Reads every packet of a log. Blank lines are ignored; a packet cut off
     * mid-document is skipped with a warning.
     *
     * @throws ConfigException when the file is missing or a line is not a packet
     */
    public static List<Packet> readAll(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Packet log not found: " + path);
        }
        ObjectMapper mapper = JsonSupport.compactMapper();
        List<Packet> packets = new ArrayList<>();
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Cannot read packet log " + path + ": " + e.getMessage(), e);
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) continue;
            try {
                packets.add(mapper.readValue(line, Packet.class));
            } catch (JsonEOFException e) {
                log.warn("PacketLogger: {}:{} skipped, packet is truncated", path, i + 1);
            } catch (IOException e) {
                throw new ConfigException(path + ":" + (i + 1) + ": not a packet: " + e.getMessage(), e);
            }
        }
        return packets;
    }

    private static boolean endsWithoutLineBreak(Path path) throws IOException {
        if (!Files.isRegularFile(path) || Files.size(path) == 0) return false;
        try (SeekableByteChannel channel = Files.newByteChannel(path)) {
            channel.position(channel.size() - 1);
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last);
            return last.get(0) != '\n';
        }
    }
}
