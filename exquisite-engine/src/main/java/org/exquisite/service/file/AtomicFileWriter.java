package org.exquisite.service.file;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.exquisite.exception.ExquisiteError;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Scoped durable write: temp file in the target directory, write, flush, fsync, rename over the
 * target, best-effort directory sync, temp removal. The previous target stays intact until the
 * rename succeeds.
 */
@Slf4j
@Component
public class AtomicFileWriter {

    @FunctionalInterface
    public interface ContentWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    public void write(Path target, ContentWriter content) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + target.getFileName() + ".", ".tmp");
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp, StandardOpenOption.WRITE))) {
                content.writeTo(out);
                out.flush();
            }
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                channel.force(true);
            }
            commit(temp, target);
            syncDirectory(directory);
        } catch (IOException e) {
            throw ExquisiteError.PERSISTENCE_FAILURE.createException(e, target, e.getMessage());
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    public void writeBytes(Path target, byte[] bytes) {
        write(target, out -> out.write(bytes));
    }

    public void writeString(Path target, String text) {
        writeBytes(target, text.getBytes(StandardCharsets.UTF_8));
    }

    public void writeJson(Path target, ObjectMapper mapper, Object value) {
        writeBytes(target, mapper.writeValueAsBytes(value));
    }

    /**
     * Encodes with the writer matching the target's extension.
     */
    public void writeImage(Path target, BufferedImage image) {
        String format = FilenameUtils.getExtension(target.getFileName().toString());
        write(target, out -> {
            if (!ImageIO.write(image, format, out)) {
                throw new IOException("No ImageIO writer for format '" + format + "'");
            }
        });
    }

    /**
     * Renames the fully written temp file over the target.
     */
    protected void commit(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not available for {}: {}", directory, e.getMessage());
        }
    }
}
