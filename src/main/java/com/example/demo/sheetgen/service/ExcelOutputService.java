package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.exception.LayoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Helper service to serialize Workbooks to bytes and persist them.
 */
@Slf4j
@Component
public class ExcelOutputService {

    public byte[] toBytes(Workbook workbook) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            workbook.write(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new LayoutException(LayoutException.OUTPUT_WRITE_FAILED, "Failed to serialize Excel workbook", e);
        }
    }

    /**
     * Writes the bytes next to the target and moves them into place, so the target
     * either keeps its previous content or holds the complete new file.
     *
     * @return the target path
     */
    public Path write(byte[] content, Path target) {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
            Files.write(temp, content);
            moveIntoPlace(temp, absolute);
            log.info("Wrote {} bytes to {}", content.length, absolute);
            return target;
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new LayoutException(LayoutException.OUTPUT_WRITE_FAILED, "Failed to write workbook to " + absolute, e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupError) {
            failure.addSuppressed(cleanupError);
        }
    }
}
