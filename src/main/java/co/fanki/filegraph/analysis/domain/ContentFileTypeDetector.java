package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Detects binaries by looking at the first bytes of a file.
 *
 * <p>Well known signatures map to a short type name. A file without a
 * known signature is still a binary when its sample holds a null byte or
 * too many control characters; its type is then {@code unknown}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ContentFileTypeDetector implements FileTypeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            ContentFileTypeDetector.class);

    /** Type reported for binaries without a known signature. */
    public static final String UNKNOWN_BINARY = "unknown";

    private static final int SAMPLE_SIZE = 4096;

    private static final double SUSPICIOUS_RATIO = 0.1;

    private static final int TAR_MAGIC_OFFSET = 257;

    private static final Signature UTF8_BOM = new Signature("utf-8", 0,
            0xEF, 0xBB, 0xBF);

    private static final Signature UTF16_LE_BOM = new Signature("utf-16le", 0,
            0xFF, 0xFE);

    private static final Signature UTF16_BE_BOM = new Signature("utf-16be", 0,
            0xFE, 0xFF);

    private static final List<Signature> SIGNATURES = List.of(
            new Signature("elf", 0, 0x7F, 'E', 'L', 'F'),
            new Signature("class", 0, 0xCA, 0xFE, 0xBA, 0xBE),
            new Signature("macho", 0, 0xFE, 0xED, 0xFA, 0xCE),
            new Signature("macho", 0, 0xFE, 0xED, 0xFA, 0xCF),
            new Signature("macho", 0, 0xCE, 0xFA, 0xED, 0xFE),
            new Signature("macho", 0, 0xCF, 0xFA, 0xED, 0xFE),
            new Signature("wasm", 0, 0x00, 'a', 's', 'm'),
            new Signature("zip", 0, 'P', 'K', 0x03, 0x04),
            new Signature("pdf", 0, '%', 'P', 'D', 'F'),
            new Signature("png", 0, 0x89, 'P', 'N', 'G'),
            new Signature("gif", 0, 'G', 'I', 'F', '8'),
            new Signature("xz", 0, 0xFD, '7', 'z', 'X', 'Z', 0x00),
            new Signature("7z", 0, '7', 'z', 0xBC, 0xAF, 0x27, 0x1C),
            new Signature("sqlite", 0, 'S', 'Q', 'L', 'i', 't', 'e', ' ',
                    'f', 'o', 'r', 'm', 'a', 't', ' ', '3', 0x00),
            new Signature("tar", TAR_MAGIC_OFFSET, 'u', 's', 't', 'a', 'r'),
            new Signature("bz2", 0, 'B', 'Z', 'h'),
            new Signature("jpg", 0, 0xFF, 0xD8, 0xFF),
            new Signature("gz", 0, 0x1F, 0x8B),
            new Signature("exe", 0, 'M', 'Z'));

    @Override
    public Optional<String> detect(final String localPath) {
        Preconditions.requireNonBlank(localPath, "Local path is required");

        final Path file = Paths.get(localPath);
        final byte[] sample;
        try (InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(SAMPLE_SIZE);
        } catch (final IOException e) {
            LOG.error("File does not exist or cannot be read: {} ({})",
                    localPath, e.getMessage());
            return Optional.empty();
        }

        for (final Signature signature : SIGNATURES) {
            if (signature.matches(sample)) {
                return Optional.of(signature.type());
            }
        }

        return isBinary(sample) ? Optional.of(UNKNOWN_BINARY)
                : Optional.empty();
    }

    private static boolean isBinary(final byte[] sample) {
        if (sample.length == 0 || hasTextByteOrderMark(sample)) {
            return false;
        }

        int suspicious = 0;
        for (final byte b : sample) {
            final int value = b & 0xFF;
            if (value == 0) {
                return true;
            }
            if (value < 7 || (value > 13 && value < 32 && value != 27)) {
                suspicious++;
            }
        }
        return suspicious > sample.length * SUSPICIOUS_RATIO;
    }

    private static boolean hasTextByteOrderMark(final byte[] sample) {
        return UTF8_BOM.matches(sample)
                || UTF16_LE_BOM.matches(sample)
                || UTF16_BE_BOM.matches(sample);
    }

    /** A byte signature at a fixed offset. */
    private record Signature(String type, int offset, int... bytes) {

        boolean matches(final byte[] sample) {
            if (sample.length < offset + bytes.length) {
                return false;
            }
            for (int i = 0; i < bytes.length; i++) {
                if ((sample[offset + i] & 0xFF) != bytes[i]) {
                    return false;
                }
            }
            return true;
        }
    }

}
