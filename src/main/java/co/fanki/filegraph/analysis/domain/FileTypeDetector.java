package co.fanki.filegraph.analysis.domain;

import java.util.Optional;

/**
 * Tells opaque binaries apart from files the analyzer can read.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FileTypeDetector {

    /**
     * Detects the type of a local file.
     *
     * @param localPath the path on this machine
     * @return the binary type (e.g. {@code elf}, or {@code unknown} for an
     *         unrecognized binary), or empty for text and unreadable files
     */
    Optional<String> detect(String localPath);
}
