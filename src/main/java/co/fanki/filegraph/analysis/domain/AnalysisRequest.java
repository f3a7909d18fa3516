package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;

import java.util.List;

/**
 * Everything the analyzer gets to know about one file.
 *
 * @param pwd the working directory the file runs in
 * @param absolutePath the canonical absolute path on the analyzed system
 * @param localPath where the file was read from on this machine
 * @param content the file content
 * @param args the arguments the file is invoked with
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisRequest(
        String pwd,
        String absolutePath,
        String localPath,
        String content,
        List<String> args) {

    /** Creates a request, validating the paths. */
    public AnalysisRequest {
        Preconditions.requireNonBlank(absolutePath,
                "Absolute path is required");
        Preconditions.requireNonBlank(localPath, "Local path is required");
        Preconditions.requireNonNull(content, "File content is required");
        pwd = pwd == null ? "" : pwd;
        args = args == null ? List.of() : List.copyOf(args);
    }
}
