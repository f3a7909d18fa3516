package co.fanki.filegraph.config;

import co.fanki.filegraph.analysis.application.ReportWriter;
import co.fanki.filegraph.analysis.domain.ContentFileTypeDetector;
import co.fanki.filegraph.analysis.domain.FileTypeDetector;
import co.fanki.filegraph.report.domain.ReportFileListExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the collaborators that are not Spring components themselves.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class FileGraphConfiguration {

    /**
     * Provides the JSON mapper for the config file.
     *
     * @return a default object mapper
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    /**
     * Provides the config file loader.
     *
     * @param objectMapper the JSON mapper
     * @return the loader
     */
    @Bean
    public AnalyzerConfigLoader analyzerConfigLoader(
            final ObjectMapper objectMapper) {
        return new AnalyzerConfigLoader(objectMapper);
    }

    /**
     * Provides the binary detector used on executed files.
     *
     * @return the content based detector
     */
    @Bean
    public FileTypeDetector fileTypeDetector() {
        return new ContentFileTypeDetector();
    }

    /**
     * Provides the reader of report file lists.
     *
     * @return the extractor
     */
    @Bean
    public ReportFileListExtractor reportFileListExtractor() {
        return new ReportFileListExtractor();
    }

    /**
     * Provides the report writer, naming files after the system clock.
     *
     * @return the writer
     */
    @Bean
    public ReportWriter reportWriter() {
        return new ReportWriter(Clock.systemDefaultZone());
    }

}
