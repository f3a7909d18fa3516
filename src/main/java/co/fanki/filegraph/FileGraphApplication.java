package co.fanki.filegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * File Dependency Analyzer.
 *
 * <p>Command line tool that follows a system's scripts from a set of entry
 * points, asks Claude which files each one reads, writes and runs, and
 * reports the resulting dependency graph. A second command copies the
 * files a report lists out of a local mirror of the analyzed system.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class FileGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(FileGraphApplication.class, args)));
    }

}
