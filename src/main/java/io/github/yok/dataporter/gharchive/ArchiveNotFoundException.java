package io.github.yok.dataporter.gharchive;

import java.io.IOException;

/**
 * Thrown when the archive server answers a download with an HTTP error status.
 *
 * <p>
 * The loader treats this as a missing hourly file and continues with the next hour.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ArchiveNotFoundException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    /**
     * Creates the exception.
     *
     * @param url requested URL
     * @param statusCode HTTP status returned by the server
     */
    public ArchiveNotFoundException(String url, int statusCode) {
        super("HTTP " + statusCode + " for URL " + url);
        this.statusCode = statusCode;
    }

    /**
     * Returns the HTTP status returned by the server.
     *
     * @return status code
     */
    public int getStatusCode() {
        return statusCode;
    }
}
