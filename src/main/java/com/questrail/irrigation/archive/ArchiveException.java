package com.questrail.irrigation.archive;

/**
 * Storage failure raised by the run archive.
 *
 * <p>Delivered to the caller whose request failed; the archive worker itself
 * keeps serving later requests.</p>
 */
public final class ArchiveException extends RuntimeException {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
