package com.paxkun.mangaha.service.download;

/**
 * The downloaded images could not be turned into a document, or the document could not be written.
 */
public class AssemblyException extends RuntimeException {

    public AssemblyException(String message) {
        super(message);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
