package org.broadinstitute.varspace.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to caller mistakes or to the state of the workspace, such as
 * non-existent or malformed files, name collisions or concurrent access to the same file.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /*
      Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.PathConflict
     * <p/>
     * The target of a mutating operation already exists and the caller did not ask to override it.
     */
    public static class PathConflict extends UserException {
        private static final long serialVersionUID = 0L;

        private final String fileId;

        public PathConflict(final String fileId) {
            super(String.format("File %s already exists and override was not requested", fileId));
            this.fileId = fileId;
        }

        public String getFileId() {
            return fileId;
        }
    }

    /**
     * <p/>
     * Class UserException.InvalidExtension
     * <p/>
     * The file name does not carry the extension required by the requested operation.
     */
    public static class InvalidExtension extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidExtension(final String fileId, final String requiredExtension) {
            super(String.format("File %s does not have the required extension '%s'", fileId, requiredExtension));
        }
    }

    /**
     * <p/>
     * Class UserException.Busy
     * <p/>
     * Another operation holds the lock on the requested file.
     */
    public static class Busy extends UserException {
        private static final long serialVersionUID = 0L;

        private final String fileId;

        public Busy(final String fileId) {
            super(String.format("File %s is in use by another operation", fileId));
            this.fileId = fileId;
        }

        public Busy(final String fileId, final Throwable cause) {
            super(String.format("Interrupted while waiting for file %s", fileId), cause);
            this.fileId = fileId;
        }

        public String getFileId() {
            return fileId;
        }
    }

    /**
     * <p/>
     * Class UserException.ConflictError
     * <p/>
     * A windowed save was attempted against a file whose content changed since the window was read.
     */
    public static class ConflictError extends UserException {
        private static final long serialVersionUID = 0L;

        public ConflictError(final String fileId, final int expectedRows, final int windowRows) {
            super(String.format("File %s changed since it was read: the saved window now holds %d rows but %d rows were submitted",
                    fileId, windowRows, expectedRows));
        }
    }

    /**
     * <p/>
     * Class UserException.NotFound
     * <p/>
     * The requested file does not exist in the workspace.
     */
    public static class NotFound extends UserException {
        private static final long serialVersionUID = 0L;

        public NotFound(final String fileId) {
            super(String.format("File %s was not found in the workspace", fileId));
        }
    }

    /**
     * <p/>
     * Class UserException.ValidationError
     * <p/>
     * Malformed table content or request arguments (e.g. row/header length mismatch, unknown column).
     */
    public static class ValidationError extends UserException {
        private static final long serialVersionUID = 0L;

        public ValidationError(final String message) {
            super(String.format("Validation error: %s", message));
        }

        public ValidationError(final String message, final Throwable cause) {
            super(String.format("Validation error: %s", message), cause);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(final Path path, final Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.toAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(final Path file, final Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.toAbsolutePath(), getMessage(e)), e);
        }
    }
}
