package dev.remedia.chunk;

/** Raised by {@link ChunkStore} implementations when the underlying store cannot answer. */
public class ChunkStoreException extends RuntimeException {

  public ChunkStoreException(String message) {
    super(message);
  }

  public ChunkStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
