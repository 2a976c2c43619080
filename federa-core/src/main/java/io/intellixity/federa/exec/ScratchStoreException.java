package io.intellixity.federa.exec;

/** DDL, DML or file-system failure inside the scratch store. */
public final class ScratchStoreException extends FederationException {
  public ScratchStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
