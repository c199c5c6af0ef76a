package com.objectarchive;

/**
 * Thrown when a reference found in the main stream cannot be turned back into an object, for
 * example because no loader is registered for its type descriptor. The {@code load} call that
 * encountered it is abandoned as a whole.
 */
public class UnresolvableReferenceException extends ArchiveException {
  private final Object reference;

  public UnresolvableReferenceException(Object reference, String message) {
    super(String.format("Cannot resolve reference %s: %s", reference, message));
    this.reference = reference;
  }

  public Object getReference() {
    return reference;
  }
}
