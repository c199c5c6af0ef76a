package com.objectarchive.codec;

/**
 * Inline placeholder stored in the main stream in place of an externally archived object.
 *
 * <p>Three shapes occur:
 *
 * <ul>
 *   <li><b>legacy</b>: descriptor and path, no identity. Written by the oldest archive versions and
 *       never memoized when read.
 *   <li><b>full</b>: descriptor, path and identity. The first occurrence of an object in a session.
 *   <li><b>reuse</b>: identity only. A later occurrence of an object already saved in the session.
 * </ul>
 *
 * @param descriptor the type descriptor selecting the loader, {@code null} for a reuse reference
 * @param relativePath the side file path relative to the archive root, {@code null} for reuse
 * @param identity the session-scoped identity token, {@code null} for a legacy reference
 */
public record ExternalReference(TypeDescriptor descriptor, String relativePath, Long identity) {

  public ExternalReference {
    if (identity == null && (descriptor == null || relativePath == null)) {
      throw new IllegalArgumentException("A reference without identity needs descriptor and path");
    }
    if ((descriptor == null) != (relativePath == null)) {
      throw new IllegalArgumentException("Descriptor and path must be given together");
    }
  }

  public static ExternalReference legacy(TypeDescriptor descriptor, String relativePath) {
    return new ExternalReference(descriptor, relativePath, null);
  }

  public static ExternalReference full(
      TypeDescriptor descriptor, String relativePath, long identity) {
    return new ExternalReference(descriptor, relativePath, identity);
  }

  public static ExternalReference reuse(long identity) {
    return new ExternalReference(null, null, identity);
  }

  public boolean isLegacy() {
    return identity == null;
  }

  public boolean isReuse() {
    return relativePath == null;
  }
}
