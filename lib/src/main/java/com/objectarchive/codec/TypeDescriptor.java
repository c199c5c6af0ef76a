package com.objectarchive.codec;

import java.util.Objects;

/**
 * Names the kind of an externally archived object so a reader can pick its loader. A descriptor is
 * either a bare built-in type tag such as {@code "SFrame"} ({@code namespace} is {@code null}) or a
 * (namespace, name) pair derived from a class.
 *
 * @param namespace the package or module part, or {@code null} for a built-in tag
 * @param name the tag or the class name within the namespace
 */
public record TypeDescriptor(String namespace, String name) {

  public TypeDescriptor {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Descriptor name must not be empty");
    }
  }

  /**
   * Creates a descriptor for a bare type tag.
   *
   * @param tag the type tag
   * @return a built-in style descriptor
   */
  public static TypeDescriptor tag(String tag) {
    return new TypeDescriptor(null, tag);
  }

  /**
   * Creates the (package, class) descriptor of a class. Nested classes keep their binary name,
   * e.g. {@code Outer$Inner}.
   *
   * @param type the class to describe
   * @return the descriptor for {@code type}
   */
  public static TypeDescriptor of(Class<?> type) {
    var packageName = type.getPackageName();
    var className = type.getName();
    if (!packageName.isEmpty()) {
      className = className.substring(packageName.length() + 1);
    }
    return new TypeDescriptor(packageName, className);
  }

  /**
   * Checks if this descriptor is a bare tag.
   *
   * @return true if there is no namespace part
   */
  public boolean isTag() {
    return namespace == null;
  }

  @Override
  public String toString() {
    return isTag() ? name : "(" + namespace + ", " + name + ")";
  }
}
