package com.objectarchive.loader;

import com.objectarchive.codec.TypeDescriptor;
import java.util.Optional;

/**
 * The fixed set of type tags that historical archives wrote as bare strings. References carrying
 * one of these tags always dispatch to the loader registered for the tag, never to a class
 * descriptor lookup.
 */
public enum BuiltinType {
  SFRAME("SFrame"),
  SGRAPH("SGraph"),
  SARRAY("SArray"),
  MODEL("Model");

  private final String tag;

  BuiltinType(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  public TypeDescriptor descriptor() {
    return TypeDescriptor.tag(tag);
  }

  /**
   * Finds the built-in type a descriptor names.
   *
   * @param descriptor the descriptor read from a reference
   * @return the built-in type, or empty if the descriptor is not one of the fixed tags
   */
  public static Optional<BuiltinType> fromDescriptor(TypeDescriptor descriptor) {
    if (descriptor == null || !descriptor.isTag()) {
      return Optional.empty();
    }
    for (var type : values()) {
      if (type.tag.equals(descriptor.name())) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
