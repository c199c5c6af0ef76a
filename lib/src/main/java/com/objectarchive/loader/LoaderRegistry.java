package com.objectarchive.loader;

import com.objectarchive.codec.TypeDescriptor;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable table mapping type descriptors to the loaders that rebuild externally archived
 * objects. The table is built explicitly and handed to each serializer or deserializer; there is
 * no process-wide registration and no lookup of classes by name.
 *
 * <p>Two kinds of entries exist:
 *
 * <ul>
 *   <li>built-in loaders, one per {@link BuiltinType} tag
 *   <li>extension loaders, keyed by the (namespace, name) descriptor of the extension type
 * </ul>
 */
public final class LoaderRegistry {

  private static final LoaderRegistry EMPTY = builder().build();

  private final Map<BuiltinType, ArchiveLoader<?>> builtins;
  private final Map<TypeDescriptor, ArchiveLoader<?>> extensions;

  private LoaderRegistry(Builder builder) {
    this.builtins = Collections.unmodifiableMap(new EnumMap<>(builder.builtins));
    this.extensions = Map.copyOf(builder.extensions);
  }

  public static LoaderRegistry empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the loader registered for a built-in tag.
   *
   * @param type the built-in type
   * @return the loader, or empty if none was registered
   */
  public Optional<ArchiveLoader<?>> builtin(BuiltinType type) {
    return Optional.ofNullable(builtins.get(type));
  }

  /**
   * Returns the loader for an arbitrary descriptor. Descriptors naming one of the fixed {@link
   * BuiltinType} tags resolve to the built-in table; every other descriptor resolves to the
   * extension table.
   *
   * @param descriptor the descriptor to look up
   * @return the loader, or empty if none is registered
   */
  public Optional<ArchiveLoader<?>> find(TypeDescriptor descriptor) {
    var builtin = BuiltinType.fromDescriptor(descriptor);
    if (builtin.isPresent()) {
      return builtin(builtin.get());
    }
    return Optional.ofNullable(extensions.get(descriptor));
  }

  /**
   * Checks whether a loader exists for a descriptor.
   *
   * @param descriptor the descriptor
   * @return true if {@link #find(TypeDescriptor)} would return a loader
   */
  public boolean canLoad(TypeDescriptor descriptor) {
    return find(descriptor).isPresent();
  }

  public int size() {
    return builtins.size() + extensions.size();
  }

  /** Collects loader registrations. */
  public static final class Builder {
    private final Map<BuiltinType, ArchiveLoader<?>> builtins = new EnumMap<>(BuiltinType.class);
    private final Map<TypeDescriptor, ArchiveLoader<?>> extensions = new HashMap<>();

    private Builder() {}

    /**
     * Registers the loader for one of the fixed built-in tags.
     *
     * @param type the built-in type
     * @param loader the loader to invoke with the staged path
     * @return this builder
     */
    public Builder builtin(BuiltinType type, ArchiveLoader<?> loader) {
      builtins.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(loader, "loader"));
      return this;
    }

    /**
     * Registers an extension loader for the descriptor of {@code type}.
     *
     * @param <T> the extension type
     * @param type the class whose instances the loader produces
     * @param loader the loader
     * @return this builder
     */
    public <T> Builder register(Class<T> type, ArchiveLoader<? extends T> loader) {
      return register(TypeDescriptor.of(type), loader);
    }

    /**
     * Registers an extension loader for an explicit descriptor.
     *
     * @param descriptor the descriptor the extension writes into its references
     * @param loader the loader
     * @return this builder
     * @throws IllegalArgumentException if the descriptor is one of the built-in tags
     */
    public Builder register(TypeDescriptor descriptor, ArchiveLoader<?> loader) {
      Objects.requireNonNull(descriptor, "descriptor");
      if (BuiltinType.fromDescriptor(descriptor).isPresent()) {
        throw new IllegalArgumentException(
            "Descriptor " + descriptor + " is a built-in tag; use builtin() instead");
      }
      extensions.put(descriptor, Objects.requireNonNull(loader, "loader"));
      return this;
    }

    public LoaderRegistry build() {
      return new LoaderRegistry(this);
    }
  }
}
