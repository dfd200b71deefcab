package io.imagexform.core.spi;

/** Which side of the pipeline an option applies to. */
public enum OptionKind {
    LOADER,
    SAVER
}
