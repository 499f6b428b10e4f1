package com.hirepanel.core.model;

import java.io.Serializable;

/**
 * A persona that produced no usable evaluation, and why.
 */
public record MissingPersona(
    String personaKey,
    String displayName,
    ErrorKind errorKind,
    String detail
) implements Serializable {}
