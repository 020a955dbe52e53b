package org.pragmatica.refactor.tree;

/**
 * Value of an imaginary literal such as {@code 2j}.
 */
public record Imaginary(double imag) {}
