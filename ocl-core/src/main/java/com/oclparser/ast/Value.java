package com.oclparser.ast;

/**
 * A node that can appear on the right-hand side of an attribute or inside an array.
 */
public sealed interface Value extends Node permits Literal, ArrayValue, Dictionary, Recovery {
}
