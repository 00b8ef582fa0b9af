package com.oclparser.ast;

/**
 * A node that can appear in the body of a document, block or dictionary.
 */
public sealed interface Member extends Node permits Block, Attribute, Recovery {
}
