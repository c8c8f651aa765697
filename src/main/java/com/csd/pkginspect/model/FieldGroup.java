package com.csd.pkginspect.model;

/**
 * Where an inspection field is answered from, in dispatch priority order.
 */
public enum FieldGroup {
    FIELD_NAMES,   // empty query: the vocabulary itself
    SESSION,       // resolver / discovery / local metrics properties
    REMOTE,        // release history and ecosystem statistics
    DERIVED,       // module introspection (doc, source file, source code)
    DESCRIPTOR     // files and METADATA fields inside the package directory
}
