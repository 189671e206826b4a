package com.example.agreement.domain.model;

/**
 * Descriptive terms listed in the agreement's metadata table, in the order they are rendered.
 * The constant name is the key used in the term labels file.
 */
public enum MetadataTerm {
    TITLE,
    ALTERNATIVE,
    CREATOR,
    CONTRIBUTOR,
    CREATED,
    DESCRIPTION,
    AUDIENCE,
    SUBJECT,
    TEMPORAL,
    SPATIAL,
    IDENTIFIER,
    SOURCE,
    PUBLISHER,
    TYPE,
    FORMAT,
    LANGUAGE,
    RELATION,
    RIGHTSHOLDER,
    ACCESSRIGHTS,
    LICENSE,
    AVAILABLE
}
