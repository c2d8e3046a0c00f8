package io.github.nicechester.bibleapi.model;

/**
 * Structural dialect of a Bible XML document.
 */
public enum FormatKind {
    /** OSIS with milestone verses: {@code <verse sID="Gen.1.1"/>...<verse eID="Gen.1.1"/>} */
    OSIS_SID_EID,
    /** OSIS with container verses: {@code <verse osisID="Gen.1.1">...</verse>} */
    OSIS_ATTRIBUTE,
    /** USFX with inline {@code <c id="1"/>} and {@code <v id="1"/>} markers */
    USFX,
    /** {@code <book><chapter number="1"><verse number="1">} nesting */
    GENERIC_CHAPTER_VERSE,
    /** No structural signal found; extraction tries every strategy in turn */
    UNKNOWN
}
