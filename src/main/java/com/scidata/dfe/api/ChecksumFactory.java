package com.scidata.dfe.api;

import java.util.zip.Checksum;

/**
 * Supplies the incremental algorithm behind a node's derived value.
 */
@FunctionalInterface
public interface ChecksumFactory {

    Checksum newChecksum();
}
