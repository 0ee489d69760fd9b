package com.scidata.dfe.node;

import com.scidata.dfe.api.ChecksumFactory;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.ReadHandle;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.Checksum;

/**
 * Helpers for reading a COMPLETE node's content.
 */
public final class NodeContents {
    static final int CHUNK_SIZE = 64 * 1024;

    private NodeContents() {
        // Utility class
    }

    /** Reads the whole content through a fresh handle. */
    public static byte[] readAll(DataNode node) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ReadHandle h = node.open()) {
            byte[] chunk;
            while ((chunk = node.read(h, CHUNK_SIZE)).length > 0)
                out.write(chunk, 0, chunk.length);
        }
        return out.toByteArray();
    }

    public static String readString(DataNode node) {
        return new String(readAll(node), StandardCharsets.UTF_8);
    }

    /**
     * Splits the content into lines, each keeping its trailing '\n'. A final line
     * without a terminator is returned as is.
     */
    public static List<String> readLines(DataNode node) {
        String text = readString(node);
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length())
            lines.add(text.substring(start));
        return lines;
    }

    /** Streams the content through a checksum in fixed-size chunks. */
    public static long checksum(DataNode node, ChecksumFactory checksums) {
        Checksum c = checksums.newChecksum();
        try (ReadHandle h = node.open()) {
            byte[] chunk;
            while ((chunk = node.read(h, CHUNK_SIZE)).length > 0)
                c.update(chunk, 0, chunk.length);
        }
        return c.getValue();
    }
}
