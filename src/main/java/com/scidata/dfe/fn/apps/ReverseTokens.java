package com.scidata.dfe.fn.apps;

import com.scidata.dfe.api.AppLogic;
import com.scidata.dfe.api.DataNode;
import com.scidata.dfe.api.NodeOutput;
import com.scidata.dfe.node.NodeContents;

import java.util.List;

/**
 * Reverses every token in place, keeping separators where they are.
 *
 * Tokens are delimited by single spaces and newlines, so
 * {@code "and another one\n"} becomes {@code "dna rehtona eno\n"}. A trailing
 * token without a separator is reversed and written as well.
 */
public final class ReverseTokens implements AppLogic {

    @Override
    public void run(List<DataNode> inputs, NodeOutput output) {
        for (DataNode in : inputs)
            output.write(reverse(NodeContents.readString(in)));
    }

    static String reverse(String text) {
        StringBuilder out = new StringBuilder(text.length());
        StringBuilder token = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ' || c == '\n') {
                out.append(token.reverse()).append(c);
                token.setLength(0);
            } else {
                token.append(c);
            }
        }
        return out.append(token.reverse()).toString();
    }
}
