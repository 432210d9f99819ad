package com.treeq.cli;

import com.treeq.tree.SyntaxTree;
import com.treeq.tree.SyntaxTreeReader;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

final class TreeInput {
    private TreeInput() {
    }

    /**
     * Reads a serialized tree from {@code file}, or from stdin when it is null.
     */
    static SyntaxTree read(File file) throws IOException {
        SyntaxTreeReader reader = new SyntaxTreeReader();
        if (file == null) {
            return reader.read(System.in);
        }
        try (InputStream input = new FileInputStream(file)) {
            return reader.read(input);
        }
    }
}
